package com.prrules.analyzer.orchestrator;

import java.time.Instant;
import java.util.List;

/**
 * Result of collecting one repository. Counts cover what was fetched and queued;
 * {@code taskErrors} is the number of queued tasks that failed during the run.
 * Errors are human-readable, one per failed step, plus one summary line when
 * {@code taskErrors} is non-zero.
 */
public record RunResult(
        String repositoryFullName,
        RunOutcome outcome,
        int pullRequests,
        int comments,
        int snippets,
        int threads,
        long taskErrors,
        List<String> errors,
        Instant start,
        Instant end
) {

    public RunResult {
        errors = List.copyOf(errors);
    }

    public long durationMs() {
        return end.toEpochMilli() - start.toEpochMilli();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
