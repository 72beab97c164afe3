package com.prrules.analyzer.store;

import java.time.Instant;

/**
 * Rows removed by a retention cleanup, per table. Counts cover the rows the
 * age filter matched directly; cascaded child rows are not included.
 */
public record CleanupResult(
        Instant cutoff,
        int codeSnippets,
        int commentThreads,
        int reviewComments,
        int pullRequests,
        int repositories
) {

    public int total() {
        return codeSnippets + commentThreads + reviewComments + pullRequests + repositories;
    }
}
