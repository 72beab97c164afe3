package com.prrules.analyzer.orchestrator;

import com.prrules.analyzer.client.GitHubApiClient;
import com.prrules.analyzer.diff.DiffSnippetExtractor;
import com.prrules.analyzer.diff.SnippetCandidate;
import com.prrules.analyzer.model.PullRequest;
import com.prrules.analyzer.model.RateLimitStatus;
import com.prrules.analyzer.model.Repository;
import com.prrules.analyzer.model.ReviewComment;
import com.prrules.analyzer.processor.NormalizeCommentTask;
import com.prrules.analyzer.processor.TaskQueueProcessor;
import com.prrules.analyzer.store.CleanupResult;
import com.prrules.analyzer.store.EntityCounts;
import com.prrules.analyzer.store.StoreHandle;
import com.prrules.analyzer.store.StoreSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Drives one repository sync: access check, repository and pull request upserts on
 * the calling thread, then one {@link NormalizeCommentTask} per fetched comment for
 * the {@link TaskQueueProcessor}. The run waits for the queue to drain before it
 * reports.
 *
 * <p>Pull request failures are recorded and skipped. Only a failed access check
 * ends a run before anything is written.</p>
 */
public class CollectionOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(CollectionOrchestrator.class);

    private final GitHubApiClient client;
    private final StoreHandle store;
    private final TaskQueueProcessor processor;
    private final DiffSnippetExtractor snippetExtractor;
    private final Clock clock;

    private volatile RunState state = RunState.IDLE;

    public CollectionOrchestrator(GitHubApiClient client, StoreHandle store, TaskQueueProcessor processor) {
        this(client, store, processor, new DiffSnippetExtractor(), Clock.systemUTC());
    }

    // Visible for testing
    CollectionOrchestrator(GitHubApiClient client, StoreHandle store, TaskQueueProcessor processor,
                           DiffSnippetExtractor snippetExtractor, Clock clock) {
        this.client = client;
        this.store = store;
        this.processor = processor;
        this.snippetExtractor = snippetExtractor;
        this.clock = clock;
    }

    public RunState currentState() {
        return state;
    }

    /**
     * Collects all closed pull requests of {@code owner/repo} and their comments.
     * Never throws for collection problems; they end up in {@link RunResult#errors()}.
     */
    public RunResult collectRepositoryData(String owner, String repo) {
        String fullName = owner + "/" + repo;
        Instant start = clock.instant();
        List<String> errors = new ArrayList<>();
        Tally tally = new Tally();
        logger.info("Starting collection for {}", fullName);

        state = RunState.VALIDATING_ACCESS;
        try {
            if (!client.validateRepositoryAccess(owner, repo)) {
                errors.add("Cannot access repository " + fullName);
                state = RunState.DONE;
                logger.error("Cannot access repository {}", fullName);
                return tally.toResult(fullName, RunOutcome.ACCESS_DENIED, errors, start, clock.instant());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            errors.add("Interrupted while validating access to " + fullName);
            state = RunState.DONE;
            return tally.toResult(fullName, RunOutcome.FAILED, errors, start, clock.instant());
        }

        state = RunState.SYNCING;
        RunOutcome outcome = RunOutcome.COMPLETED;
        if (!processor.isRunning()) {
            processor.startWorkers();
        }
        long taskErrorsBefore = processor.getProcessingStats().errors();

        try (StoreSession session = store.openSession()) {
            Repository repository = client.getRepository(owner, repo);
            long repositoryId = session.upsertRepository(repository);

            List<PullRequest> pullRequests = client.getClosedPullRequests(owner, repo);
            logger.info("Found {} closed pull requests in {}", pullRequests.size(), fullName);

            for (PullRequest pr : pullRequests) {
                try {
                    collectPullRequest(session, repositoryId, owner, repo, pr, tally);
                } catch (IOException | RuntimeException e) {
                    logger.error("Error collecting PR #{} of {}", pr.number(), fullName, e);
                    errors.add("Error collecting PR #" + pr.number() + ": " + e.getMessage());
                }
            }
        } catch (IOException | RuntimeException e) {
            logger.error("Error collecting repository data for {}", fullName, e);
            errors.add("Error collecting repository data: " + e.getMessage());
            outcome = RunOutcome.FAILED;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            errors.add("Error collecting repository data: interrupted");
            outcome = RunOutcome.FAILED;
        }

        state = RunState.AGGREGATING;
        try {
            processor.awaitIdle();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            errors.add("Interrupted while waiting for task processing");
        } catch (IllegalStateException e) {
            logger.error("Task processing for {} did not finish: {}", fullName, e.getMessage());
            errors.add("Task processing did not finish: " + e.getMessage());
            outcome = RunOutcome.FAILED;
        }

        tally.taskErrors = processor.getProcessingStats().errors() - taskErrorsBefore;
        if (tally.taskErrors > 0) {
            errors.add(tally.taskErrors + " queued tasks failed");
        }

        state = RunState.DONE;
        RunResult result = tally.toResult(fullName, outcome, errors, start, clock.instant());
        logResult(result);
        return result;
    }

    private void collectPullRequest(StoreSession session, long repositoryId, String owner, String repo,
                                    PullRequest pr, Tally tally) throws IOException, InterruptedException {
        long pullRequestId = session.upsertPullRequest(repositoryId, pr);
        List<ReviewComment> comments = client.getAllComments(owner, repo, pr.number());

        for (ReviewComment comment : comments) {
            List<SnippetCandidate> snippets = snippetExtractor.extract(comment.diffHunk(), comment.path());
            processor.submit(new NormalizeCommentTask(pullRequestId, repositoryId, owner + "/" + repo,
                    pr.title(), comment, snippets));

            tally.comments++;
            tally.snippets += snippets.size();
            if (comment.path() != null && comment.position() != null) {
                tally.threads++;
            }
        }
        tally.pullRequests++;
        logger.debug("Queued {} comments of PR #{}", comments.size(), pr.number());
    }

    /**
     * Entity counts, processor counters and GitHub's view of the quota. A failing
     * rate limit call is logged and leaves {@code rateLimit} null.
     */
    public CollectionStatus getCollectionStatus() {
        EntityCounts counts;
        try (StoreSession session = store.openSession()) {
            counts = session.countEntities();
        }

        RateLimitStatus rateLimit = null;
        try {
            rateLimit = client.getRateLimitStatus();
        } catch (IOException e) {
            logger.warn("Could not fetch rate limit status: {}", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while fetching rate limit status");
        }

        return new CollectionStatus(counts, processor.getProcessingStats(), rateLimit);
    }

    /**
     * Deletes stored rows created more than {@code days} days ago.
     */
    public CleanupResult cleanupOldData(int days) {
        if (days < 0) {
            throw new IllegalArgumentException("days must not be negative: " + days);
        }
        Instant cutoff = clock.instant().minus(Duration.ofDays(days));
        try (StoreSession session = store.openSession()) {
            CleanupResult result = session.deleteOlderThan(cutoff);
            logger.info("Cleaned up {} rows created before {}", result.total(), cutoff);
            return result;
        }
    }

    private void logResult(RunResult result) {
        logger.info("=== Collection Summary: {} ===", result.repositoryFullName());
        logger.info("Outcome: {} in {}ms", result.outcome(), result.durationMs());
        logger.info("  pull requests={}, comments={}, snippets={}, threads={}, task errors={}",
                result.pullRequests(), result.comments(), result.snippets(), result.threads(),
                result.taskErrors());
        if (result.hasErrors()) {
            logger.warn("Collection finished with {} errors", result.errors().size());
            result.errors().forEach(error -> logger.warn("  FAILED: {}", error));
        }
    }

    private static final class Tally {
        int pullRequests;
        int comments;
        int snippets;
        int threads;
        long taskErrors;

        RunResult toResult(String fullName, RunOutcome outcome, List<String> errors, Instant start, Instant end) {
            return new RunResult(fullName, outcome, pullRequests, comments, snippets, threads, taskErrors,
                    errors, start, end);
        }
    }
}
