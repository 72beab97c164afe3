package com.prrules.analyzer.processor;

import com.prrules.analyzer.Fixtures;
import com.prrules.analyzer.diff.DiffSnippetExtractor;
import com.prrules.analyzer.diff.SnippetCandidate;
import com.prrules.analyzer.model.ReviewComment;
import com.prrules.analyzer.rules.RuleExtractionEngine;
import com.prrules.analyzer.store.EntityCounts;
import com.prrules.analyzer.store.RuleStatistics;
import com.prrules.analyzer.store.StoreHandle;
import com.prrules.analyzer.store.StoreSession;
import com.prrules.analyzer.store.StoredRule;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Drives the worker pool against a real SQLite store with heuristic rule extraction.
 */
class TaskQueueProcessorTest {

    private static final String HUNK = "@@ -8,2 +10,3 @@\n+def handler(data):\n+    return run(data)\n+";

    @TempDir
    Path tempDir;

    private StoreHandle store;
    private TaskQueueProcessor processor;
    private long repositoryId;
    private long pullRequestId;

    @BeforeEach
    void setUp() {
        store = new StoreHandle(tempDir.resolve("analyzer.db"));
        try (StoreSession session = store.openSession()) {
            repositoryId = session.upsertRepository(Fixtures.repository(1, "octo", "repo"));
            pullRequestId = session.upsertPullRequest(repositoryId, Fixtures.closedPullRequest(10, 1));
        }
        processor = new TaskQueueProcessor(store, new RuleExtractionEngine(), 2);
    }

    @AfterEach
    void tearDown() {
        processor.stopWorkers();
        store.close();
    }

    // =========================================================================
    // Task chain
    // =========================================================================

    @Test
    @DisplayName("A comment batch fans out to snippets, thread, rule and statistics")
    void processBatch_runsWholeChain() throws Exception {
        processor.startWorkers();

        BatchResult result = processor.processBatch(TaskKind.NORMALIZE_COMMENT,
                List.of(commentTask(Fixtures.reviewComment(100,
                        "You should always validate user input.", "src/handler.py", 3, HUNK))));

        assertEquals(1, result.total());
        assertEquals(1, result.success());
        assertEquals(0, result.errors());
        assertTrue(result.durationMs() >= 0);

        try (StoreSession session = store.openSession()) {
            EntityCounts counts = session.countEntities();
            assertEquals(1, counts.reviewComments());
            assertEquals(1, counts.codeSnippets());
            assertEquals(1, counts.commentThreads());
            assertEquals(1, counts.extractedRules());
            assertEquals(1, counts.ruleStatistics());

            long commentRow = session.findReviewComment(100).orElseThrow().id();
            StoredRule rule = session.findExtractedRule(commentRow).orElseThrow();
            assertEquals("Should always validate user input.", rule.ruleText());
            assertEquals(0.7, rule.confidence());

            RuleStatistics stats = session.findRuleStatistics(rule.id(), repositoryId).orElseThrow();
            assertEquals(1, stats.occurrenceCount());
            assertEquals(0.7, stats.avgConfidence(), 1e-9);
        }

        ProcessingStats stats = processor.getProcessingStats();
        assertEquals(5, stats.processed());
        assertEquals(0, stats.errors());
        assertEquals(0, stats.queueSize());
    }

    @Test
    @DisplayName("Comments without a rule stop after normalization")
    void processBatch_noRule() throws Exception {
        processor.startWorkers();

        processor.processBatch(TaskKind.NORMALIZE_COMMENT,
                List.of(commentTask(Fixtures.reviewComment(100, "Nice work, LGTM!", "a.py", 2, null))));

        try (StoreSession session = store.openSession()) {
            EntityCounts counts = session.countEntities();
            assertEquals(1, counts.reviewComments());
            assertEquals(1, counts.commentThreads());
            assertEquals(0, counts.extractedRules());
            assertEquals(0, counts.ruleStatistics());
        }
    }

    @Test
    @DisplayName("Comments sharing path and position end up in one thread")
    void processBatch_sharedThread() throws Exception {
        processor.startWorkers();

        processor.processBatch(TaskKind.NORMALIZE_COMMENT, List.of(
                commentTask(Fixtures.reviewComment(100, "Avoid global state", "a.py", 2, null)),
                commentTask(Fixtures.reviewComment(101, "Agreed, avoid it", "a.py", 2, null)),
                commentTask(Fixtures.reviewComment(102, "Avoid this too", "a.py", 9, null))));

        try (StoreSession session = store.openSession()) {
            assertEquals(3, session.countEntities().reviewComments());
            assertEquals(2, session.countEntities().commentThreads());
        }
    }

    // =========================================================================
    // Validation failures
    // =========================================================================

    @Test
    @DisplayName("Invalid payloads are dropped and counted as errors")
    void processBatch_invalidComment() throws Exception {
        processor.startWorkers();

        BatchResult result = processor.processBatch(TaskKind.NORMALIZE_COMMENT, List.of(
                commentTask(Fixtures.issueComment(200, "Thanks for the PR")),
                commentTask(Fixtures.reviewComment(201, "Avoid global state", "a.py", 2, null))));

        assertEquals(2, result.total());
        assertEquals(1, result.success());
        assertEquals(1, result.errors());
        assertTrue(processor.getProcessingStats().errors() >= 1);

        try (StoreSession session = store.openSession()) {
            assertTrue(session.findReviewComment(200).isEmpty());
            assertTrue(session.findReviewComment(201).isPresent());
        }
    }

    @Test
    @DisplayName("Failed tasks record their state and cause")
    void submit_failedTaskState() throws Exception {
        processor.startWorkers();

        QueuedTask orphan = processor.submit(new NormalizeSnippetTask(999,
                new SnippetCandidate("a.py", 1, 2, "x\ny", "python")));
        QueuedTask reversed = processor.submit(new NormalizeSnippetTask(999,
                new SnippetCandidate("a.py", 5, 2, "x", "python")));
        QueuedTask badConfidence = processor.submit(new UpdateStatisticsTask(1, repositoryId, 1.5));
        processor.awaitIdle();

        for (QueuedTask task : List.of(orphan, reversed, badConfidence)) {
            assertEquals(TaskState.FAILED, task.state());
            assertInstanceOf(TaskValidationException.class, task.failure());
        }
        assertEquals(TaskKind.UPDATE_STATISTICS, ((TaskValidationException) badConfidence.failure()).getKind());
    }

    @Test
    @DisplayName("Successful tasks end committed")
    void submit_committedState() throws Exception {
        processor.startWorkers();

        QueuedTask task = processor.submit(commentTask(Fixtures.reviewComment(100, "Fine", "a.py", 2, null)));
        processor.awaitIdle();

        assertEquals(TaskState.COMMITTED, task.state());
        assertTrue(task.state().isTerminal());
        assertNull(task.failure());
    }

    // =========================================================================
    // Lifecycle and argument checks
    // =========================================================================

    @Test
    @DisplayName("processBatch requires running workers")
    void processBatch_notRunning() {
        assertThrows(IllegalStateException.class,
                () -> processor.processBatch(TaskKind.NORMALIZE_COMMENT, List.of()));
    }

    @Test
    @DisplayName("processBatch rejects items of another kind")
    void processBatch_kindMismatch() {
        processor.startWorkers();

        assertThrows(IllegalArgumentException.class, () -> processor.processBatch(TaskKind.NORMALIZE_THREAD,
                List.of(new UpdateStatisticsTask(1, 1, 0.5))));
    }

    @Test
    @DisplayName("awaitIdle fails fast when work is queued but nothing runs")
    void awaitIdle_withoutWorkers() {
        QueuedTask queued = processor.submit(new UpdateStatisticsTask(1, repositoryId, 0.5));

        assertEquals(TaskState.QUEUED, queued.state());
        assertThrows(IllegalStateException.class, () -> processor.awaitIdle());
    }

    @Test
    @DisplayName("Start and stop are idempotent and stop leaves no live workers")
    void lifecycle() {
        processor.startWorkers();
        processor.startWorkers();
        assertTrue(processor.isRunning());

        processor.stopWorkers();
        processor.stopWorkers();

        ProcessingStats stats = processor.getProcessingStats();
        assertFalse(stats.running());
        assertEquals(0, stats.workerCount());
        assertEquals(0, stats.queueSize());
    }

    @Test
    @DisplayName("Stopped workers leave later submissions queued")
    void stopWorkers_nothingDequeuedAfterwards() throws Exception {
        processor.startWorkers();
        processor.submit(new UpdateStatisticsTask(1, repositoryId, 0.5));
        processor.awaitIdle();
        long processedBefore = processor.getProcessingStats().processed();

        processor.stopWorkers();
        QueuedTask late = processor.submit(new UpdateStatisticsTask(2, repositoryId, 0.5));
        Thread.sleep(TaskQueueProcessor.POLL_TIMEOUT_MS + 250);

        ProcessingStats stats = processor.getProcessingStats();
        assertEquals(TaskState.QUEUED, late.state());
        assertEquals(processedBefore, stats.processed());
        assertEquals(0, stats.workerCount());
        assertEquals(1, stats.queueSize());
    }

    @Test
    @DisplayName("awaitIdle fails instead of hanging when every worker has died")
    void awaitIdle_allWorkersDead() {
        // workers cannot open a session on a closed store
        store.close();
        processor.startWorkers();
        QueuedTask queued = processor.submit(new UpdateStatisticsTask(1, repositoryId, 0.5));

        IllegalStateException ex = assertTimeoutPreemptively(Duration.ofSeconds(5),
                () -> assertThrows(IllegalStateException.class, () -> processor.awaitIdle()));

        assertTrue(ex.getMessage().contains("died"));
        assertEquals(TaskState.QUEUED, queued.state());
        assertTrue(processor.getProcessingStats().running());
    }

    @Test
    @DisplayName("Rejects a non-positive worker count")
    void constructor_rejectsZeroWorkers() {
        assertThrows(IllegalArgumentException.class,
                () -> new TaskQueueProcessor(store, new RuleExtractionEngine(), 0));
    }

    private NormalizeCommentTask commentTask(ReviewComment comment) {
        List<SnippetCandidate> snippets = new DiffSnippetExtractor().extract(comment.diffHunk(), comment.path());
        return new NormalizeCommentTask(pullRequestId, repositoryId, "octo/repo", "Change #1", comment, snippets);
    }
}
