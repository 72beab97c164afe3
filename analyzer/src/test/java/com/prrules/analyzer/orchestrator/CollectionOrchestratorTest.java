package com.prrules.analyzer.orchestrator;

import com.prrules.analyzer.Fixtures;
import com.prrules.analyzer.client.GitHubApiClient;
import com.prrules.analyzer.client.RequestFailedException;
import com.prrules.analyzer.diff.DiffSnippetExtractor;
import com.prrules.analyzer.model.PullRequest;
import com.prrules.analyzer.model.RateLimitStatus;
import com.prrules.analyzer.processor.TaskQueueProcessor;
import com.prrules.analyzer.rules.RuleExtractionEngine;
import com.prrules.analyzer.store.CleanupResult;
import com.prrules.analyzer.store.EntityCounts;
import com.prrules.analyzer.store.StoreHandle;
import com.prrules.analyzer.store.StoreSession;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * End-to-end test for a collection run. Mocks the GitHub API client and runs the
 * real task processor against a temporary SQLite database.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class CollectionOrchestratorTest {

    private static final String HUNK = "@@ -1,2 +4,2 @@\n+x = compute()\n+return x";

    @Mock
    private GitHubApiClient gitHubClient;

    @TempDir
    Path tempDir;

    private StoreHandle store;
    private TaskQueueProcessor processor;
    private CollectionOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        store = new StoreHandle(tempDir.resolve("analyzer.db"));
        processor = new TaskQueueProcessor(store, new RuleExtractionEngine(), 2);
        orchestrator = new CollectionOrchestrator(gitHubClient, store, processor);
    }

    @AfterEach
    void tearDown() {
        processor.stopWorkers();
        store.close();
    }

    // =========================================================================
    // Repository collection
    // =========================================================================

    @Test
    @DisplayName("Collects pull requests and comments, skipping a failing pull request")
    void collect_endToEnd() throws Exception {
        stubRepository();
        PullRequest pr1 = Fixtures.closedPullRequest(10, 1);
        PullRequest pr2 = Fixtures.closedPullRequest(20, 2);
        when(gitHubClient.getClosedPullRequests("octo", "repo")).thenReturn(List.of(pr1, pr2));
        when(gitHubClient.getAllComments("octo", "repo", 1)).thenReturn(List.of(
                Fixtures.reviewComment(100, "You should always validate user input.", "src/app.py", 4, HUNK),
                Fixtures.issueComment(101, "Thanks!")));
        when(gitHubClient.getAllComments("octo", "repo", 2))
                .thenThrow(new RequestFailedException("/repos/octo/repo/pulls/2/comments", 502, "Bad Gateway"));

        assertEquals(RunState.IDLE, orchestrator.currentState());

        RunResult result = orchestrator.collectRepositoryData("octo", "repo");

        assertEquals(RunOutcome.COMPLETED, result.outcome());
        assertEquals("octo/repo", result.repositoryFullName());
        assertEquals(1, result.pullRequests());
        assertEquals(2, result.comments());
        assertEquals(1, result.snippets());
        assertEquals(1, result.threads());
        // the issue comment fails validation in the processor
        assertEquals(1, result.taskErrors());
        assertEquals(2, result.errors().size());
        assertTrue(result.errors().get(0).contains("PR #2"));
        assertEquals("1 queued tasks failed", result.errors().get(1));
        assertEquals(RunState.DONE, orchestrator.currentState());

        EntityCounts counts = countEntities();
        assertEquals(1, counts.repositories());
        assertEquals(2, counts.pullRequests());
        assertEquals(1, counts.reviewComments());
        assertEquals(1, counts.codeSnippets());
        assertEquals(1, counts.commentThreads());
        assertEquals(1, counts.extractedRules());
        assertEquals(1, counts.ruleStatistics());
        assertEquals(1, processor.getProcessingStats().errors());
    }

    @Test
    @DisplayName("Failed queued tasks are reported as run errors")
    void collect_reportsTaskErrors() throws Exception {
        stubRepository();
        when(gitHubClient.getClosedPullRequests("octo", "repo")).thenReturn(List.of(Fixtures.closedPullRequest(10, 1)));
        when(gitHubClient.getAllComments("octo", "repo", 1)).thenReturn(List.of(
                Fixtures.issueComment(200, "Thanks for the fix!"),
                Fixtures.issueComment(201, "LGTM")));

        RunResult first = orchestrator.collectRepositoryData("octo", "repo");

        assertEquals(RunOutcome.COMPLETED, first.outcome());
        assertEquals(2, first.comments());
        assertEquals(2, first.taskErrors());
        assertTrue(first.hasErrors());
        assertEquals(List.of("2 queued tasks failed"), first.errors());

        // counted per run, not cumulatively
        RunResult second = orchestrator.collectRepositoryData("octo", "repo");
        assertEquals(2, second.taskErrors());
        assertEquals(4, processor.getProcessingStats().errors());
    }

    @Test
    @DisplayName("A run fails instead of hanging when the task workers die")
    void collect_workersDie() throws Exception {
        stubRepository();
        StoreHandle closedStore = new StoreHandle(tempDir.resolve("closed.db"));
        closedStore.close();
        TaskQueueProcessor deadProcessor = new TaskQueueProcessor(closedStore, new RuleExtractionEngine(), 2);
        CollectionOrchestrator broken = new CollectionOrchestrator(gitHubClient, store, deadProcessor);
        when(gitHubClient.getClosedPullRequests("octo", "repo")).thenReturn(List.of(Fixtures.closedPullRequest(10, 1)));
        when(gitHubClient.getAllComments("octo", "repo", 1)).thenReturn(List.of(
                Fixtures.reviewComment(100, "Avoid mutable globals", "a.py", 2, HUNK)));

        try {
            RunResult result = assertTimeoutPreemptively(Duration.ofSeconds(10),
                    () -> broken.collectRepositoryData("octo", "repo"));

            assertEquals(RunOutcome.FAILED, result.outcome());
            assertTrue(result.errors().stream().anyMatch(e -> e.contains("did not finish")));
            assertEquals(RunState.DONE, broken.currentState());
        } finally {
            deadProcessor.stopWorkers();
        }
    }

    @Test
    @DisplayName("Running the same sync twice leaves entity counts unchanged")
    void collect_isIdempotent() throws Exception {
        stubRepository();
        when(gitHubClient.getClosedPullRequests("octo", "repo")).thenReturn(List.of(Fixtures.closedPullRequest(10, 1)));
        when(gitHubClient.getAllComments("octo", "repo", 1)).thenReturn(List.of(
                Fixtures.reviewComment(100, "Avoid mutable globals", "a.py", 2, HUNK),
                Fixtures.reviewComment(101, "Agreed, avoid them", "a.py", 2, null)));

        orchestrator.collectRepositoryData("octo", "repo");
        EntityCounts first = countEntities();
        orchestrator.collectRepositoryData("octo", "repo");
        EntityCounts second = countEntities();

        assertEquals(first, second);
        assertEquals(2, second.reviewComments());
        assertEquals(1, second.commentThreads());
    }

    @Test
    @DisplayName("Stops before writing anything when the repository is not accessible")
    void collect_accessDenied() throws Exception {
        when(gitHubClient.validateRepositoryAccess("octo", "secret")).thenReturn(false);

        RunResult result = orchestrator.collectRepositoryData("octo", "secret");

        assertEquals(RunOutcome.ACCESS_DENIED, result.outcome());
        assertEquals(1, result.errors().size());
        assertEquals(0, result.pullRequests());
        verify(gitHubClient, never()).getRepository(anyString(), anyString());
        verify(gitHubClient, never()).getClosedPullRequests(anyString(), anyString());
        assertFalse(processor.isRunning());
        assertEquals(new EntityCounts(0, 0, 0, 0, 0, 0, 0), countEntities());
    }

    @Test
    @DisplayName("A failing pull request listing fails the run")
    void collect_listingFails() throws Exception {
        stubRepository();
        when(gitHubClient.getClosedPullRequests("octo", "repo"))
                .thenThrow(new IOException("connection reset"));

        RunResult result = orchestrator.collectRepositoryData("octo", "repo");

        assertEquals(RunOutcome.FAILED, result.outcome());
        assertTrue(result.hasErrors());
        assertEquals(1, countEntities().repositories());
    }

    // =========================================================================
    // Status and cleanup
    // =========================================================================

    @Test
    @DisplayName("Status reports counts, processor stats and the rate limit")
    void status_withRateLimit() throws Exception {
        RateLimitStatus.Rate core = new RateLimitStatus.Rate(5000, 4990, 1700003600L, 10);
        when(gitHubClient.getRateLimitStatus())
                .thenReturn(new RateLimitStatus(new RateLimitStatus.Resources(core), core));

        CollectionStatus status = orchestrator.getCollectionStatus();

        assertEquals(0, status.counts().repositories());
        assertFalse(status.processing().running());
        assertEquals(4990, status.rateLimit().core().remaining());
    }

    @Test
    @DisplayName("Status leaves the rate limit empty when GitHub cannot be reached")
    void status_rateLimitFails() throws Exception {
        when(gitHubClient.getRateLimitStatus()).thenThrow(new IOException("offline"));

        CollectionStatus status = orchestrator.getCollectionStatus();

        assertNull(status.rateLimit());
        assertNotNull(status.counts());
    }

    @Test
    @DisplayName("Cleanup removes data older than the retention window")
    void cleanup_removesOldData() throws Exception {
        stubRepository();
        when(gitHubClient.getClosedPullRequests("octo", "repo")).thenReturn(List.of(Fixtures.closedPullRequest(10, 1)));
        when(gitHubClient.getAllComments("octo", "repo", 1)).thenReturn(List.of());
        orchestrator.collectRepositoryData("octo", "repo");

        Clock later = Clock.fixed(Instant.now().plus(Duration.ofDays(40)), ZoneOffset.UTC);
        CollectionOrchestrator future = new CollectionOrchestrator(gitHubClient, store, processor,
                new DiffSnippetExtractor(), later);

        assertEquals(0, future.cleanupOldData(60).total());
        CleanupResult result = future.cleanupOldData(30);

        assertEquals(1, result.repositories());
        assertEquals(1, result.pullRequests());
        assertEquals(0, countEntities().repositories());
    }

    @Test
    @DisplayName("Cleanup rejects a negative retention")
    void cleanup_negativeDays() {
        assertThrows(IllegalArgumentException.class, () -> orchestrator.cleanupOldData(-1));
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private void stubRepository() throws Exception {
        when(gitHubClient.validateRepositoryAccess("octo", "repo")).thenReturn(true);
        when(gitHubClient.getRepository("octo", "repo")).thenReturn(Fixtures.repository(1, "octo", "repo"));
    }

    private EntityCounts countEntities() {
        try (StoreSession session = store.openSession()) {
            return session.countEntities();
        }
    }
}
