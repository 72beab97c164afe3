package com.prrules.analyzer.orchestrator;

import com.prrules.analyzer.client.GitHubApiClient;
import com.prrules.analyzer.config.AppConfig;
import com.prrules.analyzer.processor.TaskQueueProcessor;
import com.prrules.analyzer.rules.OpenAiRuleBackend;
import com.prrules.analyzer.rules.RuleBackend;
import com.prrules.analyzer.rules.RuleExtractionEngine;
import com.prrules.analyzer.store.CleanupResult;
import com.prrules.analyzer.store.EntityCounts;
import com.prrules.analyzer.store.StoreHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Main entry point of the PR rules analyzer. Parses CLI arguments, wires the
 * components, runs the requested command and exits with a status code.
 *
 * <p>Usage:
 * <pre>
 *   java -jar analyzer.jar owner/repo [owner/repo ...]   # collect and extract rules
 *   java -jar analyzer.jar --status                      # stored counts and rate limit
 *   java -jar analyzer.jar --cleanup 30                  # delete data older than 30 days
 * </pre>
 */
public class AnalyzerApp {

    private static final Logger logger = LoggerFactory.getLogger(AnalyzerApp.class);

    public static void main(String[] args) {
        Command command;
        try {
            command = parseArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            printUsage();
            System.exit(1);
            return;
        }

        logger.info("Starting PR rules analyzer ({})", command.mode());
        int exitCode;
        try {
            exitCode = run(command, new AppConfig());
        } catch (Exception e) {
            logger.error("Fatal error", e);
            exitCode = 1;
        }
        System.exit(exitCode);
    }

    static int run(Command command, AppConfig config) {
        GitHubApiClient client = new GitHubApiClient(
                config.getGithubToken(), config.getGithubApiBaseUrl(), config.getRequestDelayMs());
        RuleBackend backend = config.isRuleBackendEnabled()
                ? new OpenAiRuleBackend(config.getOpenAiApiKey(), config.getOpenAiApiBaseUrl(), config.getOpenAiModel())
                : null;

        try (StoreHandle store = new StoreHandle(Path.of(config.getDatabasePath()))) {
            TaskQueueProcessor processor = new TaskQueueProcessor(
                    store, new RuleExtractionEngine(backend), config.getWorkerCount());
            CollectionOrchestrator orchestrator = new CollectionOrchestrator(client, store, processor);

            try {
                switch (command.mode()) {
                    case STATUS -> {
                        printStatus(orchestrator.getCollectionStatus());
                        return 0;
                    }
                    case CLEANUP -> {
                        printCleanup(orchestrator.cleanupOldData(command.cleanupDays()));
                        return 0;
                    }
                    default -> {
                        processor.startWorkers();
                        boolean anyErrors = false;
                        for (String repository : command.repositories()) {
                            String[] parts = repository.split("/", 2);
                            RunResult result = orchestrator.collectRepositoryData(parts[0], parts[1]);
                            printRunResult(result);
                            anyErrors |= result.hasErrors();
                        }
                        return anyErrors ? 1 : 0;
                    }
                }
            } finally {
                processor.stopWorkers();
            }
        }
    }

    static Command parseArgs(String[] args) {
        if (args.length == 0) {
            throw new IllegalArgumentException("No command given");
        }
        if ("--status".equals(args[0])) {
            return new Command(Mode.STATUS, List.of(), 0);
        }
        if ("--cleanup".equals(args[0])) {
            if (args.length < 2) {
                throw new IllegalArgumentException("--cleanup needs a number of days");
            }
            try {
                int days = Integer.parseInt(args[1]);
                if (days < 0) {
                    throw new IllegalArgumentException("--cleanup days must not be negative");
                }
                return new Command(Mode.CLEANUP, List.of(), days);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("--cleanup days is not a number: " + args[1]);
            }
        }

        List<String> repositories = new ArrayList<>();
        for (String arg : args) {
            int slash = arg.indexOf('/');
            if (slash <= 0 || slash == arg.length() - 1 || arg.indexOf('/', slash + 1) >= 0) {
                throw new IllegalArgumentException("Expected owner/repo but got: " + arg);
            }
            repositories.add(arg);
        }
        return new Command(Mode.COLLECT, repositories, 0);
    }

    private static void printUsage() {
        System.err.println("Usage:");
        System.err.println("  analyzer owner/repo [owner/repo ...]");
        System.err.println("  analyzer --status");
        System.err.println("  analyzer --cleanup <days>");
    }

    private static void printRunResult(RunResult result) {
        System.out.println();
        System.out.println("=== Collection Summary: " + result.repositoryFullName() + " ===");
        System.out.println("Outcome:  " + result.outcome());
        System.out.println("Duration: " + result.durationMs() + "ms");
        System.out.printf("  %-14s %d%n", "pull requests", result.pullRequests());
        System.out.printf("  %-14s %d%n", "comments", result.comments());
        System.out.printf("  %-14s %d%n", "snippets", result.snippets());
        System.out.printf("  %-14s %d%n", "threads", result.threads());
        System.out.printf("  %-14s %d%n", "task errors", result.taskErrors());

        if (result.hasErrors()) {
            System.out.println();
            System.out.println("Errors:");
            result.errors().forEach(error -> System.out.println("  - " + error));
        }
        System.out.println();
    }

    private static void printStatus(CollectionStatus status) {
        EntityCounts counts = status.counts();
        System.out.println();
        System.out.println("=== Collection Status ===");
        System.out.printf("  %-16s %d%n", "repositories", counts.repositories());
        System.out.printf("  %-16s %d%n", "pull requests", counts.pullRequests());
        System.out.printf("  %-16s %d%n", "review comments", counts.reviewComments());
        System.out.printf("  %-16s %d%n", "code snippets", counts.codeSnippets());
        System.out.printf("  %-16s %d%n", "comment threads", counts.commentThreads());
        System.out.printf("  %-16s %d%n", "extracted rules", counts.extractedRules());
        System.out.printf("  %-16s %d%n", "rule statistics", counts.ruleStatistics());
        if (status.rateLimit() != null && status.rateLimit().core() != null) {
            System.out.println("Rate limit: " + status.rateLimit().core().remaining()
                    + "/" + status.rateLimit().core().limit() + " remaining");
        } else {
            System.out.println("Rate limit: unavailable");
        }
        System.out.println();
    }

    private static void printCleanup(CleanupResult result) {
        System.out.println();
        System.out.println("=== Cleanup (before " + result.cutoff() + ") ===");
        System.out.printf("  %-16s %d%n", "code snippets", result.codeSnippets());
        System.out.printf("  %-16s %d%n", "comment threads", result.commentThreads());
        System.out.printf("  %-16s %d%n", "review comments", result.reviewComments());
        System.out.printf("  %-16s %d%n", "pull requests", result.pullRequests());
        System.out.printf("  %-16s %d%n", "repositories", result.repositories());
        System.out.println();
    }

    enum Mode {
        COLLECT,
        STATUS,
        CLEANUP
    }

    record Command(Mode mode, List<String> repositories, int cleanupDays) {}
}
