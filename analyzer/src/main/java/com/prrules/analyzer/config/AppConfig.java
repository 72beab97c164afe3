package com.prrules.analyzer.config;

import io.github.cdimascio.dotenv.Dotenv;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Configuration read from environment variables and an optional .env file
 * using dotenv-java. Environment variables win over .env entries. Validates
 * everything on construction.
 */
public class AppConfig {

    private static final Logger logger = LoggerFactory.getLogger(AppConfig.class);

    public static final String DEFAULT_GITHUB_API_BASE_URL = "https://api.github.com";
    public static final String DEFAULT_DATABASE_PATH = "./pr-rules.db";
    public static final int DEFAULT_WORKER_COUNT = 4;
    public static final long DEFAULT_REQUEST_DELAY_MS = 100;
    public static final String DEFAULT_OPENAI_API_BASE_URL = "https://api.openai.com/v1";
    public static final String DEFAULT_OPENAI_MODEL = "gpt-4";

    private final String githubToken;
    private final String githubApiBaseUrl;
    private final String databasePath;
    private final int workerCount;
    private final long requestDelayMs;
    private final String openAiApiKey;
    private final String openAiApiBaseUrl;
    private final String openAiModel;

    public AppConfig() {
        this(environmentLookup(loadDotenv()));
    }

    /**
     * Constructor for testing: every variable is looked up in {@code values}.
     */
    public AppConfig(Map<String, String> values) {
        this(new HashMap<>(values)::get);
    }

    private AppConfig(Function<String, String> lookup) {
        List<String> problems = new ArrayList<>();

        this.githubToken = lookup.apply("GITHUB_TOKEN");
        if (isBlank(githubToken)) {
            problems.add("GITHUB_TOKEN (missing)");
        }

        this.githubApiBaseUrl = orDefault(lookup.apply("GITHUB_API_BASE_URL"), DEFAULT_GITHUB_API_BASE_URL);
        this.databasePath = orDefault(lookup.apply("DATABASE_PATH"), DEFAULT_DATABASE_PATH);
        this.workerCount = (int) parsePositive(lookup, "WORKER_COUNT", DEFAULT_WORKER_COUNT, problems);
        this.requestDelayMs = parseNonNegative(lookup, "REQUEST_DELAY_MS", DEFAULT_REQUEST_DELAY_MS, problems);
        this.openAiApiKey = blankToNull(lookup.apply("OPENAI_API_KEY"));
        this.openAiApiBaseUrl = orDefault(lookup.apply("OPENAI_API_BASE_URL"), DEFAULT_OPENAI_API_BASE_URL);
        this.openAiModel = orDefault(lookup.apply("OPENAI_MODEL"), DEFAULT_OPENAI_MODEL);

        if (!problems.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid or missing environment variables: " + String.join(", ", problems));
        }

        logger.info("Configuration loaded: databasePath={}, workerCount={}, requestDelayMs={}, ruleBackend={}",
                databasePath, workerCount, requestDelayMs, isRuleBackendEnabled() ? openAiModel : "heuristic");
    }

    private static Dotenv loadDotenv() {
        return Dotenv.configure()
                .ignoreIfMissing()
                .load();
    }

    private static Function<String, String> environmentLookup(Dotenv dotenv) {
        return key -> {
            String envValue = System.getenv(key);
            if (envValue != null && !envValue.isBlank()) {
                return envValue;
            }
            return dotenv.get(key);
        };
    }

    private static long parsePositive(Function<String, String> lookup, String key, long defaultValue,
                                      List<String> problems) {
        long value = parseNonNegative(lookup, key, defaultValue, problems);
        if (value == 0) {
            problems.add(key + " (must be positive)");
        }
        return value;
    }

    private static long parseNonNegative(Function<String, String> lookup, String key, long defaultValue,
                                         List<String> problems) {
        String raw = lookup.apply(key);
        if (isBlank(raw)) {
            return defaultValue;
        }
        try {
            long value = Long.parseLong(raw.trim());
            if (value < 0) {
                problems.add(key + " (must not be negative)");
                return defaultValue;
            }
            return value;
        } catch (NumberFormatException e) {
            problems.add(key + " (not a number: " + raw + ")");
            return defaultValue;
        }
    }

    private static String orDefault(String value, String defaultValue) {
        return isBlank(value) ? defaultValue : value.trim();
    }

    private static String blankToNull(String value) {
        return isBlank(value) ? null : value.trim();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public String getGithubToken() {
        return githubToken;
    }

    public String getGithubApiBaseUrl() {
        return githubApiBaseUrl;
    }

    public String getDatabasePath() {
        return databasePath;
    }

    public int getWorkerCount() {
        return workerCount;
    }

    public long getRequestDelayMs() {
        return requestDelayMs;
    }

    public String getOpenAiApiKey() {
        return openAiApiKey;
    }

    public String getOpenAiApiBaseUrl() {
        return openAiApiBaseUrl;
    }

    public String getOpenAiModel() {
        return openAiModel;
    }

    public boolean isRuleBackendEnabled() {
        return openAiApiKey != null;
    }
}
