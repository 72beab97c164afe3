package com.prrules.analyzer.client;

import com.prrules.analyzer.model.PullRequest;
import com.prrules.analyzer.model.RateLimitStatus;
import com.prrules.analyzer.model.Repository;
import com.prrules.analyzer.model.ReviewComment;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * GitHub REST API client with page-number pagination and client-side rate limiting.
 *
 * <p>Before every request the client waits out an exhausted quota window (as
 * reported by {@code X-RateLimit-Remaining} / {@code X-RateLimit-Reset}) and
 * enforces a minimum delay since the previous request completed. A 403 that
 * GitHub marks as a rate-limit rejection is retried exactly once; every other
 * non-2xx status surfaces as a {@link RequestFailedException}.</p>
 *
 * <p>Thread-safe: request execution is serialized on the client instance so that
 * the tracked quota and the last-request timestamp stay consistent.</p>
 */
public class GitHubApiClient {

    private static final Logger logger = LoggerFactory.getLogger(GitHubApiClient.class);

    public static final String DEFAULT_BASE_URL = "https://api.github.com";
    public static final long DEFAULT_REQUEST_DELAY_MS = 100;

    static final int PER_PAGE = 100;
    static final long FALLBACK_RATE_LIMIT_WAIT_MS = 60_000;
    static final long RESET_BUFFER_MS = 1_000;

    private static final String USER_AGENT = "pr-rules-analyzer/1.0";

    private static final TypeReference<List<PullRequest>> PULL_REQUEST_LIST = new TypeReference<>() {};
    private static final TypeReference<List<ReviewComment>> COMMENT_LIST = new TypeReference<>() {};

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String token;
    private final HttpUrl baseUrl;
    private final long requestDelayMs;
    private final Clock clock;
    private final Sleeper sleeper;

    // Serializes requests and waits; never held together with the monitor below
    private final ReentrantLock requestLock = new ReentrantLock();

    // Guarded by this
    private Integer rateLimitRemaining;
    private Long rateLimitResetEpochSeconds;
    private long lastRequestCompletedMillis;

    public GitHubApiClient(String token) {
        this(token, DEFAULT_BASE_URL, DEFAULT_REQUEST_DELAY_MS);
    }

    public GitHubApiClient(String token, String baseUrl, long requestDelayMs) {
        this(token, baseUrl, requestDelayMs, defaultHttpClient());
    }

    public GitHubApiClient(String token, String baseUrl, long requestDelayMs, OkHttpClient httpClient) {
        this(token, baseUrl, requestDelayMs, httpClient, Clock.systemUTC(), Sleeper.SYSTEM);
    }

    // Visible for testing
    GitHubApiClient(String token, String baseUrl, long requestDelayMs, OkHttpClient httpClient,
                    Clock clock, Sleeper sleeper) {
        this.token = token;
        this.baseUrl = HttpUrl.get(baseUrl);
        this.requestDelayMs = requestDelayMs;
        this.httpClient = httpClient;
        this.clock = clock;
        this.sleeper = sleeper;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    private static OkHttpClient defaultHttpClient() {
        return new OkHttpClient.Builder()
                .connectTimeout(30, TimeUnit.SECONDS)
                .readTimeout(30, TimeUnit.SECONDS)
                .writeTimeout(30, TimeUnit.SECONDS)
                .build();
    }

    // -------------------------------------------------------------------------
    // Public API endpoint methods
    // -------------------------------------------------------------------------

    /**
     * Fetches repository metadata.
     * Endpoint: GET /repos/{owner}/{repo}
     */
    public Repository getRepository(String owner, String repo) throws IOException, InterruptedException {
        String json = execute(buildUrl("/repos/" + owner + "/" + repo, Map.of()));
        return objectMapper.readValue(json, Repository.class);
    }

    /**
     * Checks that the token can read the repository. Failures are logged, not thrown.
     */
    public boolean validateRepositoryAccess(String owner, String repo) throws InterruptedException {
        try {
            getRepository(owner, repo);
            return true;
        } catch (IOException e) {
            logger.error("Repository access validation failed for {}/{}: {}", owner, repo, e.getMessage());
            return false;
        }
    }

    /**
     * Fetches every closed pull request of a repository.
     * Endpoint: GET /repos/{owner}/{repo}/pulls?state=closed
     */
    public List<PullRequest> getClosedPullRequests(String owner, String repo)
            throws IOException, InterruptedException {
        return fetchAllPages("/repos/" + owner + "/" + repo + "/pulls",
                Map.of("state", PullRequest.STATE_CLOSED), PULL_REQUEST_LIST);
    }

    /**
     * Fetches the inline review comments of a pull request.
     * Endpoint: GET /repos/{owner}/{repo}/pulls/{number}/comments
     */
    public List<ReviewComment> getReviewComments(String owner, String repo, int prNumber)
            throws IOException, InterruptedException {
        return fetchAllPages("/repos/" + owner + "/" + repo + "/pulls/" + prNumber + "/comments",
                Map.of(), COMMENT_LIST);
    }

    /**
     * Fetches the conversation comments of a pull request (GitHub treats a PR as an issue here).
     * Endpoint: GET /repos/{owner}/{repo}/issues/{number}/comments
     */
    public List<ReviewComment> getIssueComments(String owner, String repo, int prNumber)
            throws IOException, InterruptedException {
        return fetchAllPages("/repos/" + owner + "/" + repo + "/issues/" + prNumber + "/comments",
                Map.of(), COMMENT_LIST);
    }

    /**
     * Review comments followed by issue comments for one pull request.
     */
    public List<ReviewComment> getAllComments(String owner, String repo, int prNumber)
            throws IOException, InterruptedException {
        List<ReviewComment> all = new ArrayList<>(getReviewComments(owner, repo, prNumber));
        all.addAll(getIssueComments(owner, repo, prNumber));
        return all;
    }

    /**
     * Asks GitHub for the current quota.
     * Endpoint: GET /rate_limit
     */
    public RateLimitStatus getRateLimitStatus() throws IOException, InterruptedException {
        String json = execute(buildUrl("/rate_limit", Map.of()));
        return objectMapper.readValue(json, RateLimitStatus.class);
    }

    /**
     * The quota as last seen in response headers. Makes no HTTP call.
     */
    public synchronized RateLimitSnapshot getRateLimitSnapshot() {
        Instant resetAt = rateLimitResetEpochSeconds != null
                ? Instant.ofEpochSecond(rateLimitResetEpochSeconds)
                : null;
        return new RateLimitSnapshot(rateLimitRemaining, resetAt);
    }

    // -------------------------------------------------------------------------
    // Pagination
    // -------------------------------------------------------------------------

    /**
     * Fetches one page and deserializes it into a list of {@code T}.
     * An empty body yields an empty list.
     */
    public <T> List<T> fetchPage(String path, Map<String, String> params, TypeReference<List<T>> typeRef)
            throws IOException, InterruptedException {
        String json = execute(buildUrl(path, params));
        if (json == null || json.isBlank()) {
            return List.of();
        }
        return objectMapper.readValue(json, typeRef);
    }

    /**
     * Walks {@code page=1,2,...} with {@code per_page=100} until a page comes back
     * with fewer than 100 items, concatenating the results.
     */
    public <T> List<T> fetchAllPages(String path, Map<String, String> params, TypeReference<List<T>> typeRef)
            throws IOException, InterruptedException {
        List<T> allResults = new ArrayList<>();
        int page = 1;

        while (true) {
            Map<String, String> pageParams = new LinkedHashMap<>(params);
            pageParams.put("per_page", String.valueOf(PER_PAGE));
            pageParams.put("page", String.valueOf(page));

            List<T> results = fetchPage(path, pageParams, typeRef);
            allResults.addAll(results);
            logger.debug("Fetched page {} with {} items from {}", page, results.size(), path);

            if (results.size() < PER_PAGE) {
                break;
            }
            page++;
        }

        return allResults;
    }

    // -------------------------------------------------------------------------
    // Core HTTP execution with rate-limit handling
    // -------------------------------------------------------------------------

    HttpUrl buildUrl(String pathOrUrl, Map<String, String> params) {
        HttpUrl.Builder builder;
        if (pathOrUrl.startsWith("http://") || pathOrUrl.startsWith("https://")) {
            builder = HttpUrl.get(pathOrUrl).newBuilder();
        } else {
            String path = pathOrUrl.startsWith("/") ? pathOrUrl.substring(1) : pathOrUrl;
            builder = baseUrl.newBuilder().addPathSegments(path);
        }
        params.forEach(builder::addQueryParameter);
        return builder.build();
    }

    /**
     * Builds an authenticated GET request.
     */
    Request buildRequest(HttpUrl url) {
        Request.Builder builder = new Request.Builder()
                .url(url)
                .header("Accept", "application/vnd.github+json")
                .header("X-GitHub-Api-Version", "2022-11-28")
                .header("User-Agent", USER_AGENT);

        if (token != null && !token.isBlank()) {
            builder.header("Authorization", "Bearer " + token);
        }
        return builder.build();
    }

    /**
     * Executes a GET and returns the body of a 2xx response.
     *
     * @throws RateLimitedException   if GitHub rejects the single retry for rate limiting too
     * @throws RequestFailedException for any other non-2xx status
     */
    String execute(HttpUrl url) throws IOException, InterruptedException {
        Request request = buildRequest(url);
        HttpResult result;

        requestLock.lockInterruptibly();
        try {
            awaitRequestSlot();
            result = send(request);

            if (isRateLimitRejection(result)) {
                logger.warn("Rate limit exceeded for {}. Waiting for the quota window, then retrying once.", url);
                markQuotaExhausted();
                awaitRequestSlot();
                result = send(request);
                if (isRateLimitRejection(result)) {
                    throw new RateLimitedException(url.toString(), result.status(), result.body());
                }
            }
        } finally {
            requestLock.unlock();
        }

        if (result.status() < 200 || result.status() >= 300) {
            throw new RequestFailedException(url.toString(), result.status(), result.body());
        }
        return result.body();
    }

    private HttpResult send(Request request) throws IOException {
        try (Response response = httpClient.newCall(request).execute()) {
            updateRateLimit(response);
            logResponse(request.url().toString(), response.code());
            ResponseBody body = response.body();
            return new HttpResult(response.code(), body != null ? body.string() : null);
        } finally {
            synchronized (this) {
                lastRequestCompletedMillis = clock.millis();
            }
        }
    }

    // -------------------------------------------------------------------------
    // Rate limit handling
    // -------------------------------------------------------------------------

    /**
     * Sleeps until a request may be sent: first through an exhausted quota
     * window, then for whatever remains of the minimum inter-request delay.
     * Sleeps without holding the monitor, so snapshots stay available.
     */
    void awaitRequestSlot() throws InterruptedException {
        long quotaWaitMs = quotaWaitMillis();
        if (quotaWaitMs > 0) {
            logger.warn("Rate limit exhausted. Pausing for {}ms until reset.", quotaWaitMs);
            sleeper.sleep(quotaWaitMs);
            synchronized (this) {
                rateLimitRemaining = null;
            }
        }

        long delayMs = remainingDelayMillis();
        if (delayMs > 0) {
            sleeper.sleep(delayMs);
        }
    }

    private synchronized long quotaWaitMillis() {
        if (rateLimitRemaining == null || rateLimitRemaining > 0) {
            return 0;
        }
        if (rateLimitResetEpochSeconds == null) {
            return FALLBACK_RATE_LIMIT_WAIT_MS;
        }
        long untilReset = rateLimitResetEpochSeconds * 1_000 - clock.millis();
        return untilReset > 0 ? untilReset + RESET_BUFFER_MS : 0;
    }

    private synchronized long remainingDelayMillis() {
        if (lastRequestCompletedMillis <= 0) {
            return 0;
        }
        long sinceLast = clock.millis() - lastRequestCompletedMillis;
        return sinceLast < requestDelayMs ? requestDelayMs - sinceLast : 0;
    }

    private synchronized void markQuotaExhausted() {
        if (rateLimitRemaining == null || rateLimitRemaining > 0) {
            rateLimitRemaining = 0;
        }
    }

    /**
     * Records the quota headers of a response when GitHub sends them.
     */
    synchronized void updateRateLimit(Response response) {
        String remainingHeader = response.header("X-RateLimit-Remaining");
        String resetHeader = response.header("X-RateLimit-Reset");

        try {
            if (remainingHeader != null) {
                rateLimitRemaining = Integer.parseInt(remainingHeader.trim());
            }
            if (resetHeader != null) {
                rateLimitResetEpochSeconds = Long.parseLong(resetHeader.trim());
            }
        } catch (NumberFormatException e) {
            logger.debug("Ignoring malformed rate limit headers: remaining={}, reset={}",
                    remainingHeader, resetHeader);
        }
    }

    static boolean isRateLimitRejection(HttpResult result) {
        return result.status() == 403
                && result.body() != null
                && result.body().toLowerCase(Locale.ROOT).contains("rate limit");
    }

    // -------------------------------------------------------------------------
    // Logging
    // -------------------------------------------------------------------------

    private void logResponse(String url, int statusCode) {
        Integer remaining = getRateLimitSnapshot().remaining();
        logger.info("GitHub API {} {} | rate-limit-remaining: {}",
                statusCode, url, remaining != null ? remaining : "n/a");
    }

    // -------------------------------------------------------------------------
    // Internal result holder
    // -------------------------------------------------------------------------

    record HttpResult(int status, String body) {}
}
