package com.prrules.analyzer.rules;

import com.prrules.analyzer.client.Sleeper;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * {@link RuleBackend} over an OpenAI-compatible {@code /chat/completions} endpoint.
 *
 * <p>Requests JSON-object output at a low temperature. Transient failures
 * (I/O errors, 408, 429, 5xx) are retried with exponential backoff, 1s then 2s;
 * other 4xx answers fail immediately.</p>
 */
public class OpenAiRuleBackend implements RuleBackend {

    private static final Logger logger = LoggerFactory.getLogger(OpenAiRuleBackend.class);

    public static final String DEFAULT_BASE_URL = "https://api.openai.com/v1";
    public static final String DEFAULT_MODEL = "gpt-4";

    static final int MAX_ATTEMPTS = 3;
    static final long INITIAL_BACKOFF_MS = 1_000;

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final String apiKey;
    private final HttpUrl completionsUrl;
    private final String model;
    private final Sleeper sleeper;

    public OpenAiRuleBackend(String apiKey, String baseUrl, String model) {
        this(apiKey, baseUrl, model, new OkHttpClient.Builder()
                .connectTimeout(30, TimeUnit.SECONDS)
                .readTimeout(60, TimeUnit.SECONDS)
                .build(), Sleeper.SYSTEM);
    }

    // Visible for testing
    OpenAiRuleBackend(String apiKey, String baseUrl, String model, OkHttpClient httpClient, Sleeper sleeper) {
        this.apiKey = apiKey;
        this.completionsUrl = HttpUrl.get(baseUrl).newBuilder().addPathSegments("chat/completions").build();
        this.model = model;
        this.httpClient = httpClient;
        this.sleeper = sleeper;
    }

    @Override
    public String modelName() {
        return model;
    }

    @Override
    public String complete(String systemPrompt, String userPrompt) throws RuleBackendException {
        Request request = buildRequest(systemPrompt, userPrompt);

        RuleBackendException lastFailure = null;
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            try {
                logger.debug("Calling {} (attempt {}/{})", model, attempt, MAX_ATTEMPTS);
                return execute(request);
            } catch (RuleBackendException e) {
                lastFailure = e;
                logger.warn("Rule backend call failed (attempt {}/{}): {}", attempt, MAX_ATTEMPTS, e.getMessage());
                if (!e.isRetryable() || attempt == MAX_ATTEMPTS) {
                    break;
                }
                long backoff = INITIAL_BACKOFF_MS << (attempt - 1);
                try {
                    sleeper.sleep(backoff);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new RuleBackendException("Interrupted while backing off", false, ie);
                }
            }
        }
        throw lastFailure;
    }

    Request buildRequest(String systemPrompt, String userPrompt) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("model", model);
        payload.put("max_tokens", 1000);
        payload.put("temperature", 0.3);
        payload.putObject("response_format").put("type", "json_object");
        ArrayNode messages = payload.putArray("messages");
        messages.addObject().put("role", "system").put("content", systemPrompt);
        messages.addObject().put("role", "user").put("content", userPrompt);

        return new Request.Builder()
                .url(completionsUrl)
                .header("Authorization", "Bearer " + apiKey)
                .post(RequestBody.create(payload.toString(), JSON))
                .build();
    }

    private String execute(Request request) throws RuleBackendException {
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            String bodyString = body != null ? body.string() : "";

            if (!response.isSuccessful()) {
                throw new RuleBackendException("Rule backend returned HTTP " + response.code(),
                        isRetryableStatus(response.code()));
            }

            JsonNode content = objectMapper.readTree(bodyString)
                    .path("choices").path(0).path("message").path("content");
            if (content.isMissingNode() || content.isNull()) {
                return null;
            }
            return content.asText().trim();
        } catch (RuleBackendException e) {
            throw e;
        } catch (IOException e) {
            throw new RuleBackendException("Rule backend request failed: " + e.getMessage(), true, e);
        }
    }

    static boolean isRetryableStatus(int status) {
        return status == 408 || status == 429 || status >= 500;
    }
}
