package com.prrules.analyzer.client;

/**
 * Raised when GitHub still rejects a request for rate limiting after the
 * client has waited for the quota window and retried once.
 */
public class RateLimitedException extends RequestFailedException {

    public RateLimitedException(String url, int status, String body) {
        super(status, body, "GitHub rate limit still exceeded after retry for " + url);
    }
}
