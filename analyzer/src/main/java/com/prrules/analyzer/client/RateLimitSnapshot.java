package com.prrules.analyzer.client;

import java.time.Instant;

/**
 * Point-in-time view of the quota the client has tracked from response headers.
 * Both fields are {@code null} until GitHub has sent the corresponding header.
 */
public record RateLimitSnapshot(Integer remaining, Instant resetAt) {

    public boolean exhausted() {
        return remaining != null && remaining <= 0;
    }
}
