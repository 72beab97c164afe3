package com.prrules.analyzer.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Data transfer object for the GitHub rate limit endpoint.
 * Maps from: /rate_limit
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RateLimitStatus(
        @JsonProperty("resources") Resources resources,
        @JsonProperty("rate") Rate rate
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Resources(
            @JsonProperty("core") Rate core
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Rate(
            @JsonProperty("limit") int limit,
            @JsonProperty("remaining") int remaining,
            @JsonProperty("reset") long reset,
            @JsonProperty("used") int used
    ) {}

    /** The core REST quota, falling back to the legacy top-level {@code rate} block. */
    public Rate core() {
        if (resources != null && resources.core() != null) {
            return resources.core();
        }
        return rate;
    }
}
