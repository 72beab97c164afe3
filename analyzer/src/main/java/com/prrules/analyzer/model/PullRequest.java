package com.prrules.analyzer.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Data transfer object representing a GitHub pull request.
 * Maps from: /repos/{owner}/{repo}/pulls?state=closed
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PullRequest(
        @JsonProperty("id") long id,
        @JsonProperty("number") int number,
        @JsonProperty("title") String title,
        @JsonProperty("body") String body,
        @JsonProperty("state") String state,
        @JsonProperty("html_url") String htmlUrl,
        @JsonProperty("created_at") String createdAt,
        @JsonProperty("updated_at") String updatedAt,
        @JsonProperty("closed_at") String closedAt,
        @JsonProperty("merged_at") String mergedAt,
        @JsonProperty("user") User user
) {

    public static final String STATE_OPEN = "open";
    public static final String STATE_CLOSED = "closed";

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record User(
            @JsonProperty("login") String login,
            @JsonProperty("id") long id
    ) {}

    public String authorLogin() {
        return user != null ? user.login() : null;
    }
}
