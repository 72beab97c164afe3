package com.prrules.analyzer.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Data transfer object representing a comment left on a pull request.
 * Maps from both /repos/{owner}/{repo}/pulls/{number}/comments (review comments,
 * which carry a path, position and diff hunk) and
 * /repos/{owner}/{repo}/issues/{number}/comments (conversation comments, which don't).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReviewComment(
        @JsonProperty("id") long id,
        @JsonProperty("body") String body,
        @JsonProperty("path") String path,
        @JsonProperty("position") Integer position,
        @JsonProperty("line") Integer line,
        @JsonProperty("side") String side,
        @JsonProperty("diff_hunk") String diffHunk,
        @JsonProperty("html_url") String htmlUrl,
        @JsonProperty("created_at") String createdAt,
        @JsonProperty("updated_at") String updatedAt,
        @JsonProperty("user") User user
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record User(
            @JsonProperty("login") String login,
            @JsonProperty("id") long id
    ) {}

    public String authorLogin() {
        return user != null ? user.login() : null;
    }
}
