package com.prrules.analyzer.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Data transfer object representing a GitHub repository.
 * Maps from: /repos/{owner}/{repo}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Repository(
        @JsonProperty("id") long id,
        @JsonProperty("name") String name,
        @JsonProperty("full_name") String fullName,
        @JsonProperty("owner") Owner owner,
        @JsonProperty("html_url") String htmlUrl,
        @JsonProperty("description") String description,
        @JsonProperty("language") String language,
        @JsonProperty("archived") boolean archived,
        @JsonProperty("disabled") boolean disabled,
        @JsonProperty("created_at") String createdAt,
        @JsonProperty("updated_at") String updatedAt
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Owner(
            @JsonProperty("login") String login
    ) {}

    public String ownerLogin() {
        return owner != null ? owner.login() : null;
    }

    /** A repository stays active until GitHub reports it archived or disabled. */
    public boolean active() {
        return !archived && !disabled;
    }
}
