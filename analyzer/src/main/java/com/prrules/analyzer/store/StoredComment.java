package com.prrules.analyzer.store;

/**
 * The persisted fields of a review comment that downstream tasks need.
 */
public record StoredComment(
        long id,
        long githubId,
        long pullRequestId,
        String authorLogin,
        String body,
        String path,
        int position,
        Integer line
) {}
