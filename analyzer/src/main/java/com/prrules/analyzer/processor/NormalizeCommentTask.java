package com.prrules.analyzer.processor;

import com.prrules.analyzer.diff.SnippetCandidate;
import com.prrules.analyzer.model.ReviewComment;

import java.util.List;

/**
 * Persist a fetched comment, then fan out to its snippets, its thread and rule extraction.
 *
 * @param pullRequestId    row id of the owning pull request
 * @param repositoryId     row id of the repository, used for rule statistics
 * @param repositoryName   {@code owner/repo}
 * @param pullRequestTitle title of the owning pull request
 * @param comment          the comment as fetched from GitHub
 * @param snippets         snippets derived from the comment's diff hunk
 */
public record NormalizeCommentTask(
        long pullRequestId,
        long repositoryId,
        String repositoryName,
        String pullRequestTitle,
        ReviewComment comment,
        List<SnippetCandidate> snippets
) implements Task {

    public NormalizeCommentTask {
        snippets = snippets == null ? List.of() : List.copyOf(snippets);
    }

    @Override
    public TaskKind kind() {
        return TaskKind.NORMALIZE_COMMENT;
    }
}
