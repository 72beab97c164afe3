package com.prrules.analyzer.processor;

import com.prrules.analyzer.diff.SnippetCandidate;

/**
 * Persist one code snippet of an already stored comment.
 *
 * @param commentGithubId GitHub id of the owning review comment
 */
public record NormalizeSnippetTask(long commentGithubId, SnippetCandidate snippet) implements Task {

    @Override
    public TaskKind kind() {
        return TaskKind.NORMALIZE_SNIPPET;
    }
}
