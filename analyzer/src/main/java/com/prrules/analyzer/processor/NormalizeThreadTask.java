package com.prrules.analyzer.processor;

/**
 * Make sure a thread exists for the comment's {@code (path, position)} in its pull request.
 */
public record NormalizeThreadTask(
        long pullRequestId,
        long commentGithubId,
        String path,
        Integer position
) implements Task {

    @Override
    public TaskKind kind() {
        return TaskKind.NORMALIZE_THREAD;
    }
}
