package com.prrules.analyzer.rules;

/**
 * What the extractor knows about a comment besides its text.
 *
 * @param filePath        commented file, {@code null} for conversation comments
 * @param lineNumber      target line, may be {@code null}
 * @param authorLogin     comment author, may be {@code null}
 * @param pullRequestTitle title of the owning pull request
 * @param repositoryName  {@code owner/repo}
 * @param hasCodeSnippets whether snippets were derived from the comment's diff hunk
 */
public record CommentContext(
        String filePath,
        Integer lineNumber,
        String authorLogin,
        String pullRequestTitle,
        String repositoryName,
        boolean hasCodeSnippets
) {

    public boolean hasFilePath() {
        return filePath != null && !filePath.isBlank();
    }

    public boolean hasAuthor() {
        return authorLogin != null && !authorLogin.isBlank();
    }
}
