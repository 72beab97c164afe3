package com.prrules.analyzer.diff;

/**
 * A run of consecutive added lines derived from a diff hunk.
 * Line numbers refer to the target (post-change) file and are inclusive.
 */
public record SnippetCandidate(
        String filePath,
        int lineStart,
        int lineEnd,
        String content,
        String language
) {}
