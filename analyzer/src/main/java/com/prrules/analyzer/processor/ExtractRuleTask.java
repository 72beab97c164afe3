package com.prrules.analyzer.processor;

import com.prrules.analyzer.rules.CommentContext;

/**
 * Run rule extraction over a stored comment.
 *
 * @param reviewCommentId row id of the comment
 * @param repositoryId    row id of the repository the comment belongs to
 */
public record ExtractRuleTask(
        long reviewCommentId,
        long repositoryId,
        String commentText,
        CommentContext context
) implements Task {

    @Override
    public TaskKind kind() {
        return TaskKind.EXTRACT_RULE;
    }
}
