package com.prrules.analyzer.processor;

import com.prrules.analyzer.diff.SnippetCandidate;
import com.prrules.analyzer.model.ReviewComment;
import com.prrules.analyzer.rules.CommentContext;
import com.prrules.analyzer.rules.RuleCandidate;
import com.prrules.analyzer.rules.RuleExtractionEngine;
import com.prrules.analyzer.store.StoreSession;
import com.prrules.analyzer.store.StoredComment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Per-kind task handlers. Each validates its payload, writes through the worker's
 * session and hands follow-on tasks to {@code enqueue}.
 */
class TaskHandlers {

    private static final Logger logger = LoggerFactory.getLogger(TaskHandlers.class);

    private final RuleExtractionEngine ruleEngine;
    private final Consumer<Task> enqueue;

    TaskHandlers(RuleExtractionEngine ruleEngine, Consumer<Task> enqueue) {
        this.ruleEngine = ruleEngine;
        this.enqueue = enqueue;
    }

    void dispatch(Task task, StoreSession session) {
        switch (task.kind()) {
            case NORMALIZE_COMMENT -> normalizeComment((NormalizeCommentTask) task, session);
            case NORMALIZE_SNIPPET -> normalizeSnippet((NormalizeSnippetTask) task, session);
            case NORMALIZE_THREAD -> normalizeThread((NormalizeThreadTask) task, session);
            case EXTRACT_RULE -> extractRule((ExtractRuleTask) task, session);
            case UPDATE_STATISTICS -> updateStatistics((UpdateStatisticsTask) task, session);
        }
    }

    // =========================================================================
    // normalize_comment
    // =========================================================================

    void normalizeComment(NormalizeCommentTask task, StoreSession session) {
        ReviewComment comment = task.comment();
        if (comment == null) {
            throw new TaskValidationException(TaskKind.NORMALIZE_COMMENT, "missing comment payload");
        }

        List<String> missing = new ArrayList<>();
        if (comment.id() <= 0) missing.add("id");
        if (isBlank(comment.body())) missing.add("body");
        if (isBlank(comment.path())) missing.add("path");
        if (comment.position() == null || comment.position() <= 0) missing.add("position");
        if (!missing.isEmpty()) {
            throw new TaskValidationException(TaskKind.NORMALIZE_COMMENT,
                    "comment " + comment.id() + " lacks required fields " + missing);
        }

        long commentId = session.upsertReviewComment(task.pullRequestId(), comment);
        logger.debug("Stored review comment {} as row {}", comment.id(), commentId);

        for (SnippetCandidate snippet : task.snippets()) {
            enqueue.accept(new NormalizeSnippetTask(comment.id(), snippet));
        }
        enqueue.accept(new NormalizeThreadTask(task.pullRequestId(), comment.id(),
                comment.path(), comment.position()));

        CommentContext context = new CommentContext(
                comment.path(),
                comment.line(),
                comment.authorLogin(),
                task.pullRequestTitle(),
                task.repositoryName(),
                !task.snippets().isEmpty());
        enqueue.accept(new ExtractRuleTask(commentId, task.repositoryId(), comment.body(), context));
    }

    // =========================================================================
    // normalize_snippet
    // =========================================================================

    void normalizeSnippet(NormalizeSnippetTask task, StoreSession session) {
        SnippetCandidate snippet = task.snippet();
        if (snippet == null || isBlank(snippet.content())) {
            throw new TaskValidationException(TaskKind.NORMALIZE_SNIPPET, "snippet content is empty");
        }
        if (snippet.lineStart() <= 0 || snippet.lineEnd() <= 0) {
            throw new TaskValidationException(TaskKind.NORMALIZE_SNIPPET,
                    "line bounds must be positive: " + snippet.lineStart() + "-" + snippet.lineEnd());
        }
        if (snippet.lineStart() > snippet.lineEnd()) {
            throw new TaskValidationException(TaskKind.NORMALIZE_SNIPPET,
                    "line start " + snippet.lineStart() + " is after line end " + snippet.lineEnd());
        }

        StoredComment owner = requireComment(TaskKind.NORMALIZE_SNIPPET, task.commentGithubId(), session);
        session.upsertCodeSnippet(owner.id(), snippet);
    }

    // =========================================================================
    // normalize_thread
    // =========================================================================

    void normalizeThread(NormalizeThreadTask task, StoreSession session) {
        List<String> missing = new ArrayList<>();
        if (task.commentGithubId() <= 0) missing.add("comment id");
        if (isBlank(task.path())) missing.add("path");
        if (task.position() == null || task.position() <= 0) missing.add("position");
        if (!missing.isEmpty()) {
            throw new TaskValidationException(TaskKind.NORMALIZE_THREAD, "thread lacks required fields " + missing);
        }

        StoredComment owner = requireComment(TaskKind.NORMALIZE_THREAD, task.commentGithubId(), session);
        session.upsertCommentThread(task.pullRequestId(), owner.id(), task.path(), task.position());
    }

    // =========================================================================
    // extract_rule
    // =========================================================================

    void extractRule(ExtractRuleTask task, StoreSession session) {
        Optional<RuleCandidate> candidate = ruleEngine.extract(task.commentText(), task.context());
        if (candidate.isEmpty()) {
            logger.debug("No rule found in comment row {}", task.reviewCommentId());
            return;
        }

        RuleCandidate rule = candidate.get();
        long ruleId = session.upsertExtractedRule(task.reviewCommentId(), rule);
        logger.debug("Stored rule {} [{} / {}] for comment row {}", ruleId,
                rule.category().value(), rule.severity().value(), task.reviewCommentId());

        enqueue.accept(new UpdateStatisticsTask(ruleId, task.repositoryId(), rule.confidence()));
    }

    // =========================================================================
    // update_statistics
    // =========================================================================

    void updateStatistics(UpdateStatisticsTask task, StoreSession session) {
        if (task.confidence() < 0.0 || task.confidence() > 1.0) {
            throw new TaskValidationException(TaskKind.UPDATE_STATISTICS,
                    "confidence out of range: " + task.confidence());
        }
        session.recordRuleOccurrence(task.ruleId(), task.repositoryId(), task.confidence());
    }

    private static StoredComment requireComment(TaskKind kind, long githubId, StoreSession session) {
        return session.findReviewComment(githubId)
                .orElseThrow(() -> new TaskValidationException(kind, "review comment " + githubId + " is not stored"));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
