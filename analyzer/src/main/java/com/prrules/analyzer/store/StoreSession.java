package com.prrules.analyzer.store;

import com.prrules.analyzer.diff.SnippetCandidate;
import com.prrules.analyzer.model.PullRequest;
import com.prrules.analyzer.model.Repository;
import com.prrules.analyzer.model.ReviewComment;
import com.prrules.analyzer.rules.RuleCandidate;
import com.prrules.analyzer.rules.RuleCategory;
import com.prrules.analyzer.rules.RuleSeverity;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * One JDBC connection and the typed operations on it. Not thread-safe: a session
 * belongs to the thread that opened it.
 *
 * <p>Every entity with a natural key is written with
 * {@code INSERT ... ON CONFLICT DO UPDATE}, followed by a select of the row id,
 * so concurrent sessions writing the same key converge on one row.</p>
 */
public class StoreSession implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(StoreSession.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Connection conn;
    private final Clock clock;

    StoreSession(Connection conn, Clock clock) {
        this.conn = conn;
        this.clock = clock;
    }

    // =====================================================================
    // Repositories and pull requests
    // =====================================================================

    /**
     * @return the row id of the repository
     */
    public long upsertRepository(Repository repo) {
        long now = clock.millis();
        try {
            execute("upsert-repository",
                    repo.id(), repo.ownerLogin(), repo.name(), repo.fullName(), repo.htmlUrl(),
                    repo.description(), repo.language(), repo.active() ? 1 : 0,
                    repo.createdAt(), repo.updatedAt(), now, now);
            return requireId("select-repository-id", repo.id());
        } catch (SQLException e) {
            throw new StoreException("Failed to upsert repository " + repo.fullName(), e);
        }
    }

    /**
     * @throws IllegalArgumentException if the state is unknown or a merged pull request is not closed
     */
    public long upsertPullRequest(long repositoryId, PullRequest pr) {
        if (!PullRequest.STATE_OPEN.equals(pr.state()) && !PullRequest.STATE_CLOSED.equals(pr.state())) {
            throw new IllegalArgumentException("Pull request #" + pr.number() + " has invalid state: " + pr.state());
        }
        if (pr.mergedAt() != null && !PullRequest.STATE_CLOSED.equals(pr.state())) {
            throw new IllegalArgumentException("Pull request #" + pr.number() + " is merged but not closed");
        }

        long now = clock.millis();
        try {
            execute("upsert-pull-request",
                    pr.id(), repositoryId, pr.number(), pr.title(), pr.body(), pr.state(),
                    pr.authorLogin(), pr.htmlUrl(), pr.createdAt(), pr.updatedAt(),
                    pr.closedAt(), pr.mergedAt(), now, now);
            return requireId("select-pull-request-id", pr.id());
        } catch (SQLException e) {
            throw new StoreException("Failed to upsert pull request #" + pr.number(), e);
        }
    }

    // =====================================================================
    // Review comments, snippets and threads
    // =====================================================================

    /**
     * The caller validates path and position before writing.
     */
    public long upsertReviewComment(long pullRequestId, ReviewComment comment) {
        long now = clock.millis();
        try {
            execute("upsert-review-comment",
                    comment.id(), pullRequestId, comment.authorLogin(), comment.body(), comment.path(),
                    comment.position(), comment.line(), comment.side(), comment.diffHunk(),
                    comment.htmlUrl(), comment.createdAt(), comment.updatedAt(), now, now);
            return findReviewComment(comment.id())
                    .map(StoredComment::id)
                    .orElseThrow(() -> new IllegalStateException(
                            "Review comment " + comment.id() + " missing after upsert"));
        } catch (SQLException e) {
            throw new StoreException("Failed to upsert review comment " + comment.id(), e);
        }
    }

    public Optional<StoredComment> findReviewComment(long githubId) {
        try (PreparedStatement ps = prepare("select-review-comment", githubId);
             ResultSet rs = ps.executeQuery()) {
            if (!rs.next()) {
                return Optional.empty();
            }
            return Optional.of(new StoredComment(
                    rs.getLong("id"),
                    rs.getLong("github_id"),
                    rs.getLong("pull_request_id"),
                    rs.getString("author_login"),
                    rs.getString("body"),
                    rs.getString("path"),
                    rs.getInt("position"),
                    nullableInt(rs, "line")));
        } catch (SQLException e) {
            throw new StoreException("Failed to read review comment " + githubId, e);
        }
    }

    public long upsertCodeSnippet(long reviewCommentId, SnippetCandidate snippet) {
        long now = clock.millis();
        try {
            execute("upsert-code-snippet",
                    reviewCommentId, snippet.filePath(), snippet.lineStart(), snippet.lineEnd(),
                    snippet.content(), snippet.language(), now, now);
            return requireId("select-code-snippet-id", reviewCommentId, snippet.lineStart(), snippet.lineEnd());
        } catch (SQLException e) {
            throw new StoreException("Failed to upsert code snippet for comment " + reviewCommentId, e);
        }
    }

    /**
     * Returns the thread for {@code (pullRequestId, path, position)}, creating it if absent.
     * An existing thread keeps its original comment.
     */
    public long upsertCommentThread(long pullRequestId, long reviewCommentId, String path, int position) {
        try {
            Optional<Long> existing = selectId("select-comment-thread-id", pullRequestId, path, position);
            if (existing.isPresent()) {
                return existing.get();
            }
            long now = clock.millis();
            execute("insert-comment-thread", pullRequestId, reviewCommentId, path, position, now, now);
            return requireId("select-comment-thread-id", pullRequestId, path, position);
        } catch (SQLException e) {
            throw new StoreException("Failed to upsert comment thread " + path + ":" + position, e);
        }
    }

    // =====================================================================
    // Extracted rules and statistics
    // =====================================================================

    /**
     * One rule per review comment; a second extraction replaces the first and bumps {@code updated_at}.
     */
    public long upsertExtractedRule(long reviewCommentId, RuleCandidate candidate) {
        long now = clock.millis();
        try {
            execute("upsert-extracted-rule",
                    reviewCommentId, candidate.ruleText(), candidate.category().value(),
                    candidate.severity().value(), candidate.confidence(), candidate.extractor(),
                    candidate.explanation(), toJson(candidate.examples()), toJson(candidate.relatedConcepts()),
                    candidate.rawOutput(), now, now);
            return findExtractedRule(reviewCommentId)
                    .map(StoredRule::id)
                    .orElseThrow(() -> new IllegalStateException(
                            "Rule for comment " + reviewCommentId + " missing after upsert"));
        } catch (SQLException e) {
            throw new StoreException("Failed to upsert rule for comment " + reviewCommentId, e);
        }
    }

    public Optional<StoredRule> findExtractedRule(long reviewCommentId) {
        try (PreparedStatement ps = prepare("select-extracted-rule", reviewCommentId);
             ResultSet rs = ps.executeQuery()) {
            if (!rs.next()) {
                return Optional.empty();
            }
            return Optional.of(new StoredRule(
                    rs.getLong("id"),
                    rs.getLong("review_comment_id"),
                    rs.getString("rule_text"),
                    RuleCategory.fromValue(rs.getString("rule_category")),
                    RuleSeverity.fromValue(rs.getString("rule_severity")),
                    rs.getDouble("confidence_score"),
                    rs.getString("extractor"),
                    rs.getString("explanation"),
                    rs.getString("raw_output"),
                    rs.getInt("is_valid") == 1,
                    Instant.ofEpochMilli(rs.getLong("created_at")),
                    Instant.ofEpochMilli(rs.getLong("updated_at"))));
        } catch (SQLException e) {
            throw new StoreException("Failed to read rule for comment " + reviewCommentId, e);
        }
    }

    public boolean markRuleValid(long ruleId) {
        return setRuleValidity(ruleId, true);
    }

    public boolean markRuleInvalid(long ruleId) {
        return setRuleValidity(ruleId, false);
    }

    private boolean setRuleValidity(long ruleId, boolean valid) {
        try {
            return execute("update-rule-validity", valid ? 1 : 0, clock.millis(), ruleId) > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to update validity of rule " + ruleId, e);
        }
    }

    /**
     * Counts one more occurrence of a rule in a repository and folds the confidence
     * into the running average, as a single statement.
     *
     * @return the statistics after the update
     */
    public RuleStatistics recordRuleOccurrence(long ruleId, long repositoryId, double confidence) {
        long now = clock.millis();
        try {
            execute("upsert-rule-statistics", ruleId, repositoryId, now, now, confidence, now, now);
        } catch (SQLException e) {
            throw new StoreException("Failed to update statistics of rule " + ruleId, e);
        }
        return findRuleStatistics(ruleId, repositoryId)
                .orElseThrow(() -> new IllegalStateException("Statistics of rule " + ruleId + " missing after upsert"));
    }

    public Optional<RuleStatistics> findRuleStatistics(long ruleId, long repositoryId) {
        try (PreparedStatement ps = prepare("select-rule-statistics", ruleId, repositoryId);
             ResultSet rs = ps.executeQuery()) {
            if (!rs.next()) {
                return Optional.empty();
            }
            double avg = rs.getDouble("avg_confidence");
            return Optional.of(new RuleStatistics(
                    rs.getLong("id"),
                    rs.getLong("rule_id"),
                    rs.getLong("repository_id"),
                    rs.getInt("occurrence_count"),
                    Instant.ofEpochMilli(rs.getLong("first_seen")),
                    Instant.ofEpochMilli(rs.getLong("last_seen")),
                    rs.wasNull() ? null : avg));
        } catch (SQLException e) {
            throw new StoreException("Failed to read statistics of rule " + ruleId, e);
        }
    }

    // =====================================================================
    // Status and retention
    // =====================================================================

    public EntityCounts countEntities() {
        try (PreparedStatement ps = prepare("count-entities");
             ResultSet rs = ps.executeQuery()) {
            rs.next();
            return new EntityCounts(
                    rs.getLong("repositories"),
                    rs.getLong("pull_requests"),
                    rs.getLong("review_comments"),
                    rs.getLong("code_snippets"),
                    rs.getLong("comment_threads"),
                    rs.getLong("extracted_rules"),
                    rs.getLong("rule_statistics"));
        } catch (SQLException e) {
            throw new StoreException("Failed to count entities", e);
        }
    }

    /**
     * Deletes rows created before {@code cutoff}, children first, in one transaction.
     */
    public CleanupResult deleteOlderThan(Instant cutoff) {
        long cutoffMillis = cutoff.toEpochMilli();
        try {
            conn.setAutoCommit(false);
            try {
                int snippets = execute("delete-old-code-snippets", cutoffMillis);
                int threads = execute("delete-old-comment-threads", cutoffMillis);
                int comments = execute("delete-old-review-comments", cutoffMillis);
                int pullRequests = execute("delete-old-pull-requests", cutoffMillis);
                int repositories = execute("delete-old-repositories", cutoffMillis);
                conn.commit();
                return new CleanupResult(cutoff, snippets, threads, comments, pullRequests, repositories);
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to clean up data older than " + cutoff, e);
        }
    }

    @Override
    public void close() {
        try {
            conn.close();
        } catch (SQLException e) {
            logger.warn("Failed to close database session: {}", e.getMessage());
        }
    }

    // =====================================================================
    // JDBC helpers
    // =====================================================================

    private PreparedStatement prepare(String sqlName, Object... params) throws SQLException {
        PreparedStatement ps = conn.prepareStatement(SqlLoader.load(sqlName));
        try {
            for (int i = 0; i < params.length; i++) {
                ps.setObject(i + 1, params[i]);
            }
        } catch (SQLException e) {
            ps.close();
            throw e;
        }
        return ps;
    }

    private int execute(String sqlName, Object... params) throws SQLException {
        try (PreparedStatement ps = prepare(sqlName, params)) {
            return ps.executeUpdate();
        }
    }

    private Optional<Long> selectId(String sqlName, Object... params) throws SQLException {
        try (PreparedStatement ps = prepare(sqlName, params);
             ResultSet rs = ps.executeQuery()) {
            return rs.next() ? Optional.of(rs.getLong(1)) : Optional.empty();
        }
    }

    private long requireId(String sqlName, Object... params) throws SQLException {
        return selectId(sqlName, params)
                .orElseThrow(() -> new SQLException("No row found by " + sqlName));
    }

    private static Integer nullableInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    private static String toJson(List<String> values) {
        return MAPPER.valueToTree(values).toString();
    }
}
