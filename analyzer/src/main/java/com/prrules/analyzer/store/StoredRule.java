package com.prrules.analyzer.store;

import com.prrules.analyzer.rules.RuleCategory;
import com.prrules.analyzer.rules.RuleSeverity;

import java.time.Instant;

/**
 * An extracted rule as stored, one per review comment.
 */
public record StoredRule(
        long id,
        long reviewCommentId,
        String ruleText,
        RuleCategory category,
        RuleSeverity severity,
        double confidence,
        String extractor,
        String explanation,
        String rawOutput,
        boolean valid,
        Instant createdAt,
        Instant updatedAt
) {}
