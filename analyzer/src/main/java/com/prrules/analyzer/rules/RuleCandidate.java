package com.prrules.analyzer.rules;

import java.util.List;

/**
 * A rule statement extracted from one comment, ready to be persisted.
 */
public record RuleCandidate(
        String ruleText,
        RuleCategory category,
        RuleSeverity severity,
        double confidence,
        String extractor,
        String explanation,
        List<String> examples,
        List<String> relatedConcepts,
        String rawOutput
) {

    public RuleCandidate {
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0, 1]: " + confidence);
        }
        examples = examples == null ? List.of() : List.copyOf(examples);
        relatedConcepts = relatedConcepts == null ? List.of() : List.copyOf(relatedConcepts);
    }
}
