package com.prrules.analyzer.rules;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Rule severities, declared in match order.
 */
public enum RuleSeverity {

    CRITICAL("critical", List.of("critical", "must", "required", "mandatory", "essential")),
    HIGH("high", List.of("high", "important", "serious", "major")),
    MEDIUM("medium", List.of("medium", "moderate", "should", "recommended")),
    LOW("low", List.of("low", "minor", "optional", "suggestion")),
    INFO("info", List.of("info", "note", "reminder", "fyi"));

    private final String value;
    private final List<String> keywords;

    RuleSeverity(String value, List<String> keywords) {
        this.value = value;
        this.keywords = keywords;
    }

    public String value() {
        return value;
    }

    /**
     * First severity with a keyword contained in the lower-cased text.
     */
    public static Optional<RuleSeverity> matchKeywords(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (RuleSeverity severity : values()) {
            for (String keyword : severity.keywords) {
                if (lower.contains(keyword)) {
                    return Optional.of(severity);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Severity of a rule statement: keyword match, otherwise by length
     * (over 100 chars medium, over 50 low, else info).
     */
    public static RuleSeverity assess(String ruleText) {
        return matchKeywords(ruleText).orElseGet(() -> {
            int length = ruleText == null ? 0 : ruleText.length();
            if (length > 100) {
                return MEDIUM;
            }
            if (length > 50) {
                return LOW;
            }
            return INFO;
        });
    }

    /**
     * Maps an external label onto the vocabulary: exact value, then keywords, then {@link #INFO}.
     */
    public static RuleSeverity normalize(String label) {
        if (label == null || label.isBlank()) {
            return INFO;
        }
        String trimmed = label.trim().toLowerCase(Locale.ROOT);
        for (RuleSeverity severity : values()) {
            if (severity.value.equals(trimmed)) {
                return severity;
            }
        }
        return matchKeywords(trimmed).orElse(INFO);
    }

    public static RuleSeverity fromValue(String value) {
        for (RuleSeverity severity : values()) {
            if (severity.value.equals(value)) {
                return severity;
            }
        }
        throw new IllegalArgumentException("Unknown rule severity: " + value);
    }
}
