package com.prrules.analyzer.rules;

import java.util.List;
import java.util.Locale;

/**
 * Rule categories, declared in match order. Classification picks the first
 * category with a keyword contained in the lower-cased text; {@link #GENERAL}
 * catches everything else.
 */
public enum RuleCategory {

    NAMING("naming", List.of("name", "naming", "variable", "function", "class", "method", "identifier")),
    STYLE("style", List.of("style", "format", "indent", "spacing", "layout", "appearance")),
    PERFORMANCE("performance", List.of("performance", "efficient", "optimize", "speed", "memory")),
    SECURITY("security", List.of("security", "safe", "vulnerable", "attack", "protect")),
    BEST_PRACTICES("best_practices", List.of("best", "practice", "convention", "standard", "guideline")),
    ERROR_HANDLING("error_handling", List.of("error", "exception", "handle", "catch", "throw")),
    TESTING("testing", List.of("test", "testing", "unit", "integration", "coverage")),
    DOCUMENTATION("documentation", List.of("document", "comment", "doc", "readme", "description")),
    ARCHITECTURE("architecture", List.of("architecture", "design", "structure", "pattern", "module")),
    READABILITY("readability", List.of("readable", "clear", "understand", "simple", "clean")),
    GENERAL("general", List.of());

    private final String value;
    private final List<String> keywords;

    RuleCategory(String value, List<String> keywords) {
        this.value = value;
        this.keywords = keywords;
    }

    /** Stored and serialized form, e.g. {@code error_handling}. */
    public String value() {
        return value;
    }

    /**
     * Keyword classification of free text.
     */
    public static RuleCategory classify(String text) {
        if (text == null) {
            return GENERAL;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (RuleCategory category : values()) {
            for (String keyword : category.keywords) {
                if (lower.contains(keyword)) {
                    return category;
                }
            }
        }
        return GENERAL;
    }

    /**
     * Maps a label produced by an external extractor onto the vocabulary: an exact
     * value match wins, then keyword classification.
     */
    public static RuleCategory normalize(String label) {
        if (label == null || label.isBlank()) {
            return GENERAL;
        }
        String trimmed = label.trim().toLowerCase(Locale.ROOT).replace(' ', '_');
        for (RuleCategory category : values()) {
            if (category.value.equals(trimmed)) {
                return category;
            }
        }
        return classify(label);
    }

    public static RuleCategory fromValue(String value) {
        for (RuleCategory category : values()) {
            if (category.value.equals(value)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown rule category: " + value);
    }
}
