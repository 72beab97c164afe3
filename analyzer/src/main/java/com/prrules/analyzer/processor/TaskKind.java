package com.prrules.analyzer.processor;

/**
 * Discriminator of the {@link Task} hierarchy.
 */
public enum TaskKind {
    NORMALIZE_COMMENT("normalize_comment"),
    NORMALIZE_SNIPPET("normalize_snippet"),
    NORMALIZE_THREAD("normalize_thread"),
    EXTRACT_RULE("extract_rule"),
    UPDATE_STATISTICS("update_statistics");

    private final String value;

    TaskKind(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
