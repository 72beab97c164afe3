package com.prrules.analyzer.processor;

/**
 * Lifecycle of a queued task: {@code QUEUED -> RUNNING -> COMMITTED | FAILED}.
 */
public enum TaskState {
    QUEUED,
    RUNNING,
    COMMITTED,
    FAILED;

    public boolean isTerminal() {
        return this == COMMITTED || this == FAILED;
    }
}
