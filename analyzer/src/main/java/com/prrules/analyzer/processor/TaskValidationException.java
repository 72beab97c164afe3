package com.prrules.analyzer.processor;

/**
 * A task payload failed validation. The task is dropped and never retried.
 */
public class TaskValidationException extends RuntimeException {

    private final TaskKind kind;

    public TaskValidationException(TaskKind kind, String message) {
        super(kind.value() + ": " + message);
        this.kind = kind;
    }

    public TaskKind getKind() {
        return kind;
    }
}
