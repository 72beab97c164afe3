package com.prrules.analyzer.orchestrator;

/**
 * How a collection run ended. {@code COMPLETED} runs may still carry per-pull-request errors.
 */
public enum RunOutcome {
    COMPLETED,
    ACCESS_DENIED,
    FAILED
}
