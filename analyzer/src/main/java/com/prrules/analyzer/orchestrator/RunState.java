package com.prrules.analyzer.orchestrator;

/**
 * Phases of a repository collection run.
 */
public enum RunState {
    IDLE,
    VALIDATING_ACCESS,
    SYNCING,
    AGGREGATING,
    DONE
}
