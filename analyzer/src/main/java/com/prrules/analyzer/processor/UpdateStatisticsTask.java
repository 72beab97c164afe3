package com.prrules.analyzer.processor;

/**
 * Count one occurrence of a rule in a repository.
 */
public record UpdateStatisticsTask(long ruleId, long repositoryId, double confidence) implements Task {

    @Override
    public TaskKind kind() {
        return TaskKind.UPDATE_STATISTICS;
    }
}
