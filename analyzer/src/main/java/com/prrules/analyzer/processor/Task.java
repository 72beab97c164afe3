package com.prrules.analyzer.processor;

/**
 * A unit of work for the {@link TaskQueueProcessor}. Each kind carries its own payload.
 */
public sealed interface Task
        permits NormalizeCommentTask, NormalizeSnippetTask, NormalizeThreadTask, ExtractRuleTask, UpdateStatisticsTask {

    TaskKind kind();
}
