package com.prrules.analyzer.store;

/**
 * Row counts per table.
 */
public record EntityCounts(
        long repositories,
        long pullRequests,
        long reviewComments,
        long codeSnippets,
        long commentThreads,
        long extractedRules,
        long ruleStatistics
) {}
