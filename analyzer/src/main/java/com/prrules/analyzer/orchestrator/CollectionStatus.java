package com.prrules.analyzer.orchestrator;

import com.prrules.analyzer.model.RateLimitStatus;
import com.prrules.analyzer.processor.ProcessingStats;
import com.prrules.analyzer.store.EntityCounts;

/**
 * What is stored, what the processor is doing and how much GitHub quota is left.
 *
 * @param rateLimit {@code null} when the rate limit endpoint could not be reached
 */
public record CollectionStatus(
        EntityCounts counts,
        ProcessingStats processing,
        RateLimitStatus rateLimit
) {}
