package com.prrules.analyzer.processor;

import java.time.Instant;

/**
 * Outcome of {@link TaskQueueProcessor#processBatch}, counting only the batch's own items.
 */
public record BatchResult(
        int total,
        int success,
        int errors,
        Instant start,
        Instant end
) {

    public long durationMs() {
        return end.toEpochMilli() - start.toEpochMilli();
    }
}
