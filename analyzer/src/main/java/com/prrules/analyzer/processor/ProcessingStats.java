package com.prrules.analyzer.processor;

/**
 * Snapshot of the processor's counters.
 *
 * @param processed  tasks finished, successful or not
 * @param errors     tasks that failed
 * @param queueSize  tasks waiting in the queue
 * @param workerCount live worker threads
 */
public record ProcessingStats(
        long processed,
        long errors,
        int queueSize,
        int workerCount,
        boolean running
) {}
