package com.prrules.analyzer.processor;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * A task on its way through the queue, tracking its {@link TaskState}.
 */
public final class QueuedTask {

    /** Terminates the worker that receives it. */
    static final QueuedTask POISON = new QueuedTask(null, null);

    private final Task task;
    private final BatchTracker batch;
    private volatile TaskState state = TaskState.QUEUED;
    private volatile RuntimeException failure;

    QueuedTask(Task task, BatchTracker batch) {
        this.task = task;
        this.batch = batch;
    }

    public Task task() {
        return task;
    }

    public TaskState state() {
        return state;
    }

    /** The exception that failed the task, or {@code null}. */
    public RuntimeException failure() {
        return failure;
    }

    BatchTracker batch() {
        return batch;
    }

    void markRunning() {
        state = TaskState.RUNNING;
    }

    void markCommitted() {
        state = TaskState.COMMITTED;
    }

    void markFailed(RuntimeException cause) {
        failure = cause;
        state = TaskState.FAILED;
    }

    /**
     * Success and error tallies for the items of one {@code processBatch} call.
     */
    static final class BatchTracker {
        private final AtomicInteger success = new AtomicInteger();
        private final AtomicInteger errors = new AtomicInteger();

        void record(boolean succeeded) {
            if (succeeded) {
                success.incrementAndGet();
            } else {
                errors.incrementAndGet();
            }
        }

        int success() {
            return success.get();
        }

        int errors() {
            return errors.get();
        }
    }
}
