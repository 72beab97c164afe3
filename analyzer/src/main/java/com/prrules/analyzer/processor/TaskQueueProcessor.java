package com.prrules.analyzer.processor;

import com.prrules.analyzer.rules.RuleExtractionEngine;
import com.prrules.analyzer.store.StoreHandle;
import com.prrules.analyzer.store.StoreSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fixed pool of worker threads draining a FIFO queue of {@link Task}s.
 *
 * <h3>Threading model</h3>
 * <ul>
 * <li>Each worker opens its own {@link StoreSession} and passes it to every handler
 * it runs; sessions are never shared.</li>
 * <li>Handlers may enqueue follow-on tasks. Those count as pending work, so
 * {@link #awaitIdle()} returns only once the whole chain has finished.</li>
 * <li>{@link #stopWorkers()} lets in-flight tasks finish and discards queued ones.</li>
 * <li>A worker that dies (for example because its session cannot be opened) is not
 * replaced. Once the last one is gone, waiters in {@link #awaitIdle()} fail instead
 * of blocking on a queue nobody drains.</li>
 * </ul>
 */
public class TaskQueueProcessor {

    private static final Logger logger = LoggerFactory.getLogger(TaskQueueProcessor.class);

    public static final int DEFAULT_WORKER_COUNT = 4;

    static final long POLL_TIMEOUT_MS = 1_000;
    static final long JOIN_TIMEOUT_MS = 5_000;

    private final StoreHandle store;
    private final TaskHandlers handlers;
    private final int workerCount;

    private final LinkedBlockingQueue<QueuedTask> queue = new LinkedBlockingQueue<>();
    private final List<Thread> workers = new ArrayList<>();
    private volatile boolean running;

    private final Object counterLock = new Object();
    private long processed;
    private long errors;

    private final ReentrantLock pendingLock = new ReentrantLock();
    private final Condition drained = pendingLock.newCondition();
    private long pending;
    private int liveWorkers;

    public TaskQueueProcessor(StoreHandle store, RuleExtractionEngine ruleEngine) {
        this(store, ruleEngine, DEFAULT_WORKER_COUNT);
    }

    public TaskQueueProcessor(StoreHandle store, RuleExtractionEngine ruleEngine, int workerCount) {
        if (workerCount <= 0) {
            throw new IllegalArgumentException("workerCount must be positive: " + workerCount);
        }
        this.store = store;
        this.workerCount = workerCount;
        this.handlers = new TaskHandlers(ruleEngine, this::submit);
    }

    // =========================================================================
    // Lifecycle
    // =========================================================================

    public synchronized void startWorkers() {
        if (running) {
            logger.debug("Workers already running");
            return;
        }
        running = true;
        pendingLock.lock();
        try {
            liveWorkers = workerCount;
        } finally {
            pendingLock.unlock();
        }
        for (int i = 0; i < workerCount; i++) {
            Thread worker = new Thread(this::workerLoop, "task-worker-" + i);
            workers.add(worker);
            worker.start();
        }
        logger.info("Started {} task workers", workerCount);
    }

    /**
     * Stops all workers and discards queued tasks. Blocks for at most
     * {@value #JOIN_TIMEOUT_MS}ms per worker.
     */
    public void stopWorkers() {
        List<Thread> toJoin;
        synchronized (this) {
            if (!running) {
                return;
            }
            running = false;
            toJoin = new ArrayList<>(workers);
            for (int i = 0; i < toJoin.size(); i++) {
                queue.offer(QueuedTask.POISON);
            }
        }

        for (Thread worker : toJoin) {
            try {
                worker.join(JOIN_TIMEOUT_MS);
                if (worker.isAlive()) {
                    logger.warn("Worker {} did not stop within {}ms", worker.getName(), JOIN_TIMEOUT_MS);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Interrupted while stopping workers");
                break;
            }
        }

        List<QueuedTask> leftovers = new ArrayList<>();
        queue.drainTo(leftovers);
        long discarded = leftovers.stream().filter(t -> t != QueuedTask.POISON).count();

        synchronized (this) {
            workers.clear();
        }
        releaseWaiters();
        logger.info("Task workers stopped; {} queued tasks discarded", discarded);
    }

    public boolean isRunning() {
        return running;
    }

    // =========================================================================
    // Submission
    // =========================================================================

    /**
     * Enqueues one task. Tasks submitted before {@link #startWorkers()} wait in the queue.
     */
    public QueuedTask submit(Task task) {
        return enqueue(task, null);
    }

    /**
     * Enqueues {@code items}, all of one kind, and waits until the queue has drained,
     * including any follow-on tasks.
     *
     * @throws IllegalStateException    if the workers are not running
     * @throws IllegalArgumentException if an item is not of {@code kind}
     */
    public BatchResult processBatch(TaskKind kind, List<? extends Task> items) throws InterruptedException {
        if (!running) {
            throw new IllegalStateException("Workers are not running");
        }
        for (Task item : items) {
            if (item.kind() != kind) {
                throw new IllegalArgumentException(
                        "Batch of " + kind.value() + " contains a " + item.kind().value() + " task");
            }
        }

        Instant start = Instant.now();
        QueuedTask.BatchTracker tracker = new QueuedTask.BatchTracker();
        for (Task item : items) {
            enqueue(item, tracker);
        }
        awaitIdle();
        Instant end = Instant.now();

        logger.info("Batch of {} {} tasks: {} succeeded, {} failed", items.size(), kind.value(),
                tracker.success(), tracker.errors());
        return new BatchResult(items.size(), tracker.success(), tracker.errors(), start, end);
    }

    /**
     * Blocks until every submitted task, follow-ons included, has finished, or the
     * workers are stopped.
     *
     * @throws IllegalStateException if work is pending but no workers are running, or
     *                               every worker has died
     */
    public void awaitIdle() throws InterruptedException {
        pendingLock.lock();
        try {
            if (pending > 0 && !running) {
                throw new IllegalStateException(pending + " tasks pending but workers are not running");
            }
            while (pending > 0) {
                if (running && liveWorkers == 0) {
                    throw new IllegalStateException(pending + " tasks pending but all workers have died");
                }
                drained.await();
            }
        } finally {
            pendingLock.unlock();
        }
    }

    public ProcessingStats getProcessingStats() {
        long processedSnapshot;
        long errorsSnapshot;
        synchronized (counterLock) {
            processedSnapshot = processed;
            errorsSnapshot = errors;
        }
        int live;
        synchronized (this) {
            live = (int) workers.stream().filter(Thread::isAlive).count();
        }
        return new ProcessingStats(processedSnapshot, errorsSnapshot, queue.size(), live, running);
    }

    private QueuedTask enqueue(Task task, QueuedTask.BatchTracker tracker) {
        QueuedTask queued = new QueuedTask(task, tracker);
        pendingLock.lock();
        try {
            pending++;
        } finally {
            pendingLock.unlock();
        }
        queue.offer(queued);
        return queued;
    }

    // =========================================================================
    // Workers
    // =========================================================================

    private void workerLoop() {
        String name = Thread.currentThread().getName();
        logger.debug("{} started", name);

        boolean abnormal = false;
        try (StoreSession session = store.openSession()) {
            while (running) {
                QueuedTask item = queue.poll(POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
                if (item == null) {
                    continue;
                }
                if (item == QueuedTask.POISON || !running) {
                    break;
                }
                run(item, session);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            abnormal = true;
            logger.error("{} terminated abnormally", name, e);
        } finally {
            workerExited(abnormal);
        }

        logger.debug("{} stopped", name);
    }

    private void workerExited(boolean abnormal) {
        pendingLock.lock();
        try {
            if (liveWorkers > 0) {
                liveWorkers--;
            }
            if (abnormal && liveWorkers == 0) {
                logger.error("No task workers left; {} tasks cannot be processed", pending);
                drained.signalAll();
            }
        } finally {
            pendingLock.unlock();
        }
    }

    private void run(QueuedTask item, StoreSession session) {
        Task task = item.task();
        item.markRunning();
        boolean succeeded = false;
        try {
            handlers.dispatch(task, session);
            item.markCommitted();
            succeeded = true;
        } catch (TaskValidationException e) {
            logger.warn("Dropping invalid task: {}", e.getMessage());
            item.markFailed(e);
        } catch (RuntimeException e) {
            logger.error("Task {} failed", task.kind().value(), e);
            item.markFailed(e);
        } finally {
            synchronized (counterLock) {
                processed++;
                if (!succeeded) {
                    errors++;
                }
            }
            if (item.batch() != null) {
                item.batch().record(succeeded);
            }
            taskDone();
        }
    }

    private void taskDone() {
        pendingLock.lock();
        try {
            if (pending > 0) {
                pending--;
            }
            if (pending == 0) {
                drained.signalAll();
            }
        } finally {
            pendingLock.unlock();
        }
    }

    private void releaseWaiters() {
        pendingLock.lock();
        try {
            pending = 0;
            drained.signalAll();
        } finally {
            pendingLock.unlock();
        }
    }
}
