/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.documents.services;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.documents.config.SchedulerConfig;
import villagecompute.documents.data.models.ProcessingTask;
import villagecompute.documents.data.models.TaskStatus;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Dispatches pending tasks from the {@link TaskPriorityQueue} to a bounded worker pool.
 *
 * <p>
 * <b>Guarantees:</b>
 * <ul>
 * <li>At most {@code maxConcurrentTasks} tasks are processing at any instant. A slot is a {@link Semaphore} permit held
 * from the pending → processing transition until the task reaches a terminal state.</li>
 * <li>Higher priority first, FIFO within a priority.</li>
 * <li>Every dispatch request is honoured. Concurrent requests collapse into one drain loop that re-runs until no
 * request arrived while it was running, so a submission or a slot release is never lost.</li>
 * <li>A task that is no longer pending when popped (cancelled, or failed by a document delete) is skipped.</li>
 * </ul>
 */
@ApplicationScoped
public class TaskScheduler {

    private static final Logger LOG = Logger.getLogger(TaskScheduler.class);

    private final TaskRecordStore store;
    private final TaskPriorityQueue queue;
    private final TaskExecutor executor;
    private final int maxConcurrentTasks;
    private final int shutdownTimeoutSeconds;

    private final Semaphore slots;
    private final ExecutorService workers;
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
    private final AtomicInteger dispatchRequests = new AtomicInteger();

    @Inject
    public TaskScheduler(TaskRecordStore store, TaskPriorityQueue queue, TaskExecutor executor,
            SchedulerConfig config) {
        this(store, queue, executor, config.getMaxConcurrentTasks(), config.getShutdownTimeoutSeconds());
    }

    public TaskScheduler(TaskRecordStore store, TaskPriorityQueue queue, TaskExecutor executor,
            int maxConcurrentTasks, int shutdownTimeoutSeconds) {
        if (maxConcurrentTasks < 1) {
            throw new IllegalArgumentException("maxConcurrentTasks must be at least 1");
        }
        this.store = store;
        this.queue = queue;
        this.executor = executor;
        this.maxConcurrentTasks = maxConcurrentTasks;
        this.shutdownTimeoutSeconds = shutdownTimeoutSeconds;
        this.slots = new Semaphore(maxConcurrentTasks);
        this.workers = Executors.newFixedThreadPool(maxConcurrentTasks, new WorkerThreadFactory());
        LOG.infof("Task scheduler started with %d worker slots", maxConcurrentTasks);
    }

    /**
     * Queues a pending task and triggers dispatch.
     *
     * @param task
     *            a freshly created pending task
     */
    public void enqueue(ProcessingTask task) {
        if (queue.push(task.getId(), task.getPriority())) {
            LOG.debugf("Queued task %s (priority=%d, queue depth=%d)", task.getId(), task.getPriority(),
                    queue.size());
        }
        requestDispatch();
    }

    /**
     * Removes a task from the queue without touching its record.
     *
     * @return true if the task was queued
     */
    public boolean removeQueued(String taskId) {
        return queue.remove(taskId);
    }

    /**
     * Requests a dispatch cycle. Safe to call from any thread; only one cycle runs at a time.
     */
    public void requestDispatch() {
        if (dispatchRequests.getAndIncrement() != 0) {
            return;
        }
        int missed = 1;
        do {
            runDispatchCycle();
            missed = dispatchRequests.addAndGet(-missed);
        } while (missed != 0);
    }

    private void runDispatchCycle() {
        while (!queue.isEmpty() && slots.tryAcquire()) {
            Optional<String> next = queue.pop();
            if (next.isEmpty()) {
                slots.release();
                return;
            }
            String taskId = next.get();
            Optional<ProcessingTask> task = store.findById(taskId);
            if (task.isEmpty() || !store.markProcessing(task.get())) {
                LOG.debugf("Skipping task %s: no longer pending", taskId);
                slots.release();
                continue;
            }
            dispatch(task.get());
        }
    }

    private void dispatch(ProcessingTask task) {
        inFlight.add(task.getId());
        try {
            workers.execute(() -> runTask(task));
        } catch (RejectedExecutionException e) {
            inFlight.remove(task.getId());
            store.markFailed(task, TaskStatus.PROCESSING, "Scheduler is shutting down", null);
            slots.release();
            LOG.warnf("Rejected task %s: scheduler is shutting down", task.getId());
        }
    }

    private void runTask(ProcessingTask task) {
        try {
            executor.execute(task);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Unexpected error executing task %s", task.getId());
            store.markFailed(task, TaskStatus.PROCESSING, TaskExecutor.messageOf(e), null);
        } finally {
            inFlight.remove(task.getId());
            slots.release();
            if (!queue.isEmpty()) {
                requestDispatch();
            }
        }
    }

    public int getMaxConcurrentTasks() {
        return maxConcurrentTasks;
    }

    public int getInFlightCount() {
        return inFlight.size();
    }

    public int getAvailableSlots() {
        return slots.availablePermits();
    }

    public int getQueueDepth() {
        return queue.size();
    }

    @PreDestroy
    void shutdown() {
        LOG.infof("Shutting down task scheduler (%d in flight, %d queued)", inFlight.size(), queue.size());
        workers.shutdown();
        try {
            if (!workers.awaitTermination(shutdownTimeoutSeconds, TimeUnit.SECONDS)) {
                LOG.warnf("Task workers did not finish within %d seconds, interrupting", shutdownTimeoutSeconds);
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "document-task-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
