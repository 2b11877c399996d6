/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.documents.services;

import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;
import villagecompute.documents.data.models.ProcessingTask;
import villagecompute.documents.data.models.TaskStatus;
import villagecompute.documents.jobs.TaskType;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Source of truth for every processing task ever submitted.
 *
 * <p>
 * Records are created in the pending state and never deleted. Every status change goes through
 * {@link #advance(ProcessingTask, TaskStatus, TaskStatus, Object, String, Long)}, which applies the state machine and
 * refreshes {@code updatedAt} atomically with {@code status}.
 */
@ApplicationScoped
public class TaskRecordStore {

    private static final Logger LOG = Logger.getLogger(TaskRecordStore.class);

    static final Comparator<ProcessingTask> MOST_RECENT_FIRST = Comparator
            .comparing(ProcessingTask::getCreatedAt).thenComparingLong(ProcessingTask::getSequence).reversed();

    private final Map<String, ProcessingTask> tasks = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    /**
     * Creates a pending task record. Callers are responsible for validating the document and priority first.
     *
     * @param documentId
     *            referenced document
     * @param type
     *            task type
     * @param parameters
     *            handler options, may be null
     * @param priority
     *            dispatch priority
     * @return the new record
     */
    public ProcessingTask create(String documentId, TaskType type, Map<String, Object> parameters, int priority) {
        String taskId = "task_" + UUID.randomUUID();
        ProcessingTask task = new ProcessingTask(taskId, documentId, type, parameters, priority,
                sequence.incrementAndGet(), Instant.now());
        tasks.put(taskId, task);
        LOG.debugf("Created task %s (type=%s, document=%s, priority=%d)", taskId, type.getKey(), documentId, priority);
        return task;
    }

    public Optional<ProcessingTask> findById(String taskId) {
        if (taskId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(tasks.get(taskId));
    }

    /**
     * Lists tasks, most recently created first.
     *
     * @param documentId
     *            restrict to tasks of this document, or null for all tasks
     * @return matching task records
     */
    public List<ProcessingTask> list(String documentId) {
        List<ProcessingTask> result = new ArrayList<>();
        for (ProcessingTask task : tasks.values()) {
            if (documentId == null || documentId.equals(task.getDocumentId())) {
                result.add(task);
            }
        }
        result.sort(MOST_RECENT_FIRST);
        return result;
    }

    public List<ProcessingTask> listAll() {
        return list(null);
    }

    public int size() {
        return tasks.size();
    }

    public long countByStatus(TaskStatus status) {
        return tasks.values().stream().filter(task -> task.getStatus() == status).count();
    }

    /**
     * Applies a status transition to a task.
     *
     * @return true if the task was in {@code expected} and moved to {@code next}
     */
    public boolean advance(ProcessingTask task, TaskStatus expected, TaskStatus next, Object result, String error,
            Long processingTimeMs) {
        boolean applied = task.advance(expected, next, result, error, processingTimeMs, Instant.now());
        if (applied) {
            LOG.debugf("Task %s: %s -> %s", task.getId(), expected.getKey(), next.getKey());
        } else {
            LOG.debugf("Task %s: rejected transition %s -> %s (current: %s)", task.getId(), expected.getKey(),
                    next.getKey(), task.getStatus().getKey());
        }
        return applied;
    }

    public boolean markProcessing(ProcessingTask task) {
        return advance(task, TaskStatus.PENDING, TaskStatus.PROCESSING, null, null, null);
    }

    public boolean markCompleted(ProcessingTask task, Object result, long processingTimeMs) {
        return advance(task, TaskStatus.PROCESSING, TaskStatus.COMPLETED, result, null, processingTimeMs);
    }

    public boolean markFailed(ProcessingTask task, TaskStatus expected, String error, Long processingTimeMs) {
        return advance(task, expected, TaskStatus.FAILED, null, error, processingTimeMs);
    }
}
