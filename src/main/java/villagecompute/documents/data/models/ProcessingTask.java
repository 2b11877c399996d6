/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.documents.data.models;

import villagecompute.documents.jobs.TaskType;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A request to run one analysis operation against one document.
 *
 * <p>
 * Identity, target and options are immutable. Lifecycle fields ({@code status}, {@code result}, {@code error},
 * {@code processingTimeMs}, {@code updatedAt}) only change through {@link #advance}, which applies them together under
 * the task's monitor. Readers that need a consistent view take it through
 * {@link villagecompute.documents.api.types.ProcessingTaskType#fromEntity(ProcessingTask)}.
 *
 * <p>
 * Records are owned by {@link villagecompute.documents.services.TaskRecordStore} and are never deleted by normal
 * operation.
 */
public class ProcessingTask {

    private final String id;
    private final String documentId;
    private final TaskType type;
    private final Map<String, Object> parameters;
    private final int priority;
    private final long sequence;
    private final Instant createdAt;

    private TaskStatus status;
    private Object result;
    private String error;
    private Long processingTimeMs;
    private Instant updatedAt;

    public ProcessingTask(String id, String documentId, TaskType type, Map<String, Object> parameters, int priority,
            long sequence, Instant createdAt) {
        this.id = id;
        this.documentId = documentId;
        this.type = type;
        this.parameters = parameters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        this.priority = priority;
        this.sequence = sequence;
        this.createdAt = createdAt;
        this.status = TaskStatus.PENDING;
        this.updatedAt = createdAt;
    }

    /**
     * Moves the task to {@code next} if it is currently in {@code expected} and the state machine allows it.
     *
     * <p>
     * {@code status} and {@code updatedAt} are written together; the payload fields are written only for the states
     * they belong to ({@code result} for completed, {@code error} for failed).
     *
     * @param expected
     *            state the caller believes the task is in
     * @param next
     *            target state
     * @param result
     *            handler payload, kept only when {@code next} is completed
     * @param error
     *            failure reason, kept only when {@code next} is failed
     * @param processingTimeMs
     *            execution duration, or null when the task never ran
     * @param now
     *            transition timestamp
     * @return true if the transition was applied
     */
    public synchronized boolean advance(TaskStatus expected, TaskStatus next, Object result, String error,
            Long processingTimeMs, Instant now) {
        if (status != expected || !status.canTransitionTo(next)) {
            return false;
        }
        status = next;
        if (next == TaskStatus.COMPLETED) {
            this.result = result;
        }
        if (next == TaskStatus.FAILED) {
            this.error = error;
        }
        if (processingTimeMs != null) {
            this.processingTimeMs = processingTimeMs;
        }
        updatedAt = now;
        return true;
    }

    public String getId() {
        return id;
    }

    public String getDocumentId() {
        return documentId;
    }

    public TaskType getType() {
        return type;
    }

    public Map<String, Object> getParameters() {
        return parameters;
    }

    public int getPriority() {
        return priority;
    }

    /**
     * Submission order, used to break ties between records created in the same millisecond.
     */
    public long getSequence() {
        return sequence;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public synchronized TaskStatus getStatus() {
        return status;
    }

    public synchronized Object getResult() {
        return result;
    }

    public synchronized String getError() {
        return error;
    }

    public synchronized Long getProcessingTimeMs() {
        return processingTimeMs;
    }

    public synchronized Instant getUpdatedAt() {
        return updatedAt;
    }
}
