/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.documents.api.types;

import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.constraints.NotNull;
import villagecompute.documents.data.models.ProcessingTask;
import villagecompute.documents.data.models.TaskStatus;
import villagecompute.documents.jobs.TaskType;

import java.time.Instant;
import java.util.Map;

/**
 * Immutable snapshot of a processing task as returned to API consumers.
 *
 * <p>
 * Snapshots are taken under the task's monitor so {@code status}, {@code updatedAt} and the payload fields always come
 * from the same transition.
 *
 * @param id
 *            task identifier
 * @param documentId
 *            referenced document
 * @param type
 *            analysis kind
 * @param parameters
 *            options passed verbatim to the handler
 * @param priority
 *            dispatch priority (1-10, higher first)
 * @param status
 *            lifecycle state
 * @param result
 *            handler payload, present only when completed
 * @param error
 *            failure reason, present only when failed
 * @param processingTime
 *            execution duration in milliseconds, present once the task left the processing state
 * @param createdAt
 *            submission timestamp
 * @param updatedAt
 *            timestamp of the last status transition
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProcessingTaskType(@NotNull String id, @NotNull String documentId, @NotNull TaskType type,
        @NotNull Map<String, Object> parameters, int priority, @NotNull TaskStatus status, Object result, String error,
        Long processingTime, @NotNull Instant createdAt, @NotNull Instant updatedAt) {

    /**
     * Creates a consistent snapshot of a task record.
     *
     * @param task
     *            the live task record
     * @return API type instance
     */
    public static ProcessingTaskType fromEntity(ProcessingTask task) {
        synchronized (task) {
            return new ProcessingTaskType(task.getId(), task.getDocumentId(), task.getType(), task.getParameters(),
                    task.getPriority(), task.getStatus(), task.getResult(), task.getError(),
                    task.getProcessingTimeMs(), task.getCreatedAt(), task.getUpdatedAt());
        }
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }
}
