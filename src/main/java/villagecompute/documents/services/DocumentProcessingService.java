/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.documents.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.documents.api.types.ProcessingTaskType;
import villagecompute.documents.api.types.TaskResultType;
import villagecompute.documents.config.SchedulerConfig;
import villagecompute.documents.data.models.ProcessingTask;
import villagecompute.documents.data.models.TaskStatus;
import villagecompute.documents.exceptions.DocumentNotFoundException;
import villagecompute.documents.exceptions.ResourceNotFoundException;
import villagecompute.documents.exceptions.ValidationException;
import villagecompute.documents.jobs.TaskType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point for submitting, querying and cancelling processing tasks.
 *
 * <p>
 * Submission validates synchronously and never creates a record for an unknown document. Everything after submission
 * (dispatch, execution, outcome) is asynchronous; callers observe progress by polling {@link #getTask(String)}.
 */
@ApplicationScoped
public class DocumentProcessingService {

    private static final Logger LOG = Logger.getLogger(DocumentProcessingService.class);

    static final String CANCELLED_BY_USER = "cancelled by user";
    static final String DOCUMENT_DELETED = "document deleted";

    private final DocumentRegistry documents;
    private final TaskRecordStore store;
    private final TaskScheduler scheduler;
    private final SchedulerConfig config;

    @Inject
    public DocumentProcessingService(DocumentRegistry documents, TaskRecordStore store, TaskScheduler scheduler,
            SchedulerConfig config) {
        this.documents = documents;
        this.store = store;
        this.scheduler = scheduler;
        this.config = config;
    }

    /**
     * Submits a task at the configured default priority.
     */
    public String submitTask(String documentId, TaskType type, Map<String, Object> parameters) {
        return submitTask(documentId, type, parameters, null);
    }

    /**
     * Creates a pending task and queues it for dispatch.
     *
     * @param documentId
     *            document to process
     * @param type
     *            task type, need not have a registered handler
     * @param parameters
     *            handler options, may be null
     * @param priority
     *            1 to 10, higher runs first; null for the default priority
     * @return the new task id
     * @throws DocumentNotFoundException
     *             if the document does not exist
     * @throws ValidationException
     *             if the type is missing or the priority is out of range
     */
    public String submitTask(String documentId, TaskType type, Map<String, Object> parameters, Integer priority) {
        if (type == null) {
            throw new ValidationException("Task type is required");
        }
        int effectivePriority = priority == null ? config.getDefaultPriority() : priority;
        if (!SchedulerConfig.isValidPriority(effectivePriority)) {
            throw new ValidationException("Priority must be between " + SchedulerConfig.MIN_PRIORITY + " and "
                    + SchedulerConfig.MAX_PRIORITY + " but was " + effectivePriority);
        }
        if (documents.findById(documentId).isEmpty()) {
            throw new DocumentNotFoundException(documentId);
        }

        ProcessingTask task = store.create(documentId, type, parameters, effectivePriority);
        LOG.infof("Submitted task %s (type=%s, document=%s, priority=%d)", task.getId(), type.getKey(), documentId,
                effectivePriority);
        scheduler.enqueue(task);
        return task.getId();
    }

    public Optional<ProcessingTaskType> getTask(String taskId) {
        return store.findById(taskId).map(ProcessingTaskType::fromEntity);
    }

    /**
     * @throws ResourceNotFoundException
     *             if no task has this id
     */
    public ProcessingTaskType requireTask(String taskId) {
        return getTask(taskId).orElseThrow(() -> new ResourceNotFoundException("Task " + taskId + " not found"));
    }

    /**
     * Lists tasks, most recently created first.
     *
     * @param documentId
     *            restrict to this document, or null for all tasks
     */
    public List<ProcessingTaskType> listTasks(String documentId) {
        return store.list(documentId).stream().map(ProcessingTaskType::fromEntity).toList();
    }

    /**
     * Cancels a pending task.
     *
     * @return true if the task was pending and is now failed; false if it is unknown or already past pending
     */
    public boolean cancelTask(String taskId) {
        Optional<ProcessingTask> task = store.findById(taskId);
        if (task.isEmpty()) {
            return false;
        }
        if (!store.markFailed(task.get(), TaskStatus.PENDING, CANCELLED_BY_USER, null)) {
            LOG.debugf("Cancel of task %s rejected (status: %s)", taskId, task.get().getStatus().getKey());
            return false;
        }
        scheduler.removeQueued(taskId);
        LOG.infof("Cancelled task %s", taskId);
        return true;
    }

    /**
     * Removes a document and fails its pending tasks.
     *
     * @return true if the document existed
     */
    public boolean deleteDocument(String documentId) {
        if (!documents.remove(documentId)) {
            return false;
        }
        onDocumentDeleted(documentId);
        return true;
    }

    /**
     * Fails every pending task of a deleted document. Processing and terminal tasks are left alone.
     *
     * @return number of tasks failed
     */
    public int onDocumentDeleted(String documentId) {
        int failed = 0;
        for (ProcessingTask task : store.list(documentId)) {
            if (store.markFailed(task, TaskStatus.PENDING, DOCUMENT_DELETED, null)) {
                scheduler.removeQueued(task.getId());
                failed++;
            }
        }
        if (failed > 0) {
            LOG.infof("Failed %d pending tasks of deleted document %s", failed, documentId);
        }
        return failed;
    }

    /**
     * Results of completed tasks, selected by task id or by document id.
     *
     * @throws ValidationException
     *             if neither id is given
     */
    public List<TaskResultType> getResults(String taskId, String documentId) {
        List<ProcessingTask> candidates = new ArrayList<>();
        if (taskId != null && !taskId.isBlank()) {
            store.findById(taskId).ifPresent(candidates::add);
        } else if (documentId != null && !documentId.isBlank()) {
            candidates.addAll(store.list(documentId));
        } else {
            throw new ValidationException("Either taskId or documentId is required");
        }

        List<TaskResultType> results = new ArrayList<>();
        for (ProcessingTask task : candidates) {
            ProcessingTaskType snapshot = ProcessingTaskType.fromEntity(task);
            if (snapshot.status() == TaskStatus.COMPLETED) {
                results.add(new TaskResultType(snapshot.id(), snapshot.type(), snapshot.result()));
            }
        }
        return results;
    }
}
