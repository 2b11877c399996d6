/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.documents.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.documents.api.types.BatchSubmissionType;
import villagecompute.documents.config.SchedulerConfig;
import villagecompute.documents.exceptions.DocumentNotFoundException;
import villagecompute.documents.exceptions.ValidationException;
import villagecompute.documents.jobs.TaskType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fans a set of task types out over a set of documents at the batch priority.
 *
 * <p>
 * Submission order is documents in the given order, and for each document the task types in the given order. An unknown
 * document is skipped and reported; the remaining documents are still submitted.
 */
@ApplicationScoped
public class BatchProcessingService {

    private static final Logger LOG = Logger.getLogger(BatchProcessingService.class);

    private final DocumentProcessingService processing;
    private final SchedulerConfig config;

    @Inject
    public BatchProcessingService(DocumentProcessingService processing, SchedulerConfig config) {
        this.processing = processing;
        this.config = config;
    }

    /**
     * Submits every task type for every document.
     *
     * @return task ids per submitted document id, in input order; skipped documents are absent
     * @throws ValidationException
     *             if either list is empty or holds a missing entry, or the batch exceeds the configured limit. Nothing
     *             is submitted in that case.
     */
    public Map<String, List<String>> processBatch(List<String> documentIds, List<TaskType> taskTypes,
            Map<String, Object> parameters) {
        return submit(documentIds, taskTypes, parameters).tasks();
    }

    /**
     * Same as {@link #processBatch(List, List, Map)}, also reporting skipped documents and the submitted task count.
     */
    public BatchSubmissionType submit(List<String> documentIds, List<TaskType> taskTypes,
            Map<String, Object> parameters) {
        if (documentIds == null || documentIds.isEmpty()) {
            throw new ValidationException("At least one document id is required");
        }
        if (taskTypes == null || taskTypes.isEmpty()) {
            throw new ValidationException("At least one task type is required");
        }
        if (documentIds.stream().anyMatch(id -> id == null || id.isBlank())) {
            throw new ValidationException("Document ids must not be blank");
        }
        if (taskTypes.contains(null)) {
            throw new ValidationException("Task types must not contain null");
        }
        if (documentIds.size() > config.getBatchLimit()) {
            throw new ValidationException("Batch of " + documentIds.size() + " documents exceeds limit of "
                    + config.getBatchLimit());
        }

        Map<String, List<String>> submitted = new LinkedHashMap<>();
        List<String> skipped = new ArrayList<>();
        int taskCount = 0;
        for (String documentId : documentIds) {
            if (submitted.containsKey(documentId) || skipped.contains(documentId)) {
                continue;
            }
            List<String> taskIds = new ArrayList<>();
            try {
                for (TaskType type : taskTypes) {
                    taskIds.add(processing.submitTask(documentId, type, parameters, config.getBatchPriority()));
                }
            } catch (DocumentNotFoundException e) {
                LOG.warnf("Skipping unknown document %s in batch", documentId);
                if (taskIds.isEmpty()) {
                    skipped.add(documentId);
                    continue;
                }
            }
            submitted.put(documentId, taskIds);
            taskCount += taskIds.size();
        }

        LOG.infof("Batch submitted %d tasks for %d documents (%d skipped)", taskCount, submitted.size(),
                skipped.size());
        return new BatchSubmissionType(submitted, taskCount, skipped);
    }
}
