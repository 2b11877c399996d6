/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.documents.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.documents.api.types.CapabilitiesType;
import villagecompute.documents.api.types.FeatureUsageType;
import villagecompute.documents.api.types.ProcessingAnalyticsType;
import villagecompute.documents.api.types.ProcessingTaskType;
import villagecompute.documents.api.types.QueueStatusType;
import villagecompute.documents.api.types.TaskCapabilityType;
import villagecompute.documents.config.SchedulerConfig;
import villagecompute.documents.data.models.Document;
import villagecompute.documents.data.models.DocumentFormat;
import villagecompute.documents.data.models.TaskStatus;
import villagecompute.documents.jobs.TaskType;
import villagecompute.documents.util.LanguageDetector;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only views over documents and task records: the analytics summary, live queue status and service capabilities.
 *
 * <p>
 * Each call works on a snapshot of every task taken at call time, so a task changing state mid-computation is counted
 * once, in one state.
 */
@ApplicationScoped
public class ProcessingAnalyticsService {

    static final int POPULAR_FEATURES_LIMIT = 10;

    private final DocumentRegistry documents;
    private final TaskRecordStore store;
    private final TaskScheduler scheduler;
    private final TaskHandlerRegistry handlers;
    private final SchedulerConfig config;

    @Inject
    public ProcessingAnalyticsService(DocumentRegistry documents, TaskRecordStore store, TaskScheduler scheduler,
            TaskHandlerRegistry handlers, SchedulerConfig config) {
        this.documents = documents;
        this.store = store;
        this.scheduler = scheduler;
        this.handlers = handlers;
        this.config = config;
    }

    /**
     * Summarizes all documents and tasks.
     *
     * <p>
     * The average processing time covers completed tasks that recorded a processing time. The success rate is completed
     * tasks over all tasks. Both are 0 when there is nothing to measure.
     */
    public ProcessingAnalyticsType getSummary() {
        List<Document> allDocuments = documents.listAll();
        Map<String, Long> documentsByType = new LinkedHashMap<>();
        for (Document document : allDocuments) {
            documentsByType.merge(document.getFormat().getKey(), 1L, Long::sum);
        }

        List<ProcessingTaskType> tasks = snapshotTasks();
        Map<String, Long> tasksByType = new LinkedHashMap<>();
        Map<String, Long> tasksByStatus = new LinkedHashMap<>();
        for (ProcessingTaskType task : tasks) {
            tasksByType.merge(task.type().getKey(), 1L, Long::sum);
            tasksByStatus.merge(task.status().getKey(), 1L, Long::sum);
        }

        long completed = tasksByStatus.getOrDefault(TaskStatus.COMPLETED.getKey(), 0L);
        double successRate = tasks.isEmpty() ? 0.0 : (double) completed / tasks.size();

        List<FeatureUsageType> popularFeatures = new ArrayList<>();
        for (Map.Entry<String, Long> entry : tasksByType.entrySet()) {
            popularFeatures.add(new FeatureUsageType(entry.getKey(), entry.getValue()));
        }
        popularFeatures.sort(Comparator.comparingLong(FeatureUsageType::usage).reversed());
        if (popularFeatures.size() > POPULAR_FEATURES_LIMIT) {
            popularFeatures = new ArrayList<>(popularFeatures.subList(0, POPULAR_FEATURES_LIMIT));
        }

        return new ProcessingAnalyticsType(allDocuments.size(), documentsByType, tasks.size(), tasksByType,
                tasksByStatus, averageProcessingTime(tasks), successRate, popularFeatures);
    }

    /**
     * Live scheduler view. "Today" starts at 00:00 UTC and is matched against each task's last transition.
     */
    public QueueStatusType getQueueStatus() {
        Instant startOfDay = LocalDate.now(ZoneOffset.UTC).atStartOfDay(ZoneOffset.UTC).toInstant();
        List<ProcessingTaskType> tasks = snapshotTasks();

        long active = 0;
        long completedToday = 0;
        long failedToday = 0;
        for (ProcessingTaskType task : tasks) {
            if (task.status() == TaskStatus.PROCESSING) {
                active++;
            } else if (!task.updatedAt().isBefore(startOfDay)) {
                if (task.status() == TaskStatus.COMPLETED) {
                    completedToday++;
                } else if (task.status() == TaskStatus.FAILED) {
                    failedToday++;
                }
            }
        }

        return new QueueStatusType(active, scheduler.getQueueDepth(), completedToday, failedToday,
                averageProcessingTime(tasks), scheduler.getMaxConcurrentTasks(), scheduler.getAvailableSlots());
    }

    public CapabilitiesType getCapabilities() {
        List<String> formats = Arrays.stream(DocumentFormat.values()).map(DocumentFormat::getKey).toList();
        List<TaskCapabilityType> taskTypes = Arrays.stream(TaskType.values())
                .map(type -> new TaskCapabilityType(type.getKey(), type.getDescription(),
                        handlers.isRegistered(type)))
                .toList();
        return new CapabilitiesType(formats, taskTypes, LanguageDetector.SUPPORTED_LANGUAGES,
                config.getMaxFileSizeBytes(), config.getBatchLimit());
    }

    private List<ProcessingTaskType> snapshotTasks() {
        return store.listAll().stream().map(ProcessingTaskType::fromEntity).toList();
    }

    private static double averageProcessingTime(List<ProcessingTaskType> tasks) {
        long total = 0;
        int measured = 0;
        for (ProcessingTaskType task : tasks) {
            if (task.status() == TaskStatus.COMPLETED && task.processingTime() != null) {
                total += task.processingTime();
                measured++;
            }
        }
        return measured == 0 ? 0.0 : (double) total / measured;
    }
}
