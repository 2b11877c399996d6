/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.documents.api.types;

/**
 * Point-in-time view of the scheduler backlog.
 *
 * @param activeTasks
 *            tasks in the processing state
 * @param queuedTasks
 *            tasks in the pending state
 * @param completedToday
 *            tasks completed since 00:00 UTC
 * @param failedToday
 *            tasks failed since 00:00 UTC
 * @param averageProcessingTime
 *            mean processing time in milliseconds over completed tasks
 * @param maxConcurrentTasks
 *            configured concurrency ceiling
 * @param availableSlots
 *            free execution slots right now
 */
public record QueueStatusType(long activeTasks, long queuedTasks, long completedToday, long failedToday,
        double averageProcessingTime, int maxConcurrentTasks, int availableSlots) {
}
