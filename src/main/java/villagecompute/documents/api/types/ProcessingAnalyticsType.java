/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.documents.api.types;

import java.util.List;
import java.util.Map;

/**
 * Read-only rollup over all documents and task records.
 *
 * @param totalDocuments
 *            documents currently in the registry
 * @param documentsByType
 *            document count per format key
 * @param totalTasks
 *            task records ever created
 * @param tasksByType
 *            task count per task type key
 * @param tasksByStatus
 *            task count per status key
 * @param averageProcessingTime
 *            mean processing time in milliseconds over completed tasks; 0 when none
 * @param successRate
 *            completed / total tasks in [0, 1]; 0 when there are no tasks
 * @param popularFeatures
 *            task types by usage, descending, at most 10
 */
public record ProcessingAnalyticsType(long totalDocuments, Map<String, Long> documentsByType, long totalTasks,
        Map<String, Long> tasksByType, Map<String, Long> tasksByStatus, double averageProcessingTime,
        double successRate, List<FeatureUsageType> popularFeatures) {
}
