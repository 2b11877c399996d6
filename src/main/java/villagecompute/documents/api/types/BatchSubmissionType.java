/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.documents.api.types;

import java.util.List;
import java.util.Map;

/**
 * Outcome of a batch submission.
 *
 * @param tasks
 *            document id to submitted task ids, in submission order
 * @param submittedTasks
 *            total number of tasks created
 * @param skippedDocuments
 *            requested document ids that were not found and therefore have no entry in {@code tasks}
 */
public record BatchSubmissionType(Map<String, List<String>> tasks, int submittedTasks, List<String> skippedDocuments) {
}
