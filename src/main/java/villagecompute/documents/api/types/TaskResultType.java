/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.documents.api.types;

import villagecompute.documents.jobs.TaskType;

/**
 * Result payload of a completed task.
 *
 * @param taskId
 *            task identifier
 * @param type
 *            task type
 * @param result
 *            handler payload
 */
public record TaskResultType(String taskId, TaskType type, Object result) {
}
