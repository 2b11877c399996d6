/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.documents.api.types;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import villagecompute.documents.jobs.TaskType;

import java.util.List;
import java.util.Map;

/**
 * Request body for batch submission of every (document, task type) pair.
 *
 * @param documentIds
 *            documents to process, in order
 * @param taskTypes
 *            task types to run against each document, in order
 * @param parameters
 *            options shared by every submitted task
 */
public record BatchProcessRequestType(@NotEmpty List<@NotBlank String> documentIds,
        @NotEmpty List<@NotNull TaskType> taskTypes,
        Map<String, Object> parameters) {
}
