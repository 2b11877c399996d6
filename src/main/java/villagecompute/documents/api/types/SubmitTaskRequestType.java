/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.documents.api.types;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import villagecompute.documents.jobs.TaskType;

import java.util.Map;

/**
 * Request body for submitting a single processing task.
 *
 * @param documentId
 *            target document
 * @param type
 *            task type key (e.g. {@code text_extraction})
 * @param parameters
 *            handler options, optional
 * @param priority
 *            1-10, defaults to the configured default priority when omitted
 */
public record SubmitTaskRequestType(@NotBlank String documentId, @NotNull TaskType type,
        Map<String, Object> parameters, @Min(1) @Max(10) Integer priority) {
}
