/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.documents.api.types;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import villagecompute.documents.data.models.DocumentFormat;

import java.util.Map;

/**
 * Request body for uploading a document. Either {@code content} or {@code url} must be provided.
 *
 * @param name
 *            file name
 * @param format
 *            document format key (e.g. {@code pdf})
 * @param content
 *            inline text content
 * @param url
 *            source location for documents uploaded by reference
 * @param pageCount
 *            page count if the caller knows it
 * @param metadata
 *            free-form caller metadata
 */
public record UploadDocumentRequestType(@NotBlank String name, @NotNull DocumentFormat format, String content,
        String url, @Positive Integer pageCount, Map<String, Object> metadata) {
}
