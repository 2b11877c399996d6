/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.documents.api.types;

import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.constraints.NotNull;
import villagecompute.documents.data.models.Document;
import villagecompute.documents.data.models.DocumentFormat;

import java.time.Instant;
import java.util.Map;

/**
 * API type representing an uploaded document. Content is omitted; only descriptive attributes are exposed.
 *
 * @param id
 *            document identifier
 * @param name
 *            original file name
 * @param format
 *            document format
 * @param sizeBytes
 *            payload size
 * @param pageCount
 *            page count, when known or estimated
 * @param language
 *            detected ISO 639-1 language code
 * @param sourceUrl
 *            source location, when uploaded by reference
 * @param metadata
 *            caller metadata enriched with word/character counts
 * @param createdAt
 *            upload timestamp
 * @param processedAt
 *            first successful processing, null until then
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DocumentType(@NotNull String id, @NotNull String name, @NotNull DocumentFormat format, long sizeBytes,
        Integer pageCount, @NotNull String language, String sourceUrl, @NotNull Map<String, Object> metadata,
        @NotNull Instant createdAt, Instant processedAt) {

    public static DocumentType fromEntity(Document document) {
        return new DocumentType(document.getId(), document.getName(), document.getFormat(), document.getSizeBytes(),
                document.getPageCount(), document.getLanguage(), document.getSourceUrl(), document.getMetadata(),
                document.getCreatedAt(), document.getProcessedAt());
    }
}
