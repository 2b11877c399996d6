/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.documents.data.models;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Uploaded document held by the in-memory document registry.
 *
 * <p>
 * Descriptive attributes are fixed at upload time. The only field that changes afterwards is {@link #getProcessedAt()},
 * which the task executor sets the first time a task against this document completes successfully. Once set it is
 * never cleared.
 *
 * @see villagecompute.documents.services.DocumentRegistry
 */
public class Document {

    private final String id;
    private final String name;
    private final DocumentFormat format;
    private final long sizeBytes;
    private final Integer pageCount;
    private final String language;
    private final String sourceUrl;
    private final String content;
    private final Map<String, Object> metadata;
    private final Instant createdAt;

    private volatile Instant processedAt;

    public Document(String id, String name, DocumentFormat format, long sizeBytes, Integer pageCount, String language,
            String sourceUrl, String content, Map<String, Object> metadata, Instant createdAt) {
        this.id = id;
        this.name = name;
        this.format = format;
        this.sizeBytes = sizeBytes;
        this.pageCount = pageCount;
        this.language = language;
        this.sourceUrl = sourceUrl;
        this.content = content;
        this.metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        this.createdAt = createdAt;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public DocumentFormat getFormat() {
        return format;
    }

    public long getSizeBytes() {
        return sizeBytes;
    }

    public Integer getPageCount() {
        return pageCount;
    }

    public String getLanguage() {
        return language;
    }

    public String getSourceUrl() {
        return sourceUrl;
    }

    public String getContent() {
        return content;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getProcessedAt() {
        return processedAt;
    }

    public boolean isProcessed() {
        return processedAt != null;
    }

    /**
     * Records the first successful processing of this document.
     *
     * @param when
     *            completion timestamp
     * @return true if this call set the timestamp, false if it was already set
     */
    public synchronized boolean markProcessed(Instant when) {
        if (processedAt != null) {
            return false;
        }
        processedAt = when;
        return true;
    }
}
