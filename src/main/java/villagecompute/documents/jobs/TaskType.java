/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.documents.jobs;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Enumeration of all document analysis task types.
 *
 * <p>
 * The scheduler treats each value as an opaque dispatch key: it never inspects what a handler does, it only looks up
 * the {@link TaskHandler} registered for the key. Handler implementations must return their type from
 * {@link TaskHandler#handlesType()} for CDI discovery.
 *
 * <p>
 * On the wire each type is represented by its snake_case key (e.g. {@code text_extraction}).
 *
 * @see TaskHandler for handler contract
 */
public enum TaskType {

    // ========== EXTRACTION ==========

    /**
     * Extracts plain text from the document, split into pages.
     * <p>
     * <b>Handler:</b> TextExtractionTaskHandler
     */
    TEXT_EXTRACTION("text_extraction", "Text extraction"),

    /**
     * Extracts named entities (people, organizations, dates, amounts).
     */
    ENTITY_EXTRACTION("entity_extraction", "Entity extraction"),

    /**
     * Extracts structured key/value data according to a caller-supplied schema.
     */
    DATA_EXTRACTION("data_extraction", "Structured data extraction"),

    /**
     * Extracts tables with headers and rows.
     */
    TABLE_EXTRACTION("table_extraction", "Table extraction"),

    // ========== UNDERSTANDING ==========

    CLASSIFICATION("classification", "Document classification"),

    SUMMARIZATION("summarization", "Summarization"),

    TRANSLATION("translation", "Translation"),

    SENTIMENT_ANALYSIS("sentiment_analysis", "Sentiment analysis"),

    // ========== LEGAL / COMPLIANCE ==========

    /**
     * Identifies contract parties, clauses, obligations and risks.
     */
    CONTRACT_ANALYSIS("contract_analysis", "Contract analysis"),

    /**
     * Checks the document against regulatory frameworks passed in the task parameters.
     */
    COMPLIANCE_CHECK("compliance_check", "Compliance check"),

    SIGNATURE_DETECTION("signature_detection", "Signature detection"),

    // ========== VISUAL / QUALITY ==========

    IMAGE_ANALYSIS("image_analysis", "Image analysis"),

    QUALITY_ASSESSMENT("quality_assessment", "Quality assessment");

    private final String key;
    private final String description;

    TaskType(String key, String description) {
        this.key = key;
        this.description = description;
    }

    /**
     * Returns the snake_case wire key.
     */
    @JsonValue
    public String getKey() {
        return key;
    }

    /**
     * Returns a human-readable description.
     */
    public String getDescription() {
        return description;
    }

    /**
     * Resolves a wire key (or enum constant name) to a task type.
     *
     * @param key
     *            snake_case key such as {@code text_extraction}; case-insensitive
     * @return the matching task type
     * @throws IllegalArgumentException
     *             if the key matches no task type
     */
    @JsonCreator
    public static TaskType fromKey(String key) {
        if (key != null) {
            for (TaskType type : values()) {
                if (type.key.equalsIgnoreCase(key) || type.name().equalsIgnoreCase(key)) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown task type: " + key);
    }
}
