/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.documents.data.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed set of document formats accepted by the registry.
 */
public enum DocumentFormat {

    PDF("pdf", "PDF Parser"),

    DOCX("docx", "Office Parser"),

    XLSX("xlsx", "Spreadsheet Parser"),

    PPTX("pptx", "Presentation Parser"),

    TXT("txt", "Plain Text"),

    HTML("html", "HTML Parser"),

    CSV("csv", "CSV Parser"),

    JSON("json", "JSON Parser"),

    XML("xml", "XML Parser"),

    IMAGE("image", "OCR Engine");

    private final String key;
    private final String extractionMethod;

    DocumentFormat(String key, String extractionMethod) {
        this.key = key;
        this.extractionMethod = extractionMethod;
    }

    @JsonValue
    public String getKey() {
        return key;
    }

    /**
     * Returns the name of the extraction method reported by text extraction for this format.
     */
    public String getExtractionMethod() {
        return extractionMethod;
    }

    @JsonCreator
    public static DocumentFormat fromKey(String key) {
        if (key != null) {
            for (DocumentFormat format : values()) {
                if (format.key.equalsIgnoreCase(key) || format.name().equalsIgnoreCase(key)) {
                    return format;
                }
            }
        }
        throw new IllegalArgumentException("Unknown document format: " + key);
    }
}
