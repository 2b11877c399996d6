/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.documents.api.types;

import java.util.List;

/**
 * Result of the text extraction handler.
 *
 * @param text
 *            full extracted text
 * @param confidence
 *            extraction confidence in [0, 1]
 * @param pages
 *            text split across the document's pages
 * @param totalPages
 *            number of pages
 * @param language
 *            document language
 * @param encoding
 *            character encoding of {@code text}
 * @param extractionMethod
 *            parser used for the document format
 */
public record TextExtractionResultType(String text, double confidence, List<PageType> pages, int totalPages,
        String language, String encoding, String extractionMethod) {

    /**
     * Text of a single page.
     *
     * @param pageNumber
     *            1-based page number
     * @param text
     *            page text
     */
    public record PageType(int pageNumber, String text) {
    }
}
