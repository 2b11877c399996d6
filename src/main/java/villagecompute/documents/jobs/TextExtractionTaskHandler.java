/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.documents.jobs;

import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;
import villagecompute.documents.api.types.TextExtractionResultType.PageType;
import villagecompute.documents.api.types.TextExtractionResultType;
import villagecompute.documents.data.models.Document;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Extracts the text of a document and splits it across the document's pages.
 *
 * <p>
 * Words are distributed evenly: each page receives {@code ceil(words / pages)} words, so trailing pages may be empty
 * for short texts. Documents without a page count are treated as a single page.
 *
 * <p>
 * <b>Parameters:</b>
 * <ul>
 * <li>{@code includePages} (boolean, default true) - when false, the result carries the full text only</li>
 * </ul>
 */
@ApplicationScoped
public class TextExtractionTaskHandler implements TaskHandler {

    private static final Logger LOG = Logger.getLogger(TextExtractionTaskHandler.class);

    static final double CONFIDENCE = 0.95;
    static final String ENCODING = "UTF-8";

    @Override
    public TaskType handlesType() {
        return TaskType.TEXT_EXTRACTION;
    }

    @Override
    public TextExtractionResultType execute(Document document, Map<String, Object> parameters) {
        String text = document.getContent();
        if (text == null) {
            throw new IllegalStateException("Document " + document.getId() + " has no content to extract");
        }

        int pageCount = document.getPageCount() == null || document.getPageCount() < 1 ? 1 : document.getPageCount();
        boolean includePages = parameters == null || !Boolean.FALSE.equals(parameters.get("includePages"));
        List<PageType> pages = includePages ? splitIntoPages(text, pageCount) : List.of();

        LOG.debugf("Extracted %d characters across %d pages from document %s", text.length(), pageCount,
                document.getId());
        return new TextExtractionResultType(text, CONFIDENCE, pages, pageCount, document.getLanguage(), ENCODING,
                document.getFormat().getExtractionMethod());
    }

    static List<PageType> splitIntoPages(String text, int pageCount) {
        String[] words = text.isBlank() ? new String[0] : text.trim().split("\\s+");
        int wordsPerPage = Math.max(1, (int) Math.ceil(words.length / (double) pageCount));

        List<PageType> pages = new ArrayList<>(pageCount);
        for (int i = 0; i < pageCount; i++) {
            int start = Math.min(i * wordsPerPage, words.length);
            int end = Math.min(start + wordsPerPage, words.length);
            pages.add(new PageType(i + 1, String.join(" ", Arrays.copyOfRange(words, start, end))));
        }
        return pages;
    }
}
