/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.documents.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.documents.api.types.UploadDocumentRequestType;
import villagecompute.documents.config.SchedulerConfig;
import villagecompute.documents.data.models.Document;
import villagecompute.documents.data.models.DocumentFormat;
import villagecompute.documents.exceptions.ValidationException;
import villagecompute.documents.util.LanguageDetector;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory registry of uploaded documents.
 *
 * <p>
 * Uploads are enriched before they are stored:
 * <ul>
 * <li>language detected from the content (defaults to {@code en})</li>
 * <li>page count estimated for PDFs at one page per 2000 characters when the caller did not supply one</li>
 * <li>metadata extended with {@code wordCount}, {@code characterCount} and {@code estimatedReadingTime} (minutes at
 * 200 words per minute)</li>
 * </ul>
 *
 * <p>
 * Deleting a document here only removes it from the registry. Failing the document's pending tasks is the job of
 * {@link DocumentProcessingService#deleteDocument(String)}, which callers should use instead.
 */
@ApplicationScoped
public class DocumentRegistry implements DocumentLookup {

    private static final Logger LOG = Logger.getLogger(DocumentRegistry.class);

    static final int CHARACTERS_PER_PAGE = 2000;
    static final int WORDS_PER_MINUTE = 200;

    private final Map<String, Document> documents = new ConcurrentHashMap<>();

    private final SchedulerConfig config;

    @Inject
    public DocumentRegistry(SchedulerConfig config) {
        this.config = config;
    }

    /**
     * Validates, enriches and stores a new document.
     *
     * @param request
     *            upload payload
     * @return the stored document
     * @throws ValidationException
     *             if the name or format is missing, neither content nor url is given, or the payload exceeds the
     *             configured size limit
     */
    public Document upload(UploadDocumentRequestType request) {
        if (request == null || request.name() == null || request.name().isBlank()) {
            throw new ValidationException("Document name is required");
        }
        if (request.format() == null) {
            throw new ValidationException("Document format is required");
        }
        String content = request.content();
        if ((content == null || content.isEmpty()) && (request.url() == null || request.url().isBlank())) {
            throw new ValidationException("Either content or url must be provided");
        }

        long sizeBytes = content == null ? 0L : content.getBytes(StandardCharsets.UTF_8).length;
        if (sizeBytes > config.getMaxFileSizeBytes()) {
            throw new ValidationException("Document size " + sizeBytes + " exceeds limit of "
                    + config.getMaxFileSizeBytes() + " bytes");
        }

        Integer pageCount = request.pageCount();
        if (pageCount == null && request.format() == DocumentFormat.PDF && content != null) {
            pageCount = Math.max(1, (int) Math.ceil(content.length() / (double) CHARACTERS_PER_PAGE));
        }

        int wordCount = LanguageDetector.countWords(content);
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (request.metadata() != null) {
            metadata.putAll(request.metadata());
        }
        metadata.put("wordCount", wordCount);
        metadata.put("characterCount", content == null ? 0 : content.length());
        metadata.put("estimatedReadingTime", (int) Math.ceil(wordCount / (double) WORDS_PER_MINUTE));

        String documentId = "doc_" + UUID.randomUUID();
        Document document = new Document(documentId, request.name().trim(), request.format(), sizeBytes, pageCount,
                LanguageDetector.detect(content), request.url(), content, metadata, Instant.now());
        documents.put(documentId, document);

        LOG.infof("Registered document %s (name=%s, format=%s, size=%d bytes, language=%s)", documentId,
                document.getName(), document.getFormat().getKey(), sizeBytes, document.getLanguage());
        return document;
    }

    @Override
    public Optional<Document> findById(String documentId) {
        if (documentId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(documents.get(documentId));
    }

    /**
     * Lists documents, most recently uploaded first.
     *
     * @param format
     *            only documents of this format, or null for all
     * @param language
     *            only documents in this language, or null for all
     * @param processed
     *            only processed (true) or unprocessed (false) documents, or null for all
     * @return matching documents
     */
    public List<Document> list(DocumentFormat format, String language, Boolean processed) {
        List<Document> result = new ArrayList<>();
        for (Document document : documents.values()) {
            if (format != null && document.getFormat() != format) {
                continue;
            }
            if (language != null && !language.equalsIgnoreCase(document.getLanguage())) {
                continue;
            }
            if (processed != null && document.isProcessed() != processed) {
                continue;
            }
            result.add(document);
        }
        result.sort(Comparator.comparing(Document::getCreatedAt).reversed());
        return result;
    }

    public List<Document> listAll() {
        return list(null, null, null);
    }

    /**
     * Removes a document from the registry.
     *
     * @param documentId
     *            document identifier
     * @return true if the document existed
     */
    public boolean remove(String documentId) {
        Document removed = documentId == null ? null : documents.remove(documentId);
        if (removed == null) {
            return false;
        }
        LOG.infof("Removed document %s", documentId);
        return true;
    }

    public int size() {
        return documents.size();
    }
}
