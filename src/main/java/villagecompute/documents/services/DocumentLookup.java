/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.documents.services;

import villagecompute.documents.data.models.Document;

import java.util.Optional;

/**
 * Read access to documents, as consumed by task submission and execution.
 *
 * @see DocumentRegistry for the in-memory implementation
 */
public interface DocumentLookup {

    /**
     * Resolves a document by id.
     *
     * @param documentId
     *            document identifier
     * @return the document, or empty if it is unknown or was deleted
     */
    Optional<Document> findById(String documentId);
}
