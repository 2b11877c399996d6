/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.documents.exceptions;

/**
 * Thrown at submission time when a task references a document id that the registry does not know.
 *
 * <p>
 * The submission is rejected synchronously and no task record is created.
 */
public class DocumentNotFoundException extends ResourceNotFoundException {

    private final String documentId;

    public DocumentNotFoundException(String documentId) {
        super("Document " + documentId + " not found");
        this.documentId = documentId;
    }

    public String getDocumentId() {
        return documentId;
    }
}
