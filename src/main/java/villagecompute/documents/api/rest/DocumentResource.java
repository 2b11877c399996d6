/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.documents.api.rest;

import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;
import villagecompute.documents.api.types.DocumentType;
import villagecompute.documents.api.types.UploadDocumentRequestType;
import villagecompute.documents.data.models.Document;
import villagecompute.documents.data.models.DocumentFormat;
import villagecompute.documents.exceptions.ValidationException;
import villagecompute.documents.services.DocumentProcessingService;
import villagecompute.documents.services.DocumentRegistry;

import java.net.URI;
import java.util.List;
import java.util.Map;

/**
 * REST endpoints for document upload, lookup and deletion.
 *
 * <p>
 * Deleting a document fails its pending tasks with "document deleted"; tasks already processing finish normally.
 */
@Path("/api/documents")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@Tag(
        name = "Documents",
        description = "Document registry operations")
public class DocumentResource {

    private static final Logger LOG = Logger.getLogger(DocumentResource.class);

    @Inject
    DocumentRegistry documentRegistry;

    @Inject
    DocumentProcessingService processingService;

    /**
     * Uploads a document.
     *
     * @param request
     *            document payload
     * @return 201 with the stored document, 400 when the payload is invalid
     */
    @POST
    @Operation(
            summary = "Upload document",
            description = "Register a document for processing. Language and word metadata are derived from the content.")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "201",
                    description = "Document registered",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = DocumentType.class))),
                    @APIResponse(
                            responseCode = "400",
                            description = "Invalid document payload",
                            content = @Content(
                                    mediaType = MediaType.APPLICATION_JSON))})
    public Response upload(@Valid @NotNull UploadDocumentRequestType request) {
        try {
            Document document = documentRegistry.upload(request);
            return Response.created(URI.create("/api/documents/" + document.getId()))
                    .entity(DocumentType.fromEntity(document)).build();
        } catch (ValidationException e) {
            LOG.warnf("Rejected document upload: %s", e.getMessage());
            return Response.status(Response.Status.BAD_REQUEST).entity(Map.of("error", e.getMessage())).build();
        }
    }

    /**
     * Lists documents, most recent first.
     *
     * @param format
     *            optional format key filter, e.g. {@code pdf}
     * @param language
     *            optional language code filter
     * @param processed
     *            optional processed-state filter
     * @return matching documents
     */
    @GET
    @Operation(
            summary = "List documents",
            description = "List documents with optional format, language and processed filters")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Documents returned",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = DocumentType[].class))),
                    @APIResponse(
                            responseCode = "400",
                            description = "Unknown format",
                            content = @Content(
                                    mediaType = MediaType.APPLICATION_JSON))})
    public Response list(@QueryParam("format") String format, @QueryParam("language") String language,
            @QueryParam("processed") Boolean processed) {
        DocumentFormat formatFilter = null;
        if (format != null && !format.isBlank()) {
            try {
                formatFilter = DocumentFormat.fromKey(format);
            } catch (IllegalArgumentException e) {
                return Response.status(Response.Status.BAD_REQUEST).entity(Map.of("error", e.getMessage())).build();
            }
        }
        List<DocumentType> documents = documentRegistry.list(formatFilter, language, processed).stream()
                .map(DocumentType::fromEntity).toList();
        return Response.ok(documents).build();
    }

    @GET
    @Path("/{id}")
    @Operation(
            summary = "Get document")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Document returned",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = DocumentType.class))),
                    @APIResponse(
                            responseCode = "404",
                            description = "Document not found")})
    public Response get(@PathParam("id") String id) {
        return documentRegistry.findById(id).map(document -> Response.ok(DocumentType.fromEntity(document)).build())
                .orElseGet(() -> Response.status(Response.Status.NOT_FOUND)
                        .entity(Map.of("error", "Document " + id + " not found")).build());
    }

    @DELETE
    @Path("/{id}")
    @Operation(
            summary = "Delete document",
            description = "Remove a document and fail its pending tasks")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "204",
                    description = "Document deleted"),
                    @APIResponse(
                            responseCode = "404",
                            description = "Document not found")})
    public Response delete(@PathParam("id") String id) {
        if (!processingService.deleteDocument(id)) {
            return Response.status(Response.Status.NOT_FOUND).entity(Map.of("error", "Document " + id + " not found"))
                    .build();
        }
        return Response.noContent().build();
    }
}
