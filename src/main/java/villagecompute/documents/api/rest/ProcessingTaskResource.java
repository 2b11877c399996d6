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
import villagecompute.documents.api.types.BatchProcessRequestType;
import villagecompute.documents.api.types.BatchSubmissionType;
import villagecompute.documents.api.types.CapabilitiesType;
import villagecompute.documents.api.types.ProcessingAnalyticsType;
import villagecompute.documents.api.types.ProcessingTaskType;
import villagecompute.documents.api.types.QueueStatusType;
import villagecompute.documents.api.types.SubmitTaskRequestType;
import villagecompute.documents.exceptions.DocumentNotFoundException;
import villagecompute.documents.exceptions.ResourceNotFoundException;
import villagecompute.documents.exceptions.ValidationException;
import villagecompute.documents.services.BatchProcessingService;
import villagecompute.documents.services.DocumentProcessingService;
import villagecompute.documents.services.ProcessingAnalyticsService;

import java.net.URI;
import java.util.Map;

/**
 * REST endpoints for task submission, status polling, cancellation and scheduler analytics.
 *
 * <p>
 * Submission returns as soon as the task is queued. Clients poll {@code GET /api/tasks/{id}} until the status is
 * {@code completed} or {@code failed}.
 */
@Path("/api/tasks")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@Tag(
        name = "Processing Tasks",
        description = "Document processing task operations")
public class ProcessingTaskResource {

    private static final Logger LOG = Logger.getLogger(ProcessingTaskResource.class);

    @Inject
    DocumentProcessingService processingService;

    @Inject
    BatchProcessingService batchService;

    @Inject
    ProcessingAnalyticsService analyticsService;

    /**
     * Submits a task.
     *
     * @param request
     *            document id, task type, parameters and optional priority
     * @return 201 with the pending task, 404 for an unknown document, 400 for invalid input
     */
    @POST
    @Operation(
            summary = "Submit task",
            description = "Queue a processing task against a document. Higher priority (1-10) runs first.")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "201",
                    description = "Task queued",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = ProcessingTaskType.class))),
                    @APIResponse(
                            responseCode = "400",
                            description = "Invalid task request",
                            content = @Content(
                                    mediaType = MediaType.APPLICATION_JSON)),
                    @APIResponse(
                            responseCode = "404",
                            description = "Document not found",
                            content = @Content(
                                    mediaType = MediaType.APPLICATION_JSON))})
    public Response submit(@Valid @NotNull SubmitTaskRequestType request) {
        try {
            String taskId = processingService.submitTask(request.documentId(), request.type(), request.parameters(),
                    request.priority());
            ProcessingTaskType task = processingService.getTask(taskId).orElseThrow();
            return Response.created(URI.create("/api/tasks/" + taskId)).entity(task).build();
        } catch (DocumentNotFoundException e) {
            return Response.status(Response.Status.NOT_FOUND).entity(Map.of("error", e.getMessage())).build();
        } catch (ValidationException e) {
            LOG.warnf("Rejected task submission: %s", e.getMessage());
            return Response.status(Response.Status.BAD_REQUEST).entity(Map.of("error", e.getMessage())).build();
        }
    }

    @GET
    @Operation(
            summary = "List tasks",
            description = "List tasks, most recent first, optionally for a single document")
    @APIResponse(
            responseCode = "200",
            description = "Tasks returned",
            content = @Content(
                    mediaType = MediaType.APPLICATION_JSON,
                    schema = @Schema(
                            implementation = ProcessingTaskType[].class)))
    public Response list(@QueryParam("documentId") String documentId) {
        String filter = documentId == null || documentId.isBlank() ? null : documentId;
        return Response.ok(processingService.listTasks(filter)).build();
    }

    @GET
    @Path("/{id}")
    @Operation(
            summary = "Get task")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Task returned",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = ProcessingTaskType.class))),
                    @APIResponse(
                            responseCode = "404",
                            description = "Task not found")})
    public Response get(@PathParam("id") String id) {
        try {
            return Response.ok(processingService.requireTask(id)).build();
        } catch (ResourceNotFoundException e) {
            return Response.status(Response.Status.NOT_FOUND).entity(Map.of("error", e.getMessage())).build();
        }
    }

    /**
     * Cancels a pending task.
     *
     * @return 200 when cancelled, 409 when the task already left the pending state, 404 when unknown
     */
    @DELETE
    @Path("/{id}")
    @Operation(
            summary = "Cancel task",
            description = "Cancel a pending task. Tasks that are processing or finished cannot be cancelled.")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Task cancelled"),
                    @APIResponse(
                            responseCode = "404",
                            description = "Task not found"),
                    @APIResponse(
                            responseCode = "409",
                            description = "Task is no longer pending")})
    public Response cancel(@PathParam("id") String id) {
        if (processingService.cancelTask(id)) {
            return Response.ok(Map.of("cancelled", true)).build();
        }
        try {
            ProcessingTaskType task = processingService.requireTask(id);
            return Response.status(Response.Status.CONFLICT).entity(Map.of("cancelled", false, "error",
                    "Task " + id + " is " + task.status().getKey() + " and cannot be cancelled")).build();
        } catch (ResourceNotFoundException e) {
            return Response.status(Response.Status.NOT_FOUND).entity(Map.of("error", e.getMessage())).build();
        }
    }

    @POST
    @Path("/batch")
    @Operation(
            summary = "Submit batch",
            description = "Submit every task type for every document at batch priority. Unknown documents are skipped.")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Batch submitted",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = BatchSubmissionType.class))),
                    @APIResponse(
                            responseCode = "400",
                            description = "Empty or oversized batch",
                            content = @Content(
                                    mediaType = MediaType.APPLICATION_JSON))})
    public Response batch(@Valid @NotNull BatchProcessRequestType request) {
        try {
            return Response.ok(batchService.submit(request.documentIds(), request.taskTypes(), request.parameters()))
                    .build();
        } catch (ValidationException e) {
            return Response.status(Response.Status.BAD_REQUEST).entity(Map.of("error", e.getMessage())).build();
        }
    }

    @GET
    @Path("/analytics")
    @Operation(
            summary = "Processing analytics")
    @APIResponse(
            responseCode = "200",
            description = "Analytics summary",
            content = @Content(
                    mediaType = MediaType.APPLICATION_JSON,
                    schema = @Schema(
                            implementation = ProcessingAnalyticsType.class)))
    public ProcessingAnalyticsType analytics() {
        return analyticsService.getSummary();
    }

    @GET
    @Path("/queue-status")
    @Operation(
            summary = "Queue status")
    @APIResponse(
            responseCode = "200",
            description = "Live scheduler status",
            content = @Content(
                    mediaType = MediaType.APPLICATION_JSON,
                    schema = @Schema(
                            implementation = QueueStatusType.class)))
    public QueueStatusType queueStatus() {
        return analyticsService.getQueueStatus();
    }

    @GET
    @Path("/capabilities")
    @Operation(
            summary = "Capabilities")
    @APIResponse(
            responseCode = "200",
            description = "Supported formats, task types and limits",
            content = @Content(
                    mediaType = MediaType.APPLICATION_JSON,
                    schema = @Schema(
                            implementation = CapabilitiesType.class)))
    public CapabilitiesType capabilities() {
        return analyticsService.getCapabilities();
    }

    @GET
    @Path("/results")
    @Operation(
            summary = "Task results",
            description = "Results of completed tasks, by task id or by document id")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Results returned"),
                    @APIResponse(
                            responseCode = "400",
                            description = "Neither taskId nor documentId given")})
    public Response results(@QueryParam("taskId") String taskId, @QueryParam("documentId") String documentId) {
        try {
            return Response.ok(processingService.getResults(taskId, documentId)).build();
        } catch (ValidationException e) {
            return Response.status(Response.Status.BAD_REQUEST).entity(Map.of("error", e.getMessage())).build();
        }
    }
}
