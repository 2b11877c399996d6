/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.documents.services;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import villagecompute.documents.api.types.ProcessingTaskType;
import villagecompute.documents.api.types.TaskResultType;
import villagecompute.documents.data.models.Document;
import villagecompute.documents.data.models.TaskStatus;
import villagecompute.documents.exceptions.DocumentNotFoundException;
import villagecompute.documents.exceptions.ResourceNotFoundException;
import villagecompute.documents.exceptions.ValidationException;
import villagecompute.documents.jobs.TaskType;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for task submission, cancellation and the document-delete cascade.
 */
class DocumentProcessingServiceTest {

    private ProcessingTestFixture fixture;
    private DocumentProcessingService service;
    private Document document;

    @BeforeEach
    void setUp() {
        fixture = new ProcessingTestFixture(1);
        service = fixture.service;
        document = fixture.upload("invoice.txt");
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    @Test
    void testUnknownDocumentIsRejectedWithoutCreatingTask() {
        DocumentNotFoundException e = assertThrows(DocumentNotFoundException.class,
                () -> service.submitTask("doc_missing", TaskType.TEXT_EXTRACTION, Map.of()));

        assertEquals("doc_missing", e.getDocumentId());
        assertEquals("Document doc_missing not found", e.getMessage());
        assertEquals(0, fixture.store.size());
        assertEquals(0, fixture.scheduler.getQueueDepth());
    }

    @Test
    void testOutOfRangePriorityIsRejected() {
        assertThrows(ValidationException.class,
                () -> service.submitTask(document.getId(), TaskType.TEXT_EXTRACTION, Map.of(), 0));
        assertThrows(ValidationException.class,
                () -> service.submitTask(document.getId(), TaskType.TEXT_EXTRACTION, Map.of(), 11));

        assertEquals(0, fixture.store.size());
    }

    @Test
    void testDefaultPriorityIsApplied() {
        String taskId = service.submitTask(document.getId(), TaskType.TEXT_EXTRACTION, null);

        ProcessingTaskType task = service.getTask(taskId).orElseThrow();
        assertEquals(5, task.priority());
        assertEquals(document.getId(), task.documentId());
        assertTrue(task.parameters().isEmpty());
    }

    @Test
    void testSubmittedTaskCompletesAndExposesResult() {
        String taskId = service.submitTask(document.getId(), TaskType.TEXT_EXTRACTION, Map.of(), 6);

        fixture.awaitTerminal(List.of(taskId));

        ProcessingTaskType task = service.getTask(taskId).orElseThrow();
        assertEquals(TaskStatus.COMPLETED, task.status());
        assertNull(task.error());
        List<TaskResultType> results = service.getResults(null, document.getId());
        assertEquals(1, results.size());
        assertEquals(taskId, results.get(0).taskId());
        assertEquals(TaskType.TEXT_EXTRACTION, results.get(0).type());
        assertEquals(1, service.getResults(taskId, null).size());
    }

    @Test
    void testRequireTaskRejectsUnknownId() {
        ResourceNotFoundException e = assertThrows(ResourceNotFoundException.class,
                () -> service.requireTask("task_missing"));
        assertEquals("Task task_missing not found", e.getMessage());
    }

    @Test
    void testResultsRequireAnId() {
        assertThrows(ValidationException.class, () -> service.getResults(null, " "));
    }

    @Test
    void testTaskWithoutHandlerFailsAsUnsupported() {
        String taskId = service.submitTask(document.getId(), TaskType.TRANSLATION, Map.of("target", "fr"));

        fixture.awaitTerminal(List.of(taskId));

        ProcessingTaskType task = service.getTask(taskId).orElseThrow();
        assertEquals(TaskStatus.FAILED, task.status());
        assertEquals("Unsupported task type: translation", task.error());
        assertNotNull(task.processingTime());
    }

    @Test
    void testListTasksIsMostRecentFirst() {
        Document other = fixture.upload("other.txt");
        String first = service.submitTask(document.getId(), TaskType.TEXT_EXTRACTION, Map.of());
        String second = service.submitTask(other.getId(), TaskType.TEXT_EXTRACTION, Map.of());
        String third = service.submitTask(document.getId(), TaskType.TEXT_EXTRACTION, Map.of());

        assertEquals(List.of(third, second, first),
                service.listTasks(null).stream().map(ProcessingTaskType::id).toList());
        assertEquals(List.of(third, first),
                service.listTasks(document.getId()).stream().map(ProcessingTaskType::id).toList());
    }

    @Test
    void testCancelOnlyAppliesToPendingTasks() throws Exception {
        String running = fixture.submitGated(document, "running", 5, "running");
        fixture.handler.awaitStarted(1);
        String pending = fixture.submitLabelled(document, "pending", 5);

        assertFalse(service.cancelTask(running), "a processing task cannot be cancelled");
        assertEquals(TaskStatus.PROCESSING, fixture.task(running).status());

        assertTrue(service.cancelTask(pending));
        assertEquals(TaskStatus.FAILED, fixture.task(pending).status());
        assertEquals("cancelled by user", fixture.task(pending).error());
        assertFalse(service.cancelTask(pending), "a terminal task cannot be cancelled again");
        assertFalse(service.cancelTask("task_unknown"));
        assertEquals(0, fixture.scheduler.getQueueDepth());

        fixture.handler.open("running");
        fixture.awaitTerminal(List.of(running));
        assertEquals(TaskStatus.COMPLETED, fixture.task(running).status());
    }

    @Test
    void testDeletingDocumentFailsPendingTasksOnly() throws Exception {
        String processing = fixture.submitGated(document, "processing", 5, "processing");
        fixture.handler.awaitStarted(1);
        String pendingOne = fixture.submitLabelled(document, "pending-1", 5);
        String pendingTwo = fixture.submitLabelled(document, "pending-2", 9);

        assertTrue(service.deleteDocument(document.getId()));

        assertEquals(TaskStatus.FAILED, fixture.task(pendingOne).status());
        assertEquals("document deleted", fixture.task(pendingOne).error());
        assertEquals(TaskStatus.FAILED, fixture.task(pendingTwo).status());
        assertEquals("document deleted", fixture.task(pendingTwo).error());
        assertEquals(TaskStatus.PROCESSING, fixture.task(processing).status());
        assertEquals(0, fixture.scheduler.getQueueDepth());

        fixture.handler.open("processing");
        fixture.awaitTerminal(List.of(processing));

        assertEquals(TaskStatus.COMPLETED, fixture.task(processing).status());
        assertEquals(List.of("processing"), fixture.handler.executionOrder());
        assertFalse(service.deleteDocument(document.getId()));
    }
}
