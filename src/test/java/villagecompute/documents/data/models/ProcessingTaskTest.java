/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.documents.data.models;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import villagecompute.documents.jobs.TaskType;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for the {@link ProcessingTask} state machine.
 */
class ProcessingTaskTest {

    private static final Instant CREATED = Instant.parse("2025-03-01T10:00:00Z");

    private ProcessingTask task;

    @BeforeEach
    void setUp() {
        task = new ProcessingTask("task_1", "doc_1", TaskType.TEXT_EXTRACTION, Map.of("mode", "fast"), 5, 1L,
                CREATED);
    }

    @Test
    void testStartsPending() {
        assertEquals(TaskStatus.PENDING, task.getStatus());
        assertEquals(CREATED, task.getUpdatedAt());
        assertNull(task.getResult());
        assertNull(task.getError());
        assertNull(task.getProcessingTimeMs());
    }

    @Test
    void testCompletesThroughProcessing() {
        Instant started = CREATED.plusSeconds(1);
        Instant finished = CREATED.plusSeconds(2);

        assertTrue(task.advance(TaskStatus.PENDING, TaskStatus.PROCESSING, null, null, null, started));
        assertEquals(started, task.getUpdatedAt());

        assertTrue(task.advance(TaskStatus.PROCESSING, TaskStatus.COMPLETED, "text", "ignored", 1000L, finished));
        assertEquals(TaskStatus.COMPLETED, task.getStatus());
        assertEquals("text", task.getResult());
        assertNull(task.getError(), "error is only recorded for failed tasks");
        assertEquals(1000L, task.getProcessingTimeMs());
        assertEquals(finished, task.getUpdatedAt());
    }

    @Test
    void testPendingCanFailDirectly() {
        assertTrue(task.advance(TaskStatus.PENDING, TaskStatus.FAILED, null, "cancelled by user", null,
                CREATED.plusSeconds(1)));

        assertEquals(TaskStatus.FAILED, task.getStatus());
        assertEquals("cancelled by user", task.getError());
    }

    @Test
    void testExpectedStatusMismatchIsRejected() {
        task.advance(TaskStatus.PENDING, TaskStatus.PROCESSING, null, null, null, CREATED.plusSeconds(1));

        assertFalse(task.advance(TaskStatus.PENDING, TaskStatus.FAILED, null, "cancelled by user", null,
                CREATED.plusSeconds(2)));
        assertEquals(TaskStatus.PROCESSING, task.getStatus());
        assertNull(task.getError());
    }

    @Test
    void testTerminalStatesAreFinal() {
        task.advance(TaskStatus.PENDING, TaskStatus.FAILED, null, "boom", null, CREATED.plusSeconds(1));

        assertFalse(task.advance(TaskStatus.FAILED, TaskStatus.PROCESSING, null, null, null, CREATED.plusSeconds(2)));
        assertFalse(task.advance(TaskStatus.FAILED, TaskStatus.COMPLETED, "x", null, 1L, CREATED.plusSeconds(2)));
        assertEquals(TaskStatus.FAILED, task.getStatus());
    }

    @Test
    void testPendingCannotCompleteWithoutProcessing() {
        assertFalse(task.advance(TaskStatus.PENDING, TaskStatus.COMPLETED, "x", null, 1L, CREATED.plusSeconds(1)));
        assertEquals(TaskStatus.PENDING, task.getStatus());
    }

    @Test
    void testStatusTransitionTable() {
        assertTrue(TaskStatus.PENDING.canTransitionTo(TaskStatus.PROCESSING));
        assertTrue(TaskStatus.PENDING.canTransitionTo(TaskStatus.FAILED));
        assertTrue(TaskStatus.PROCESSING.canTransitionTo(TaskStatus.COMPLETED));
        assertTrue(TaskStatus.PROCESSING.canTransitionTo(TaskStatus.FAILED));
        assertFalse(TaskStatus.PROCESSING.canTransitionTo(TaskStatus.PENDING));
        assertFalse(TaskStatus.COMPLETED.canTransitionTo(TaskStatus.FAILED));
        assertTrue(TaskStatus.COMPLETED.isTerminal());
        assertTrue(TaskStatus.FAILED.isTerminal());
        assertFalse(TaskStatus.PENDING.isTerminal());
    }
}
