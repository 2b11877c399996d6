/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.documents.services;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import villagecompute.documents.data.models.Document;
import villagecompute.documents.data.models.TaskStatus;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Concurrency and ordering tests for {@link TaskScheduler}, run against the real pipeline.
 */
class TaskSchedulerTest {

    private ProcessingTestFixture fixture;

    @AfterEach
    void tearDown() {
        if (fixture != null) {
            fixture.close();
        }
    }

    @Test
    void testConcurrencyCeilingIsNeverExceeded() throws Exception {
        fixture = new ProcessingTestFixture(2);
        Document document = fixture.upload("ledger.txt");

        List<String> taskIds = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            taskIds.add(fixture.submitGated(document, "task-" + i, 5, "hold"));
        }

        fixture.handler.awaitStarted(2);
        Thread.sleep(100);

        assertEquals(2, fixture.handler.running());
        assertEquals(2, fixture.scheduler.getInFlightCount());
        assertEquals(0, fixture.scheduler.getAvailableSlots());
        assertEquals(4, fixture.scheduler.getQueueDepth());
        assertEquals(2, fixture.store.countByStatus(TaskStatus.PROCESSING));
        assertEquals(4, fixture.store.countByStatus(TaskStatus.PENDING));

        fixture.handler.open("hold");
        fixture.awaitTerminal(taskIds);
        fixture.awaitIdle();

        assertEquals(2, fixture.handler.maxRunning());
        assertEquals(6, fixture.store.countByStatus(TaskStatus.COMPLETED));
        assertEquals(0, fixture.scheduler.getInFlightCount());
    }

    @Test
    void testHigherPriorityRunsFirstAndTiesAreFifo() throws Exception {
        fixture = new ProcessingTestFixture(1);
        Document document = fixture.upload("contract.txt");

        String blocker = fixture.submitGated(document, "blocker", 5, "blocker");
        fixture.handler.awaitStarted(1);

        String a = fixture.submitLabelled(document, "A", 3);
        String b = fixture.submitLabelled(document, "B", 8);
        String c = fixture.submitLabelled(document, "C", 3);
        assertEquals(TaskStatus.PENDING, fixture.task(a).status());

        fixture.handler.open("blocker");
        fixture.awaitTerminal(List.of(blocker, a, b, c));

        assertEquals(List.of("blocker", "B", "A", "C"), fixture.handler.executionOrder());
    }

    @Test
    void testEveryQueuedTaskIsEventuallyDispatched() {
        fixture = new ProcessingTestFixture(2);
        Document document = fixture.upload("archive.txt");

        List<String> taskIds = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            taskIds.add(fixture.submitLabelled(document, "task-" + i, 1 + (i % 10)));
        }

        fixture.awaitTerminal(taskIds);
        fixture.awaitIdle();

        assertEquals(30, fixture.handler.executionOrder().size());
        assertEquals(30, fixture.store.countByStatus(TaskStatus.COMPLETED));
        assertEquals(0, fixture.scheduler.getQueueDepth());
    }

    @Test
    void testConcurrentSubmissionsAreNotLost() throws Exception {
        fixture = new ProcessingTestFixture(3);
        Document document = fixture.upload("bulk.txt");

        int threads = 8;
        int perThread = 25;
        List<String> taskIds = Collections.synchronizedList(new ArrayList<>());
        CountDownLatch startSignal = new CountDownLatch(1);
        ExecutorService submitters = Executors.newFixedThreadPool(threads);
        try {
            for (int t = 0; t < threads; t++) {
                int thread = t;
                submitters.execute(() -> {
                    try {
                        startSignal.await();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return;
                    }
                    for (int i = 0; i < perThread; i++) {
                        taskIds.add(fixture.submitLabelled(document, thread + "-" + i, 1 + (i % 10)));
                    }
                });
            }
            startSignal.countDown();
            submitters.shutdown();
            assertTrue(submitters.awaitTermination(5, TimeUnit.SECONDS));
        } finally {
            submitters.shutdownNow();
        }

        assertEquals(threads * perThread, taskIds.size());
        fixture.awaitTerminal(new ArrayList<>(taskIds));
        fixture.awaitIdle();

        assertEquals(threads * perThread, fixture.store.countByStatus(TaskStatus.COMPLETED));
        assertTrue(fixture.handler.maxRunning() <= 3);
    }

    @Test
    void testCancelledTaskIsSkippedAtDispatch() throws Exception {
        fixture = new ProcessingTestFixture(1);
        Document document = fixture.upload("memo.txt");

        String blocker = fixture.submitGated(document, "blocker", 5, "blocker");
        fixture.handler.awaitStarted(1);
        String cancelled = fixture.submitLabelled(document, "cancelled", 10);
        String kept = fixture.submitLabelled(document, "kept", 1);

        assertTrue(fixture.service.cancelTask(cancelled));
        fixture.handler.open("blocker");
        fixture.awaitTerminal(List.of(blocker, kept));

        assertEquals(List.of("blocker", "kept"), fixture.handler.executionOrder());
        assertEquals(TaskStatus.FAILED, fixture.task(cancelled).status());
        assertEquals("cancelled by user", fixture.task(cancelled).error());
    }
}
