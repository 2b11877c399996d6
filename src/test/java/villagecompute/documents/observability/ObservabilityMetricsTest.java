/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.documents.observability;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import villagecompute.documents.data.models.TaskStatus;
import villagecompute.documents.services.TaskRecordStore;
import villagecompute.documents.services.TaskScheduler;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link ObservabilityMetrics} gauge registration.
 */
class ObservabilityMetricsTest {

    @Mock
    TaskScheduler scheduler;

    @Mock
    TaskRecordStore store;

    @InjectMocks
    ObservabilityMetrics metrics;

    private MeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        meterRegistry = new SimpleMeterRegistry();
        metrics.registry = meterRegistry;
    }

    @Test
    void testGaugesReflectSchedulerState() {
        when(scheduler.getQueueDepth()).thenReturn(7);
        when(scheduler.getInFlightCount()).thenReturn(3);
        when(scheduler.getAvailableSlots()).thenReturn(2);
        when(scheduler.getMaxConcurrentTasks()).thenReturn(5);
        when(store.countByStatus(TaskStatus.FAILED)).thenReturn(4L);

        metrics.register();

        assertEquals(7.0, meterRegistry.get("documents_tasks_queue_depth").gauge().value());
        assertEquals(3.0, meterRegistry.get("documents_tasks_in_flight").gauge().value());
        assertEquals(2.0, meterRegistry.get("documents_tasks_slots_available").gauge().value());
        assertEquals(4.0,
                meterRegistry.get("documents_tasks_by_status").tag("status", "failed").gauge().value());
        assertEquals(0.0,
                meterRegistry.get("documents_tasks_by_status").tag("status", "pending").gauge().value());
    }
}
