/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.documents.observability;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.context.Initialized;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.documents.data.models.TaskStatus;
import villagecompute.documents.services.TaskRecordStore;
import villagecompute.documents.services.TaskScheduler;

import java.util.List;

/**
 * Registers scheduler gauges at application startup.
 *
 * <p>
 * <b>Metrics Catalog:</b>
 * <ul>
 * <li>{@code documents_tasks_queue_depth} - Tasks waiting in the priority queue</li>
 * <li>{@code documents_tasks_in_flight} - Tasks currently executing</li>
 * <li>{@code documents_tasks_slots_available} - Free worker slots (0 means the scheduler is saturated)</li>
 * <li>{@code documents_tasks_by_status{status}} - Task records per status</li>
 * </ul>
 *
 * <p>
 * Execution timers and counters are recorded by {@link villagecompute.documents.services.TaskExecutor}. Metrics are
 * exported in Prometheus format at {@code /q/metrics}.
 *
 * @see LoggingConfig for structured logging field definitions
 */
@ApplicationScoped
public class ObservabilityMetrics {

    private static final Logger LOG = Logger.getLogger(ObservabilityMetrics.class);

    @Inject
    MeterRegistry registry;

    @Inject
    TaskScheduler scheduler;

    @Inject
    TaskRecordStore store;

    public void registerMetrics(@Observes @Initialized(ApplicationScoped.class) Object init) {
        register();
    }

    void register() {
        LOG.info("Registering document scheduler metrics");

        Gauge.builder("documents_tasks_queue_depth", scheduler, TaskScheduler::getQueueDepth)
                .description("Tasks waiting for a worker slot").register(registry);

        Gauge.builder("documents_tasks_in_flight", scheduler, TaskScheduler::getInFlightCount)
                .description("Tasks currently executing").register(registry);

        Gauge.builder("documents_tasks_slots_available", scheduler, TaskScheduler::getAvailableSlots)
                .description("Free worker slots out of " + scheduler.getMaxConcurrentTasks()).register(registry);

        for (TaskStatus status : TaskStatus.values()) {
            Gauge.builder("documents_tasks_by_status", store, s -> s.countByStatus(status))
                    .description("Task records in the " + status.getKey() + " state")
                    .tags(List.of(Tag.of("status", status.getKey()))).register(registry);
            LOG.debugf("Registered gauge: documents_tasks_by_status{status=%s}", status.getKey());
        }

        LOG.infof("Document scheduler metrics registered. Access metrics at /q/metrics");
    }
}
