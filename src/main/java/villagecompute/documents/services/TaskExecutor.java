/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.documents.services;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.documents.data.models.Document;
import villagecompute.documents.data.models.ProcessingTask;
import villagecompute.documents.data.models.TaskStatus;
import villagecompute.documents.exceptions.DocumentNotFoundException;
import villagecompute.documents.exceptions.UnsupportedTaskTypeException;
import villagecompute.documents.jobs.TaskHandler;
import villagecompute.documents.observability.LoggingConfig;

import java.time.Instant;
import java.util.Optional;

/**
 * Runs a single task that the scheduler has already moved to processing.
 *
 * <p>
 * Every outcome ends in a terminal state:
 * <ul>
 * <li>document missing: failed with "Document &lt;id&gt; not found"</li>
 * <li>no handler for the type: failed with "Unsupported task type: &lt;type&gt;"</li>
 * <li>handler throws: failed with the exception message, or "Unknown error" when it has none</li>
 * <li>handler returns: completed with the result, and the document is marked processed</li>
 * </ul>
 * {@code processingTime} is measured from the start of execution and recorded on every outcome.
 *
 * <p>
 * <b>Metrics:</b>
 * <ul>
 * <li>{@code documents.tasks.processing.duration} (Timer, tags: type, status) - Handler execution time</li>
 * <li>{@code documents.tasks.completed.total} (Counter, tags: type, status) - Tasks reaching a terminal state</li>
 * </ul>
 */
@ApplicationScoped
public class TaskExecutor {

    private static final Logger LOG = Logger.getLogger(TaskExecutor.class);

    static final String UNKNOWN_ERROR = "Unknown error";

    private final DocumentLookup documents;
    private final TaskHandlerRegistry handlers;
    private final TaskRecordStore store;
    private final MeterRegistry meterRegistry;
    private final Tracer tracer;

    @Inject
    public TaskExecutor(DocumentLookup documents, TaskHandlerRegistry handlers, TaskRecordStore store,
            MeterRegistry meterRegistry, Tracer tracer) {
        this.documents = documents;
        this.handlers = handlers;
        this.store = store;
        this.meterRegistry = meterRegistry;
        this.tracer = tracer;
    }

    /**
     * Executes the task and records its outcome. Never throws for handler failures.
     *
     * @param task
     *            a task in the processing state
     */
    public void execute(ProcessingTask task) {
        Span span = tracer.spanBuilder("document.task.execute").setAttribute("task.id", task.getId())
                .setAttribute("task.type", task.getType().getKey()).setAttribute("document.id", task.getDocumentId())
                .setAttribute("task.priority", task.getPriority()).startSpan();

        Timer.Sample sample = Timer.start(meterRegistry);
        long started = System.nanoTime();

        try (Scope scope = span.makeCurrent()) {
            LoggingConfig.enrichWithTraceContext();
            LoggingConfig.setTaskContext(task);

            Optional<Document> document = documents.findById(task.getDocumentId());
            if (document.isEmpty()) {
                String error = new DocumentNotFoundException(task.getDocumentId()).getMessage();
                failAndRecord(task, span, sample, error, elapsedMillis(started));
                return;
            }

            Optional<TaskHandler> handler = handlers.find(task.getType());
            if (handler.isEmpty()) {
                String error = new UnsupportedTaskTypeException(task.getType()).getMessage();
                failAndRecord(task, span, sample, error, elapsedMillis(started));
                return;
            }

            run(task, document.get(), handler.get(), span, sample, started);
        } finally {
            LoggingConfig.clearMDC();
            span.end();
        }
    }

    private void run(ProcessingTask task, Document document, TaskHandler handler, Span span, Timer.Sample sample,
            long started) {
        LOG.debugf("Executing task %s with %s", task.getId(), handler.getClass().getSimpleName());
        try {
            Object result = handler.execute(document, task.getParameters());
            long elapsedMs = elapsedMillis(started);
            if (store.markCompleted(task, result, elapsedMs)) {
                document.markProcessed(Instant.now());
                record(sample, task, TaskStatus.COMPLETED);
                span.setAttribute("task.processing_time_ms", elapsedMs);
                LOG.infof("Task %s completed in %d ms", task.getId(), elapsedMs);
            } else {
                LOG.warnf("Task %s finished but was no longer processing (status: %s)", task.getId(),
                        task.getStatus().getKey());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            span.recordException(e);
            failAndRecord(task, span, sample, messageOf(e), elapsedMillis(started));
        } catch (Exception e) {
            span.recordException(e);
            LOG.errorf(e, "Task %s failed", task.getId());
            failAndRecord(task, span, sample, messageOf(e), elapsedMillis(started));
        } catch (Error e) {
            span.recordException(e);
            failAndRecord(task, span, sample, messageOf(e), elapsedMillis(started));
            throw e;
        }
    }

    private void failAndRecord(ProcessingTask task, Span span, Timer.Sample sample, String error,
            long processingTimeMs) {
        span.setStatus(StatusCode.ERROR, error);
        if (store.markFailed(task, TaskStatus.PROCESSING, error, processingTimeMs)) {
            LOG.warnf("Task %s failed: %s", task.getId(), error);
        }
        record(sample, task, TaskStatus.FAILED);
    }

    private void record(Timer.Sample sample, ProcessingTask task, TaskStatus status) {
        sample.stop(Timer.builder("documents.tasks.processing.duration").tag("type", task.getType().getKey())
                .tag("status", status.getKey()).register(meterRegistry));
        Counter.builder("documents.tasks.completed.total").tag("type", task.getType().getKey())
                .tag("status", status.getKey()).register(meterRegistry).increment();
    }

    static String messageOf(Throwable e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? UNKNOWN_ERROR : message;
    }

    private static long elapsedMillis(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000L;
    }
}
