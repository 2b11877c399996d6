/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.documents.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import org.jboss.logging.MDC;
import villagecompute.documents.data.models.ProcessingTask;

/**
 * Standard MDC field names and helpers for enriching logs with task execution context.
 *
 * <p>
 * <b>Standard Log Fields:</b>
 * <ul>
 * <li>{@code trace_id} - OpenTelemetry trace identifier</li>
 * <li>{@code span_id} - Current span identifier within the trace</li>
 * <li>{@code task_id} - Processing task identifier (only during task execution)</li>
 * <li>{@code document_id} - Document the task runs against</li>
 * <li>{@code task_type} - Task type key</li>
 * </ul>
 *
 * <p>
 * <b>Usage in the task executor:</b>
 *
 * <pre>
 * LoggingConfig.enrichWithTraceContext();
 * LoggingConfig.setTaskContext(task);
 * try {
 *     ...
 * } finally {
 *     LoggingConfig.clearMDC();
 * }
 * </pre>
 *
 * <p>
 * <b>Thread Safety:</b> All methods operate on {@link MDC}, which uses ThreadLocal storage. Worker threads are reused,
 * so every execution must clear MDC when it ends.
 */
public final class LoggingConfig {

    public static final String MDC_TRACE_ID = "trace_id";

    public static final String MDC_SPAN_ID = "span_id";

    public static final String MDC_TASK_ID = "task_id";

    public static final String MDC_DOCUMENT_ID = "document_id";

    public static final String MDC_TASK_TYPE = "task_type";

    private LoggingConfig() {
        // Utility class, no instantiation
    }

    /**
     * Enriches MDC with trace_id and span_id from the current OpenTelemetry span. Empty strings are written when no
     * span is active so the log structure stays consistent.
     */
    public static void enrichWithTraceContext() {
        SpanContext spanContext = Span.current().getSpanContext();

        if (spanContext.isValid()) {
            MDC.put(MDC_TRACE_ID, spanContext.getTraceId());
            MDC.put(MDC_SPAN_ID, spanContext.getSpanId());
        } else {
            MDC.put(MDC_TRACE_ID, "");
            MDC.put(MDC_SPAN_ID, "");
        }
    }

    /**
     * Sets task, document and type fields for the task being executed.
     *
     * @param task
     *            the task being executed
     */
    public static void setTaskContext(ProcessingTask task) {
        if (task != null) {
            MDC.put(MDC_TASK_ID, task.getId());
            MDC.put(MDC_DOCUMENT_ID, task.getDocumentId());
            MDC.put(MDC_TASK_TYPE, task.getType().getKey());
        }
    }

    /**
     * Clears all observability-related MDC fields.
     */
    public static void clearMDC() {
        MDC.remove(MDC_TRACE_ID);
        MDC.remove(MDC_SPAN_ID);
        MDC.remove(MDC_TASK_ID);
        MDC.remove(MDC_DOCUMENT_ID);
        MDC.remove(MDC_TASK_TYPE);
    }
}
