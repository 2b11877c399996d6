/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.documents.jobs;

import villagecompute.documents.data.models.Document;

import java.util.Map;

/**
 * Contract for document analysis handler implementations.
 *
 * <p>
 * Handlers must be CDI-managed beans annotated with {@code @ApplicationScoped} and implement this interface. The
 * {@link villagecompute.documents.services.TaskHandlerRegistry} discovers handlers at startup and the task executor
 * routes tasks to them based on their {@link TaskType}.
 *
 * <p>
 * <b>Execution Model:</b>
 * <ul>
 * <li>Handlers execute on the scheduler's worker threads, at most {@code documents.max-concurrent-tasks} at once</li>
 * <li>Failed tasks are never retried; the exception message becomes the task's error</li>
 * <li>OpenTelemetry spans automatically wrap handler execution</li>
 * </ul>
 *
 * <p>
 * <b>Example Implementation:</b>
 *
 * <pre>{@code
 * @ApplicationScoped
 * public class SummarizationTaskHandler implements TaskHandler {
 *     @Override
 *     public TaskType handlesType() {
 *         return TaskType.SUMMARIZATION;
 *     }
 *
 *     @Override
 *     public Object execute(Document document, Map<String, Object> parameters) throws Exception {
 *         int maxLength = ((Number) parameters.getOrDefault("maxLength", 200)).intValue();
 *         // Summarize document.getContent()...
 *     }
 * }
 * }</pre>
 *
 * @see TaskType for supported task types
 */
public interface TaskHandler {

    /**
     * Returns the task type this handler processes.
     *
     * @return the task type enum value
     */
    TaskType handlesType();

    /**
     * Runs the analysis against a document.
     *
     * <p>
     * <b>Thread Safety:</b> This method may be called concurrently by multiple worker threads. Implementations must be
     * thread-safe. The document is shared and must be treated as read-only.
     *
     * @param document
     *            the document the task references
     * @param parameters
     *            task parameters, passed verbatim from submission (never null)
     * @return the result payload stored on the completed task; serialized to JSON by API consumers
     * @throws Exception
     *             any error during execution; the task ends in the failed state
     */
    Object execute(Document document, Map<String, Object> parameters) throws Exception;
}
