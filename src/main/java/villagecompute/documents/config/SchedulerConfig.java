/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.documents.config;

import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Configuration for the document processing scheduler.
 *
 * <p>
 * <b>Configuration Properties:</b>
 * <ul>
 * <li>{@code documents.max-concurrent-tasks} - Concurrency ceiling for task execution (default: 5)</li>
 * <li>{@code documents.default-priority} - Priority of ad-hoc submissions without an explicit priority (default:
 * 5)</li>
 * <li>{@code documents.batch-priority} - Priority of batch submissions (default: 7)</li>
 * <li>{@code documents.batch-limit} - Maximum documents per batch request (default: 100)</li>
 * <li>{@code documents.max-file-size-bytes} - Upload size limit (default: 100 MiB)</li>
 * <li>{@code documents.shutdown-timeout-seconds} - Grace period for in-flight tasks at shutdown (default: 30)</li>
 * </ul>
 *
 * <p>
 * Validation runs at startup; an invalid value prevents the application from starting.
 */
@ApplicationScoped
@Startup
public class SchedulerConfig {

    private static final Logger LOG = Logger.getLogger(SchedulerConfig.class);

    public static final int MIN_PRIORITY = 1;
    public static final int MAX_PRIORITY = 10;

    @ConfigProperty(
            name = "documents.max-concurrent-tasks",
            defaultValue = "5")
    int maxConcurrentTasks = 5;

    @ConfigProperty(
            name = "documents.default-priority",
            defaultValue = "5")
    int defaultPriority = 5;

    @ConfigProperty(
            name = "documents.batch-priority",
            defaultValue = "7")
    int batchPriority = 7;

    @ConfigProperty(
            name = "documents.batch-limit",
            defaultValue = "100")
    int batchLimit = 100;

    @ConfigProperty(
            name = "documents.max-file-size-bytes",
            defaultValue = "104857600")
    long maxFileSizeBytes = 104857600L;

    @ConfigProperty(
            name = "documents.shutdown-timeout-seconds",
            defaultValue = "30")
    int shutdownTimeoutSeconds = 30;

    /**
     * Validates the configured values.
     *
     * @throws SchedulerConfigurationException
     *             if any value is out of range
     */
    @PostConstruct
    public void validateConfiguration() {
        if (maxConcurrentTasks < 1) {
            fail("documents.max-concurrent-tasks must be at least 1 but was " + maxConcurrentTasks);
        }
        if (!isValidPriority(defaultPriority)) {
            fail("documents.default-priority must be between 1 and 10 but was " + defaultPriority);
        }
        if (!isValidPriority(batchPriority)) {
            fail("documents.batch-priority must be between 1 and 10 but was " + batchPriority);
        }
        if (batchLimit < 1) {
            fail("documents.batch-limit must be at least 1 but was " + batchLimit);
        }
        if (maxFileSizeBytes < 1) {
            fail("documents.max-file-size-bytes must be positive but was " + maxFileSizeBytes);
        }
        if (shutdownTimeoutSeconds < 0) {
            fail("documents.shutdown-timeout-seconds must not be negative but was " + shutdownTimeoutSeconds);
        }
        LOG.infof("Document scheduler configured: maxConcurrentTasks=%d, defaultPriority=%d, batchPriority=%d",
                maxConcurrentTasks, defaultPriority, batchPriority);
    }

    private void fail(String message) {
        LOG.fatal(message);
        throw new SchedulerConfigurationException(message);
    }

    public static boolean isValidPriority(int priority) {
        return priority >= MIN_PRIORITY && priority <= MAX_PRIORITY;
    }

    public int getMaxConcurrentTasks() {
        return maxConcurrentTasks;
    }

    public int getDefaultPriority() {
        return defaultPriority;
    }

    public int getBatchPriority() {
        return batchPriority;
    }

    public int getBatchLimit() {
        return batchLimit;
    }

    public long getMaxFileSizeBytes() {
        return maxFileSizeBytes;
    }

    public int getShutdownTimeoutSeconds() {
        return shutdownTimeoutSeconds;
    }

    /**
     * Exception thrown when scheduler configuration is invalid.
     */
    public static class SchedulerConfigurationException extends RuntimeException {

        public SchedulerConfigurationException(String message) {
            super(message);
        }
    }
}
