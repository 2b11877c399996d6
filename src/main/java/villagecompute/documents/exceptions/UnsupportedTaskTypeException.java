/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.documents.exceptions;

import villagecompute.documents.jobs.TaskType;

/**
 * Raised by the executor when no handler is registered for a task's type.
 *
 * <p>
 * This is a configuration error. It never escapes to the submitter: the executor records the message on the task,
 * which ends in the failed state without retry.
 */
public class UnsupportedTaskTypeException extends RuntimeException {

    public UnsupportedTaskTypeException(TaskType type) {
        super("Unsupported task type: " + (type == null ? "null" : type.getKey()));
    }
}
