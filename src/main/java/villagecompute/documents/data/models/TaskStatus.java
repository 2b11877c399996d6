/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.documents.data.models;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle states of a {@link ProcessingTask}.
 *
 * <pre>
 * PENDING ──► PROCESSING ──► COMPLETED
 *    │             │
 *    └─────────────┴──────► FAILED
 * </pre>
 *
 * <p>
 * {@code PENDING} is the only initial state and the only externally cancellable one. {@code COMPLETED} and
 * {@code FAILED} are terminal. There is no transition back to {@code PENDING}.
 */
public enum TaskStatus {

    PENDING("pending"),

    PROCESSING("processing"),

    COMPLETED("completed"),

    FAILED("failed");

    private final String key;

    TaskStatus(String key) {
        this.key = key;
    }

    @JsonValue
    public String getKey() {
        return key;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Returns whether the state machine allows moving from this state to {@code next}.
     *
     * @param next
     *            the candidate state
     * @return true for pending→processing, pending→failed, processing→completed and processing→failed
     */
    public boolean canTransitionTo(TaskStatus next) {
        return switch (this) {
            case PENDING -> next == PROCESSING || next == FAILED;
            case PROCESSING -> next == COMPLETED || next == FAILED;
            case COMPLETED, FAILED -> false;
        };
    }
}
