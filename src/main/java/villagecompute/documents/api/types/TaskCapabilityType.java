/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.documents.api.types;

/**
 * One task type as advertised by the capabilities endpoint.
 *
 * @param type
 *            task type key
 * @param description
 *            human-readable description
 * @param handlerRegistered
 *            whether a handler is deployed; tasks of unregistered types fail with "Unsupported task type"
 */
public record TaskCapabilityType(String type, String description, boolean handlerRegistered) {
}
