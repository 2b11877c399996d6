/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.documents.api.types;

/**
 * Usage count of one task type.
 *
 * @param feature
 *            task type key
 * @param usage
 *            number of tasks ever submitted with this type
 */
public record FeatureUsageType(String feature, long usage) {
}
