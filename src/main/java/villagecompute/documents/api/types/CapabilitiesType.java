/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.documents.api.types;

import java.util.List;

/**
 * Static description of what the processing service accepts.
 *
 * @param supportedFormats
 *            document format keys
 * @param taskTypes
 *            task types with handler availability
 * @param languages
 *            language codes reported by documents
 * @param maxFileSizeBytes
 *            upload size limit
 * @param batchLimit
 *            maximum documents per batch
 */
public record CapabilitiesType(List<String> supportedFormats, List<TaskCapabilityType> taskTypes,
        List<String> languages, long maxFileSizeBytes, int batchLimit) {
}
