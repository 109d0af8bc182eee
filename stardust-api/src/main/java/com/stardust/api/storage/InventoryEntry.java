package com.stardust.api.storage;

import com.stardust.core.domain.SensitivityLevel;

import java.time.Instant;
import java.util.Set;

/**
 * Per-category summary of an owner's active records.
 */
public record InventoryEntry(
        long count,
        long totalBytes,
        Instant oldest,
        Instant newest,
        Set<SensitivityLevel> sensitivityLevels,
        long accessCount
) {}
