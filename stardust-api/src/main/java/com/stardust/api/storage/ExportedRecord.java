package com.stardust.api.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.stardust.core.domain.DataCategory;
import com.stardust.core.domain.SensitivityLevel;

import java.time.Instant;
import java.util.UUID;

/**
 * Decrypted copy of one record, as handed out by a data export.
 */
public record ExportedRecord(
        UUID recordId,
        DataCategory category,
        SensitivityLevel sensitivity,
        Instant createdAt,
        Instant updatedAt,
        JsonNode payload
) {}
