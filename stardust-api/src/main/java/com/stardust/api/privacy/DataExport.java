package com.stardust.api.privacy;

import com.stardust.api.storage.ExportedRecord;
import com.stardust.core.domain.DataCategory;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Everything held about a user, decrypted and grouped by category.
 */
public record DataExport(
        UUID ownerId,
        UUID requestId,
        Instant exportedAt,
        Map<DataCategory, List<ExportedRecord>> records,
        int recordCount
) {}
