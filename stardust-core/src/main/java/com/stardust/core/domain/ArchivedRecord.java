package com.stardust.core.domain;

import java.time.Instant;
import java.util.UUID;

/**
 * Copy of a stored record placed in the archive area. The original stays in place.
 */
public record ArchivedRecord(
        UUID id,
        UUID originalRecordId,
        UUID ownerId,
        DataCategory category,
        StoredSecureRecord snapshot,
        Instant archivedAt,
        String reason
) {
    public static ArchivedRecord of(StoredSecureRecord original, Instant archivedAt, String reason) {
        return new ArchivedRecord(UUID.randomUUID(), original.getId(), original.getOwnerId(),
                original.getCategory(), original.copy(), archivedAt, reason);
    }

    @Override
    public StoredSecureRecord snapshot() {
        return snapshot.copy();
    }
}
