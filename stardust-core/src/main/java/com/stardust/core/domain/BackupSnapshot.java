package com.stardust.core.domain;

import java.time.Instant;
import java.util.UUID;

/**
 * Encrypted backup of a record written right before retention deletion.
 *
 * @param encryptedData the serialized stored record, encrypted with the category key
 * @param checksum checksum of the serialized record before encryption
 */
public record BackupSnapshot(
        UUID id,
        UUID trackingId,
        UUID recordId,
        UUID ownerId,
        DataCategory category,
        String encryptedData,
        String checksum,
        Instant createdAt,
        Instant expiresAt
) {
    public BackupSnapshot {
        if (encryptedData == null || encryptedData.isEmpty()) {
            throw new IllegalArgumentException("Backup payload is required");
        }
        if (createdAt == null || expiresAt == null || !expiresAt.isAfter(createdAt)) {
            throw new IllegalArgumentException("Backup expiry must be after creation");
        }
    }

    public boolean isExpiredAt(Instant now) {
        return !expiresAt.isAfter(now);
    }
}
