package com.stardust.core.domain;

import java.time.Instant;
import java.util.UUID;

/**
 * One consent decision of a user for a data category. Append-only: the most recent
 * decision per (owner, category) is the current one.
 */
public record ConsentRecord(
        UUID id,
        UUID ownerId,
        DataCategory category,
        boolean granted,
        String purpose,
        String legalBasis,
        Instant recordedAt,
        Instant expiresAt
) {
    public ConsentRecord {
        if (id == null || ownerId == null) {
            throw new IllegalArgumentException("Consent id and owner id are required");
        }
        if (category == null) {
            throw new IllegalArgumentException("Data category is required");
        }
        if (recordedAt == null) {
            throw new IllegalArgumentException("Recording time is required");
        }
        if (expiresAt != null && !expiresAt.isAfter(recordedAt)) {
            throw new IllegalArgumentException("Consent expiry must be after recording time");
        }
    }

    public static ConsentRecord create(
            UUID ownerId, DataCategory category, boolean granted,
            String purpose, String legalBasis, Instant recordedAt, Instant expiresAt) {
        return new ConsentRecord(UUID.randomUUID(), ownerId, category, granted,
                purpose, legalBasis, recordedAt, expiresAt);
    }

    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }

    /**
     * Granted and not expired.
     */
    public boolean isEffectiveAt(Instant now) {
        return granted && !isExpiredAt(now);
    }
}
