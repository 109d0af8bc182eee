package com.stardust.api.privacy;

import java.time.Instant;
import java.util.UUID;

/**
 * Result of an erasure request.
 *
 * @param anonymousId id the retained anonymized data lives under, null for complete deletion
 */
public record ErasureSummary(
        UUID ownerId,
        UUID requestId,
        int recordsDeleted,
        String anonymousId,
        Instant completedAt
) {}
