package com.stardust.api.retention;

import java.time.Instant;

/**
 * Tracked records of one owner sharing a category and status.
 *
 * @param nextDeletion earliest scheduled deletion among them
 * @param nextArchive earliest scheduled archive date among them, null if none archives
 */
public record RetentionSummary(int count, Instant nextDeletion, Instant nextArchive) {

    RetentionSummary merge(Instant deletion, Instant archive) {
        return new RetentionSummary(count + 1, earliest(nextDeletion, deletion), earliest(nextArchive, archive));
    }

    private static Instant earliest(Instant a, Instant b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.isBefore(b) ? a : b;
    }
}
