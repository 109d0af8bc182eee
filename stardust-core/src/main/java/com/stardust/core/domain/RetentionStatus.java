package com.stardust.core.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Retention state of a tracked record.
 * Transitions only move forward: ACTIVE, ARCHIVED, PENDING_DELETION, DELETED, PURGED.
 */
public enum RetentionStatus {
    ACTIVE(0),
    ARCHIVED(1),
    PENDING_DELETION(2),
    DELETED(3),
    PURGED(4);

    private final int rank;

    RetentionStatus(int rank) {
        this.rank = rank;
    }

    /**
     * Whether a record in this state may move to {@code target}.
     */
    public boolean canTransitionTo(RetentionStatus target) {
        if (target == null || target.rank <= this.rank) {
            return false;
        }
        // Purging only ever follows a completed deletion
        if (target == PURGED) {
            return this == DELETED;
        }
        return this != DELETED;
    }

    public boolean isTerminal() {
        return this == DELETED || this == PURGED;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }
}
