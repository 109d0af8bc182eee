package com.stardust.api.retention;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.UUID;

/**
 * Outcome of one tracked record within a sweep.
 */
public record SweepDetail(UUID trackingId, UUID recordId, Outcome outcome, String reason) {

    public enum Outcome {
        ARCHIVED,
        DELETED,
        PURGED,
        SKIPPED,
        PENDING_REVIEW,
        ERROR;

        @JsonValue
        public String value() {
            return name().toLowerCase();
        }
    }
}
