package com.stardust.core.domain;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.util.UUID;

/**
 * Anonymized remainder of a user's record, keyed by a stable anonymous id instead of the owner.
 *
 * @param payload the payload without any schema-marked field, null when nothing could be kept
 */
public record AnonymizedRecord(
        UUID id,
        String anonymousId,
        DataCategory category,
        SensitivityLevel sensitivity,
        Instant originalCreatedAt,
        Instant anonymizedAt,
        ObjectNode payload
) {
    public AnonymizedRecord {
        if (anonymousId == null || !anonymousId.startsWith("anon_")) {
            throw new IllegalArgumentException("Anonymous id must start with anon_");
        }
        payload = payload == null ? null : payload.deepCopy();
    }

    @Override
    public ObjectNode payload() {
        return payload == null ? null : payload.deepCopy();
    }
}
