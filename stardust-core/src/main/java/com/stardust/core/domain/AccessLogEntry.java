package com.stardust.core.domain;

import com.fasterxml.jackson.annotation.JsonFormat;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Immutable record of a single access to secure data.
 * Append-only: entries are never mutated after insertion and outlive the record they reference.
 *
 * @param id entry id
 * @param actorId user on whose behalf the access happened
 * @param targetId accessed record, null when the access did not resolve to a record
 * @param category data category of the target, null when unknown
 * @param accessType kind of access
 * @param timestamp when the access happened
 * @param success whether the operation succeeded
 * @param errorMessage failure reason when {@code success} is false
 * @param sourceAddress caller network address
 * @param userAgent caller agent string
 * @param context free-form context, e.g. {@code reason=expired}
 */
public record AccessLogEntry(
        UUID id,
        UUID actorId,
        UUID targetId,
        DataCategory category,
        AccessType accessType,
        @JsonFormat(shape = JsonFormat.Shape.STRING) Instant timestamp,
        boolean success,
        String errorMessage,
        String sourceAddress,
        String userAgent,
        Map<String, String> context
) {
    public AccessLogEntry {
        if (id == null) {
            throw new IllegalArgumentException("Entry id is required");
        }
        if (actorId == null) {
            throw new IllegalArgumentException("Actor id is required");
        }
        if (accessType == null) {
            throw new IllegalArgumentException("Access type is required");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("Timestamp is required");
        }
        context = context == null ? Map.of() : Map.copyOf(context);
    }

    public static AccessLogEntry success(
            UUID actorId, UUID targetId, DataCategory category, AccessType accessType,
            Instant timestamp, RequestContext request, Map<String, String> context) {
        var req = request == null ? RequestContext.NONE : request;
        return new AccessLogEntry(UUID.randomUUID(), actorId, targetId, category, accessType,
                timestamp, true, null, req.sourceAddress(), req.userAgent(), context);
    }

    public static AccessLogEntry failure(
            UUID actorId, UUID targetId, DataCategory category, AccessType accessType,
            Instant timestamp, String errorMessage, RequestContext request, Map<String, String> context) {
        var req = request == null ? RequestContext.NONE : request;
        return new AccessLogEntry(UUID.randomUUID(), actorId, targetId, category, accessType,
                timestamp, false, errorMessage, req.sourceAddress(), req.userAgent(), context);
    }
}
