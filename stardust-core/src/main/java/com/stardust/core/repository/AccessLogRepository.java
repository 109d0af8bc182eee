package com.stardust.core.repository;

import com.stardust.core.domain.AccessLogEntry;
import com.stardust.core.domain.AccessType;
import com.stardust.core.domain.DataCategory;

import java.util.List;
import java.util.UUID;

/**
 * Repository for access log entries.
 * Append-only - no update or delete operations exposed.
 */
public interface AccessLogRepository {

    void append(AccessLogEntry entry);

    /**
     * Find entries of an actor, most recent first, optionally filtered.
     *
     * @param category null for any category
     * @param accessType null for any access type
     */
    List<AccessLogEntry> findByActor(UUID actorId, DataCategory category, AccessType accessType, int limit);

    /**
     * Find entries for a target record, most recent first.
     */
    List<AccessLogEntry> findByTarget(UUID targetId);

    long count();
}
