package com.stardust.core.repository.memory;

import com.stardust.core.domain.AccessLogEntry;
import com.stardust.core.domain.AccessType;
import com.stardust.core.domain.DataCategory;
import com.stardust.core.repository.AccessLogRepository;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.function.Predicate;

/**
 * In-memory, append-only access log.
 * Entries with equal timestamps keep insertion order, newest first.
 */
public class InMemoryAccessLogRepository implements AccessLogRepository {

    private final List<AccessLogEntry> entries = new ArrayList<>();

    @Override
    public synchronized void append(AccessLogEntry entry) {
        entries.add(entry);
    }

    @Override
    public List<AccessLogEntry> findByActor(UUID actorId, DataCategory category, AccessType accessType, int limit) {
        return newestFirst(e -> e.actorId().equals(actorId)
                && (category == null || category == e.category())
                && (accessType == null || accessType == e.accessType()), limit);
    }

    @Override
    public List<AccessLogEntry> findByTarget(UUID targetId) {
        return newestFirst(e -> targetId.equals(e.targetId()), Integer.MAX_VALUE);
    }

    @Override
    public synchronized long count() {
        return entries.size();
    }

    private synchronized List<AccessLogEntry> newestFirst(Predicate<AccessLogEntry> filter, int limit) {
        var result = new ArrayList<AccessLogEntry>();
        // Walk backwards by insertion, then order by timestamp; sort is stable
        for (int i = entries.size() - 1; i >= 0; i--) {
            if (filter.test(entries.get(i))) {
                result.add(entries.get(i));
            }
        }
        result.sort((a, b) -> b.timestamp().compareTo(a.timestamp()));
        return result.size() > limit ? List.copyOf(result.subList(0, limit)) : List.copyOf(result);
    }
}
