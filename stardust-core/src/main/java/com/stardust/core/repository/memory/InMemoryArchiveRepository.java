package com.stardust.core.repository.memory;

import com.stardust.core.domain.ArchivedRecord;
import com.stardust.core.repository.ArchiveRepository;

import java.util.List;
import java.util.UUID;

/**
 * In-memory archive area.
 */
public class InMemoryArchiveRepository implements ArchiveRepository {

    // Archived copies are immutable records; the snapshot accessor already copies
    private final InMemoryCollection<ArchivedRecord> archive =
            new InMemoryCollection<>("ArchivedRecord", ArchivedRecord::id, a -> a);

    @Override
    public ArchivedRecord save(ArchivedRecord archived) {
        return archive.put(archived);
    }

    @Override
    public List<ArchivedRecord> findByOriginalRecordId(UUID recordId) {
        return archive.find(a -> a.originalRecordId().equals(recordId));
    }

    @Override
    public List<ArchivedRecord> findByOwner(UUID ownerId) {
        return archive.find(a -> a.ownerId().equals(ownerId));
    }
}
