package com.stardust.core.repository;

import com.stardust.core.domain.ArchivedRecord;

import java.util.List;
import java.util.UUID;

/**
 * Archive area for record copies.
 */
public interface ArchiveRepository {

    ArchivedRecord save(ArchivedRecord archived);

    List<ArchivedRecord> findByOriginalRecordId(UUID recordId);

    List<ArchivedRecord> findByOwner(UUID ownerId);
}
