package com.stardust.core.repository;

import com.stardust.core.domain.ConsentRecord;
import com.stardust.core.domain.DataCategory;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for consent decisions. Append-only.
 */
public interface ConsentRecordRepository {

    void append(ConsentRecord consent);

    /**
     * Find the latest decision of an owner for a category.
     */
    Optional<ConsentRecord> findLatest(UUID ownerId, DataCategory category);

    /**
     * Find all decisions of an owner, most recent first.
     */
    List<ConsentRecord> findByOwner(UUID ownerId);
}
