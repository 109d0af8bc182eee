package com.stardust.core.repository;

import com.stardust.core.domain.RetentionStatus;
import com.stardust.core.domain.RetentionTrackingRecord;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Repository for retention tracking records. Records are never deleted.
 */
public interface RetentionTrackingRepository {

    RetentionTrackingRecord save(RetentionTrackingRecord tracking);

    Optional<RetentionTrackingRecord> findById(UUID id);

    Optional<RetentionTrackingRecord> findByRecordId(UUID recordId);

    List<RetentionTrackingRecord> findByOwner(UUID ownerId);

    List<RetentionTrackingRecord> findByStatus(RetentionStatus status);

    /**
     * Apply {@code patch} atomically.
     *
     * @throws RecordNotFoundException if no tracking record has this id
     */
    RetentionTrackingRecord update(UUID id, Consumer<RetentionTrackingRecord> patch);
}
