package com.stardust.core.repository.memory;

import com.stardust.core.domain.RetentionStatus;
import com.stardust.core.domain.RetentionTrackingRecord;
import com.stardust.core.repository.RetentionTrackingRepository;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * In-memory implementation of RetentionTrackingRepository for testing and development.
 */
public class InMemoryRetentionTrackingRepository implements RetentionTrackingRepository {

    private final InMemoryCollection<RetentionTrackingRecord> tracking = new InMemoryCollection<>(
            "RetentionTrackingRecord", RetentionTrackingRecord::getId, RetentionTrackingRecord::copy);

    @Override
    public RetentionTrackingRecord save(RetentionTrackingRecord record) {
        return tracking.put(record);
    }

    @Override
    public Optional<RetentionTrackingRecord> findById(UUID id) {
        return tracking.get(id);
    }

    @Override
    public Optional<RetentionTrackingRecord> findByRecordId(UUID recordId) {
        return tracking.find(t -> t.getRecordId().equals(recordId)).stream().findFirst();
    }

    @Override
    public List<RetentionTrackingRecord> findByOwner(UUID ownerId) {
        return tracking.find(t -> t.getOwnerId().equals(ownerId),
                Comparator.comparing(RetentionTrackingRecord::getCreatedAt));
    }

    @Override
    public List<RetentionTrackingRecord> findByStatus(RetentionStatus status) {
        return tracking.find(t -> t.getStatus() == status,
                Comparator.comparing(RetentionTrackingRecord::getScheduledDeletionDate));
    }

    @Override
    public RetentionTrackingRecord update(UUID id, Consumer<RetentionTrackingRecord> patch) {
        return tracking.update(id, patch);
    }
}
