package com.stardust.core.repository.memory;

import com.stardust.core.domain.StoredSecureRecord;
import com.stardust.core.repository.SecureRecordRepository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * In-memory implementation of SecureRecordRepository for testing and development.
 * Production deployments plug in a document-store adapter.
 */
public class InMemorySecureRecordRepository implements SecureRecordRepository {

    private final InMemoryCollection<StoredSecureRecord> records =
            new InMemoryCollection<>("StoredSecureRecord", StoredSecureRecord::getId, StoredSecureRecord::copy);

    @Override
    public StoredSecureRecord save(StoredSecureRecord record) {
        return records.put(record);
    }

    @Override
    public Optional<StoredSecureRecord> findById(UUID id) {
        return records.get(id);
    }

    @Override
    public Optional<StoredSecureRecord> findVisible(UUID id, UUID ownerId, Instant now) {
        return records.get(id).filter(r -> r.isOwnedBy(ownerId) && r.isVisibleAt(now));
    }

    @Override
    public List<StoredSecureRecord> findByOwner(UUID ownerId) {
        return records.find(r -> r.isOwnedBy(ownerId), Comparator.comparing(StoredSecureRecord::getCreatedAt));
    }

    @Override
    public List<StoredSecureRecord> findExpired(Instant now) {
        return records.find(r -> r.isActive() && r.getExpiresAt().isBefore(now));
    }

    @Override
    public Optional<StoredSecureRecord> updateOne(UUID id, Predicate<StoredSecureRecord> filter,
                                                  Consumer<StoredSecureRecord> patch) {
        return records.updateIf(id, filter, patch);
    }

    @Override
    public boolean deleteOne(UUID id, Predicate<StoredSecureRecord> filter) {
        return records.removeIf(id, filter);
    }

    @Override
    public long count() {
        return records.size();
    }

    /**
     * Removes every record (for testing).
     */
    public void wipe() {
        records.clear();
    }
}
