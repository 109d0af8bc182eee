package com.stardust.core.repository.memory;

import com.stardust.core.domain.ConsentRecord;
import com.stardust.core.domain.DataCategory;
import com.stardust.core.repository.ConsentRecordRepository;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * In-memory, append-only consent history.
 */
public class InMemoryConsentRecordRepository implements ConsentRecordRepository {

    private final List<ConsentRecord> history = new ArrayList<>();

    @Override
    public synchronized void append(ConsentRecord consent) {
        history.add(consent);
    }

    @Override
    public synchronized Optional<ConsentRecord> findLatest(UUID ownerId, DataCategory category) {
        ConsentRecord latest = null;
        for (ConsentRecord consent : history) {
            if (consent.ownerId().equals(ownerId) && consent.category() == category
                    && (latest == null || !consent.recordedAt().isBefore(latest.recordedAt()))) {
                latest = consent;
            }
        }
        return Optional.ofNullable(latest);
    }

    @Override
    public synchronized List<ConsentRecord> findByOwner(UUID ownerId) {
        var result = new ArrayList<ConsentRecord>();
        for (int i = history.size() - 1; i >= 0; i--) {
            if (history.get(i).ownerId().equals(ownerId)) {
                result.add(history.get(i));
            }
        }
        result.sort((a, b) -> b.recordedAt().compareTo(a.recordedAt()));
        return List.copyOf(result);
    }
}
