package com.stardust.core.repository.memory;

import com.stardust.core.domain.AnonymizedRecord;
import com.stardust.core.repository.AnonymizedRecordRepository;

import java.util.List;

/**
 * In-memory store for anonymized records.
 */
public class InMemoryAnonymizedRecordRepository implements AnonymizedRecordRepository {

    // AnonymizedRecord copies its payload on construction and is never mutated afterwards
    private final InMemoryCollection<AnonymizedRecord> records =
            new InMemoryCollection<>("AnonymizedRecord", AnonymizedRecord::id, r -> r);

    @Override
    public AnonymizedRecord save(AnonymizedRecord record) {
        return records.put(record);
    }

    @Override
    public List<AnonymizedRecord> findByAnonymousId(String anonymousId) {
        return records.find(r -> r.anonymousId().equals(anonymousId));
    }
}
