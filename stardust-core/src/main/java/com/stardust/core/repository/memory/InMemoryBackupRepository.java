package com.stardust.core.repository.memory;

import com.stardust.core.domain.BackupSnapshot;
import com.stardust.core.repository.BackupRepository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * In-memory backup area.
 */
public class InMemoryBackupRepository implements BackupRepository {

    private final InMemoryCollection<BackupSnapshot> backups =
            new InMemoryCollection<>("BackupSnapshot", BackupSnapshot::id, b -> b);

    @Override
    public BackupSnapshot save(BackupSnapshot snapshot) {
        return backups.put(snapshot);
    }

    @Override
    public Optional<BackupSnapshot> findById(UUID id) {
        return backups.get(id);
    }

    @Override
    public List<BackupSnapshot> findByRecordId(UUID recordId) {
        return backups.find(b -> b.recordId().equals(recordId));
    }

    @Override
    public List<BackupSnapshot> findExpired(Instant now) {
        return backups.find(b -> b.isExpiredAt(now));
    }

    @Override
    public boolean deleteById(UUID id) {
        return backups.removeIf(id, b -> true);
    }
}
