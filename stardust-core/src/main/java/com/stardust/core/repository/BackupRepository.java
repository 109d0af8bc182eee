package com.stardust.core.repository;

import com.stardust.core.domain.BackupSnapshot;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Backup area for snapshots written before retention deletion.
 */
public interface BackupRepository {

    BackupSnapshot save(BackupSnapshot snapshot);

    Optional<BackupSnapshot> findById(UUID id);

    List<BackupSnapshot> findByRecordId(UUID recordId);

    /**
     * Find snapshots whose expiry is at or before {@code now}.
     */
    List<BackupSnapshot> findExpired(Instant now);

    boolean deleteById(UUID id);
}
