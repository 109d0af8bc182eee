package com.stardust.core.repository;

import com.stardust.core.domain.StoredSecureRecord;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Repository for stored secure records.
 * Every operation is atomic for a single record; no cross-record transactions exist.
 */
public interface SecureRecordRepository {

    /**
     * Insert or replace a record.
     */
    StoredSecureRecord save(StoredSecureRecord record);

    Optional<StoredSecureRecord> findById(UUID id);

    /**
     * Find a record of the owner that is active and not expired at {@code now}.
     */
    Optional<StoredSecureRecord> findVisible(UUID id, UUID ownerId, Instant now);

    /**
     * Find all records of an owner, active or not.
     */
    List<StoredSecureRecord> findByOwner(UUID ownerId);

    /**
     * Find active records whose expiry is strictly before {@code now}.
     */
    List<StoredSecureRecord> findExpired(Instant now);

    /**
     * Apply {@code patch} to the record if it matches {@code filter}, atomically.
     *
     * @return the patched record, empty if nothing matched
     */
    Optional<StoredSecureRecord> updateOne(UUID id, Predicate<StoredSecureRecord> filter,
                                           Consumer<StoredSecureRecord> patch);

    /**
     * Remove the record if it matches {@code filter}, atomically.
     */
    boolean deleteOne(UUID id, Predicate<StoredSecureRecord> filter);

    long count();
}
