package com.stardust.core.repository;

import com.stardust.core.domain.DataRequest;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Repository for data-subject requests.
 */
public interface DataRequestRepository {

    DataRequest save(DataRequest request);

    Optional<DataRequest> findById(UUID id);

    /**
     * Find requests of an owner, most recent first.
     */
    List<DataRequest> findByOwner(UUID ownerId);

    /**
     * Apply {@code patch} atomically.
     *
     * @throws RecordNotFoundException if no request has this id
     */
    DataRequest update(UUID id, Consumer<DataRequest> patch);
}
