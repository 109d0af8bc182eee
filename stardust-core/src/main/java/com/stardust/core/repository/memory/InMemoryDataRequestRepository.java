package com.stardust.core.repository.memory;

import com.stardust.core.domain.DataRequest;
import com.stardust.core.repository.DataRequestRepository;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * In-memory implementation of DataRequestRepository for testing and development.
 */
public class InMemoryDataRequestRepository implements DataRequestRepository {

    private final InMemoryCollection<DataRequest> requests =
            new InMemoryCollection<>("DataRequest", DataRequest::getId, DataRequest::copy);

    @Override
    public DataRequest save(DataRequest request) {
        return requests.put(request);
    }

    @Override
    public Optional<DataRequest> findById(UUID id) {
        return requests.get(id);
    }

    @Override
    public List<DataRequest> findByOwner(UUID ownerId) {
        return requests.find(r -> r.getOwnerId().equals(ownerId),
                Comparator.comparing(DataRequest::getCreatedAt).reversed());
    }

    @Override
    public DataRequest update(UUID id, Consumer<DataRequest> patch) {
        return requests.update(id, patch);
    }
}
