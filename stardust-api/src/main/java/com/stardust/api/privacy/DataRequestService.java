package com.stardust.api.privacy;

import com.stardust.core.domain.DataRequest;
import com.stardust.core.domain.DataRequest.RequestType;
import com.stardust.core.repository.DataRequestRepository;
import com.stardust.core.repository.RecordNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Data-subject request intake: export, erasure, anonymization and rectification requests.
 */
@Service
public class DataRequestService {

    private static final Logger log = LoggerFactory.getLogger(DataRequestService.class);

    private final DataRequestRepository requestRepository;
    private final Clock clock;

    public DataRequestService(DataRequestRepository requestRepository, Clock clock) {
        this.requestRepository = requestRepository;
        this.clock = clock;
    }

    public DataRequest create(UUID ownerId, RequestType type, Map<String, String> details) {
        DataRequest request = requestRepository.save(DataRequest.create(ownerId, type, details, clock.instant()));
        log.info("Created {} request {} for owner {} (priority {})",
                type, request.getId(), ownerId, request.getPriority());
        return request;
    }

    public DataRequest get(UUID requestId) {
        return requestRepository.findById(requestId)
                .orElseThrow(() -> new RecordNotFoundException("DataRequest", requestId));
    }

    /**
     * Requests of the owner, most recent first.
     */
    public List<DataRequest> list(UUID ownerId) {
        return requestRepository.findByOwner(ownerId);
    }

    /**
     * Whether the owner has an erasure request that is still open.
     */
    public boolean hasPendingErasure(UUID ownerId) {
        return requestRepository.findByOwner(ownerId).stream()
                .anyMatch(r -> r.getType() == RequestType.DELETE && r.isPending());
    }

    public DataRequest complete(UUID requestId, String summary) {
        DataRequest completed = requestRepository.update(requestId, r -> r.markCompleted(summary, clock.instant()));
        log.info("Completed {} request {}", completed.getType(), requestId);
        return completed;
    }

    public DataRequest reject(UUID requestId, String reason) {
        DataRequest rejected = requestRepository.update(requestId, r -> r.markRejected(reason, clock.instant()));
        log.info("Rejected {} request {}: {}", rejected.getType(), requestId, reason);
        return rejected;
    }
}
