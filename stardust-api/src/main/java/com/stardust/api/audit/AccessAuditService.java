package com.stardust.api.audit;

import com.stardust.core.domain.AccessLogEntry;
import com.stardust.core.domain.AccessType;
import com.stardust.core.domain.DataCategory;
import com.stardust.core.domain.RequestContext;
import com.stardust.core.repository.AccessLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Access Audit Service - append-only log of who accessed which record, when, and with what outcome.
 *
 * Appends are best effort: a failing log store never blocks the guarded data operation.
 * Failures come back as an {@link AuditAppendResult} for the caller to discard explicitly.
 */
@Service
public class AccessAuditService {

    private static final Logger log = LoggerFactory.getLogger(AccessAuditService.class);

    private final AccessLogRepository accessLogRepository;
    private final Clock clock;
    private final int defaultLimit;
    private final int maxLimit;

    public AccessAuditService(
            AccessLogRepository accessLogRepository,
            Clock clock,
            @Value("${stardust.audit.default-limit:100}") int defaultLimit,
            @Value("${stardust.audit.max-limit:1000}") int maxLimit) {
        if (defaultLimit <= 0 || maxLimit < defaultLimit) {
            throw new IllegalArgumentException("Audit limits must satisfy 0 < default <= max");
        }
        this.accessLogRepository = accessLogRepository;
        this.clock = clock;
        this.defaultLimit = defaultLimit;
        this.maxLimit = maxLimit;
    }

    /**
     * Appends an entry. Never throws.
     */
    public AuditAppendResult append(AccessLogEntry entry) {
        try {
            accessLogRepository.append(entry);
            return AuditAppendResult.appended(entry.id());
        } catch (RuntimeException e) {
            log.debug("Access log store rejected entry {}", entry.id(), e);
            return AuditAppendResult.failed(entry.id(), e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    public AuditAppendResult recordSuccess(UUID actorId, UUID targetId, DataCategory category,
                                           AccessType accessType, RequestContext request,
                                           Map<String, String> context) {
        return append(AccessLogEntry.success(actorId, targetId, category, accessType,
                clock.instant(), request, context));
    }

    public AuditAppendResult recordFailure(UUID actorId, UUID targetId, DataCategory category,
                                           AccessType accessType, String errorMessage,
                                           RequestContext request, Map<String, String> context) {
        return append(AccessLogEntry.failure(actorId, targetId, category, accessType,
                clock.instant(), errorMessage, request, context));
    }

    /**
     * Entries of an actor, most recent first.
     *
     * @param limit requested page size; null or non-positive means the default, capped at the maximum
     * @param category null for all categories
     * @param accessType null for all access types
     */
    public List<AccessLogEntry> query(UUID actorId, Integer limit, DataCategory category, AccessType accessType) {
        if (actorId == null) {
            throw new IllegalArgumentException("Actor id is required");
        }
        return accessLogRepository.findByActor(actorId, category, accessType, effectiveLimit(limit));
    }

    /**
     * Every entry that references a record, most recent first.
     */
    public List<AccessLogEntry> historyOf(UUID targetId) {
        return accessLogRepository.findByTarget(targetId);
    }

    int effectiveLimit(Integer requested) {
        if (requested == null || requested <= 0) {
            return defaultLimit;
        }
        return Math.min(requested, maxLimit);
    }

    /**
     * Logs and drops a failed append. The data operation has already happened either way.
     */
    public static void discardFailure(AuditAppendResult result, Logger caller) {
        if (result.failed()) {
            caller.warn("Audit entry {} could not be written: {}", result.entryId(), result.failureReason());
        }
    }
}
