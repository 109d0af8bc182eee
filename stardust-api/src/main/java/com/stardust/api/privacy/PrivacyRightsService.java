package com.stardust.api.privacy;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.stardust.api.consent.ConsentService;
import com.stardust.api.field.FieldEncryptionService;
import com.stardust.api.retention.RetentionService;
import com.stardust.api.security.CryptoService;
import com.stardust.api.storage.ExportedRecord;
import com.stardust.api.storage.SecureRecordService;
import com.stardust.core.domain.AnonymizedRecord;
import com.stardust.core.domain.DataCategory;
import com.stardust.core.domain.DataRequest;
import com.stardust.core.domain.DataRequest.RequestType;
import com.stardust.core.domain.RequestContext;
import com.stardust.core.domain.StoredSecureRecord;
import com.stardust.core.repository.AnonymizedRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.UUID;

/**
 * Privacy Rights Service - fulfils data-subject requests: export, erasure and anonymization.
 *
 * Every operation is bound to a pending request of the matching type and completes it.
 */
@Service
public class PrivacyRightsService {

    private static final Logger log = LoggerFactory.getLogger(PrivacyRightsService.class);

    static final String ERASURE_REASON = "erasure_request";
    static final int DASHBOARD_REQUEST_LIMIT = 10;

    private final SecureRecordService secureRecords;
    private final FieldEncryptionService fieldEncryption;
    private final DataRequestService dataRequests;
    private final ConsentService consentService;
    private final RetentionService retentionService;
    private final AnonymizedRecordRepository anonymizedRepository;
    private final Clock clock;
    private final String anonymizationSalt;

    public PrivacyRightsService(
            SecureRecordService secureRecords,
            FieldEncryptionService fieldEncryption,
            DataRequestService dataRequests,
            ConsentService consentService,
            RetentionService retentionService,
            AnonymizedRecordRepository anonymizedRepository,
            Clock clock,
            @Value("${stardust.privacy.anonymization-salt}") String anonymizationSalt) {
        if (anonymizationSalt == null || anonymizationSalt.isBlank()) {
            throw new IllegalArgumentException("Anonymization salt is required");
        }
        this.secureRecords = secureRecords;
        this.fieldEncryption = fieldEncryption;
        this.dataRequests = dataRequests;
        this.consentService = consentService;
        this.retentionService = retentionService;
        this.anonymizedRepository = anonymizedRepository;
        this.clock = clock;
        this.anonymizationSalt = anonymizationSalt;
    }

    /**
     * Decrypts every active record of the owner and completes the export request.
     */
    public DataExport exportUserData(UUID ownerId, UUID requestId, RequestContext request) {
        requirePending(ownerId, requestId, RequestType.EXPORT);

        List<ExportedRecord> records = secureRecords.exportAll(ownerId, request);
        var grouped = new EnumMap<DataCategory, List<ExportedRecord>>(DataCategory.class);
        for (ExportedRecord record : records) {
            grouped.computeIfAbsent(record.category(), c -> new ArrayList<>()).add(record);
        }

        dataRequests.complete(requestId, "Exported " + records.size() + " records");
        log.info("Exported {} records for owner {}", records.size(), ownerId);
        return new DataExport(ownerId, requestId, clock.instant(), grouped, records.size());
    }

    /**
     * Removes every record of the owner and completes the erasure request.
     *
     * @param retainAnonymized anonymize the records first and keep the anonymized remainder
     */
    public ErasureSummary eraseUserData(UUID ownerId, UUID requestId, boolean retainAnonymized,
                                        RequestContext request) {
        requirePending(ownerId, requestId, RequestType.DELETE);

        String anonymousId = null;
        if (retainAnonymized) {
            anonymousId = anonymousIdOf(ownerId);
            anonymize(ownerId, anonymousId);
        }
        int deleted = secureRecords.eraseAll(ownerId, ERASURE_REASON, request);

        dataRequests.complete(requestId, "Deleted " + deleted + " records"
                + (retainAnonymized ? ", anonymized copy retained" : ""));
        return new ErasureSummary(ownerId, requestId, deleted, anonymousId, clock.instant());
    }

    /**
     * Stores an anonymized remainder of every active record and completes the request.
     * Originals are left in place.
     */
    public AnonymizationSummary anonymizeUserData(UUID ownerId, UUID requestId) {
        requirePending(ownerId, requestId, RequestType.ANONYMIZE);

        String anonymousId = anonymousIdOf(ownerId);
        int processed = anonymize(ownerId, anonymousId);

        dataRequests.complete(requestId, "Anonymized " + processed + " records as " + anonymousId);
        log.info("Anonymized {} records of owner {} as {}", processed, ownerId, anonymousId);
        return new AnonymizationSummary(requestId, anonymousId, processed, clock.instant());
    }

    public PrivacyDashboard privacyDashboard(UUID ownerId) {
        List<DataRequest> requests = dataRequests.list(ownerId);
        return new PrivacyDashboard(
                ownerId,
                consentService.currentConsents(ownerId),
                requests.size() > DASHBOARD_REQUEST_LIMIT ? requests.subList(0, DASHBOARD_REQUEST_LIMIT) : requests,
                secureRecords.inventory(ownerId),
                retentionService.retentionSummary(ownerId));
    }

    /**
     * Stable pseudonym: {@code anon_} + first 16 hex chars of SHA-256(owner + "_" + salt).
     */
    public String anonymousIdOf(UUID ownerId) {
        return "anon_" + CryptoService.checksum(ownerId + "_" + anonymizationSalt).substring(0, 16);
    }

    private int anonymize(UUID ownerId, String anonymousId) {
        Instant now = clock.instant();
        int processed = 0;
        for (StoredSecureRecord record : secureRecords.storedRecordsOf(ownerId)) {
            // Only the unmarked fields of field-level documents are kept, they were never encrypted
            ObjectNode payload = record.getStorageMode() == StoredSecureRecord.StorageMode.FIELD_LEVEL
                    ? fieldEncryption.stripMarkedFields(record.getDocument(), record.getSchemaName())
                    : null;
            anonymizedRepository.save(new AnonymizedRecord(UUID.randomUUID(), anonymousId, record.getCategory(),
                    record.getSensitivity(), record.getCreatedAt(), now, payload));
            processed++;
        }
        return processed;
    }

    private void requirePending(UUID ownerId, UUID requestId, RequestType type) {
        DataRequest request = dataRequests.get(requestId);
        if (!request.getOwnerId().equals(ownerId)) {
            throw new IllegalArgumentException("Request " + requestId + " does not belong to owner " + ownerId);
        }
        if (request.getType() != type) {
            throw new IllegalArgumentException("Request " + requestId + " is a " + request.getType()
                    + " request, not " + type);
        }
        if (!request.isPending()) {
            throw new IllegalStateException("Request " + requestId + " is already " + request.getStatus());
        }
    }
}
