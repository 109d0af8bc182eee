package com.stardust.api.retention;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.stardust.api.compliance.ComplianceDecision;
import com.stardust.api.compliance.ComplianceGate;
import com.stardust.api.retention.SweepDetail.Outcome;
import com.stardust.api.security.CategoryKeyRing;
import com.stardust.api.security.CryptoService;
import com.stardust.api.storage.SecureRecordService;
import com.stardust.core.domain.ArchivedRecord;
import com.stardust.core.domain.BackupSnapshot;
import com.stardust.core.domain.DataCategory;
import com.stardust.core.domain.RetentionPolicy;
import com.stardust.core.domain.RetentionStatus;
import com.stardust.core.domain.RetentionTrackingRecord;
import com.stardust.core.domain.StoredSecureRecord;
import com.stardust.core.repository.ArchiveRepository;
import com.stardust.core.repository.BackupRepository;
import com.stardust.core.repository.RecordNotFoundException;
import com.stardust.core.repository.RetentionTrackingRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Retention Service - moves tracked records through the retention state machine.
 *
 * ACTIVE records are archived once their archive date passes (non-destructive), and deleted
 * once their deletion date passes, provided the compliance gate allows it. Sweeps only touch
 * records already past their scheduled dates and never abort: per-record failures end up in
 * the returned {@link SweepResult}.
 */
@Service
public class RetentionService {

    private static final Logger log = LoggerFactory.getLogger(RetentionService.class);

    static final String RETENTION_REASON = "retention_policy";
    static final String AWAITING_APPROVAL = "awaiting_manual_approval";
    static final String RECORD_NOT_REMOVED = "Underlying record was not removed";

    private final RetentionTrackingRepository trackingRepository;
    private final RetentionPolicyRegistry policyRegistry;
    private final SecureRecordService secureRecords;
    private final ComplianceGate complianceGate;
    private final ArchiveRepository archiveRepository;
    private final BackupRepository backupRepository;
    private final CategoryKeyRing keyRing;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration backupRetention;

    public RetentionService(
            RetentionTrackingRepository trackingRepository,
            RetentionPolicyRegistry policyRegistry,
            SecureRecordService secureRecords,
            ComplianceGate complianceGate,
            ArchiveRepository archiveRepository,
            BackupRepository backupRepository,
            CategoryKeyRing keyRing,
            ObjectMapper objectMapper,
            Clock clock,
            @Value("${stardust.retention.backup-retention-days:90}") int backupRetentionDays) {
        if (backupRetentionDays <= 0) {
            throw new IllegalArgumentException("Backup retention must be positive");
        }
        this.trackingRepository = trackingRepository;
        this.policyRegistry = policyRegistry;
        this.secureRecords = secureRecords;
        this.complianceGate = complianceGate;
        this.archiveRepository = archiveRepository;
        this.backupRepository = backupRepository;
        this.keyRing = keyRing;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.backupRetention = Duration.ofDays(backupRetentionDays);
    }

    /**
     * Starts tracking a record under its category policy. Applying again returns the
     * existing tracking record unchanged.
     *
     * @throws RecordNotFoundException when no stored record has this id
     * @throws IllegalArgumentException when the record belongs to another owner or category
     */
    public RetentionTrackingRecord applyPolicy(UUID ownerId, DataCategory category, UUID recordId) {
        Optional<RetentionTrackingRecord> existing = trackingRepository.findByRecordId(recordId);
        if (existing.isPresent()) {
            return existing.get();
        }
        StoredSecureRecord record = secureRecords.findStored(recordId)
                .orElseThrow(() -> new RecordNotFoundException("StoredSecureRecord", recordId));
        if (!record.isOwnedBy(ownerId) || record.getCategory() != category) {
            throw new IllegalArgumentException("Record " + recordId + " does not belong to owner " + ownerId
                    + " in category " + category);
        }
        RetentionPolicy policy = policyRegistry.policyFor(category);
        RetentionTrackingRecord tracking = trackingRepository.save(
                RetentionTrackingRecord.create(ownerId, recordId, category, policy, clock.instant()));
        log.info("Applied {} retention policy to record {}: delete at {}, archive at {}",
                category, recordId, tracking.getScheduledDeletionDate(), tracking.getScheduledArchiveDate());
        return tracking;
    }

    /**
     * Archives every ACTIVE record whose archive date has passed and deletion date has not.
     */
    public SweepResult processScheduledArchiving() {
        Instant now = clock.instant();
        var tally = new SweepResult.Tally("archiving", now);

        for (RetentionTrackingRecord tracking : trackingRepository.findByStatus(RetentionStatus.ACTIVE)) {
            if (!tracking.isDueForArchiving(now)) {
                continue;
            }
            tally.add(archive(tracking, now));
        }

        SweepResult result = tally.finish(clock.instant());
        logSweep(result);
        return result;
    }

    /**
     * Deletes every ACTIVE or ARCHIVED record whose deletion date has passed, subject to the
     * compliance gate. Policies without auto-delete park due records for manual approval.
     */
    public SweepResult processScheduledDeletions() {
        Instant now = clock.instant();
        var tally = new SweepResult.Tally("deletion", now);

        var candidates = new ArrayList<RetentionTrackingRecord>();
        candidates.addAll(trackingRepository.findByStatus(RetentionStatus.ACTIVE));
        candidates.addAll(trackingRepository.findByStatus(RetentionStatus.ARCHIVED));

        for (RetentionTrackingRecord tracking : candidates) {
            if (!tracking.isDueForDeletion(now)) {
                continue;
            }
            tally.add(processDeletion(tracking, now));
        }

        SweepResult result = tally.finish(clock.instant());
        logSweep(result);
        return result;
    }

    /**
     * Deletes a record parked for manual approval, after consulting the compliance gate again.
     */
    public SweepDetail approveDeletion(UUID trackingId) {
        RetentionTrackingRecord tracking = trackingRepository.findById(trackingId)
                .orElseThrow(() -> new RecordNotFoundException("RetentionTrackingRecord", trackingId));
        if (tracking.getStatus() != RetentionStatus.PENDING_DELETION) {
            throw new IllegalStateException("Tracking record " + trackingId + " is " + tracking.getStatus()
                    + ", not awaiting approval");
        }

        Instant now = clock.instant();
        try {
            ComplianceDecision decision = gate(tracking, now);
            if (!decision.allowed()) {
                return new SweepDetail(trackingId, tracking.getRecordId(), Outcome.SKIPPED, decision.reason());
            }
            SweepDetail detail = executeDeletion(tracking, now);
            log.info("Approved deletion of record {} (tracking {})", tracking.getRecordId(), trackingId);
            return detail;
        } catch (RuntimeException e) {
            log.warn("Approved deletion of tracking record {} failed: {}", trackingId, e.getMessage());
            return new SweepDetail(trackingId, tracking.getRecordId(), Outcome.ERROR, e.getMessage());
        }
    }

    /**
     * Removes expired backup snapshots and marks their tracking records PURGED.
     */
    public SweepResult purgeExpiredBackups() {
        Instant now = clock.instant();
        var tally = new SweepResult.Tally("backup-purge", now);

        for (BackupSnapshot backup : backupRepository.findExpired(now)) {
            try {
                backupRepository.deleteById(backup.id());
                trackingRepository.findById(backup.trackingId())
                        .filter(t -> t.getStatus() == RetentionStatus.DELETED)
                        .ifPresent(t -> trackingRepository.update(t.getId(), r -> r.markPurged(now)));
                tally.add(new SweepDetail(backup.trackingId(), backup.recordId(), Outcome.PURGED, "backup expired"));
            } catch (RuntimeException e) {
                log.warn("Failed to purge backup {}: {}", backup.id(), e.getMessage());
                tally.add(new SweepDetail(backup.trackingId(), backup.recordId(), Outcome.ERROR, e.getMessage()));
            }
        }

        SweepResult result = tally.finish(clock.instant());
        logSweep(result);
        return result;
    }

    /**
     * Tracked records of an owner grouped by category and status.
     */
    public Map<DataCategory, Map<RetentionStatus, RetentionSummary>> retentionSummary(UUID ownerId) {
        var summary = new EnumMap<DataCategory, Map<RetentionStatus, RetentionSummary>>(DataCategory.class);
        for (RetentionTrackingRecord tracking : trackingRepository.findByOwner(ownerId)) {
            summary.computeIfAbsent(tracking.getCategory(), c -> new EnumMap<>(RetentionStatus.class))
                    .merge(tracking.getStatus(),
                            new RetentionSummary(1, tracking.getScheduledDeletionDate(), tracking.getScheduledArchiveDate()),
                            (a, b) -> a.merge(b.nextDeletion(), b.nextArchive()));
        }
        return summary;
    }

    public Optional<RetentionTrackingRecord> trackingFor(UUID recordId) {
        return trackingRepository.findByRecordId(recordId);
    }

    private SweepDetail archive(RetentionTrackingRecord tracking, Instant now) {
        UUID recordId = tracking.getRecordId();
        try {
            Optional<StoredSecureRecord> record = secureRecords.findStored(recordId);
            if (record.isEmpty()) {
                return new SweepDetail(tracking.getId(), recordId, Outcome.ERROR, "Underlying record not found");
            }
            archiveRepository.save(ArchivedRecord.of(record.get(), now, RETENTION_REASON));
            secureRecords.markArchived(recordId, RETENTION_REASON);
            trackingRepository.update(tracking.getId(), t -> t.markArchived(now));
            log.debug("Archived record {} (tracking {})", recordId, tracking.getId());
            return new SweepDetail(tracking.getId(), recordId, Outcome.ARCHIVED, RETENTION_REASON);
        } catch (RuntimeException e) {
            log.warn("Failed to archive record {}: {}", recordId, e.getMessage());
            return new SweepDetail(tracking.getId(), recordId, Outcome.ERROR, e.getMessage());
        }
    }

    private SweepDetail processDeletion(RetentionTrackingRecord tracking, Instant now) {
        UUID recordId = tracking.getRecordId();
        try {
            ComplianceDecision decision = gate(tracking, now);
            if (!decision.allowed()) {
                trackingRepository.update(tracking.getId(), t -> t.noteSkipped(decision.reason(), now));
                log.debug("Deletion of record {} skipped: {}", recordId, decision.reason());
                return new SweepDetail(tracking.getId(), recordId, Outcome.SKIPPED, decision.reason());
            }
            if (!tracking.getPolicy().autoDelete()) {
                trackingRepository.update(tracking.getId(), t -> t.markPendingDeletion(AWAITING_APPROVAL, now));
                return new SweepDetail(tracking.getId(), recordId, Outcome.PENDING_REVIEW, AWAITING_APPROVAL);
            }
            return executeDeletion(tracking, now);
        } catch (RuntimeException e) {
            log.warn("Failed to delete record {}: {}", recordId, e.getMessage());
            return new SweepDetail(tracking.getId(), recordId, Outcome.ERROR, e.getMessage());
        }
    }

    private ComplianceDecision gate(RetentionTrackingRecord tracking, Instant now) {
        ComplianceDecision decision = complianceGate.canDelete(tracking.getOwnerId(), tracking.getCategory(), tracking);
        if (!decision.verdicts().isEmpty()) {
            trackingRepository.update(tracking.getId(),
                    t -> decision.verdicts().forEach((regulation, ok) -> t.recordCompliance(regulation, ok, now)));
        }
        return decision;
    }

    /**
     * Backs up (when the policy asks for it) and removes the record, then marks it DELETED.
     * A failed backup aborts the deletion.
     */
    private SweepDetail executeDeletion(RetentionTrackingRecord tracking, Instant now) {
        UUID recordId = tracking.getRecordId();
        Optional<StoredSecureRecord> record = secureRecords.findStored(recordId);

        if (record.isEmpty()) {
            trackingRepository.update(tracking.getId(), t -> t.markDeleted(now));
            return new SweepDetail(tracking.getId(), recordId, Outcome.DELETED, "Record already removed");
        }
        BackupSnapshot snapshot = null;
        if (tracking.getPolicy().backupBeforeDeletion()) {
            snapshot = backupRepository.save(backup(tracking, record.get(), now));
        }
        boolean removed = secureRecords.deleteForRetention(
                tracking.getOwnerId(), recordId, tracking.getCategory(), RETENTION_REASON);
        if (!removed) {
            if (snapshot != null) {
                backupRepository.deleteById(snapshot.id());
            }
            log.warn("Record {} was not removed for tracking {}", recordId, tracking.getId());
            return new SweepDetail(tracking.getId(), recordId, Outcome.ERROR, RECORD_NOT_REMOVED);
        }
        trackingRepository.update(tracking.getId(), t -> t.markDeleted(now));
        log.debug("Deleted record {} (tracking {})", recordId, tracking.getId());
        return new SweepDetail(tracking.getId(), recordId, Outcome.DELETED, RETENTION_REASON);
    }

    private BackupSnapshot backup(RetentionTrackingRecord tracking, StoredSecureRecord record, Instant now) {
        ObjectNode snapshot = objectMapper.createObjectNode();
        snapshot.put("recordId", record.getId().toString());
        snapshot.put("ownerId", record.getOwnerId().toString());
        snapshot.put("category", record.getCategory().value());
        snapshot.put("sensitivity", record.getSensitivity().value());
        snapshot.put("storageMode", record.getStorageMode().name());
        snapshot.put("schema", record.getSchemaName());
        snapshot.put("encryptedData", record.getEncryptedData());
        snapshot.set("document", record.getDocument());
        snapshot.put("checksum", record.getChecksum());
        snapshot.put("createdAt", record.getCreatedAt().toString());
        snapshot.put("expiresAt", record.getExpiresAt().toString());

        String serialized;
        try {
            serialized = objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new CryptoService.EncryptionException("Backup snapshot could not be serialized", e);
        }
        CryptoService crypto = keyRing.forCategory(record.getCategory());
        return new BackupSnapshot(UUID.randomUUID(), tracking.getId(), record.getId(), record.getOwnerId(),
                record.getCategory(), crypto.encryptString(serialized), CryptoService.checksum(serialized),
                now, now.plus(backupRetention));
    }

    private static void logSweep(SweepResult result) {
        if (result.processed() == 0) {
            log.debug("Retention {} sweep found nothing to do", result.sweep());
            return;
        }
        log.info("Retention {} sweep: processed={}, archived={}, deleted={}, skipped={}, pendingReview={}, errors={}",
                result.sweep(), result.processed(), result.archived(), result.deleted(),
                result.skipped(), result.pendingReview(), result.errors());
    }
}
