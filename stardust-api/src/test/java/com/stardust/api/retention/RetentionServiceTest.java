package com.stardust.api.retention;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.stardust.api.SecureDataFixture;
import com.stardust.api.field.EncryptionSchemaRegistry;
import com.stardust.api.retention.SweepDetail.Outcome;
import com.stardust.api.security.CryptoService;
import com.stardust.core.domain.BackupSnapshot;
import com.stardust.core.domain.ComplianceRegulation;
import com.stardust.core.domain.DataCategory;
import com.stardust.core.domain.DataRequest.RequestType;
import com.stardust.core.domain.RetentionPolicy;
import com.stardust.core.domain.RetentionStatus;
import com.stardust.core.domain.RetentionTrackingRecord;
import com.stardust.core.domain.SensitivityLevel;
import com.stardust.core.repository.RecordNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import static com.stardust.api.SecureDataFixture.MAPPER;
import static com.stardust.api.SecureDataFixture.START;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the retention state machine: archiving, compliance-gated deletion, backups and purging.
 */
class RetentionServiceTest {

    private SecureDataFixture fixture;
    private RetentionService retention;
    private UUID owner;

    @BeforeEach
    void setUp() {
        fixture = new SecureDataFixture();
        retention = fixture.retention;
        owner = UUID.randomUUID();
    }

    private UUID storeTracked(DataCategory category) {
        ObjectNode payload = MAPPER.createObjectNode().put("title", "entry").put("body", "text");
        UUID id = fixture.store.store(owner, payload, category, SensitivityLevel.CONFIDENTIAL);
        retention.applyPolicy(owner, category, id);
        return id;
    }

    private RetentionTrackingRecord trackingOf(UUID recordId) {
        return retention.trackingFor(recordId).orElseThrow();
    }

    private void consentTo(DataCategory category) {
        fixture.consentService.recordConsent(owner, category, true, "service delivery", "contract", null);
    }

    // ==================== Policy application ====================

    @Test
    void applyPolicySchedulesDatesFromCategoryPolicy() {
        UUID id = storeTracked(DataCategory.EXPERIENCE_DATA);

        RetentionTrackingRecord tracking = trackingOf(id);
        assertThat(tracking.getStatus()).isEqualTo(RetentionStatus.ACTIVE);
        assertThat(tracking.getScheduledDeletionDate()).isEqualTo(START.plus(Duration.ofDays(1825)));
        assertThat(tracking.getScheduledArchiveDate()).isEqualTo(START.plus(Duration.ofDays(730)));
        assertThat(tracking.getComplianceFlags()).containsOnlyKeys(ComplianceRegulation.GDPR);
    }

    @Test
    void applyPolicyIsIdempotent() {
        UUID id = storeTracked(DataCategory.RATING_DATA);
        UUID trackingId = trackingOf(id).getId();

        fixture.clock.advance(Duration.ofDays(3));
        RetentionTrackingRecord again = retention.applyPolicy(owner, DataCategory.RATING_DATA, id);

        assertThat(again.getId()).isEqualTo(trackingId);
        assertThat(again.getCreatedAt()).isEqualTo(START);
        assertThat(fixture.tracking.findByOwner(owner)).hasSize(1);
    }

    @Test
    void applyPolicyRejectsRecordOfAnotherOwnerOrCategory() {
        ObjectNode payload = MAPPER.createObjectNode().put("score", 4);
        UUID id = fixture.store.store(owner, payload, DataCategory.RATING_DATA, SensitivityLevel.INTERNAL);

        assertThatThrownBy(() -> retention.applyPolicy(UUID.randomUUID(), DataCategory.RATING_DATA, id))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> retention.applyPolicy(owner, DataCategory.ACTIVITY_LOGS, id))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> retention.applyPolicy(owner, DataCategory.RATING_DATA, UUID.randomUUID()))
                .isInstanceOf(RecordNotFoundException.class);
        assertThat(retention.trackingFor(id)).isEmpty();
    }

    // ==================== Archiving ====================

    @Test
    void dueRecordsAreArchivedAndStayReadable() {
        UUID id = storeTracked(DataCategory.EXPERIENCE_DATA);
        UUID notDue = storeTracked(DataCategory.RATING_DATA);

        fixture.clock.advance(Duration.ofDays(730));
        SweepResult result = retention.processScheduledArchiving();

        assertThat(result.processed()).isEqualTo(1);
        assertThat(result.archived()).isEqualTo(1);
        assertThat(result.details()).extracting(SweepDetail::recordId).containsExactly(id);
        assertThat(trackingOf(id).getStatus()).isEqualTo(RetentionStatus.ARCHIVED);
        assertThat(trackingOf(id).getActualArchiveDate()).isEqualTo(fixture.clock.instant());
        assertThat(trackingOf(notDue).getStatus()).isEqualTo(RetentionStatus.ACTIVE);

        assertThat(fixture.archive.findByOriginalRecordId(id)).hasSize(1);
        assertThat(fixture.records.findById(id).orElseThrow().isArchived()).isTrue();
        assertThat(fixture.store.retrieve(owner, id)).isPresent();
    }

    @Test
    void archivingIsNotRepeated() {
        UUID id = storeTracked(DataCategory.EXPERIENCE_DATA);
        fixture.clock.advance(Duration.ofDays(731));

        retention.processScheduledArchiving();
        SweepResult second = retention.processScheduledArchiving();

        assertThat(second.processed()).isZero();
        assertThat(fixture.archive.findByOriginalRecordId(id)).hasSize(1);
    }

    @Test
    void archivingMissingRecordIsReportedAsError() {
        UUID id = storeTracked(DataCategory.EXPERIENCE_DATA);
        fixture.store.delete(owner, id, true);
        fixture.clock.advance(Duration.ofDays(730));

        SweepResult result = retention.processScheduledArchiving();

        assertThat(result.errors()).isEqualTo(1);
        assertThat(result.details().get(0).reason()).isEqualTo("Underlying record not found");
        assertThat(trackingOf(id).getStatus()).isEqualTo(RetentionStatus.ACTIVE);
    }

    // ==================== Deletion ====================

    @Test
    void dueRecordWithConsentIsBackedUpAndDeleted() {
        UUID id = storeTracked(DataCategory.EXPERIENCE_DATA);
        consentTo(DataCategory.EXPERIENCE_DATA);

        fixture.clock.advance(Duration.ofDays(1825));
        SweepResult result = retention.processScheduledDeletions();

        assertThat(result.deleted()).isEqualTo(1);
        assertThat(result.details().get(0).outcome()).isEqualTo(Outcome.DELETED);
        RetentionTrackingRecord tracking = trackingOf(id);
        assertThat(tracking.getStatus()).isEqualTo(RetentionStatus.DELETED);
        assertThat(tracking.getComplianceFlags()).containsEntry(ComplianceRegulation.GDPR, true);
        assertThat(fixture.records.findById(id)).isEmpty();

        assertThat(fixture.backups.findByRecordId(id)).singleElement().satisfies(backup -> {
            assertThat(backup.expiresAt()).isEqualTo(fixture.clock.instant().plus(Duration.ofDays(90)));
            assertThat(backup.encryptedData()).doesNotContain("entry");
        });
    }

    @Test
    void backupSnapshotDecryptsWithCategoryKey() throws Exception {
        UUID id = storeTracked(DataCategory.EXPERIENCE_DATA);
        consentTo(DataCategory.EXPERIENCE_DATA);
        fixture.clock.advance(Duration.ofDays(1825));

        retention.processScheduledDeletions();

        BackupSnapshot backup = fixture.backups.findByRecordId(id).get(0);
        String plaintext = fixture.keyRing.forCategory(DataCategory.EXPERIENCE_DATA).decryptString(backup.encryptedData());
        JsonNode snapshot = MAPPER.readTree(plaintext);
        assertThat(snapshot.get("recordId").asText()).isEqualTo(id.toString());
        assertThat(snapshot.get("storageMode").asText()).isEqualTo("FIELD_LEVEL");
        assertThat(backup.checksum()).isEqualTo(CryptoService.checksum(plaintext));
    }

    @Test
    void archivedRecordIsDeletedWhenDue() {
        UUID id = storeTracked(DataCategory.SOLUTION_DATA);
        consentTo(DataCategory.SOLUTION_DATA);
        fixture.clock.advance(Duration.ofDays(365));
        retention.processScheduledArchiving();

        fixture.clock.advance(Duration.ofDays(730));
        SweepResult result = retention.processScheduledDeletions();

        assertThat(result.deleted()).isEqualTo(1);
        assertThat(trackingOf(id).getStatus()).isEqualTo(RetentionStatus.DELETED);
        assertThat(fixture.backups.findByRecordId(id)).as("solution policy keeps no backup").isEmpty();
    }

    @Test
    void gdprDeniesDeletionWithoutConsentRecord() {
        UUID id = storeTracked(DataCategory.RATING_DATA);
        fixture.clock.advance(Duration.ofDays(730));

        SweepResult result = retention.processScheduledDeletions();

        assertThat(result.skipped()).isEqualTo(1);
        assertThat(result.deleted()).isZero();
        RetentionTrackingRecord tracking = trackingOf(id);
        assertThat(tracking.getStatus()).isEqualTo(RetentionStatus.ACTIVE);
        assertThat(tracking.getStatusReason()).contains("No consent record");
        assertThat(tracking.getComplianceFlags()).containsEntry(ComplianceRegulation.GDPR, false);
        assertThat(fixture.records.findById(id)).isPresent();
    }

    @Test
    void pendingErasureRequestSatisfiesGdpr() {
        UUID id = storeTracked(DataCategory.RATING_DATA);
        fixture.dataRequests.create(owner, RequestType.DELETE, Map.of());
        fixture.clock.advance(Duration.ofDays(730));

        SweepResult result = retention.processScheduledDeletions();

        assertThat(result.deleted()).isEqualTo(1);
        assertThat(trackingOf(id).getStatus()).isEqualTo(RetentionStatus.DELETED);
    }

    @Test
    void requiredConsentBlocksDeletionEvenWithErasureRequest() {
        UUID id = storeTracked(DataCategory.PERSONAL_INFO);
        fixture.dataRequests.create(owner, RequestType.DELETE, Map.of());
        fixture.clock.advance(Duration.ofDays(2555));

        SweepResult result = retention.processScheduledDeletions();

        assertThat(result.skipped()).isEqualTo(1);
        assertThat(result.details().get(0).outcome()).isEqualTo(Outcome.SKIPPED);
        assertThat(result.details().get(0).reason()).contains("requires a consent record");
        assertThat(trackingOf(id).getStatus()).isEqualTo(RetentionStatus.ACTIVE);
    }

    @Test
    void deniedRecordIsRetriedOnLaterSweeps() {
        UUID id = storeTracked(DataCategory.RATING_DATA);
        fixture.clock.advance(Duration.ofDays(730));
        retention.processScheduledDeletions();

        consentTo(DataCategory.RATING_DATA);
        fixture.clock.advance(Duration.ofDays(1));
        SweepResult result = retention.processScheduledDeletions();

        assertThat(result.deleted()).isEqualTo(1);
        assertThat(trackingOf(id).getStatus()).isEqualTo(RetentionStatus.DELETED);
    }

    @Test
    void alreadyRemovedRecordIsMarkedDeleted() {
        UUID id = storeTracked(DataCategory.RATING_DATA);
        consentTo(DataCategory.RATING_DATA);
        fixture.store.delete(owner, id, true);
        fixture.clock.advance(Duration.ofDays(730));

        SweepResult result = retention.processScheduledDeletions();

        assertThat(result.deleted()).isEqualTo(1);
        assertThat(result.details().get(0).reason()).isEqualTo("Record already removed");
        assertThat(trackingOf(id).getStatus()).isEqualTo(RetentionStatus.DELETED);
    }

    @Test
    void deletionThatRemovesNothingIsReportedAsError() {
        UUID id = fixture.store.store(owner, MAPPER.createObjectNode().put("title", "entry"),
                DataCategory.EXPERIENCE_DATA, SensitivityLevel.CONFIDENTIAL);
        UUID stranger = UUID.randomUUID();
        RetentionPolicy policy = fixture.policies.policyFor(DataCategory.EXPERIENCE_DATA);
        RetentionTrackingRecord mismatched = fixture.tracking.save(
                RetentionTrackingRecord.create(stranger, id, DataCategory.EXPERIENCE_DATA, policy, START));
        fixture.consentService.recordConsent(stranger, DataCategory.EXPERIENCE_DATA, true, "service delivery",
                "contract", null);
        fixture.clock.advance(Duration.ofDays(1825));

        SweepResult result = retention.processScheduledDeletions();

        assertThat(result.deleted()).isZero();
        assertThat(result.errors()).isEqualTo(1);
        assertThat(result.details()).singleElement().satisfies(detail -> {
            assertThat(detail.outcome()).isEqualTo(Outcome.ERROR);
            assertThat(detail.reason()).isEqualTo(RetentionService.RECORD_NOT_REMOVED);
        });
        assertThat(fixture.tracking.findById(mismatched.getId()).orElseThrow().getStatus())
                .isEqualTo(RetentionStatus.ACTIVE);
        assertThat(fixture.records.findById(id)).isPresent();
        assertThat(fixture.backups.findByRecordId(id)).as("backup of a kept record is dropped").isEmpty();
    }

    @Test
    void recordsNotYetDueAreLeftAlone() {
        UUID id = storeTracked(DataCategory.ACTIVITY_LOGS);
        consentTo(DataCategory.ACTIVITY_LOGS);
        fixture.clock.advance(Duration.ofDays(364));

        SweepResult result = retention.processScheduledDeletions();

        assertThat(result.processed()).isZero();
        assertThat(trackingOf(id).getStatus()).isEqualTo(RetentionStatus.ACTIVE);
    }

    // ==================== Manual approval ====================

    @Test
    void policyWithoutAutoDeleteWaitsForApproval() {
        var policies = RetentionPolicyRegistry.defaultPolicies();
        policies.put(DataCategory.RATING_DATA,
                new RetentionPolicy(30, null, Set.of(ComplianceRegulation.GDPR), false, false, false));
        fixture = new SecureDataFixture(EncryptionSchemaRegistry.defaults(), new RetentionPolicyRegistry(policies));
        retention = fixture.retention;

        UUID id = storeTracked(DataCategory.RATING_DATA);
        consentTo(DataCategory.RATING_DATA);
        fixture.clock.advance(Duration.ofDays(30));

        SweepResult result = retention.processScheduledDeletions();

        assertThat(result.pendingReview()).isEqualTo(1);
        RetentionTrackingRecord parked = trackingOf(id);
        assertThat(parked.getStatus()).isEqualTo(RetentionStatus.PENDING_DELETION);
        assertThat(parked.getStatusReason()).isEqualTo("awaiting_manual_approval");
        assertThat(fixture.records.findById(id)).isPresent();
        assertThat(retention.processScheduledDeletions().processed()).as("parked records are not swept").isZero();

        SweepDetail approved = retention.approveDeletion(parked.getId());

        assertThat(approved.outcome()).isEqualTo(Outcome.DELETED);
        assertThat(trackingOf(id).getStatus()).isEqualTo(RetentionStatus.DELETED);
        assertThat(fixture.records.findById(id)).isEmpty();
        assertThatThrownBy(() -> retention.approveDeletion(parked.getId()))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void approvingUnknownTrackingRecordFails() {
        assertThatThrownBy(() -> retention.approveDeletion(UUID.randomUUID()))
                .isInstanceOf(RecordNotFoundException.class);
    }

    // ==================== Backup purge ====================

    @Test
    void expiredBackupIsPurgedAndTrackingMarkedPurged() {
        UUID id = storeTracked(DataCategory.EXPERIENCE_DATA);
        consentTo(DataCategory.EXPERIENCE_DATA);
        fixture.clock.advance(Duration.ofDays(1825));
        retention.processScheduledDeletions();

        fixture.clock.advance(Duration.ofDays(89));
        assertThat(retention.purgeExpiredBackups().processed()).isZero();

        fixture.clock.advance(Duration.ofDays(1));
        SweepResult result = retention.purgeExpiredBackups();

        assertThat(result.deleted()).isEqualTo(1);
        assertThat(result.details().get(0).outcome()).isEqualTo(Outcome.PURGED);
        assertThat(fixture.backups.findByRecordId(id)).isEmpty();
        RetentionTrackingRecord tracking = trackingOf(id);
        assertThat(tracking.getStatus()).isEqualTo(RetentionStatus.PURGED);
        assertThat(tracking.getPurgedAt()).isEqualTo(fixture.clock.instant());
    }

    // ==================== Summary ====================

    @Test
    void summaryGroupsByCategoryAndStatus() {
        storeTracked(DataCategory.EXPERIENCE_DATA);
        fixture.clock.advance(Duration.ofDays(10));
        storeTracked(DataCategory.EXPERIENCE_DATA);
        storeTracked(DataCategory.RATING_DATA);

        Map<DataCategory, Map<RetentionStatus, RetentionSummary>> summary = retention.retentionSummary(owner);

        assertThat(summary).containsOnlyKeys(DataCategory.EXPERIENCE_DATA, DataCategory.RATING_DATA);
        RetentionSummary experiences = summary.get(DataCategory.EXPERIENCE_DATA).get(RetentionStatus.ACTIVE);
        assertThat(experiences.count()).isEqualTo(2);
        assertThat(experiences.nextDeletion()).isEqualTo(START.plus(Duration.ofDays(1825)));
        assertThat(experiences.nextArchive()).isEqualTo(START.plus(Duration.ofDays(730)));
        assertThat(summary.get(DataCategory.RATING_DATA).get(RetentionStatus.ACTIVE).nextArchive()).isNull();
    }
}
