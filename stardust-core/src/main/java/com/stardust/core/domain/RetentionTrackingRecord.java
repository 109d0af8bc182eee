package com.stardust.core.domain;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.UUID;

/**
 * Retention Tracking Record - lifecycle state of one tracked record under its category policy.
 *
 * One per tracked record. Created when a policy is first applied, mutated by the retention
 * sweep and never deleted, so it doubles as its own audit trail. It references the tracked
 * record by id only and survives its deletion.
 *
 * Status only moves forward, see {@link RetentionStatus#canTransitionTo(RetentionStatus)}.
 */
public class RetentionTrackingRecord {

    private UUID id;
    private UUID ownerId;
    private UUID recordId;
    private DataCategory category;
    private RetentionStatus status;
    private Instant scheduledDeletionDate;
    private Instant scheduledArchiveDate;
    private RetentionPolicy policy;
    private Map<ComplianceRegulation, Boolean> complianceFlags;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant actualArchiveDate;
    private Instant actualDeletionDate;
    private Instant purgedAt;
    private String statusReason;

    protected RetentionTrackingRecord() {}

    /**
     * Starts tracking a record in ACTIVE state with dates computed from the policy.
     */
    public static RetentionTrackingRecord create(
            UUID ownerId,
            UUID recordId,
            DataCategory category,
            RetentionPolicy policy,
            Instant now) {

        if (ownerId == null) {
            throw new IllegalArgumentException("Owner ID is required");
        }
        if (recordId == null) {
            throw new IllegalArgumentException("Record ID is required");
        }
        if (category == null) {
            throw new IllegalArgumentException("Data category is required");
        }
        if (policy == null) {
            throw new IllegalArgumentException("Retention policy is required");
        }

        var tracking = new RetentionTrackingRecord();
        tracking.id = UUID.randomUUID();
        tracking.ownerId = ownerId;
        tracking.recordId = recordId;
        tracking.category = category;
        tracking.status = RetentionStatus.ACTIVE;
        tracking.policy = policy;
        tracking.scheduledDeletionDate = policy.deletionDateFrom(now);
        tracking.scheduledArchiveDate = policy.archiveDateFrom(now);
        tracking.complianceFlags = new EnumMap<>(ComplianceRegulation.class);
        for (ComplianceRegulation regulation : policy.regulations()) {
            tracking.complianceFlags.put(regulation, Boolean.FALSE);
        }
        tracking.createdAt = now;
        tracking.updatedAt = now;
        return tracking;
    }

    public RetentionTrackingRecord copy() {
        var copy = new RetentionTrackingRecord();
        copy.id = id;
        copy.ownerId = ownerId;
        copy.recordId = recordId;
        copy.category = category;
        copy.status = status;
        copy.scheduledDeletionDate = scheduledDeletionDate;
        copy.scheduledArchiveDate = scheduledArchiveDate;
        copy.policy = policy;
        copy.complianceFlags = complianceFlags.isEmpty()
                ? new EnumMap<>(ComplianceRegulation.class)
                : new EnumMap<>(complianceFlags);
        copy.createdAt = createdAt;
        copy.updatedAt = updatedAt;
        copy.actualArchiveDate = actualArchiveDate;
        copy.actualDeletionDate = actualDeletionDate;
        copy.purgedAt = purgedAt;
        copy.statusReason = statusReason;
        return copy;
    }

    public boolean isDueForArchiving(Instant now) {
        return status == RetentionStatus.ACTIVE
                && scheduledArchiveDate != null
                && !scheduledArchiveDate.isAfter(now)
                && scheduledDeletionDate.isAfter(now);
    }

    public boolean isDueForDeletion(Instant now) {
        return (status == RetentionStatus.ACTIVE || status == RetentionStatus.ARCHIVED)
                && !scheduledDeletionDate.isAfter(now);
    }

    public void markArchived(Instant at) {
        transitionTo(RetentionStatus.ARCHIVED, at);
        this.actualArchiveDate = at;
        this.statusReason = null;
    }

    /**
     * Parks a due record until deletion is approved manually.
     */
    public void markPendingDeletion(String reason, Instant at) {
        transitionTo(RetentionStatus.PENDING_DELETION, at);
        this.statusReason = reason;
    }

    public void markDeleted(Instant at) {
        transitionTo(RetentionStatus.DELETED, at);
        this.actualDeletionDate = at;
        this.statusReason = null;
    }

    /**
     * Marks the last remaining copy (the backup) as gone.
     */
    public void markPurged(Instant at) {
        transitionTo(RetentionStatus.PURGED, at);
        this.purgedAt = at;
    }

    /**
     * Records the latest compliance verdict of one regulation.
     */
    public void recordCompliance(ComplianceRegulation regulation, boolean compliant, Instant at) {
        this.complianceFlags.put(regulation, compliant);
        this.updatedAt = at;
    }

    /**
     * Notes why the last sweep left this record untouched.
     */
    public void noteSkipped(String reason, Instant at) {
        this.statusReason = reason;
        this.updatedAt = at;
    }

    private void transitionTo(RetentionStatus target, Instant at) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalStateException(
                    "Cannot move tracking record " + id + " from " + status + " to " + target);
        }
        this.status = target;
        this.updatedAt = at;
    }

    // Getters
    public UUID getId() { return id; }
    public UUID getOwnerId() { return ownerId; }
    public UUID getRecordId() { return recordId; }
    public DataCategory getCategory() { return category; }
    public RetentionStatus getStatus() { return status; }
    public Instant getScheduledDeletionDate() { return scheduledDeletionDate; }
    public Instant getScheduledArchiveDate() { return scheduledArchiveDate; }
    public RetentionPolicy getPolicy() { return policy; }
    public Map<ComplianceRegulation, Boolean> getComplianceFlags() { return Map.copyOf(complianceFlags); }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public Instant getActualArchiveDate() { return actualArchiveDate; }
    public Instant getActualDeletionDate() { return actualDeletionDate; }
    public Instant getPurgedAt() { return purgedAt; }
    public String getStatusReason() { return statusReason; }
}
