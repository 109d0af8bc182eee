package com.stardust.core.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;

/**
 * Retention rules of one data category. Static configuration, loaded once.
 *
 * @param retentionPeriodDays days a record lives before it is due for deletion
 * @param archiveAfterDays days before a record is archived, null when the category is never archived
 * @param regulations regulations whose compliance handlers gate automated deletion
 * @param autoDelete whether the sweep deletes due records without manual approval
 * @param requireConsent whether deletion requires an explicit stored consent decision
 * @param backupBeforeDeletion whether an encrypted backup is written before deletion
 */
public record RetentionPolicy(
        int retentionPeriodDays,
        Integer archiveAfterDays,
        Set<ComplianceRegulation> regulations,
        boolean autoDelete,
        boolean requireConsent,
        boolean backupBeforeDeletion
) {
    public RetentionPolicy {
        if (retentionPeriodDays <= 0) {
            throw new IllegalArgumentException("Retention period must be positive");
        }
        if (archiveAfterDays != null) {
            if (archiveAfterDays <= 0) {
                throw new IllegalArgumentException("Archive period must be positive");
            }
            // Deletion must never precede the scheduled archive date
            if (archiveAfterDays >= retentionPeriodDays) {
                throw new IllegalArgumentException("Archive period must be shorter than retention period");
            }
        }
        regulations = regulations == null || regulations.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(regulations));
    }

    public Instant deletionDateFrom(Instant start) {
        return start.plus(Duration.ofDays(retentionPeriodDays));
    }

    /**
     * Scheduled archive date, or null when the policy does not archive.
     */
    public Instant archiveDateFrom(Instant start) {
        return archiveAfterDays == null ? null : start.plus(Duration.ofDays(archiveAfterDays));
    }

    public boolean appliesTo(ComplianceRegulation regulation) {
        return regulations.contains(regulation);
    }
}
