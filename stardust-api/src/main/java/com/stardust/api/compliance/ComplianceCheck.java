package com.stardust.api.compliance;

import com.stardust.core.domain.DataCategory;
import com.stardust.core.domain.RetentionTrackingRecord;

import java.time.Instant;
import java.util.UUID;

/**
 * Input of a compliance evaluation: whose data, which category, which tracked record, and when.
 */
public record ComplianceCheck(
        UUID ownerId,
        DataCategory category,
        RetentionTrackingRecord tracking,
        Instant evaluatedAt
) {}
