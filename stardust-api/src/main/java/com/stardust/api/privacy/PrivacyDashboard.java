package com.stardust.api.privacy;

import com.stardust.api.retention.RetentionSummary;
import com.stardust.api.storage.InventoryEntry;
import com.stardust.core.domain.ConsentRecord;
import com.stardust.core.domain.DataCategory;
import com.stardust.core.domain.DataRequest;
import com.stardust.core.domain.RetentionStatus;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Self-service overview of what is stored about a user and under which terms.
 */
public record PrivacyDashboard(
        UUID ownerId,
        Map<DataCategory, ConsentRecord> consents,
        List<DataRequest> recentRequests,
        Map<DataCategory, InventoryEntry> inventory,
        Map<DataCategory, Map<RetentionStatus, RetentionSummary>> retention
) {}
