package com.stardust.api.audit;

import java.util.UUID;

/**
 * Outcome of an audit append. A failed append carries the reason instead of throwing, so the
 * guarded operation decides explicitly what to do with it.
 */
public record AuditAppendResult(UUID entryId, boolean appended, String failureReason) {

    public static AuditAppendResult appended(UUID entryId) {
        return new AuditAppendResult(entryId, true, null);
    }

    public static AuditAppendResult failed(UUID entryId, String reason) {
        return new AuditAppendResult(entryId, false, reason);
    }

    public boolean failed() {
        return !appended;
    }
}
