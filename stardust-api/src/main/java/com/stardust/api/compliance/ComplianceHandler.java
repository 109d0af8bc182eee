package com.stardust.api.compliance;

import com.stardust.core.domain.ComplianceRegulation;

/**
 * Deletion precondition of one regulation.
 */
public interface ComplianceHandler {

    ComplianceRegulation regulation();

    /**
     * Decide whether the tracked record may be deleted now.
     */
    ComplianceDecision evaluate(ComplianceCheck check);
}
