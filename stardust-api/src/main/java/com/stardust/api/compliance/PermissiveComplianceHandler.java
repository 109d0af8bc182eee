package com.stardust.api.compliance;

import com.stardust.core.domain.ComplianceRegulation;

/**
 * Handler for regulations without extra deletion preconditions yet (CCPA, PIPEDA, LGPD).
 */
public class PermissiveComplianceHandler implements ComplianceHandler {

    private final ComplianceRegulation regulation;

    public PermissiveComplianceHandler(ComplianceRegulation regulation) {
        this.regulation = regulation;
    }

    @Override
    public ComplianceRegulation regulation() {
        return regulation;
    }

    @Override
    public ComplianceDecision evaluate(ComplianceCheck check) {
        return ComplianceDecision.allow(regulation.name() + " compliance checks passed");
    }
}
