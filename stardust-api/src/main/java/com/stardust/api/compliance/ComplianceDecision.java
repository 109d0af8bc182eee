package com.stardust.api.compliance;

import com.stardust.core.domain.ComplianceRegulation;

import java.util.Map;

/**
 * Verdict on an automated deletion. A denial is a normal outcome, not an error.
 *
 * @param verdicts per-regulation outcome of the handlers that were consulted
 */
public record ComplianceDecision(boolean allowed, String reason, Map<ComplianceRegulation, Boolean> verdicts) {

    public ComplianceDecision {
        verdicts = verdicts == null ? Map.of() : Map.copyOf(verdicts);
    }

    public static ComplianceDecision allow(String reason) {
        return new ComplianceDecision(true, reason, Map.of());
    }

    public static ComplianceDecision deny(String reason) {
        return new ComplianceDecision(false, reason, Map.of());
    }

    ComplianceDecision withVerdicts(Map<ComplianceRegulation, Boolean> verdicts) {
        return new ComplianceDecision(allowed, reason, verdicts);
    }
}
