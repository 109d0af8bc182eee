package com.stardust.api.compliance;

import com.stardust.api.consent.ConsentService;
import com.stardust.core.domain.ComplianceRegulation;
import com.stardust.core.domain.DataCategory;
import com.stardust.core.domain.RetentionPolicy;
import com.stardust.core.domain.RetentionTrackingRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Compliance Gate - consulted before every automated deletion.
 *
 * Applies the consent requirement of the record's policy, then every handler of the policy's
 * regulations. Deletion proceeds only if all of them allow it. A regulation without a
 * registered handler allows by default. A handler that throws counts as a denial.
 */
public class ComplianceGate {

    private static final Logger log = LoggerFactory.getLogger(ComplianceGate.class);

    private final Map<ComplianceRegulation, ComplianceHandler> handlers;
    private final ConsentService consentService;
    private final Clock clock;

    public ComplianceGate(List<ComplianceHandler> handlers, ConsentService consentService, Clock clock) {
        var table = new EnumMap<ComplianceRegulation, ComplianceHandler>(ComplianceRegulation.class);
        for (ComplianceHandler handler : handlers) {
            if (table.putIfAbsent(handler.regulation(), handler) != null) {
                throw new IllegalArgumentException("Duplicate compliance handler for " + handler.regulation());
            }
        }
        this.handlers = Collections.unmodifiableMap(table);
        this.consentService = consentService;
        this.clock = clock;
    }

    public ComplianceDecision canDelete(UUID ownerId, DataCategory category, RetentionTrackingRecord tracking) {
        Instant now = clock.instant();
        RetentionPolicy policy = tracking.getPolicy();

        if (policy.requireConsent() && consentService.currentConsent(ownerId, category).isEmpty()) {
            return ComplianceDecision.deny("Policy requires a consent record for " + category.value()
                    + " before deletion");
        }
        if (policy.regulations().isEmpty()) {
            return ComplianceDecision.allow("No compliance restrictions");
        }

        var check = new ComplianceCheck(ownerId, category, tracking, now);
        var verdicts = new EnumMap<ComplianceRegulation, Boolean>(ComplianceRegulation.class);
        for (ComplianceRegulation regulation : ComplianceRegulation.values()) {
            if (!policy.appliesTo(regulation)) {
                continue;
            }
            ComplianceHandler handler = handlers.get(regulation);
            if (handler == null) {
                verdicts.put(regulation, true);
                continue;
            }
            ComplianceDecision decision = evaluate(handler, check);
            verdicts.put(regulation, decision.allowed());
            if (!decision.allowed()) {
                return decision.withVerdicts(verdicts);
            }
        }
        return ComplianceDecision.allow("All compliance checks passed").withVerdicts(verdicts);
    }

    private ComplianceDecision evaluate(ComplianceHandler handler, ComplianceCheck check) {
        try {
            ComplianceDecision decision = handler.evaluate(check);
            return decision != null ? decision
                    : ComplianceDecision.deny(handler.regulation() + " handler returned no decision");
        } catch (RuntimeException e) {
            log.warn("{} compliance check failed for tracking record {}: {}",
                    handler.regulation(), check.tracking().getId(), e.getMessage());
            return ComplianceDecision.deny(handler.regulation() + " compliance check failed: " + e.getMessage());
        }
    }

    public boolean hasHandler(ComplianceRegulation regulation) {
        return handlers.containsKey(regulation);
    }
}
