package com.stardust.api.compliance;

import com.stardust.api.consent.ConsentService;
import com.stardust.api.privacy.DataRequestService;
import com.stardust.core.domain.ComplianceRegulation;
import com.stardust.core.domain.ConsentRecord;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * GDPR deletion precondition.
 *
 * An open erasure request (Art. 17) or an expired consent allows deletion. Otherwise a stored
 * consent decision for the category must exist before data is removed automatically.
 */
@Component
public class GdprComplianceHandler implements ComplianceHandler {

    private final ConsentService consentService;
    private final DataRequestService dataRequestService;

    public GdprComplianceHandler(ConsentService consentService, DataRequestService dataRequestService) {
        this.consentService = consentService;
        this.dataRequestService = dataRequestService;
    }

    @Override
    public ComplianceRegulation regulation() {
        return ComplianceRegulation.GDPR;
    }

    @Override
    public ComplianceDecision evaluate(ComplianceCheck check) {
        if (dataRequestService.hasPendingErasure(check.ownerId())) {
            return ComplianceDecision.allow("User requested data deletion (GDPR Art. 17)");
        }

        Optional<ConsentRecord> consent = consentService.currentConsent(check.ownerId(), check.category());
        if (consent.isEmpty()) {
            return ComplianceDecision.deny("No consent record found for " + check.category().value() + " (GDPR)");
        }
        if (consent.get().isExpiredAt(check.evaluatedAt())) {
            return ComplianceDecision.allow("Consent expired (GDPR)");
        }
        return ComplianceDecision.allow("GDPR compliance checks passed");
    }
}
