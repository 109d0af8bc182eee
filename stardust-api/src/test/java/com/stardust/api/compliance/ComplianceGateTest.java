package com.stardust.api.compliance;

import com.stardust.api.SecureDataFixture;
import com.stardust.core.domain.ComplianceRegulation;
import com.stardust.core.domain.DataCategory;
import com.stardust.core.domain.DataRequest.RequestType;
import com.stardust.core.domain.RetentionPolicy;
import com.stardust.core.domain.RetentionTrackingRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for deletion gating by consent requirement and regulation handlers.
 */
class ComplianceGateTest {

    private SecureDataFixture fixture;
    private UUID owner;

    @BeforeEach
    void setUp() {
        fixture = new SecureDataFixture();
        owner = UUID.randomUUID();
    }

    private RetentionTrackingRecord tracking(DataCategory category, RetentionPolicy policy) {
        return RetentionTrackingRecord.create(owner, UUID.randomUUID(), category, policy, fixture.clock.instant());
    }

    private static RetentionPolicy policy(boolean requireConsent, ComplianceRegulation... regulations) {
        return new RetentionPolicy(30, null, Set.of(regulations), true, requireConsent, false);
    }

    private static ComplianceHandler handler(ComplianceRegulation regulation, ComplianceDecision decision) {
        return new ComplianceHandler() {
            @Override
            public ComplianceRegulation regulation() {
                return regulation;
            }

            @Override
            public ComplianceDecision evaluate(ComplianceCheck check) {
                return decision;
            }
        };
    }

    // ==================== Consent requirement ====================

    @Test
    void requiredConsentWithoutRecordDenies() {
        ComplianceDecision decision = fixture.gate.canDelete(owner, DataCategory.MEDIA_FILES,
                tracking(DataCategory.MEDIA_FILES, policy(true)));

        assertThat(decision.allowed()).isFalse();
        assertThat(decision.reason()).contains("media_files");
        assertThat(decision.verdicts()).isEmpty();
    }

    @Test
    void revokedConsentStillCountsAsConsentRecord() {
        fixture.consentService.recordConsent(owner, DataCategory.MEDIA_FILES, false, "uploads", "consent", null);

        ComplianceDecision decision = fixture.gate.canDelete(owner, DataCategory.MEDIA_FILES,
                tracking(DataCategory.MEDIA_FILES, policy(true)));

        assertThat(decision.allowed()).isTrue();
        assertThat(decision.reason()).isEqualTo("No compliance restrictions");
    }

    // ==================== GDPR ====================

    @Test
    void gdprDeniesWithoutConsentAndRecordsVerdict() {
        ComplianceDecision decision = fixture.gate.canDelete(owner, DataCategory.RATING_DATA,
                tracking(DataCategory.RATING_DATA, policy(false, ComplianceRegulation.GDPR)));

        assertThat(decision.allowed()).isFalse();
        assertThat(decision.reason()).isEqualTo("No consent record found for rating_data (GDPR)");
        assertThat(decision.verdicts()).containsExactly(Map.entry(ComplianceRegulation.GDPR, false));
    }

    @Test
    void gdprAllowsWithPendingErasureRequest() {
        fixture.dataRequests.create(owner, RequestType.DELETE, Map.of());

        ComplianceDecision decision = fixture.gate.canDelete(owner, DataCategory.RATING_DATA,
                tracking(DataCategory.RATING_DATA, policy(false, ComplianceRegulation.GDPR)));

        assertThat(decision.allowed()).isTrue();
        assertThat(decision.verdicts()).containsEntry(ComplianceRegulation.GDPR, true);
    }

    @Test
    void gdprAllowsOnceConsentHasExpired() {
        fixture.consentService.recordConsent(owner, DataCategory.RATING_DATA, true, "reviews", "consent",
                fixture.clock.instant().plus(Duration.ofDays(10)));
        var gdpr = new GdprComplianceHandler(fixture.consentService, fixture.dataRequests);
        RetentionTrackingRecord tracking = tracking(DataCategory.RATING_DATA, policy(false, ComplianceRegulation.GDPR));

        fixture.clock.advance(Duration.ofDays(10));
        ComplianceDecision decision = gdpr.evaluate(new ComplianceCheck(owner, DataCategory.RATING_DATA, tracking,
                fixture.clock.instant()));

        assertThat(decision.allowed()).isTrue();
        assertThat(decision.reason()).isEqualTo("Consent expired (GDPR)");
    }

    // ==================== Handler combination ====================

    @Test
    void allApplicableHandlersMustAllow() {
        var gate = new ComplianceGate(List.of(
                handler(ComplianceRegulation.GDPR, ComplianceDecision.allow("ok")),
                handler(ComplianceRegulation.CCPA, ComplianceDecision.deny("opt-out pending"))),
                fixture.consentService, fixture.clock);

        ComplianceDecision decision = gate.canDelete(owner, DataCategory.PERSONAL_INFO,
                tracking(DataCategory.PERSONAL_INFO, policy(false, ComplianceRegulation.GDPR, ComplianceRegulation.CCPA)));

        assertThat(decision.allowed()).isFalse();
        assertThat(decision.reason()).isEqualTo("opt-out pending");
        assertThat(decision.verdicts())
                .containsEntry(ComplianceRegulation.GDPR, true)
                .containsEntry(ComplianceRegulation.CCPA, false);
    }

    @Test
    void handlersOfOtherRegulationsAreNotConsulted() {
        var gate = new ComplianceGate(List.of(
                handler(ComplianceRegulation.CCPA, ComplianceDecision.deny("never"))),
                fixture.consentService, fixture.clock);

        ComplianceDecision decision = gate.canDelete(owner, DataCategory.RATING_DATA,
                tracking(DataCategory.RATING_DATA, policy(false, ComplianceRegulation.PIPEDA)));

        assertThat(decision.allowed()).isTrue();
        assertThat(decision.verdicts()).containsExactly(Map.entry(ComplianceRegulation.PIPEDA, true));
    }

    @Test
    void throwingHandlerCountsAsDenial() {
        ComplianceHandler broken = new ComplianceHandler() {
            @Override
            public ComplianceRegulation regulation() {
                return ComplianceRegulation.LGPD;
            }

            @Override
            public ComplianceDecision evaluate(ComplianceCheck check) {
                throw new IllegalStateException("registry offline");
            }
        };
        var gate = new ComplianceGate(List.of(broken), fixture.consentService, fixture.clock);

        ComplianceDecision decision = gate.canDelete(owner, DataCategory.RATING_DATA,
                tracking(DataCategory.RATING_DATA, policy(false, ComplianceRegulation.LGPD)));

        assertThat(decision.allowed()).isFalse();
        assertThat(decision.reason()).contains("registry offline");
    }

    @Test
    void duplicateHandlersAreRejected() {
        assertThatThrownBy(() -> new ComplianceGate(List.of(
                new PermissiveComplianceHandler(ComplianceRegulation.CCPA),
                new PermissiveComplianceHandler(ComplianceRegulation.CCPA)),
                fixture.consentService, fixture.clock))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(fixture.gate.hasHandler(ComplianceRegulation.GDPR)).isTrue();
        assertThat(fixture.gate.hasHandler(ComplianceRegulation.LGPD)).isFalse();
    }
}
