package com.stardust.api.consent;

import com.stardust.core.domain.ConsentRecord;
import com.stardust.core.domain.DataCategory;
import com.stardust.core.repository.ConsentRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Consent registry - append-only history of per-category consent decisions.
 * The latest decision for an (owner, category) pair is the current one.
 */
@Service
public class ConsentService {

    private static final Logger log = LoggerFactory.getLogger(ConsentService.class);

    private final ConsentRecordRepository consentRepository;
    private final Clock clock;

    public ConsentService(ConsentRecordRepository consentRepository, Clock clock) {
        this.consentRepository = consentRepository;
        this.clock = clock;
    }

    /**
     * Records a consent decision.
     *
     * @param expiresAt when the consent lapses, null for no expiry
     */
    public ConsentRecord recordConsent(
            UUID ownerId,
            DataCategory category,
            boolean granted,
            String purpose,
            String legalBasis,
            Instant expiresAt) {

        if (purpose == null || purpose.isBlank()) {
            throw new IllegalArgumentException("Purpose cannot be null or blank");
        }
        ConsentRecord consent = ConsentRecord.create(ownerId, category, granted, purpose, legalBasis,
                clock.instant(), expiresAt);
        consentRepository.append(consent);
        log.info("Recorded consent {} for owner {} category {}: granted={}",
                consent.id(), ownerId, category, granted);
        return consent;
    }

    public Optional<ConsentRecord> currentConsent(UUID ownerId, DataCategory category) {
        return consentRepository.findLatest(ownerId, category);
    }

    /**
     * Current decision per category, only for categories the owner has decided on.
     */
    public Map<DataCategory, ConsentRecord> currentConsents(UUID ownerId) {
        var current = new EnumMap<DataCategory, ConsentRecord>(DataCategory.class);
        for (DataCategory category : DataCategory.values()) {
            currentConsent(ownerId, category).ifPresent(c -> current.put(category, c));
        }
        return current;
    }

    /**
     * Every decision of the owner, most recent first.
     */
    public List<ConsentRecord> consentHistory(UUID ownerId) {
        return consentRepository.findByOwner(ownerId);
    }

    public boolean hasEffectiveConsent(UUID ownerId, DataCategory category) {
        Instant now = clock.instant();
        return currentConsent(ownerId, category).map(c -> c.isEffectiveAt(now)).orElse(false);
    }
}
