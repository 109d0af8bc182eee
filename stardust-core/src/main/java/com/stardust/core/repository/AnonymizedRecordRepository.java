package com.stardust.core.repository;

import com.stardust.core.domain.AnonymizedRecord;

import java.util.List;

/**
 * Repository for anonymized record remainders.
 */
public interface AnonymizedRecordRepository {

    AnonymizedRecord save(AnonymizedRecord record);

    List<AnonymizedRecord> findByAnonymousId(String anonymousId);
}
