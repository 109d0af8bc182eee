package com.stardust.core.repository.memory;

import com.stardust.core.domain.DataCategory;
import com.stardust.core.domain.EncryptionMetadata;
import com.stardust.core.domain.SensitivityLevel;
import com.stardust.core.domain.StoredSecureRecord;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class InMemorySecureRecordRepositoryTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    private final InMemorySecureRecordRepository repository = new InMemorySecureRecordRepository();

    private StoredSecureRecord record(UUID owner, Instant expiresAt) {
        return StoredSecureRecord.wholePayload(owner, DataCategory.RATING_DATA, SensitivityLevel.INTERNAL,
                "ciphertext", new EncryptionMetadata("AES-256-GCM", "rating_data_key", "iv", NOW, 730),
                "checksum", Map.of(), NOW, expiresAt);
    }

    @Test
    void storedRecordsAreIsolatedFromCallerMutation() {
        UUID owner = UUID.randomUUID();
        StoredSecureRecord original = record(owner, NOW.plus(Duration.ofDays(1)));
        repository.save(original);

        original.recordAccess(NOW);
        StoredSecureRecord loaded = repository.findById(original.getId()).orElseThrow();
        loaded.softDelete(NOW);

        StoredSecureRecord reloaded = repository.findById(original.getId()).orElseThrow();
        assertThat(reloaded.getAccessCount()).isZero();
        assertThat(reloaded.isActive()).isTrue();
    }

    @Test
    void findVisibleFiltersOwnerActiveAndExpiry() {
        UUID owner = UUID.randomUUID();
        StoredSecureRecord live = repository.save(record(owner, NOW.plusSeconds(60)));
        StoredSecureRecord expired = repository.save(record(owner, NOW.plusSeconds(1)));

        assertThat(repository.findVisible(live.getId(), owner, NOW)).isPresent();
        assertThat(repository.findVisible(live.getId(), UUID.randomUUID(), NOW)).isEmpty();
        assertThat(repository.findVisible(expired.getId(), owner, NOW.plusSeconds(1))).isEmpty();
        assertThat(repository.findExpired(NOW.plusSeconds(2)))
                .extracting(StoredSecureRecord::getId)
                .containsExactly(expired.getId());
    }

    @Test
    void updateOneAppliesOnlyWhenFilterMatches() {
        UUID owner = UUID.randomUUID();
        StoredSecureRecord saved = repository.save(record(owner, NOW.plusSeconds(60)));

        assertThat(repository.updateOne(saved.getId(), r -> r.isOwnedBy(UUID.randomUUID()), r -> r.recordAccess(NOW)))
                .isEmpty();
        assertThat(repository.updateOne(saved.getId(), r -> r.isOwnedBy(owner), r -> r.recordAccess(NOW)))
                .get()
                .extracting(StoredSecureRecord::getAccessCount)
                .isEqualTo(1L);
        assertThat(repository.updateOne(UUID.randomUUID(), r -> true, r -> r.recordAccess(NOW))).isEmpty();
    }

    @Test
    void deleteOneRespectsFilter() {
        UUID owner = UUID.randomUUID();
        StoredSecureRecord saved = repository.save(record(owner, NOW.plusSeconds(60)));

        assertThat(repository.deleteOne(saved.getId(), r -> !r.isActive())).isFalse();
        assertThat(repository.deleteOne(saved.getId(), StoredSecureRecord::isActive)).isTrue();
        assertThat(repository.deleteOne(saved.getId(), r -> true)).isFalse();
        assertThat(repository.count()).isZero();
    }

    @Test
    void concurrentUpdatesAreNotLost() throws Exception {
        UUID owner = UUID.randomUUID();
        StoredSecureRecord saved = repository.save(record(owner, NOW.plusSeconds(60)));
        int threads = 8;
        int perThread = 250;

        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        var futures = new ArrayList<Future<?>>();
        for (int t = 0; t < threads; t++) {
            futures.add(executor.submit(() -> {
                start.await();
                for (int i = 0; i < perThread; i++) {
                    repository.updateOne(saved.getId(), r -> true, r -> r.recordAccess(NOW));
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }
        executor.shutdown();

        assertThat(repository.findById(saved.getId()).orElseThrow().getAccessCount())
                .isEqualTo((long) threads * perThread);
    }
}
