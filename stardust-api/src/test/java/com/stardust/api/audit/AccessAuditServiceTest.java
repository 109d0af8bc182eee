package com.stardust.api.audit;

import com.stardust.api.MutableClock;
import com.stardust.core.domain.AccessLogEntry;
import com.stardust.core.domain.AccessType;
import com.stardust.core.domain.DataCategory;
import com.stardust.core.domain.RequestContext;
import com.stardust.core.repository.memory.InMemoryAccessLogRepository;
import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for access log appends and paged queries.
 */
class AccessAuditServiceTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    private final InMemoryAccessLogRepository repository = new InMemoryAccessLogRepository();
    private final AccessAuditService audit = new AccessAuditService(repository, clock, 5, 20);
    private final UUID actor = UUID.randomUUID();

    private void record(int count, AccessType type, DataCategory category) {
        for (int i = 0; i < count; i++) {
            clock.advance(Duration.ofSeconds(1));
            audit.recordSuccess(actor, UUID.randomUUID(), category, type, RequestContext.NONE, Map.of());
        }
    }

    // Property: the effective page size is always within [1, max]
    @Property(tries = 200)
    void effectiveLimitIsBounded(@ForAll @IntRange(min = -50, max = 5000) int requested) {
        int limit = audit.effectiveLimit(requested);

        assertThat(limit).isBetween(1, 20);
        if (requested > 0 && requested <= 20) {
            assertThat(limit).isEqualTo(requested);
        }
    }

    @Test
    void missingLimitUsesDefault() {
        record(8, AccessType.READ, DataCategory.RATING_DATA);

        assertThat(audit.query(actor, null, null, null)).hasSize(5);
        assertThat(audit.query(actor, 0, null, null)).hasSize(5);
        assertThat(audit.query(actor, 100, null, null)).hasSize(8);
    }

    @Test
    void queryFiltersAndReturnsNewestFirst() {
        record(3, AccessType.READ, DataCategory.RATING_DATA);
        record(2, AccessType.UPDATE, DataCategory.RATING_DATA);
        record(2, AccessType.READ, DataCategory.PERSONAL_INFO);

        List<AccessLogEntry> reads = audit.query(actor, 20, DataCategory.RATING_DATA, AccessType.READ);

        assertThat(reads).hasSize(3);
        assertThat(reads).isSortedAccordingTo((a, b) -> b.timestamp().compareTo(a.timestamp()));
        assertThat(audit.query(actor, 20, null, AccessType.READ)).hasSize(5);
        assertThat(audit.query(actor, 20, DataCategory.PERSONAL_INFO, null)).hasSize(2);
        assertThat(audit.query(UUID.randomUUID(), 20, null, null)).isEmpty();
    }

    @Test
    void failureEntriesCarryReasonAndRequest() {
        UUID target = UUID.randomUUID();

        AuditAppendResult result = audit.recordFailure(actor, target, DataCategory.MEDIA_FILES, AccessType.DECRYPT,
                "Record not found", RequestContext.of("192.168.1.4", "cli"), Map.of("field", "ssn"));

        assertThat(result.appended()).isTrue();
        AccessLogEntry entry = audit.historyOf(target).get(0);
        assertThat(entry.success()).isFalse();
        assertThat(entry.errorMessage()).isEqualTo("Record not found");
        assertThat(entry.sourceAddress()).isEqualTo("192.168.1.4");
        assertThat(entry.userAgent()).isEqualTo("cli");
        assertThat(entry.context()).containsEntry("field", "ssn");
        assertThat(entry.timestamp()).isEqualTo(clock.instant());
    }

    @Test
    void storeFailureIsReturnedNotThrown() {
        var failing = new AccessAuditService(new InMemoryAccessLogRepository() {
            @Override
            public synchronized void append(AccessLogEntry entry) {
                throw new IllegalStateException("disk full");
            }
        }, clock, 5, 20);

        AuditAppendResult result = failing.recordSuccess(actor, null, null, AccessType.READ, RequestContext.NONE, Map.of());

        assertThat(result.failed()).isTrue();
        assertThat(result.failureReason()).contains("disk full");
    }

    @Test
    void queryRequiresActor() {
        assertThatThrownBy(() -> audit.query(null, 10, null, null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new AccessAuditService(repository, clock, 50, 10))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
