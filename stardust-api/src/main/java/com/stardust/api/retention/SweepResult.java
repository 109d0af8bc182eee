package com.stardust.api.retention;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Structured summary of a sweep, so operators can verify a run without replaying logs.
 *
 * @param processed records the sweep looked at
 * @param skipped records left untouched because compliance denied deletion
 * @param pendingReview records parked for manual deletion approval
 * @param errors records whose processing failed
 */
public record SweepResult(
        String sweep,
        int processed,
        int archived,
        int deleted,
        int skipped,
        int pendingReview,
        int errors,
        List<SweepDetail> details,
        Instant startedAt,
        Instant finishedAt
) {
    public SweepResult {
        details = List.copyOf(details);
    }

    public static SweepResult empty(String sweep, Instant at) {
        return new SweepResult(sweep, 0, 0, 0, 0, 0, 0, List.of(), at, at);
    }

    /**
     * Mutable tally filled while a sweep runs.
     */
    static final class Tally {
        private final String sweep;
        private final Instant startedAt;
        private final List<SweepDetail> details = new ArrayList<>();
        private int processed;
        private int archived;
        private int deleted;
        private int skipped;
        private int pendingReview;
        private int errors;

        Tally(String sweep, Instant startedAt) {
            this.sweep = sweep;
            this.startedAt = startedAt;
        }

        void add(SweepDetail detail) {
            processed++;
            details.add(detail);
            switch (detail.outcome()) {
                case ARCHIVED -> archived++;
                case DELETED, PURGED -> deleted++;
                case SKIPPED -> skipped++;
                case PENDING_REVIEW -> pendingReview++;
                case ERROR -> errors++;
            }
        }

        SweepResult finish(Instant finishedAt) {
            return new SweepResult(sweep, processed, archived, deleted, skipped, pendingReview, errors,
                    details, startedAt, finishedAt);
        }
    }
}
