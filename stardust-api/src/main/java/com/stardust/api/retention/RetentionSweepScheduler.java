package com.stardust.api.retention;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs sweep tasks periodically on a {@link TaskScheduler}.
 *
 * Each task ticks every {@code interval} plus a random jitter in {@code [0, jitter]}, so
 * several instances do not sweep in lockstep. A tick that arrives while the previous run of
 * the same task is still going is skipped rather than queued, so the same records are never
 * processed twice at once. Runs are never interrupted.
 */
public class RetentionSweepScheduler {

    private static final Logger log = LoggerFactory.getLogger(RetentionSweepScheduler.class);

    private final TaskScheduler taskScheduler;
    private final Map<String, SweepTask> tasks;
    private final Map<String, AtomicBoolean> inProgress = new ConcurrentHashMap<>();
    private final Map<String, ScheduledFuture<?>> pending = new ConcurrentHashMap<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Clock clock;
    private final Duration initialDelay;
    private final Duration interval;
    private final Duration jitter;

    public RetentionSweepScheduler(
            TaskScheduler taskScheduler,
            List<SweepTask> tasks,
            Clock clock,
            Duration initialDelay,
            Duration interval,
            Duration jitter) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Sweep interval must be positive");
        }
        if (jitter == null || jitter.isNegative()) {
            throw new IllegalArgumentException("Sweep jitter cannot be negative");
        }
        this.taskScheduler = taskScheduler;
        var table = new LinkedHashMap<String, SweepTask>();
        for (SweepTask task : tasks) {
            if (table.putIfAbsent(task.name(), task) != null) {
                throw new IllegalArgumentException("Duplicate sweep task " + task.name());
            }
            inProgress.put(task.name(), new AtomicBoolean(false));
        }
        this.tasks = table;
        this.clock = clock;
        this.initialDelay = initialDelay == null ? Duration.ZERO : initialDelay;
        this.interval = interval;
        this.jitter = jitter;
    }

    /**
     * Starts ticking every task.
     */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        Instant first = clock.instant().plus(initialDelay);
        tasks.keySet().forEach(name -> scheduleTick(name, first));
        log.info("Retention sweeps started: {} every {} (jitter up to {})", tasks.keySet(), interval, jitter);
    }

    /**
     * Stops ticking. Runs already in progress finish normally.
     */
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        pending.values().forEach(future -> future.cancel(false));
        pending.clear();
        log.info("Retention sweeps stopped");
    }

    public boolean isRunning() {
        return running.get();
    }

    public Set<String> taskNames() {
        return tasks.keySet();
    }

    /**
     * Runs a task now, unless its previous run is still in progress.
     */
    public SweepRun runOnce(String taskName) {
        SweepTask task = tasks.get(taskName);
        if (task == null) {
            throw new IllegalArgumentException("Unknown sweep task " + taskName);
        }
        AtomicBoolean busy = inProgress.get(taskName);
        if (!busy.compareAndSet(false, true)) {
            log.info("Skipping {} sweep: previous run still in progress", taskName);
            return SweepRun.skipped(taskName);
        }
        try {
            return SweepRun.completed(taskName, task.run());
        } catch (RuntimeException e) {
            log.warn("{} sweep failed: {}", taskName, e.getMessage(), e);
            return SweepRun.failed(taskName, e.getMessage());
        } finally {
            busy.set(false);
        }
    }

    private void scheduleTick(String taskName, Instant base) {
        if (!running.get()) {
            return;
        }
        Instant at = base.plus(randomJitter());
        pending.put(taskName, taskScheduler.schedule(() -> tick(taskName, base), at));
    }

    private void tick(String taskName, Instant base) {
        // Next tick is anchored to the schedule, not to when this run ends
        scheduleTick(taskName, base.plus(interval));
        runOnce(taskName);
    }

    private Duration randomJitter() {
        long bound = jitter.toMillis();
        return bound <= 0 ? Duration.ZERO : Duration.ofMillis(ThreadLocalRandom.current().nextLong(bound + 1));
    }

    /**
     * Outcome of one scheduled or manual trigger.
     */
    public record SweepRun(String taskName, Status status, SweepResult result, String failure) {

        public enum Status {
            COMPLETED,
            SKIPPED_OVERLAP,
            FAILED
        }

        static SweepRun completed(String taskName, SweepResult result) {
            return new SweepRun(taskName, Status.COMPLETED, result, null);
        }

        static SweepRun skipped(String taskName) {
            return new SweepRun(taskName, Status.SKIPPED_OVERLAP, null, null);
        }

        static SweepRun failed(String taskName, String failure) {
            return new SweepRun(taskName, Status.FAILED, null, failure);
        }
    }
}
