package com.stardust.api.config;

import com.stardust.api.retention.RetentionSweepScheduler;
import com.stardust.api.retention.RetentionSweepScheduler.SweepRun;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.*;

@SpringBootTest(properties = {
        "stardust.retention.sweep.enabled=true",
        "stardust.retention.sweep.initial-delay=1h"
})
@ActiveProfiles("test")
class SweepSchedulingConfigurationTest {

    @Autowired
    private RetentionSweepScheduler scheduler;

    @Test
    void schedulerStartsWithAllSweeps() {
        assertThat(scheduler.isRunning()).isTrue();
        assertThat(scheduler.taskNames()).containsExactly("expired-records", "archiving", "deletion", "backup-purge");
    }

    @Test
    void manualTriggerRunsSweep() {
        SweepRun run = scheduler.runOnce("deletion");

        assertThat(run.status()).isEqualTo(SweepRun.Status.COMPLETED);
        assertThat(run.result().processed()).isZero();
        assertThat(scheduler.runOnce("expired-records").result().sweep()).isEqualTo("expired-records");
    }
}
