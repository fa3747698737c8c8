package com.maascheduler.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class SchedulerMetricsTest {

    private SimpleMeterRegistry registry;
    private SchedulerMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new SchedulerMetrics(registry);
    }

    @Test
    @DisplayName("recordRun counts by status and times by task")
    void recordRun() {
        metrics.recordRun("daily", "success", Duration.ofSeconds(90));
        metrics.recordRun("daily", "failed", Duration.ofSeconds(10));
        metrics.recordRun("shop", "success", Duration.ofSeconds(30));

        assertEquals(2.0, registry.find("maa.runs.total").tag("status", "success").counter().count());
        assertEquals(1.0, registry.find("maa.runs.total").tag("status", "failed").counter().count());
        var timer = registry.find("maa.run.duration").tag("task", "daily").timer();
        assertNotNull(timer);
        assertEquals(2, timer.count());
    }

    @Test
    @DisplayName("retry, repeat and preemption counters are tagged by task")
    void taskCounters() {
        metrics.recordRetryScheduled("daily");
        metrics.recordRetryScheduled("daily");
        metrics.recordSuccessRepeat("roguelike");
        metrics.recordPreemption("roguelike");

        assertEquals(2.0, registry.find("maa.retries.scheduled").tag("task", "daily").counter().count());
        assertEquals(1.0, registry.find("maa.success_repeats.scheduled").tag("task", "roguelike").counter().count());
        assertEquals(1.0, registry.find("maa.preemptions.total").tag("task", "roguelike").counter().count());
    }

    @Test
    @DisplayName("admission deferrals are tagged by group")
    void admissionDeferral() {
        metrics.recordAdmissionDeferral("emulator");

        assertEquals(1.0, registry.find("maa.admission.deferrals").tag("group", "emulator").counter().count());
    }

    @Test
    @DisplayName("notifications without a tag use 'none'")
    void notificationTag() {
        metrics.recordNotification(null, false);
        metrics.recordNotification("retry", true);

        assertEquals(1.0, registry.find("maa.notifications.total")
                .tag("tag", "none").tag("delivered", "false").counter().count());
        assertEquals(1.0, registry.find("maa.notifications.total")
                .tag("tag", "retry").tag("delivered", "true").counter().count());
    }
}
