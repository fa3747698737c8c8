package com.maascheduler.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for task dispatch and execution.
 */
@Service
public class SchedulerMetrics {

    private final MeterRegistry registry;

    public SchedulerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordRun(String taskId, String status, Duration duration) {
        Counter.builder("maa.runs.total")
                .tag("status", status)
                .register(registry)
                .increment();
        Timer.builder("maa.run.duration")
                .tag("task", taskId)
                .register(registry)
                .record(duration);
    }

    public void recordRetryScheduled(String taskId) {
        Counter.builder("maa.retries.scheduled")
                .description("Delayed re-enqueues after a failed run")
                .tag("task", taskId)
                .register(registry)
                .increment();
    }

    public void recordSuccessRepeat(String taskId) {
        Counter.builder("maa.success_repeats.scheduled")
                .tag("task", taskId)
                .register(registry)
                .increment();
    }

    /**
     * @param taskId the evicted task
     */
    public void recordPreemption(String taskId) {
        Counter.builder("maa.preemptions.total")
                .description("Running tasks cancelled to free a slot for a more urgent task")
                .tag("task", taskId)
                .register(registry)
                .increment();
    }

    public void recordAdmissionDeferral(String resourceGroup) {
        Counter.builder("maa.admission.deferrals")
                .description("Queue items put back because their resource group was full")
                .tag("group", resourceGroup)
                .register(registry)
                .increment();
    }

    public void recordNotification(String tag, boolean delivered) {
        Counter.builder("maa.notifications.total")
                .tag("tag", tag == null ? "none" : tag)
                .tag("delivered", String.valueOf(delivered))
                .register(registry)
                .increment();
    }
}
