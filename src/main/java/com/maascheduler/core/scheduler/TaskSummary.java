package com.maascheduler.core.scheduler;

import java.time.LocalDateTime;

/**
 * One catalog entry with its live state, as shown in task lists.
 *
 * @param status      last known run status label, {@code queued} when waiting in the queue, or {@code idle}
 * @param nextRunTime earliest armed fire time, or {@code null} when nothing is armed
 */
public record TaskSummary(
        String id,
        String name,
        String description,
        boolean enabled,
        int priority,
        String resourceGroup,
        String triggerType,
        int triggerCount,
        String status,
        boolean running,
        boolean queued,
        LocalDateTime nextRunTime
) {}
