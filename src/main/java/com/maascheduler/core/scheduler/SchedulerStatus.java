package com.maascheduler.core.scheduler;

import com.maascheduler.core.model.ResourceGroupStatus;
import com.maascheduler.core.retry.RetryController;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Point-in-time view of the scheduler for operators.
 *
 * @param running        whether the worker loop and timeline are active
 * @param mode           {@code scheduler} or {@code single_task}
 * @param startedAt      when the scheduler was last started, or {@code null}
 * @param uptimeSeconds  seconds since {@code startedAt}, 0 when stopped
 * @param totalTasks     tasks in the catalog
 * @param enabledTasks   enabled tasks in the catalog
 * @param queueSize      pending queue items
 * @param queuedTasks    task ids in queue order
 * @param runningTasks   task ids with an invocation in flight
 * @param armedTriggers  number of armed trigger timers
 * @param resourceGroups per-group occupancy
 * @param retryCounters  non-zero failure and success-repeat counters
 */
public record SchedulerStatus(
        boolean running,
        String mode,
        LocalDateTime startedAt,
        long uptimeSeconds,
        int totalTasks,
        int enabledTasks,
        int queueSize,
        List<String> queuedTasks,
        List<String> runningTasks,
        int armedTriggers,
        List<ResourceGroupStatus> resourceGroups,
        List<RetryController.Counters> retryCounters
) {}
