package com.maascheduler.core.history;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.maascheduler.core.model.QueueItem;
import com.maascheduler.core.model.QueueOrigin;
import com.maascheduler.core.model.RunResult;
import com.maascheduler.core.model.TaskDefinition;

import java.time.LocalDateTime;

/**
 * History entry for one finished invocation, as persisted and shown to operators.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RunRecord(
        String taskId,
        String taskName,
        String runId,
        String status,
        boolean success,
        String message,
        String resourceGroup,
        LocalDateTime startTime,
        LocalDateTime endTime,
        double durationSeconds,
        Integer returnCode,
        String origin,
        String triggerKey,
        String triggerType,
        int retryAttempt,
        int repeatAttempt,
        boolean manual,
        String cancelReason,
        String logFile
) {

    public static RunRecord of(TaskDefinition task, QueueItem item, RunResult result, String logFile) {
        return new RunRecord(
                task.id(),
                task.name(),
                result.runId(),
                result.status().name(),
                result.success(),
                result.message(),
                task.resourceGroup(),
                result.startTime(),
                result.endTime(),
                result.duration().toMillis() / 1000.0,
                result.exitCode(),
                item.origin().label(),
                item.triggerKey() == null ? null : item.triggerKey().toString(),
                item.triggerType() == null ? null : item.triggerType().label(),
                item.retryAttempt(),
                item.repeatAttempt(),
                item.origin() == QueueOrigin.MANUAL,
                result.cancelReason() == null ? null : result.cancelReason().label(),
                logFile);
    }

    public RunRecord withLogFile(String path) {
        return new RunRecord(taskId, taskName, runId, status, success, message, resourceGroup, startTime, endTime,
                durationSeconds, returnCode, origin, triggerKey, triggerType, retryAttempt, repeatAttempt, manual,
                cancelReason, path);
    }
}
