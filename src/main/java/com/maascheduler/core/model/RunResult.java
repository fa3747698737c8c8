package com.maascheduler.core.model;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Outcome of one invocation. Produced exactly once per run, even on exception or cancellation.
 *
 * @param taskId       task identifier
 * @param runId        run identifier ({@code yyyyMMdd_HHmmss_xxxxxx})
 * @param status       terminal status
 * @param exitCode     main command exit code, or {@code null} when it never ran to exit
 * @param stdout       captured standard output
 * @param stderr       captured standard error
 * @param startTime    when the invocation started
 * @param endTime      when the invocation finished
 * @param message      human readable summary
 * @param cancelReason why the run was cancelled, {@code null} unless {@code status} is CANCELLED
 */
public record RunResult(
        String taskId,
        String runId,
        TaskStatus status,
        Integer exitCode,
        String stdout,
        String stderr,
        LocalDateTime startTime,
        LocalDateTime endTime,
        String message,
        CancelReason cancelReason
) {

    public RunResult {
        stdout = stdout == null ? "" : stdout;
        stderr = stderr == null ? "" : stderr;
    }

    public boolean success() {
        return status == TaskStatus.COMPLETED;
    }

    public boolean cancelled() {
        return status == TaskStatus.CANCELLED;
    }

    public Duration duration() {
        if (startTime == null || endTime == null) {
            return Duration.ZERO;
        }
        return Duration.between(startTime, endTime);
    }
}
