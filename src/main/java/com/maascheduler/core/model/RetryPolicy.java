package com.maascheduler.core.model;

import java.time.Duration;

/**
 * Failure-retry settings for a task.
 *
 * @param enabled            whether failed runs are retried at all
 * @param maxRetries         maximum consecutive retries after the initial attempt
 * @param delay              fixed delay before each retry (at least one second)
 * @param notifyAfterRetries retry count at which a single alert is sent, or {@code null} for none
 * @param rerunPreTasks      when false, retries skip device preparation
 * @param successRepeat      independent within-window repeat policy for successful runs
 */
public record RetryPolicy(
        boolean enabled,
        int maxRetries,
        Duration delay,
        Integer notifyAfterRetries,
        boolean rerunPreTasks,
        SuccessRepeatPolicy successRepeat
) {

    public RetryPolicy {
        delay = delay == null || delay.compareTo(Duration.ofSeconds(1)) < 0 ? Duration.ofSeconds(1) : delay;
        successRepeat = successRepeat == null ? SuccessRepeatPolicy.disabled() : successRepeat;
        maxRetries = Math.max(0, maxRetries);
    }

    public static RetryPolicy disabled() {
        return new RetryPolicy(false, 0, Duration.ofSeconds(60), null, true, SuccessRepeatPolicy.disabled());
    }

    public boolean retriesFailures() {
        return enabled && maxRetries > 0;
    }
}
