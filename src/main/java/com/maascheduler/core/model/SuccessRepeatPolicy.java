package com.maascheduler.core.model;

import java.time.Duration;

/**
 * Re-runs a {@code scheduled} task after success while its window stays open.
 *
 * @param enabled    the {@code retry_on_success_within_window} flag
 * @param delay      wait before each repeat
 * @param maxRepeats optional cap on repeats per window, {@code null} for unbounded
 */
public record SuccessRepeatPolicy(boolean enabled, Duration delay, Integer maxRepeats) {

    public SuccessRepeatPolicy {
        delay = delay == null || delay.compareTo(Duration.ofSeconds(1)) < 0 ? Duration.ofSeconds(1) : delay;
    }

    public static SuccessRepeatPolicy disabled() {
        return new SuccessRepeatPolicy(false, Duration.ofSeconds(60), null);
    }
}
