package com.maascheduler.core.model;

import java.util.Locale;

/**
 * Operating mode of the scheduler. In {@link #SINGLE_TASK} mode nothing is dispatched from
 * the queue and tasks only run through explicit run-once requests.
 */
public enum SchedulerMode {
    SCHEDULER,
    SINGLE_TASK;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a mode name leniently ({@code single_task}, {@code single-task}, {@code SCHEDULER}).
     *
     * @throws IllegalArgumentException for an unknown name
     */
    public static SchedulerMode fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Scheduler mode must not be blank");
        }
        String normalized = value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown scheduler mode: " + value, e);
        }
    }
}
