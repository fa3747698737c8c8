package com.maascheduler.core.model;

/**
 * Provenance of a queue item.
 */
public enum QueueOrigin {
    SCHEDULER("scheduler"),
    MANUAL("manual"),
    RETRY("retry"),
    SUCCESS_REPEAT("success-repeat"),
    PREEMPTED("preempted");

    private final String label;

    QueueOrigin(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /** True for origins that begin a new run cycle rather than continue an existing one. */
    public boolean isFresh() {
        return this == SCHEDULER || this == MANUAL;
    }
}
