package com.maascheduler.core.model;

/**
 * Why a running invocation was cancelled. Downstream consumers use the reason to tell
 * an operator cancellation apart from a system eviction.
 */
public enum CancelReason {
    MANUAL("manual"),
    PREEMPT("preempt"),
    STOP("stop"),
    DISABLED("disabled"),
    MODE_SWITCH("mode-switch");

    private final String label;

    CancelReason(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /** Preemption is silent: no notification, automatic re-queue. */
    public boolean isSilent() {
        return this == PREEMPT;
    }
}
