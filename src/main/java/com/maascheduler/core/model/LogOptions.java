package com.maascheduler.core.model;

/**
 * Output capture flags.
 *
 * @param logToGlobal mirror each output line into the application log
 * @param tempLog     stream lines into the per-run log file while the command runs
 */
public record LogOptions(boolean logToGlobal, boolean tempLog) {

    public static LogOptions defaults() {
        return new LogOptions(true, false);
    }
}
