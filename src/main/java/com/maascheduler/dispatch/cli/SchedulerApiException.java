package com.maascheduler.dispatch.cli;

/**
 * Non-2xx answer from the scheduler REST API.
 */
public class SchedulerApiException extends RuntimeException {

    private final int statusCode;

    public SchedulerApiException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public int statusCode() {
        return statusCode;
    }
}
