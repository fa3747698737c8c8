package com.maascheduler.core.executor;

/**
 * Receives command output one line at a time, from the thread draining that stream.
 */
@FunctionalInterface
public interface OutputListener {

    enum Stream { STDOUT, STDERR }

    void onLine(Stream stream, String line);

    OutputListener NONE = (stream, line) -> { };
}
