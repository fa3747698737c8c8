package com.maascheduler.core.executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Per-run log file written while the command runs. A disabled or unopenable log silently discards lines.
 */
final class RunLog implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RunLog.class);

    private final BufferedWriter writer;

    private RunLog(BufferedWriter writer) {
        this.writer = writer;
    }

    static RunLog open(Path file, boolean enabled) {
        if (!enabled || file == null) {
            return new RunLog(null);
        }
        try {
            return new RunLog(Files.newBufferedWriter(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.warn("Cannot open run log {}: {}", file, e.getMessage());
            return new RunLog(null);
        }
    }

    synchronized void append(String line) {
        if (writer == null) {
            return;
        }
        try {
            writer.write(line);
            writer.newLine();
            writer.flush();
        } catch (IOException e) {
            log.debug("Run log write failed: {}", e.getMessage());
        }
    }

    @Override
    public synchronized void close() {
        if (writer == null) {
            return;
        }
        try {
            writer.close();
        } catch (IOException e) {
            log.debug("Run log close failed: {}", e.getMessage());
        }
    }
}
