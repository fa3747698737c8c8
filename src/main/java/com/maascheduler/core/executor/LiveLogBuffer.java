package com.maascheduler.core.executor;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Bounded per-task ring buffer of the most recent output lines.
 */
public class LiveLogBuffer {

    private final int capacity;
    private final ConcurrentHashMap<String, Deque<String>> buffers = new ConcurrentHashMap<>();

    public LiveLogBuffer(int capacity) {
        this.capacity = Math.max(1, capacity);
    }

    /** Starts a fresh buffer for a new run of the task. */
    public void reset(String taskId) {
        buffers.put(taskId, new ArrayDeque<>(capacity));
    }

    public void append(String taskId, String line) {
        Deque<String> buffer = buffers.computeIfAbsent(taskId, k -> new ArrayDeque<>(capacity));
        synchronized (buffer) {
            if (buffer.size() >= capacity) {
                buffer.removeFirst();
            }
            buffer.addLast(line);
        }
    }

    /**
     * @return up to {@code limit} most recent lines, oldest first
     */
    public List<String> tail(String taskId, int limit) {
        Deque<String> buffer = buffers.get(taskId);
        if (buffer == null) {
            return List.of();
        }
        synchronized (buffer) {
            List<String> lines = new ArrayList<>(buffer);
            if (limit > 0 && lines.size() > limit) {
                return new ArrayList<>(lines.subList(lines.size() - limit, lines.size()));
            }
            return lines;
        }
    }
}
