package com.maascheduler.dispatch.api;

import com.maascheduler.core.history.RunRecord;
import com.maascheduler.core.scheduler.TaskScheduler;
import com.maascheduler.core.scheduler.TaskSummary;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for task operations and run history.
 */
@RestController
@RequestMapping("/api/v1")
public class TaskController {

    private final TaskScheduler scheduler;

    public TaskController(TaskScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @GetMapping("/tasks")
    public ResponseEntity<List<TaskSummary>> listTasks() {
        return ResponseEntity.ok(scheduler.listTasks());
    }

    /**
     * POST /api/v1/tasks/{id}/run — runs the task immediately, outside the queue.
     */
    @PostMapping("/tasks/{id}/run")
    public ResponseEntity<Map<String, String>> run(@PathVariable String id) {
        scheduler.runOnce(id);
        return ResponseEntity.accepted().body(Map.of("task_id", id, "status", "started"));
    }

    @PostMapping("/tasks/{id}/enqueue")
    public ResponseEntity<Map<String, String>> enqueue(@PathVariable String id) {
        scheduler.enqueue(id);
        return ResponseEntity.accepted().body(Map.of("task_id", id, "status", "queued"));
    }

    @PostMapping("/tasks/{id}/cancel")
    public ResponseEntity<Map<String, Object>> cancel(@PathVariable String id) {
        boolean cancelled = scheduler.cancel(id);
        return ResponseEntity.ok(Map.of("task_id", id, "cancelled", cancelled));
    }

    @PostMapping("/tasks/{id}/enable")
    public ResponseEntity<Map<String, Object>> enable(@PathVariable String id) {
        scheduler.setTaskEnabled(id, true);
        return ResponseEntity.ok(Map.of("task_id", id, "enabled", true));
    }

    @PostMapping("/tasks/{id}/disable")
    public ResponseEntity<Map<String, Object>> disable(@PathVariable String id) {
        scheduler.setTaskEnabled(id, false);
        return ResponseEntity.ok(Map.of("task_id", id, "enabled", false));
    }

    /**
     * GET /api/v1/tasks/{id}/logs?lines=200 — tail of the task's live log.
     */
    @GetMapping("/tasks/{id}/logs")
    public ResponseEntity<Map<String, Object>> logs(@PathVariable String id,
                                                    @RequestParam(defaultValue = "200") int lines) {
        List<String> tail = scheduler.getLiveLog(id, lines);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("task_id", id);
        body.put("lines", tail);
        return ResponseEntity.ok(body);
    }

    @GetMapping("/history")
    public ResponseEntity<List<RunRecord>> history(@RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(scheduler.getHistory(limit));
    }
}
