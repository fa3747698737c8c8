package com.maascheduler.dispatch.api;

import com.maascheduler.core.model.ResourceGroupStatus;
import com.maascheduler.core.model.SchedulerMode;
import com.maascheduler.core.notification.NotificationSink;
import com.maascheduler.core.notification.NotificationTags;
import com.maascheduler.core.scheduler.SchedulerStatus;
import com.maascheduler.core.scheduler.TaskScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.Map;

/**
 * REST controller for scheduler lifecycle, mode, resource groups, notifications and the event stream.
 */
@RestController
@RequestMapping("/api/v1")
public class SchedulerController {

    private static final Logger log = LoggerFactory.getLogger(SchedulerController.class);

    private final TaskScheduler scheduler;
    private final NotificationSink notifications;
    private final SseStreamingService sseStreamingService;

    public SchedulerController(TaskScheduler scheduler, NotificationSink notifications,
                               SseStreamingService sseStreamingService) {
        this.scheduler = scheduler;
        this.notifications = notifications;
        this.sseStreamingService = sseStreamingService;
    }

    /**
     * GET /api/v1/scheduler/status
     */
    @GetMapping("/scheduler/status")
    public ResponseEntity<SchedulerStatus> status() {
        return ResponseEntity.ok(scheduler.getStatus());
    }

    @PostMapping("/scheduler/start")
    public ResponseEntity<Map<String, Object>> start() {
        boolean started = scheduler.start();
        return ResponseEntity.ok(Map.of(
                "running", scheduler.isRunning(),
                "message", started ? "Scheduler started" : "Scheduler already running"));
    }

    @PostMapping("/scheduler/stop")
    public ResponseEntity<Map<String, Object>> stop() {
        boolean stopped = scheduler.stop();
        return ResponseEntity.ok(Map.of(
                "running", scheduler.isRunning(),
                "message", stopped ? "Scheduler stopped" : "Scheduler was not running"));
    }

    @PostMapping("/scheduler/reload")
    public ResponseEntity<Map<String, Object>> reload() {
        int count = scheduler.reload();
        return ResponseEntity.ok(Map.of("tasks", count, "message", "Reloaded " + count + " task(s)"));
    }

    /**
     * PUT /api/v1/scheduler/mode — body {@code {"mode": "single_task"}}.
     */
    @PutMapping("/scheduler/mode")
    public ResponseEntity<Map<String, String>> setMode(@RequestBody ModeRequest request) {
        SchedulerMode mode = SchedulerMode.fromString(request == null ? null : request.mode());
        scheduler.setMode(mode);
        return ResponseEntity.ok(Map.of("mode", scheduler.getMode().label()));
    }

    @GetMapping("/resource-groups")
    public ResponseEntity<List<ResourceGroupStatus>> resourceGroups() {
        return ResponseEntity.ok(scheduler.getResourceGroupStatus());
    }

    /**
     * POST /api/v1/notifications/test — sends a test message through the configured webhook.
     */
    @PostMapping("/notifications/test")
    public ResponseEntity<Map<String, Object>> testNotification(
            @RequestBody(required = false) NotificationRequest request) {
        String title = request != null && request.title() != null ? request.title() : "MAA Scheduler test";
        String content = request != null && request.content() != null
                ? request.content() : "Test notification from MAA Scheduler.";
        boolean delivered = notifications.notify(title, content, NotificationTags.TEST);
        log.info("Test notification {}", delivered ? "delivered" : "not delivered");
        return ResponseEntity.ok(Map.of("delivered", delivered, "configured", notifications.isConfigured()));
    }

    /**
     * GET /api/v1/events — SSE stream of scheduler events, optionally filtered to one task.
     */
    @GetMapping(value = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter events(@RequestParam(name = "task", required = false) String taskId) {
        return sseStreamingService.createEmitter(taskId);
    }
}
