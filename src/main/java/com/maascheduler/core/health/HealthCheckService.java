package com.maascheduler.core.health;

import com.maascheduler.core.config.ConfigurationSource;
import com.maascheduler.core.config.SchedulerProperties;
import com.maascheduler.core.model.TaskDefinition;
import com.maascheduler.core.notification.NotificationSink;
import com.maascheduler.core.scheduler.TaskScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final TaskScheduler scheduler;
    private final ConfigurationSource config;
    private final NotificationSink notifications;
    private final Path logDirectory;

    @Autowired
    public HealthCheckService(TaskScheduler scheduler, ConfigurationSource config,
                              NotificationSink notifications, SchedulerProperties properties) {
        this(scheduler, config, notifications, Path.of(properties.getLogs().getDirectory()));
    }

    HealthCheckService(TaskScheduler scheduler, ConfigurationSource config,
                       NotificationSink notifications, Path logDirectory) {
        this.scheduler = scheduler;
        this.config = config;
        this.notifications = notifications;
        this.logDirectory = logDirectory;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkScheduler());
        results.add(checkConfiguration());
        results.add(checkNotifications());
        results.add(checkLogStorage());
        return results;
    }

    private HealthStatus checkScheduler() {
        String mode = scheduler.getMode().label();
        if (scheduler.isRunning()) {
            return new HealthStatus("scheduler", HealthStatus.Status.UP,
                    "Scheduler running", Map.of("mode", mode));
        }
        return new HealthStatus("scheduler", HealthStatus.Status.DEGRADED,
                "Scheduler stopped", Map.of("mode", mode));
    }

    private HealthStatus checkConfiguration() {
        try {
            List<TaskDefinition> tasks = config.getTasks();
            long enabled = tasks.stream().filter(TaskDefinition::enabled).count();
            return new HealthStatus("configuration", HealthStatus.Status.UP,
                    "Task catalog loaded",
                    Map.of("tasks", String.valueOf(tasks.size()), "enabled", String.valueOf(enabled)));
        } catch (Exception e) {
            log.warn("Configuration health check failed: {}", e.getMessage());
            return new HealthStatus("configuration", HealthStatus.Status.DOWN,
                    "Configuration error: " + e.getMessage(), Map.of());
        }
    }

    private HealthStatus checkNotifications() {
        if (notifications.isConfigured()) {
            return new HealthStatus("notifications", HealthStatus.Status.UP,
                    "Webhook configured", Map.of());
        }
        return new HealthStatus("notifications", HealthStatus.Status.DEGRADED,
                "No webhook configured, notifications are only logged", Map.of());
    }

    private HealthStatus checkLogStorage() {
        try {
            Files.createDirectories(logDirectory);
            if (Files.isWritable(logDirectory)) {
                return new HealthStatus("logs", HealthStatus.Status.UP,
                        "Log directory writable", Map.of("path", logDirectory.toAbsolutePath().toString()));
            }
            return new HealthStatus("logs", HealthStatus.Status.DOWN,
                    "Log directory not writable", Map.of("path", logDirectory.toAbsolutePath().toString()));
        } catch (Exception e) {
            log.warn("Log storage health check failed: {}", e.getMessage());
            return new HealthStatus("logs", HealthStatus.Status.DOWN,
                    "Log directory error: " + e.getMessage(), Map.of());
        }
    }
}
