package com.maascheduler.dispatch.api;

import com.maascheduler.core.events.EventBus;
import com.maascheduler.core.events.SchedulerEvent;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Bridges {@link EventBus} subscriptions to {@link SseEmitter} instances for the live-status stream.
 * <p>
 * A client either follows every scheduler event or the events of a single task. Emitters are
 * unsubscribed on completion, timeout or error, and kept alive with periodic comment heartbeats.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    /** Default emitter timeout: 30 minutes. */
    private static final long DEFAULT_TIMEOUT_MS = 30 * 60 * 1000L;

    private static final long HEARTBEAT_INTERVAL_SECONDS = 30;

    private final EventBus eventBus;
    private final long timeoutMs;

    private final CopyOnWriteArrayList<EmitterRegistration> activeRegistrations = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-heartbeat");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public SseStreamingService(EventBus eventBus) {
        this(eventBus, DEFAULT_TIMEOUT_MS);
    }

    SseStreamingService(EventBus eventBus, long timeoutMs) {
        this.eventBus = eventBus;
        this.timeoutMs = timeoutMs;
    }

    @PostConstruct
    void startHeartbeat() {
        heartbeatScheduler.scheduleAtFixedRate(
                this::sendHeartbeats,
                HEARTBEAT_INTERVAL_SECONDS,
                HEARTBEAT_INTERVAL_SECONDS,
                TimeUnit.SECONDS
        );
    }

    @PreDestroy
    void stopHeartbeat() {
        heartbeatScheduler.shutdown();
        try {
            if (!heartbeatScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                heartbeatScheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            heartbeatScheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        activeRegistrations.forEach(registration -> registration.emitter.complete());
    }

    private void sendHeartbeats() {
        for (EmitterRegistration registration : activeRegistrations) {
            try {
                registration.emitter.send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException | IllegalStateException e) {
                // the emitter's own callbacks unregister it
                log.debug("Heartbeat failed for {}: {}", registration.label(), e.getMessage());
            }
        }
    }

    /**
     * Creates an emitter streaming scheduler events.
     *
     * @param taskId task to follow, or {@code null} for every event
     */
    public SseEmitter createEmitter(String taskId) {
        SseEmitter emitter = new SseEmitter(timeoutMs);

        EventBus.Subscription subscription = taskId == null
                ? eventBus.subscribeAll(event -> sendEvent(emitter, event))
                : eventBus.subscribe(taskId, event -> sendEvent(emitter, event));

        var registration = new EmitterRegistration(taskId, emitter, subscription);
        activeRegistrations.add(registration);

        emitter.onCompletion(() -> cleanup(registration));
        emitter.onTimeout(() -> cleanup(registration));
        emitter.onError(ex -> {
            log.debug("SSE emitter error for {}: {}", registration.label(), ex.getMessage());
            cleanup(registration);
        });

        try {
            emitter.send(SseEmitter.event().comment("connected"));
        } catch (IOException e) {
            log.warn("Failed to confirm SSE connection for {}: {}", registration.label(), e.getMessage());
        }

        log.info("SSE emitter created for {} (timeout={}ms)", registration.label(), timeoutMs);
        return emitter;
    }

    public int activeEmitterCount() {
        return activeRegistrations.size();
    }

    private void sendEvent(SseEmitter emitter, SchedulerEvent event) {
        try {
            Map<String, Object> data = new LinkedHashMap<>();
            if (event.taskId() != null) {
                data.put("taskId", event.taskId());
            }
            data.putAll(event.payload());
            data.put("timestamp", event.timestamp().toString());

            emitter.send(SseEmitter.event()
                    .name(event.eventType())
                    .data(data));
        } catch (IOException | IllegalStateException e) {
            log.debug("Failed to send SSE event {}: {}", event.eventType(), e.getMessage());
        }
    }

    private void cleanup(EmitterRegistration registration) {
        registration.subscription.unsubscribe();
        activeRegistrations.remove(registration);
        log.debug("Cleaned up SSE registration for {}", registration.label());
    }

    private record EmitterRegistration(
            String taskId,
            SseEmitter emitter,
            EventBus.Subscription subscription
    ) {
        String label() {
            return taskId == null ? "all events" : "task " + taskId;
        }
    }
}
