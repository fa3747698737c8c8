package com.maascheduler.core.notification;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.maascheduler.core.config.SchedulerProperties;
import com.maascheduler.core.metrics.SchedulerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;

/**
 * ServerChan-style webhook sink: form POST of {@code title}, {@code desp} and {@code channel} to
 * {@code {baseUrl}/{token}.send}. A message counts as delivered when the endpoint answers HTTP 200
 * with JSON {@code code == 0}.
 */
@Service
public class WebhookNotificationService implements NotificationSink {

    private static final Logger log = LoggerFactory.getLogger(WebhookNotificationService.class);

    private final SchedulerProperties.Webhook settings;
    private final SchedulerMetrics metrics;
    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;

    @Autowired
    public WebhookNotificationService(SchedulerProperties properties, SchedulerMetrics metrics,
                                      ObjectMapper objectMapper) {
        this(properties, metrics, objectMapper, HttpClient.newBuilder()
                .connectTimeout(properties.getWebhook().getTimeout())
                .build());
    }

    WebhookNotificationService(SchedulerProperties properties, SchedulerMetrics metrics,
                               ObjectMapper objectMapper, HttpClient httpClient) {
        this.settings = properties.getWebhook();
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.httpClient = httpClient;
    }

    @Override
    public boolean isConfigured() {
        return settings.isConfigured();
    }

    @Override
    public boolean notify(String title, String content, String tag) {
        if (!settings.isConfigured()) {
            log.debug("Webhook not configured, dropping notification '{}'", title);
            return false;
        }

        String body = "title=%s&desp=%s".formatted(encode(title), encode(content));
        if (tag != null && !tag.isBlank()) {
            body += "&channel=" + encode(tag);
        }

        boolean delivered = false;
        try {
            var request = HttpRequest.newBuilder()
                    .uri(URI.create(endpoint()))
                    .timeout(settings.getTimeout())
                    .header("Content-Type", "application/x-www-form-urlencoded")
                    .header("Accept", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(body))
                    .build();

            var response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                log.warn("Webhook returned HTTP {} for '{}': {}", response.statusCode(), title, response.body());
            } else {
                JsonNode json = objectMapper.readTree(response.body());
                delivered = json.path("code").asInt(-1) == 0;
                if (!delivered) {
                    log.warn("Webhook rejected '{}': {}", title, response.body());
                } else {
                    log.info("Notification sent: {} [{}]", title, tag);
                }
            }
        } catch (IOException e) {
            log.error("Failed to send notification '{}': {}", title, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while sending notification '{}'", title);
        }
        metrics.recordNotification(tag, delivered);
        return delivered;
    }

    String endpoint() {
        String base = settings.getBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + "/" + settings.getToken() + ".send";
    }

    private static String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
    }
}
