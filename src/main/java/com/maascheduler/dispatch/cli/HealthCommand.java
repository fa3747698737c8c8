package com.maascheduler.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.maascheduler.core.health.HealthCheckService;
import com.maascheduler.core.health.HealthStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.io.IOException;
import java.net.ConnectException;
import java.util.Iterator;
import java.util.Map;

/**
 * CLI command: maa-scheduler health
 * <p>
 * Shows the health report of a running server. When no server answers, runs the checks locally,
 * where the scheduler itself is reported as stopped.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check system health")
@Component
public class HealthCommand extends RemoteCommand {

    private final HealthCheckService healthCheckService;

    public HealthCommand(ObjectMapper objectMapper,
                         @Autowired(required = false) HealthCheckService healthCheckService) {
        super(objectMapper);
        this.healthCheckService = healthCheckService;
    }

    @Override
    protected void execute(SchedulerApiClient client) throws IOException, InterruptedException {
        ConsoleOutput.printBanner();
        try {
            JsonNode report = client.getLenient("/api/v1/health");
            Iterator<Map.Entry<String, JsonNode>> components = report.path("components").fields();
            while (components.hasNext()) {
                Map.Entry<String, JsonNode> component = components.next();
                print(component.getKey() + ": " + component.getValue().path("detail").asText(),
                        component.getValue().path("status").asText());
            }
            printOverall("UP".equals(report.path("status").asText()));
        } catch (ConnectException e) {
            ConsoleOutput.warn("Server not reachable at " + client.baseUrl() + ", running local checks");
            runLocalChecks();
        }
    }

    private void runLocalChecks() {
        if (healthCheckService == null) {
            ConsoleOutput.error("Health check service not available");
            return;
        }
        boolean allUp = true;
        for (var check : healthCheckService.checkAll()) {
            print(check.component() + ": " + check.detail(), check.status().name());
            allUp &= check.status() == HealthStatus.Status.UP;
        }
        printOverall(allUp);
    }

    private static void print(String label, String status) {
        switch (status) {
            case "UP" -> ConsoleOutput.success(label);
            case "DEGRADED" -> ConsoleOutput.warn(label);
            default -> ConsoleOutput.error(label);
        }
    }

    private static void printOverall(boolean allUp) {
        System.out.println("──────────────────────────────────");
        if (allUp) {
            ConsoleOutput.success("Overall: all systems operational");
        } else {
            ConsoleOutput.error("Overall: one or more components degraded or down");
        }
    }
}
