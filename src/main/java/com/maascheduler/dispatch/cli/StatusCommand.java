package com.maascheduler.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.util.stream.Stream;

/**
 * CLI command: maa-scheduler status
 * <p>
 * Shows scheduler state, resource-group occupancy and the task table of a running server, or follows
 * its live event stream with {@code --watch}.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show scheduler and task status")
@Component
public class StatusCommand extends RemoteCommand {

    @Option(names = {"--watch", "-w"}, description = "Watch live events via SSE")
    private boolean watch;

    public StatusCommand(ObjectMapper objectMapper) {
        super(objectMapper);
    }

    @Override
    protected void execute(SchedulerApiClient client) throws IOException, InterruptedException {
        ConsoleOutput.printBanner();
        if (watch) {
            watch(client);
            return;
        }

        JsonNode status = client.get("/api/v1/scheduler/status");
        System.out.println();
        if (status.path("running").asBoolean()) {
            ConsoleOutput.success("Scheduler running (mode: " + status.path("mode").asText()
                    + ", uptime: " + ConsoleOutput.formatDuration(status.path("uptimeSeconds").asDouble()) + ")");
        } else {
            ConsoleOutput.info("Scheduler stopped (mode: " + status.path("mode").asText() + ")");
        }
        ConsoleOutput.info(String.format("Tasks: %d (%d enabled) | Queue: %d | Running: %d | Armed triggers: %d",
                status.path("totalTasks").asInt(), status.path("enabledTasks").asInt(),
                status.path("queueSize").asInt(), status.path("runningTasks").size(),
                status.path("armedTriggers").asInt()));

        JsonNode groups = status.path("resourceGroups");
        if (groups.size() > 0) {
            System.out.println();
            System.out.printf("  %-16s %-8s %s%n", "GROUP", "SLOTS", "RUNNING");
            System.out.println("  " + "-".repeat(50));
            for (JsonNode group : groups) {
                System.out.printf("  %-16s %d/%-6d %s%n", group.path("name").asText(),
                        group.path("runningCount").asInt(), group.path("maxConcurrent").asInt(),
                        join(group.path("runningTasks")));
            }
        }

        JsonNode tasks = client.get("/api/v1/tasks");
        if (tasks.size() > 0) {
            System.out.println();
            System.out.printf("  %-20s %-4s %-12s %-14s %-10s %s%n",
                    "TASK", "PRI", "GROUP", "TRIGGER", "STATUS", "NEXT RUN");
            System.out.println("  " + "-".repeat(84));
            for (JsonNode task : tasks) {
                String state = task.path("enabled").asBoolean() ? task.path("status").asText() : "disabled";
                System.out.printf("  %-20s %-4d %-12s %-14s %-10s %s%n",
                        ConsoleOutput.truncate(task.path("id").asText(), 20),
                        task.path("priority").asInt(),
                        ConsoleOutput.truncate(task.path("resourceGroup").asText(), 12),
                        task.path("triggerType").asText(),
                        state,
                        task.path("nextRunTime").isNull() ? "-" : task.path("nextRunTime").asText("-"));
            }
        }

        JsonNode counters = status.path("retryCounters");
        if (counters.size() > 0) {
            System.out.println();
            for (JsonNode counter : counters) {
                ConsoleOutput.warn(String.format("%s: %d failure(s), %d success repeat(s)%s",
                        counter.path("key").asText(), counter.path("failures").asInt(),
                        counter.path("successRepeats").asInt(),
                        counter.path("pending").asBoolean() ? ", follow-up pending" : ""));
            }
        }
    }

    private void watch(SchedulerApiClient client) throws IOException, InterruptedException {
        ConsoleOutput.info("Watching " + client.baseUrl() + " (Ctrl+C to stop)...");
        System.out.println();

        final String[] currentEventType = {""};
        try (Stream<String> lines = client.stream("/api/v1/events")) {
            lines.forEach(line -> {
                if (line.startsWith("event:")) {
                    currentEventType[0] = line.substring(6).trim();
                } else if (line.startsWith("data:")) {
                    String data = line.substring(5).trim();
                    String eventType = currentEventType[0].isEmpty() ? "message" : currentEventType[0];
                    ConsoleOutput.watchEvent(eventType, data);
                    currentEventType[0] = "";
                }
            });
        }
        System.out.println();
        ConsoleOutput.info("Stream ended.");
    }

    private static String join(JsonNode array) {
        if (array.size() == 0) return "-";
        StringBuilder sb = new StringBuilder();
        for (JsonNode item : array) {
            if (sb.length() > 0) sb.append(", ");
            sb.append(item.asText());
        }
        return sb.toString();
    }
}
