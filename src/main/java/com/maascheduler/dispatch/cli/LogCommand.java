package com.maascheduler.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.maascheduler.core.history.RunHistoryStore;
import com.maascheduler.core.history.RunRecord;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.net.ConnectException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * CLI command: maa-scheduler log &lt;task-id&gt; [--lines N]
 * <p>
 * Prints the tail of the task's live log from a running server. When no server answers, falls back to
 * the log file of the task's most recent recorded run.
 */
@Command(name = "log", mixinStandardHelpOptions = true, description = "Show a task's recent output")
@Component
public class LogCommand extends RemoteCommand {

    @Parameters(index = "0", description = "Task ID")
    private String taskId;

    @Option(names = {"--lines", "-n"}, description = "Number of lines (default: ${DEFAULT-VALUE})",
            defaultValue = "200")
    private int lines;

    private final RunHistoryStore historyStore;

    public LogCommand(ObjectMapper objectMapper, RunHistoryStore historyStore) {
        super(objectMapper);
        this.historyStore = historyStore;
    }

    @Override
    protected void execute(SchedulerApiClient client) throws IOException, InterruptedException {
        try {
            JsonNode result = client.get("/api/v1/tasks/" + taskId + "/logs?lines=" + lines);
            JsonNode logLines = result.path("lines");
            if (logLines.size() == 0) {
                ConsoleOutput.info("No live output for task " + taskId);
                return;
            }
            ConsoleOutput.info("Live log of " + taskId + " (last " + logLines.size() + " lines):");
            for (JsonNode line : logLines) {
                System.out.println(line.asText());
            }
        } catch (ConnectException e) {
            ConsoleOutput.warn("Server not reachable at " + client.baseUrl() + ", reading the last run log");
            printLastRunLog();
        }
    }

    private void printLastRunLog() throws IOException {
        List<RunRecord> runs = historyStore.runsOf(taskId, 1);
        if (runs.isEmpty() || runs.get(0).logFile() == null) {
            ConsoleOutput.error("No recorded runs for task " + taskId);
            return;
        }
        RunRecord last = runs.get(0);
        Path file = Path.of(last.logFile());
        if (!Files.isRegularFile(file)) {
            ConsoleOutput.error("Log file of run " + last.runId() + " no longer exists: " + file);
            return;
        }
        List<String> content = Files.readAllLines(file, StandardCharsets.UTF_8);
        List<String> tail = content.size() > lines ? content.subList(content.size() - lines, content.size()) : content;
        ConsoleOutput.info("Run " + last.runId() + " (" + last.status() + "), " + file);
        tail.forEach(System.out::println);
    }
}
