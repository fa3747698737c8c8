package com.maascheduler.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.IOException;

/**
 * CLI command: maa-scheduler cancel &lt;task-id&gt;
 */
@Command(name = "cancel", mixinStandardHelpOptions = true,
        description = "Cancel a running task and drop its queued runs")
@Component
public class CancelCommand extends RemoteCommand {

    @Parameters(index = "0", description = "Task ID")
    private String taskId;

    public CancelCommand(ObjectMapper objectMapper) {
        super(objectMapper);
    }

    @Override
    protected void execute(SchedulerApiClient client) throws IOException, InterruptedException {
        JsonNode result = client.post("/api/v1/tasks/" + taskId + "/cancel");
        if (result.path("cancelled").asBoolean()) {
            ConsoleOutput.success("Task " + taskId + " cancelled");
        } else {
            ConsoleOutput.info("Task " + taskId + " was neither running nor queued");
        }
    }
}
