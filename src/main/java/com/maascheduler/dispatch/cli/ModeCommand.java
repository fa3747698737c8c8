package com.maascheduler.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.util.Map;

/**
 * CLI command: maa-scheduler mode &lt;scheduler|single_task&gt;
 */
@Command(name = "mode", mixinStandardHelpOptions = true, description = "Switch the scheduler mode")
@Component
public class ModeCommand extends RemoteCommand {

    @Parameters(index = "0", description = "scheduler or single_task")
    private String mode;

    public ModeCommand(ObjectMapper objectMapper) {
        super(objectMapper);
    }

    @Override
    protected void execute(SchedulerApiClient client) throws IOException, InterruptedException {
        JsonNode result = client.put("/api/v1/scheduler/mode", Map.of("mode", mode));
        ConsoleOutput.success("Mode: " + result.path("mode").asText());
    }
}
