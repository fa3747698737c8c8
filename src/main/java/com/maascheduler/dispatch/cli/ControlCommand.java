package com.maascheduler.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.IOException;

/**
 * CLI command: maa-scheduler control &lt;start|stop|reload&gt;
 */
@Command(name = "control", mixinStandardHelpOptions = true,
        description = "Start, stop or reload the scheduler of a running server")
@Component
public class ControlCommand extends RemoteCommand {

    enum Action { start, stop, reload }

    @Parameters(index = "0", description = "One of: ${COMPLETION-CANDIDATES}")
    private Action action;

    public ControlCommand(ObjectMapper objectMapper) {
        super(objectMapper);
    }

    @Override
    protected void execute(SchedulerApiClient client) throws IOException, InterruptedException {
        JsonNode result = client.post("/api/v1/scheduler/" + action.name());
        ConsoleOutput.success(result.path("message").asText(action.name() + " done"));
    }
}
