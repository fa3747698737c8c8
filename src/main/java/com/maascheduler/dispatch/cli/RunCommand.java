package com.maascheduler.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;

/**
 * CLI command: maa-scheduler run &lt;task-id&gt; [--queue]
 * <p>
 * Runs a task immediately, or with {@code --queue} adds it to the scheduler's queue.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run a task now or enqueue it")
@Component
public class RunCommand extends RemoteCommand {

    @Parameters(index = "0", description = "Task ID")
    private String taskId;

    @Option(names = {"--queue", "-q"}, description = "Enqueue instead of running outside the queue")
    private boolean queue;

    public RunCommand(ObjectMapper objectMapper) {
        super(objectMapper);
    }

    @Override
    protected void execute(SchedulerApiClient client) throws IOException, InterruptedException {
        if (queue) {
            client.post("/api/v1/tasks/" + taskId + "/enqueue");
            ConsoleOutput.success("Task " + taskId + " enqueued");
        } else {
            client.post("/api/v1/tasks/" + taskId + "/run");
            ConsoleOutput.success("Task " + taskId + " started");
            ConsoleOutput.info("Follow its output with: maa-scheduler log " + taskId);
        }
    }
}
