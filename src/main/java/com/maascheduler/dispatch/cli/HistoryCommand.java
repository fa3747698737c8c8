package com.maascheduler.dispatch.cli;

import com.maascheduler.core.history.RunHistoryStore;
import com.maascheduler.core.history.RunRecord;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * CLI command: maa-scheduler history
 * <p>
 * Reads the persisted run history and displays it as a table: Run ID | Task | Status | Origin |
 * Started | Duration.
 */
@Command(name = "history", mixinStandardHelpOptions = true, description = "List recent task runs")
@Component
public class HistoryCommand implements Runnable {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("MM-dd HH:mm:ss");

    @Option(names = {"--limit", "-n"}, description = "Number of results", defaultValue = "20")
    private int limit;

    @Option(names = {"--task", "-t"}, description = "Only runs of this task")
    private String taskId;

    private final RunHistoryStore historyStore;

    public HistoryCommand(RunHistoryStore historyStore) {
        this.historyStore = historyStore;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<RunRecord> runs = taskId == null ? historyStore.recentRuns(limit) : historyStore.runsOf(taskId, limit);
        if (runs.isEmpty()) {
            ConsoleOutput.info("No runs recorded.");
            return;
        }

        ConsoleOutput.info("Runs (" + runs.size() + "):");
        System.out.println();
        System.out.printf("  %-24s %-18s %-10s %-15s %-15s %s%n",
                "RUN ID", "TASK", "STATUS", "ORIGIN", "STARTED", "DURATION");
        System.out.println("  " + "-".repeat(96));

        for (RunRecord run : runs) {
            System.out.printf("  %-24s %-18s %-10s %-15s %-15s %s%n",
                    run.runId(),
                    ConsoleOutput.truncate(run.taskId(), 18),
                    run.status(),
                    run.origin() == null ? "-" : run.origin(),
                    run.startTime() == null ? "-" : TIME_FORMAT.format(run.startTime()),
                    ConsoleOutput.formatDuration(run.durationSeconds()));
        }
    }
}
