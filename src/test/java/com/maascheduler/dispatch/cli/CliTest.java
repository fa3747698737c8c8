package com.maascheduler.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.maascheduler.core.config.ConfigurationException;
import com.maascheduler.core.config.ConfigurationSource;
import com.maascheduler.core.config.SchedulerProperties;
import com.maascheduler.core.health.HealthCheckService;
import com.maascheduler.core.health.HealthStatus;
import com.maascheduler.core.history.RunHistoryStore;
import com.maascheduler.core.history.RunRecord;
import com.maascheduler.core.model.ResourceGroup;
import com.maascheduler.core.model.TriggerSpec;
import com.maascheduler.core.scheduler.TaskScheduler;
import com.maascheduler.core.trigger.TriggerEvaluator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;

import static com.maascheduler.core.model.TaskFixtures.task;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

/**
 * Tests for the MAA Scheduler CLI command structure.
 * These tests exercise picocli directly without a Spring context.
 */
class CliTest {

    /** Nothing listens on port 1, so remote commands see a refused connection. */
    private static final String UNREACHABLE = "http://127.0.0.1:1";

    private record CliResult(int exitCode, String output) {}

    @TempDir
    Path tempDir;

    private RunHistoryStore historyStore;
    private ConfigurationSource config;
    private HealthCheckService healthCheckService;

    @BeforeEach
    void setUp() {
        historyStore = mock(RunHistoryStore.class);
        when(historyStore.recentRuns(anyInt())).thenReturn(List.of());
        config = mock(ConfigurationSource.class);
        healthCheckService = mock(HealthCheckService.class);
    }

    /**
     * Custom picocli IFactory that provides mock dependencies for commands.
     */
    private CommandLine.IFactory createFactory() {
        ObjectMapper objectMapper = new ObjectMapper();
        Clock clock = Clock.fixed(LocalDateTime.of(2026, 10, 19, 12, 0).atZone(ZoneId.systemDefault()).toInstant(),
                ZoneId.systemDefault());
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == ServeCommand.class) {
                    return (K) new ServeCommand(mock(TaskScheduler.class), new SchedulerProperties());
                }
                if (cls == ControlCommand.class) {
                    return (K) new ControlCommand(objectMapper);
                }
                if (cls == StatusCommand.class) {
                    return (K) new StatusCommand(objectMapper);
                }
                if (cls == RunCommand.class) {
                    return (K) new RunCommand(objectMapper);
                }
                if (cls == CancelCommand.class) {
                    return (K) new CancelCommand(objectMapper);
                }
                if (cls == ModeCommand.class) {
                    return (K) new ModeCommand(objectMapper);
                }
                if (cls == LogCommand.class) {
                    return (K) new LogCommand(objectMapper, historyStore);
                }
                if (cls == HistoryCommand.class) {
                    return (K) new HistoryCommand(historyStore);
                }
                if (cls == HealthCommand.class) {
                    return (K) new HealthCommand(objectMapper, healthCheckService);
                }
                if (cls == CheckConfigCommand.class) {
                    return (K) new CheckConfigCommand(config, new TriggerEvaluator(), clock);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CommandLine(new MaaSchedulerCommand(), createFactory());
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private static RunRecord run(String taskId, String runId, String status, String logFile) {
        LocalDateTime start = LocalDateTime.of(2026, 10, 19, 4, 0);
        return new RunRecord(taskId, taskId, runId, status, "COMPLETED".equals(status), status, "emulator",
                start, start.plusMinutes(12), 720.0, 0, "scheduler", taskId + ":0", "scheduled", 0, 0, false, null,
                logFile);
    }

    // =====================================================================
    //  Help output tests
    // =====================================================================

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help includes all subcommands")
        void helpIncludesAllSubcommands() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            for (String name : List.of("serve", "control", "status", "run", "cancel", "mode", "log",
                    "history", "health", "check-config", "help")) {
                assertTrue(result.output().contains(name), "Help should list '" + name + "' subcommand");
            }
        }

        @Test
        @DisplayName("--version shows version")
        void versionOutput() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("MAA Scheduler 0.1.0"));
        }

        @Test
        @DisplayName("no arguments prints the banner and usage")
        void noArguments() {
            CliResult result = execute();
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("MAA SCHEDULER"));
            assertTrue(result.output().contains("Usage: maa-scheduler"));
        }

        @Test
        @DisplayName("an unknown control action is a usage error")
        void badControlAction() {
            CliResult result = execute("control", "restart");
            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("restart"));
        }
    }

    // =====================================================================
    //  Local commands
    // =====================================================================

    @Nested
    @DisplayName("history")
    class HistoryTests {

        @Test
        @DisplayName("empty history prints a notice")
        void emptyHistory() {
            CliResult result = execute("history");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("No runs recorded."));
        }

        @Test
        @DisplayName("lists runs of one task")
        void historyOfTask() {
            when(historyStore.runsOf("daily-routine", 5)).thenReturn(List.of(
                    run("daily-routine", "20261019_040000_a1b2c3", "COMPLETED", null)));

            CliResult result = execute("history", "--task", "daily-routine", "-n", "5");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("20261019_040000_a1b2c3"));
            assertTrue(result.output().contains("12m 0s"));
            verify(historyStore).runsOf("daily-routine", 5);
        }
    }

    @Nested
    @DisplayName("check-config")
    class CheckConfigTests {

        @Test
        @DisplayName("valid catalog prints next fire times")
        void validCatalog() {
            when(config.getResourceGroups()).thenReturn(List.of(new ResourceGroup("emulator", "MuMu", 1)));
            when(config.getTasks()).thenReturn(List.of(
                    task("daily-routine", 1, "emulator", new TriggerSpec.Scheduled(LocalTime.of(4, 0), null))));

            CliResult result = execute("check-config");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("2026-10-20T04:00"));
            assertTrue(result.output().contains("Catalog OK"));
        }

        @Test
        @DisplayName("undeclared group is flagged")
        void undeclaredGroup() {
            when(config.getResourceGroups()).thenReturn(List.of());
            when(config.getTasks()).thenReturn(List.of(task("credit-shop", 3, "phone")));

            CliResult result = execute("check-config");

            assertTrue(result.output().contains("undeclared group 'phone'"));
            assertTrue(result.output().contains("1 warning(s)"));
        }

        @Test
        @DisplayName("unreadable catalog is reported")
        void invalidCatalog() {
            doThrow(new ConfigurationException("tasks.yaml: unknown trigger type 'hourly'")).when(config).reload();

            CliResult result = execute("check-config");

            assertTrue(result.output().contains("Catalog invalid"));
            assertTrue(result.output().contains("hourly"));
        }
    }

    // =====================================================================
    //  Remote commands without a server
    // =====================================================================

    @Nested
    @DisplayName("Remote commands without a server")
    class UnreachableServerTests {

        @Test
        @DisplayName("status reports that the server is not running")
        void statusNotRunning() {
            CliResult result = execute("status", "--server", UNREACHABLE);
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Cannot connect to MAA Scheduler server"));
        }

        @Test
        @DisplayName("run reports that the server is not running")
        void runNotRunning() {
            CliResult result = execute("run", "daily-routine", "--server", UNREACHABLE);
            assertTrue(result.output().contains("Cannot connect to MAA Scheduler server"));
        }

        @Test
        @DisplayName("log falls back to the last recorded run")
        void logFallsBackToFile() throws IOException {
            Path logFile = tempDir.resolve("roguelike.log");
            Files.writeString(logFile, "line 1\nline 2\nline 3\n");
            when(historyStore.runsOf("roguelike", 1)).thenReturn(List.of(
                    run("roguelike", "20261019_230000_ffffff", "FAILED", logFile.toString())));

            CliResult result = execute("log", "roguelike", "-n", "2", "--server", UNREACHABLE);

            assertTrue(result.output().contains("reading the last run log"));
            assertFalse(result.output().contains("line 1"));
            assertTrue(result.output().contains("line 3"));
        }

        @Test
        @DisplayName("health runs the checks locally")
        void healthLocal() {
            when(healthCheckService.checkAll()).thenReturn(List.of(
                    new HealthStatus("scheduler", HealthStatus.Status.DEGRADED, "Scheduler stopped",
                            Map.of("mode", "scheduler")),
                    new HealthStatus("logs", HealthStatus.Status.UP, "Log directory writable", Map.of())));

            CliResult result = execute("health", "--server", UNREACHABLE);

            assertTrue(result.output().contains("running local checks"));
            assertTrue(result.output().contains("Scheduler stopped"));
            assertTrue(result.output().contains("one or more components degraded or down"));
        }
    }

    @Test
    @DisplayName("serve mode is detected from the arguments")
    void serveModeDetection() {
        assertTrue(CliRunner.isServeMode("serve", "--server.port=9090"));
        assertFalse(CliRunner.isServeMode("status"));
        assertFalse(CliRunner.isServeMode());
    }
}
