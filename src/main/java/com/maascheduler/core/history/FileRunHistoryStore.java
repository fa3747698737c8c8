package com.maascheduler.core.history;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.maascheduler.core.config.SchedulerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON-file history store.
 * <p>
 * Layout under the log directory:
 * <ul>
 *   <li>{@code task_history.json} - the newest {@code historyLimit} runs across all tasks</li>
 *   <li>{@code task_logs_index.json} - per-task list of runs whose log files are kept</li>
 *   <li>{@code tasks/<taskId>/<runId>.log} - one file per run</li>
 * </ul>
 * The per-task index is pruned on every write: at most {@code retentionCount} runs, none older than
 * {@code retentionDays}. Pruned runs have their log files deleted.
 */
@Component
public class FileRunHistoryStore implements RunHistoryStore {

    private static final Logger log = LoggerFactory.getLogger(FileRunHistoryStore.class);

    private static final TypeReference<List<RunRecord>> HISTORY_TYPE = new TypeReference<>() {};
    private static final TypeReference<Map<String, List<RunRecord>>> INDEX_TYPE = new TypeReference<>() {};

    private final Path directory;
    private final int historyLimit;
    private final int retentionCount;
    private final int retentionDays;
    private final Clock clock;
    private final ObjectMapper json;

    private Deque<RunRecord> history;
    private Map<String, List<RunRecord>> index;

    @Autowired
    public FileRunHistoryStore(SchedulerProperties properties) {
        this(Path.of(properties.getLogs().getDirectory()),
                properties.getScheduler().getHistoryLimit(),
                properties.getLogs().getRetentionCount(),
                properties.getLogs().getRetentionDays(),
                Clock.systemDefaultZone());
    }

    public FileRunHistoryStore(Path directory, int historyLimit, int retentionCount, int retentionDays, Clock clock) {
        this.directory = directory;
        this.historyLimit = Math.max(1, historyLimit);
        this.retentionCount = Math.max(1, retentionCount);
        this.retentionDays = Math.max(0, retentionDays);
        this.clock = clock;
        this.json = JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT)
                .build();
    }

    @Override
    public Path logFileFor(String taskId, String runId) {
        Path taskDir = directory.resolve("tasks").resolve(taskId);
        try {
            Files.createDirectories(taskDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create log directory " + taskDir, e);
        }
        return taskDir.resolve(runId + ".log");
    }

    @Override
    public synchronized RunRecord recordRun(String taskId, String runId, RunRecord record) {
        loadIfNeeded();

        history.addLast(record);
        while (history.size() > historyLimit) {
            history.removeFirst();
        }

        if (record.logFile() != null) {
            List<RunRecord> runs = index.computeIfAbsent(taskId, k -> new ArrayList<>());
            runs.removeIf(existing -> runId.equals(existing.runId()));
            runs.add(record);
            prune(taskId, runs);
        }

        write(directory.resolve("task_history.json"), new ArrayList<>(history));
        write(directory.resolve("task_logs_index.json"), index);
        log.debug("Recorded run {} of task {} ({})", runId, taskId, record.status());
        return record;
    }

    @Override
    public synchronized List<RunRecord> recentRuns(int limit) {
        loadIfNeeded();
        return tail(new ArrayList<>(history), limit);
    }

    @Override
    public synchronized List<RunRecord> runsOf(String taskId, int limit) {
        loadIfNeeded();
        List<RunRecord> runs = new ArrayList<>();
        for (RunRecord record : history) {
            if (record.taskId().equals(taskId)) {
                runs.add(record);
            }
        }
        return tail(runs, limit);
    }

    private void prune(String taskId, List<RunRecord> runs) {
        LocalDateTime cutoff = retentionDays > 0 ? LocalDateTime.now(clock).minusDays(retentionDays) : null;
        Iterator<RunRecord> it = runs.iterator();
        int excess = runs.size() - retentionCount;
        while (it.hasNext()) {
            RunRecord run = it.next();
            boolean tooMany = excess > 0;
            boolean tooOld = cutoff != null && run.startTime() != null && run.startTime().isBefore(cutoff);
            if (tooMany || tooOld) {
                it.remove();
                excess--;
                deleteLog(taskId, run);
            }
        }
    }

    private void deleteLog(String taskId, RunRecord run) {
        try {
            if (Files.deleteIfExists(Path.of(run.logFile()))) {
                log.debug("Deleted expired log {} of task {}", run.runId(), taskId);
            }
        } catch (IOException e) {
            log.warn("Cannot delete expired log {}: {}", run.logFile(), e.getMessage());
        }
    }

    private void loadIfNeeded() {
        if (history != null) {
            return;
        }
        history = new ArrayDeque<>();
        index = new LinkedHashMap<>();
        Path historyFile = directory.resolve("task_history.json");
        Path indexFile = directory.resolve("task_logs_index.json");
        try {
            if (Files.isRegularFile(historyFile)) {
                List<RunRecord> stored = json.readValue(historyFile.toFile(), HISTORY_TYPE);
                history.addAll(tail(stored, historyLimit));
            }
            if (Files.isRegularFile(indexFile)) {
                index.putAll(json.readValue(indexFile.toFile(), INDEX_TYPE));
            }
            log.info("Loaded {} history entries from {}", history.size(), directory);
        } catch (IOException e) {
            log.warn("Cannot read run history from {}, starting empty: {}", directory, e.getMessage());
        }
    }

    private void write(Path target, Object value) {
        try {
            Files.createDirectories(directory);
            Path temp = target.resolveSibling(target.getFileName() + ".tmp");
            json.writeValue(temp.toFile(), value);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            log.error("Cannot write {}: {}", target, e.getMessage());
        }
    }

    private static List<RunRecord> tail(List<RunRecord> records, int limit) {
        if (limit <= 0 || records.size() <= limit) {
            return records;
        }
        return new ArrayList<>(records.subList(records.size() - limit, records.size()));
    }
}
