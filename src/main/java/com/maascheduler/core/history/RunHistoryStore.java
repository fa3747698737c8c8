package com.maascheduler.core.history;

import java.nio.file.Path;
import java.util.List;

/**
 * Durable store for run history and per-run log files.
 */
public interface RunHistoryStore {

    /**
     * Location of the log file for a run. Parent directories exist when this returns.
     */
    Path logFileFor(String taskId, String runId);

    /**
     * Persists a finished run. Called once per invocation.
     *
     * @return the stored record, which may carry a normalised log file path
     */
    RunRecord recordRun(String taskId, String runId, RunRecord record);

    /** Most recent runs across all tasks, newest last. */
    List<RunRecord> recentRuns(int limit);

    /** Most recent runs of one task, newest last. */
    List<RunRecord> runsOf(String taskId, int limit);
}
