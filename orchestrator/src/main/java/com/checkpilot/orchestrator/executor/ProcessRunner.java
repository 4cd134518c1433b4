package com.checkpilot.orchestrator.executor;

import com.checkpilot.orchestrator.executor.dto.ExecutionResult;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Spawns job processes. Separated from {@link ExecutionController} so the
 * controller can be tested without real processes.
 */
public interface ProcessRunner {

    /**
     * Run to completion, capturing stdout and stderr with timestamps.
     * A process still running after {@code timeout} is killed.
     *
     * @param environment complete environment of the child, nothing is inherited
     * @throws ExecutorException if the process cannot be started
     */
    ExecutionResult run(List<String> command, Map<String, String> environment, Path workDir, Duration timeout);

    /**
     * Start the process and return at once, output discarded. Used for jobs
     * that are not expected to return (reboot, power off).
     *
     * @throws ExecutorException if the process cannot be started
     */
    void dispatch(List<String> command, Map<String, String> environment, Path workDir);
}
