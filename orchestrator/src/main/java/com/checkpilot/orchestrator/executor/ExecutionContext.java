package com.checkpilot.orchestrator.executor;

import java.nio.file.Path;

/**
 * Per-session inputs of a job execution.
 *
 * @param shareDir directory shared by all jobs of the session, exported to them
 */
public record ExecutionContext(String sessionId, Path shareDir) {}
