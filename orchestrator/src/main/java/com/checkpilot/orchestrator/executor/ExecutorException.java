package com.checkpilot.orchestrator.executor;

/**
 * Thrown when a job's process cannot be started or waited for.
 */
public class ExecutorException extends RuntimeException {

    public ExecutorException(String message) {
        super(message);
    }

    public ExecutorException(String message, Throwable cause) {
        super(message, cause);
    }
}
