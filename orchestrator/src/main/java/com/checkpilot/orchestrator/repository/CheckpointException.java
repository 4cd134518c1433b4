package com.checkpilot.orchestrator.repository;

/**
 * Session state could not be written or read back. Fatal for a run in
 * progress: continuing without a persisted checkpoint would break resume.
 */
public class CheckpointException extends RuntimeException {

    public CheckpointException(String message) {
        super(message);
    }

    public CheckpointException(String message, Throwable cause) {
        super(message, cause);
    }
}
