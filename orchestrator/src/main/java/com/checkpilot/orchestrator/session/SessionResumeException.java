package com.checkpilot.orchestrator.session;

/**
 * A stored session cannot be resumed against the current catalogue, for
 * instance because a job it recorded a result for was redefined. The caller
 * should start a new session instead.
 */
public class SessionResumeException extends RuntimeException {

    private final String sessionId;

    public SessionResumeException(String sessionId, String message) {
        super("Cannot resume session " + sessionId + ": " + message);
        this.sessionId = sessionId;
    }

    public SessionResumeException(String sessionId, String message, Throwable cause) {
        super("Cannot resume session " + sessionId + ": " + message, cause);
        this.sessionId = sessionId;
    }

    public String getSessionId() { return sessionId; }
}
