package com.checkpilot.orchestrator.session;

/** Why {@link SessionService#run} returned. */
public enum RunOutcome {
    /** Every run-list entry has an outcome; the session is complete. */
    COMPLETED,
    /** An abort was requested; the session is checkpointed and resumable. */
    ABORTED,
    /** A {@code noreturn} job was dispatched; the session continues after resume. */
    AWAITING_RESUME
}
