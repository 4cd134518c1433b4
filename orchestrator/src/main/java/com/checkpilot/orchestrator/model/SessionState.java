package com.checkpilot.orchestrator.model;

/**
 * Lifecycle of a test session.
 *
 * Transitions:
 *   NEW → SELECTING → RESOLVING → RUNNING → COMPLETE
 *   RUNNING → RESOLVING   (a local or resource job introduced new units)
 *
 * The "incomplete" metadata flag is set from NEW until COMPLETE.
 */
public enum SessionState {
    NEW,
    SELECTING,
    RESOLVING,
    RUNNING,
    COMPLETE
}
