package com.checkpilot.orchestrator.model;

/**
 * Outcome of one job within a session.
 *
 * NONE means the job has not run yet. Every other value is terminal for
 * the current attempt; only an explicit re-run request resets it.
 */
public enum Outcome {
    NONE("none"),
    PASS("pass"),
    FAIL("fail"),
    SKIP("skip"),
    NOT_SUPPORTED("not-supported"),
    UNDECIDED("undecided");

    private final String value;

    Outcome(String value) {
        this.value = value;
    }

    public String value() { return value; }

    public static Outcome fromValue(String value) {
        for (Outcome outcome : values()) {
            if (outcome.value.equals(value)) {
                return outcome;
            }
        }
        throw new IllegalArgumentException("unknown outcome: '" + value + "'");
    }
}
