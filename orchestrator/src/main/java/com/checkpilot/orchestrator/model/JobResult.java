package com.checkpilot.orchestrator.model;

import java.util.Objects;

/**
 * Recorded result of one job attempt.
 *
 * @param outcome           terminal outcome, or NONE when the job has not run
 * @param comment           operator or controller note, may be null
 * @param ioLogRef          reference into the session's I/O log store, may be null
 * @param returnCode        process exit code, null when no process was started
 * @param executionDuration wall clock seconds, null when no process was started
 */
public record JobResult(Outcome outcome,
                        String comment,
                        String ioLogRef,
                        Integer returnCode,
                        Double executionDuration) {

    public static final JobResult NONE = new JobResult(Outcome.NONE, null, null, null, null);

    public JobResult {
        Objects.requireNonNull(outcome, "outcome");
    }

    public static JobResult of(Outcome outcome, String comment) {
        return new JobResult(outcome, comment, null, null, null);
    }

    public boolean isFinal() {
        return outcome == Outcome.PASS || outcome == Outcome.FAIL;
    }
}
