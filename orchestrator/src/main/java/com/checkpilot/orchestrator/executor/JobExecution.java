package com.checkpilot.orchestrator.executor;

import com.checkpilot.orchestrator.model.IoLogRecord;
import com.checkpilot.orchestrator.model.Outcome;

import java.util.List;

/**
 * Result of running one job.
 *
 * @param returnCode null when no process was started
 * @param comment    extra information for the operator (timeout, leftovers...), may be null
 * @param timedOut   the process was killed at the time limit; its output is incomplete
 */
public record JobExecution(Outcome outcome, Integer returnCode, List<IoLogRecord> ioLog,
                           String comment, double duration, boolean timedOut) {

    public JobExecution(Outcome outcome, Integer returnCode, List<IoLogRecord> ioLog,
                        String comment, double duration) {
        this(outcome, returnCode, ioLog, comment, duration, false);
    }

    static JobExecution withoutProcess(Outcome outcome, String comment) {
        return new JobExecution(outcome, null, List.of(), comment, 0.0);
    }

    /** A process ran to its own end, so what it printed is complete. */
    public boolean ranToCompletion() {
        return returnCode != null && !timedOut;
    }
}
