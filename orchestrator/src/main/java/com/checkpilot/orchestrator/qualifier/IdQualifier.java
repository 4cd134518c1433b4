package com.checkpilot.orchestrator.qualifier;

/** Selects exactly one job id. */
public record IdQualifier(String id) implements JobQualifier {

    @Override
    public boolean designates(String jobId) {
        return id.equals(jobId);
    }

    @Override
    public String origin() {
        return id;
    }
}
