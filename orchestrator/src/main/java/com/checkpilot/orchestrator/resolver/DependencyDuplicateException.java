package com.checkpilot.orchestrator.resolver;

/** Two different job definitions share one id. */
public class DependencyDuplicateException extends ResolutionException {

    private final String jobId;

    public DependencyDuplicateException(String jobId) {
        super("Job " + jobId + " is defined more than once");
        this.jobId = jobId;
    }

    public String getJobId() { return jobId; }
}
