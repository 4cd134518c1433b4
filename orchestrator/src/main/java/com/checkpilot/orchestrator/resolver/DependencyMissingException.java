package com.checkpilot.orchestrator.resolver;

import com.checkpilot.orchestrator.model.Dependency;

/** A job references a job that is not in the catalogue. */
public class DependencyMissingException extends ResolutionException {

    private final String jobId;
    private final String missingJobId;
    private final Dependency.Kind kind;

    public DependencyMissingException(String jobId, String missingJobId, Dependency.Kind kind) {
        super("Job " + jobId + " has a missing " + kind.name().toLowerCase() + " dependency on " + missingJobId);
        this.jobId        = jobId;
        this.missingJobId = missingJobId;
        this.kind         = kind;
    }

    public String getJobId()          { return jobId; }
    public String getMissingJobId()   { return missingJobId; }
    public Dependency.Kind getKind()  { return kind; }
}
