package com.checkpilot.orchestrator.model;

/**
 * Per-job record inside a session: the definition, its latest result and,
 * for units produced by a local job, the id of that generator ({@code via}).
 *
 * Mutated only by the owning session.
 */
public class JobState {

    private JobDefinition job;
    private JobResult result = JobResult.NONE;
    private String via;

    public JobState(JobDefinition job) {
        this.job = job;
    }

    public JobState(JobDefinition job, String via) {
        this.job = job;
        this.via = via;
    }

    public JobDefinition getJob()    { return job; }
    public JobResult     getResult() { return result; }
    public Outcome       getOutcome(){ return result.outcome(); }
    public String        getVia()    { return via; }

    public void setResult(JobResult result) { this.result = result; }
    public void setVia(String via)          { this.via = via; }
    public void setJob(JobDefinition job)   { this.job = job; }

    @Override
    public String toString() {
        return "JobState[" + job.id() + ", " + result.outcome().value()
                + (via != null ? ", via=" + via : "") + "]";
    }
}
