package com.checkpilot.orchestrator.qualifier;

/**
 * Decides whether a job id is selected by a rule.
 */
public interface JobQualifier {

    boolean designates(String jobId);

    /** Source text of the rule, for logs and problem reports. */
    String origin();
}
