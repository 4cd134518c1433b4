package com.checkpilot.orchestrator.model;

/**
 * Reason why a run-list entry cannot start right now.
 *
 * <ul>
 *   <li>PENDING_DEP: a {@code depends} or {@code after} job has not produced an outcome yet</li>
 *   <li>FAILED_DEP: a {@code depends} job finished with anything but pass</li>
 *   <li>PENDING_RESOURCE: a requirement's resource job has not run yet</li>
 *   <li>FAILED_RESOURCE: a requirement evaluates to false over the available records</li>
 * </ul>
 *
 * @param relatedJobId      the job causing the problem (not the inhibited one)
 * @param relatedExpression requirement text for the two resource causes, else null
 */
public record JobReadinessInhibitor(Cause cause, String relatedJobId, String relatedExpression) {

    public enum Cause { PENDING_DEP, FAILED_DEP, PENDING_RESOURCE, FAILED_RESOURCE }

    public boolean isResourceCause() {
        return cause == Cause.PENDING_RESOURCE || cause == Cause.FAILED_RESOURCE;
    }

    public String describe() {
        return switch (cause) {
            case PENDING_DEP -> "required dependency '" + relatedJobId + "' did not run yet";
            case FAILED_DEP  -> "required dependency '" + relatedJobId + "' has failed";
            case PENDING_RESOURCE -> "resource expression '" + relatedExpression
                    + "' could not be evaluated because the resource it depends on did not run yet";
            case FAILED_RESOURCE  -> "resource expression '" + relatedExpression + "' evaluates to false";
        };
    }
}
