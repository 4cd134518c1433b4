package com.checkpilot.orchestrator.resolver;

/**
 * The run list could not be computed. Aborts the whole run request; no
 * partial run list is ever executed.
 */
public class ResolutionException extends RuntimeException {

    public ResolutionException(String message) {
        super(message);
    }
}
