package com.checkpilot.orchestrator.resolver;

/** Generated jobs kept producing new jobs past the configured pass ceiling. */
public class ResolutionDivergedException extends ResolutionException {

    private final int passes;

    public ResolutionDivergedException(int passes, int ceiling) {
        super("Resolution did not settle after " + passes + " passes (ceiling " + ceiling + ")");
        this.passes = passes;
    }

    public int getPasses() { return passes; }
}
