package com.checkpilot.orchestrator.model;

/**
 * One edge of the job dependency graph.
 *
 * DIRECT:   {@code depends}: must run first and must pass.
 * ORDERING: {@code after}: must run first, any outcome.
 * RESOURCE: referenced by a {@code requires} expression: the resource job
 *            must run first so its records are available.
 */
public record Dependency(Kind kind, String jobId) {

    public enum Kind { DIRECT, ORDERING, RESOURCE }
}
