package com.checkpilot.orchestrator.resolver;

import java.util.List;

/** The dependency graph has a cycle; {@code cycle} starts and ends on the same job. */
public class DependencyCycleException extends ResolutionException {

    private final List<String> cycle;

    public DependencyCycleException(List<String> cycle) {
        super("Dependency cycle detected: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    public List<String> getCycle() { return cycle; }
}
