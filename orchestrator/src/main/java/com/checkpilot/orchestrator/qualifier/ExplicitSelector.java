package com.checkpilot.orchestrator.qualifier;

import com.checkpilot.orchestrator.catalog.UnitCatalog;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Selects a fixed list of job ids. Jobs generated by a listed local job are
 * appended after the list, in the order they were generated.
 */
public record ExplicitSelector(List<String> jobIds, List<String> bootstrapIds) implements JobSelector {

    public ExplicitSelector {
        jobIds       = List.copyOf(jobIds);
        bootstrapIds = List.copyOf(bootstrapIds);
    }

    public ExplicitSelector(List<String> jobIds) {
        this(jobIds, List.of());
    }

    @Override
    public Selection select(UnitCatalog catalog) {
        Set<String> desired = new LinkedHashSet<>(jobIds);
        List<String> frontier = new ArrayList<>(jobIds);
        frontier.addAll(bootstrapIds);
        // generated jobs may be local jobs themselves
        for (int i = 0; i < frontier.size(); i++) {
            for (String child : catalog.generatedBy(frontier.get(i))) {
                if (desired.add(child)) {
                    frontier.add(child);
                }
            }
        }
        return new Selection(new ArrayList<>(desired), bootstrapIds, Map.of(), List.of());
    }
}
