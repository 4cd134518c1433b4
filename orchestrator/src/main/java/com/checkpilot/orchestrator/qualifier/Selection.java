package com.checkpilot.orchestrator.qualifier;

import com.checkpilot.orchestrator.model.UnitProblem;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of applying selection rules to a catalogue.
 *
 * @param desired     selected job ids, mandatory ones first, duplicate free
 * @param bootstrap   local/resource jobs to run before anything else
 * @param categoryMap effective category per selected job (presentation only)
 * @param problems    rules that could not be applied
 */
public record Selection(List<String> desired, List<String> bootstrap,
                        Map<String, String> categoryMap, List<UnitProblem> problems) {

    public Selection {
        desired     = List.copyOf(desired);
        bootstrap   = List.copyOf(bootstrap);
        categoryMap = Collections.unmodifiableMap(new LinkedHashMap<>(categoryMap));
        problems    = List.copyOf(problems);
    }
}
