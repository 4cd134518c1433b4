package com.checkpilot.orchestrator.qualifier;

import com.checkpilot.orchestrator.catalog.UnitCatalog;
import com.checkpilot.orchestrator.model.TestPlanUnit;

/** Selects jobs through the rules of one test plan of the catalogue. */
public record TestPlanSelector(String testPlanId) implements JobSelector {

    /** @throws IllegalArgumentException if the catalogue has no such test plan */
    @Override
    public Selection select(UnitCatalog catalog) {
        TestPlanUnit plan = catalog.testPlan(testPlanId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown test plan: " + testPlanId));
        return SelectionEngine.select(SelectionRules.of(plan), catalog.jobs());
    }
}
