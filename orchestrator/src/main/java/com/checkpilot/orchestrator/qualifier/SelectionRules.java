package com.checkpilot.orchestrator.qualifier;

import com.checkpilot.orchestrator.model.TestPlanUnit;

/**
 * Raw selection rule text together with the namespace unqualified patterns
 * are resolved against.
 *
 * @param ownerId id of the test plan (or whitelist name) the rules come from
 */
public record SelectionRules(String ownerId, String namespace,
                             String include, String exclude,
                             String mandatoryInclude, String bootstrapInclude,
                             String categoryOverrides) {

    public static SelectionRules of(TestPlanUnit plan) {
        return new SelectionRules(plan.id(), plan.namespace(),
                plan.getInclude(), plan.getExclude(),
                plan.getMandatoryInclude(), plan.getBootstrapInclude(),
                plan.getCategoryOverrides());
    }
}
