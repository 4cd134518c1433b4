package com.checkpilot.orchestrator.resolver;

import com.checkpilot.orchestrator.model.JobDefinition;
import com.checkpilot.orchestrator.model.JobReadinessInhibitor;
import com.checkpilot.orchestrator.model.JobReadinessInhibitor.Cause;
import com.checkpilot.orchestrator.model.Outcome;
import com.checkpilot.orchestrator.model.ResourceRecord;
import com.checkpilot.orchestrator.resource.ResourceExpression;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Computes why a job cannot run given the outcomes recorded so far and the
 * current resource snapshot. An empty list means the job is runnable.
 */
public final class ReadinessCalculator {

    private ReadinessCalculator() {}

    /**
     * @param outcomeOf   latest outcome of a job id, {@link Outcome#NONE} if it never ran
     * @param resourceMap records per resource job id
     */
    public static List<JobReadinessInhibitor> inhibitors(JobDefinition job,
                                                         Function<String, Outcome> outcomeOf,
                                                         Map<String, List<ResourceRecord>> resourceMap) {
        List<JobReadinessInhibitor> out = new ArrayList<>();

        if (job.getRequires().isPresent()) {
            for (ResourceExpression e : job.getRequires().get().expressions()) {
                String resourceId = e.resourceId();
                List<ResourceRecord> group = resourceMap.get(resourceId);
                if (group == null && outcomeOf.apply(resourceId) == Outcome.NONE) {
                    out.add(new JobReadinessInhibitor(Cause.PENDING_RESOURCE, resourceId, e.text()));
                } else if (!e.evaluate(group)) {
                    out.add(new JobReadinessInhibitor(Cause.FAILED_RESOURCE, resourceId, e.text()));
                }
            }
        }

        for (String dep : job.getDepends()) {
            Outcome o = outcomeOf.apply(dep);
            if (o == Outcome.NONE) {
                out.add(new JobReadinessInhibitor(Cause.PENDING_DEP, dep, null));
            } else if (o != Outcome.PASS) {
                out.add(new JobReadinessInhibitor(Cause.FAILED_DEP, dep, null));
            }
        }

        for (String dep : job.getAfter()) {
            if (outcomeOf.apply(dep) == Outcome.NONE) {
                out.add(new JobReadinessInhibitor(Cause.PENDING_DEP, dep, null));
            }
        }
        return out;
    }
}
