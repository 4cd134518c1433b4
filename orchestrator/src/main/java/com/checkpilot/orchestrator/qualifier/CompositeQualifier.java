package com.checkpilot.orchestrator.qualifier;

import java.util.List;

/**
 * Include/exclude pair: a job is designated when some include rule matches
 * it and no exclude rule does. Exclusion always wins, whatever the order
 * the rules were written in.
 */
public record CompositeQualifier(List<JobQualifier> include, List<JobQualifier> exclude) implements JobQualifier {

    @Override
    public boolean designates(String jobId) {
        return include.stream().anyMatch(q -> q.designates(jobId)) && !isExcluded(jobId);
    }

    public boolean isExcluded(String jobId) {
        return exclude.stream().anyMatch(q -> q.designates(jobId));
    }

    @Override
    public String origin() {
        return "include " + include.size() + " / exclude " + exclude.size();
    }
}
