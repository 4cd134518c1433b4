package com.checkpilot.orchestrator.resolver;

import com.checkpilot.orchestrator.model.Dependency;
import com.checkpilot.orchestrator.model.JobDefinition;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Orders jobs so that every prerequisite precedes the jobs that need it.
 *
 * Depth-first walk from each job of the visit list in turn, following
 * {@code depends}, {@code after} and resource edges in declaration order;
 * a job is emitted once all its prerequisites are. Jobs are therefore kept
 * in visit-list order except where an edge forces an earlier position.
 */
public final class DependencySolver {

    private enum Color { WHITE, GRAY, BLACK }

    private final Map<String, JobDefinition> jobs;
    private final boolean ignoreMissing;
    private final Map<String, Color> color = new HashMap<>();
    private final List<String> trail = new ArrayList<>();
    private final List<JobDefinition> solution = new ArrayList<>();

    private DependencySolver(Map<String, JobDefinition> jobs, boolean ignoreMissing) {
        this.jobs          = jobs;
        this.ignoreMissing = ignoreMissing;
    }

    /**
     * Closure of {@code visitList} over all dependency edges, topologically
     * ordered. Ids in the visit list that are not known jobs are ignored.
     *
     * @throws DependencyMissingException   an edge points at an unknown job
     * @throws DependencyCycleException     the edges reachable from the visit list form a cycle
     * @throws DependencyDuplicateException {@code universe} has two definitions for one id
     */
    public static List<JobDefinition> resolve(Collection<JobDefinition> universe, List<String> visitList) {
        DependencySolver solver = new DependencySolver(index(universe), false);
        for (String id : visitList) {
            JobDefinition job = solver.jobs.get(id);
            if (job != null) {
                solver.visit(job);
            }
        }
        return List.copyOf(solver.solution);
    }

    /**
     * Checks the whole universe for cycles. Dangling edges are not an error
     * here since their target may be generated later.
     *
     * @throws DependencyCycleException on the first cycle found
     */
    public static void checkAcyclic(Collection<JobDefinition> universe) {
        DependencySolver solver = new DependencySolver(index(universe), true);
        for (JobDefinition job : solver.jobs.values()) {
            solver.visit(job);
        }
    }

    private static Map<String, JobDefinition> index(Collection<JobDefinition> universe) {
        Map<String, JobDefinition> map = new LinkedHashMap<>();
        for (JobDefinition job : universe) {
            JobDefinition previous = map.putIfAbsent(job.id(), job);
            if (previous != null && !previous.equals(job)) {
                throw new DependencyDuplicateException(job.id());
            }
        }
        return map;
    }

    private void visit(JobDefinition job) {
        Color c = color.getOrDefault(job.id(), Color.WHITE);
        if (c == Color.BLACK) {
            return;
        }
        if (c == Color.GRAY) {
            List<String> cycle = new ArrayList<>(trail.subList(trail.indexOf(job.id()), trail.size()));
            cycle.add(job.id());
            throw new DependencyCycleException(cycle);
        }
        color.put(job.id(), Color.GRAY);
        trail.add(job.id());
        for (Dependency dep : job.getDependencies()) {
            JobDefinition target = jobs.get(dep.jobId());
            if (target == null) {
                if (ignoreMissing) continue;
                throw new DependencyMissingException(job.id(), dep.jobId(), dep.kind());
            }
            visit(target);
        }
        trail.remove(trail.size() - 1);
        color.put(job.id(), Color.BLACK);
        solution.add(job);
    }
}
