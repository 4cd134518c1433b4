package com.checkpilot.orchestrator.resolver;

import com.checkpilot.orchestrator.catalog.UnitCatalog;
import com.checkpilot.orchestrator.model.JobDefinition;
import com.checkpilot.orchestrator.model.ResourceRecord;
import com.checkpilot.orchestrator.model.Unit;
import com.checkpilot.orchestrator.model.UnitProblem;
import com.checkpilot.orchestrator.qualifier.JobSelector;
import com.checkpilot.orchestrator.qualifier.Selection;
import com.checkpilot.orchestrator.template.TemplateExpander;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One resolution pass: desired selection to ordered run list.
 *
 * Steps of a pass:
 *  1. Instantiate templates whose resource has records, adding new units
 *     to the session catalogue.
 *  2. Re-apply the selector to the catalogue (generated jobs may now match).
 *  3. Seed the solver with bootstrap jobs then the desired jobs and order
 *     the closure over depends/after/resource edges.
 *
 * The pass loop itself is driven by the session service, which calls
 * {@link #resolve} again whenever an executed local or resource job adds
 * units to the catalogue. The resolver never executes anything.
 *
 * The pass number is the length of the generation chain that led to the
 * pass: 1 for a pass triggered by a catalogue job, n + 1 for one triggered
 * by a job that a pass n generator produced. Independent generators each
 * start again at 1, so the ceiling only stops generators that keep
 * producing generators.
 */
@Component
public class RunListResolver {

    private static final Logger log = LoggerFactory.getLogger(RunListResolver.class);

    /**
     * Outcome of one pass.
     *
     * @param desired  selected jobs known to the catalogue, in selection order
     * @param runList  bootstrap, desired and all prerequisites, topologically ordered
     * @param added    units added to the catalogue by template instantiation
     * @param sources  id of each added unit to the id of its template
     */
    public record Resolution(int pass, Selection selection, List<String> desired,
                             List<JobDefinition> runList, List<Unit> added,
                             Map<String, String> sources, List<UnitProblem> problems) {

        public List<String> runListIds() {
            return runList.stream().map(JobDefinition::id).toList();
        }
    }

    private final TemplateExpander expander;
    private final Counter          passCounter;
    private final int              maxPasses;

    public RunListResolver(TemplateExpander expander,
                           MeterRegistry meterRegistry,
                           @Value("${checkpilot.resolver.max-passes:64}") int maxPasses) {
        this.expander    = expander;
        this.passCounter = meterRegistry.counter("checkpilot.resolution.passes");
        this.maxPasses   = maxPasses;
    }

    /**
     * Run a resolution pass at position {@code pass} (1-based) of its generation chain.
     *
     * @throws ResolutionDivergedException if {@code pass} exceeds the configured ceiling
     * @throws ResolutionException         on a missing dependency or a cycle
     */
    public Resolution resolve(UnitCatalog catalog, JobSelector selector,
                              Map<String, List<ResourceRecord>> resourceMap, int pass) {
        if (pass > maxPasses) {
            throw new ResolutionDivergedException(pass, maxPasses);
        }
        passCounter.increment();

        List<UnitProblem> problems = new ArrayList<>();
        Map<String, String> sources = new LinkedHashMap<>();
        List<Unit> added = instantiateTemplates(catalog, resourceMap, sources, problems);

        Selection selection = selector.select(catalog);
        problems.addAll(selection.problems());

        List<String> desired = selection.desired().stream().filter(catalog::contains).toList();
        List<String> visit = new ArrayList<>(selection.bootstrap());
        visit.addAll(desired);

        List<JobDefinition> runList = DependencySolver.resolve(catalog.jobs(), visit);

        log.info("Resolution pass {}: {} desired, {} in run list, {} unit(s) from templates",
                pass, desired.size(), runList.size(), added.size());
        return new Resolution(pass, selection, desired, runList, added, sources, problems);
    }

    /**
     * Expands every template against the current resource snapshot and adds
     * the resulting units to {@code catalog}. Already known identical units
     * are ignored; a different definition under a known id is reported.
     *
     * @param sources receives the template id of every new unit
     * @return units that were actually new
     */
    public List<Unit> instantiateTemplates(UnitCatalog catalog,
                                           Map<String, List<ResourceRecord>> resourceMap,
                                           Map<String, String> sources,
                                           List<UnitProblem> problems) {
        TemplateExpander.Expansion expansion = expander.expandAll(catalog.templates(), resourceMap);
        problems.addAll(expansion.problems());
        List<Unit> added = new ArrayList<>();
        for (Unit unit : expansion.units()) {
            switch (catalog.add(unit)) {
                case ADDED -> {
                    added.add(unit);
                    sources.put(unit.id(), expansion.sources().get(unit.id()));
                }
                case IDENTICAL -> { }
                case CONFLICT -> {
                    log.warn("Instantiated unit {} clashes with an existing definition, discarded", unit.id());
                    problems.add(new UnitProblem(unit.id(), "template instantiation",
                            "a different unit with this id already exists"));
                }
            }
        }
        return added;
    }
}
