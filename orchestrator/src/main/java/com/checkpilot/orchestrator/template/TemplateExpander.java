package com.checkpilot.orchestrator.template;

import com.checkpilot.orchestrator.model.ResourceRecord;
import com.checkpilot.orchestrator.model.TemplateUnit;
import com.checkpilot.orchestrator.model.Unit;
import com.checkpilot.orchestrator.model.UnitFactory;
import com.checkpilot.orchestrator.model.UnitProblem;
import com.checkpilot.orchestrator.model.UnitValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Instantiates templates against resource records.
 *
 * Expansion is a pure function of the template and the record group: the
 * same records in the same order give the same units in the same order.
 */
@Component
public class TemplateExpander {

    private static final Logger log = LoggerFactory.getLogger(TemplateExpander.class);

    public static final String INDEX_PARAM = "__index__";

    /**
     * Units produced by a batch expansion plus the templates that failed.
     *
     * @param sources id of each produced unit to the id of its template
     */
    public record Expansion(List<Unit> units, Map<String, String> sources, List<UnitProblem> problems) {}

    /**
     * One unit per record of the group that passes the template filter.
     *
     * The filter is checked against each record on its own. {@code __index__}
     * is the record's 0-based position in the group.
     *
     * @throws TemplateException if any field cannot be formatted or a produced
     *         unit is invalid; nothing is returned for the template in that case
     */
    public List<Unit> expand(TemplateUnit template, List<ResourceRecord> group) {
        List<Unit> units = new ArrayList<>();
        if (group == null) {
            return units;
        }
        for (int index = 0; index < group.size(); index++) {
            ResourceRecord record = group.get(index);
            if (template.getTemplateFilter().isPresent()
                    && !template.getTemplateFilter().get().matchesRecord(record)) {
                continue;
            }
            Map<String, String> params = new LinkedHashMap<>(record.asMap());
            params.put(INDEX_PARAM, Integer.toString(index));

            Map<String, String> fields = new LinkedHashMap<>();
            for (Map.Entry<String, String> e : template.getBody().entrySet()) {
                fields.put(e.getKey(), FieldFormatter.format(template.id(), e.getKey(), e.getValue(), params));
            }
            fields.put("unit", template.getTemplateUnit());
            try {
                units.add(UnitFactory.create(template.namespace(), fields));
            } catch (UnitValidationException e) {
                throw new TemplateException(template.id(),
                        "instantiated unit #" + index + " is invalid: " + e.getMessage(), e);
            }
        }
        return units;
    }

    /**
     * Expands every template whose resource is present in {@code resourceMap}.
     * A failing template is reported and skipped; the others are unaffected.
     */
    public Expansion expandAll(Collection<TemplateUnit> templates, Map<String, List<ResourceRecord>> resourceMap) {
        List<Unit> units = new ArrayList<>();
        Map<String, String> sources = new LinkedHashMap<>();
        List<UnitProblem> problems = new ArrayList<>();
        for (TemplateUnit template : templates) {
            List<ResourceRecord> group = resourceMap.get(template.getTemplateResource());
            if (group == null) {
                continue;
            }
            try {
                for (Unit unit : expand(template, group)) {
                    units.add(unit);
                    sources.putIfAbsent(unit.id(), template.id());
                }
            } catch (TemplateException e) {
                log.warn("Template {} not expanded: {}", template.id(), e.getMessage());
                problems.add(new UnitProblem(template.id(), "template " + template.id(), e.getMessage()));
            }
        }
        return new Expansion(units, sources, problems);
    }
}
