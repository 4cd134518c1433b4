package com.checkpilot.orchestrator.catalog;

import com.checkpilot.orchestrator.model.JobDefinition;
import com.checkpilot.orchestrator.model.TemplateUnit;
import com.checkpilot.orchestrator.model.TestPlanUnit;
import com.checkpilot.orchestrator.model.Unit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The loaded unit universe: an arena of units in load order plus an
 * id to index map.
 *
 * Catalogue order is the order units were added in and is what ties are
 * broken on during selection. Each session works on its own {@link #copy()}
 * since generated units are session specific.
 */
public class UnitCatalog {

    public enum AddResult {
        /** New id. */
        ADDED,
        /** Same id and same content as an existing unit; nothing changed. */
        IDENTICAL,
        /** Same id, different content; the existing unit is kept. */
        CONFLICT
    }

    private final List<Unit> units = new ArrayList<>();
    private final Map<String, Integer> index = new HashMap<>();
    private final Map<String, String> via = new LinkedHashMap<>();

    public synchronized AddResult add(Unit unit) {
        Integer existing = index.get(unit.id());
        if (existing != null) {
            return units.get(existing).checksum().equals(unit.checksum())
                    ? AddResult.IDENTICAL
                    : AddResult.CONFLICT;
        }
        index.put(unit.id(), units.size());
        units.add(unit);
        return AddResult.ADDED;
    }

    /** Drops the given units; later units move up to keep the arena dense. */
    public synchronized void removeAll(Set<String> ids) {
        if (ids.isEmpty()) return;
        units.removeIf(u -> ids.contains(u.id()));
        index.clear();
        for (int i = 0; i < units.size(); i++) {
            index.put(units.get(i).id(), i);
        }
        ids.forEach(via::remove);
    }

    public synchronized boolean contains(String id) {
        return index.containsKey(id);
    }

    public synchronized Optional<Unit> get(String id) {
        Integer i = index.get(id);
        return i == null ? Optional.empty() : Optional.of(units.get(i));
    }

    public Optional<JobDefinition> job(String id) {
        return get(id).filter(JobDefinition.class::isInstance).map(JobDefinition.class::cast);
    }

    public Optional<TestPlanUnit> testPlan(String id) {
        return get(id).filter(TestPlanUnit.class::isInstance).map(TestPlanUnit.class::cast);
    }

    public synchronized List<Unit> units() {
        return List.copyOf(units);
    }

    public List<JobDefinition> jobs()       { return ofType(JobDefinition.class); }
    public List<TemplateUnit> templates()   { return ofType(TemplateUnit.class); }

    private synchronized <T extends Unit> List<T> ofType(Class<T> type) {
        List<T> out = new ArrayList<>();
        for (Unit u : units) {
            if (type.isInstance(u)) out.add(type.cast(u));
        }
        return out;
    }

    public synchronized int size() {
        return units.size();
    }

    // -------------------------------------------------------------------------
    // Generated units
    // -------------------------------------------------------------------------

    /** Records that {@code jobId} was emitted by the local job {@code generatorId}. */
    public synchronized void markVia(String jobId, String generatorId) {
        via.putIfAbsent(jobId, generatorId);
    }

    public synchronized Optional<String> viaOf(String jobId) {
        return Optional.ofNullable(via.get(jobId));
    }

    /** Ids emitted by {@code generatorId}, in the order they were first seen. */
    public synchronized List<String> generatedBy(String generatorId) {
        List<String> out = new ArrayList<>();
        via.forEach((job, gen) -> {
            if (gen.equals(generatorId)) out.add(job);
        });
        return out;
    }

    public synchronized Map<String, String> viaMap() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(via));
    }

    public synchronized UnitCatalog copy() {
        UnitCatalog c = new UnitCatalog();
        units.forEach(c::add);
        c.via.putAll(via);
        return c;
    }
}
