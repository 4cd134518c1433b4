package com.checkpilot.orchestrator.model;

import java.util.Map;

/** Presentation grouping for jobs; has no effect on scheduling. */
public final class CategoryUnit implements Unit {

    private final UnitFields fields;
    private final String id;

    private CategoryUnit(UnitFields fields, String id) {
        this.fields = fields;
        this.id     = id;
    }

    public static CategoryUnit fromFields(String namespace, Map<String, String> raw) {
        UnitFields f = new UnitFields(namespace, raw);
        String partial = f.get("id")
                .orElseThrow(() -> new UnitValidationException(null, "id", "category has no id"));
        return new CategoryUnit(f, Ids.qualify(namespace, partial));
    }

    @Override public String id()                  { return id; }
    @Override public String namespace()           { return fields.namespace(); }
    @Override public String unitType()            { return "category"; }
    @Override public Map<String, String> fields() { return fields.asMap(); }
    @Override public String checksum()            { return fields.checksum(); }

    public String getName() { return fields.getOrDefault("name", partialId()); }
}
