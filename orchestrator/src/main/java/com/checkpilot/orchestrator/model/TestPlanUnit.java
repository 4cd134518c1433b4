package com.checkpilot.orchestrator.model;

import java.util.Map;

/**
 * A named selection rule set over job ids and patterns.
 *
 * The selection fields hold one pattern per line and are interpreted by
 * the qualifier engine relative to this test plan's namespace.
 */
public final class TestPlanUnit implements Unit {

    private final UnitFields fields;
    private final String id;

    private TestPlanUnit(UnitFields fields, String id) {
        this.fields = fields;
        this.id     = id;
    }

    public static TestPlanUnit fromFields(String namespace, Map<String, String> raw) {
        UnitFields f = new UnitFields(namespace, raw);
        String partial = f.get("id")
                .orElseThrow(() -> new UnitValidationException(null, "id", "test plan has no id"));
        String id = Ids.qualify(namespace, partial);
        if (f.get("include").isEmpty() && f.get("mandatory_include").isEmpty()) {
            throw new UnitValidationException(id, "include", "test plan selects nothing");
        }
        return new TestPlanUnit(f, id);
    }

    @Override public String id()                  { return id; }
    @Override public String namespace()           { return fields.namespace(); }
    @Override public String unitType()            { return "test plan"; }
    @Override public Map<String, String> fields() { return fields.asMap(); }
    @Override public String checksum()            { return fields.checksum(); }

    public String getName()              { return fields.getOrDefault("name", partialId()); }
    public String getInclude()           { return fields.getOrDefault("include", ""); }
    public String getExclude()           { return fields.getOrDefault("exclude", ""); }
    public String getMandatoryInclude()  { return fields.getOrDefault("mandatory_include", ""); }
    public String getBootstrapInclude()  { return fields.getOrDefault("bootstrap_include", ""); }
    public String getCategoryOverrides() { return fields.getOrDefault("category-overrides", ""); }

    @Override
    public String toString() {
        return "TestPlanUnit[" + id + "]";
    }
}
