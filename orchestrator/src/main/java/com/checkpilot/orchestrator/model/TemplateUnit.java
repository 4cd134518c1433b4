package com.checkpilot.orchestrator.model;

import com.checkpilot.orchestrator.resource.ResourceProgram;
import com.checkpilot.orchestrator.resource.ResourceProgramException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A parametric unit: every non {@code template-*} field is a format pattern
 * over the attributes of one resource record. One concrete unit is
 * instantiated per record of {@code template-resource} that passes
 * {@code template-filter}.
 */
public final class TemplateUnit implements Unit {

    private final UnitFields fields;
    private final String id;
    private final String templateUnit;
    private final String templateResource;
    private final ResourceProgram templateFilter;
    private final Map<String, String> body;

    private TemplateUnit(UnitFields fields, String id, String templateUnit,
                         String templateResource, ResourceProgram templateFilter,
                         Map<String, String> body) {
        this.fields           = fields;
        this.id               = id;
        this.templateUnit     = templateUnit;
        this.templateResource = templateResource;
        this.templateFilter   = templateFilter;
        this.body             = body;
    }

    public static TemplateUnit fromFields(String namespace, Map<String, String> raw) {
        UnitFields f = new UnitFields(namespace, raw);
        String idPattern = f.get("id")
                .orElseThrow(() -> new UnitValidationException(null, "id", "template has no id"));
        String id = Ids.qualify(namespace, idPattern);

        Map<String, String> imports = Imports.parse(id, "template-imports",
                f.get("template-imports").orElse(null));
        String resourceName = f.get("template-resource")
                .orElseThrow(() -> new UnitValidationException(id, "template-resource", "field is mandatory"));
        String resourceId = imports.getOrDefault(resourceName, Ids.qualify(namespace, resourceName));

        ResourceProgram filter = null;
        Optional<String> filterText = f.get("template-filter");
        if (filterText.isPresent()) {
            try {
                filter = ResourceProgram.compile(filterText.get(), namespace, imports);
            } catch (ResourceProgramException e) {
                throw new UnitValidationException(id, "template-filter", e.getMessage(), e);
            }
        }

        Map<String, String> body = new LinkedHashMap<>();
        f.asMap().forEach((key, value) -> {
            if (!key.startsWith("template-") && !key.equals("unit")) {
                body.put(key, value);
            }
        });

        return new TemplateUnit(f, id, f.getOrDefault("template-unit", "job"),
                resourceId, filter, Collections.unmodifiableMap(body));
    }

    @Override public String id()                  { return id; }
    @Override public String namespace()           { return fields.namespace(); }
    @Override public String unitType()            { return "template"; }
    @Override public Map<String, String> fields() { return fields.asMap(); }
    @Override public String checksum()            { return fields.checksum(); }

    /** Unit type produced by instantiation, "job" unless overridden. */
    public String getTemplateUnit()     { return templateUnit; }

    /** Fully qualified id of the resource job supplying the records. */
    public String getTemplateResource() { return templateResource; }

    public Optional<ResourceProgram> getTemplateFilter() { return Optional.ofNullable(templateFilter); }

    /** Field patterns of the instantiated unit, {@code template-*} and {@code unit} removed. */
    public Map<String, String> getBody() { return body; }

    @Override
    public String toString() {
        return "TemplateUnit[" + id + " <~ " + templateResource + "]";
    }
}
