package com.checkpilot.orchestrator.model;

import java.util.Map;

/**
 * Turns a parsed field mapping into the matching unit type, dispatching on
 * the {@code unit} field (default "job").
 */
public final class UnitFactory {

    private UnitFactory() {}

    /**
     * @param namespace namespace of the provider (or generating job) the record came from
     * @param fields    raw field mapping as produced by the record parser
     * @throws UnitValidationException if the record does not describe a valid unit
     */
    public static Unit create(String namespace, Map<String, String> fields) {
        String type = fields.getOrDefault("unit", "job").strip();
        return switch (type) {
            case "job"       -> JobDefinition.fromFields(namespace, fields);
            case "template"  -> TemplateUnit.fromFields(namespace, fields);
            case "test plan" -> TestPlanUnit.fromFields(namespace, fields);
            case "category"  -> CategoryUnit.fromFields(namespace, fields);
            default -> throw new UnitValidationException(
                    fields.get("id"), "unit", "unsupported unit type '" + type + "'");
        };
    }
}
