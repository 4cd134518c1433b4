package com.checkpilot.orchestrator.model;

/**
 * A unit definition is unusable: a missing or malformed field, a resource
 * expression that does not compile, a template that cannot be instantiated.
 *
 * Raised at load time, reported per unit; the offending unit is left out of
 * the catalogue while the rest of its provider loads normally.
 */
public class UnitValidationException extends RuntimeException {

    private final String unitId;
    private final String field;

    public UnitValidationException(String unitId, String field, String message) {
        super(describe(unitId, field, message));
        this.unitId = unitId;
        this.field  = field;
    }

    public UnitValidationException(String unitId, String field, String message, Throwable cause) {
        super(describe(unitId, field, message), cause);
        this.unitId = unitId;
        this.field  = field;
    }

    public String getUnitId() { return unitId; }
    public String getField()  { return field; }

    private static String describe(String unitId, String field, String message) {
        String who = unitId == null ? "<unnamed unit>" : unitId;
        return field == null
                ? who + ": " + message
                : who + " [" + field + "]: " + message;
    }
}
