package com.checkpilot.orchestrator.model;

/**
 * A unit that was excluded from the catalogue, and why.
 *
 * @param unitId id of the offending unit, null when it could not be determined
 * @param origin where the definition came from (file path, generating job, template id)
 */
public record UnitProblem(String unitId, String origin, String message) {

    @Override
    public String toString() {
        return origin + ": " + (unitId == null ? "" : unitId + ": ") + message;
    }
}
