package com.checkpilot.orchestrator.model;

import java.util.Map;

/**
 * Common capability of every loaded unit: job, template, test plan, category.
 *
 * Units are immutable once created. Two units with the same id are the same
 * definition only when their {@link #checksum()} matches; the checksum is
 * also what a resumed session compares to detect definition drift.
 */
public interface Unit {

    /** Fully qualified id, {@code namespace::partial_id}. */
    String id();

    String namespace();

    default String partialId() {
        return Ids.partialOf(id());
    }

    /** Value of the {@code unit} field: "job", "template", "test plan", "category". */
    String unitType();

    /** Normalized field values this unit was built from. */
    Map<String, String> fields();

    /** Hex SHA-256 over the normalized fields and namespace. */
    String checksum();
}
