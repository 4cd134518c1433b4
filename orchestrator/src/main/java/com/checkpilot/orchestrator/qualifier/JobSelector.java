package com.checkpilot.orchestrator.qualifier;

import com.checkpilot.orchestrator.catalog.UnitCatalog;

/**
 * Source of the desired job list. Re-applied on every resolution pass so
 * that generated jobs matching the rules join the selection.
 */
public interface JobSelector {

    Selection select(UnitCatalog catalog);
}
