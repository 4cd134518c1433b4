package com.checkpilot.orchestrator.qualifier;

import com.checkpilot.orchestrator.catalog.UnitCatalog;

/**
 * Legacy selection: one pattern per line, {@code #} comments, each pattern
 * anchored at both ends. Same matching as a test plan's {@code include}.
 */
public record WhiteList(String name, String namespace, String text) implements JobSelector {

    public static WhiteList fromText(String name, String namespace, String text) {
        return new WhiteList(name, namespace, text);
    }

    @Override
    public Selection select(UnitCatalog catalog) {
        SelectionRules rules = new SelectionRules(name, namespace, text, "", "", "", "");
        return SelectionEngine.select(rules, catalog.jobs());
    }
}
