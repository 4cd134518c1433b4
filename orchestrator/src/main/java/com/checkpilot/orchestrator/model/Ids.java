package com.checkpilot.orchestrator.model;

/**
 * Helpers for namespace-qualified unit identifiers ({@code namespace::partial_id}).
 */
public final class Ids {

    public static final String SEPARATOR = "::";

    private Ids() {}

    public static boolean isQualified(String id) {
        return id.contains(SEPARATOR);
    }

    /** Prefix {@code id} with {@code namespace} unless it already carries one. */
    public static String qualify(String namespace, String id) {
        if (isQualified(id) || namespace == null || namespace.isEmpty()) {
            return id;
        }
        return namespace + SEPARATOR + id;
    }

    public static String namespaceOf(String id) {
        int idx = id.indexOf(SEPARATOR);
        return idx < 0 ? "" : id.substring(0, idx);
    }

    public static String partialOf(String id) {
        int idx = id.indexOf(SEPARATOR);
        return idx < 0 ? id : id.substring(idx + SEPARATOR.length());
    }
}
