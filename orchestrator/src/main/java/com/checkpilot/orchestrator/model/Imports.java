package com.checkpilot.orchestrator.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses {@code imports} statements that alias resource jobs from other
 * namespaces, one per line:
 *
 * <pre>
 *   from com.example.base import cpuinfo as cpu
 *   from com.example.base import package
 * </pre>
 *
 * The result maps the name usable inside a requirement expression to the
 * fully qualified resource job id.
 */
public final class Imports {

    private static final Pattern STATEMENT = Pattern.compile(
            "^from\\s+([\\w.-]+)\\s+import\\s+([\\w.-]+)(?:\\s+as\\s+(\\w+))?$");

    private Imports() {}

    public static Map<String, String> parse(String unitId, String field, String text) {
        if (text == null || text.isBlank()) {
            return Map.of();
        }
        Map<String, String> aliases = new LinkedHashMap<>();
        for (String line : text.split("\n")) {
            String stmt = line.strip();
            if (stmt.isEmpty() || stmt.startsWith("#")) continue;
            Matcher m = STATEMENT.matcher(stmt);
            if (!m.matches()) {
                throw new UnitValidationException(unitId, field, "malformed import statement: '" + stmt + "'");
            }
            String partial = m.group(2);
            String alias   = m.group(3) != null ? m.group(3) : partial;
            aliases.put(alias, m.group(1) + Ids.SEPARATOR + partial);
        }
        return Collections.unmodifiableMap(aliases);
    }
}
