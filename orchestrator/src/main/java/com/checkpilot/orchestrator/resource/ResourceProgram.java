package com.checkpilot.orchestrator.resource;

import com.checkpilot.orchestrator.model.Ids;
import com.checkpilot.orchestrator.model.ResourceRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import static com.checkpilot.orchestrator.resource.ResourceProgramException.Kind.MULTIPLE_RESOURCES_REFERENCED;
import static com.checkpilot.orchestrator.resource.ResourceProgramException.Kind.NO_RESOURCES_REFERENCED;

/**
 * A compiled multi-line requirement ({@code requires} or
 * {@code template-filter}). Lines are independent expressions joined by an
 * implicit AND; blank lines are ignored.
 */
public final class ResourceProgram {

    /** An expression that does not hold; {@code pending} when its resource has not produced data yet. */
    public record Unmet(ResourceExpression expression, boolean pending) {}

    private final String text;
    private final List<ResourceExpression> expressions;

    private ResourceProgram(String text, List<ResourceExpression> expressions) {
        this.text        = text;
        this.expressions = Collections.unmodifiableList(expressions);
    }

    /**
     * @param namespace namespace used to qualify free names
     * @param imports   alias to fully qualified resource id
     * @throws ResourceProgramException if any line does not compile
     */
    public static ResourceProgram compile(String text, String namespace, Map<String, String> imports) {
        List<ResourceExpression> expressions = new ArrayList<>();
        for (String line : text.split("\n")) {
            String source = line.strip();
            if (source.isEmpty()) {
                continue;
            }
            expressions.add(compileLine(source, namespace, imports));
        }
        if (expressions.isEmpty()) {
            throw new ResourceProgramException(NO_RESOURCES_REFERENCED, text, "empty program");
        }
        return new ResourceProgram(text, expressions);
    }

    private static ResourceExpression compileLine(String source, String namespace, Map<String, String> imports) {
        Node root = ExpressionParser.parse(source);
        Set<String> names = new HashSet<>();
        root.collectNames(names);
        if (names.isEmpty()) {
            throw new ResourceProgramException(NO_RESOURCES_REFERENCED, source,
                    "expression does not reference any resource");
        }
        if (names.size() > 1) {
            throw new ResourceProgramException(MULTIPLE_RESOURCES_REFERENCED, source,
                    "expression references more than one resource " + new TreeSet<>(names));
        }
        String name = names.iterator().next();
        String resourceId = imports.containsKey(name) ? imports.get(name) : Ids.qualify(namespace, name);
        return new ResourceExpression(source, root, name, resourceId);
    }

    public String text() { return text; }

    public List<ResourceExpression> expressions() { return expressions; }

    /** Resource job ids read by this program, in line order. */
    public Set<String> requiredResources() {
        Set<String> ids = new LinkedHashSet<>();
        for (ResourceExpression e : expressions) {
            ids.add(e.resourceId());
        }
        return ids;
    }

    /**
     * Lines that do not hold against {@code resourceMap}. A resource absent
     * from the map is pending; a resource present but not matching failed.
     */
    public List<Unmet> unmet(Map<String, List<ResourceRecord>> resourceMap) {
        List<Unmet> out = new ArrayList<>();
        for (ResourceExpression e : expressions) {
            List<ResourceRecord> group = resourceMap.get(e.resourceId());
            if (group == null) {
                out.add(new Unmet(e, true));
            } else if (!e.evaluate(group)) {
                out.add(new Unmet(e, false));
            }
        }
        return out;
    }

    public boolean isSatisfied(Map<String, List<ResourceRecord>> resourceMap) {
        return unmet(resourceMap).isEmpty();
    }

    /** Every line against one record, without the {@code any()} wrapping. */
    public boolean matchesRecord(ResourceRecord record) {
        for (ResourceExpression e : expressions) {
            if (!e.matches(record)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return text;
    }
}
