package com.checkpilot.orchestrator.model;

import com.checkpilot.orchestrator.resource.ResourceProgram;
import com.checkpilot.orchestrator.resource.ResourceProgramException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A single unit of testing work.
 *
 * Built from a parsed field mapping by {@link #fromFields}; unqualified ids
 * in {@code depends}, {@code after} and {@code category_id} are qualified
 * with the job's own namespace there, so everything downstream only ever
 * sees {@code namespace::partial_id}.
 */
public final class JobDefinition implements Unit {

    public static final String FLAG_PRESERVE_LOCALE = "preserve-locale";
    public static final String FLAG_NORETURN        = "noreturn";
    public static final String FLAG_HAS_LEFTOVERS   = "has-leftovers";

    private final UnitFields fields;
    private final String id;
    private final Plugin plugin;
    private final String command;
    private final ResourceProgram requires;
    private final Set<String> depends;
    private final Set<String> after;
    private final Double estimatedDuration;
    private final String user;
    private final Set<String> environ;
    private final Set<String> flags;
    private final String categoryId;
    private final String summary;

    private JobDefinition(UnitFields fields, String id, Plugin plugin, String command,
                          ResourceProgram requires, Set<String> depends, Set<String> after,
                          Double estimatedDuration, String user, Set<String> environ,
                          Set<String> flags,
                          String categoryId, String summary) {
        this.fields            = fields;
        this.id                = id;
        this.plugin            = plugin;
        this.command           = command;
        this.requires          = requires;
        this.depends           = depends;
        this.after             = after;
        this.estimatedDuration = estimatedDuration;
        this.user              = user;
        this.environ           = environ;
        this.flags             = flags;
        this.categoryId        = categoryId;
        this.summary           = summary;
    }

    /**
     * Build a job from its field mapping.
     *
     * @throws UnitValidationException on a missing id or plugin, an unknown
     *         plugin, a malformed duration, a self-dependency, or a
     *         {@code requires} program that does not compile
     */
    public static JobDefinition fromFields(String namespace, Map<String, String> raw) {
        UnitFields f = new UnitFields(namespace, raw);
        String partial = f.get("id").or(() -> f.get("name"))
                .orElseThrow(() -> new UnitValidationException(null, "id", "job has no id"));
        String id = Ids.qualify(namespace, partial);

        String pluginName = f.get("plugin")
                .orElseThrow(() -> new UnitValidationException(id, "plugin", "field is mandatory"));
        Plugin plugin;
        try {
            plugin = Plugin.fromValue(pluginName);
        } catch (IllegalArgumentException e) {
            throw new UnitValidationException(id, "plugin", e.getMessage());
        }

        Map<String, String> imports = Imports.parse(id, "imports", f.get("imports").orElse(null));

        ResourceProgram requires = null;
        Optional<String> requiresText = f.get("requires");
        if (requiresText.isPresent()) {
            try {
                requires = ResourceProgram.compile(requiresText.get(), namespace, imports);
            } catch (ResourceProgramException e) {
                throw new UnitValidationException(id, "requires", e.getMessage(), e);
            }
        }

        Set<String> depends = qualifiedIdSet(namespace, f.get("depends").orElse(""));
        Set<String> after   = qualifiedIdSet(namespace, f.get("after").orElse(""));
        if (depends.contains(id) || after.contains(id)) {
            throw new UnitValidationException(id, "depends", "job depends on itself");
        }

        Double duration = null;
        Optional<String> durationText = f.get("estimated_duration");
        if (durationText.isPresent()) {
            try {
                duration = Double.parseDouble(durationText.get());
            } catch (NumberFormatException e) {
                throw new UnitValidationException(id, "estimated_duration",
                        "not a number: '" + durationText.get() + "'");
            }
            if (duration < 0) {
                throw new UnitValidationException(id, "estimated_duration", "must not be negative");
            }
        }

        return new JobDefinition(
                f, id, plugin,
                f.get("command").orElse(null),
                requires, depends, after, duration,
                f.get("user").orElse(null),
                tokenSet(f.get("environ").orElse("")),
                tokenSet(f.get("flags").orElse("")),
                f.get("category_id").map(c -> Ids.qualify(namespace, c)).orElse(null),
                f.get("summary").orElse(null));
    }

    // ------------------------------------------------------------------
    // Unit
    // ------------------------------------------------------------------

    @Override public String id()                  { return id; }
    @Override public String namespace()           { return fields.namespace(); }
    @Override public String unitType()            { return "job"; }
    @Override public Map<String, String> fields() { return fields.asMap(); }
    @Override public String checksum()            { return fields.checksum(); }

    // ------------------------------------------------------------------
    // Job fields
    // ------------------------------------------------------------------

    public Plugin   getPlugin()            { return plugin; }
    public String   getCommand()           { return command; }
    public String   getUser()              { return user; }
    public String   getCategoryId()        { return categoryId; }
    public String   getSummary()           { return summary != null ? summary : partialId(); }
    public Double   getEstimatedDuration() { return estimatedDuration; }

    public Optional<ResourceProgram> getRequires() { return Optional.ofNullable(requires); }

    public Set<String> getDepends()          { return depends; }
    public Set<String> getAfter()            { return after; }
    public Set<String> getEnviron()          { return environ; }
    public Set<String> getFlags()            { return flags; }

    public boolean hasFlag(String flag) { return flags.contains(flag); }

    /** True when the job must be run as a different user. */
    public boolean isPrivileged() { return user != null; }

    /** Resource job ids referenced by {@code requires}. */
    public Set<String> getResourceDependencies() {
        return requires == null ? Set.of() : requires.requiredResources();
    }

    /** Every outgoing edge, in declaration order: depends, after, then resources. */
    public List<Dependency> getDependencies() {
        List<Dependency> deps = new ArrayList<>();
        depends.forEach(d -> deps.add(new Dependency(Dependency.Kind.DIRECT, d)));
        after.forEach(d -> deps.add(new Dependency(Dependency.Kind.ORDERING, d)));
        getResourceDependencies().forEach(d -> deps.add(new Dependency(Dependency.Kind.RESOURCE, d)));
        return deps;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof JobDefinition other
                && id.equals(other.id)
                && checksum().equals(other.checksum());
    }

    @Override
    public int hashCode() {
        return checksum().hashCode();
    }

    @Override
    public String toString() {
        return "JobDefinition[" + id + ", plugin=" + plugin.value() + "]";
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    static Set<String> tokenSet(String text) {
        Set<String> tokens = new LinkedHashSet<>();
        for (String token : text.split("[\\s,]+")) {
            if (!token.isEmpty()) tokens.add(token);
        }
        return Collections.unmodifiableSet(tokens);
    }

    private static Set<String> qualifiedIdSet(String namespace, String text) {
        Set<String> ids = new LinkedHashSet<>();
        for (String token : tokenSet(text)) {
            ids.add(Ids.qualify(namespace, token));
        }
        return Collections.unmodifiableSet(ids);
    }
}
