package com.checkpilot.orchestrator.qualifier;

import com.checkpilot.orchestrator.model.Ids;
import com.checkpilot.orchestrator.model.JobDefinition;
import com.checkpilot.orchestrator.model.Plugin;
import com.checkpilot.orchestrator.model.UnitProblem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Turns selection rules into the desired job list.
 *
 * <ol>
 *   <li>{@code include} patterns in written order; within one pattern the
 *       job whose id equals the pattern comes first, then the other matches
 *       in catalogue order. A job keeps the position of the first pattern
 *       that selected it.</li>
 *   <li>Jobs matched by any {@code exclude} pattern are dropped.</li>
 *   <li>{@code mandatory_include} jobs are put in front and are never
 *       excluded.</li>
 *   <li>{@code category-overrides} statements are applied in order, the
 *       last matching one wins.</li>
 * </ol>
 *
 * A pattern matching nothing is not a problem: the job may be generated later.
 */
public final class SelectionEngine {

    private static final Logger log = LoggerFactory.getLogger(SelectionEngine.class);

    private static final Pattern OVERRIDE = Pattern.compile("^apply\\s+(\\S+)\\s+to\\s+(\\S+)$");
    private static final Pattern REGEX_META = Pattern.compile("[.*+?^$|()\\[\\]{}\\\\]");

    private record CategoryOverride(String categoryId, JobQualifier qualifier) {}

    private SelectionEngine() {}

    public static Selection select(SelectionRules rules, List<JobDefinition> jobs) {
        List<UnitProblem> problems = new ArrayList<>();
        List<JobQualifier> include   = parsePatterns(rules.include(), rules, "include", problems);
        List<JobQualifier> exclude   = parsePatterns(rules.exclude(), rules, "exclude", problems);
        List<JobQualifier> mandatory = parsePatterns(rules.mandatoryInclude(), rules, "mandatory_include", problems);
        List<JobQualifier> bootstrap = parsePatterns(rules.bootstrapInclude(), rules, "bootstrap_include", problems);

        Set<String> mandatoryIds = matchAll(mandatory, jobs);

        CompositeQualifier filter = new CompositeQualifier(include, exclude);
        Set<String> desired = new LinkedHashSet<>(mandatoryIds);
        for (String id : matchAll(include, jobs)) {
            if (filter.designates(id)) {
                desired.add(id);
            }
        }

        List<String> bootstrapIds = new ArrayList<>();
        Map<String, JobDefinition> byId = new LinkedHashMap<>();
        jobs.forEach(j -> byId.put(j.id(), j));
        for (String id : matchAll(bootstrap, jobs)) {
            Plugin plugin = byId.get(id).getPlugin();
            if (plugin == Plugin.LOCAL || plugin == Plugin.RESOURCE) {
                bootstrapIds.add(id);
            } else {
                problems.add(new UnitProblem(id, rules.ownerId(),
                        "bootstrap_include may only select local or resource jobs, not " + plugin.value()));
            }
        }

        List<CategoryOverride> overrides = parseOverrides(rules, problems);
        Map<String, String> categoryMap = new LinkedHashMap<>();
        Set<String> selected = new LinkedHashSet<>(bootstrapIds);
        selected.addAll(desired);
        for (String id : selected) {
            String category = byId.get(id).getCategoryId();
            for (CategoryOverride o : overrides) {
                if (o.qualifier().designates(id)) {
                    category = o.categoryId();
                }
            }
            if (category != null) {
                categoryMap.put(id, category);
            }
        }

        problems.forEach(p -> log.warn("Selection problem: {}", p));
        return new Selection(new ArrayList<>(desired), bootstrapIds, categoryMap, problems);
    }

    /** Every job designated by the qualifiers, ordered as described on the class. */
    static Set<String> matchAll(List<JobQualifier> qualifiers, List<JobDefinition> jobs) {
        Set<String> out = new LinkedHashSet<>();
        for (JobQualifier q : qualifiers) {
            String literal = q instanceof RegExpQualifier r ? r.pattern() : q.origin();
            for (JobDefinition job : jobs) {
                if (job.id().equals(literal)) {
                    out.add(job.id());
                }
            }
            for (JobDefinition job : jobs) {
                if (q.designates(job.id())) {
                    out.add(job.id());
                }
            }
        }
        return out;
    }

    /**
     * One regular expression per line: {@code #} starts a comment, only the
     * first whitespace separated token counts, unqualified patterns get the
     * rules' namespace. Invalid expressions are reported and skipped. An
     * unqualified pattern without metacharacters names a single job of the
     * rules' namespace and becomes an {@link IdQualifier}.
     */
    public static List<JobQualifier> parsePatterns(String text, String namespace, String ownerId,
                                                   String field, List<UnitProblem> problems) {
        List<JobQualifier> out = new ArrayList<>();
        if (text == null) {
            return out;
        }
        for (String line : text.split("\n")) {
            int hash = line.indexOf('#');
            String stripped = (hash >= 0 ? line.substring(0, hash) : line).strip();
            if (stripped.isEmpty()) {
                continue;
            }
            String token = stripped.split("\\s+")[0];
            String pattern = Ids.qualify(namespace, token);
            if (!Ids.isQualified(token) && !REGEX_META.matcher(token).find()) {
                out.add(new IdQualifier(pattern));
                continue;
            }
            try {
                out.add(new RegExpQualifier(pattern));
            } catch (PatternSyntaxException e) {
                problems.add(new UnitProblem(ownerId, field,
                        "invalid pattern '" + pattern + "': " + e.getDescription()));
            }
        }
        return out;
    }

    private static List<JobQualifier> parsePatterns(String text, SelectionRules rules, String field,
                                                    List<UnitProblem> problems) {
        return parsePatterns(text, rules.namespace(), rules.ownerId(), field, problems);
    }

    private static List<CategoryOverride> parseOverrides(SelectionRules rules, List<UnitProblem> problems) {
        List<CategoryOverride> out = new ArrayList<>();
        if (rules.categoryOverrides() == null) {
            return out;
        }
        for (String line : rules.categoryOverrides().split("\n")) {
            String stripped = line.strip();
            if (stripped.isEmpty() || stripped.startsWith("#")) {
                continue;
            }
            Matcher m = OVERRIDE.matcher(stripped);
            if (!m.matches()) {
                problems.add(new UnitProblem(rules.ownerId(), "category-overrides",
                        "expected 'apply <category> to <pattern>', got '" + stripped + "'"));
                continue;
            }
            String category = Ids.qualify(rules.namespace(), m.group(1));
            String pattern  = Ids.qualify(rules.namespace(), m.group(2));
            try {
                out.add(new CategoryOverride(category, new RegExpQualifier(pattern)));
            } catch (PatternSyntaxException e) {
                problems.add(new UnitProblem(rules.ownerId(), "category-overrides",
                        "invalid pattern '" + pattern + "': " + e.getDescription()));
            }
        }
        return out;
    }
}
