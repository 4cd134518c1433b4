package com.checkpilot.orchestrator.qualifier;

import com.checkpilot.orchestrator.catalog.UnitCatalog;
import com.checkpilot.orchestrator.model.JobDefinition;
import com.checkpilot.orchestrator.model.TestPlanUnit;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SelectionEngineTest {

    private static final String NS = "com.example";

    private static JobDefinition job(String id, String plugin) {
        return JobDefinition.fromFields(NS, Map.of("id", id, "plugin", plugin, "command", "true"));
    }

    private static JobDefinition job(String id, String plugin, String category) {
        return JobDefinition.fromFields(NS, Map.of("id", id, "plugin", plugin, "command", "true",
                "category_id", category));
    }

    private static List<JobDefinition> jobs() {
        return List.of(
                job("audio/playback", "shell", "audio"),
                job("audio/record", "shell", "audio"),
                job("audio", "shell"),
                job("disk/detect", "resource"),
                job("disk/read", "shell", "disk"),
                job("info/collect", "local"));
    }

    private static SelectionRules rules(String include, String exclude, String mandatory,
                                        String bootstrap, String overrides) {
        return new SelectionRules(NS + "::plan", NS, include, exclude, mandatory, bootstrap, overrides);
    }

    private static List<String> ids(String... partials) {
        List<String> out = new ArrayList<>();
        for (String p : partials) out.add(NS + "::" + p);
        return out;
    }

    // ------------------------------------------------------------------
    // include / exclude
    // ------------------------------------------------------------------

    @Test
    void select_includeThenExclude_excludeWins() {
        Selection s = SelectionEngine.select(rules("audio/.*\ndisk/.*", "audio/record", "", "", ""), jobs());
        assertThat(s.desired()).isEqualTo(ids("audio/playback", "disk/detect", "disk/read"));
        assertThat(s.problems()).isEmpty();
    }

    @Test
    void select_patternsAreAnchored() {
        Selection s = SelectionEngine.select(rules("audio", "", "", "", ""), jobs());
        assertThat(s.desired()).isEqualTo(ids("audio"));
    }

    @Test
    void select_exactMatchComesFirstWithinPattern() {
        // "a.b" also matches "a-b", which comes earlier in the catalogue
        List<JobDefinition> jobs = List.of(job("a-b", "shell"), job("a.b", "shell"));
        Selection s = SelectionEngine.select(rules("a.b", "", "", "", ""), jobs);
        assertThat(s.desired()).isEqualTo(ids("a.b", "a-b"));
    }

    @Test
    void select_otherMatchesFollowCatalogueOrder() {
        Selection s = SelectionEngine.select(rules("audio.*", "", "", "", ""), jobs());
        assertThat(s.desired()).isEqualTo(ids("audio/playback", "audio/record", "audio"));
    }

    @Test
    void select_patternOrderDecidesPosition_duplicatesDropped() {
        Selection s = SelectionEngine.select(rules("disk/read\naudio/playback\ndisk/.*", "", "", "", ""), jobs());
        assertThat(s.desired()).isEqualTo(ids("disk/read", "audio/playback", "disk/detect"));
    }

    @Test
    void select_commentsAndTrailingTokensIgnored() {
        Selection s = SelectionEngine.select(
                rules("# audio first\naudio/playback   extra words\n\n", "", "", "", ""), jobs());
        assertThat(s.desired()).isEqualTo(ids("audio/playback"));
    }

    @Test
    void select_invalidPattern_reportedAndSkipped() {
        Selection s = SelectionEngine.select(rules("audio/(\ndisk/read", "", "", "", ""), jobs());
        assertThat(s.desired()).isEqualTo(ids("disk/read"));
        assertThat(s.problems()).singleElement()
                .satisfies(p -> assertThat(p.origin()).isEqualTo("include"));
    }

    @Test
    void select_patternMatchingNothing_isNotAProblem() {
        Selection s = SelectionEngine.select(rules("generated/.*", "", "", "", ""), jobs());
        assertThat(s.desired()).isEmpty();
        assertThat(s.problems()).isEmpty();
    }

    @Test
    void parsePatterns_plainIdBecomesIdQualifier_regexStaysRegex() {
        List<JobQualifier> qualifiers = SelectionEngine.parsePatterns("audio\naudio/.*", NS, "plan", "include",
                new ArrayList<>());

        assertThat(qualifiers.get(0)).isEqualTo(new IdQualifier(NS + "::audio"));
        assertThat(qualifiers.get(1)).isInstanceOf(RegExpQualifier.class);
        assertThat(qualifiers.get(0).designates(NS + "::audio")).isTrue();
        assertThat(qualifiers.get(0).designates(NS + "::audio/record")).isFalse();
    }

    @Test
    void select_plainIdInclude_selectsOnlyThatJob() {
        Selection s = SelectionEngine.select(rules("audio\ninfo/collect", "", "", "", ""), jobs());
        assertThat(s.desired()).isEqualTo(ids("audio", "info/collect"));
    }

    // ------------------------------------------------------------------
    // mandatory / bootstrap / category overrides
    // ------------------------------------------------------------------

    @Test
    void select_mandatoryFirstAndNeverExcluded() {
        Selection s = SelectionEngine.select(
                rules("audio/.*", "info/.*\naudio/record", "info/collect", "", ""), jobs());
        assertThat(s.desired()).isEqualTo(ids("info/collect", "audio/playback"));
    }

    @Test
    void select_bootstrapAcceptsOnlyGeneratorJobs() {
        Selection s = SelectionEngine.select(
                rules("disk/read", "", "", "disk/detect\ninfo/collect\naudio", ""), jobs());
        assertThat(s.bootstrap()).isEqualTo(ids("disk/detect", "info/collect"));
        assertThat(s.problems()).singleElement()
                .satisfies(p -> assertThat(p.unitId()).isEqualTo(NS + "::audio"));
    }

    @Test
    void select_categoryOverrides_lastMatchWins() {
        Selection s = SelectionEngine.select(rules("audio/.*\ndisk/read", "", "", "",
                "apply misc to .*\napply speakers to audio/playback"), jobs());
        assertThat(s.categoryMap()).containsEntry(NS + "::audio/playback", NS + "::speakers")
                .containsEntry(NS + "::audio/record", NS + "::misc")
                .containsEntry(NS + "::disk/read", NS + "::misc");
    }

    @Test
    void select_noOverride_keepsJobCategory() {
        Selection s = SelectionEngine.select(rules("audio/.*\naudio", "", "", "", ""), jobs());
        assertThat(s.categoryMap()).containsEntry(NS + "::audio/record", NS + "::audio")
                .doesNotContainKey(NS + "::audio");
    }

    @Test
    void select_malformedOverride_reported() {
        Selection s = SelectionEngine.select(rules("audio", "", "", "", "move audio to misc"), jobs());
        assertThat(s.problems()).singleElement()
                .satisfies(p -> assertThat(p.origin()).isEqualTo("category-overrides"));
    }

    // ------------------------------------------------------------------
    // Selectors
    // ------------------------------------------------------------------

    private static UnitCatalog catalog() {
        UnitCatalog catalog = new UnitCatalog();
        jobs().forEach(catalog::add);
        return catalog;
    }

    @Test
    void testPlanSelector_usesPlanRules() {
        UnitCatalog catalog = catalog();
        Map<String, String> plan = new LinkedHashMap<>();
        plan.put("unit", "test plan");
        plan.put("id", "smoke");
        plan.put("include", "disk/.*");
        plan.put("exclude", "disk/detect");
        catalog.add(TestPlanUnit.fromFields(NS, plan));

        Selection s = new TestPlanSelector(NS + "::smoke").select(catalog);
        assertThat(s.desired()).isEqualTo(ids("disk/read"));
    }

    @Test
    void testPlanSelector_unknownPlan_throws() {
        assertThatThrownBy(() -> new TestPlanSelector(NS + "::nope").select(catalog()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void whiteList_behavesLikeInclude() {
        Selection s = WhiteList.fromText("wl", NS, "# sound\naudio/play.*\ndisk/read\n").select(catalog());
        assertThat(s.desired()).isEqualTo(ids("audio/playback", "disk/read"));
    }

    @Test
    void explicitSelector_appendsGeneratedJobs() {
        UnitCatalog catalog = catalog();
        catalog.add(job("gen/one", "shell"));
        catalog.add(job("gen/two", "shell"));
        catalog.markVia(NS + "::gen/one", NS + "::info/collect");
        catalog.markVia(NS + "::gen/two", NS + "::info/collect");

        Selection s = new ExplicitSelector(ids("info/collect", "disk/read")).select(catalog);
        assertThat(s.desired()).isEqualTo(ids("info/collect", "disk/read", "gen/one", "gen/two"));
    }
}
