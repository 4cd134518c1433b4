package com.checkpilot.orchestrator.model;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobDefinitionTest {

    private static final String NS = "com.example";

    // ------------------------------------------------------------------
    // Parsing
    // ------------------------------------------------------------------

    @Test
    void fromFields_qualifiesIdAndDependencies() {
        JobDefinition job = JobDefinition.fromFields(NS, Map.of(
                "id", "disk/read",
                "plugin", "shell",
                "command", "true",
                "depends", "disk/detect other.ns::setup",
                "after", "warmup",
                "requires", "device.category == 'DISK'"));

        assertThat(job.id()).isEqualTo("com.example::disk/read");
        assertThat(job.getDepends()).containsExactly("com.example::disk/detect", "other.ns::setup");
        assertThat(job.getAfter()).containsExactly("com.example::warmup");
        assertThat(job.getResourceDependencies()).containsExactly("com.example::device");
        assertThat(job.getDependencies()).extracting(Dependency::kind).containsExactly(
                Dependency.Kind.DIRECT, Dependency.Kind.DIRECT,
                Dependency.Kind.ORDERING, Dependency.Kind.RESOURCE);
    }

    @Test
    void fromFields_translatableFieldPrefix_isStripped() {
        JobDefinition job = JobDefinition.fromFields(NS, Map.of(
                "id", "j", "plugin", "manual", "_summary", "Check the screen"));
        assertThat(job.getSummary()).isEqualTo("Check the screen");
    }

    @Test
    void fromFields_missingPlugin_rejected() {
        assertThatThrownBy(() -> JobDefinition.fromFields(NS, Map.of("id", "j")))
                .isInstanceOf(UnitValidationException.class)
                .extracting(e -> ((UnitValidationException) e).getField())
                .isEqualTo("plugin");
    }

    @Test
    void fromFields_unknownPlugin_rejected() {
        assertThatThrownBy(() -> JobDefinition.fromFields(NS, Map.of("id", "j", "plugin", "telepathy")))
                .isInstanceOf(UnitValidationException.class);
    }

    @Test
    void fromFields_badRequires_rejectedWithField() {
        assertThatThrownBy(() -> JobDefinition.fromFields(NS, Map.of(
                "id", "j", "plugin", "shell", "requires", "package.name is None")))
                .isInstanceOf(UnitValidationException.class)
                .extracting(e -> ((UnitValidationException) e).getField())
                .isEqualTo("requires");
    }

    @Test
    void fromFields_selfDependency_rejected() {
        assertThatThrownBy(() -> JobDefinition.fromFields(NS, Map.of(
                "id", "j", "plugin", "shell", "depends", "j")))
                .isInstanceOf(UnitValidationException.class);
    }

    @Test
    void fromFields_negativeDuration_rejected() {
        assertThatThrownBy(() -> JobDefinition.fromFields(NS, Map.of(
                "id", "j", "plugin", "shell", "estimated_duration", "-1")))
                .isInstanceOf(UnitValidationException.class);
    }

    // ------------------------------------------------------------------
    // Identity
    // ------------------------------------------------------------------

    @Test
    void checksum_ignoresFieldOrderAndSurroundingWhitespace() {
        JobDefinition a = JobDefinition.fromFields(NS, Map.of("id", "j", "plugin", "shell", "command", "echo hi"));
        JobDefinition b = JobDefinition.fromFields(NS, Map.of("command", "  echo hi\n", "plugin", "shell", "id", "j"));
        assertThat(a.checksum()).isEqualTo(b.checksum());
        assertThat(a).isEqualTo(b);
    }

    @Test
    void checksum_differsWhenFieldChanges() {
        JobDefinition a = JobDefinition.fromFields(NS, Map.of("id", "j", "plugin", "shell", "command", "echo hi"));
        JobDefinition b = JobDefinition.fromFields(NS, Map.of("id", "j", "plugin", "shell", "command", "echo bye"));
        assertThat(a.checksum()).isNotEqualTo(b.checksum());
        assertThat(a).isNotEqualTo(b);
    }

    @Test
    void unitFactory_dispatchesOnUnitField() {
        assertThat(UnitFactory.create(NS, Map.of("unit", "category", "id", "audio")))
                .isInstanceOf(CategoryUnit.class);
        assertThat(UnitFactory.create(NS, Map.of("unit", "test plan", "id", "tp", "include", ".*")))
                .isInstanceOf(TestPlanUnit.class);
        assertThatThrownBy(() -> UnitFactory.create(NS, Map.of("unit", "exporter", "id", "x")))
                .isInstanceOf(UnitValidationException.class);
    }
}
