package com.checkpilot.orchestrator.session;

import com.checkpilot.orchestrator.catalog.ProviderRegistry;
import com.checkpilot.orchestrator.catalog.UnitCatalog;
import com.checkpilot.orchestrator.executor.ExecutionController;
import com.checkpilot.orchestrator.executor.ExecutorException;
import com.checkpilot.orchestrator.executor.JobExecution;
import com.checkpilot.orchestrator.model.IoLogRecord;
import com.checkpilot.orchestrator.model.JobDefinition;
import com.checkpilot.orchestrator.model.JobState;
import com.checkpilot.orchestrator.model.Outcome;
import com.checkpilot.orchestrator.model.SessionMetadata;
import com.checkpilot.orchestrator.model.SessionState;
import com.checkpilot.orchestrator.model.UnitFactory;
import com.checkpilot.orchestrator.qualifier.TestPlanSelector;
import com.checkpilot.orchestrator.repository.FileSessionRepository;
import com.checkpilot.orchestrator.resolver.ResolutionDivergedException;
import com.checkpilot.orchestrator.resolver.RunListResolver;
import com.checkpilot.orchestrator.template.TemplateExpander;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * SessionService over a real resolver and a file repository in a temp
 * directory; only process execution is mocked. Each job's output is
 * scripted per job id, unscripted jobs pass with no output.
 */
@ExtendWith(MockitoExtension.class)
class SessionServiceTest {

    private static final String NS = "ns";

    @Mock ExecutionController controller;

    @TempDir
    Path storage;

    SimpleMeterRegistry meterRegistry;
    FileSessionRepository repository;
    UnitCatalog catalog;

    private final Map<String, JobExecution> scripted = new HashMap<>();
    private final Map<String, Consumer<String>> sideEffects = new HashMap<>();

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        repository = new FileSessionRepository(storage.toString(), new ObjectMapper());
        catalog = new UnitCatalog();
        lenient().when(controller.execute(any(), any())).thenAnswer(inv -> {
            JobDefinition job = inv.getArgument(0);
            Consumer<String> effect = sideEffects.get(job.id());
            if (effect != null) {
                effect.accept(job.id());
            }
            return scripted.getOrDefault(job.id(), passed(""));
        });
    }

    private SessionService service() {
        return new SessionService(ProviderRegistry.of(catalog),
                new RunListResolver(new TemplateExpander(), meterRegistry, 16),
                controller, repository, meterRegistry);
    }

    private void unit(String... kv) {
        Map<String, String> fields = new LinkedHashMap<>();
        for (int i = 0; i < kv.length; i += 2) {
            fields.put(kv[i], kv[i + 1]);
        }
        catalog.add(UnitFactory.create(NS, fields));
    }

    private void plan(String include, String bootstrap) {
        unit("unit", "test plan", "id", "plan", "include", include, "bootstrap_include", bootstrap);
    }

    private static JobExecution passed(String stdout) {
        return exited(0, Outcome.PASS, stdout);
    }

    private static JobExecution exited(int code, Outcome outcome, String stdout) {
        List<IoLogRecord> ioLog = stdout.isEmpty()
                ? List.of()
                : List.of(new IoLogRecord(0.0, IoLogRecord.STDOUT, stdout.getBytes(StandardCharsets.UTF_8)));
        return new JobExecution(outcome, code, ioLog, null, 0.1);
    }

    private static Map<String, Outcome> outcomes(Session session) {
        Map<String, Outcome> out = new LinkedHashMap<>();
        session.getJobStateMap().forEach((id, js) -> out.put(id, js.getOutcome()));
        return out;
    }

    // ------------------------------------------------------------------
    // Basic run loop
    // ------------------------------------------------------------------

    @Test
    void run_simplePlan_allJobsPassAndSessionCompletes() {
        unit("id", "a", "plugin", "shell", "command", "true");
        unit("id", "b", "plugin", "shell", "command", "true", "depends", "a");
        plan("b", "");
        SessionService service = service();

        Session session = service.create(new TestPlanSelector("ns::plan"), "app", "simple");
        RunOutcome outcome = service.run(session);

        assertThat(outcome).isEqualTo(RunOutcome.COMPLETED);
        assertThat(session.getRunListIds()).containsExactly("ns::a", "ns::b");
        assertThat(outcomes(session)).containsEntry("ns::a", Outcome.PASS).containsEntry("ns::b", Outcome.PASS);
        assertThat(session.getState()).isEqualTo(SessionState.COMPLETE);
        assertThat(session.getMetadata().hasFlag(SessionMetadata.FLAG_INCOMPLETE)).isFalse();
        assertThat(meterRegistry.counter("checkpilot.job.outcomes", "outcome", "pass", "plugin", "shell").count())
                .isEqualTo(2.0);
    }

    @Test
    void run_failedDependency_dependentSkippedWithReason() {
        unit("id", "a", "plugin", "shell", "command", "false");
        unit("id", "b", "plugin", "shell", "command", "true", "depends", "a");
        plan("b", "");
        scripted.put("ns::a", exited(1, Outcome.FAIL, ""));
        SessionService service = service();

        Session session = service.create(new TestPlanSelector("ns::plan"), "app", "skip");
        service.run(session);

        JobState b = session.jobState("ns::b").orElseThrow();
        assertThat(b.getOutcome()).isEqualTo(Outcome.SKIP);
        assertThat(b.getResult().comment()).contains("ns::a").contains("failed");
        verify(controller, never()).execute(argThat(j -> j.id().equals("ns::b")), any());
    }

    @Test
    void run_resourceRequirementFalse_notSupported() {
        unit("id", "device", "plugin", "resource", "command", "lsdev");
        unit("id", "disk", "plugin", "shell", "command", "true", "requires", "device.category == 'DISK'");
        plan("disk", "");
        scripted.put("ns::device", passed("category: NETWORK\n"));
        SessionService service = service();

        Session session = service.create(new TestPlanSelector("ns::plan"), "app", "resources");
        service.run(session);

        assertThat(session.getRunListIds()).containsExactly("ns::device", "ns::disk");
        assertThat(session.outcomeOf("ns::disk")).isEqualTo(Outcome.NOT_SUPPORTED);
        assertThat(session.getResourceMap().get("ns::device")).hasSize(1);
        assertThat(session.getPassCount()).isEqualTo(1);
    }

    @Test
    void run_ioLogStoredAndReferenced() {
        unit("id", "a", "plugin", "shell", "command", "echo hi");
        plan("a", "");
        scripted.put("ns::a", passed("hi\n"));
        SessionService service = service();

        Session session = service.create(new TestPlanSelector("ns::plan"), "app", "log");
        service.run(session);

        String ref = session.jobState("ns::a").orElseThrow().getResult().ioLogRef();
        assertThat(ref).isNotNull();
        assertThat(repository.readIoLog(session.getId(), ref)).singleElement()
                .satisfies(r -> assertThat(r.text()).isEqualTo("hi\n"));
    }

    // ------------------------------------------------------------------
    // Generators: resource + template, local jobs
    // ------------------------------------------------------------------

    @Test
    void run_resourceFeedsTemplate_instancesRunAfterSecondPass() {
        unit("id", "pkg", "plugin", "resource", "command", "list");
        unit("unit", "template", "template-resource", "pkg",
                "id", "t-{name}", "plugin", "shell", "command", "check {name}");
        plan("t-.*", "pkg");
        scripted.put("ns::pkg", passed("name: x\n\nname: y\n"));
        SessionService service = service();

        Session session = service.create(new TestPlanSelector("ns::plan"), "app", "templates");
        service.run(session);

        assertThat(session.getRunListIds()).containsExactly("ns::pkg", "ns::t-x", "ns::t-y");
        assertThat(outcomes(session)).containsEntry("ns::t-x", Outcome.PASS).containsEntry("ns::t-y", Outcome.PASS);
        assertThat(session.getPassCount()).isEqualTo(2);
        assertThat(session.getGeneratedUnits()).extracting(g -> g.unit().id())
                .containsExactly("ns::t-x", "ns::t-y");
    }

    @Test
    void run_localJobGeneratesJob_exactlyOneExtraPassAndViaRecorded() {
        unit("id", "gen", "plugin", "local", "command", "emit");
        plan("gen\ngenerated-.*", "");
        scripted.put("ns::gen", passed("id: generated-1\nplugin: shell\ncommand: true\n"));
        SessionService service = service();

        Session session = service.create(new TestPlanSelector("ns::plan"), "app", "local");
        service.run(session);

        assertThat(session.getPassCount()).isEqualTo(2);
        assertThat(session.getRunListIds()).containsExactly("ns::gen", "ns::generated-1");
        assertThat(session.outcomeOf("ns::generated-1")).isEqualTo(Outcome.PASS);
        assertThat(session.jobState("ns::generated-1").orElseThrow().getVia()).isEqualTo("ns::gen");
        assertThat(session.getCatalog().viaOf("ns::generated-1")).contains("ns::gen");
    }

    @Test
    void run_localJobOutputDoesNotLeakIntoProviderCatalogue() {
        unit("id", "gen", "plugin", "local", "command", "emit");
        plan("gen\ngenerated-.*", "");
        scripted.put("ns::gen", passed("id: generated-1\nplugin: shell\ncommand: true\n"));
        SessionService service = service();

        service.run(service.create(new TestPlanSelector("ns::plan"), "app", "local"));

        assertThat(catalog.contains("ns::generated-1")).isFalse();
    }

    @Test
    void run_privilegedJobInRunList_generatedPrivilegedJobsDiscarded() {
        unit("id", "gen", "plugin", "local", "command", "emit");
        unit("id", "priv", "plugin", "shell", "command", "true", "user", "root");
        plan("gen\npriv\ngenerated-.*", "");
        scripted.put("ns::gen", passed("""
                id: generated-root
                plugin: shell
                user: root
                command: true

                id: generated-plain
                plugin: shell
                command: true
                """));
        SessionService service = service();

        Session session = service.create(new TestPlanSelector("ns::plan"), "app", "priv");
        service.run(session);

        assertThat(session.getCatalog().contains("ns::generated-plain")).isTrue();
        assertThat(session.getCatalog().contains("ns::generated-root")).isFalse();
    }

    @Test
    void run_localJobEmitsConflictingDefinition_discarded() {
        unit("id", "gen", "plugin", "local", "command", "emit");
        unit("id", "a", "plugin", "shell", "command", "original");
        plan("gen\na", "");
        scripted.put("ns::gen", passed("id: a\nplugin: shell\ncommand: replaced\n"));
        SessionService service = service();

        Session session = service.create(new TestPlanSelector("ns::plan"), "app", "conflict");
        service.run(session);

        assertThat(session.getCatalog().job("ns::a").orElseThrow().getCommand()).isEqualTo("original");
        assertThat(session.getPassCount()).isEqualTo(1);
    }

    @Test
    void run_moreIndependentGeneratorsThanPassCeiling_sessionCompletes() {
        for (int i = 1; i <= 20; i++) {
            unit("id", "gen-" + i, "plugin", "local", "command", "emit " + i);
            scripted.put("ns::gen-" + i, passed("id: made-" + i + "\nplugin: shell\ncommand: true\n"));
        }
        plan("gen-.*\nmade-.*", "");
        SessionService service = service();

        Session session = service.create(new TestPlanSelector("ns::plan"), "app", "many generators");

        assertThat(service.run(session)).isEqualTo(RunOutcome.COMPLETED);
        assertThat(session.getRunList()).hasSize(40);
        assertThat(session.outcomeOf("ns::made-20")).isEqualTo(Outcome.PASS);
        assertThat(session.getPassCount()).isEqualTo(21);
    }

    @Test
    void run_generatorsKeepProducingGenerators_divergesAtCeiling() {
        for (int i = 0; i < 20; i++) {
            scripted.put("ns::chain-" + i, passed("id: chain-" + (i + 1) + "\nplugin: local\ncommand: emit\n"));
        }
        unit("id", "chain-0", "plugin", "local", "command", "emit");
        plan("chain-.*", "");
        SessionService service = service();

        Session session = service.create(new TestPlanSelector("ns::plan"), "app", "chain");

        assertThatThrownBy(() -> service.run(session)).isInstanceOf(ResolutionDivergedException.class);
        assertThat(session.getState()).isEqualTo(SessionState.RESOLVING);
        assertThat(session.outcomeOf("ns::chain-16")).isEqualTo(Outcome.PASS);
        assertThat(SessionService.generationDepth(session, "ns::chain-16")).isEqualTo(16);
    }

    @Test
    void run_resourceJobTimedOut_partialRecordsIgnored() {
        unit("id", "device", "plugin", "resource", "command", "lsdev");
        unit("id", "disk", "plugin", "shell", "command", "true", "requires", "device.category == 'DISK'");
        plan("disk", "");
        scripted.put("ns::device", new JobExecution(Outcome.FAIL, -9,
                List.of(new IoLogRecord(0.0, IoLogRecord.STDOUT, "category: DISK\n".getBytes(StandardCharsets.UTF_8))),
                "job timed out after 600 s", 600.0, true));
        SessionService service = service();

        Session session = service.create(new TestPlanSelector("ns::plan"), "app", "timeout");
        service.run(session);

        assertThat(session.getResourceMap()).doesNotContainKey("ns::device");
        assertThat(session.outcomeOf("ns::device")).isEqualTo(Outcome.FAIL);
        assertThat(session.outcomeOf("ns::disk")).isEqualTo(Outcome.NOT_SUPPORTED);
    }

    // ------------------------------------------------------------------
    // Checkpoint and resume
    // ------------------------------------------------------------------

    @Test
    void resume_afterCompletion_restoresEquivalentSession() {
        unit("id", "pkg", "plugin", "resource", "command", "list");
        unit("unit", "template", "template-resource", "pkg",
                "id", "t-{name}", "plugin", "shell", "command", "check {name}");
        unit("id", "gen", "plugin", "local", "command", "emit");
        plan("t-.*\ngen\ngenerated-.*", "pkg");
        scripted.put("ns::pkg", passed("name: x\n"));
        scripted.put("ns::gen", passed("id: generated-1\nplugin: shell\ncommand: true\n"));
        scripted.put("ns::t-x", exited(2, Outcome.FAIL, ""));
        SessionService service = service();
        Session original = service.create(new TestPlanSelector("ns::plan"), "app", "round trip");
        service.run(original);

        Session restored = service().resume(original.getId());

        assertThat(restored.getState()).isEqualTo(SessionState.COMPLETE);
        assertThat(restored.getRunListIds()).isEqualTo(original.getRunListIds());
        assertThat(restored.getDesiredJobList()).isEqualTo(original.getDesiredJobList());
        assertThat(restored.getBootstrapList()).isEqualTo(original.getBootstrapList());
        assertThat(outcomes(restored)).isEqualTo(outcomes(original));
        assertThat(restored.getResourceMap()).isEqualTo(original.getResourceMap());
        assertThat(restored.getPassCount()).isEqualTo(original.getPassCount());
        assertThat(restored.getCatalog().viaMap()).isEqualTo(original.getCatalog().viaMap());
        assertThat(restored.getGeneratedUnits()).extracting(g -> g.unit().id())
                .containsExactlyInAnyOrderElementsOf(
                        original.getGeneratedUnits().stream().map(g -> g.unit().id()).toList());
        assertThat(restored.getMetadata().getTitle()).isEqualTo("round trip");
        assertThat(restored.getMetadata().hasFlag(SessionMetadata.FLAG_INCOMPLETE)).isFalse();
    }

    @Test
    void resume_jobDefinitionChanged_rejected() {
        unit("id", "a", "plugin", "shell", "command", "true");
        unit("id", "b", "plugin", "shell", "command", "true");
        plan("a\nb", "");
        SessionService service = service();
        Session session = service.create(new TestPlanSelector("ns::plan"), "app", "changed");
        sideEffects.put("ns::a", id -> session.requestAbort());
        service.run(session);

        catalog = new UnitCatalog();
        unit("id", "a", "plugin", "shell", "command", "echo changed");
        unit("id", "b", "plugin", "shell", "command", "true");
        plan("a\nb", "");

        assertThatThrownBy(() -> service().resume(session.getId()))
                .isInstanceOf(SessionResumeException.class)
                .hasMessageContaining("ns::a");
    }

    @Test
    void resume_templateChangedWithInstancePending_rejected() {
        templateSessionAbortedAfterResource("old {name}");

        catalog = new UnitCatalog();
        templateCatalog("NEW {name}");

        String id = repository.list().get(0);
        assertThatThrownBy(() -> service().resume(id))
                .isInstanceOf(SessionResumeException.class)
                .hasMessageContaining("ns::t-x")
                .hasMessageContaining("modified");
    }

    @Test
    void resume_templateUnchanged_instanceRunsAfterResume() {
        templateSessionAbortedAfterResource("old {name}");
        sideEffects.clear();

        catalog = new UnitCatalog();
        templateCatalog("old {name}");
        SessionService restarted = service();
        Session resumed = restarted.resume(repository.list().get(0));

        assertThat(restarted.run(resumed)).isEqualTo(RunOutcome.COMPLETED);
        assertThat(resumed.getCatalog().job("ns::t-x").orElseThrow().getCommand()).isEqualTo("old x");
        assertThat(resumed.outcomeOf("ns::t-x")).isEqualTo(Outcome.PASS);
    }

    private void templateCatalog(String command) {
        unit("id", "pkg", "plugin", "resource", "command", "list");
        unit("unit", "template", "template-resource", "pkg",
                "id", "t-{name}", "plugin", "shell", "command", command);
        plan("t-.*", "pkg");
    }

    /** Runs pkg, which instantiates t-x, and aborts before t-x runs. */
    private void templateSessionAbortedAfterResource(String command) {
        templateCatalog(command);
        scripted.put("ns::pkg", passed("name: x\n"));
        SessionService service = service();
        Session session = service.create(new TestPlanSelector("ns::plan"), "app", "template drift");
        sideEffects.put("ns::pkg", id -> session.requestAbort());

        assertThat(service.run(session)).isEqualTo(RunOutcome.ABORTED);
        assertThat(session.outcomeOf("ns::t-x")).isEqualTo(Outcome.NONE);
    }

    @Test
    void resume_unknownSession_rejected() {
        assertThatThrownBy(() -> service().resume("missing"))
                .isInstanceOf(SessionResumeException.class);
    }

    @Test
    void abort_stopsAfterCurrentJob_resumeFinishesRemainingJobs() {
        unit("id", "a", "plugin", "shell", "command", "true");
        unit("id", "b", "plugin", "shell", "command", "true");
        plan("a\nb", "");
        SessionService service = service();
        Session session = service.create(new TestPlanSelector("ns::plan"), "app", "abort");
        sideEffects.put("ns::a", id -> session.requestAbort());

        assertThat(service.run(session)).isEqualTo(RunOutcome.ABORTED);
        assertThat(session.outcomeOf("ns::a")).isEqualTo(Outcome.PASS);
        assertThat(session.outcomeOf("ns::b")).isEqualTo(Outcome.NONE);
        assertThat(service.resumableSessions()).containsExactly(session.getId());

        sideEffects.clear();
        SessionService restarted = service();
        Session resumed = restarted.resume(session.getId());
        assertThat(restarted.run(resumed)).isEqualTo(RunOutcome.COMPLETED);

        assertThat(resumed.outcomeOf("ns::b")).isEqualTo(Outcome.PASS);
        verify(controller).execute(argThat(j -> j.id().equals("ns::a")), any());
        assertThat(restarted.resumableSessions()).isEmpty();
    }

    // ------------------------------------------------------------------
    // noreturn jobs and in-flight recovery
    // ------------------------------------------------------------------

    @Test
    void run_noreturnJob_dispatchedAndSessionAwaitsResume() {
        unit("id", "reboot", "plugin", "shell", "command", "reboot", "flags", "noreturn");
        unit("id", "after-reboot", "plugin", "shell", "command", "true", "after", "reboot");
        plan("after-reboot", "");
        SessionService service = service();
        Session session = service.create(new TestPlanSelector("ns::plan"), "app", "reboot");

        assertThat(service.run(session)).isEqualTo(RunOutcome.AWAITING_RESUME);
        verify(controller).dispatch(argThat(j -> j.id().equals("ns::reboot")), any());

        Session resumed = service().resume(session.getId());
        assertThat(resumed.inFlightJobId()).contains("ns::reboot");
    }

    @Test
    void run_inFlightJobAfterResume_mustBeSettledFirst() {
        unit("id", "reboot", "plugin", "shell", "command", "reboot", "flags", "noreturn");
        unit("id", "after-reboot", "plugin", "shell", "command", "true", "after", "reboot");
        plan("after-reboot", "");
        SessionService service = service();
        service.run(service.create(new TestPlanSelector("ns::plan"), "app", "reboot"));
        String id = service.listSessions().get(0);

        SessionService restarted = service();
        Session resumed = restarted.resume(id);
        assertThatThrownBy(() -> restarted.run(resumed)).isInstanceOf(IllegalStateException.class);

        restarted.recoverInFlight(resumed);

        assertThat(resumed.outcomeOf("ns::reboot")).isEqualTo(Outcome.PASS);
        assertThat(resumed.inFlightJobId()).isEmpty();
        assertThat(restarted.run(resumed)).isEqualTo(RunOutcome.COMPLETED);
        assertThat(resumed.outcomeOf("ns::after-reboot")).isEqualTo(Outcome.PASS);
    }

    @Test
    void recoverInFlight_ordinaryJobInterrupted_fails() {
        unit("id", "a", "plugin", "shell", "command", "true");
        plan("a", "");
        SessionService service = service();
        Session session = service.create(new TestPlanSelector("ns::plan"), "app", "crash");
        service.resolve(session);
        session.markRunning("ns::a");
        service.checkpoint(session);

        SessionService restarted = service();
        Session resumed = restarted.resume(session.getId());
        restarted.recoverInFlight(resumed);

        assertThat(resumed.outcomeOf("ns::a")).isEqualTo(Outcome.FAIL);
    }

    @Test
    void rerunInFlight_jobExecutedAgain() {
        unit("id", "a", "plugin", "shell", "command", "true");
        plan("a", "");
        SessionService service = service();
        Session session = service.create(new TestPlanSelector("ns::plan"), "app", "crash");
        service.resolve(session);
        session.markRunning("ns::a");
        service.checkpoint(session);

        SessionService restarted = service();
        Session resumed = restarted.resume(session.getId());
        restarted.rerunInFlight(resumed);
        restarted.run(resumed);

        assertThat(resumed.outcomeOf("ns::a")).isEqualTo(Outcome.PASS);
        verify(controller).execute(argThat(j -> j.id().equals("ns::a")), any());
    }

    @Test
    void run_dispatchFails_jobFailsAndRunContinues() {
        unit("id", "reboot", "plugin", "shell", "command", "reboot", "flags", "noreturn");
        unit("id", "b", "plugin", "shell", "command", "true");
        plan("reboot\nb", "");
        doThrow(new ExecutorException("sudo not available")).when(controller).dispatch(any(), any());
        SessionService service = service();
        Session session = service.create(new TestPlanSelector("ns::plan"), "app", "dispatch");

        assertThat(service.run(session)).isEqualTo(RunOutcome.COMPLETED);
        assertThat(session.outcomeOf("ns::reboot")).isEqualTo(Outcome.FAIL);
        assertThat(session.outcomeOf("ns::b")).isEqualTo(Outcome.PASS);
    }

    // ------------------------------------------------------------------
    // Operator actions
    // ------------------------------------------------------------------

    @Test
    void setJobResult_replacingPassWithoutRerun_rejected() {
        unit("id", "a", "plugin", "shell", "command", "true");
        plan("a", "");
        SessionService service = service();
        Session session = service.create(new TestPlanSelector("ns::plan"), "app", "results");
        service.resolve(session);
        service.setJobResult(session, "ns::a", Outcome.PASS, "checked by hand");

        assertThatThrownBy(() -> service.setJobResult(session, "ns::a", Outcome.FAIL, "changed my mind"))
                .isInstanceOf(IllegalStateException.class);
        service.setJobResult(session, "ns::a", Outcome.PASS, "checked by hand");
    }

    @Test
    void rerun_clearsResultSoJobRunsAgain() {
        unit("id", "a", "plugin", "shell", "command", "true");
        unit("id", "b", "plugin", "shell", "command", "true");
        plan("a\nb", "");
        SessionService service = service();
        Session session = service.create(new TestPlanSelector("ns::plan"), "app", "rerun");
        sideEffects.put("ns::a", id -> session.requestAbort());
        service.run(session);
        sideEffects.clear();

        service.rerun(session, "ns::a");
        assertThat(session.outcomeOf("ns::a")).isEqualTo(Outcome.NONE);
        service.run(session);

        verify(controller, times(2)).execute(argThat(j -> j.id().equals("ns::a")), any());
        assertThat(session.getState()).isEqualTo(SessionState.COMPLETE);
    }

    @Test
    void delete_removesStoredSession() {
        unit("id", "a", "plugin", "shell", "command", "true");
        plan("a", "");
        SessionService service = service();
        Session session = service.create(new TestPlanSelector("ns::plan"), "app", "gone");

        service.delete(session.getId());

        assertThat(service.listSessions()).isEmpty();
        assertThat(service.find(session.getId())).isEmpty();
    }
}
