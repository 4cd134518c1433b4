package com.checkpilot.orchestrator.session;

import com.checkpilot.orchestrator.catalog.ProviderRegistry;
import com.checkpilot.orchestrator.catalog.RecordParser;
import com.checkpilot.orchestrator.catalog.UnitCatalog;
import com.checkpilot.orchestrator.executor.ExecutionContext;
import com.checkpilot.orchestrator.executor.ExecutionController;
import com.checkpilot.orchestrator.executor.ExecutorException;
import com.checkpilot.orchestrator.executor.JobExecution;
import com.checkpilot.orchestrator.model.IoLogRecord;
import com.checkpilot.orchestrator.model.JobDefinition;
import com.checkpilot.orchestrator.model.JobReadinessInhibitor;
import com.checkpilot.orchestrator.model.JobResult;
import com.checkpilot.orchestrator.model.Outcome;
import com.checkpilot.orchestrator.model.Plugin;
import com.checkpilot.orchestrator.model.ResourceRecord;
import com.checkpilot.orchestrator.model.SessionMetadata;
import com.checkpilot.orchestrator.model.SessionState;
import com.checkpilot.orchestrator.model.Unit;
import com.checkpilot.orchestrator.model.UnitFactory;
import com.checkpilot.orchestrator.model.UnitValidationException;
import com.checkpilot.orchestrator.qualifier.JobSelector;
import com.checkpilot.orchestrator.repository.SessionDocument;
import com.checkpilot.orchestrator.repository.SessionRepository;
import com.checkpilot.orchestrator.resolver.ResolutionException;
import com.checkpilot.orchestrator.resolver.RunListResolver;
import com.checkpilot.orchestrator.resolver.RunListResolver.Resolution;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Drives sessions: selection, resolution passes, the job-by-job run loop,
 * checkpointing and resume.
 *
 * A session is checkpointed before and after every job and every
 * resolution pass, so a crash loses at most the job that was running.
 * A checkpoint failure aborts the run; job failures never do.
 */
@Service
public class SessionService {

    private static final Logger log = LoggerFactory.getLogger(SessionService.class);

    private final ProviderRegistry    registry;
    private final RunListResolver     resolver;
    private final ExecutionController controller;
    private final SessionRepository   repository;
    private final MeterRegistry       meterRegistry;

    private final Map<String, Session> live = new ConcurrentHashMap<>();

    public SessionService(ProviderRegistry registry,
                          RunListResolver resolver,
                          ExecutionController controller,
                          SessionRepository repository,
                          MeterRegistry meterRegistry) {
        this.registry      = registry;
        this.resolver      = resolver;
        this.controller    = controller;
        this.repository    = repository;
        this.meterRegistry = meterRegistry;
    }

    // ------------------------------------------------------------------
    // Creation and resolution
    // ------------------------------------------------------------------

    /** New session over a private copy of the provider catalogue. */
    public Session create(JobSelector selector, String appId, String title) {
        Session session = new Session(UUID.randomUUID().toString(), registry.catalog().copy(), selector);
        session.getMetadata().setAppId(appId);
        session.getMetadata().setTitle(title);
        live.put(session.getId(), session);
        checkpoint(session);
        log.info("Session {} created ({})", session.getId(), title);
        return session;
    }

    /**
     * Run one resolution pass and install its run list.
     *
     * @throws ResolutionException on a missing dependency or a cycle;
     *         the session is left resolving and nothing of the new run list is used
     */
    public Resolution resolve(Session session) {
        return resolve(session, 1);
    }

    /**
     * @param pass position of the pass in its generation chain, see {@link #generationDepth}
     * @throws ResolutionException on a missing dependency, a cycle or a chain past the ceiling
     */
    private Resolution resolve(Session session, int pass) {
        MDC.put("sessionId", session.getId());
        try {
            switch (session.getState()) {
                case NEW -> {
                    session.transitionTo(SessionState.SELECTING);
                    session.transitionTo(SessionState.RESOLVING);
                }
                case SELECTING, RUNNING -> session.transitionTo(SessionState.RESOLVING);
                case RESOLVING -> { }
                case COMPLETE -> throw new IllegalStateException("Session " + session.getId() + " is complete");
            }
            checkpoint(session);

            Resolution resolution = resolver.resolve(session.getCatalog(), session.getSelector(),
                    session.getResourceMap(), pass);
            session.applyResolution(resolution);
            session.transitionTo(SessionState.RUNNING);
            checkpoint(session);
            return resolution;
        } finally {
            MDC.remove("sessionId");
        }
    }

    // ------------------------------------------------------------------
    // Run loop
    // ------------------------------------------------------------------

    /**
     * Execute run-list entries in order until none is left, an abort is
     * requested or a {@code noreturn} job is dispatched.
     *
     * Inhibited entries are not run: a job with an unmet resource
     * requirement is recorded as not-supported, one with unmet job
     * dependencies as skipped.
     *
     * @throws IllegalStateException if a job is still in flight from before a resume
     * @throws ResolutionException   if a pass triggered by generated units fails
     */
    public RunOutcome run(Session session) {
        if (session.getState() != SessionState.RUNNING) {
            resolve(session);
        }
        session.inFlightJobId().ifPresent(jobId -> {
            throw new IllegalStateException("Job " + jobId + " of session " + session.getId()
                    + " was in flight; skip it, set its result or re-run it first");
        });
        session.clearAbort();

        while (true) {
            if (session.isAbortRequested()) {
                checkpoint(session);
                log.info("Session {} aborted on request", session.getId());
                return RunOutcome.ABORTED;
            }
            Optional<JobDefinition> next = session.nextPendingJob();
            if (next.isEmpty()) {
                break;
            }
            if (!runJob(session, next.get())) {
                return RunOutcome.AWAITING_RESUME;
            }
        }

        session.transitionTo(SessionState.COMPLETE);
        checkpoint(session);
        log.info("Session {} complete: {}", session.getId(), summary(session));
        return RunOutcome.COMPLETED;
    }

    /** @return false when the job was dispatched and the run must stop */
    private boolean runJob(Session session, JobDefinition job) {
        MDC.put("sessionId", session.getId());
        MDC.put("jobId", job.id());
        try {
            List<JobReadinessInhibitor> inhibitors = session.inhibitorsOf(job);
            if (!inhibitors.isEmpty()) {
                Outcome outcome = inhibitors.stream().anyMatch(JobReadinessInhibitor::isResourceCause)
                        ? Outcome.NOT_SUPPORTED
                        : Outcome.SKIP;
                String comment = inhibitors.stream().map(JobReadinessInhibitor::describe)
                        .collect(Collectors.joining("; "));
                log.info("Job {} not runnable ({}): {}", job.id(), outcome.value(), comment);
                record(session, job, JobResult.of(outcome, comment));
                checkpoint(session);
                return true;
            }

            ExecutionContext context = new ExecutionContext(session.getId(), repository.shareDir(session.getId()));
            session.markRunning(job.id());
            checkpoint(session);

            if (job.hasFlag(JobDefinition.FLAG_NORETURN)) {
                try {
                    controller.dispatch(job, context);
                    log.info("Job {} dispatched, session continues after resume", job.id());
                    return false;
                } catch (ExecutorException e) {
                    log.error("Job {} could not be dispatched: {}", job.id(), e.getMessage());
                    session.clearRunning();
                    record(session, job, JobResult.of(Outcome.FAIL, e.getMessage()));
                    checkpoint(session);
                    return true;
                }
            }

            log.info("Running job {} ({})", job.id(), job.getPlugin().value());
            JobExecution execution = controller.execute(job, context);
            String ioLogRef = execution.ioLog().isEmpty()
                    ? null
                    : repository.writeIoLog(session.getId(), job.id(), execution.ioLog());
            record(session, job, new JobResult(execution.outcome(), execution.comment(), ioLogRef,
                    execution.returnCode(), execution.returnCode() == null ? null : execution.duration()));
            session.clearRunning();

            boolean newPass = false;
            if (execution.timedOut() && (job.getPlugin() == Plugin.RESOURCE || job.getPlugin() == Plugin.LOCAL)) {
                log.warn("Job {} timed out, its partial output is ignored", job.id());
            }
            if (execution.ranToCompletion()) {
                if (job.getPlugin() == Plugin.RESOURCE) {
                    newPass = absorbResourceOutput(session, job, stdout(execution.ioLog()));
                } else if (job.getPlugin() == Plugin.LOCAL) {
                    newPass = absorbLocalOutput(session, job, stdout(execution.ioLog()));
                }
            }
            checkpoint(session);

            if (newPass) {
                resolve(session, generationDepth(session, job.id()) + 1);
            }
            return true;
        } finally {
            MDC.clear();
        }
    }

    private void record(Session session, JobDefinition job, JobResult result) {
        session.addJobResult(job.id(), result);
        meterRegistry.counter("checkpilot.job.outcomes",
                "outcome", result.outcome().value(),
                "plugin", job.getPlugin().value()).increment();
    }

    /**
     * Replaces the job's records in the resource map.
     *
     * @return true when a template consumes this resource, so a new pass is needed
     */
    boolean absorbResourceOutput(Session session, JobDefinition job, String stdout) {
        RecordParser.Result parsed = RecordParser.parseLenient(stdout, job.id());
        List<ResourceRecord> records = parsed.records().stream().map(ResourceRecord::new).toList();
        session.setResource(job.id(), records);
        log.info("Resource {} produced {} record(s)", job.id(), records.size());
        return session.getCatalog().templates().stream()
                .anyMatch(t -> t.getTemplateResource().equals(job.id()));
    }

    /**
     * Adds the units printed by a local job to the session catalogue.
     *
     * Invalid definitions and definitions clashing with a different unit of
     * the same id are discarded. While the run list holds a job that runs as
     * another user, generated jobs asking for another user are discarded too.
     *
     * @return true when at least one unit was accepted, so a new pass is needed
     */
    boolean absorbLocalOutput(Session session, JobDefinition job, String stdout) {
        RecordParser.Result parsed = RecordParser.parseLenient(stdout, job.id());
        boolean privilegedInRunList = session.getRunList().stream().anyMatch(JobDefinition::isPrivileged);
        int accepted = 0;
        for (Map<String, String> fields : parsed.records()) {
            Unit unit;
            try {
                unit = UnitFactory.create(job.namespace(), fields);
            } catch (UnitValidationException e) {
                log.warn("Local job {} emitted an invalid unit: {}", job.id(), e.getMessage());
                continue;
            }
            if (privilegedInRunList && unit instanceof JobDefinition generated && generated.isPrivileged()) {
                log.warn("Local job {} emitted {} running as {}, discarded: no privileged jobs may be generated "
                        + "while the run list already holds one", job.id(), unit.id(), generated.getUser());
                continue;
            }
            UnitCatalog.AddResult result = session.addGeneratedUnit(unit, job.id());
            switch (result) {
                case ADDED, IDENTICAL -> accepted++;
                case CONFLICT -> log.warn("Local job {} emitted {} which differs from the known definition, discarded",
                        job.id(), unit.id());
            }
        }
        log.info("Local job {} contributed {} unit(s)", job.id(), accepted);
        return accepted > 0;
    }

    /**
     * Number of local jobs between {@code jobId} and the catalogue: 0 for a
     * provider job or a template instance, 1 for a job printed by one of
     * those, and so on.
     */
    static int generationDepth(Session session, String jobId) {
        UnitCatalog catalog = session.getCatalog();
        Set<String> seen = new HashSet<>();
        int depth = 0;
        Optional<String> via = catalog.viaOf(jobId);
        while (via.isPresent() && seen.add(via.get())) {
            depth++;
            via = catalog.viaOf(via.get());
        }
        return depth;
    }

    private static String stdout(List<IoLogRecord> ioLog) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (IoLogRecord r : ioLog) {
            if (IoLogRecord.STDOUT.equals(r.stream())) {
                out.writeBytes(r.data());
            }
        }
        return out.toString(StandardCharsets.UTF_8);
    }

    // ------------------------------------------------------------------
    // Operator actions
    // ------------------------------------------------------------------

    /**
     * Record an outcome decided outside the run loop, for example the
     * operator's verdict on a manual job.
     *
     * @throws IllegalStateException if a pass or fail would be replaced
     */
    public void setJobResult(Session session, String jobId, Outcome outcome, String comment) {
        session.addJobResult(jobId, JobResult.of(outcome, comment));
        checkpoint(session);
    }

    /** Give the in-flight job of a resumed session an outcome and clear it. */
    public void resolveInFlight(Session session, Outcome outcome, String comment) {
        String jobId = session.inFlightJobId().orElseThrow(() ->
                new IllegalStateException("Session " + session.getId() + " has no job in flight"));
        session.addJobResult(jobId, JobResult.of(outcome, comment), true);
        session.clearRunning();
        checkpoint(session);
        log.info("In-flight job {} of session {} recorded as {}", jobId, session.getId(), outcome.value());
    }

    public void skipInFlight(Session session, String comment) {
        resolveInFlight(session, Outcome.SKIP, comment);
    }

    /** Clear the in-flight marker so that the job runs again on the next {@link #run}. */
    public void rerunInFlight(Session session) {
        String jobId = session.inFlightJobId().orElseThrow(() ->
                new IllegalStateException("Session " + session.getId() + " has no job in flight"));
        session.clearRunning();
        checkpoint(session);
        log.info("In-flight job {} of session {} will be run again", jobId, session.getId());
    }

    /**
     * Default recovery for a job interrupted by a crash or restart: a
     * {@code noreturn} job is expected to take the system down and passes,
     * anything else failed.
     */
    public void recoverInFlight(Session session) {
        Optional<String> jobId = session.inFlightJobId();
        if (jobId.isEmpty()) {
            return;
        }
        boolean noreturn = session.getCatalog().job(jobId.get())
                .map(j -> j.hasFlag(JobDefinition.FLAG_NORETURN))
                .orElse(false);
        if (noreturn) {
            resolveInFlight(session, Outcome.PASS, "job did not return, as expected");
        } else {
            resolveInFlight(session, Outcome.FAIL, "job was interrupted before it finished");
        }
    }

    /**
     * Explicit re-run request: forget the job's result so that the next
     * {@link #run} executes it again.
     */
    public void rerun(Session session, String jobId) {
        if (session.getState() == SessionState.COMPLETE) {
            throw new IllegalStateException("Session " + session.getId() + " is complete");
        }
        session.addJobResult(jobId, JobResult.NONE, true);
        checkpoint(session);
        log.info("Job {} of session {} queued for re-run", jobId, session.getId());
    }

    /** Set after the results were exported and handed off. */
    public void markSubmitted(Session session) {
        session.getMetadata().addFlag(SessionMetadata.FLAG_SUBMITTED);
        checkpoint(session);
    }

    // ------------------------------------------------------------------
    // Persistence
    // ------------------------------------------------------------------

    /**
     * Persist the full session state.
     *
     * @throws com.checkpilot.orchestrator.repository.CheckpointException on storage failure
     */
    public void checkpoint(Session session) {
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            repository.save(SessionCodec.toDocument(session, System.currentTimeMillis()));
        } catch (RuntimeException e) {
            log.error("Checkpoint of session {} failed: {}", session.getId(), e.getMessage());
            throw e;
        } finally {
            sample.stop(meterRegistry.timer("checkpilot.checkpoint.duration"));
        }
    }

    /**
     * Reload a stored session against the current catalogue. Results and
     * generated units are restored without running anything; a job that was
     * in flight stays marked as such.
     *
     * @throws SessionResumeException if the session is unknown or its jobs changed
     */
    public Session resume(String sessionId) {
        SessionDocument doc = repository.load(sessionId)
                .orElseThrow(() -> new SessionResumeException(sessionId, "no such session"));
        Session session = SessionCodec.fromDocument(doc, registry.catalog());
        live.put(sessionId, session);
        log.info("Session {} resumed in state {} ({} job(s) in run list)",
                sessionId, session.getState(), session.getRunList().size());
        session.inFlightJobId().ifPresent(jobId ->
                log.warn("Job {} was in flight when session {} was interrupted", jobId, sessionId));
        return session;
    }

    public Optional<Session> find(String sessionId) {
        return Optional.ofNullable(live.get(sessionId));
    }

    /** All stored sessions, most recent first. */
    public List<String> listSessions() {
        return repository.list();
    }

    /** Stored sessions that did not complete, most recent first. */
    public List<String> resumableSessions() {
        List<String> out = new ArrayList<>();
        for (String id : repository.list()) {
            repository.load(id)
                    .filter(d -> d.metadata() != null && d.metadata().flags() != null
                            && d.metadata().flags().contains(SessionMetadata.FLAG_INCOMPLETE))
                    .ifPresent(d -> out.add(id));
        }
        return out;
    }

    public void delete(String sessionId) {
        live.remove(sessionId);
        repository.delete(sessionId);
    }

    private static String summary(Session session) {
        Map<String, Long> counts = session.getJobStateMap().values().stream()
                .filter(js -> js.getOutcome() != Outcome.NONE)
                .collect(Collectors.groupingBy(js -> js.getOutcome().value(), Collectors.counting()));
        return counts.toString();
    }
}
