package com.checkpilot.orchestrator.session;

import com.checkpilot.orchestrator.catalog.UnitCatalog;
import com.checkpilot.orchestrator.model.JobDefinition;
import com.checkpilot.orchestrator.model.JobReadinessInhibitor;
import com.checkpilot.orchestrator.model.JobResult;
import com.checkpilot.orchestrator.model.JobState;
import com.checkpilot.orchestrator.model.Outcome;
import com.checkpilot.orchestrator.model.ResourceRecord;
import com.checkpilot.orchestrator.model.SessionMetadata;
import com.checkpilot.orchestrator.model.SessionState;
import com.checkpilot.orchestrator.model.Unit;
import com.checkpilot.orchestrator.qualifier.JobSelector;
import com.checkpilot.orchestrator.resolver.ReadinessCalculator;
import com.checkpilot.orchestrator.resolver.RunListResolver.Resolution;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Mutable root of one test session: per-job results, resource records,
 * desired and run lists, and the session's own copy of the unit catalogue.
 *
 * All mutators are synchronized; the session service is the only writer and
 * only mutates between job executions.
 */
public class Session {

    /** Extra seconds assumed for every job needing an operator. */
    public static final double MANUAL_OVERHEAD_SEC = 30.0;

    private static final Map<SessionState, Set<SessionState>> TRANSITIONS = Map.of(
            SessionState.NEW,       EnumSet.of(SessionState.SELECTING),
            SessionState.SELECTING, EnumSet.of(SessionState.RESOLVING),
            SessionState.RESOLVING, EnumSet.of(SessionState.RUNNING),
            SessionState.RUNNING,   EnumSet.of(SessionState.RESOLVING, SessionState.COMPLETE),
            SessionState.COMPLETE,  EnumSet.noneOf(SessionState.class));

    /** A unit that only exists in this session, with its generating job (null for template instances). */
    /**
     * A unit that is not part of the provider catalogue.
     *
     * @param via      local job that printed it, null for template instances
     * @param template template it was instantiated from, null for local job output
     */
    public record GeneratedUnit(Unit unit, String via, String template) {}

    /** Estimated run time in seconds; a total is null when some job in it has no estimate. */
    public record DurationEstimate(Double automated, Double manual) {}

    private final String id;
    private final UnitCatalog catalog;
    private final JobSelector selector;
    private final SessionMetadata metadata = new SessionMetadata();

    private SessionState state = SessionState.NEW;
    private final Map<String, JobState> jobStates = new LinkedHashMap<>();
    private final Map<String, List<ResourceRecord>> resourceMap = new LinkedHashMap<>();
    private final List<GeneratedUnit> generated = new ArrayList<>();
    private List<String> desired = List.of();
    private List<String> bootstrap = List.of();
    private List<JobDefinition> runList = List.of();
    private Map<String, String> categoryMap = Map.of();
    private int passCount = 0;
    private volatile boolean abortRequested = false;

    public Session(String id, UnitCatalog catalog, JobSelector selector) {
        this.id       = id;
        this.catalog  = catalog;
        this.selector = selector;
        metadata.addFlag(SessionMetadata.FLAG_INCOMPLETE);
    }

    // ------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------

    /** @throws IllegalStateException if the transition is not allowed */
    public synchronized void transitionTo(SessionState next) {
        if (!TRANSITIONS.get(state).contains(next)) {
            throw new IllegalStateException("Session " + id + ": illegal transition " + state + " -> " + next);
        }
        state = next;
        if (next == SessionState.COMPLETE) {
            metadata.removeFlag(SessionMetadata.FLAG_INCOMPLETE);
        }
    }

    /** Restores a checkpointed state without transition checks. */
    synchronized void restoreState(SessionState restored) {
        this.state = restored;
    }

    // ------------------------------------------------------------------
    // Resolution
    // ------------------------------------------------------------------

    /** Installs the outcome of a resolution pass. */
    public synchronized void applyResolution(Resolution resolution) {
        for (Unit unit : resolution.added()) {
            generated.add(new GeneratedUnit(unit, null, resolution.sources().get(unit.id())));
        }
        this.desired     = List.copyOf(resolution.desired());
        this.bootstrap   = List.copyOf(resolution.selection().bootstrap());
        this.runList     = List.copyOf(resolution.runList());
        this.categoryMap = resolution.selection().categoryMap();
        this.passCount++;
        for (JobDefinition job : runList) {
            jobStates.computeIfAbsent(job.id(), k -> new JobState(job, catalog.viaOf(k).orElse(null)));
        }
    }

    /**
     * Adds a unit printed by a local job (or replayed on resume).
     *
     * An identical re-definition of a known unit only gains the
     * {@code via} link; a different definition under a known id is
     * rejected and the existing unit kept.
     */
    public synchronized UnitCatalog.AddResult addGeneratedUnit(Unit unit, String via) {
        UnitCatalog.AddResult result = catalog.add(unit);
        if (result == UnitCatalog.AddResult.CONFLICT) {
            return result;
        }
        if (result == UnitCatalog.AddResult.ADDED) {
            generated.add(new GeneratedUnit(unit, via, null));
        }
        if (via != null) {
            catalog.markVia(unit.id(), via);
            JobState js = jobStates.get(unit.id());
            if (js != null && js.getVia() == null) {
                js.setVia(via);
            }
        }
        return result;
    }

    /** Template instances restored from a checkpoint. */
    synchronized void restoreTemplateUnit(Unit unit, String template) {
        if (catalog.add(unit) == UnitCatalog.AddResult.ADDED) {
            generated.add(new GeneratedUnit(unit, null, template));
        }
    }

    synchronized void restoreLists(List<String> desired, List<String> bootstrap, List<JobDefinition> runList,
                                   Map<String, String> categoryMap, int passCount) {
        this.desired     = List.copyOf(desired);
        this.bootstrap   = List.copyOf(bootstrap);
        this.runList     = List.copyOf(runList);
        this.categoryMap = Collections.unmodifiableMap(new LinkedHashMap<>(categoryMap));
        this.passCount   = passCount;
    }

    // ------------------------------------------------------------------
    // Results
    // ------------------------------------------------------------------

    /**
     * Record a job result. Writing the same result twice is a no-op;
     * replacing a pass or fail needs {@code rerun}.
     *
     * @return true if the stored result changed
     * @throws IllegalArgumentException if the job is unknown
     * @throws IllegalStateException    if a final result would be replaced without {@code rerun}
     */
    public synchronized boolean addJobResult(String jobId, JobResult result, boolean rerun) {
        JobState js = jobState(jobId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown job: " + jobId));
        if (js.getResult().equals(result)) {
            return false;
        }
        if (js.getResult().isFinal() && !rerun) {
            throw new IllegalStateException("Job " + jobId + " already has result "
                    + js.getOutcome().value() + "; replacing it needs a re-run request");
        }
        js.setResult(result);
        return true;
    }

    public boolean addJobResult(String jobId, JobResult result) {
        return addJobResult(jobId, result, false);
    }

    /** Replaces the records of one resource job. */
    public synchronized void setResource(String resourceId, List<ResourceRecord> records) {
        resourceMap.put(resourceId, List.copyOf(records));
    }

    // ------------------------------------------------------------------
    // Scheduling queries
    // ------------------------------------------------------------------

    /** First run-list job without an outcome. */
    public synchronized Optional<JobDefinition> nextPendingJob() {
        for (JobDefinition job : runList) {
            if (outcomeOf(job.id()) == Outcome.NONE) {
                return Optional.of(job);
            }
        }
        return Optional.empty();
    }

    public synchronized List<JobReadinessInhibitor> inhibitorsOf(JobDefinition job) {
        return ReadinessCalculator.inhibitors(job, this::outcomeOf, resourceMap);
    }

    public synchronized Outcome outcomeOf(String jobId) {
        JobState js = jobStates.get(jobId);
        return js == null ? Outcome.NONE : js.getOutcome();
    }

    /** Job state for a known job, created on first access. */
    public synchronized Optional<JobState> jobState(String jobId) {
        JobState js = jobStates.get(jobId);
        if (js == null) {
            Optional<JobDefinition> job = catalog.job(jobId);
            if (job.isEmpty()) {
                return Optional.empty();
            }
            js = new JobState(job.get(), catalog.viaOf(jobId).orElse(null));
            jobStates.put(jobId, js);
        }
        return Optional.of(js);
    }

    public synchronized DurationEstimate estimatedDuration() {
        Double automated = 0.0;
        Double manual = 0.0;
        for (JobDefinition job : runList) {
            Double d = job.getEstimatedDuration();
            if (job.getPlugin().isAutomated()) {
                automated = (automated == null || d == null) ? null : automated + d;
            } else {
                manual = (manual == null || d == null) ? null : manual + d + MANUAL_OVERHEAD_SEC;
            }
        }
        return new DurationEstimate(automated, manual);
    }

    // ------------------------------------------------------------------
    // In-flight job and abort
    // ------------------------------------------------------------------

    public synchronized void markRunning(String jobId) {
        metadata.setRunningJobId(jobId);
    }

    public synchronized void clearRunning() {
        metadata.setRunningJobId(null);
    }

    public synchronized Optional<String> inFlightJobId() {
        return Optional.ofNullable(metadata.getRunningJobId());
    }

    /** Stop requesting run-list items; the current job finishes first. */
    public void requestAbort()            { abortRequested = true; }
    public boolean isAbortRequested()     { return abortRequested; }
    void clearAbort()                     { abortRequested = false; }

    // ------------------------------------------------------------------
    // Accessors
    // ------------------------------------------------------------------

    public String getId()                  { return id; }
    public UnitCatalog getCatalog()        { return catalog; }
    public JobSelector getSelector()       { return selector; }
    public SessionMetadata getMetadata()   { return metadata; }
    public synchronized SessionState getState()          { return state; }
    public synchronized List<String> getDesiredJobList() { return desired; }
    public synchronized List<String> getBootstrapList()  { return bootstrap; }
    public synchronized List<JobDefinition> getRunList() { return runList; }
    public synchronized Map<String, String> getCategoryMap() { return categoryMap; }
    /** Resolution passes run over the whole life of the session. */
    public synchronized int getPassCount()               { return passCount; }

    public synchronized List<String> getRunListIds() {
        return runList.stream().map(JobDefinition::id).toList();
    }

    public synchronized Map<String, List<ResourceRecord>> getResourceMap() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(resourceMap));
    }

    public synchronized Map<String, JobState> getJobStateMap() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(jobStates));
    }

    public synchronized List<GeneratedUnit> getGeneratedUnits() {
        return List.copyOf(generated);
    }
}
