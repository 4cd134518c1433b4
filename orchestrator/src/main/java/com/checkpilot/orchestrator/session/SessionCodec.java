package com.checkpilot.orchestrator.session;

import com.checkpilot.orchestrator.catalog.UnitCatalog;
import com.checkpilot.orchestrator.model.JobDefinition;
import com.checkpilot.orchestrator.model.JobResult;
import com.checkpilot.orchestrator.model.JobState;
import com.checkpilot.orchestrator.model.Outcome;
import com.checkpilot.orchestrator.model.ResourceRecord;
import com.checkpilot.orchestrator.model.SessionMetadata;
import com.checkpilot.orchestrator.model.SessionState;
import com.checkpilot.orchestrator.model.TemplateUnit;
import com.checkpilot.orchestrator.model.Unit;
import com.checkpilot.orchestrator.model.UnitFactory;
import com.checkpilot.orchestrator.model.UnitValidationException;
import com.checkpilot.orchestrator.qualifier.ExplicitSelector;
import com.checkpilot.orchestrator.qualifier.JobSelector;
import com.checkpilot.orchestrator.qualifier.TestPlanSelector;
import com.checkpilot.orchestrator.qualifier.WhiteList;
import com.checkpilot.orchestrator.repository.SessionDocument;
import com.checkpilot.orchestrator.repository.SessionDocument.GeneratedUnitDoc;
import com.checkpilot.orchestrator.repository.SessionDocument.JobStateDoc;
import com.checkpilot.orchestrator.repository.SessionDocument.Metadata;
import com.checkpilot.orchestrator.repository.SessionDocument.SelectorDoc;

import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts between a live {@link Session} and its stored document.
 *
 * Restoring is the resume check: every job with a recorded result and every
 * run-list entry must still exist with the content hash it had when the
 * checkpoint was taken. Units generated during the session are replayed
 * from the document, never by running their generators again; a template
 * instance is replayed only while its template keeps the content hash it
 * had when it was instantiated.
 */
final class SessionCodec {

    private SessionCodec() {}

    // ------------------------------------------------------------------
    // Session -> document
    // ------------------------------------------------------------------

    static SessionDocument toDocument(Session session, long now) {
        synchronized (session) {
            SessionMetadata m = session.getMetadata();
            Metadata metadata = new Metadata(m.getAppId(), m.getTitle(),
                    m.getAppBlob() == null ? null : Base64.getEncoder().encodeToString(m.getAppBlob()),
                    new ArrayList<>(m.getFlags()), m.getRunningJobId());

            List<String> runList = session.getRunListIds();
            Map<String, JobStateDoc> jobs = new LinkedHashMap<>();
            for (Map.Entry<String, JobState> e : session.getJobStateMap().entrySet()) {
                JobState js = e.getValue();
                if (!runList.contains(e.getKey()) && js.getOutcome() == Outcome.NONE && js.getVia() == null) {
                    continue;
                }
                JobResult r = js.getResult();
                jobs.put(e.getKey(), new JobStateDoc(r.outcome().value(), r.comment(), r.ioLogRef(),
                        r.returnCode(), r.executionDuration(), js.getVia(), js.getJob().checksum()));
            }

            Map<String, List<Map<String, String>>> resources = new LinkedHashMap<>();
            session.getResourceMap().forEach((id, records) ->
                    resources.put(id, records.stream().map(ResourceRecord::asMap).toList()));

            List<GeneratedUnitDoc> generated = new ArrayList<>();
            for (Session.GeneratedUnit g : session.getGeneratedUnits()) {
                String templateChecksum = g.template() == null ? null
                        : session.getCatalog().get(g.template()).map(Unit::checksum).orElse(null);
                generated.add(new GeneratedUnitDoc(g.unit().namespace(), g.unit().fields(), g.via(),
                        g.template(), templateChecksum));
            }

            return new SessionDocument(SessionDocument.CURRENT_VERSION, session.getId(),
                    session.getState().name(), now, metadata, selectorDoc(session.getSelector()),
                    session.getDesiredJobList(), session.getBootstrapList(), runList, jobs,
                    resources, generated, session.getCategoryMap(), session.getPassCount());
        }
    }

    private static SelectorDoc selectorDoc(JobSelector selector) {
        if (selector instanceof TestPlanSelector t) {
            return new SelectorDoc("test-plan", t.testPlanId(), null, null, null, null, null);
        }
        if (selector instanceof ExplicitSelector x) {
            return new SelectorDoc("explicit", null, x.jobIds(), x.bootstrapIds(), null, null, null);
        }
        if (selector instanceof WhiteList w) {
            return new SelectorDoc("whitelist", null, null, null, w.name(), w.namespace(), w.text());
        }
        throw new IllegalArgumentException("Selector cannot be persisted: " + selector.getClass().getName());
    }

    // ------------------------------------------------------------------
    // Document -> session
    // ------------------------------------------------------------------

    /**
     * @param providerCatalog the catalogue as loaded now; it is copied, not modified
     * @throws SessionResumeException if the document does not match the catalogue
     */
    static Session fromDocument(SessionDocument doc, UnitCatalog providerCatalog) {
        String id = doc.id();
        if (doc.version() > SessionDocument.CURRENT_VERSION) {
            throw new SessionResumeException(id, "unsupported document version " + doc.version());
        }
        Session session = new Session(id, providerCatalog.copy(), selector(id, doc.selector()));
        restoreMetadata(session.getMetadata(), doc.metadata());

        // generated units first so that results can refer to them
        for (GeneratedUnitDoc g : orEmpty(doc.generated())) {
            Unit unit;
            try {
                unit = UnitFactory.create(g.namespace(), g.fields());
            } catch (UnitValidationException e) {
                throw new SessionResumeException(id, "generated unit no longer valid: " + e.getMessage(), e);
            }
            if (g.via() != null) {
                if (session.addGeneratedUnit(unit, g.via()) == UnitCatalog.AddResult.CONFLICT) {
                    throw new SessionResumeException(id, "generated unit " + unit.id()
                            + " clashes with a unit of the current catalogue");
                }
            } else {
                checkTemplate(id, g, unit, providerCatalog);
                session.restoreTemplateUnit(unit, g.template());
            }
        }

        UnitCatalog catalog = session.getCatalog();
        for (Map.Entry<String, JobStateDoc> e : orEmpty(doc.jobs()).entrySet()) {
            String jobId = e.getKey();
            JobStateDoc js = e.getValue();
            JobDefinition job = catalog.job(jobId).orElseThrow(() ->
                    new SessionResumeException(id, "job " + jobId + " is no longer defined"));
            if (js.checksum() != null && !js.checksum().equals(job.checksum())) {
                throw new SessionResumeException(id, "job " + jobId + " was modified since the session started");
            }
            JobState state = session.jobState(jobId).orElseThrow();
            state.setResult(new JobResult(Outcome.fromValue(js.outcome()), js.comment(), js.ioLogRef(),
                    js.returnCode(), js.executionDuration()));
            if (js.via() != null) {
                state.setVia(js.via());
                catalog.markVia(jobId, js.via());
            }
        }

        List<JobDefinition> runList = new ArrayList<>();
        for (String jobId : orEmpty(doc.runList())) {
            runList.add(catalog.job(jobId).orElseThrow(() ->
                    new SessionResumeException(id, "run-list job " + jobId + " is no longer defined")));
        }

        orEmpty(doc.resources()).forEach((resourceId, records) ->
                session.setResource(resourceId, records.stream().map(ResourceRecord::new).toList()));

        session.restoreLists(orEmpty(doc.desired()), orEmpty(doc.bootstrap()), runList,
                orEmpty(doc.categories()), doc.passCount());
        session.restoreState(SessionState.valueOf(doc.state()));
        return session;
    }

    /** A template instance is only replayed while its template is unchanged. */
    private static void checkTemplate(String sessionId, GeneratedUnitDoc g, Unit unit, UnitCatalog providerCatalog) {
        if (g.template() == null || g.templateChecksum() == null) {
            return;
        }
        Unit template = providerCatalog.get(g.template())
                .filter(TemplateUnit.class::isInstance)
                .orElseThrow(() -> new SessionResumeException(sessionId, "template " + g.template()
                        + " of " + unit.id() + " is no longer defined"));
        if (!template.checksum().equals(g.templateChecksum())) {
            throw new SessionResumeException(sessionId, "template " + g.template() + " of " + unit.id()
                    + " was modified since the session started");
        }
    }

    private static JobSelector selector(String sessionId, SelectorDoc doc) {
        if (doc == null) {
            throw new SessionResumeException(sessionId, "document has no selector");
        }
        return switch (doc.kind()) {
            case "test-plan" -> new TestPlanSelector(doc.testPlanId());
            case "explicit"  -> new ExplicitSelector(orEmpty(doc.jobIds()), orEmpty(doc.bootstrapIds()));
            case "whitelist" -> WhiteList.fromText(doc.name(), doc.namespace(), doc.text());
            default -> throw new SessionResumeException(sessionId, "unknown selector kind " + doc.kind());
        };
    }

    private static void restoreMetadata(SessionMetadata target, Metadata m) {
        if (m == null) return;
        target.setAppId(m.appId());
        target.setTitle(m.title());
        target.setAppBlob(m.appBlob() == null ? null : Base64.getDecoder().decode(m.appBlob()));
        target.setRunningJobId(m.runningJobId());
        target.removeFlag(SessionMetadata.FLAG_INCOMPLETE);
        orEmpty(m.flags()).forEach(target::addFlag);
    }

    private static <T> List<T> orEmpty(List<T> list) {
        return list == null ? List.of() : list;
    }

    private static <K, V> Map<K, V> orEmpty(Map<K, V> map) {
        return map == null ? Map.of() : map;
    }
}
