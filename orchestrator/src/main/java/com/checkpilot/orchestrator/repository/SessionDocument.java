package com.checkpilot.orchestrator.repository;

import java.util.List;
import java.util.Map;

/**
 * Persisted shape of a session, serialised as one gzip-compressed JSON
 * document. Maps keep insertion order so that lists and maps come back in
 * the order they were written.
 *
 * @param updatedAt epoch millis of the checkpoint
 */
public record SessionDocument(
        int version,
        String id,
        String state,
        long updatedAt,
        Metadata metadata,
        SelectorDoc selector,
        List<String> desired,
        List<String> bootstrap,
        List<String> runList,
        Map<String, JobStateDoc> jobs,
        Map<String, List<Map<String, String>>> resources,
        List<GeneratedUnitDoc> generated,
        Map<String, String> categories,
        int passCount) {

    public static final int CURRENT_VERSION = 1;

    /** @param appBlob base64, may be null */
    public record Metadata(String appId, String title, String appBlob,
                           List<String> flags, String runningJobId) {}

    /**
     * How the desired list is selected. {@code kind} is one of
     * {@code test-plan}, {@code explicit}, {@code whitelist}.
     */
    public record SelectorDoc(String kind, String testPlanId,
                              List<String> jobIds, List<String> bootstrapIds,
                              String name, String namespace, String text) {}

    /** @param checksum content hash of the job definition the result was recorded against */
    public record JobStateDoc(String outcome, String comment, String ioLogRef,
                              Integer returnCode, Double executionDuration,
                              String via, String checksum) {}

    /**
     * A unit that is not part of the provider catalogue.
     *
     * @param via              generating local job, null for template instances
     * @param template         template of a template instance, null otherwise
     * @param templateChecksum content hash of that template when it was instantiated
     */
    public record GeneratedUnitDoc(String namespace, Map<String, String> fields, String via,
                                   String template, String templateChecksum) {}
}
