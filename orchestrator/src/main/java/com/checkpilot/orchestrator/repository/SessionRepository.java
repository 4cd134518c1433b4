package com.checkpilot.orchestrator.repository;

import com.checkpilot.orchestrator.model.IoLogRecord;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Durable storage for sessions and their per-job I/O logs.
 * Every method throws {@link CheckpointException} on I/O failure.
 */
public interface SessionRepository {

    /** Replaces the stored document of {@code doc.id()} atomically. */
    void save(SessionDocument doc);

    Optional<SessionDocument> load(String sessionId);

    /** Ids of all stored sessions, most recently updated first. */
    List<String> list();

    void delete(String sessionId);

    /** Scratch directory shared by all jobs of a session. */
    Path shareDir(String sessionId);

    /** @return reference to pass to {@link #readIoLog} */
    String writeIoLog(String sessionId, String jobId, List<IoLogRecord> records);

    List<IoLogRecord> readIoLog(String sessionId, String ioLogRef);
}
