package com.checkpilot.orchestrator.repository;

import com.checkpilot.orchestrator.model.IoLogRecord;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Stores each session under {@code <root>/<sessionId>/}:
 * <pre>
 *   session.json.gz            the session document
 *   io-logs/&lt;job&gt;.record.gz    one [delay, stream, base64] JSON array per line
 *   share/                     scratch space for the session's jobs
 * </pre>
 * The document is written to a temporary file next to the target and moved
 * over it, so a crash leaves either the previous or the new checkpoint.
 */
@Component
public class FileSessionRepository implements SessionRepository {

    private static final Logger log = LoggerFactory.getLogger(FileSessionRepository.class);

    static final String DOCUMENT   = "session.json.gz";
    static final String IO_LOG_DIR = "io-logs";
    static final String SHARE_DIR  = "share";

    private static final TypeReference<List<Object>> LINE_TYPE = new TypeReference<>() {};

    private final Path         root;
    private final ObjectMapper objectMapper;

    public FileSessionRepository(@Value("${checkpilot.storage.root:sessions}") String root,
                                 ObjectMapper objectMapper) {
        this.root         = Path.of(root);
        this.objectMapper = objectMapper;
    }

    // ------------------------------------------------------------------
    // Session documents
    // ------------------------------------------------------------------

    @Override
    public void save(SessionDocument doc) {
        Path dir = sessionDir(doc.id());
        Path target = dir.resolve(DOCUMENT);
        Path tmp = null;
        try {
            Files.createDirectories(dir);
            tmp = Files.createTempFile(dir, DOCUMENT, ".tmp");
            try (OutputStream out = new GZIPOutputStream(Files.newOutputStream(tmp))) {
                objectMapper.writeValue(out, doc);
            }
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("Atomic move not supported in {}, falling back to plain replace", dir);
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Checkpoint written for session {}", doc.id());
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new CheckpointException("Cannot write checkpoint of session " + doc.id(), e);
        }
    }

    @Override
    public Optional<SessionDocument> load(String sessionId) {
        Path file = sessionDir(sessionId).resolve(DOCUMENT);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try (InputStream in = new GZIPInputStream(Files.newInputStream(file))) {
            return Optional.of(objectMapper.readValue(in, SessionDocument.class));
        } catch (IOException e) {
            throw new CheckpointException("Cannot read checkpoint of session " + sessionId, e);
        }
    }

    @Override
    public List<String> list() {
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        try (Stream<Path> s = Files.list(root)) {
            return s.filter(d -> Files.isRegularFile(d.resolve(DOCUMENT)))
                    .sorted(Comparator.comparing(FileSessionRepository::modifiedAt).reversed()
                            .thenComparing(d -> d.getFileName().toString()))
                    .map(d -> d.getFileName().toString())
                    .toList();
        } catch (IOException e) {
            throw new CheckpointException("Cannot list sessions in " + root, e);
        }
    }

    @Override
    public void delete(String sessionId) {
        Path dir = sessionDir(sessionId);
        if (!Files.exists(dir)) {
            return;
        }
        try {
            Files.walkFileTree(dir, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                    Files.delete(file);
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult postVisitDirectory(Path d, IOException exc) throws IOException {
                    if (exc != null) throw exc;
                    Files.delete(d);
                    return FileVisitResult.CONTINUE;
                }
            });
            log.info("Session {} deleted", sessionId);
        } catch (IOException e) {
            throw new CheckpointException("Cannot delete session " + sessionId, e);
        }
    }

    @Override
    public Path shareDir(String sessionId) {
        Path dir = sessionDir(sessionId).resolve(SHARE_DIR);
        try {
            return Files.createDirectories(dir);
        } catch (IOException e) {
            throw new CheckpointException("Cannot create share directory for session " + sessionId, e);
        }
    }

    // ------------------------------------------------------------------
    // I/O logs
    // ------------------------------------------------------------------

    @Override
    public String writeIoLog(String sessionId, String jobId, List<IoLogRecord> records) {
        String ref = IO_LOG_DIR + "/" + slug(jobId) + ".record.gz";
        Path file = sessionDir(sessionId).resolve(ref);
        try {
            Files.createDirectories(file.getParent());
            try (BufferedWriter w = new BufferedWriter(new OutputStreamWriter(
                    new GZIPOutputStream(Files.newOutputStream(file)), StandardCharsets.UTF_8))) {
                Base64.Encoder b64 = Base64.getEncoder();
                for (IoLogRecord r : records) {
                    w.write(objectMapper.writeValueAsString(
                            List.of(r.delay(), r.stream(), b64.encodeToString(r.data()))));
                    w.newLine();
                }
            }
            return ref;
        } catch (IOException e) {
            throw new CheckpointException("Cannot write I/O log of job " + jobId, e);
        }
    }

    @Override
    public List<IoLogRecord> readIoLog(String sessionId, String ioLogRef) {
        Path file = sessionDir(sessionId).resolve(ioLogRef);
        List<IoLogRecord> out = new ArrayList<>();
        try (BufferedReader r = new BufferedReader(new InputStreamReader(
                new GZIPInputStream(Files.newInputStream(file)), StandardCharsets.UTF_8))) {
            Base64.Decoder b64 = Base64.getDecoder();
            String line;
            while ((line = r.readLine()) != null) {
                if (line.isBlank()) continue;
                List<Object> triple = objectMapper.readValue(line, LINE_TYPE);
                out.add(new IoLogRecord(((Number) triple.get(0)).doubleValue(),
                        (String) triple.get(1), b64.decode((String) triple.get(2))));
            }
            return out;
        } catch (IOException e) {
            throw new CheckpointException("Cannot read I/O log " + ioLogRef, e);
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    Path sessionDir(String sessionId) {
        if (sessionId.isBlank() || sessionId.contains("/") || sessionId.contains("\\") || sessionId.startsWith(".")) {
            throw new IllegalArgumentException("Invalid session id: " + sessionId);
        }
        return root.resolve(sessionId);
    }

    static String slug(String jobId) {
        return jobId.replaceAll("[^A-Za-z0-9._-]", "_");
    }

    private static long modifiedAt(Path dir) {
        try {
            return Files.getLastModifiedTime(dir.resolve(DOCUMENT)).toMillis();
        } catch (IOException e) {
            return 0L;
        }
    }

    private static void deleteQuietly(Path file) {
        if (file == null) return;
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Could not remove temporary file {}: {}", file, e.getMessage());
        }
    }
}
