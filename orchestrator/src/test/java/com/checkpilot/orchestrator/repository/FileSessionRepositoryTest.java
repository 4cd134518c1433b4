package com.checkpilot.orchestrator.repository;

import com.checkpilot.orchestrator.model.IoLogRecord;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileSessionRepositoryTest {

    @TempDir
    Path root;

    private FileSessionRepository repository;

    @BeforeEach
    void setUp() {
        repository = new FileSessionRepository(root.toString(), new ObjectMapper());
    }

    private static SessionDocument document(String id) {
        Map<String, SessionDocument.JobStateDoc> jobs = new LinkedHashMap<>();
        jobs.put("ns::a", new SessionDocument.JobStateDoc("pass", null, "io-logs/ns__a.record.gz", 0, 1.5, null, "abc"));
        jobs.put("ns::b", new SessionDocument.JobStateDoc("skip", "dependency failed", null, null, null, "ns::gen", "def"));
        return new SessionDocument(
                SessionDocument.CURRENT_VERSION, id, "RUNNING", 1_700_000_000_000L,
                new SessionDocument.Metadata("app", "Title", null, List.of("incomplete"), "ns::b"),
                new SessionDocument.SelectorDoc("test-plan", "ns::plan", null, null, null, null, null),
                List.of("ns::a", "ns::b"),
                List.of("ns::gen"),
                List.of("ns::gen", "ns::a", "ns::b"),
                jobs,
                Map.of("ns::res", List.of(Map.of("k", "v"))),
                List.of(new SessionDocument.GeneratedUnitDoc("ns", Map.of("id", "b", "plugin", "shell"), "ns::gen", null, null)),
                Map.of("ns::a", "ns::cat"),
                2);
    }

    // ------------------------------------------------------------------
    // Documents
    // ------------------------------------------------------------------

    @Test
    void saveThenLoad_returnsEqualDocument() {
        SessionDocument doc = document("s1");
        repository.save(doc);

        assertThat(repository.load("s1")).contains(doc);
        assertThat(root.resolve("s1").resolve(FileSessionRepository.DOCUMENT)).isRegularFile();
    }

    @Test
    void save_overwritesAndLeavesNoTempFiles() throws Exception {
        repository.save(document("s1"));
        repository.save(document("s1"));

        try (var files = Files.list(root.resolve("s1"))) {
            assertThat(files.map(p -> p.getFileName().toString()))
                    .containsExactly(FileSessionRepository.DOCUMENT);
        }
    }

    @Test
    void load_unknownSession_empty() {
        assertThat(repository.load("nope")).isEmpty();
    }

    @Test
    void load_corruptDocument_throwsCheckpointException() throws Exception {
        Files.createDirectories(root.resolve("bad"));
        Files.writeString(root.resolve("bad").resolve(FileSessionRepository.DOCUMENT), "not gzip");
        assertThatThrownBy(() -> repository.load("bad")).isInstanceOf(CheckpointException.class);
    }

    @Test
    void list_mostRecentFirst() throws Exception {
        repository.save(document("old"));
        repository.save(document("new"));
        Files.setLastModifiedTime(root.resolve("old").resolve(FileSessionRepository.DOCUMENT),
                FileTime.fromMillis(1_000_000L));
        Files.setLastModifiedTime(root.resolve("new").resolve(FileSessionRepository.DOCUMENT),
                FileTime.fromMillis(2_000_000L));
        Files.createDirectories(root.resolve("stray"));

        assertThat(repository.list()).containsExactly("new", "old");
    }

    @Test
    void delete_removesEverything() {
        repository.save(document("s1"));
        repository.shareDir("s1");
        repository.writeIoLog("s1", "ns::a", List.of(new IoLogRecord(0.0, "stdout", new byte[] {1})));

        repository.delete("s1");

        assertThat(root.resolve("s1")).doesNotExist();
        assertThat(repository.list()).isEmpty();
    }

    @Test
    void sessionId_withPathSeparator_rejected() {
        assertThatThrownBy(() -> repository.load("../escape")).isInstanceOf(IllegalArgumentException.class);
    }

    // ------------------------------------------------------------------
    // I/O logs
    // ------------------------------------------------------------------

    @Test
    void writeThenReadIoLog_preservesStreamsAndBytes() {
        List<IoLogRecord> records = List.of(
                new IoLogRecord(0.0, IoLogRecord.STDOUT, "hello\n".getBytes(StandardCharsets.UTF_8)),
                new IoLogRecord(0.25, IoLogRecord.STDERR, new byte[] {(byte) 0xff, 0x00, 0x7f}));

        String ref = repository.writeIoLog("s1", "ns::disk/read", records);
        List<IoLogRecord> back = repository.readIoLog("s1", ref);

        assertThat(ref).isEqualTo("io-logs/ns__disk_read.record.gz");
        assertThat(back).hasSize(2);
        assertThat(back.get(0).stream()).isEqualTo("stdout");
        assertThat(back.get(0).data()).isEqualTo("hello\n".getBytes(StandardCharsets.UTF_8));
        assertThat(back.get(1).delay()).isEqualTo(0.25);
        assertThat(back.get(1).data()).containsExactly((byte) 0xff, (byte) 0x00, (byte) 0x7f);
    }

    @Test
    void shareDir_createdOnDemand() {
        Path share = repository.shareDir("s1");
        assertThat(share).isDirectory();
        assertThat(share.getFileName().toString()).isEqualTo("share");
    }
}
