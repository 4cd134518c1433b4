package com.checkpilot.orchestrator.catalog;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecordParserTest {

    @Test
    void parse_blankLinesSeparateRecords() {
        List<Map<String, String>> records = RecordParser.parse("""
                name: sda
                category: DISK

                name: sr0
                category: CDROM
                """, "test");
        assertThat(records).hasSize(2);
        assertThat(records.get(1)).containsEntry("name", "sr0").containsEntry("category", "CDROM");
    }

    @Test
    void parse_continuationLinesJoined_dotIsEmptyLine() {
        List<Map<String, String>> records = RecordParser.parse("""
                id: j
                command:
                  echo one
                  .
                  echo two
                """, "test");
        assertThat(records.get(0).get("command")).isEqualTo("echo one\n\necho two");
    }

    @Test
    void parse_commentsSkipped() {
        List<Map<String, String>> records = RecordParser.parse("# header\nid: j\n# inner\nplugin: shell\n", "test");
        assertThat(records).containsExactly(Map.of("id", "j", "plugin", "shell"));
    }

    @Test
    void parse_emptyInput_noRecords() {
        assertThat(RecordParser.parse("", "test")).isEmpty();
        assertThat(RecordParser.parse("\n\n\n", "test")).isEmpty();
    }

    @Test
    void parse_duplicateField_rejectedWithLine() {
        assertThatThrownBy(() -> RecordParser.parse("id: a\nid: b\n", "units.pxu"))
                .isInstanceOf(RecordSyntaxException.class)
                .satisfies(e -> assertThat(((RecordSyntaxException) e).getLine()).isEqualTo(2));
    }

    @Test
    void parse_leadingContinuation_rejected() {
        assertThatThrownBy(() -> RecordParser.parse("  orphan\n", "test"))
                .isInstanceOf(RecordSyntaxException.class);
    }

    @Test
    void parseLenient_keepsRecordsBeforeError() {
        RecordParser.Result result = RecordParser.parseLenient("""
                name: a

                name: b

                name: c
                this line is garbage
                """, "stdout");
        assertThat(result.isClean()).isFalse();
        assertThat(result.records()).extracting(r -> r.get("name")).containsExactly("a", "b");
    }

    @Test
    void parseLenient_cleanInput_noError() {
        RecordParser.Result result = RecordParser.parseLenient("name: a\n", "stdout");
        assertThat(result.isClean()).isTrue();
        assertThat(result.records()).hasSize(1);
    }
}
