package com.checkpilot.orchestrator.catalog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses RFC822-style record text: {@code key: value} lines, records
 * separated by blank lines, continuation lines starting with whitespace
 * (a lone {@code .} on a continuation line stands for an empty line) and
 * {@code #} comment lines.
 *
 * Used for provider unit files, resource job output and local job output.
 */
public final class RecordParser {

    private static final Logger log = LoggerFactory.getLogger(RecordParser.class);

    private static final Pattern FIELD = Pattern.compile("^([^\\s:#][^\\s:]*)\\s*:\\s?(.*)$");

    /** Records parsed before the first error, plus that error if any. */
    public record Result(List<Map<String, String>> records, RecordSyntaxException error) {
        public boolean isClean() { return error == null; }
    }

    private RecordParser() {}

    /** @throws RecordSyntaxException on the first malformed line */
    public static List<Map<String, String>> parse(String text, String origin) {
        List<Map<String, String>> records = new ArrayList<>();
        Map<String, String> current = null;
        String key = null;
        List<String> value = null;

        String[] lines = text.split("\\r?\\n", -1);
        for (int n = 0; n < lines.length; n++) {
            String line = lines[n];
            if (line.startsWith("#")) {
                continue;
            }
            if (line.isBlank()) {
                if (current != null) {
                    finish(current, key, value);
                    records.add(current);
                }
                current = null;
                key = null;
                value = null;
                continue;
            }
            if (Character.isWhitespace(line.charAt(0))) {
                if (key == null) {
                    throw new RecordSyntaxException(origin, n + 1, "continuation line without a field");
                }
                String stripped = line.strip();
                value.add(stripped.equals(".") ? "" : stripped);
                continue;
            }
            Matcher m = FIELD.matcher(line);
            if (!m.matches()) {
                throw new RecordSyntaxException(origin, n + 1, "expected 'key: value', got '" + line + "'");
            }
            if (current == null) {
                current = new LinkedHashMap<>();
            } else {
                finish(current, key, value);
            }
            key = m.group(1);
            if (current.containsKey(key)) {
                throw new RecordSyntaxException(origin, n + 1, "duplicate field '" + key + "'");
            }
            value = new ArrayList<>();
            value.add(m.group(2).strip());
        }
        if (current != null) {
            finish(current, key, value);
            records.add(current);
        }
        return records;
    }

    /** Like {@link #parse} but keeps whatever was parsed before an error. */
    public static Result parseLenient(String text, String origin) {
        try {
            return new Result(parse(text, origin), null);
        } catch (RecordSyntaxException e) {
            log.warn("Malformed records in {}: {}", origin, e.getMessage());
            int cut = e.getLine() - 1;
            String[] lines = text.split("\\r?\\n", -1);
            int end = cut;
            // back up to the last record boundary before the bad line
            while (end > 0 && !lines[end - 1].isBlank()) {
                end--;
            }
            String prefix = String.join("\n", Arrays.copyOfRange(lines, 0, end));
            return new Result(parse(prefix, origin), e);
        }
    }

    private static void finish(Map<String, String> record, String key, List<String> value) {
        if (key != null) {
            record.put(key, String.join("\n", value).strip());
        }
    }
}
