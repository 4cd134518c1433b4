package com.checkpilot.orchestrator.model;

import java.nio.charset.StandardCharsets;

/**
 * One chunk of captured job output.
 *
 * @param delay  seconds since the job's process was started
 * @param stream "stdout" or "stderr"
 * @param data   raw bytes as read from the stream
 */
public record IoLogRecord(double delay, String stream, byte[] data) {

    public static final String STDOUT = "stdout";
    public static final String STDERR = "stderr";

    public String text() {
        return new String(data, StandardCharsets.UTF_8);
    }
}
