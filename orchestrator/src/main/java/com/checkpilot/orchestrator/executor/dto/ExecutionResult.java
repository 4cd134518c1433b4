package com.checkpilot.orchestrator.executor.dto;

import com.checkpilot.orchestrator.model.IoLogRecord;

import java.io.ByteArrayOutputStream;
import java.util.List;

/**
 * What a finished process left behind.
 *
 * @param ioLog      stdout/stderr chunks in the order they were read
 * @param errorType  "TIMEOUT" when the process was killed, else null
 */
public record ExecutionResult(
        int returnCode,
        List<IoLogRecord> ioLog,
        double elapsedSec,
        String errorType
) {
    public static final String TIMEOUT = "TIMEOUT";

    public boolean success() {
        return returnCode == 0 && errorType == null;
    }

    public byte[] stdout() {
        return collect(IoLogRecord.STDOUT);
    }

    public byte[] stderr() {
        return collect(IoLogRecord.STDERR);
    }

    private byte[] collect(String stream) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (IoLogRecord r : ioLog) {
            if (r.stream().equals(stream)) {
                out.writeBytes(r.data());
            }
        }
        return out.toByteArray();
    }
}
