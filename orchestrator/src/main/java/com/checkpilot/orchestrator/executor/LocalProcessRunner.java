package com.checkpilot.orchestrator.executor;

import com.checkpilot.orchestrator.executor.dto.ExecutionResult;
import com.checkpilot.orchestrator.model.IoLogRecord;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs commands as local child processes.
 *
 * Each of stdout and stderr is drained by its own reader task; both append
 * line-sized chunks to one shared log under its lock, so the log is ordered
 * by read time across the two streams.
 */
@Component
public class LocalProcessRunner implements ProcessRunner {

    private static final Logger log = LoggerFactory.getLogger(LocalProcessRunner.class);

    private static final int MAX_CHUNK = 8192;
    private static final long READER_GRACE_SEC = 10;

    private final ExecutorService readers = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "io-reader");
        t.setDaemon(true);
        return t;
    });

    @Override
    public ExecutionResult run(List<String> command, Map<String, String> environment,
                               Path workDir, Duration timeout) {
        ProcessBuilder pb = builder(command, environment, workDir);
        long start = System.nanoTime();
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new ExecutorException("Cannot start " + command.get(0), e);
        }
        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            log.debug("Could not close stdin of {}: {}", command.get(0), e.getMessage());
        }

        List<IoLogRecord> ioLog = new ArrayList<>();
        Future<?> out = readers.submit(() -> pump(process.getInputStream(), IoLogRecord.STDOUT, start, ioLog));
        Future<?> err = readers.submit(() -> pump(process.getErrorStream(), IoLogRecord.STDERR, start, ioLog));

        boolean timedOut = false;
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                timedOut = true;
                log.warn("Process {} exceeded {} s, killing it", process.pid(), timeout.toSeconds());
                process.destroyForcibly();
                process.waitFor();
            }
            awaitReader(out);
            awaitReader(err);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw abandon(process, "Interrupted while waiting for " + command.get(0), e);
        } catch (ExecutionException e) {
            out.cancel(true);
            err.cancel(true);
            throw abandon(process, "Output capture failed for " + command.get(0), e.getCause());
        }

        double elapsed = (System.nanoTime() - start) / 1e9;
        List<IoLogRecord> records;
        synchronized (ioLog) {
            records = List.copyOf(ioLog);
        }
        return new ExecutionResult(process.exitValue(), records, elapsed,
                timedOut ? ExecutionResult.TIMEOUT : null);
    }

    /** Kills a process whose run failed, so that it does not outlive the job. */
    static ExecutorException abandon(Process process, String message, Throwable cause) {
        process.destroyForcibly();
        return new ExecutorException(message, cause);
    }

    /** Background children may keep a pipe open after the process exits. */
    private static void awaitReader(Future<?> reader) throws InterruptedException, ExecutionException {
        try {
            reader.get(READER_GRACE_SEC, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            reader.cancel(true);
            log.warn("Output stream still open {} s after the process exited, giving up on it", READER_GRACE_SEC);
        }
    }

    @Override
    public void dispatch(List<String> command, Map<String, String> environment, Path workDir) {
        ProcessBuilder pb = builder(command, environment, workDir)
                .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                .redirectError(ProcessBuilder.Redirect.DISCARD);
        try {
            Process p = pb.start();
            log.info("Dispatched {} as pid {}", command.get(0), p.pid());
        } catch (IOException e) {
            throw new ExecutorException("Cannot start " + command.get(0), e);
        }
    }

    @PreDestroy
    public void shutdown() {
        readers.shutdownNow();
    }

    private static ProcessBuilder builder(List<String> command, Map<String, String> environment, Path workDir) {
        ProcessBuilder pb = new ProcessBuilder(command);
        if (workDir != null) {
            pb.directory(workDir.toFile());
        }
        pb.environment().clear();
        pb.environment().putAll(environment);
        return pb;
    }

    /** Reads {@code in} until EOF, one record per line (or per {@link #MAX_CHUNK} bytes). */
    private static Void pump(InputStream in, String stream, long start, List<IoLogRecord> ioLog) throws IOException {
        try (in) {
            ByteArrayOutputStream line = new ByteArrayOutputStream();
            int b;
            while ((b = in.read()) != -1) {
                line.write(b);
                if (b == '\n' || line.size() >= MAX_CHUNK) {
                    append(ioLog, stream, start, line);
                }
            }
            if (line.size() > 0) {
                append(ioLog, stream, start, line);
            }
        }
        return null;
    }

    private static void append(List<IoLogRecord> ioLog, String stream, long start, ByteArrayOutputStream line) {
        IoLogRecord r = new IoLogRecord((System.nanoTime() - start) / 1e9, stream, line.toByteArray());
        line.reset();
        synchronized (ioLog) {
            ioLog.add(r);
        }
    }
}
