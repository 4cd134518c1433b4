package com.checkpilot.orchestrator.executor;

import com.checkpilot.orchestrator.catalog.Provider;
import com.checkpilot.orchestrator.catalog.ProviderRegistry;
import com.checkpilot.orchestrator.executor.dto.ExecutionResult;
import com.checkpilot.orchestrator.model.JobDefinition;
import com.checkpilot.orchestrator.model.Outcome;
import com.checkpilot.orchestrator.model.Plugin;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Runs one job and maps what happened to an outcome.
 *
 * <ul>
 *   <li>shell, attachment, resource, local, user-interact: return code 0 is
 *       a pass, anything else a fail</li>
 *   <li>user-interact-verify: the command runs, then the operator decides
 *       (undecided) unless the command failed</li>
 *   <li>manual: nothing runs, undecided</li>
 *   <li>qml: not supported by this runner</li>
 * </ul>
 *
 * Every job gets a fresh working directory; files left there are reported
 * unless the job has the {@code has-leftovers} flag. Jobs with a
 * {@code user} are run through {@code sudo} with an explicit environment
 * and a search path limited to their own provider's executables.
 */
@Component
public class ExecutionController {

    private static final Logger log = LoggerFactory.getLogger(ExecutionController.class);

    public static final String SESSION_SHARE_VAR = "CHECKPILOT_SESSION_SHARE";
    static final String DEFAULT_PATH = "/usr/local/sbin:/usr/local/bin:/usr/sbin:/usr/bin:/sbin:/bin";
    static final String C_LOCALE = "C.UTF-8";

    private final ProcessRunner       runner;
    private final ProviderRegistry    registry;
    private final ExecutionProperties properties;
    private final MeterRegistry       meterRegistry;
    private final Map<String, String> processEnvironment;

    @Autowired
    public ExecutionController(ProcessRunner runner,
                               ProviderRegistry registry,
                               ExecutionProperties properties,
                               MeterRegistry meterRegistry) {
        this(runner, registry, properties, meterRegistry, System.getenv());
    }

    ExecutionController(ProcessRunner runner,
                        ProviderRegistry registry,
                        ExecutionProperties properties,
                        MeterRegistry meterRegistry,
                        Map<String, String> processEnvironment) {
        this.runner             = runner;
        this.registry           = registry;
        this.properties         = properties;
        this.meterRegistry      = meterRegistry;
        this.processEnvironment = Map.copyOf(processEnvironment);
    }

    // ------------------------------------------------------------------
    // Entry points
    // ------------------------------------------------------------------

    /**
     * Run {@code job} to completion. Never throws for job-level failures:
     * a process that cannot be started or times out is a {@code fail}.
     */
    public JobExecution execute(JobDefinition job, ExecutionContext context) {
        Plugin plugin = job.getPlugin();
        if (plugin == Plugin.QML) {
            return JobExecution.withoutProcess(Outcome.NOT_SUPPORTED, "qml jobs are not supported by this runner");
        }
        if (plugin == Plugin.MANUAL) {
            return JobExecution.withoutProcess(Outcome.UNDECIDED, null);
        }
        if (job.getCommand() == null) {
            if (plugin == Plugin.USER_INTERACT_VERIFY) {
                return JobExecution.withoutProcess(Outcome.UNDECIDED, null);
            }
            return JobExecution.withoutProcess(Outcome.FAIL, "job has no command to run");
        }

        Map<String, String> env = buildEnvironment(job, context);
        List<String> command = buildCommand(job, env);
        Path workDir;
        try {
            workDir = createWorkDir(job);
        } catch (UncheckedIOException e) {
            log.error("Job {} not started: {}", job.id(), e.getMessage());
            return JobExecution.withoutProcess(Outcome.FAIL, e.getMessage());
        }
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            ExecutionResult result;
            try {
                result = runner.run(command, launcherEnvironment(job, env), workDir,
                        Duration.ofSeconds(properties.timeoutSec()));
            } catch (ExecutorException e) {
                log.error("Job {} could not be started: {}", job.id(), e.getMessage());
                return JobExecution.withoutProcess(Outcome.FAIL, e.getMessage());
            }

            List<String> comments = new ArrayList<>();
            boolean timedOut = ExecutionResult.TIMEOUT.equals(result.errorType());
            if (timedOut) {
                comments.add("job timed out after " + properties.timeoutSec() + " s");
            }
            List<String> leftovers = leftovers(workDir);
            if (!leftovers.isEmpty() && !job.hasFlag(JobDefinition.FLAG_HAS_LEFTOVERS)) {
                log.warn("Job {} left files behind: {}", job.id(), leftovers);
                comments.add("job left files behind: " + String.join(", ", leftovers));
            }

            Outcome outcome = outcomeFor(plugin, result);
            log.info("Job {} finished: return code {}, outcome {}, {} s",
                    job.id(), result.returnCode(), outcome.value(), String.format("%.2f", result.elapsedSec()));
            return new JobExecution(outcome, result.returnCode(), result.ioLog(),
                    comments.isEmpty() ? null : String.join("; ", comments), result.elapsedSec(), timedOut);
        } finally {
            sample.stop(meterRegistry.timer("checkpilot.job.duration", "plugin", plugin.value()));
            deleteTree(workDir);
        }
    }

    /**
     * Start a {@code noreturn} job and return without waiting for it. The
     * caller must have checkpointed before calling this.
     *
     * @throws ExecutorException if the process cannot be started
     */
    public void dispatch(JobDefinition job, ExecutionContext context) {
        if (job.getCommand() == null) {
            throw new ExecutorException("Job " + job.id() + " has no command to dispatch");
        }
        Map<String, String> env = buildEnvironment(job, context);
        runner.dispatch(buildCommand(job, env), launcherEnvironment(job, env), context.shareDir());
    }

    // ------------------------------------------------------------------
    // Environment and command line
    // ------------------------------------------------------------------

    /**
     * Environment the job's command sees.
     *
     * Unprivileged jobs inherit the process environment; jobs with a
     * {@code user} only get PATH, locale, the session share and their
     * {@code environ} variables. An {@code environ} variable missing from
     * the process environment is taken from the site configuration.
     */
    Map<String, String> buildEnvironment(JobDefinition job, ExecutionContext context) {
        Map<String, String> env = new LinkedHashMap<>();
        if (!job.isPrivileged()) {
            env.putAll(processEnvironment);
        }
        for (String name : job.getEnviron()) {
            String value = processEnvironment.get(name);
            if (value == null) {
                value = properties.environment().get(name);
            }
            if (value != null) {
                env.put(name, value);
            }
        }
        if (!job.hasFlag(JobDefinition.FLAG_PRESERVE_LOCALE)) {
            env.put("LANG", C_LOCALE);
            env.put("LC_ALL", C_LOCALE);
        } else if (job.isPrivileged()) {
            copyIfSet(env, "LANG");
            copyIfSet(env, "LC_ALL");
        }
        env.put("PATH", searchPath(job));
        if (context.shareDir() != null) {
            env.put(SESSION_SHARE_VAR, context.shareDir().toString());
        }
        return env;
    }

    private void copyIfSet(Map<String, String> env, String name) {
        String value = processEnvironment.get(name);
        if (value != null) env.put(name, value);
    }

    private String searchPath(JobDefinition job) {
        List<String> dirs = new ArrayList<>();
        if (job.isPrivileged()) {
            registry.binDirFor(job.namespace()).ifPresent(p -> dirs.add(p.toString()));
        } else {
            for (Provider p : registry.providers()) {
                if (p.binDir() != null) dirs.add(p.binDir().toString());
            }
        }
        dirs.add(processEnvironment.getOrDefault("PATH", DEFAULT_PATH));
        return String.join(":", dirs);
    }

    /** {@code shell -c command}, prefixed with {@code sudo -n -u user env K=V...} for privileged jobs. */
    List<String> buildCommand(JobDefinition job, Map<String, String> env) {
        List<String> cmd = new ArrayList<>();
        if (job.isPrivileged()) {
            cmd.addAll(List.of("sudo", "-n", "-u", job.getUser(), "env"));
            env.forEach((k, v) -> cmd.add(k + "=" + v));
        }
        cmd.addAll(List.of(properties.shell(), "-c", job.getCommand()));
        return cmd;
    }

    /** The launcher of a privileged job runs with our own environment, the job gets {@code env} through sudo. */
    private Map<String, String> launcherEnvironment(JobDefinition job, Map<String, String> env) {
        return job.isPrivileged() ? processEnvironment : env;
    }

    static Outcome outcomeFor(Plugin plugin, ExecutionResult result) {
        boolean ok = result.success();
        return switch (plugin) {
            case USER_INTERACT_VERIFY -> ok ? Outcome.UNDECIDED : Outcome.FAIL;
            case MANUAL -> Outcome.UNDECIDED;
            case QML    -> Outcome.NOT_SUPPORTED;
            default     -> ok ? Outcome.PASS : Outcome.FAIL;
        };
    }

    // ------------------------------------------------------------------
    // Working directory
    // ------------------------------------------------------------------

    private static Path createWorkDir(JobDefinition job) {
        try {
            return Files.createTempDirectory("checkpilot-" + job.partialId().replaceAll("[^A-Za-z0-9._-]", "_") + "-");
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create working directory for " + job.id(), e);
        }
    }

    private static List<String> leftovers(Path dir) {
        try (Stream<Path> s = Files.list(dir)) {
            return s.map(p -> p.getFileName().toString()).sorted().toList();
        } catch (IOException e) {
            log.warn("Could not inspect working directory {}: {}", dir, e.getMessage());
            return List.of();
        }
    }

    private static void deleteTree(Path dir) {
        try {
            Files.walkFileTree(dir, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                    Files.delete(file);
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult postVisitDirectory(Path d, IOException exc) throws IOException {
                    Files.delete(d);
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            log.warn("Could not remove working directory {}: {}", dir, e.getMessage());
        }
    }
}
