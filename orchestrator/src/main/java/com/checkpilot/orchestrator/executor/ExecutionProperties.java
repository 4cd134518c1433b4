package com.checkpilot.orchestrator.executor;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.Map;

/**
 * {@code checkpilot.execution.*} settings.
 *
 * @param timeoutSec  wall clock limit of one job
 * @param shell       interpreter for job commands, invoked as {@code shell -c command}
 * @param environment site values for {@code environ} variables missing from the process environment
 */
@ConfigurationProperties(prefix = "checkpilot.execution")
public record ExecutionProperties(Integer timeoutSec, String shell, Map<String, String> environment) {

    public ExecutionProperties {
        if (timeoutSec == null) timeoutSec = 600;
        if (shell == null || shell.isBlank()) shell = "bash";
        environment = environment == null ? Map.of() : Map.copyOf(environment);
    }
}
