package com.checkpilot.orchestrator.catalog;

import java.nio.file.Path;

/**
 * A loaded provider: one namespace of units plus an optional directory of
 * executables put on the search path of its jobs.
 *
 * @param binDir null when the provider ships no executables
 */
public record Provider(String namespace, String name, String version, Path root, Path binDir) {}
