package com.heritagesync.core.pipeline;

import com.heritagesync.core.config.PipelineConfig;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Options for one pipeline run.
 *
 * @param projectDir directory that relative input and output locations resolve against
 * @param config configuration, completed with defaults on construction
 * @param dryRun when true, everything runs except publication
 */
public record RunOptions(
    Path projectDir,
    PipelineConfig config,
    boolean dryRun
) {
    public RunOptions {
        Objects.requireNonNull(projectDir, "projectDir must not be null");
        config = config == null ? PipelineConfig.defaults() : config.withDefaults();
    }

    /**
     * Creates options with the default configuration.
     *
     * @param projectDir project directory
     * @return options publishing with defaults
     */
    public static RunOptions withDefaults(Path projectDir) {
        return new RunOptions(projectDir, PipelineConfig.defaults(), false);
    }
}
