package com.example.archiver;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Immutable runtime settings for one archiving job.
 */
public record ArchiverConfig(
        List<String> seeds,
        String name,
        Path outputDirectory,
        int initialWorkers,
        String crawlerImage,
        String containerRuntime,
        List<String> passthroughArgs,
        boolean cleanup,
        boolean overwrite,
        boolean dryRun,
        boolean relaxPermissions,
        int maxStageAttempts,
        int backoffDelayMinutes,
        MonitorSettings monitoring,
        AdaptationSettings adaptation,
        ContainerSettings container
) {
    public static final String FINAL_ARTIFACT_EXTENSION = ".zim";

    /**
     * Location of the consolidated output produced by the final build stage.
     */
    public Path finalArtifact() {
        return outputDirectory.resolve(name + FINAL_ARTIFACT_EXTENSION);
    }

    /**
     * Returns a copy with extra crawler arguments appended after the configured ones.
     */
    public ArchiverConfig withExtraPassthroughArgs(List<String> extra, boolean forceDryRun) {
        List<String> merged = new ArrayList<>(passthroughArgs);
        merged.addAll(extra);
        return new ArchiverConfig(
                seeds,
                name,
                outputDirectory,
                ConfigLoader.effectiveInitialWorkers(initialWorkers, merged),
                crawlerImage,
                containerRuntime,
                List.copyOf(merged),
                cleanup,
                overwrite,
                dryRun || forceDryRun,
                relaxPermissions,
                maxStageAttempts,
                backoffDelayMinutes,
                monitoring,
                adaptation,
                container
        );
    }
}
