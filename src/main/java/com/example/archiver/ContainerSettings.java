package com.example.archiver;

import java.util.Optional;

/**
 * Resource limits applied to every crawler container.
 */
public record ContainerSettings(
        Optional<String> shmSize,
        Optional<String> memoryLimit,
        Optional<String> cpuLimit
) {
    public static ContainerSettings unlimited() {
        return new ContainerSettings(Optional.empty(), Optional.empty(), Optional.empty());
    }
}
