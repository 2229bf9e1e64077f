package com.example.archiver;

import java.nio.file.Path;
import java.util.List;

/**
 * Everything needed to start one crawler container.
 */
public record ContainerLaunch(
        String image,
        Path hostDirectory,
        String containerDirectory,
        String label,
        List<String> args,
        ContainerSettings limits,
        boolean runAsRoot
) {
}
