package com.example.archiver;

import java.util.Optional;

/**
 * A started crawler container: the engine client process and, when it could be
 * identified, the container id behind it.
 */
public record LaunchedContainer(
        Process process,
        Optional<String> containerId,
        String label
) {
}
