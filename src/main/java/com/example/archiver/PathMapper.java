package com.example.archiver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Translates paths between the host output directory and its mount point inside the container.
 */
public final class PathMapper {
    private static final Logger LOGGER = LoggerFactory.getLogger(PathMapper.class);

    private final Path hostRoot;
    private final String containerRoot;

    public PathMapper(Path hostOutputDirectory) {
        this(hostOutputDirectory, ContainerSupervisor.CONTAINER_OUTPUT_DIR);
    }

    PathMapper(Path hostOutputDirectory, String containerRoot) {
        this.hostRoot = canonical(hostOutputDirectory);
        this.containerRoot = containerRoot;
    }

    /**
     * Maps a host path inside the output directory to its container path. Empty when the
     * path lies outside the output directory.
     */
    public Optional<String> toContainer(Path hostPath) {
        Path resolved = canonical(hostPath);
        if (!resolved.startsWith(hostRoot)) {
            LOGGER.error("Path {} is not within output directory {}.", hostPath, hostRoot);
            return Optional.empty();
        }
        Path relative = hostRoot.relativize(resolved);
        if (relative.toString().isEmpty()) {
            return Optional.of(containerRoot);
        }
        StringBuilder container = new StringBuilder(containerRoot);
        for (Path part : relative) {
            container.append('/').append(part);
        }
        return Optional.of(container.toString());
    }

    /**
     * Maps a container path (as printed by the crawler) back to the host. Relative paths
     * that start with the mount name are read as absolute. A path outside the mount falls
     * back to a directory of the same name directly under the output directory.
     */
    public Optional<Path> toHost(String containerPath) {
        String normalized = containerPath.strip().replace('\\', '/');
        String mountName = containerRoot.substring(containerRoot.lastIndexOf('/') + 1);
        if (!normalized.startsWith("/")) {
            if (!normalized.startsWith(mountName)) {
                LOGGER.warn("Cannot convert relative container path: {}", containerPath);
                return Optional.empty();
            }
            normalized = "/" + normalized;
        }
        if (normalized.equals(containerRoot)) {
            return Optional.of(hostRoot);
        }
        if (!normalized.startsWith(containerRoot + "/")) {
            LOGGER.warn("Path '{}' is not under '{}'. Attempting name-based lookup.", normalized, containerRoot);
            String name = normalized.substring(normalized.lastIndexOf('/') + 1);
            if (name.isEmpty()) {
                return Optional.empty();
            }
            Path candidate = hostRoot.resolve(name);
            return Files.isDirectory(candidate) ? Optional.of(candidate) : Optional.empty();
        }
        Path host = hostRoot;
        for (String part : normalized.substring(containerRoot.length() + 1).split("/")) {
            if (part.isEmpty() || part.equals(".")) {
                continue;
            }
            if (part.equals("..")) {
                LOGGER.warn("Refusing container path with parent segments: {}", containerPath);
                return Optional.empty();
            }
            host = host.resolve(part);
        }
        return Optional.of(host);
    }

    public Path hostRoot() {
        return hostRoot;
    }

    private static Path canonical(Path path) {
        try {
            return path.toRealPath();
        } catch (IOException ex) {
            return path.toAbsolutePath().normalize();
        }
    }
}
