package com.example.archiver;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * The operations the orchestrator needs from a container engine.
 */
public interface ContainerRuntime {

    /**
     * Returns the engine version string, or empty when the engine is unavailable.
     */
    Optional<String> version();

    /**
     * Starts a labeled, detached container bound to a host directory. The returned
     * process is the engine client; its stdout carries the container's combined output.
     */
    Process run(ContainerLaunch launch) throws IOException;

    /**
     * Looks up a running container by its label ({@code key=value}).
     */
    Optional<String> findByLabel(String label);

    /**
     * Independent liveness probe. Returns false when the probe itself fails.
     */
    boolean isRunning(String containerId);

    /**
     * Follows the container's combined output stream until it exits.
     */
    Process followLogs(String containerId, int tailLines) throws IOException;

    /**
     * Requests a graceful stop. Returns true if the container is stopped or already gone.
     */
    boolean stop(String containerId, Duration gracePeriod);

    boolean kill(String containerId);

    /**
     * Runs a short-lived helper container to completion and returns its exit code.
     */
    int runUtility(String image, Path hostDirectory, String containerDirectory, List<String> command)
            throws IOException, InterruptedException;
}
