package com.example.archiver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link ContainerRuntime} backed by the docker command line client.
 */
public class DockerCli implements ContainerRuntime {
    private static final Logger LOGGER = LoggerFactory.getLogger(DockerCli.class);
    private static final Duration QUERY_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration STOP_COMMAND_TIMEOUT = Duration.ofSeconds(120);
    private static final Duration KILL_TIMEOUT = Duration.ofSeconds(30);
    private static final Duration UTILITY_TIMEOUT = Duration.ofMinutes(30);

    private final String executable;
    private final CommandRunner runner;

    public DockerCli(String executable, CommandRunner runner) {
        this.executable = executable;
        this.runner = runner;
    }

    @Override
    public Optional<String> version() {
        try {
            CommandResult result = runner.run(List.of(executable, "--version"), QUERY_TIMEOUT);
            if (result.success()) {
                return Optional.of(result.stdout().trim());
            }
            LOGGER.error("'{} --version' failed (rc={}): {}", executable, result.exitCode(), result.stderr().trim());
        } catch (IOException ex) {
            LOGGER.error("Container runtime '{}' not found or not executable: {}", executable, ex.getMessage());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
        return Optional.empty();
    }

    @Override
    public Process run(ContainerLaunch launch) throws IOException {
        return runner.start(runCommand(launch));
    }

    List<String> runCommand(ContainerLaunch launch) {
        List<String> command = new ArrayList<>();
        command.add(executable);
        command.add("run");
        command.add("--rm");
        command.add("-v");
        command.add(launch.hostDirectory().toAbsolutePath() + ":" + launch.containerDirectory());
        command.add("--label");
        command.add(launch.label());
        ContainerSettings limits = launch.limits();
        limits.shmSize().ifPresent(size -> {
            command.add("--shm-size");
            command.add(size);
        });
        if (launch.runAsRoot()) {
            command.add("--user");
            command.add("0:0");
        }
        limits.memoryLimit().ifPresent(memory -> {
            command.add("--memory");
            command.add(memory);
            command.add("--memory-swap");
            command.add(memory);
            command.add("--memory-swappiness");
            command.add("10");
        });
        limits.cpuLimit().ifPresent(cpus -> {
            command.add("--cpus");
            command.add(cpus);
        });
        command.add(launch.image());
        command.addAll(launch.args());
        return command;
    }

    @Override
    public Optional<String> findByLabel(String label) {
        return firstLine(List.of(executable, "ps", "-q", "--filter", "label=" + label));
    }

    @Override
    public boolean isRunning(String containerId) {
        return firstLine(List.of(executable, "ps", "-q", "--filter", "id=" + containerId)).isPresent();
    }

    private Optional<String> firstLine(List<String> command) {
        try {
            CommandResult result = runner.run(command, QUERY_TIMEOUT);
            if (!result.success()) {
                LOGGER.debug("'{}' failed (rc={}): {}", String.join(" ", command), result.exitCode(), result.stderr().trim());
                return Optional.empty();
            }
            return result.stdout().lines()
                    .map(String::trim)
                    .filter(line -> !line.isEmpty())
                    .findFirst();
        } catch (IOException ex) {
            LOGGER.warn("Could not query container runtime: {}", ex.getMessage());
            return Optional.empty();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }

    @Override
    public Process followLogs(String containerId, int tailLines) throws IOException {
        return runner.start(List.of(executable, "logs", "-f", "--tail", Integer.toString(tailLines), containerId));
    }

    @Override
    public boolean stop(String containerId, Duration gracePeriod) {
        List<String> command = List.of(executable, "stop", "-t", Long.toString(gracePeriod.toSeconds()), containerId);
        try {
            CommandResult result = runner.run(command, STOP_COMMAND_TIMEOUT);
            if (result.success()) {
                return true;
            }
            if (result.stderr().contains("No such container")) {
                LOGGER.info("Container {} already gone.", containerId);
                return true;
            }
            LOGGER.error("Failed to stop container {} (rc={}): {}", containerId, result.exitCode(), result.stderr().trim());
        } catch (IOException ex) {
            LOGGER.error("Could not run stop for container {}", containerId, ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
        return false;
    }

    @Override
    public boolean kill(String containerId) {
        try {
            CommandResult result = runner.run(List.of(executable, "kill", containerId), KILL_TIMEOUT);
            if (result.success()) {
                return true;
            }
            if (result.stderr().contains("No such container")) {
                LOGGER.warn("Container {} not found during kill. Assumed stopped.", containerId);
                return true;
            }
            LOGGER.error("Failed to kill container {} (rc={}): {}", containerId, result.exitCode(), result.stderr().trim());
            return false;
        } catch (IOException ex) {
            LOGGER.error("Could not run kill for container {}", containerId, ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
        return false;
    }

    @Override
    public int runUtility(String image, Path hostDirectory, String containerDirectory, List<String> command)
            throws IOException, InterruptedException {
        List<String> full = new ArrayList<>();
        full.add(executable);
        full.add("run");
        full.add("--rm");
        full.add("-v");
        full.add(hostDirectory.toAbsolutePath() + ":" + containerDirectory);
        full.add(image);
        full.addAll(command);
        CommandResult result = runner.run(full, UTILITY_TIMEOUT);
        if (!result.success()) {
            LOGGER.warn("Utility container {} exited with {}: {}", image, result.exitCode(), result.stderr().trim());
        }
        return result.exitCode();
    }
}
