package com.example.archiver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Starts, identifies and stops crawler containers. Holds the container currently in
 * flight so the shutdown hook can reach it.
 */
public class ContainerSupervisor {
    private static final Logger LOGGER = LoggerFactory.getLogger(ContainerSupervisor.class);

    public static final String CONTAINER_OUTPUT_DIR = "/output";
    static final String CRAWLER_COMMAND = "zimit";
    static final String JOB_LABEL_KEY = "archive_job";
    static final List<String> FINAL_BUILD_ARG_PREFIXES = List.of(
            "--name", "--title", "--description", "--long-description", "--zim-lang",
            "--custom-css", "--adminEmail", "--favicon", "--warcPrefix", "--lang"
    );
    private static final int IDENTIFY_ATTEMPTS = 5;
    private static final Duration DEFAULT_IDENTIFY_INTERVAL = Duration.ofSeconds(3);
    private static final Duration STOP_GRACE_PERIOD = Duration.ofSeconds(90);
    private static final int EARLY_OUTPUT_LIMIT = 8192;

    private final ContainerRuntime runtime;
    private final ContainerSettings limits;
    private final ShutdownSignal shutdown;
    private final Duration identifyInterval;
    private volatile LaunchedContainer current;

    public ContainerSupervisor(ContainerRuntime runtime, ContainerSettings limits, ShutdownSignal shutdown) {
        this(runtime, limits, shutdown, DEFAULT_IDENTIFY_INTERVAL);
    }

    ContainerSupervisor(ContainerRuntime runtime, ContainerSettings limits, ShutdownSignal shutdown,
                        Duration identifyInterval) {
        this.runtime = runtime;
        this.limits = limits;
        this.shutdown = shutdown;
        this.identifyInterval = identifyInterval;
    }

    /**
     * Arguments every crawl invocation carries.
     */
    public record RequiredArgs(List<String> seeds, String name) {
    }

    /**
     * Assembles the crawler command line. The job name and worker count from the base
     * arguments are replaced by the required name and {@code workerCount}, and the output
     * location is always the mounted container directory.
     */
    public static List<String> buildArgs(List<String> baseArgs, RequiredArgs required, int workerCount,
                                         boolean finalBuild, List<String> extraArgs) {
        List<String> args = new ArrayList<>();
        args.add(CRAWLER_COMMAND);
        if (!finalBuild && !required.seeds().isEmpty()) {
            args.add("--seeds");
            args.add(String.join(",", required.seeds()));
        }
        args.add("--name");
        args.add(required.name());
        if (!finalBuild) {
            args.add("--workers");
            args.add(Integer.toString(workerCount));
        }
        args.addAll(withoutOption(withoutOption(baseArgs, "--workers"), "--name"));
        args.addAll(extraArgs);
        if (!args.contains("--keep")) {
            args.add("--keep");
        }
        List<String> result = new ArrayList<>(withoutOption(args, "--output"));
        result.add("--output");
        result.add(CONTAINER_OUTPUT_DIR);
        return result;
    }

    /**
     * Drops {@code option} in both its {@code --opt value} and {@code --opt=value} forms.
     */
    private static List<String> withoutOption(List<String> args, String option) {
        List<String> kept = new ArrayList<>();
        for (int i = 0; i < args.size(); i++) {
            String arg = args.get(i);
            if (arg.equals(option)) {
                if (i + 1 < args.size() && !args.get(i + 1).startsWith("-")) {
                    i++;
                }
                continue;
            }
            if (arg.startsWith(option + "=")) {
                continue;
            }
            kept.add(arg);
        }
        return kept;
    }

    /**
     * Keeps only the metadata flags (and their values) that still apply when building
     * the final artifact from existing WARCs.
     */
    public static List<String> filterArgsForFinalBuild(List<String> passthroughArgs) {
        List<String> filtered = new ArrayList<>();
        int i = 0;
        while (i < passthroughArgs.size()) {
            String arg = passthroughArgs.get(i);
            boolean keep = FINAL_BUILD_ARG_PREFIXES.stream().anyMatch(arg::startsWith);
            boolean hasSeparateValue = arg.startsWith("--") && !arg.contains("=")
                    && i + 1 < passthroughArgs.size() && !passthroughArgs.get(i + 1).startsWith("-");
            if (keep) {
                filtered.add(arg);
                if (hasSeparateValue) {
                    filtered.add(passthroughArgs.get(i + 1));
                }
            }
            i += hasSeparateValue ? 2 : 1;
        }
        LOGGER.debug("Filtered arguments for final build: {}", filtered);
        return filtered;
    }

    /**
     * Launches a labeled crawler container and tries to identify it. A launch that cannot
     * start at all throws; a container that cannot be identified comes back without an id.
     */
    public LaunchedContainer start(String image, Path outputDirectory, List<String> args, String jobName,
                                   boolean runAsRoot) throws IOException {
        String jobId = "archive-" + jobName + "-" + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        String label = JOB_LABEL_KEY + "=" + jobId;
        ContainerLaunch launch = new ContainerLaunch(image, outputDirectory, CONTAINER_OUTPUT_DIR, label,
                List.copyOf(args), limits, runAsRoot);
        LOGGER.info("Starting container (Job ID: {}): {} {}", jobId, image, String.join(" ", args));
        Process process = runtime.run(launch);
        current = new LaunchedContainer(process, Optional.empty(), label);

        Optional<String> containerId = Optional.empty();
        for (int attempt = 1; attempt <= IDENTIFY_ATTEMPTS; attempt++) {
            if (shutdown.await(identifyInterval)) {
                break;
            }
            containerId = runtime.findByLabel(label);
            if (containerId.isPresent()) {
                break;
            }
            LOGGER.debug("Attempt {}: container id not found yet for job {}.", attempt, jobId);
        }

        if (containerId.isPresent()) {
            LOGGER.info("Identified running container ID: {}", containerId.get());
        } else {
            LOGGER.warn("Could not identify running container using label {}.", label);
            if (!process.isAlive()) {
                LOGGER.error("Container process exited prematurely with code {}. Output: {}",
                        process.exitValue(), earlyOutput(process));
            }
        }
        LaunchedContainer launched = new LaunchedContainer(process, containerId, label);
        current = launched;
        return launched;
    }

    /**
     * Reads what an exited client printed. The stream stays open for the stage log drain.
     */
    private static String earlyOutput(Process process) {
        try {
            InputStream in = process.getInputStream();
            return new String(in.readNBytes(EARLY_OUTPUT_LIMIT), StandardCharsets.UTF_8).trim();
        } catch (IOException ex) {
            return "<unavailable: " + ex.getMessage() + ">";
        }
    }

    /**
     * Stops a container gracefully, killing it when the graceful stop fails.
     */
    public boolean stop(String containerId) {
        LOGGER.info("Stopping container {} (grace period {}s)...", containerId, STOP_GRACE_PERIOD.toSeconds());
        boolean stopped = runtime.stop(containerId, STOP_GRACE_PERIOD);
        if (!stopped) {
            LOGGER.warn("Attempting to force-kill container {}...", containerId);
            stopped = runtime.kill(containerId);
        }
        LaunchedContainer inFlight = current;
        if (inFlight != null && inFlight.containerId().filter(containerId::equals).isPresent()) {
            current = null;
        }
        return stopped;
    }

    /**
     * Stops the container behind {@code launched}, looking it up by label when it was never
     * identified. Returns false when no container could be found.
     */
    public boolean stopLaunched(LaunchedContainer launched) {
        Optional<String> containerId = launched.containerId();
        if (containerId.isEmpty()) {
            containerId = runtime.findByLabel(launched.label());
        }
        if (containerId.isEmpty()) {
            LOGGER.warn("No container found for label {}.", launched.label());
            return false;
        }
        return stop(containerId.get());
    }

    /**
     * Waits for the engine client to exit, escalating from a plain wait to terminate
     * and then to a forced kill. Returns true once the process is gone.
     */
    public boolean ensureExited(Process process, String reason) {
        if (!process.isAlive()) {
            return true;
        }
        try {
            if (process.waitFor(15, TimeUnit.SECONDS)) {
                return true;
            }
            LOGGER.warn("Container process still alive after {}; terminating.", reason);
            process.destroy();
            if (process.waitFor(10, TimeUnit.SECONDS)) {
                return true;
            }
            LOGGER.error("Container process ignored terminate after {}; killing.", reason);
            process.destroyForcibly();
            return process.waitFor(5, TimeUnit.SECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            return !process.isAlive();
        }
    }

    public Optional<LaunchedContainer> current() {
        return Optional.ofNullable(current);
    }

    /**
     * Forgets {@code launched} once its process has been reaped.
     */
    public void release(LaunchedContainer launched) {
        if (current == launched) {
            current = null;
        }
    }

    public ContainerRuntime runtime() {
        return runtime;
    }
}
