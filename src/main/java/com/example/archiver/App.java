package com.example.archiver;

import com.example.archiver.strategy.AdaptationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

public final class App {
    private static final Logger LOGGER = LoggerFactory.getLogger(App.class);
    private static final String USAGE = "Usage: java -jar site-archiver.jar <config.json> [--dry-run] [-- <crawler args>...]";

    private App() {
    }

    public static void main(String[] args) {
        int exitCode;
        ShutdownHandler handler = null;
        try {
            CommandLine commandLine = CommandLine.parse(args);
            if (commandLine == null) {
                LOGGER.error(USAGE);
                System.exit(1);
                return;
            }
            ArchiverConfig config;
            try {
                config = new ConfigLoader().load(commandLine.configPath())
                        .withExtraPassthroughArgs(commandLine.crawlerArgs(), commandLine.dryRun());
            } catch (IllegalArgumentException | IOException ex) {
                LOGGER.error("Failed to load config {}: {}", commandLine.configPath(), ex.getMessage());
                System.exit(1);
                return;
            }

            CommandRunner runner = new CommandRunner();
            DockerCli runtime = new DockerCli(config.containerRuntime(), runner);
            Optional<String> version = runtime.version();
            if (version.isEmpty()) {
                LOGGER.error("Container runtime '{}' is not available. Ensure it is installed and running.",
                        config.containerRuntime());
                System.exit(1);
                return;
            }
            LOGGER.info("Using container runtime: {}", version.get());

            if (!prepareOutputDirectory(config.outputDirectory())) {
                System.exit(1);
                return;
            }
            if (Files.exists(config.finalArtifact()) && !config.overwrite()) {
                LOGGER.error("Final artifact {} already exists. Enable overwrite to rebuild it.", config.finalArtifact());
                System.exit(1);
                return;
            }
            if (config.dryRun()) {
                logDryRun(config);
                System.exit(0);
                return;
            }

            JobState state = JobState.open(config.outputDirectory(), config.initialWorkers());
            ShutdownSignal shutdown = new ShutdownSignal();
            Clock clock = Clock.systemUTC();
            ContainerSupervisor supervisor = new ContainerSupervisor(runtime, config.container(), shutdown);
            AdaptationEngine engine = AdaptationEngine.standard(config.adaptation(), runner, shutdown, clock);
            handler = new ShutdownHandler(shutdown, supervisor, Thread.currentThread());
            handler.install();

            StageOrchestrator orchestrator = new StageOrchestrator(config, state, supervisor, engine, shutdown,
                    clock, System.out);
            JobOutcome outcome = orchestrator.run();
            exitCode = outcome.isSuccess() ? 0 : 1;
        } catch (Exception ex) {
            LOGGER.error("Unhandled error in archiver", ex);
            exitCode = 2;
        }
        if (handler != null && !handler.disarm()) {
            // The JVM is already shutting down; System.exit would block on the running hook.
            return;
        }
        System.exit(exitCode);
    }

    private static boolean prepareOutputDirectory(Path outputDirectory) {
        Path probe = outputDirectory.resolve(".writable_test_" + ProcessHandle.current().pid());
        try {
            Files.createDirectories(outputDirectory);
            Files.writeString(probe, "test");
            Files.delete(probe);
            LOGGER.info("Output directory: {}", outputDirectory);
            return true;
        } catch (IOException ex) {
            LOGGER.error("Output directory {} is not writable", outputDirectory, ex);
            return false;
        }
    }

    private static void logDryRun(ArchiverConfig config) {
        List<String> args = ContainerSupervisor.buildArgs(config.passthroughArgs(),
                new ContainerSupervisor.RequiredArgs(config.seeds(), config.name()),
                config.initialWorkers(), false, List.of());
        LOGGER.info("Dry run. No container will be started.");
        LOGGER.info("  Name: {}", config.name());
        LOGGER.info("  Seeds: {}", config.seeds());
        LOGGER.info("  Output: {}", config.outputDirectory());
        LOGGER.info("  Image: {}", config.crawlerImage());
        LOGGER.info("  Initial workers: {}", config.initialWorkers());
        LOGGER.info("  Monitoring: {}", config.monitoring().enabled());
        LOGGER.info("  First stage command: {}", String.join(" ", args));
    }

    /**
     * {@code <config.json> [--dry-run] [-- <crawler args>...]}
     */
    record CommandLine(Path configPath, boolean dryRun, List<String> crawlerArgs) {
        static CommandLine parse(String[] args) {
            List<String> all = Arrays.asList(args);
            int separator = all.indexOf("--");
            List<String> own = separator < 0 ? all : all.subList(0, separator);
            List<String> crawlerArgs = separator < 0 ? List.of() : new ArrayList<>(all.subList(separator + 1, all.size()));
            Path configPath = null;
            boolean dryRun = false;
            for (String arg : own) {
                if (arg.equals("--dry-run")) {
                    dryRun = true;
                } else if (arg.startsWith("-") || configPath != null) {
                    return null;
                } else {
                    configPath = Path.of(arg);
                }
            }
            if (configPath == null) {
                return null;
            }
            return new CommandLine(configPath, dryRun, List.copyOf(crawlerArgs));
        }
    }
}
