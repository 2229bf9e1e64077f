package com.example.archiver;

import com.example.archiver.strategy.AdaptationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Drives one archiving job from mode selection through crawl attempts to the final
 * consolidated build, then summarizes and optionally cleans up.
 */
public final class StageOrchestrator {
    private static final Logger LOGGER = LoggerFactory.getLogger(StageOrchestrator.class);

    static final Set<Integer> ACCEPTABLE_EXIT_CODES = Set.of(16, 32, 33);
    static final int EVENT_QUEUE_CAPACITY = 64;
    static final String FINAL_BUILD_STAGE = "Final Build from WARCs";
    static final String PERMISSIONS_IMAGE = "alpine";
    private static final Duration LOOP_POLL = Duration.ofSeconds(1);
    private static final Duration DRAIN_JOIN_TIMEOUT = Duration.ofSeconds(5);
    private static final Duration MONITOR_STOP_TIMEOUT = Duration.ofSeconds(5);
    private static final Duration STATUS_PRINT_INTERVAL = Duration.ofSeconds(60);

    private final ArchiverConfig config;
    private final JobState state;
    private final ContainerSupervisor supervisor;
    private final AdaptationEngine engine;
    private final ShutdownSignal shutdown;
    private final Clock clock;
    private final ArtifactLocator locator;
    private final PathMapper mapper;
    private final CrawlLogParser logParser = new CrawlLogParser();
    private final StatusReporter reporter;
    private final ContainerSupervisor.RequiredArgs requiredArgs;

    public StageOrchestrator(ArchiverConfig config, JobState state, ContainerSupervisor supervisor,
                             AdaptationEngine engine, ShutdownSignal shutdown, Clock clock, PrintStream console) {
        this.config = config;
        this.state = state;
        this.supervisor = supervisor;
        this.engine = engine;
        this.shutdown = shutdown;
        this.clock = clock;
        this.locator = new ArtifactLocator(state.outputDirectory());
        this.mapper = new PathMapper(state.outputDirectory());
        this.reporter = new StatusReporter(console, config.adaptation());
        this.requiredArgs = new ContainerSupervisor.RequiredArgs(config.seeds(), config.name());
    }

    public JobOutcome run() {
        Instant startedAt = clock.instant();
        RunMode mode = selectMode();
        LOGGER.info("Entering main crawl loop with stage '{}'.", mode.stageName());
        JobOutcome outcome = crawl(mode);
        if (outcome.isSuccess()) {
            if (shutdown.isSet()) {
                LOGGER.warn("Skipping final build stage because shutdown was requested.");
                outcome = JobOutcome.STOPPED;
            } else {
                LOGGER.info("Crawl phase successful. Proceeding to final WARC consolidation.");
                outcome = finalBuild();
            }
        } else {
            LOGGER.error("Skipping final build stage because the crawl phase did not succeed ({}).", outcome);
        }
        summarize(outcome, startedAt);
        return outcome;
    }

    /**
     * Decides how the first stage starts from what earlier runs left in the output directory.
     */
    RunMode selectMode() {
        List<Path> known = state.tempDirs();
        for (Path discovered : locator.discoverTempDirs()) {
            if (!known.contains(discovered)) {
                state.addTempDir(discovered);
            }
        }
        List<Path> tempDirs = state.tempDirs();
        LOGGER.debug("Temp directories managed by state: {}", tempDirs);

        Optional<Path> resumeConfig = locator.locateResumeConfig(tempDirs);
        resumeConfig.ifPresent(path -> LOGGER.info("Found resume config YAML: {}", path));
        List<Path> warcs = tempDirs.isEmpty() ? List.of() : locator.findWarcs(tempDirs);
        if (resumeConfig.isPresent() || !warcs.isEmpty()) {
            logLastKnownStats();
        }

        if (config.overwrite() && Files.exists(config.finalArtifact())) {
            LOGGER.warn("Target artifact exists and overwrite is enabled: {}", config.finalArtifact());
            LOGGER.warn("Resetting persistent state for a completely fresh crawl.");
            state.resetForOverwrite();
            return RunMode.FRESH;
        }
        if (resumeConfig.isPresent()) {
            LOGGER.info("Run mode: RESUME crawl using {}. {} earlier WARC file(s) will join the final build.",
                    resumeConfig.get().getFileName(), warcs.size());
            logCounters();
            return RunMode.RESUME;
        }
        if (!warcs.isEmpty()) {
            LOGGER.info("Run mode: NEW crawl phase, consolidating {} earlier WARC file(s).", warcs.size());
            logCounters();
            return RunMode.NEW_PHASE_WITH_CONSOLIDATION;
        }
        LOGGER.info("Run mode: FRESH crawl. No resume config and no earlier WARCs found.");
        state.resetAdaptationCounts();
        logCounters();
        return RunMode.FRESH;
    }

    private void logLastKnownStats() {
        Optional<Path> latestLog = logParser.newestLog(state.outputDirectory(), "archive_*.combined.log");
        Optional<CrawlStats> stats = latestLog.flatMap(logParser::lastStats);
        if (stats.isPresent()) {
            LOGGER.info("Last known status from logs: Crawled={}/{}, Failed={}",
                    stats.get().crawled(), stats.get().total(),
                    stats.get().failed() == null ? "-" : stats.get().failed());
        } else {
            LOGGER.info("No stats parsed from previous runs.");
        }
    }

    private void logCounters() {
        LOGGER.info("Current state: Workers={}, VPN Rotations={}, Worker Reductions={}, Restarts={}",
                state.currentWorkers(), state.vpnRotationsDone(), state.workerReductionsDone(),
                state.containerRestartsDone());
    }

    private JobOutcome crawl(RunMode mode) {
        String stageName = mode.stageName();
        int attempt = 1;
        while (!shutdown.isSet()) {
            StageOutcome outcome = runAttempt(stageName, attempt);
            switch (outcome) {
                case SUCCESS:
                    return JobOutcome.SUCCESS;
                case STOPPED:
                    LOGGER.warn("Stage stopped by shutdown request. Cannot continue.");
                    return JobOutcome.STOPPED;
                case STOPPED_FOR_ADAPTATION:
                    stageName = RunMode.RESUME.stageName();
                    LOGGER.info("Stage stopped for adaptation. Next stage will be '{}' (Attempt {}).", stageName, attempt);
                    break;
                case FAILED:
                default:
                    if (attempt >= config.maxStageAttempts()) {
                        LOGGER.error("Maximum number of stage attempts ({}) reached after failure. Aborting.",
                                config.maxStageAttempts());
                        return JobOutcome.FAILED_MAX_ATTEMPTS;
                    }
                    stageName = RunMode.RESUME.stageName();
                    attempt++;
                    LOGGER.info("Attempting to recover. Next stage will be '{}' (Attempt {}).", stageName, attempt);
                    break;
            }
            if (backoff("post-stage")) {
                return JobOutcome.STOPPED;
            }
        }
        return JobOutcome.STOPPED;
    }

    /**
     * Waits the configured backoff. Returns true if shutdown was requested meanwhile.
     */
    private boolean backoff(String reason) {
        if (config.backoffDelayMinutes() <= 0) {
            return shutdown.isSet();
        }
        LOGGER.info("Applying {} backoff delay of {} minutes...", reason, config.backoffDelayMinutes());
        if (shutdown.await(Duration.ofMinutes(config.backoffDelayMinutes()))) {
            LOGGER.warn("Shutdown requested during {} backoff.", reason);
            return true;
        }
        return false;
    }

    StageOutcome runAttempt(String requestedStage, int attempt) {
        String stageName = requestedStage;
        List<String> extraArgs = new ArrayList<>();
        if (RunMode.RESUME.stageName().equals(stageName)) {
            Optional<Path> resumeConfig = locator.locateResumeConfig(state.tempDirs());
            if (resumeConfig.isPresent()) {
                Optional<String> containerPath = mapper.toContainer(resumeConfig.get());
                if (containerPath.isEmpty()) {
                    LOGGER.error("Failed to map resume config {} into the container. Attempt {} failed.",
                            resumeConfig.get(), attempt);
                    return StageOutcome.FAILED;
                }
                extraArgs.add("--config");
                extraArgs.add(containerPath.get());
                LOGGER.info("Will use container config path: {}", containerPath.get());
            } else {
                LOGGER.error("Resume requested, but no resume config could be found. Switching to '{}'.",
                        RunMode.NEW_PHASE_WITH_CONSOLIDATION.stageName());
                stageName = RunMode.NEW_PHASE_WITH_CONSOLIDATION.stageName();
            }
        }
        String label = stageName + " - Attempt " + attempt;
        LOGGER.info("--- Starting stage '{}' ---", label);

        List<String> args = ContainerSupervisor.buildArgs(config.passthroughArgs(), requiredArgs,
                state.currentWorkers(), false, extraArgs);
        LaunchedContainer launched;
        try {
            launched = supervisor.start(config.crawlerImage(), state.outputDirectory(), args, config.name(),
                    config.relaxPermissions());
        } catch (IOException ex) {
            LOGGER.error("Failed to start container for stage '{}'", label, ex);
            state.setStatus("failed");
            return StageOutcome.FAILED;
        }
        if (shutdown.isSet()) {
            LOGGER.warn("Shutdown requested while starting stage '{}'. Stopping the new container.", label);
            abandon(launched, "shutdown during start");
            state.setStatus("stopped");
            return StageOutcome.STOPPED;
        }
        state.resetForNewStage(label, clock.instant());

        StageLogDrain drain = StageLogDrain.start(label, state.outputDirectory(),
                launched.process().getInputStream(), !config.monitoring().enabled(), clock);
        LOGGER.info("Crawl stage logs: {}", drain.combinedLog());

        BlockingQueue<MonitorEvent> events = new ArrayBlockingQueue<>(EVENT_QUEUE_CAPACITY);
        ProgressMonitor monitor = null;
        if (!config.monitoring().enabled()) {
            LOGGER.info("Monitoring is disabled.");
        } else if (launched.containerId().isEmpty()) {
            LOGGER.warn("Cannot start monitor: container id was not identified.");
        } else {
            monitor = new ProgressMonitor(launched.containerId().get(), launched.process(), supervisor.runtime(),
                    state, config.monitoring(), events, shutdown, clock);
            monitor.start();
        }

        StageOutcome outcome = supervise(launched, monitor, events, label);

        drain.join(DRAIN_JOIN_TIMEOUT);
        if (monitor != null) {
            monitor.stop(MONITOR_STOP_TIMEOUT);
        }
        Process process = launched.process();
        if (!process.isAlive()) {
            state.setExitCode(process.exitValue());
        }
        if (outcome == null) {
            outcome = classifyExit(process.exitValue());
        }
        supervisor.release(launched);
        LOGGER.info("Container for '{}' ended. Exit code: {}. Outcome: {}",
                label, state.exitCode().map(String::valueOf).orElse("unknown"), outcome);
        if (outcome == StageOutcome.FAILED) {
            LOGGER.error("Stage '{}' failed. See {}", label, drain.combinedLog());
        }
        state.setStatus(outcome.name().toLowerCase());
        recordStageTempDir(drain.combinedLog(), label);
        return outcome;
    }

    /**
     * Runs the in-stage event loop until the container exits. Returns null when it exited
     * on its own, or the outcome that ended the loop early.
     */
    private StageOutcome supervise(LaunchedContainer launched, ProgressMonitor monitor,
                                   BlockingQueue<MonitorEvent> events, String label) {
        Process process = launched.process();
        boolean monitoring = monitor != null;
        Instant lastPrint = null;
        while (process.isAlive()) {
            if (shutdown.isSet()) {
                LOGGER.warn("Shutdown requested. Leaving stage '{}'.", label);
                return StageOutcome.STOPPED;
            }
            MonitorEvent event = null;
            if (monitoring) {
                try {
                    event = events.poll(LOOP_POLL.toMillis(), TimeUnit.MILLISECONDS);
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                    return StageOutcome.STOPPED;
                }
            } else if (shutdown.await(LOOP_POLL)) {
                continue;
            }

            if (event != null && event.isIntervention()) {
                if (MonitorEvent.MONITOR_FAILED.equals(event.reason())) {
                    LOGGER.error("Monitor failed for stage '{}'. Continuing without monitoring.", label);
                    monitoring = false;
                } else {
                    LOGGER.warn("Intervention triggered! Condition: {}, Reason: {}", event.type(), event.reason());
                    AdaptationEngine.Decision decision = engine.handle(event, state);
                    if (decision == AdaptationEngine.Decision.RESTART_REQUIRED) {
                        stopForAdaptation(launched);
                        return StageOutcome.STOPPED_FOR_ADAPTATION;
                    }
                    if (decision == AdaptationEngine.Decision.CONTINUED_LIVE) {
                        LOGGER.info("Live adaptation performed. Continuing to monitor the running container.");
                    } else {
                        if (backoff("no-adaptation")) {
                            return StageOutcome.STOPPED;
                        }
                        state.resetRuntimeErrors();
                    }
                }
            }

            Instant now = clock.instant();
            if (monitoring && (lastPrint == null || Duration.between(lastPrint, now).compareTo(STATUS_PRINT_INTERVAL) > 0)) {
                RuntimeSnapshot snapshot = state.snapshot();
                if (snapshot.crawled() >= 0) {
                    reporter.print(label, snapshot, now);
                }
                lastPrint = now;
            }
        }
        return null;
    }

    private void stopForAdaptation(LaunchedContainer launched) {
        launched.containerId().ifPresent(supervisor::stop);
        supervisor.ensureExited(launched.process(), "adaptation restart");
    }

    private void abandon(LaunchedContainer launched, String reason) {
        supervisor.stopLaunched(launched);
        supervisor.ensureExited(launched.process(), reason);
        supervisor.release(launched);
    }

    static StageOutcome classifyExit(int exitCode) {
        if (exitCode == 0) {
            return StageOutcome.SUCCESS;
        }
        if (ACCEPTABLE_EXIT_CODES.contains(exitCode)) {
            LOGGER.warn("Crawler finished with acceptable non-zero exit code {} (limit hit). Treating as success.", exitCode);
            return StageOutcome.SUCCESS;
        }
        return StageOutcome.FAILED;
    }

    private void recordStageTempDir(Path combinedLog, String label) {
        Optional<Path> tempDir = logParser.tempDirFromLog(combinedLog, mapper);
        if (tempDir.isEmpty()) {
            LOGGER.warn("Could not parse temp dir from logs, falling back to directory scan.");
            tempDir = locator.newestTempDir();
        }
        if (tempDir.isPresent()) {
            LOGGER.info("Identified temp directory for this stage: {}", tempDir.get());
            state.addTempDir(tempDir.get());
        } else {
            LOGGER.error("Could not determine temp directory created by stage '{}'. State might be incomplete.", label);
        }
    }

    JobOutcome finalBuild() {
        state.setCurrentStageName(FINAL_BUILD_STAGE);
        if (config.relaxPermissions()) {
            relaxPermissions();
        }
        List<Path> warcs = locator.findWarcs(state.tempDirs());
        if (warcs.isEmpty()) {
            LOGGER.error("No WARC files found in any tracked temp directories. Cannot perform final build.");
            return JobOutcome.FAILED_NO_ARTIFACTS;
        }
        List<String> containerWarcs = new ArrayList<>(warcs.size());
        for (Path warc : warcs) {
            Optional<String> containerPath = mapper.toContainer(warc);
            if (containerPath.isEmpty()) {
                LOGGER.error("Failed to convert WARC path {} to a container path. Aborting final build.", warc);
                return JobOutcome.FAILED_PATH_CONVERSION;
            }
            containerWarcs.add(containerPath.get());
        }
        LOGGER.info("Consolidating {} WARC file(s).", containerWarcs.size());

        List<String> baseArgs = new ArrayList<>(ContainerSupervisor.filterArgsForFinalBuild(config.passthroughArgs()));
        if (!baseArgs.contains("--seeds")) {
            baseArgs.add("--seeds");
            baseArgs.add(config.seeds().get(0));
        }
        List<String> args = ContainerSupervisor.buildArgs(baseArgs, requiredArgs, state.currentWorkers(), true,
                List.of("--warcs", String.join(",", containerWarcs)));

        LOGGER.info("--- Starting stage '{}' ---", FINAL_BUILD_STAGE);
        Instant startedAt = clock.instant();
        LaunchedContainer launched;
        try {
            launched = supervisor.start(config.crawlerImage(), state.outputDirectory(), args, config.name(),
                    config.relaxPermissions());
        } catch (IOException ex) {
            LOGGER.error("Failed to start final build container", ex);
            return JobOutcome.FAILED_FINAL_BUILD;
        }
        if (shutdown.isSet()) {
            LOGGER.warn("Shutdown requested while starting the final build. Stopping the new container.");
            abandon(launched, "shutdown during start");
            return JobOutcome.STOPPED;
        }
        StageLogDrain drain = StageLogDrain.start(FINAL_BUILD_STAGE, state.outputDirectory(),
                launched.process().getInputStream(), false, clock);
        LOGGER.info("Final build logs: {}", drain.combinedLog());

        Process process = launched.process();
        try {
            while (!process.waitFor(LOOP_POLL.toMillis(), TimeUnit.MILLISECONDS)) {
                if (shutdown.isSet()) {
                    LOGGER.warn("Shutdown requested during final build.");
                    drain.join(DRAIN_JOIN_TIMEOUT);
                    return JobOutcome.STOPPED;
                }
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return JobOutcome.STOPPED;
        }
        drain.join(DRAIN_JOIN_TIMEOUT);
        supervisor.release(launched);
        int exitCode = process.exitValue();
        state.setExitCode(exitCode);
        LOGGER.info("{} finished with exit code {} after {}", FINAL_BUILD_STAGE, exitCode,
                StatusReporter.formatDuration(Duration.between(startedAt, clock.instant())));

        logParser.tempDirFromLog(drain.combinedLog(), mapper).ifPresent(tempDir -> {
            LOGGER.info("Adding temp directory from final build stage to state: {}", tempDir);
            state.addTempDir(tempDir);
        });

        if (exitCode != 0) {
            LOGGER.error("Stage '{}' failed (exit code {}). Check {}", FINAL_BUILD_STAGE, exitCode, drain.combinedLog());
            return JobOutcome.FAILED_FINAL_BUILD;
        }
        if (Files.exists(config.finalArtifact())) {
            LOGGER.info("Verified final artifact exists: {}", config.finalArtifact());
        } else {
            LOGGER.warn("Final build finished with exit code 0, but {} was not found!", config.finalArtifact());
        }
        return JobOutcome.SUCCESS;
    }

    /**
     * Makes crawl artifacts world-readable by running chmod in a throwaway root container.
     */
    void relaxPermissions() {
        if (locator.discoverTempDirs().isEmpty()) {
            LOGGER.debug("No {}* directories to relax under {}.", ArtifactLocator.TEMP_DIR_PREFIX, state.outputDirectory());
            return;
        }
        LOGGER.info("Ensuring crawl artifacts are readable (chmod a+rX)...");
        try {
            int exitCode = supervisor.runtime().runUtility(PERMISSIONS_IMAGE, state.outputDirectory(),
                    ContainerSupervisor.CONTAINER_OUTPUT_DIR,
                    List.of("sh", "-c", "chmod -R a+rX /output/.tmp* 2>/dev/null || true"));
            if (exitCode != 0) {
                LOGGER.warn("Permission relaxation exited with code {}.", exitCode);
            }
        } catch (IOException ex) {
            LOGGER.warn("Could not relax permissions: {}", ex.getMessage());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }

    private void summarize(JobOutcome outcome, Instant startedAt) {
        Instant finishedAt = clock.instant();
        LOGGER.info("--- Archiving Process Summary ---");
        LOGGER.info("Total Duration: {}", StatusReporter.formatDuration(Duration.between(startedAt, finishedAt)));
        LOGGER.info("Final Overall Status: {}", outcome);
        state.setStatus(outcome.name().toLowerCase());

        List<Path> tempDirs = state.tempDirs();
        if (config.relaxPermissions() && !shutdown.isSet()) {
            relaxPermissions();
        }
        if (!outcome.isSuccess()) {
            LOGGER.error("Overall process FAILED or was STOPPED ({}). Temporary files and state kept for debugging:", outcome);
            listKeptFiles(tempDirs);
            return;
        }
        Path artifact = config.finalArtifact();
        if (Files.exists(artifact)) {
            try {
                LOGGER.info("Final artifact: {} ({} MB)", artifact,
                        String.format("%.2f", Files.size(artifact) / (1024.0 * 1024.0)));
            } catch (IOException ex) {
                LOGGER.info("Final artifact: {}", artifact);
            }
        }
        if (config.cleanup()) {
            LOGGER.info("Cleanup enabled. Removing temporary directories and state file...");
            int deleted = locator.deleteTempDirs(tempDirs);
            try {
                state.deleteStateFile();
            } catch (IOException ex) {
                LOGGER.error("Failed to delete state file {}", state.stateFilePath(), ex);
            }
            LOGGER.info("Cleanup finished. Deleted {} directories.", deleted);
        } else {
            LOGGER.info("Cleanup disabled. Temporary files and state remain:");
            listKeptFiles(tempDirs);
        }
    }

    private void listKeptFiles(List<Path> tempDirs) {
        tempDirs.forEach(dir -> LOGGER.info("  - Temp Dir: {}", dir));
        if (Files.exists(state.stateFilePath())) {
            LOGGER.info("  - State File: {}", state.stateFilePath());
        }
    }
}
