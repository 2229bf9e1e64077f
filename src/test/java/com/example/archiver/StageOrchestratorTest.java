package com.example.archiver;

import com.example.archiver.strategy.AdaptationEngine;
import com.example.archiver.strategy.AdaptationStrategy;
import com.example.archiver.strategy.TestStrategies;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StageOrchestratorTest {
    private static final String WARC_PATH = ".tmpabc/collections/crawl-1/archive/rec.warc.gz";
    private static final String RESET_LINE = "page failed: net::ERR_CONNECTION_RESET";

    @Test
    void acceptsLimitExitCodes() {
        assertEquals(StageOutcome.SUCCESS, StageOrchestrator.classifyExit(0));
        assertEquals(StageOutcome.SUCCESS, StageOrchestrator.classifyExit(16));
        assertEquals(StageOutcome.SUCCESS, StageOrchestrator.classifyExit(32));
        assertEquals(StageOutcome.FAILED, StageOrchestrator.classifyExit(1));
        assertEquals(StageOutcome.FAILED, StageOrchestrator.classifyExit(137));
    }

    @Test
    void finalBuildWithoutWarcsStartsNoContainer() throws Exception {
        Harness harness = new Harness(Files.createTempDirectory("orchestrator-nowarc"), "");
        Files.createDirectories(harness.output.resolve(".tmpempty/collections"));
        harness.state.addTempDir(harness.output.resolve(".tmpempty"));

        assertEquals(JobOutcome.FAILED_NO_ARTIFACTS, harness.orchestrator().finalBuild());
        assertTrue(harness.runtime.launches.isEmpty());
    }

    @Test
    void freshModeWhenNothingExists() throws Exception {
        Harness harness = new Harness(Files.createTempDirectory("orchestrator-fresh"), ", \"initialWorkers\": 3");
        harness.state.reduceWorkers(1);

        assertEquals(RunMode.FRESH, harness.orchestrator().selectMode());
        assertEquals(0, harness.state.workerReductionsDone());
    }

    @Test
    void warcsWithoutResumeConfigStartNewPhase() throws Exception {
        Path output = Files.createTempDirectory("orchestrator-newphase");
        writeWarc(output);
        Harness harness = new Harness(output, "");

        assertEquals(RunMode.NEW_PHASE_WITH_CONSOLIDATION, harness.orchestrator().selectMode());
        assertEquals(List.of(output.resolve(".tmpabc").toRealPath()), harness.state.tempDirs());
    }

    @Test
    void resumeConfigSelectsResumeAndIsPassedToCrawler() throws Exception {
        Path output = Files.createTempDirectory("orchestrator-resume");
        Path crawls = Files.createDirectories(output.resolve(".tmp1/collections/crawl-1/crawls"));
        Files.writeString(crawls.resolve("crawl-20240501-1.yaml"), "seeds: []");
        Harness harness = new Harness(output, "");
        harness.runtime.enqueue(FakeProcess.exited(0, ""));
        StageOrchestrator orchestrator = harness.orchestrator();

        assertEquals(RunMode.RESUME, orchestrator.selectMode());
        assertEquals(StageOutcome.SUCCESS, orchestrator.runAttempt(RunMode.RESUME.stageName(), 1));

        List<String> args = harness.runtime.launches.get(0).args();
        int config = args.indexOf("--config");
        assertTrue(config > 0);
        assertEquals("/output/.zimit_resume.yaml", args.get(config + 1));
    }

    @Test
    void overwriteResetsStateAndStartsFresh() throws Exception {
        Path output = Files.createTempDirectory("orchestrator-overwrite");
        writeWarc(output);
        Files.writeString(output.resolve("site.zim"), "old archive");
        Harness harness = new Harness(output, ", \"overwrite\": true");

        assertEquals(RunMode.FRESH, harness.orchestrator().selectMode());
        assertTrue(harness.state.tempDirs().isEmpty());
    }

    @Test
    @Timeout(30)
    void successfulRunBuildsFromWarcsAndCleansUp() throws Exception {
        Path output = Files.createTempDirectory("orchestrator-success");
        writeWarc(output);
        Harness harness = new Harness(output, ", \"cleanup\": true, \"relaxPermissions\": true");
        harness.runtime
                .enqueue(FakeProcess.exited(0, "Output to tempdir: \"/output/.tmpabc\" - will keep\n"))
                .enqueue(FakeProcess.exited(0, ""));

        assertEquals(JobOutcome.SUCCESS, harness.orchestrator().run());

        assertEquals(2, harness.runtime.launches.size());
        List<String> crawlArgs = harness.runtime.launches.get(0).args();
        assertTrue(crawlArgs.contains("--seeds"));
        assertTrue(crawlArgs.contains("--workers"));
        assertTrue(harness.runtime.launches.get(0).runAsRoot());
        List<String> buildArgs = harness.runtime.launches.get(1).args();
        assertFalse(buildArgs.contains("--workers"));
        assertEquals("/output/" + WARC_PATH, buildArgs.get(buildArgs.indexOf("--warcs") + 1));
        assertEquals("https://example.org", buildArgs.get(buildArgs.indexOf("--seeds") + 1));
        assertFalse(harness.runtime.utilityCommands.isEmpty());
        assertFalse(Files.exists(output.resolve(".tmpabc")));
        assertFalse(Files.exists(harness.state.stateFilePath()));
    }

    @Test
    @Timeout(30)
    void failedAttemptsStopAtMaximum() throws Exception {
        Harness harness = new Harness(Files.createTempDirectory("orchestrator-failures"), "");
        harness.runtime.enqueue(FakeProcess.exited(1, "boom")).enqueue(FakeProcess.exited(1, "boom"));

        assertEquals(JobOutcome.FAILED_MAX_ATTEMPTS, harness.orchestrator().run());

        assertEquals(2, harness.runtime.launches.size());
        assertFalse(harness.runtime.launches.get(1).args().contains("--config"));
        assertEquals(1, harness.state.exitCode().orElseThrow());
    }

    @Test
    @Timeout(30)
    void launchFailuresConsumeAttempts() throws Exception {
        Harness harness = new Harness(Files.createTempDirectory("orchestrator-nolaunch"), "");

        assertEquals(JobOutcome.FAILED_MAX_ATTEMPTS, harness.orchestrator().run());
        assertTrue(harness.runtime.launches.isEmpty());
    }

    @Test
    void shutdownBeforeFirstStageStops() throws Exception {
        Harness harness = new Harness(Files.createTempDirectory("orchestrator-shutdown"), "");
        harness.shutdown.trigger();

        assertEquals(JobOutcome.STOPPED, harness.orchestrator().run());
        assertTrue(harness.runtime.launches.isEmpty());
    }

    @Test
    @Timeout(30)
    void errorBurstReducesWorkersAndResumes() throws Exception {
        Path output = Files.createTempDirectory("orchestrator-adapt");
        writeWarc(output);
        Harness harness = new Harness(output, ", \"initialWorkers\": 2,"
                + " \"monitoring\": {\"enabled\": true, \"intervalSeconds\": 1, \"errorThresholdHttp\": 3},"
                + " \"adaptation\": {\"adaptiveWorkers\": true, \"minWorkers\": 1}");
        FakeProcess logs = FakeProcess.streaming();
        for (int i = 0; i < 3; i++) {
            logs.emit("page failed: net::ERR_CONNECTION_RESET");
        }
        FakeProcess firstContainer = FakeProcess.running("");
        harness.runtime
                .enqueueLogs(logs)
                .enqueue(firstContainer)
                .enqueue(FakeProcess.exited(0, ""))
                .enqueue(FakeProcess.exited(0, ""));

        assertEquals(JobOutcome.SUCCESS, harness.orchestrator().run());

        assertEquals(List.of("container-1"), harness.runtime.stopped);
        assertFalse(firstContainer.isAlive());
        assertEquals(3, harness.runtime.launches.size());
        assertEquals("2", workers(harness.runtime.launches.get(0)));
        assertEquals("1", workers(harness.runtime.launches.get(1)));
        assertEquals(1, harness.state.workerReductionsDone());
    }

    @Test
    @Timeout(30)
    void shutdownWhileStartingStopsTheNewContainer() throws Exception {
        Harness harness = new Harness(Files.createTempDirectory("orchestrator-startstop"), "");
        FakeProcess container = FakeProcess.running("");
        harness.runtime.enqueue(container);
        harness.runtime.onFindByLabel = harness.shutdown::trigger;

        assertEquals(StageOutcome.STOPPED, harness.orchestrator().runAttempt(RunMode.FRESH.stageName(), 1));

        assertEquals(List.of("container-1"), harness.runtime.stopped);
        assertFalse(container.isAlive());
        assertTrue(harness.supervisor.current().isEmpty());
    }

    @Test
    @Timeout(30)
    void stageTimerStartsOnceTheContainerIsUp() throws Exception {
        Instant launchedAt = Instant.parse("2024-05-01T10:00:00Z");
        MutableClock clock = new MutableClock(launchedAt);
        Harness harness = new Harness(Files.createTempDirectory("orchestrator-timer"), "", clock);
        harness.runtime.enqueue(FakeProcess.exited(0, ""));
        harness.runtime.onFindByLabel = () -> clock.advance(Duration.ofSeconds(3));

        assertEquals(StageOutcome.SUCCESS, harness.orchestrator().runAttempt(RunMode.FRESH.stageName(), 1));

        RuntimeSnapshot snapshot = harness.state.snapshot();
        assertEquals("Initial Crawl - Attempt 1", snapshot.stageName());
        assertEquals(launchedAt.plusSeconds(3), snapshot.stageStartTime());
    }

    @Test
    @Timeout(30)
    void egressRotationKeepsTheSameContainerRunning() throws Exception {
        Harness harness = new Harness(Files.createTempDirectory("orchestrator-live"),
                ", \"monitoring\": {\"enabled\": true, \"intervalSeconds\": 1, \"errorThresholdHttp\": 3},"
                        + " \"adaptation\": {\"vpnRotation\": true, \"vpnConnectCommand\": \"vpn-rotate --random\"}");
        FakeProcess logs = FakeProcess.streaming();
        emitResets(logs, 3);
        FakeProcess container = FakeProcess.running("");
        harness.runtime.enqueueLogs(logs).enqueue(container);
        ConnectRunner runner = new ConnectRunner();
        RecordingEngine engine = new RecordingEngine(TestStrategies.standardWithoutSettleDelay(
                harness.config.adaptation(), runner, harness.shutdown, harness.clock));
        StageOrchestrator orchestrator = harness.orchestrator(engine);

        CompletableFuture<StageOutcome> outcome = CompletableFuture.supplyAsync(
                () -> orchestrator.runAttempt(RunMode.FRESH.stageName(), 1));
        await().atMost(Duration.ofSeconds(10)).until(() -> !engine.decisions.isEmpty());

        assertEquals(List.of(AdaptationEngine.Decision.CONTINUED_LIVE), engine.decisions);
        assertTrue(container.isAlive());
        container.exit(0);

        assertEquals(StageOutcome.SUCCESS, outcome.get(10, TimeUnit.SECONDS));
        assertEquals(1, harness.runtime.launches.size());
        assertTrue(harness.runtime.stopped.isEmpty());
        assertEquals(List.of(List.of("vpn-rotate", "--random")), runner.commands);
        assertEquals(1, harness.state.vpnRotationsDone());
        assertEquals(0, harness.state.snapshot().errors(ErrorCategory.HTTP));
    }

    @Test
    @Timeout(30)
    void unhandledErrorBurstKeepsMonitoringTheSameAttempt() throws Exception {
        Harness harness = new Harness(Files.createTempDirectory("orchestrator-none"),
                ", \"monitoring\": {\"enabled\": true, \"intervalSeconds\": 1, \"errorThresholdHttp\": 3}");
        FakeProcess logs = FakeProcess.streaming();
        emitResets(logs, 3);
        FakeProcess container = FakeProcess.running("");
        harness.runtime.enqueueLogs(logs).enqueue(container);
        RecordingEngine engine = new RecordingEngine(TestStrategies.standardWithoutSettleDelay(
                harness.config.adaptation(), new ConnectRunner(), harness.shutdown, harness.clock));
        StageOrchestrator orchestrator = harness.orchestrator(engine);

        CompletableFuture<StageOutcome> outcome = CompletableFuture.supplyAsync(
                () -> orchestrator.runAttempt(RunMode.FRESH.stageName(), 1));
        await().atMost(Duration.ofSeconds(10)).until(() -> engine.decisions.size() == 1);
        await().pollDelay(Duration.ofMillis(500)).atMost(Duration.ofSeconds(5))
                .until(() -> harness.state.snapshot().errors(ErrorCategory.HTTP) == 0);
        emitResets(logs, 3);
        await().atMost(Duration.ofSeconds(10)).until(() -> engine.decisions.size() == 2);

        assertEquals(List.of(AdaptationEngine.Decision.NONE, AdaptationEngine.Decision.NONE), engine.decisions);
        assertTrue(container.isAlive());
        container.exit(0);

        assertEquals(StageOutcome.SUCCESS, outcome.get(10, TimeUnit.SECONDS));
        assertEquals(1, harness.runtime.launches.size());
        assertTrue(harness.runtime.stopped.isEmpty());
        assertEquals(0, harness.state.snapshot().errors(ErrorCategory.HTTP));
        assertEquals(0, harness.state.workerReductionsDone());
        assertEquals(0, harness.state.containerRestartsDone());
    }

    @Test
    @Timeout(30)
    void stallRestartsTheContainer() throws Exception {
        MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        Harness harness = new Harness(Files.createTempDirectory("orchestrator-stall"),
                ", \"monitoring\": {\"enabled\": true, \"intervalSeconds\": 1, \"stallTimeoutMinutes\": 30},"
                        + " \"adaptation\": {\"adaptiveRestart\": true}", clock);
        FakeProcess logs = FakeProcess.streaming();
        logs.emit("{\"logLevel\":\"info\",\"context\":\"crawlStatus\",\"message\":\"Crawl statistics\","
                + "\"details\":{\"crawled\":5,\"total\":20,\"pending\":5,\"failed\":0}}");
        FakeProcess container = FakeProcess.running("");
        harness.runtime.enqueueLogs(logs).enqueue(container);
        RecordingEngine engine = new RecordingEngine(TestStrategies.standardWithoutSettleDelay(
                harness.config.adaptation(), new ConnectRunner(), harness.shutdown, clock));
        StageOrchestrator orchestrator = harness.orchestrator(engine);

        CompletableFuture<StageOutcome> outcome = CompletableFuture.supplyAsync(
                () -> orchestrator.runAttempt(RunMode.FRESH.stageName(), 1));
        await().atMost(Duration.ofSeconds(10)).until(() -> harness.state.snapshot().crawled() == 5);
        clock.advance(Duration.ofMinutes(31));

        assertEquals(StageOutcome.STOPPED_FOR_ADAPTATION, outcome.get(10, TimeUnit.SECONDS));
        assertEquals(List.of(AdaptationEngine.Decision.RESTART_REQUIRED), engine.decisions);
        assertEquals(List.of("container-1"), harness.runtime.stopped);
        assertFalse(container.isAlive());
        assertEquals(1, harness.runtime.launches.size());
        assertEquals(1, harness.state.containerRestartsDone());
    }

    private static void emitResets(FakeProcess logs, int count) {
        for (int i = 0; i < count; i++) {
            logs.emit(RESET_LINE);
        }
    }

    private static String workers(ContainerLaunch launch) {
        List<String> args = launch.args();
        return args.get(args.indexOf("--workers") + 1);
    }

    private static void writeWarc(Path output) throws Exception {
        Path warc = output.resolve(WARC_PATH);
        Files.createDirectories(warc.getParent());
        Files.writeString(warc, "WARC/1.1");
    }

    private static final class Harness {
        private final Path output;
        private final ArchiverConfig config;
        private final JobState state;
        private final Clock clock;
        private final ShutdownSignal shutdown = new ShutdownSignal();
        private final FakeContainerRuntime runtime = new FakeContainerRuntime();
        private final ContainerSupervisor supervisor;

        private Harness(Path output, String extraJson) throws Exception {
            this(output, extraJson, Clock.systemUTC());
        }

        private Harness(Path output, String extraJson, Clock clock) throws Exception {
            this.output = output;
            this.clock = clock;
            this.config = new ConfigLoader().parse("{\"seeds\": [\"https://example.org\"], \"name\": \"site\","
                    + " \"outputDirectory\": \"" + output + "\", \"backoffDelayMinutes\": 0,"
                    + " \"maxStageAttempts\": 2" + extraJson + "}");
            this.state = JobState.open(output, config.initialWorkers());
            this.supervisor = new ContainerSupervisor(runtime, ContainerSettings.unlimited(), shutdown,
                    Duration.ofMillis(1));
        }

        private StageOrchestrator orchestrator() {
            return orchestrator(AdaptationEngine.standard(config.adaptation(), new CommandRunner(), shutdown, clock));
        }

        private StageOrchestrator orchestrator(AdaptationEngine engine) {
            PrintStream console = new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8);
            return new StageOrchestrator(config, state, supervisor, engine, shutdown, clock, console);
        }
    }

    private static final class RecordingEngine extends AdaptationEngine {
        private final List<Decision> decisions = new CopyOnWriteArrayList<>();

        private RecordingEngine(List<AdaptationStrategy> strategies) {
            super(strategies);
        }

        @Override
        public Decision handle(MonitorEvent event, JobState state) {
            Decision decision = super.handle(event, state);
            decisions.add(decision);
            return decision;
        }
    }

    private static final class ConnectRunner extends CommandRunner {
        private final List<List<String>> commands = new CopyOnWriteArrayList<>();

        @Override
        public Optional<Path> which(String executable) {
            return Optional.of(Path.of("/usr/local/bin", executable));
        }

        @Override
        public CommandResult run(List<String> command, Duration timeout) {
            commands.add(List.copyOf(command));
            return new CommandResult(0, "Connected", "", false);
        }
    }
}
