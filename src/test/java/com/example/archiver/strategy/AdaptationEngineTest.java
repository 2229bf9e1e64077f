package com.example.archiver.strategy;

import com.example.archiver.AdaptationSettings;
import com.example.archiver.CommandRunner;
import com.example.archiver.JobState;
import com.example.archiver.MonitorEvent;
import com.example.archiver.ShutdownSignal;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;

class AdaptationEngineTest {

    @Test
    void firstApplicableStrategyWins() throws Exception {
        JobState state = JobState.open(Files.createTempDirectory("engine-order"), 4);
        List<String> tried = new ArrayList<>();
        AdaptationEngine engine = new AdaptationEngine(List.of(
                new RecordingStrategy("first", false, false, tried),
                new RecordingStrategy("second", true, false, tried),
                new RecordingStrategy("third", true, true, tried)
        ));

        assertEquals(AdaptationEngine.Decision.CONTINUED_LIVE, engine.handle(MonitorEvent.stalled("timeout"), state));
        assertEquals(List.of("first", "second"), tried);
    }

    @Test
    void stallFallsThroughToContainerRestart() throws Exception {
        JobState state = JobState.open(Files.createTempDirectory("engine-stall"), 1);
        AdaptationSettings settings = new AdaptationSettings(true, 1, 2, false, Optional.empty(), 0, 0, true, 3);
        AdaptationEngine engine = AdaptationEngine.standard(settings, new CommandRunner(), new ShutdownSignal(),
                Clock.systemUTC());

        assertEquals(AdaptationEngine.Decision.RESTART_REQUIRED,
                engine.handle(MonitorEvent.stalled(MonitorEvent.STALL_TIMEOUT), state));
        assertEquals(1, state.containerRestartsDone());
        assertEquals(0, state.workerReductionsDone());
    }

    @Test
    void errorWithoutApplicableStrategyIsNone() throws Exception {
        JobState state = JobState.open(Files.createTempDirectory("engine-none"), 1);
        AdaptationSettings settings = new AdaptationSettings(true, 1, 2, false, Optional.empty(), 0, 0, true, 3);
        AdaptationEngine engine = AdaptationEngine.standard(settings, new CommandRunner(), new ShutdownSignal(),
                Clock.systemUTC());

        assertEquals(AdaptationEngine.Decision.NONE,
                engine.handle(MonitorEvent.error(MonitorEvent.TIMEOUT_THRESHOLD), state));
        assertEquals(0, state.containerRestartsDone());
    }

    @Test
    void workerReductionComesFirst() throws Exception {
        JobState state = JobState.open(Files.createTempDirectory("engine-reduce"), 3);
        AdaptationSettings settings = new AdaptationSettings(true, 1, 2, false, Optional.empty(), 0, 0, true, 3);
        AdaptationEngine engine = AdaptationEngine.standard(settings, new CommandRunner(), new ShutdownSignal(),
                Clock.systemUTC());

        assertEquals(AdaptationEngine.Decision.RESTART_REQUIRED,
                engine.handle(MonitorEvent.stalled(MonitorEvent.STALL_TIMEOUT), state));
        assertEquals(2, state.currentWorkers());
        assertEquals(0, state.containerRestartsDone());
    }

    private static final class RecordingStrategy implements AdaptationStrategy {
        private final String name;
        private final boolean succeeds;
        private final boolean restart;
        private final List<String> tried;

        private RecordingStrategy(String name, boolean succeeds, boolean restart, List<String> tried) {
            this.name = name;
            this.succeeds = succeeds;
            this.restart = restart;
            this.tried = tried;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public boolean requiresRestart() {
            return restart;
        }

        @Override
        public boolean attempt(JobState state, MonitorEvent event) {
            tried.add(name);
            return succeeds;
        }
    }
}
