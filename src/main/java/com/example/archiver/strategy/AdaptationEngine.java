package com.example.archiver.strategy;

import com.example.archiver.AdaptationSettings;
import com.example.archiver.CommandRunner;
import com.example.archiver.JobState;
import com.example.archiver.MonitorEvent;
import com.example.archiver.ShutdownSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;

/**
 * Tries the adaptation strategies in order and reports what the control loop has to do next.
 */
public class AdaptationEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(AdaptationEngine.class);

    public enum Decision {
        /** A strategy changed settings that need the container restarted. */
        RESTART_REQUIRED,
        /** A strategy took effect while the container keeps running. */
        CONTINUED_LIVE,
        /** Nothing applied. */
        NONE
    }

    private final List<AdaptationStrategy> strategies;

    public AdaptationEngine(List<AdaptationStrategy> strategies) {
        this.strategies = List.copyOf(strategies);
    }

    /**
     * Worker reduction, then egress rotation, then container restart.
     */
    public static AdaptationEngine standard(AdaptationSettings settings, CommandRunner runner,
                                            ShutdownSignal shutdown, Clock clock) {
        return new AdaptationEngine(List.of(
                new WorkerReductionStrategy(settings),
                new EgressRotationStrategy(settings, runner, shutdown, clock),
                new ContainerRestartStrategy(settings)
        ));
    }

    public Decision handle(MonitorEvent event, JobState state) {
        LOGGER.warn("Handling monitor event {} ({})", event.type(), event.reason());
        for (AdaptationStrategy strategy : strategies) {
            if (!strategy.appliesTo(event)) {
                continue;
            }
            if (strategy.attempt(state, event)) {
                LOGGER.info("Adaptation '{}' applied.", strategy.name());
                return strategy.requiresRestart() ? Decision.RESTART_REQUIRED : Decision.CONTINUED_LIVE;
            }
        }
        LOGGER.warn("No adaptation strategy applicable for {} ({}).", event.type(), event.reason());
        return Decision.NONE;
    }
}
