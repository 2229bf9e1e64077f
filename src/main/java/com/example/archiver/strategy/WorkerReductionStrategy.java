package com.example.archiver.strategy;

import com.example.archiver.AdaptationSettings;
import com.example.archiver.JobState;
import com.example.archiver.MonitorEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Lowers the crawler worker count by one, down to the configured minimum.
 */
public class WorkerReductionStrategy implements AdaptationStrategy {
    private static final Logger LOGGER = LoggerFactory.getLogger(WorkerReductionStrategy.class);

    private final AdaptationSettings settings;

    public WorkerReductionStrategy(AdaptationSettings settings) {
        this.settings = settings;
    }

    @Override
    public String name() {
        return "worker-reduction";
    }

    @Override
    public boolean requiresRestart() {
        return true;
    }

    @Override
    public boolean attempt(JobState state, MonitorEvent event) {
        if (!settings.adaptiveWorkers()) {
            LOGGER.debug("Adaptive workers strategy disabled.");
            return false;
        }
        if (state.workerReductionsDone() >= settings.maxWorkerReductions()) {
            LOGGER.warn("Adaptive workers: max reductions ({}) already performed.", settings.maxWorkerReductions());
            return false;
        }
        Optional<Integer> reduced = state.reduceWorkers(settings.minWorkers());
        if (reduced.isEmpty()) {
            LOGGER.info("Adaptive workers: already at minimum workers ({}). Cannot reduce further.", settings.minWorkers());
            return false;
        }
        LOGGER.warn("Reduced worker count to {} after {} (reduction {}/{}).",
                reduced.get(), event.reason(), state.workerReductionsDone(), settings.maxWorkerReductions());
        return true;
    }
}
