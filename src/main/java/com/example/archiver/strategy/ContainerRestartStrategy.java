package com.example.archiver.strategy;

import com.example.archiver.AdaptationSettings;
import com.example.archiver.JobState;
import com.example.archiver.MonitorEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Last resort for a stalled crawl: restart the container with unchanged settings.
 */
public class ContainerRestartStrategy implements AdaptationStrategy {
    private static final Logger LOGGER = LoggerFactory.getLogger(ContainerRestartStrategy.class);

    private final AdaptationSettings settings;

    public ContainerRestartStrategy(AdaptationSettings settings) {
        this.settings = settings;
    }

    @Override
    public String name() {
        return "container-restart";
    }

    @Override
    public boolean appliesTo(MonitorEvent event) {
        return event.type() == MonitorEvent.Type.STALLED;
    }

    @Override
    public boolean requiresRestart() {
        return true;
    }

    @Override
    public boolean attempt(JobState state, MonitorEvent event) {
        if (!settings.adaptiveRestart()) {
            LOGGER.debug("Adaptive restart strategy disabled.");
            return false;
        }
        int maxRestarts = settings.maxContainerRestarts();
        if (maxRestarts <= 0) {
            LOGGER.info("Adaptive restart: max container restarts is 0; restart skipped.");
            return false;
        }
        if (state.containerRestartsDone() >= maxRestarts) {
            LOGGER.warn("Adaptive restart: max restarts ({}) already performed for this run.", maxRestarts);
            return false;
        }
        state.recordContainerRestart();
        LOGGER.warn("Container restart requested (count: {}/{}).", state.containerRestartsDone(), maxRestarts);
        return true;
    }
}
