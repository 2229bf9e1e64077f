package com.example.archiver.strategy;

import com.example.archiver.JobState;
import com.example.archiver.MonitorEvent;

/**
 * One bounded intervention the engine can try when the monitor reports trouble.
 * Strategies only update the job state; stopping the container is left to the caller.
 */
public interface AdaptationStrategy {

    String name();

    /**
     * Whether this strategy is a candidate for {@code event} at all.
     */
    default boolean appliesTo(MonitorEvent event) {
        return event.isIntervention();
    }

    /**
     * True when a successful attempt only takes effect after the container is restarted.
     */
    boolean requiresRestart();

    /**
     * Tries the intervention. Returns true if it was applied and recorded in {@code state}.
     */
    boolean attempt(JobState state, MonitorEvent event);
}
