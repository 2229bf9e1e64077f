package com.example.archiver;

import java.time.Instant;
import java.util.Optional;

/**
 * What a single crawler log line means for the job state: a statistics update,
 * one categorized error, or nothing.
 */
public final class LogSignal {
    private static final LogSignal NONE = new LogSignal(null, null);

    private final CrawlStats stats;
    private final ErrorCategory error;

    private LogSignal(CrawlStats stats, ErrorCategory error) {
        this.stats = stats;
        this.error = error;
    }

    public static LogSignal progress(CrawlStats stats) {
        return new LogSignal(stats, null);
    }

    public static LogSignal error(ErrorCategory category) {
        return new LogSignal(null, category);
    }

    public static LogSignal none() {
        return NONE;
    }

    public Optional<CrawlStats> stats() {
        return Optional.ofNullable(stats);
    }

    public Optional<ErrorCategory> error() {
        return Optional.ofNullable(error);
    }

    /**
     * Applies the signal to {@code state}.
     */
    public void applyTo(JobState state, Instant timestamp) {
        if (stats != null) {
            state.updateProgress(stats, timestamp);
        } else if (error != null) {
            state.recordError(error);
        }
    }

    @Override
    public String toString() {
        if (stats != null) {
            return "LogSignal[progress " + stats + "]";
        }
        return error != null ? "LogSignal[error " + error.key() + "]" : "LogSignal[none]";
    }
}
