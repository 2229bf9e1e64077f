package com.example.archiver;

import java.time.Duration;

/**
 * Thresholds used by the progress monitor.
 */
public record MonitorSettings(
        boolean enabled,
        int intervalSeconds,
        int stallTimeoutMinutes,
        int errorThresholdTimeout,
        int errorThresholdHttp
) {
    public Duration interval() {
        return Duration.ofSeconds(intervalSeconds);
    }

    public Duration stallTimeout() {
        return Duration.ofMinutes(stallTimeoutMinutes);
    }
}
