package com.example.archiver;

import java.time.Instant;
import java.util.Map;

/**
 * Consistent read of the runtime and durable counters, taken under the state lock.
 */
public record RuntimeSnapshot(
        String stageName,
        Instant stageStartTime,
        long crawled,
        long total,
        long pending,
        long failed,
        Instant lastProgressTimestamp,
        double progressRatePpm,
        Map<ErrorCategory, Integer> errorCounts,
        int currentWorkers,
        int vpnRotationsDone,
        int workerReductionsDone,
        int containerRestartsDone
) {
    public int errors(ErrorCategory category) {
        return errorCounts.getOrDefault(category, 0);
    }
}
