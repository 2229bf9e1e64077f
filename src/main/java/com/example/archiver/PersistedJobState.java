package com.example.archiver;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Durable part of {@link JobState}, written to {@code .archive_state.json}.
 */
public record PersistedJobState(
        @JsonProperty("current_workers") int currentWorkers,
        @JsonProperty("initial_workers") int initialWorkers,
        @JsonProperty("temp_dirs_host_paths") List<String> tempDirs,
        @JsonProperty("vpn_rotations_done") int vpnRotationsDone,
        @JsonProperty("worker_reductions_done") int workerReductionsDone,
        @JsonProperty("container_restarts_done") int containerRestartsDone,
        @JsonProperty("last_error_counts") Map<String, Integer> lastErrorCounts
) {
    /**
     * State of a job that has never run.
     */
    public static PersistedJobState fresh(int initialWorkers) {
        return new PersistedJobState(initialWorkers, initialWorkers, List.of(), 0, 0, 0, Map.of());
    }
}
