package com.example.archiver;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobStateTest {
    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    @Test
    void clampsPersistedWorkersToInitialWorkers() throws Exception {
        Path output = Files.createTempDirectory("state-clamp");
        Files.writeString(output.resolve(JobState.STATE_FILE_NAME),
                "{\"current_workers\": 12, \"vpn_rotations_done\": 2}");

        JobState state = JobState.open(output, 4);

        assertEquals(4, state.currentWorkers());
        assertEquals(2, state.vpnRotationsDone());
    }

    @Test
    void fallsBackToDefaultsForInvalidFields() throws Exception {
        Path output = Files.createTempDirectory("state-invalid");
        Files.writeString(output.resolve(JobState.STATE_FILE_NAME),
                "{\"current_workers\": 0, \"worker_reductions_done\": \"two\", \"temp_dirs_host_paths\": [1, 2]}");

        JobState state = JobState.open(output, 3);

        assertEquals(3, state.currentWorkers());
        assertEquals(0, state.workerReductionsDone());
        assertTrue(state.tempDirs().isEmpty());
    }

    @Test
    void unparsableStateFileStartsFresh() throws Exception {
        Path output = Files.createTempDirectory("state-corrupt");
        Files.writeString(output.resolve(JobState.STATE_FILE_NAME), "{not json");

        JobState state = JobState.open(output, 2);

        assertEquals(2, state.currentWorkers());
        JsonNode saved = new ObjectMapper().readTree(output.resolve(JobState.STATE_FILE_NAME).toFile());
        assertEquals(2, saved.get("current_workers").intValue());
    }

    @Test
    void saveDropsMissingAndDuplicateTempDirs() throws Exception {
        Path output = Files.createTempDirectory("state-dirs");
        Path older = Files.createDirectory(output.resolve(".tmpold"));
        Path newer = Files.createDirectory(output.resolve(".tmpnew"));
        Files.setLastModifiedTime(older, FileTime.from(T0));
        Files.setLastModifiedTime(newer, FileTime.from(T0.plusSeconds(60)));
        String missing = output.resolve(".tmpgone").toString();
        String json = "{\"temp_dirs_host_paths\": [\"" + newer + "\", \"" + missing + "\", \""
                + older + "\", \"" + output.resolve(".tmpnew/../.tmpnew") + "\"]}";
        Files.writeString(output.resolve(JobState.STATE_FILE_NAME), json);

        JobState state = JobState.open(output, 1);

        assertEquals(List.of(older.toRealPath(), newer.toRealPath()), state.tempDirs());
        JsonNode saved = new ObjectMapper().readTree(output.resolve(JobState.STATE_FILE_NAME).toFile());
        assertEquals(2, saved.get("temp_dirs_host_paths").size());
    }

    @Test
    void stateFileHoldsOnlyDurableKeys() throws Exception {
        Path output = Files.createTempDirectory("state-keys");
        JobState state = JobState.open(output, 2);
        state.recordContainerRestart();

        JsonNode saved = new ObjectMapper().readTree(output.resolve(JobState.STATE_FILE_NAME).toFile());
        Set<String> keys = new HashSet<>();
        saved.fieldNames().forEachRemaining(keys::add);

        assertEquals(Set.of("current_workers", "initial_workers", "temp_dirs_host_paths", "vpn_rotations_done",
                "worker_reductions_done", "container_restarts_done", "last_error_counts"), keys);
    }

    @Test
    void saveThenLoadKeepsDurableFields() throws Exception {
        Path output = Files.createTempDirectory("state-roundtrip");
        Path tempDir = Files.createDirectory(output.resolve(".tmpabc"));
        JobState first = JobState.open(output, 5);
        first.addTempDir(tempDir);
        assertEquals(Optional.of(4), first.reduceWorkers(1));
        first.recordVpnRotation(T0);
        first.recordContainerRestart();

        JobState second = JobState.open(output, 5);

        assertEquals(4, second.currentWorkers());
        assertEquals(1, second.workerReductionsDone());
        assertEquals(1, second.vpnRotationsDone());
        assertEquals(1, second.containerRestartsDone());
        assertEquals(List.of(tempDir.toRealPath()), second.tempDirs());
    }

    @Test
    void reduceWorkersStopsAtFloor() throws Exception {
        JobState state = JobState.open(Files.createTempDirectory("state-floor"), 2);

        assertEquals(Optional.of(1), state.reduceWorkers(1));
        assertEquals(Optional.empty(), state.reduceWorkers(1));
        assertEquals(1, state.currentWorkers());
        assertEquals(1, state.workerReductionsDone());
    }

    @Test
    void progressClearsErrorCountsAndComputesRate() throws Exception {
        JobState state = JobState.open(Files.createTempDirectory("state-progress"), 1);
        state.resetForNewStage("Initial Crawl - Attempt 1", T0);

        state.updateProgress(new CrawlStats(10L, 100L, 5L, 0L), T0);
        state.recordError(ErrorCategory.TIMEOUT);
        state.recordError(ErrorCategory.HTTP);
        assertEquals(1, state.snapshot().errors(ErrorCategory.TIMEOUT));

        state.updateProgress(new CrawlStats(40L, 100L, 5L, 0L), T0.plusSeconds(60));

        RuntimeSnapshot snapshot = state.snapshot();
        assertEquals(40L, snapshot.crawled());
        assertEquals(0, snapshot.errors(ErrorCategory.TIMEOUT));
        assertEquals(0, snapshot.errors(ErrorCategory.HTTP));
        assertEquals(30.0, snapshot.progressRatePpm(), 0.001);
        assertEquals(T0.plusSeconds(60), snapshot.lastProgressTimestamp());
    }

    @Test
    void rateDecaysWithoutProgress() throws Exception {
        JobState state = JobState.open(Files.createTempDirectory("state-decay"), 1);
        state.resetForNewStage("Initial Crawl - Attempt 1", T0);
        state.updateProgress(new CrawlStats(0L, 10L, 1L, 0L), T0);
        state.updateProgress(new CrawlStats(6L, 10L, 1L, 0L), T0.plusSeconds(30));
        assertEquals(12.0, state.snapshot().progressRatePpm(), 0.001);

        state.updateProgress(new CrawlStats(6L, 10L, 1L, 0L), T0.plusSeconds(100));

        assertEquals(0.0, state.snapshot().progressRatePpm(), 0.001);
    }

    @Test
    void resetForOverwriteClearsHistory() throws Exception {
        Path output = Files.createTempDirectory("state-overwrite");
        JobState state = JobState.open(output, 3);
        state.addTempDir(Files.createDirectory(output.resolve(".tmpx")));
        state.reduceWorkers(1);
        state.recordVpnRotation(T0);

        state.resetForOverwrite();

        assertEquals(3, state.currentWorkers());
        assertEquals(0, state.vpnRotationsDone());
        assertEquals(0, state.workerReductionsDone());
        assertTrue(state.tempDirs().isEmpty());
        assertFalse(state.lastVpnRotationTimestamp().isPresent());
    }

    @Test
    void deleteStateFileRemovesIt() throws Exception {
        JobState state = JobState.open(Files.createTempDirectory("state-delete"), 1);
        assertTrue(Files.exists(state.stateFilePath()));

        state.deleteStateFile();

        assertFalse(Files.exists(state.stateFilePath()));
    }
}
