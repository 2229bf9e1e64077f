package com.example.archiver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Crawl state for one output directory. Durable fields survive restarts through
 * {@link JobStateFile}; runtime fields are reset at the start of every stage attempt.
 * <p>
 * All access goes through one lock. File I/O happens after the lock is released, so no
 * method holding the lock may call {@link #save()}.
 */
public final class JobState {
    private static final Logger LOGGER = LoggerFactory.getLogger(JobState.class);
    public static final String STATE_FILE_NAME = ".archive_state.json";
    private static final Duration RATE_DECAY_WINDOW = Duration.ofSeconds(60);

    private final Object lock = new Object();
    private final Path outputDirectory;
    private final JobStateFile stateFile;

    private final int initialWorkers;
    private int currentWorkers;
    private List<String> tempDirs = new ArrayList<>();
    private int vpnRotationsDone;
    private int workerReductionsDone;
    private int containerRestartsDone;

    private String status = "initializing";
    private String currentStageName = "None";
    private Instant stageStartTime;
    private long lastCrawledCount = -1;
    private long lastTotalCount = -1;
    private long lastPendingCount = -1;
    private long lastFailedCount = -1;
    private Instant lastProgressTimestamp;
    private Instant lastStatsTimestamp;
    private long previousCrawledCount = -1;
    private Instant previousStatsTimestamp;
    private double progressRatePpm;
    private final Map<ErrorCategory, Integer> errorCounts = new EnumMap<>(ErrorCategory.class);
    private ErrorCategory lastErrorCategory;
    private Instant lastVpnRotationTimestamp;
    private Integer exitCode;

    private JobState(Path outputDirectory, int initialWorkers, JobStateFile stateFile) {
        this.outputDirectory = outputDirectory;
        this.initialWorkers = Math.max(1, initialWorkers);
        this.currentWorkers = this.initialWorkers;
        this.stateFile = stateFile;
        clearErrorCounts();
    }

    /**
     * Loads the state for {@code outputDirectory}, falling back to defaults for anything
     * missing or invalid, and writes it straight back so the file exists afterwards.
     */
    public static JobState open(Path outputDirectory, int initialWorkers) throws IOException {
        Path resolved = outputDirectory.toAbsolutePath().normalize();
        JobStateFile file = new JobStateFile(resolved.resolve(STATE_FILE_NAME));
        JobState state = new JobState(resolved, initialWorkers, file);
        Optional<PersistedJobState> loaded = file.load(state.initialWorkers);
        if (loaded.isPresent()) {
            PersistedJobState persisted = loaded.get();
            state.currentWorkers = Math.max(1, Math.min(persisted.currentWorkers(), state.initialWorkers));
            state.tempDirs = new ArrayList<>(persisted.tempDirs());
            state.vpnRotationsDone = persisted.vpnRotationsDone();
            state.workerReductionsDone = persisted.workerReductionsDone();
            state.containerRestartsDone = persisted.containerRestartsDone();
            LOGGER.info("Loaded persistent state from {}: Workers={}, Rotations={}, Reductions={}, Restarts={}, TempDirs={}",
                    file.path(), state.currentWorkers, state.vpnRotationsDone, state.workerReductionsDone,
                    state.containerRestartsDone, state.tempDirs.size());
        } else {
            LOGGER.info("No usable state file at {}. Initializing fresh state.", file.path());
        }
        state.persist();
        return state;
    }

    /**
     * Persists the durable fields. Temp dirs are reduced to existing directories,
     * deduplicated by canonical path and ordered oldest first. Failures are logged.
     */
    public void save() {
        try {
            persist();
        } catch (IOException ex) {
            LOGGER.error("Could not save state file {}", stateFile.path(), ex);
        }
    }

    private void persist() throws IOException {
        List<String> candidates;
        synchronized (lock) {
            candidates = new ArrayList<>(tempDirs);
        }
        List<String> normalized = normalizeTempDirs(candidates);
        PersistedJobState snapshot;
        synchronized (lock) {
            List<String> merged = new ArrayList<>(normalized);
            for (String path : tempDirs) {
                if (!candidates.contains(path) && !merged.contains(path)) {
                    merged.add(path);
                }
            }
            tempDirs = merged;
            snapshot = new PersistedJobState(
                    currentWorkers,
                    initialWorkers,
                    List.copyOf(tempDirs),
                    vpnRotationsDone,
                    workerReductionsDone,
                    containerRestartsDone,
                    errorSnapshotLocked()
            );
        }
        stateFile.save(snapshot);
    }

    private List<String> normalizeTempDirs(List<String> paths) {
        Map<String, Long> byCanonical = new LinkedHashMap<>();
        for (String raw : paths) {
            Path path = Path.of(raw);
            long mtime;
            try {
                BasicFileAttributes attrs = Files.readAttributes(path, BasicFileAttributes.class);
                if (!attrs.isDirectory()) {
                    continue;
                }
                mtime = attrs.lastModifiedTime().toMillis();
            } catch (NoSuchFileException ex) {
                continue;
            } catch (IOException ex) {
                // Storage may be transiently unreachable; keep the entry and let a later save decide.
                LOGGER.warn("Could not stat temp dir {}: {}", path, ex.getMessage());
                mtime = 0L;
            }
            byCanonical.putIfAbsent(canonical(path), mtime);
        }
        List<Map.Entry<String, Long>> entries = new ArrayList<>(byCanonical.entrySet());
        entries.sort(Map.Entry.comparingByValue(Comparator.naturalOrder()));
        List<String> result = new ArrayList<>(entries.size());
        entries.forEach(entry -> result.add(entry.getKey()));
        return result;
    }

    private static String canonical(Path path) {
        try {
            return path.toRealPath().toString();
        } catch (IOException ex) {
            return path.toAbsolutePath().normalize().toString();
        }
    }

    /**
     * Records a temp dir produced by a stage attempt and persists immediately.
     */
    public void addTempDir(Path tempDir) {
        if (tempDir == null) {
            return;
        }
        if (!Files.isDirectory(tempDir)) {
            LOGGER.warn("Attempted to add non-directory temp path: {}", tempDir);
            return;
        }
        String path = canonical(tempDir);
        synchronized (lock) {
            if (tempDirs.contains(path)) {
                return;
            }
            LOGGER.debug("Adding temp dir to state: {}", path);
            tempDirs.add(path);
        }
        save();
    }

    /**
     * Returns the recorded temp dirs that still exist, oldest first. Entries that vanished
     * are dropped from the state.
     */
    public List<Path> tempDirs() {
        List<Path> existing = new ArrayList<>();
        Set<String> stale = new LinkedHashSet<>();
        synchronized (lock) {
            for (String raw : tempDirs) {
                Path path = Path.of(raw);
                if (Files.isDirectory(path)) {
                    existing.add(path);
                } else {
                    stale.add(raw);
                }
            }
            if (!stale.isEmpty()) {
                tempDirs.removeAll(stale);
            }
        }
        if (!stale.isEmpty()) {
            stale.forEach(path -> LOGGER.warn("Temp dir from state no longer exists: {}. Removing from state.", path));
            save();
        }
        return existing;
    }

    /**
     * Wipes counters and temp-dir history for a run that replaces an existing final artifact.
     */
    public void resetForOverwrite() {
        synchronized (lock) {
            currentWorkers = initialWorkers;
            tempDirs = new ArrayList<>();
            vpnRotationsDone = 0;
            workerReductionsDone = 0;
            containerRestartsDone = 0;
            lastVpnRotationTimestamp = null;
        }
        save();
    }

    public void resetAdaptationCounts() {
        synchronized (lock) {
            vpnRotationsDone = 0;
            workerReductionsDone = 0;
            containerRestartsDone = 0;
            lastVpnRotationTimestamp = null;
        }
        save();
    }

    public void resetRuntimeErrors() {
        synchronized (lock) {
            clearErrorCounts();
        }
        LOGGER.debug("Runtime error counts reset.");
    }

    /**
     * Clears progress and error tracking before a new stage attempt starts.
     */
    public void resetForNewStage(String stageName, Instant startedAt) {
        synchronized (lock) {
            status = "running";
            currentStageName = stageName;
            stageStartTime = startedAt;
            exitCode = null;
            lastCrawledCount = -1;
            lastTotalCount = -1;
            lastPendingCount = -1;
            lastFailedCount = -1;
            lastProgressTimestamp = null;
            lastStatsTimestamp = null;
            previousCrawledCount = -1;
            previousStatsTimestamp = null;
            progressRatePpm = 0.0;
            clearErrorCounts();
        }
    }

    /**
     * Applies one crawl statistics entry. A strict increase in the crawled count counts as
     * progress and clears the error counters.
     */
    public void updateProgress(CrawlStats stats, Instant timestamp) {
        synchronized (lock) {
            long crawled = CrawlStats.valueOr(stats.crawled(), lastCrawledCount);
            long total = CrawlStats.valueOr(stats.total(), lastTotalCount);
            long pending = CrawlStats.valueOr(stats.pending(), lastPendingCount);
            long failed = CrawlStats.valueOr(stats.failed(), lastFailedCount);

            if (previousCrawledCount < 0 && crawled >= 0) {
                previousCrawledCount = crawled;
                previousStatsTimestamp = timestamp;
            }
            updateRateLocked(crawled, timestamp);

            boolean progressMade = crawled > lastCrawledCount;
            boolean statsChanged = crawled != lastCrawledCount
                    || total != lastTotalCount
                    || pending != lastPendingCount
                    || failed != lastFailedCount;
            if (progressMade) {
                lastProgressTimestamp = timestamp;
                if (hasErrorsLocked()) {
                    LOGGER.info("Progress detected, resetting error counts.");
                    clearErrorCounts();
                }
            }
            lastCrawledCount = crawled;
            lastTotalCount = total;
            lastPendingCount = pending;
            lastFailedCount = failed;
            lastStatsTimestamp = timestamp;
            if (statsChanged) {
                LOGGER.debug("Stats Update: Crawled={}, Total={}, Pending={}, Failed={}, Rate={} ppm",
                        crawled, total, pending, failed, String.format("%.1f", progressRatePpm));
            }
        }
    }

    private void updateRateLocked(long crawled, Instant timestamp) {
        if (previousStatsTimestamp == null || !timestamp.isAfter(previousStatsTimestamp)
                || crawled < previousCrawledCount) {
            return;
        }
        Duration elapsed = Duration.between(previousStatsTimestamp, timestamp);
        long delta = crawled - previousCrawledCount;
        if (delta > 0 && elapsed.toMillis() > 1000) {
            progressRatePpm = delta * 60_000.0 / elapsed.toMillis();
            previousStatsTimestamp = timestamp;
            previousCrawledCount = crawled;
        } else if (delta == 0 && elapsed.compareTo(RATE_DECAY_WINDOW) > 0) {
            progressRatePpm = 0.0;
            previousStatsTimestamp = timestamp;
            previousCrawledCount = crawled;
        }
    }

    public void recordError(ErrorCategory category) {
        synchronized (lock) {
            errorCounts.merge(category, 1, Integer::sum);
            lastErrorCategory = category;
        }
    }

    /**
     * Called after a stall was signalled: restarts the stall clock and clears the error counters.
     */
    public void markStallHandled(Instant now) {
        synchronized (lock) {
            lastProgressTimestamp = now;
            clearErrorCounts();
        }
    }

    /**
     * Lowers the worker count by one, never below {@code floor}. Returns the new count,
     * or empty when already at the floor.
     */
    public Optional<Integer> reduceWorkers(int floor) {
        Integer reduced = null;
        synchronized (lock) {
            if (currentWorkers > floor) {
                currentWorkers = Math.max(floor, currentWorkers - 1);
                workerReductionsDone++;
                clearErrorCounts();
                reduced = currentWorkers;
            }
        }
        if (reduced == null) {
            return Optional.empty();
        }
        save();
        return Optional.of(reduced);
    }

    public void recordVpnRotation(Instant rotatedAt) {
        synchronized (lock) {
            vpnRotationsDone++;
            lastVpnRotationTimestamp = rotatedAt;
            clearErrorCounts();
        }
        save();
    }

    public void recordContainerRestart() {
        synchronized (lock) {
            containerRestartsDone++;
            clearErrorCounts();
        }
        save();
    }

    public RuntimeSnapshot snapshot() {
        synchronized (lock) {
            return new RuntimeSnapshot(
                    currentStageName,
                    stageStartTime,
                    lastCrawledCount,
                    lastTotalCount,
                    lastPendingCount,
                    lastFailedCount,
                    lastProgressTimestamp,
                    progressRatePpm,
                    Map.copyOf(errorCounts),
                    currentWorkers,
                    vpnRotationsDone,
                    workerReductionsDone,
                    containerRestartsDone
            );
        }
    }

    public int currentWorkers() {
        synchronized (lock) {
            return currentWorkers;
        }
    }

    public int initialWorkers() {
        return initialWorkers;
    }

    public int vpnRotationsDone() {
        synchronized (lock) {
            return vpnRotationsDone;
        }
    }

    public int workerReductionsDone() {
        synchronized (lock) {
            return workerReductionsDone;
        }
    }

    public int containerRestartsDone() {
        synchronized (lock) {
            return containerRestartsDone;
        }
    }

    public Optional<Instant> lastVpnRotationTimestamp() {
        synchronized (lock) {
            return Optional.ofNullable(lastVpnRotationTimestamp);
        }
    }

    public Optional<ErrorCategory> lastErrorCategory() {
        synchronized (lock) {
            return Optional.ofNullable(lastErrorCategory);
        }
    }

    public void setStatus(String status) {
        synchronized (lock) {
            this.status = status;
        }
    }

    public String status() {
        synchronized (lock) {
            return status;
        }
    }

    public void setCurrentStageName(String stageName) {
        synchronized (lock) {
            this.currentStageName = stageName;
        }
    }

    public void setExitCode(Integer exitCode) {
        synchronized (lock) {
            this.exitCode = exitCode;
        }
    }

    public Optional<Integer> exitCode() {
        synchronized (lock) {
            return Optional.ofNullable(exitCode);
        }
    }

    public Optional<Instant> lastStatsTimestamp() {
        synchronized (lock) {
            return Optional.ofNullable(lastStatsTimestamp);
        }
    }

    public Path outputDirectory() {
        return outputDirectory;
    }

    public Path stateFilePath() {
        return stateFile.path();
    }

    /**
     * Removes the state file, used by cleanup after a successful run.
     */
    public void deleteStateFile() throws IOException {
        if (stateFile.delete()) {
            LOGGER.info("Deleted state file: {}", stateFile.path());
        }
    }

    private boolean hasErrorsLocked() {
        return errorCounts.values().stream().anyMatch(count -> count > 0);
    }

    private void clearErrorCounts() {
        for (ErrorCategory category : ErrorCategory.values()) {
            errorCounts.put(category, 0);
        }
        lastErrorCategory = null;
    }

    private Map<String, Integer> errorSnapshotLocked() {
        Map<String, Integer> snapshot = new LinkedHashMap<>();
        errorCounts.forEach((category, count) -> snapshot.put(category.key(), count));
        return snapshot;
    }
}
