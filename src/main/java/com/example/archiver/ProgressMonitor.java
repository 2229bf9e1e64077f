package com.example.archiver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Follows a running crawler container's log stream, feeds the job state, and reports
 * stalls and error bursts to the control loop. Condition checks run on a fixed cadence
 * whether or not log lines arrive.
 */
public final class ProgressMonitor implements Runnable {
    private static final Logger LOGGER = LoggerFactory.getLogger(ProgressMonitor.class);
    private static final String END_OF_STREAM = new String("<end-of-stream>");
    static final int LOG_TAIL_LINES = 50;
    private static final Duration MAX_POLL = Duration.ofSeconds(1);

    private final String containerId;
    private final Process containerProcess;
    private final ContainerRuntime runtime;
    private final JobState state;
    private final MonitorSettings settings;
    private final BlockingQueue<MonitorEvent> events;
    private final ShutdownSignal shutdown;
    private final Clock clock;
    private final LogLineClassifier classifier = new LogLineClassifier();

    private volatile boolean stopRequested;
    private volatile Process logProcess;
    private Thread thread;

    public ProgressMonitor(String containerId, Process containerProcess, ContainerRuntime runtime, JobState state,
                           MonitorSettings settings, BlockingQueue<MonitorEvent> events, ShutdownSignal shutdown,
                           Clock clock) {
        this.containerId = containerId;
        this.containerProcess = containerProcess;
        this.runtime = runtime;
        this.state = state;
        this.settings = settings;
        this.events = events;
        this.shutdown = shutdown;
        this.clock = clock;
    }

    public void start() {
        thread = new Thread(this, "progress-monitor");
        thread.setDaemon(true);
        thread.start();
    }

    @Override
    public void run() {
        LOGGER.info("Starting monitoring for container {}...", containerId);
        try {
            Process logs = runtime.followLogs(containerId, LOG_TAIL_LINES);
            logProcess = logs;
            BlockingQueue<String> lines = new LinkedBlockingQueue<>();
            Thread reader = new Thread(() -> readLines(logs, lines), "progress-monitor-reader");
            reader.setDaemon(true);
            reader.start();
            monitorLoop(lines);
        } catch (IOException | RuntimeException ex) {
            if (!shutdown.isSet() && !stopRequested) {
                LOGGER.error("Error in monitoring thread", ex);
                offer(MonitorEvent.error(MonitorEvent.MONITOR_FAILED));
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        } finally {
            terminateLogProcess();
            LOGGER.info("Monitoring thread stopped.");
        }
    }

    private void monitorLoop(BlockingQueue<String> lines) throws InterruptedException {
        Duration interval = settings.interval();
        Duration pollTimeout = interval.compareTo(MAX_POLL) < 0 ? interval : MAX_POLL;
        Instant lastCheck = clock.instant();
        Instant lastProgressReport = lastCheck;

        while (!shutdown.isSet() && !stopRequested) {
            if (!containerProcess.isAlive()) {
                if (runtime.isRunning(containerId)) {
                    LOGGER.debug("Container {} still running although its client process exited.", containerId);
                } else {
                    LOGGER.info("Container {} has exited. Stopping monitor.", containerId);
                    return;
                }
            }

            String line = lines.poll(Math.max(1L, pollTimeout.toMillis()), TimeUnit.MILLISECONDS);
            if (line == END_OF_STREAM) {
                LOGGER.info("Container log stream ended.");
                return;
            }
            Instant now = clock.instant();
            if (line != null) {
                handleLine(line, now);
            }

            if (Duration.between(lastCheck, now).compareTo(interval) >= 0) {
                lastCheck = now;
                Optional<MonitorEvent> signal = checkConditions(now);
                if (signal.isPresent()) {
                    offer(signal.get());
                    lastProgressReport = now;
                }
            }
            if (Duration.between(lastProgressReport, now).compareTo(interval) >= 0) {
                offer(MonitorEvent.progress());
                lastProgressReport = now;
            }
        }
    }

    private void readLines(Process logs, BlockingQueue<String> lines) {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(logs.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                lines.add(line);
            }
        } catch (IOException ex) {
            if (!stopRequested) {
                LOGGER.warn("Error reading log stream: {}. Assuming logs ended.", ex.getMessage());
            }
        } finally {
            lines.add(END_OF_STREAM);
        }
    }

    /**
     * Applies one log line to the job state.
     */
    void handleLine(String line, Instant timestamp) {
        classifier.classify(line).applyTo(state, timestamp);
    }

    /**
     * Evaluates the stall rule, then the timeout and HTTP error thresholds. At most one
     * event is produced per check; producing one resets the error counters.
     */
    Optional<MonitorEvent> checkConditions(Instant now) {
        if (!settings.enabled()) {
            return Optional.empty();
        }
        RuntimeSnapshot snapshot = state.snapshot();
        Instant lastProgress = snapshot.lastProgressTimestamp();
        boolean pendingUnknownOrPositive = snapshot.pending() < 0 || snapshot.pending() > 0;
        if (lastProgress != null && snapshot.crawled() >= 0 && pendingUnknownOrPositive) {
            Duration sinceProgress = Duration.between(lastProgress, now);
            if (sinceProgress.compareTo(settings.stallTimeout()) > 0) {
                LOGGER.warn("Stall condition met: no progress for {} seconds.", sinceProgress.toSeconds());
                state.markStallHandled(now);
                return Optional.of(MonitorEvent.stalled(MonitorEvent.STALL_TIMEOUT));
            }
        }
        int timeouts = snapshot.errors(ErrorCategory.TIMEOUT);
        if (timeouts >= settings.errorThresholdTimeout()) {
            LOGGER.warn("Error condition met: {} timeouts.", timeouts);
            state.resetRuntimeErrors();
            return Optional.of(MonitorEvent.error(MonitorEvent.TIMEOUT_THRESHOLD));
        }
        int httpErrors = snapshot.errors(ErrorCategory.HTTP);
        if (httpErrors >= settings.errorThresholdHttp()) {
            LOGGER.warn("Error condition met: {} HTTP/network errors.", httpErrors);
            state.resetRuntimeErrors();
            return Optional.of(MonitorEvent.error(MonitorEvent.HTTP_THRESHOLD));
        }
        return Optional.empty();
    }

    private void offer(MonitorEvent event) {
        if (!events.offer(event)) {
            LOGGER.warn("Monitor event queue full, dropping {} event.", event.type());
        }
    }

    /**
     * Asks the monitor to finish and waits up to {@code timeout} for it.
     */
    public void stop(Duration timeout) {
        stopRequested = true;
        terminateLogProcess();
        if (thread == null) {
            return;
        }
        try {
            thread.join(Math.max(1L, timeout.toMillis()));
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
        if (thread.isAlive()) {
            LOGGER.warn("Monitor thread did not stop within {}s.", timeout.toSeconds());
        }
    }

    public boolean isAlive() {
        return thread != null && thread.isAlive();
    }

    private void terminateLogProcess() {
        Process logs = logProcess;
        if (logs == null || !logs.isAlive()) {
            return;
        }
        logs.destroy();
        try {
            if (!logs.waitFor(5, TimeUnit.SECONDS)) {
                LOGGER.warn("Log follower did not exit, killing it.");
                logs.destroyForcibly();
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            logs.destroyForcibly();
        }
    }
}
