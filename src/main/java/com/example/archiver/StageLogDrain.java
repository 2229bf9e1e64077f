package com.example.archiver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Copies a container's output stream into per-stage log files so the engine client
 * never blocks on a full pipe. The combined log is what temp-dir discovery and stats
 * parsing read later.
 */
public final class StageLogDrain {
    private static final Logger LOGGER = LoggerFactory.getLogger(StageLogDrain.class);
    static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final Path stdoutLog;
    private final Path combinedLog;
    private final Thread thread;

    private StageLogDrain(Path stdoutLog, Path combinedLog, Thread thread) {
        this.stdoutLog = stdoutLog;
        this.combinedLog = combinedLog;
        this.thread = thread;
    }

    public static StageLogDrain start(String stageLabel, Path outputDirectory, InputStream stream,
                                      boolean teeToStdout, Clock clock) {
        String slug = slug(stageLabel);
        String timestamp = LocalDateTime.now(clock).format(TIMESTAMP_FORMAT);
        String base = "archive_" + slug + "_" + timestamp;
        Path stdoutLog = outputDirectory.resolve(base + ".stdout.log");
        Path combinedLog = outputDirectory.resolve(base + ".combined.log");
        Thread thread = new Thread(() -> drain(stream, stdoutLog, combinedLog, teeToStdout),
                "stage-log-drain[" + slug + "]");
        thread.setDaemon(true);
        thread.start();
        return new StageLogDrain(stdoutLog, combinedLog, thread);
    }

    static String slug(String stageLabel) {
        return stageLabel.replace(' ', '_').toLowerCase(Locale.ROOT);
    }

    private static void drain(InputStream stream, Path stdoutLog, Path combinedLog, boolean teeToStdout) {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8));
             BufferedWriter stdoutWriter = open(stdoutLog);
             BufferedWriter combinedWriter = open(combinedLog)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (teeToStdout) {
                    System.out.println(line);
                }
                writeLine(stdoutWriter, line);
                writeLine(combinedWriter, line);
            }
        } catch (IOException ex) {
            LOGGER.warn("Stage log drain for {} stopped: {}", combinedLog.getFileName(), ex.getMessage());
        }
    }

    private static BufferedWriter open(Path path) throws IOException {
        Files.createDirectories(path.toAbsolutePath().getParent());
        return Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    }

    private static void writeLine(Writer writer, String line) throws IOException {
        writer.write(line);
        writer.write('\n');
        writer.flush();
    }

    /**
     * Waits for the drain to reach end of stream. Returns false if it is still running.
     */
    public boolean join(Duration timeout) {
        try {
            thread.join(Math.max(1L, timeout.toMillis()));
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
        if (thread.isAlive()) {
            LOGGER.warn("Stage log drain for {} still running after {}s.", combinedLog.getFileName(), timeout.toSeconds());
            return false;
        }
        return true;
    }

    public Path stdoutLog() {
        return stdoutLog;
    }

    public Path combinedLog() {
        return combinedLog;
    }
}
