package com.example.archiver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads facts back out of stage logs written by {@link StageLogDrain}.
 */
public final class CrawlLogParser {
    private static final Logger LOGGER = LoggerFactory.getLogger(CrawlLogParser.class);
    private static final Pattern TEMP_DIR_PATTERN = Pattern.compile(
            "Output to tempdir:\\s*\"?([/\\\\]?output[/\\\\]\\.tmp\\w+)\"?", Pattern.CASE_INSENSITIVE);
    private static final int TEMP_DIR_SCAN_BYTES = 15 * 1024;
    private static final int STATS_SCAN_BYTES = 1024 * 1024;

    private final LogLineClassifier classifier = new LogLineClassifier();

    /**
     * Finds the container temp dir the crawler announced, looking at the head and the
     * tail of the log only.
     */
    public Optional<String> findTempDirAnnouncement(Path logFile) {
        if (!Files.isRegularFile(logFile)) {
            LOGGER.warn("Log file not found or invalid for parsing temp dir: {}", logFile);
            return Optional.empty();
        }
        try {
            String text = readHead(logFile, TEMP_DIR_SCAN_BYTES) + "\n" + readTail(logFile, TEMP_DIR_SCAN_BYTES);
            Matcher matcher = TEMP_DIR_PATTERN.matcher(text);
            if (matcher.find()) {
                String containerPath = matcher.group(1).strip().replace('\\', '/');
                LOGGER.info("Found potential temp dir in log: {}", containerPath);
                return Optional.of(containerPath);
            }
            LOGGER.warn("Could not parse temp dir pattern from {}.", logFile);
        } catch (IOException ex) {
            LOGGER.error("Error reading log file {}", logFile, ex);
        }
        return Optional.empty();
    }

    /**
     * Resolves the temp dir announced in {@code logFile} on the host. Empty when the log
     * names none or the named directory does not exist.
     */
    public Optional<Path> tempDirFromLog(Path logFile, PathMapper mapper) {
        Optional<String> announced = findTempDirAnnouncement(logFile);
        if (announced.isEmpty()) {
            return Optional.empty();
        }
        Optional<Path> host = mapper.toHost(announced.get());
        if (host.isEmpty()) {
            LOGGER.warn("Could not convert parsed path '{}'", announced.get());
            return Optional.empty();
        }
        if (!Files.isDirectory(host.get())) {
            LOGGER.warn("Parsed host temp dir is not a directory: {}", host.get());
            return Optional.empty();
        }
        return host;
    }

    /**
     * Returns the last complete crawl statistics entry near the end of {@code logFile}.
     */
    public Optional<CrawlStats> lastStats(Path logFile) {
        if (!Files.isRegularFile(logFile)) {
            LOGGER.warn("Cannot parse stats, invalid log file path: {}", logFile);
            return Optional.empty();
        }
        List<String> lines;
        try {
            lines = readTail(logFile, STATS_SCAN_BYTES).lines().toList();
        } catch (IOException ex) {
            LOGGER.error("Error parsing stats log {}", logFile, ex);
            return Optional.empty();
        }
        for (int i = lines.size() - 1; i >= 0; i--) {
            String line = lines.get(i);
            if (!line.contains("Crawl statistics")) {
                continue;
            }
            Optional<CrawlStats> stats = classifier.classify(line).stats();
            if (stats.isPresent()) {
                if (stats.get().crawled() == null || stats.get().total() == null) {
                    LOGGER.warn("Last stats message missing data: {}", line);
                    return Optional.empty();
                }
                LOGGER.info("Parsed last stats from {}: {}", logFile.getFileName(), stats.get());
                return stats;
            }
        }
        LOGGER.info("No 'Crawl statistics' message found at the end of {}.", logFile.getFileName());
        return Optional.empty();
    }

    /**
     * Newest {@code archive_*.combined.log} in {@code directory} whose name matches {@code glob}.
     */
    public Optional<Path> newestLog(Path directory, String glob) {
        List<Path> logs = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, glob)) {
            stream.forEach(logs::add);
        } catch (IOException ex) {
            LOGGER.warn("Failed to scan logs under {} ({}): {}", directory, glob, ex.getMessage());
            return Optional.empty();
        }
        return logs.stream().max(Comparator.comparingLong(ArtifactLocator::modifiedMillis));
    }

    private static String readHead(Path file, int bytes) throws IOException {
        try (SeekableByteChannel channel = Files.newByteChannel(file)) {
            ByteBuffer buffer = ByteBuffer.allocate((int) Math.min(bytes, channel.size()));
            fill(channel, buffer);
            return new String(buffer.array(), 0, buffer.position(), StandardCharsets.UTF_8);
        }
    }

    private static String readTail(Path file, int bytes) throws IOException {
        try (SeekableByteChannel channel = Files.newByteChannel(file)) {
            long size = channel.size();
            int length = (int) Math.min(bytes, size);
            channel.position(size - length);
            ByteBuffer buffer = ByteBuffer.allocate(length);
            fill(channel, buffer);
            return new String(buffer.array(), 0, buffer.position(), StandardCharsets.UTF_8);
        }
    }

    private static void fill(SeekableByteChannel channel, ByteBuffer buffer) throws IOException {
        int read;
        do {
            read = channel.read(buffer);
        } while (read > 0 && buffer.hasRemaining());
    }
}
