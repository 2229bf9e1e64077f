package com.example.archiver;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class JobStateFile {
    private static final Logger LOGGER = LoggerFactory.getLogger(JobStateFile.class);

    private final ObjectMapper mapper;
    private final Path statePath;

    /**
     * Manages persistence of the durable job state to a single JSON file.
     */
    public JobStateFile(Path statePath) {
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.statePath = statePath;
    }

    /**
     * Reads the state file if it exists. Each field is validated on its own; a missing or
     * mistyped field falls back to its default instead of failing the whole load.
     */
    public Optional<PersistedJobState> load(int initialWorkers) throws IOException {
        if (!Files.exists(statePath)) {
            return Optional.empty();
        }
        JsonNode root;
        try (Reader reader = Files.newBufferedReader(statePath)) {
            root = mapper.readTree(reader);
        } catch (JsonProcessingException ex) {
            LOGGER.warn("Could not parse state file {}; resetting state. ({})", statePath, ex.getOriginalMessage());
            return Optional.empty();
        }
        if (root == null || !root.isObject()) {
            LOGGER.warn("State file {} does not hold a JSON object; resetting state.", statePath);
            return Optional.empty();
        }

        int currentWorkers = intField(root, "current_workers", initialWorkers, 1);
        if (currentWorkers > initialWorkers) {
            LOGGER.info("Clamping persisted worker count {} to initial workers {}.", currentWorkers, initialWorkers);
            currentWorkers = initialWorkers;
        }
        return Optional.of(new PersistedJobState(
                currentWorkers,
                initialWorkers,
                stringList(root, "temp_dirs_host_paths"),
                intField(root, "vpn_rotations_done", 0, 0),
                intField(root, "worker_reductions_done", 0, 0),
                intField(root, "container_restarts_done", 0, 0),
                errorCounts(root)
        ));
    }

    /**
     * Writes the state through a sibling temp file that is forced to disk and then renamed
     * over the target, so a crash leaves either the old or the new document.
     */
    public synchronized void save(PersistedJobState state) throws IOException {
        Path parent = statePath.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        byte[] payload = mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(state);
        Path temp = statePath.resolveSibling(statePath.getFileName() + ".tmp");
        try (FileChannel channel = FileChannel.open(temp,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
            ByteBuffer buffer = ByteBuffer.wrap(payload);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        }
        try {
            Files.move(temp, statePath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException ex) {
            Files.move(temp, statePath, StandardCopyOption.REPLACE_EXISTING);
        }
        syncDirectory(parent);
        LOGGER.debug("Saved persistent state to {}", statePath);
    }

    public boolean delete() throws IOException {
        return Files.deleteIfExists(statePath);
    }

    /**
     * Exposes the underlying state file path.
     */
    public Path path() {
        return statePath;
    }

    private void syncDirectory(Path directory) {
        try (FileChannel channel = FileChannel.open(directory, StandardOpenOption.READ)) {
            channel.force(true);
        } catch (IOException | UnsupportedOperationException ex) {
            // Not every platform can open a directory for fsync.
            LOGGER.debug("Directory sync skipped for {}: {}", directory, ex.getMessage());
        }
    }

    private int intField(JsonNode root, String field, int fallback, int minimum) {
        JsonNode node = root.get(field);
        if (node == null) {
            return fallback;
        }
        if (!node.isIntegralNumber() || !node.canConvertToInt() || node.intValue() < minimum) {
            LOGGER.warn("State field '{}' has invalid value {}; using default {}.", field, node, fallback);
            return fallback;
        }
        return node.intValue();
    }

    private List<String> stringList(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null) {
            return List.of();
        }
        if (!node.isArray()) {
            LOGGER.warn("State field '{}' is not a list; starting with no temp dirs.", field);
            return List.of();
        }
        List<String> values = new ArrayList<>();
        for (JsonNode element : node) {
            if (!element.isTextual() || element.textValue().isBlank()) {
                LOGGER.warn("State field '{}' contains a non-path entry {}; discarding the list.", field, element);
                return List.of();
            }
            values.add(element.textValue());
        }
        return values;
    }

    private Map<String, Integer> errorCounts(JsonNode root) {
        JsonNode node = root.get("last_error_counts");
        Map<String, Integer> counts = new LinkedHashMap<>();
        if (node == null || !node.isObject()) {
            return counts;
        }
        for (ErrorCategory category : ErrorCategory.values()) {
            JsonNode value = node.get(category.key());
            if (value != null && value.isIntegralNumber() && value.canConvertToInt()) {
                counts.put(category.key(), value.intValue());
            }
        }
        return counts;
    }
}
