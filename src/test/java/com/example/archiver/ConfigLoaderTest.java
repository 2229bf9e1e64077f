package com.example.archiver;

import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigLoaderTest {
    private final ConfigLoader loader = new ConfigLoader();

    @Test
    void appliesDefaults() throws Exception {
        ArchiverConfig config = loader.parse(
                "{\"seeds\": [\"https://example.org\"], \"name\": \"example\", \"outputDirectory\": \"/data/out\"}");

        assertEquals(List.of("https://example.org"), config.seeds());
        assertEquals(1, config.initialWorkers());
        assertEquals("ghcr.io/openzim/zimit", config.crawlerImage());
        assertEquals("docker", config.containerRuntime());
        assertEquals(100, config.maxStageAttempts());
        assertEquals(15, config.backoffDelayMinutes());
        assertFalse(config.monitoring().enabled());
        assertEquals(30, config.monitoring().intervalSeconds());
        assertEquals(30, config.monitoring().stallTimeoutMinutes());
        assertEquals(10, config.monitoring().errorThresholdTimeout());
        assertEquals(3, config.adaptation().maxContainerRestarts());
        assertEquals(Optional.of("4g"), config.container().memoryLimit());
        assertEquals(Optional.empty(), config.container().shmSize());
        assertEquals(Path.of("/data/out/example.zim"), config.finalArtifact());
    }

    @Test
    void loadsFromFileAndIgnoresUnknownFields() throws Exception {
        Path file = Files.createTempFile("archiver-config", ".json");
        Files.writeString(file, "{\"seeds\": [\"https://a.example\", \" \"], \"name\": \" site \","
                + " \"outputDirectory\": \"out\", \"initialWorkers\": 4, \"someFutureOption\": true,"
                + " \"monitoring\": {\"enabled\": true, \"intervalSeconds\": 5},"
                + " \"adaptation\": {\"adaptiveWorkers\": true, \"minWorkers\": 2},"
                + " \"container\": {\"cpuLimit\": \"\"}}");

        ArchiverConfig config = loader.load(file);

        assertEquals(List.of("https://a.example"), config.seeds());
        assertEquals("site", config.name());
        assertEquals(4, config.initialWorkers());
        assertTrue(config.monitoring().enabled());
        assertEquals(5, config.monitoring().intervalSeconds());
        assertTrue(config.adaptation().adaptiveWorkers());
        assertEquals(2, config.adaptation().minWorkers());
        assertEquals(Optional.empty(), config.container().cpuLimit());
    }

    @Test
    void rejectsMissingRequiredFields() {
        assertThrows(IllegalArgumentException.class,
                () -> loader.parse("{\"seeds\": [], \"name\": \"x\", \"outputDirectory\": \"o\"}"));
        assertThrows(IllegalArgumentException.class,
                () -> loader.parse("{\"seeds\": [\"https://a\"], \"outputDirectory\": \"o\"}"));
        assertThrows(IllegalArgumentException.class,
                () -> loader.parse("{\"seeds\": [\"https://a\"], \"name\": \"x\"}"));
    }

    @Test
    void rejectsAdaptationWithoutMonitoring() {
        assertThrows(IllegalArgumentException.class, () -> loader.parse(
                "{\"seeds\": [\"https://a\"], \"name\": \"x\", \"outputDirectory\": \"o\","
                        + " \"adaptation\": {\"adaptiveWorkers\": true}}"));
    }

    @Test
    void rejectsRotationWithoutConnectCommand() {
        assertThrows(IllegalArgumentException.class, () -> loader.parse(
                "{\"seeds\": [\"https://a\"], \"name\": \"x\", \"outputDirectory\": \"o\","
                        + " \"monitoring\": {\"enabled\": true}, \"adaptation\": {\"vpnRotation\": true}}"));
    }

    @Test
    void rejectsInvalidMinWorkers() {
        assertThrows(IllegalArgumentException.class, () -> loader.parse(
                "{\"seeds\": [\"https://a\"], \"name\": \"x\", \"outputDirectory\": \"o\","
                        + " \"adaptation\": {\"minWorkers\": 0}}"));
    }

    @Test
    void crawlerWorkersArgumentOverridesInitialWorkers() throws Exception {
        ArchiverConfig config = loader.parse("{\"seeds\": [\"https://a\"], \"name\": \"x\", \"outputDirectory\": \"o\","
                + " \"initialWorkers\": 2, \"passthroughArgs\": [\"--workers\", \"6\"]}");
        assertEquals(6, config.initialWorkers());

        ArchiverConfig extended = config.withExtraPassthroughArgs(List.of("--lang", "eng"), true);
        assertEquals(6, extended.initialWorkers());
        assertTrue(extended.dryRun());
        assertEquals(List.of("--workers", "6", "--lang", "eng"), extended.passthroughArgs());
    }

    @Test
    void effectiveInitialWorkersIsAtLeastOne() {
        assertEquals(1, ConfigLoader.effectiveInitialWorkers(3, List.of("--workers=0")));
        assertEquals(3, ConfigLoader.effectiveInitialWorkers(3, List.of("--workers", "many")));
        assertEquals(5, ConfigLoader.effectiveInitialWorkers(3, List.of("--workers=5")));
    }
}
