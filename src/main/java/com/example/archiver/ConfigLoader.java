package com.example.archiver;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class ConfigLoader {
    private static final Logger LOGGER = LoggerFactory.getLogger(ConfigLoader.class);

    static final String DEFAULT_CRAWLER_IMAGE = "ghcr.io/openzim/zimit";
    static final String DEFAULT_CONTAINER_RUNTIME = "docker";
    private static final int DEFAULT_INITIAL_WORKERS = 1;
    private static final int DEFAULT_MAX_STAGE_ATTEMPTS = 100;
    private static final int DEFAULT_BACKOFF_DELAY_MINUTES = 15;
    private static final int DEFAULT_MONITOR_INTERVAL_SECONDS = 30;
    private static final int DEFAULT_STALL_TIMEOUT_MINUTES = 30;
    private static final int DEFAULT_ERROR_THRESHOLD = 10;
    private static final int DEFAULT_MIN_WORKERS = 1;
    private static final int DEFAULT_MAX_WORKER_REDUCTIONS = 2;
    private static final int DEFAULT_MAX_VPN_ROTATIONS = 3;
    private static final int DEFAULT_VPN_ROTATION_FREQUENCY_MINUTES = 60;
    private static final int DEFAULT_MAX_CONTAINER_RESTARTS = 3;
    private static final String DEFAULT_MEMORY_LIMIT = "4g";
    private static final String DEFAULT_CPU_LIMIT = "1.5";

    private final ObjectMapper mapper;

    public ConfigLoader() {
        mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public ArchiverConfig load(Path path) throws IOException {
        return toConfig(mapper.readValue(path.toFile(), RawConfig.class));
    }

    public ArchiverConfig parse(String json) throws IOException {
        return toConfig(mapper.readValue(json, RawConfig.class));
    }

    private ArchiverConfig toConfig(RawConfig raw) {
        List<String> seeds = raw.seeds == null ? List.of() : raw.seeds.stream()
                .filter(seed -> seed != null && !seed.isBlank())
                .toList();
        if (seeds.isEmpty()) {
            throw new IllegalArgumentException("Config must include at least one seed URL.");
        }
        if (raw.name == null || raw.name.isBlank()) {
            throw new IllegalArgumentException("Config must include a job name.");
        }
        if (raw.outputDirectory == null || raw.outputDirectory.isBlank()) {
            throw new IllegalArgumentException("Config must include an outputDirectory.");
        }

        List<String> passthrough = raw.passthroughArgs == null ? List.of() : List.copyOf(raw.passthroughArgs);
        int initialWorkers = positiveOr(raw.initialWorkers, DEFAULT_INITIAL_WORKERS);

        RawMonitoring rawMonitoring = raw.monitoring == null ? new RawMonitoring() : raw.monitoring;
        MonitorSettings monitoring = new MonitorSettings(
                rawMonitoring.enabled != null && rawMonitoring.enabled,
                positiveOr(rawMonitoring.intervalSeconds, DEFAULT_MONITOR_INTERVAL_SECONDS),
                positiveOr(rawMonitoring.stallTimeoutMinutes, DEFAULT_STALL_TIMEOUT_MINUTES),
                positiveOr(rawMonitoring.errorThresholdTimeout, DEFAULT_ERROR_THRESHOLD),
                positiveOr(rawMonitoring.errorThresholdHttp, DEFAULT_ERROR_THRESHOLD)
        );

        RawAdaptation rawAdaptation = raw.adaptation == null ? new RawAdaptation() : raw.adaptation;
        AdaptationSettings adaptation = new AdaptationSettings(
                rawAdaptation.adaptiveWorkers != null && rawAdaptation.adaptiveWorkers,
                rawAdaptation.minWorkers == null ? DEFAULT_MIN_WORKERS : rawAdaptation.minWorkers,
                nonNegativeOr(rawAdaptation.maxWorkerReductions, DEFAULT_MAX_WORKER_REDUCTIONS),
                rawAdaptation.vpnRotation != null && rawAdaptation.vpnRotation,
                Optional.ofNullable(rawAdaptation.vpnConnectCommand).filter(value -> !value.isBlank()),
                nonNegativeOr(rawAdaptation.maxVpnRotations, DEFAULT_MAX_VPN_ROTATIONS),
                rawAdaptation.vpnRotationFrequencyMinutes == null
                        ? DEFAULT_VPN_ROTATION_FREQUENCY_MINUTES
                        : rawAdaptation.vpnRotationFrequencyMinutes,
                rawAdaptation.adaptiveRestart != null && rawAdaptation.adaptiveRestart,
                nonNegativeOr(rawAdaptation.maxContainerRestarts, DEFAULT_MAX_CONTAINER_RESTARTS)
        );
        validateAdaptation(monitoring, adaptation);

        RawContainer rawContainer = raw.container == null ? new RawContainer() : raw.container;
        ContainerSettings container = new ContainerSettings(
                limit(rawContainer.shmSize, null),
                limit(rawContainer.memoryLimit, DEFAULT_MEMORY_LIMIT),
                limit(rawContainer.cpuLimit, DEFAULT_CPU_LIMIT)
        );

        return new ArchiverConfig(
                seeds,
                raw.name.trim(),
                Path.of(raw.outputDirectory),
                effectiveInitialWorkers(initialWorkers, passthrough),
                optionalString(raw.crawlerImage, DEFAULT_CRAWLER_IMAGE),
                optionalString(raw.containerRuntime, DEFAULT_CONTAINER_RUNTIME),
                passthrough,
                raw.cleanup != null && raw.cleanup,
                raw.overwrite != null && raw.overwrite,
                raw.dryRun != null && raw.dryRun,
                raw.relaxPermissions != null && raw.relaxPermissions,
                positiveOr(raw.maxStageAttempts, DEFAULT_MAX_STAGE_ATTEMPTS),
                nonNegativeOr(raw.backoffDelayMinutes, DEFAULT_BACKOFF_DELAY_MINUTES),
                monitoring,
                adaptation,
                container
        );
    }

    private void validateAdaptation(MonitorSettings monitoring, AdaptationSettings adaptation) {
        if ((adaptation.adaptiveWorkers() || adaptation.vpnRotation()) && !monitoring.enabled()) {
            throw new IllegalArgumentException("adaptiveWorkers and vpnRotation require monitoring.enabled.");
        }
        if (adaptation.vpnRotation() && adaptation.vpnConnectCommand().isEmpty()) {
            throw new IllegalArgumentException("vpnRotation requires vpnConnectCommand to be set.");
        }
        if (adaptation.minWorkers() < 1) {
            throw new IllegalArgumentException("minWorkers must be 1 or greater.");
        }
        if (adaptation.vpnRotationFrequencyMinutes() < 0) {
            throw new IllegalArgumentException("vpnRotationFrequencyMinutes cannot be negative.");
        }
    }

    /**
     * A {@code --workers} value among the crawler arguments overrides the configured count.
     */
    static int effectiveInitialWorkers(int configured, List<String> passthroughArgs) {
        int workers = configured;
        for (int i = 0; i < passthroughArgs.size(); i++) {
            String arg = passthroughArgs.get(i);
            String value = null;
            if (arg.equals("--workers") && i + 1 < passthroughArgs.size()) {
                value = passthroughArgs.get(i + 1);
            } else if (arg.startsWith("--workers=")) {
                value = arg.substring("--workers=".length());
            }
            if (value == null) {
                continue;
            }
            try {
                workers = Integer.parseInt(value.trim());
                LOGGER.info("Crawler argument {} overrides initial workers: {}", arg, workers);
                break;
            } catch (NumberFormatException ex) {
                LOGGER.warn("Ignoring non-integer worker count '{}'.", value);
            }
        }
        return Math.max(1, workers);
    }

    private Optional<String> limit(String value, String fallback) {
        if (value == null) {
            return Optional.ofNullable(fallback);
        }
        return Optional.of(value).filter(v -> !v.isBlank());
    }

    private int positiveOr(Integer value, int fallback) {
        return value != null && value > 0 ? value : fallback;
    }

    private int nonNegativeOr(Integer value, int fallback) {
        return value != null && value >= 0 ? value : fallback;
    }

    private String optionalString(String value, String fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return value;
    }

    private static class RawConfig {
        public List<String> seeds = new ArrayList<>();
        public String name;
        public String outputDirectory;
        public Integer initialWorkers;
        public String crawlerImage;
        public String containerRuntime;
        public List<String> passthroughArgs;
        public Boolean cleanup;
        public Boolean overwrite;
        public Boolean dryRun;
        public Boolean relaxPermissions;
        public Integer maxStageAttempts;
        public Integer backoffDelayMinutes;
        public RawMonitoring monitoring;
        public RawAdaptation adaptation;
        public RawContainer container;
    }

    private static class RawMonitoring {
        public Boolean enabled;
        public Integer intervalSeconds;
        public Integer stallTimeoutMinutes;
        public Integer errorThresholdTimeout;
        public Integer errorThresholdHttp;
    }

    private static class RawAdaptation {
        public Boolean adaptiveWorkers;
        public Integer minWorkers;
        public Integer maxWorkerReductions;
        public Boolean vpnRotation;
        public String vpnConnectCommand;
        public Integer maxVpnRotations;
        public Integer vpnRotationFrequencyMinutes;
        public Boolean adaptiveRestart;
        public Integer maxContainerRestarts;
    }

    private static class RawContainer {
        public String shmSize;
        public String memoryLimit;
        public String cpuLimit;
    }
}
