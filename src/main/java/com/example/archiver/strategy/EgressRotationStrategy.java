package com.example.archiver.strategy;

import com.example.archiver.AdaptationSettings;
import com.example.archiver.CommandResult;
import com.example.archiver.CommandRunner;
import com.example.archiver.JobState;
import com.example.archiver.MonitorEvent;
import com.example.archiver.ShutdownSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Rotates the egress IP by running the configured VPN connect command while the
 * container keeps crawling.
 */
public class EgressRotationStrategy implements AdaptationStrategy {
    private static final Logger LOGGER = LoggerFactory.getLogger(EgressRotationStrategy.class);
    static final Duration COMMAND_TIMEOUT = Duration.ofSeconds(120);
    static final Duration DEFAULT_SETTLE_DELAY = Duration.ofSeconds(15);

    private final AdaptationSettings settings;
    private final CommandRunner runner;
    private final ShutdownSignal shutdown;
    private final Clock clock;
    private final Duration settleDelay;

    public EgressRotationStrategy(AdaptationSettings settings, CommandRunner runner, ShutdownSignal shutdown,
                                  Clock clock) {
        this(settings, runner, shutdown, clock, DEFAULT_SETTLE_DELAY);
    }

    EgressRotationStrategy(AdaptationSettings settings, CommandRunner runner, ShutdownSignal shutdown,
                           Clock clock, Duration settleDelay) {
        this.settings = settings;
        this.runner = runner;
        this.shutdown = shutdown;
        this.clock = clock;
        this.settleDelay = settleDelay;
    }

    @Override
    public String name() {
        return "egress-rotation";
    }

    @Override
    public boolean requiresRestart() {
        return false;
    }

    @Override
    public boolean attempt(JobState state, MonitorEvent event) {
        if (!settings.vpnRotation()) {
            LOGGER.debug("VPN rotation strategy disabled.");
            return false;
        }
        if (state.vpnRotationsDone() >= settings.maxVpnRotations()) {
            LOGGER.warn("VPN rotation: max rotations ({}) already performed.", settings.maxVpnRotations());
            return false;
        }
        Optional<String> connectCommand = settings.vpnConnectCommand().filter(command -> !command.isBlank());
        if (connectCommand.isEmpty()) {
            LOGGER.error("VPN rotation enabled, but no connect command is configured.");
            return false;
        }
        List<String> command;
        try {
            command = CommandRunner.splitCommand(connectCommand.get());
        } catch (IllegalArgumentException ex) {
            LOGGER.error("Could not parse VPN connect command: {}", ex.getMessage());
            return false;
        }
        if (command.isEmpty()) {
            LOGGER.error("VPN connect command is empty after parsing.");
            return false;
        }
        if (runner.which(command.get(0)).isEmpty()) {
            LOGGER.error("VPN connect command '{}' not found in PATH. Cannot rotate VPN.", command.get(0));
            return false;
        }

        Instant now = clock.instant();
        Duration required = settings.vpnRotationInterval();
        Optional<Instant> lastRotation = state.lastVpnRotationTimestamp();
        if (lastRotation.isPresent() && !required.isZero()) {
            Duration sinceLast = Duration.between(lastRotation.get(), now);
            if (sinceLast.compareTo(required) < 0) {
                LOGGER.info("VPN rotation frequency limit not met. Last rotation was {}s ago, need to wait {}s more.",
                        sinceLast.toSeconds(), required.minus(sinceLast).toSeconds());
                return false;
            }
        }

        LOGGER.warn("Attempting VPN rotation while container remains running...");
        if (!runCommand(command)) {
            return false;
        }
        LOGGER.info("Waiting {}s for the network to settle after VPN change...", settleDelay.toSeconds());
        if (shutdown.await(settleDelay)) {
            LOGGER.warn("Shutdown requested during post-VPN delay. Rotation not recorded.");
            return false;
        }
        state.recordVpnRotation(now);
        LOGGER.info("VPN rotation finished (count: {}/{}). Container continues running.",
                state.vpnRotationsDone(), settings.maxVpnRotations());
        return true;
    }

    private boolean runCommand(List<String> command) {
        LOGGER.info("Executing VPN connect command: {}", String.join(" ", command));
        try {
            CommandResult result = runner.run(command, COMMAND_TIMEOUT);
            if (result.timedOut()) {
                LOGGER.error("VPN connect command timed out after {}s.", COMMAND_TIMEOUT.toSeconds());
                return false;
            }
            if (!result.stdout().isBlank()) {
                LOGGER.info("VPN connect output: {}", result.stdout().strip());
            }
            if (!result.success()) {
                LOGGER.error("VPN connect command failed (rc={}): {}", result.exitCode(), result.stderr().strip());
                return false;
            }
            return true;
        } catch (IOException ex) {
            LOGGER.error("Could not run VPN connect command", ex);
            return false;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
