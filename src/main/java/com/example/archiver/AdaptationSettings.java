package com.example.archiver;

import java.time.Duration;
import java.util.Optional;

/**
 * Switches and budgets for the adaptive strategies.
 */
public record AdaptationSettings(
        boolean adaptiveWorkers,
        int minWorkers,
        int maxWorkerReductions,
        boolean vpnRotation,
        Optional<String> vpnConnectCommand,
        int maxVpnRotations,
        int vpnRotationFrequencyMinutes,
        boolean adaptiveRestart,
        int maxContainerRestarts
) {
    public Duration vpnRotationInterval() {
        return Duration.ofMinutes(vpnRotationFrequencyMinutes);
    }

    public static AdaptationSettings disabled() {
        return new AdaptationSettings(false, 1, 0, false, Optional.empty(), 0, 0, false, 0);
    }
}
