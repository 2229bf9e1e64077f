package com.example.archiver;

import java.io.PrintStream;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

/**
 * Renders the one-line crawl status printed while a monitored stage runs.
 */
public final class StatusReporter {
    private final PrintStream out;
    private final AdaptationSettings adaptation;

    public StatusReporter(PrintStream out, AdaptationSettings adaptation) {
        this.out = out;
        this.adaptation = adaptation;
    }

    public void print(String stageLabel, RuntimeSnapshot snapshot, Instant now) {
        out.println(statusLine(stageLabel, snapshot, now, adaptation));
        out.flush();
    }

    static String statusLine(String stageLabel, RuntimeSnapshot snapshot, Instant now, AdaptationSettings adaptation) {
        String elapsed = snapshot.stageStartTime() == null
                ? "N/A"
                : formatDuration(Duration.between(snapshot.stageStartTime(), now));
        String total = snapshot.total() >= 0 ? Long.toString(snapshot.total()) : "?";
        String percent = snapshot.total() > 0 && snapshot.crawled() >= 0
                ? String.format(Locale.ROOT, "%.1f%%", snapshot.crawled() * 100.0 / snapshot.total())
                : "N/A";
        String maxRotations = adaptation.vpnRotation() ? Integer.toString(adaptation.maxVpnRotations()) : "N/A";
        String maxReductions = adaptation.adaptiveWorkers() ? Integer.toString(adaptation.maxWorkerReductions()) : "N/A";
        return String.format(Locale.ROOT,
                "[%s | %s] Crawled: %s/%s (%s) | Rate: %.1f ppm | Pending: %s | Failed: %s | Workers: %d"
                        + " | VRot: %d/%s | WRed: %d/%s | Errs(T/H/O): %d/%d/%d",
                stageLabel,
                elapsed,
                known(snapshot.crawled()),
                total,
                percent,
                snapshot.progressRatePpm(),
                known(snapshot.pending()),
                known(snapshot.failed()),
                snapshot.currentWorkers(),
                snapshot.vpnRotationsDone(),
                maxRotations,
                snapshot.workerReductionsDone(),
                maxReductions,
                snapshot.errors(ErrorCategory.TIMEOUT),
                snapshot.errors(ErrorCategory.HTTP),
                snapshot.errors(ErrorCategory.OTHER));
    }

    /**
     * Formats as {@code H:MM:SS}, or {@code M:SS} below one hour.
     */
    public static String formatDuration(Duration duration) {
        long seconds = Math.max(0L, duration.toSeconds());
        long hours = seconds / 3600;
        long minutes = (seconds % 3600) / 60;
        long secs = seconds % 60;
        if (hours > 0) {
            return String.format(Locale.ROOT, "%d:%02d:%02d", hours, minutes, secs);
        }
        return String.format(Locale.ROOT, "%d:%02d", minutes, secs);
    }

    private static String known(long value) {
        return value >= 0 ? Long.toString(value) : "-";
    }
}
