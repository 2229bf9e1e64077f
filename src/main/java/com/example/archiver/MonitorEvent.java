package com.example.archiver;

/**
 * Message from a progress monitor to the control loop.
 */
public record MonitorEvent(Type type, String reason) {

    public enum Type {
        PROGRESS,
        STALLED,
        ERROR
    }

    public static final String STALL_TIMEOUT = "timeout";
    public static final String TIMEOUT_THRESHOLD = "timeout_threshold";
    public static final String HTTP_THRESHOLD = "http_threshold";
    public static final String MONITOR_FAILED = "monitor_failed";

    public static MonitorEvent progress() {
        return new MonitorEvent(Type.PROGRESS, "");
    }

    public static MonitorEvent stalled(String reason) {
        return new MonitorEvent(Type.STALLED, reason);
    }

    public static MonitorEvent error(String reason) {
        return new MonitorEvent(Type.ERROR, reason);
    }

    /**
     * True for events that call for an adaptive intervention.
     */
    public boolean isIntervention() {
        return type != Type.PROGRESS;
    }
}
