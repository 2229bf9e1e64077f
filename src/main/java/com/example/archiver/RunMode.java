package com.example.archiver;

/**
 * How the first stage of a run relates to earlier runs against the same output directory.
 */
public enum RunMode {
    FRESH("Initial Crawl"),
    RESUME("Resume Crawl"),
    NEW_PHASE_WITH_CONSOLIDATION("New Crawl Phase");

    private final String stageName;

    RunMode(String stageName) {
        this.stageName = stageName;
    }

    public String stageName() {
        return stageName;
    }
}
