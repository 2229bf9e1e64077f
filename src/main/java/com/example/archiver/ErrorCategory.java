package com.example.archiver;

/**
 * Buckets used to count crawler errors between progress events.
 */
public enum ErrorCategory {
    TIMEOUT("timeout"),
    HTTP("http"),
    OTHER("other");

    private final String key;

    ErrorCategory(String key) {
        this.key = key;
    }

    /**
     * Name used in the persisted error snapshot and in status lines.
     */
    public String key() {
        return key;
    }
}
