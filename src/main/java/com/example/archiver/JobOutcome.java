package com.example.archiver;

/**
 * Final result of one orchestrator run.
 */
public enum JobOutcome {
    SUCCESS,
    STOPPED,
    FAILED_MAX_ATTEMPTS,
    FAILED_NO_ARTIFACTS,
    FAILED_PATH_CONVERSION,
    FAILED_FINAL_BUILD;

    public boolean isSuccess() {
        return this == SUCCESS;
    }
}
