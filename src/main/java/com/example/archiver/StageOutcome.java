package com.example.archiver;

public enum StageOutcome {
    SUCCESS,
    FAILED,
    STOPPED,
    STOPPED_FOR_ADAPTATION
}
