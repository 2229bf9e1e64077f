package com.example.archiver;

/**
 * Outcome of a short-lived external command.
 */
public record CommandResult(
        int exitCode,
        String stdout,
        String stderr,
        boolean timedOut
) {
    public boolean success() {
        return !timedOut && exitCode == 0;
    }

    public static CommandResult timeout() {
        return new CommandResult(-1, "", "", true);
    }
}
