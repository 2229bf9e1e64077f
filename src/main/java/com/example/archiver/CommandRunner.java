package com.example.archiver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Runs external commands: short ones to completion with a timeout, long ones detached.
 */
public class CommandRunner {
    private static final Logger LOGGER = LoggerFactory.getLogger(CommandRunner.class);

    /**
     * Runs {@code command} and collects its output. A command that outlives {@code timeout}
     * is killed and reported as timed out. Throws {@link IOException} when it cannot start.
     */
    public CommandResult run(List<String> command, Duration timeout) throws IOException, InterruptedException {
        LOGGER.debug("Running command: {}", String.join(" ", command));
        Process process = new ProcessBuilder(command)
                .redirectInput(ProcessBuilder.Redirect.from(nullDevice()))
                .start();
        OutputCollector stdout = OutputCollector.start(process.getInputStream(), "command-stdout");
        OutputCollector stderr = OutputCollector.start(process.getErrorStream(), "command-stderr");
        if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
            process.destroyForcibly();
            process.waitFor(5, TimeUnit.SECONDS);
            LOGGER.warn("Command timed out after {}: {}", timeout, String.join(" ", command));
            return CommandResult.timeout();
        }
        return new CommandResult(process.exitValue(), stdout.await(), stderr.await(), false);
    }

    /**
     * Starts {@code command} with stderr merged into stdout and stdin closed.
     */
    public Process start(List<String> command) throws IOException {
        LOGGER.debug("Starting command: {}", String.join(" ", command));
        return new ProcessBuilder(command)
                .redirectErrorStream(true)
                .redirectInput(ProcessBuilder.Redirect.from(nullDevice()))
                .start();
    }

    /**
     * Resolves the executable of a command line against {@code PATH}.
     */
    public Optional<Path> which(String executable) {
        if (executable.contains("/")) {
            Path direct = Path.of(executable);
            return Files.isExecutable(direct) ? Optional.of(direct) : Optional.empty();
        }
        String pathVariable = System.getenv("PATH");
        if (pathVariable == null) {
            return Optional.empty();
        }
        for (String entry : pathVariable.split(File.pathSeparator)) {
            if (entry.isBlank()) {
                continue;
            }
            Path candidate = Path.of(entry).resolve(executable);
            if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /**
     * Splits a shell-style command line on whitespace, honouring single and double quotes.
     */
    public static List<String> splitCommand(String commandLine) {
        List<String> out = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        char quote = 0;
        boolean inToken = false;
        for (int i = 0; i < commandLine.length(); i++) {
            char c = commandLine.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                } else {
                    current.append(c);
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
                inToken = true;
            } else if (Character.isWhitespace(c)) {
                if (inToken) {
                    out.add(current.toString());
                    current.setLength(0);
                    inToken = false;
                }
            } else {
                current.append(c);
                inToken = true;
            }
        }
        if (quote != 0) {
            throw new IllegalArgumentException("Unbalanced quote in command: " + commandLine);
        }
        if (inToken) {
            out.add(current.toString());
        }
        return out;
    }

    private static File nullDevice() {
        return new File(System.getProperty("os.name").startsWith("Windows") ? "NUL" : "/dev/null");
    }

    /**
     * Reads one process stream to EOF on its own thread.
     */
    private static final class OutputCollector implements Runnable {
        private static final long JOIN_MILLIS = 5000;

        private final InputStream stream;
        private final Thread thread;
        private volatile String text = "";

        private OutputCollector(InputStream stream, String name) {
            this.stream = stream;
            this.thread = new Thread(this, name);
            this.thread.setDaemon(true);
        }

        static OutputCollector start(InputStream stream, String name) {
            OutputCollector collector = new OutputCollector(stream, name);
            collector.thread.start();
            return collector;
        }

        @Override
        public void run() {
            try (InputStream in = stream) {
                text = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException ex) {
                LOGGER.debug("Could not read command output: {}", ex.getMessage());
            }
        }

        String await() throws InterruptedException {
            thread.join(JOIN_MILLIS);
            if (thread.isAlive()) {
                LOGGER.debug("Command output still open after exit; ignoring it.");
            }
            return text;
        }
    }
}
