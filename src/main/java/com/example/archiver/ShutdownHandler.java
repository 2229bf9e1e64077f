package com.example.archiver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs on JVM shutdown (SIGINT/SIGTERM): raises the shutdown signal, stops the container
 * in flight and gives the main thread a bounded window to finish its summary.
 */
public final class ShutdownHandler implements Runnable {
    private static final Logger LOGGER = LoggerFactory.getLogger(ShutdownHandler.class);
    private static final Duration MAIN_THREAD_GRACE = Duration.ofSeconds(30);

    private final ShutdownSignal shutdown;
    private final ContainerSupervisor supervisor;
    private final Thread mainThread;
    private final AtomicBoolean armed = new AtomicBoolean(true);

    public ShutdownHandler(ShutdownSignal shutdown, ContainerSupervisor supervisor, Thread mainThread) {
        this.shutdown = shutdown;
        this.supervisor = supervisor;
        this.mainThread = mainThread;
    }

    public void install() {
        Runtime.getRuntime().addShutdownHook(new Thread(this, "archiver-shutdown"));
    }

    /**
     * Marks a normal exit. Returns false if the hook already started, in which case the
     * caller must not call {@link System#exit(int)}.
     */
    public boolean disarm() {
        return armed.compareAndSet(true, false);
    }

    @Override
    public void run() {
        if (!armed.compareAndSet(true, false)) {
            return;
        }
        LOGGER.warn("Shutdown requested. Stopping crawl...");
        shutdown.trigger();
        supervisor.current().ifPresent(this::stopContainer);
        try {
            mainThread.join(MAIN_THREAD_GRACE.toMillis());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
        if (mainThread.isAlive()) {
            LOGGER.warn("Main thread did not finish within {}s of shutdown.", MAIN_THREAD_GRACE.toSeconds());
        }
    }

    private void stopContainer(LaunchedContainer container) {
        if (!supervisor.stopLaunched(container)) {
            LOGGER.warn("Container not identified; terminating engine client only.");
        }
        Process process = container.process();
        if (!process.isAlive()) {
            return;
        }
        try {
            process.destroy();
            if (!process.waitFor(10, TimeUnit.SECONDS)) {
                LOGGER.warn("Engine client did not terminate, killing it.");
                process.destroyForcibly();
                process.waitFor(5, TimeUnit.SECONDS);
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
        }
    }
}
