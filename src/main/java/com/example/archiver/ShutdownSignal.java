package com.example.archiver;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Process-wide cancellation flag. Every loop checks it at its boundaries and every
 * delay waits on it, so a shutdown request ends backoffs early.
 */
public final class ShutdownSignal {
    private final CountDownLatch latch = new CountDownLatch(1);

    public void trigger() {
        latch.countDown();
    }

    public boolean isSet() {
        return latch.getCount() == 0;
    }

    /**
     * Waits up to {@code timeout}. Returns true if shutdown was requested (or the waiting
     * thread was interrupted) before the timeout elapsed.
     */
    public boolean await(Duration timeout) {
        if (timeout.isZero() || timeout.isNegative()) {
            return isSet();
        }
        try {
            return latch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return true;
        }
    }
}
