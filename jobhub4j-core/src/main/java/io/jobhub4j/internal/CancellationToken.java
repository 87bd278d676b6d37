package io.jobhub4j.internal;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One-shot cancellation signal for a single execution.
 */
final class CancellationToken {
    private final CountDownLatch signal = new CountDownLatch(1);
    private volatile boolean cancelled;

    /**
     * @return true if this call flipped the token
     */
    boolean cancel() {
        if (cancelled) {
            return false;
        }
        cancelled = true;
        signal.countDown();
        return true;
    }

    boolean isCancelled() {
        return cancelled;
    }

    /**
     * Waits up to {@code timeout} for cancellation.
     *
     * @return true if cancelled
     */
    boolean await(Duration timeout) throws InterruptedException {
        if (timeout.isNegative() || timeout.isZero()) {
            return cancelled;
        }
        return signal.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }
}
