package io.jobhub4j.internal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Background thread that runs a tick at a fixed interval. A failing tick is retried with exponential
 * backoff instead of the regular interval.
 */
final class SchedulerLoop {
    private static final Logger log = LoggerFactory.getLogger(SchedulerLoop.class);

    private final Duration tickInterval;
    private final Runnable tick;

    private volatile boolean running;
    private Thread thread;
    private int systemErrorCount = 0;

    SchedulerLoop(Duration tickInterval, Runnable tick) {
        this.tickInterval = Objects.requireNonNull(tickInterval, "tickInterval must not be null");
        this.tick = Objects.requireNonNull(tick, "tick must not be null");
    }

    synchronized void start() {
        if (thread != null) {
            return;
        }
        running = true;
        thread = new Thread(this::loop);
        thread.setName("jobhub.scheduler");
        thread.setDaemon(true);
        thread.start();
    }

    synchronized void stop() {
        running = false;
        if (thread == null) {
            return;
        }
        thread.interrupt();
        try {
            thread.join(tickInterval.toMillis() + 1000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        thread = null;
    }

    private void loop() {
        while (running) {
            try {
                tick.run();
                systemErrorCount = 0;
            } catch (Exception e) {
                systemErrorCount++;
                log.error("jobhub scheduler tick failed count={} msg={}", systemErrorCount, e.getMessage(), e);
                try {
                    Thread.sleep(backoff(systemErrorCount).toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
                continue;
            }

            try {
                Thread.sleep(tickInterval.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        log.debug("jobhub scheduler loop exited");
    }

    // Exponential backoff for repeated tick failures.
    static Duration backoff(int failCount) {
        int exp = Math.max(0, Math.min(failCount, 15));
        long ms = Math.min(1000L * (1L << exp), 60_000L);
        return Duration.ofMillis(ms);
    }
}
