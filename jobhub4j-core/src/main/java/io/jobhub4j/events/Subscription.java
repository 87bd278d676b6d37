package io.jobhub4j.events;

import io.jobhub4j.core.StatusUpdate;
import io.jobhub4j.core.UpdateStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A live, best-effort feed of {@link StatusUpdate}s backed by a bounded buffer.
 *
 * <p>The publisher never waits for this subscriber: when the buffer is full the update is dropped and
 * counted. Consumers must tolerate gaps; the execution history is the durable record.
 */
public final class Subscription implements AutoCloseable {

    // wakes a consumer blocked in poll() when the subscription closes
    private static final StatusUpdate CLOSED =
            new StatusUpdate("", -1, UpdateStatus.CANCELLED, "subscription closed", Instant.EPOCH);

    private final long id;
    private final EventBus bus;
    private final BlockingQueue<StatusUpdate> buffer;
    private final int capacity;
    private final AtomicLong dropped = new AtomicLong();
    private volatile boolean closed;

    Subscription(long id, int capacity, EventBus bus) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be a positive number");
        }
        this.id = id;
        this.bus = Objects.requireNonNull(bus, "bus must not be null");
        // one extra slot so the close marker always fits
        this.buffer = new ArrayBlockingQueue<>(capacity + 1);
        this.capacity = capacity;
    }

    public long id() {
        return id;
    }

    /**
     * Waits up to {@code timeout} for the next update.
     *
     * @return the next update, or null on timeout or once the subscription is closed
     */
    public StatusUpdate poll(Duration timeout) throws InterruptedException {
        if (closed && buffer.isEmpty()) {
            return null;
        }
        StatusUpdate next = buffer.poll(Math.max(0, timeout.toMillis()), TimeUnit.MILLISECONDS);
        return next == CLOSED ? null : next;
    }

    /**
     * Non-blocking variant of {@link #poll(Duration)}.
     */
    public StatusUpdate poll() {
        StatusUpdate next = buffer.poll();
        return next == CLOSED ? null : next;
    }

    /**
     * Removes and returns everything currently buffered, oldest first.
     */
    public List<StatusUpdate> drain() {
        List<StatusUpdate> out = new ArrayList<>();
        buffer.drainTo(out);
        out.removeIf(u -> u == CLOSED);
        return out;
    }

    /**
     * Updates discarded because the buffer was full.
     */
    public long droppedCount() {
        return dropped.get();
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Deregisters from the bus. Idempotent.
     */
    @Override
    public void close() {
        bus.unsubscribe(this);
    }

    // synchronized with markClosed so publishers never take the close marker's slot
    synchronized boolean offer(StatusUpdate update) {
        if (closed) {
            return false;
        }
        if (buffer.size() >= capacity || !buffer.offer(update)) {
            dropped.incrementAndGet();
            return false;
        }
        return true;
    }

    synchronized void markClosed() {
        if (closed) {
            return;
        }
        closed = true;
        buffer.offer(CLOSED);
    }
}
