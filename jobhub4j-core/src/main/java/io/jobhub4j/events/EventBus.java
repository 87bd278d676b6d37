package io.jobhub4j.events;

import io.jobhub4j.core.StatusUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fan-out of status updates to dynamically registered subscribers.
 *
 * <p>The registry is copy-on-write, so subscribing and unsubscribing never block a publisher, and
 * {@link #publish(StatusUpdate)} only performs non-blocking offers.
 */
public class EventBus {
    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final List<Subscription> subscribers = new CopyOnWriteArrayList<>();
    private final AtomicLong ids = new AtomicLong();
    private final int bufferSize;

    public EventBus(int bufferSize) {
        if (bufferSize <= 0) {
            throw new IllegalArgumentException("bufferSize must be a positive number");
        }
        this.bufferSize = bufferSize;
    }

    public Subscription subscribe() {
        Subscription s = new Subscription(ids.incrementAndGet(), bufferSize, this);
        subscribers.add(s);
        log.debug("jobhub subscriber added id={} subscribers={}", s.id(), subscribers.size());
        return s;
    }

    public void unsubscribe(Subscription subscription) {
        Objects.requireNonNull(subscription, "subscription must not be null");
        if (subscribers.remove(subscription)) {
            log.debug("jobhub subscriber removed id={} dropped={} subscribers={}",
                    subscription.id(), subscription.droppedCount(), subscribers.size());
        }
        subscription.markClosed();
    }

    /**
     * Delivers a copy of {@code update} to every registered subscriber whose buffer has room.
     */
    public void publish(StatusUpdate update) {
        Objects.requireNonNull(update, "update must not be null");
        for (Subscription s : subscribers) {
            if (!s.offer(update)) {
                log.debug("jobhub event dropped subscriber={} jobId={} status={} dropped={}",
                        s.id(), update.jobId(), update.status(), s.droppedCount());
            }
        }
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    /**
     * Closes every subscription, waking consumers blocked in {@link Subscription#poll}.
     */
    public void closeAll() {
        for (Subscription s : subscribers) {
            unsubscribe(s);
        }
    }
}
