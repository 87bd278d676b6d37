package io.jobhub4j.events;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.jobhub4j.JobManager;
import io.jobhub4j.core.StatusUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.function.BooleanSupplier;

/**
 * Renders a job manager subscription as a text event stream.
 *
 * <p>Each frame is {@code data: <json>\n\n}. The stream opens with a {@code connected} frame, emits one
 * {@code job_update} frame per status update and a {@code ping} frame after {@code keepAlive} without
 * traffic. It is framework neutral: the caller supplies the sink and the disconnect signal.
 */
public class JobEventStream {
    private static final Logger log = LoggerFactory.getLogger(JobEventStream.class);

    static final Duration POLL_SLICE = Duration.ofSeconds(1);

    private final JobManager manager;
    private final ObjectMapper objectMapper;
    private final Duration keepAlive;
    private final Clock clock;

    public JobEventStream(JobManager manager, ObjectMapper objectMapper, Duration keepAlive) {
        this(manager, objectMapper, keepAlive, Clock.systemUTC());
    }

    public JobEventStream(JobManager manager, ObjectMapper objectMapper, Duration keepAlive, Clock clock) {
        this.manager = Objects.requireNonNull(manager, "manager must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.keepAlive = Objects.requireNonNull(keepAlive, "keepAlive must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (keepAlive.isZero() || keepAlive.isNegative()) {
            throw new IllegalArgumentException("keepAlive must be positive");
        }
    }

    /**
     * Blocks the calling thread, forwarding updates to {@code sink} until {@code disconnected} reports true,
     * the sink fails, the subscription is closed by the manager, or the thread is interrupted.
     */
    public void stream(EventSink sink, BooleanSupplier disconnected) {
        Objects.requireNonNull(sink, "sink must not be null");
        Objects.requireNonNull(disconnected, "disconnected must not be null");

        Subscription subscription = manager.subscribe();
        log.debug("jobhub event stream opened subscriber={}", subscription.id());
        try {
            sink.send(frame(connected()));
            Instant lastSent = clock.instant();

            while (!disconnected.getAsBoolean()) {
                StatusUpdate update = subscription.poll(POLL_SLICE);
                if (update != null) {
                    sink.send(frame(jobUpdate(update)));
                    lastSent = clock.instant();
                    continue;
                }
                if (subscription.isClosed()) {
                    break;
                }
                Instant now = clock.instant();
                if (!now.isBefore(lastSent.plus(keepAlive))) {
                    sink.send(frame(ping()));
                    lastSent = now;
                }
            }
        } catch (IOException e) {
            log.debug("jobhub event stream consumer gone subscriber={} msg={}", subscription.id(), e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            manager.unsubscribe(subscription);
            log.debug("jobhub event stream closed subscriber={} dropped={}",
                    subscription.id(), subscription.droppedCount());
        }
    }

    ObjectNode connected() {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("type", "connected");
        node.put("timestamp", clock.instant().toString());
        return node;
    }

    ObjectNode ping() {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("type", "ping");
        node.put("timestamp", clock.instant().toString());
        return node;
    }

    ObjectNode jobUpdate(StatusUpdate update) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("type", "job_update");
        node.put("jobId", update.jobId());
        node.put("executionId", update.executionId());
        node.put("status", update.status().wireName());
        node.put("message", update.message());
        node.put("timestamp", update.timestamp().toString());
        return node;
    }

    private String frame(ObjectNode node) throws JsonProcessingException {
        return "data: " + objectMapper.writeValueAsString(node) + "\n\n";
    }
}
