package io.jobhub4j.events;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.jobhub4j.JobManager;
import io.jobhub4j.core.StatusUpdate;
import io.jobhub4j.core.UpdateStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class JobEventStreamTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private EventBus bus;
    private JobManager manager;

    @BeforeEach
    void setUp() {
        bus = new EventBus(10);
        manager = mock(JobManager.class);
        when(manager.subscribe()).thenAnswer(inv -> bus.subscribe());
        doAnswer(inv -> {
            bus.unsubscribe(inv.getArgument(0));
            return null;
        }).when(manager).unsubscribe(any());
    }

    @Test
    void streamShouldSendConnectedThenJobUpdates() throws Exception {
        JobEventStream stream = new JobEventStream(manager, objectMapper, Duration.ofSeconds(30));
        BlockingQueue<String> frames = new LinkedBlockingQueue<>();
        AtomicBoolean disconnected = new AtomicBoolean(false);

        Thread consumer = new Thread(() -> stream.stream(frames::add, disconnected::get));
        consumer.start();

        JsonNode connected = read(frames);
        assertEquals("connected", connected.get("type").asText());
        assertTrue(connected.has("timestamp"));

        bus.publish(new StatusUpdate("scan", 7, UpdateStatus.COMPLETED, "Job Scan completed successfully",
                Instant.parse("2026-01-01T00:00:05Z")));

        JsonNode update = read(frames);
        assertEquals("job_update", update.get("type").asText());
        assertEquals("scan", update.get("jobId").asText());
        assertEquals(7, update.get("executionId").asLong());
        assertEquals("completed", update.get("status").asText());
        assertEquals("Job Scan completed successfully", update.get("message").asText());
        assertEquals("2026-01-01T00:00:05Z", update.get("timestamp").asText());

        disconnected.set(true);
        consumer.join(5000);
        assertFalse(consumer.isAlive());
        assertEquals(0, bus.subscriberCount());
        verify(manager).unsubscribe(any());
    }

    @Test
    void idleStreamShouldSendPing() throws Exception {
        JobEventStream stream = new JobEventStream(manager, objectMapper, Duration.ofMillis(100));
        BlockingQueue<String> frames = new LinkedBlockingQueue<>();
        AtomicBoolean disconnected = new AtomicBoolean(false);

        Thread consumer = new Thread(() -> stream.stream(frames::add, disconnected::get));
        consumer.start();

        assertEquals("connected", read(frames).get("type").asText());
        assertEquals("ping", read(frames).get("type").asText());

        disconnected.set(true);
        consumer.join(5000);
        assertFalse(consumer.isAlive());
    }

    @Test
    void failingSinkShouldEndStreamAndUnsubscribe() {
        JobEventStream stream = new JobEventStream(manager, objectMapper, Duration.ofSeconds(30));
        AtomicInteger sent = new AtomicInteger();

        stream.stream(frame -> {
            sent.incrementAndGet();
            throw new IOException("broken pipe");
        }, () -> false);

        assertEquals(1, sent.get());
        assertEquals(0, bus.subscriberCount());
    }

    @Test
    void closedSubscriptionShouldEndStream() throws Exception {
        JobEventStream stream = new JobEventStream(manager, objectMapper, Duration.ofSeconds(30));
        BlockingQueue<String> frames = new LinkedBlockingQueue<>();

        Thread consumer = new Thread(() -> stream.stream(frames::add, () -> false));
        consumer.start();
        read(frames);

        bus.closeAll();
        consumer.join(5000);
        assertFalse(consumer.isAlive());
    }

    private JsonNode read(BlockingQueue<String> frames) throws Exception {
        String frame = frames.poll(5, TimeUnit.SECONDS);
        assertNotNull(frame, "expected a frame");
        assertTrue(frame.startsWith("data: "));
        assertTrue(frame.endsWith("\n\n"));
        return objectMapper.readTree(frame.substring("data: ".length()).trim());
    }
}
