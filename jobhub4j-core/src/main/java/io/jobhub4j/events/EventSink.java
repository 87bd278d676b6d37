package io.jobhub4j.events;

import java.io.IOException;

/**
 * Destination for text event stream frames, e.g. a servlet response writer or an SSE emitter.
 */
@FunctionalInterface
public interface EventSink {

    /**
     * Writes and flushes one complete frame.
     *
     * @throws IOException when the consumer is gone; the stream ends
     */
    void send(String frame) throws IOException;
}
