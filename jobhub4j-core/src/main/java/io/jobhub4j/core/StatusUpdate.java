package io.jobhub4j.core;

import java.time.Instant;

/**
 * Immutable status-change event fanned out to live subscribers.
 */
public record StatusUpdate(
        String jobId,
        long executionId,
        UpdateStatus status,
        String message,
        Instant timestamp
) {
}
