package io.jobhub4j.core;

import java.time.Duration;
import java.time.Instant;

/**
 * One attempt to run a job. Instances are immutable; the executor replaces the running row with a
 * terminal copy when the attempt ends.
 */
public record Execution(
        long executionId,
        String jobId,
        Trigger trigger,
        boolean forced,
        ExecutionStatus status,
        Instant startedAt,
        Instant endedAt,
        String message,
        String error
) {

    public static Execution started(long executionId, String jobId, Trigger trigger, boolean forced, Instant startedAt) {
        return new Execution(executionId, jobId, trigger, forced, ExecutionStatus.RUNNING, startedAt, null, null, null);
    }

    public Execution finish(ExecutionStatus terminal, Instant endedAt, String message, String error) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("status must be terminal: " + terminal);
        }
        return new Execution(executionId, jobId, trigger, forced, terminal, startedAt, endedAt, message, error);
    }

    /**
     * Elapsed run time, or null while still running.
     */
    public Duration duration() {
        if (startedAt == null || endedAt == null) {
            return null;
        }
        return Duration.between(startedAt, endedAt);
    }

    public boolean isRunning() {
        return status == ExecutionStatus.RUNNING;
    }
}
