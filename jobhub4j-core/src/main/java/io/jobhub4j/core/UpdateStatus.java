package io.jobhub4j.core;

import java.util.Locale;

/**
 * Kinds of live status transitions published for a job.
 */
public enum UpdateStatus {
    STARTED,
    PROGRESS,
    CANCELLING,
    COMPLETED,
    FAILED,
    CANCELLED;

    /**
     * Lower-case name used on the event stream (e.g. {@code "completed"}).
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public static UpdateStatus of(ExecutionStatus terminal) {
        return switch (terminal) {
            case SUCCEEDED -> COMPLETED;
            case FAILED -> FAILED;
            case CANCELLED -> CANCELLED;
            case RUNNING -> STARTED;
        };
    }
}
