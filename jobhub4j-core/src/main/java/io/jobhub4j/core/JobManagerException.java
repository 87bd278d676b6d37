package io.jobhub4j.core;

import java.util.Objects;

/**
 * Base type for failures a Manager operation reports synchronously to its caller.
 */
public abstract class JobManagerException extends RuntimeException {

    private final ErrorKind kind;
    private final String jobId;

    protected JobManagerException(ErrorKind kind, String jobId, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.jobId = jobId;
    }

    protected JobManagerException(ErrorKind kind, String jobId, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.jobId = jobId;
    }

    public ErrorKind kind() {
        return kind;
    }

    /**
     * Job the failure relates to; may be null for requests that never resolved a job.
     */
    public String jobId() {
        return jobId;
    }
}
