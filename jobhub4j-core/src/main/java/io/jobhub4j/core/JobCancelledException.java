package io.jobhub4j.core;

/**
 * Thrown from inside a job's work when it observes a cancellation request.
 * The executor records the execution as cancelled rather than failed.
 */
public class JobCancelledException extends RuntimeException {

    public JobCancelledException(String message) {
        super(message);
    }
}
