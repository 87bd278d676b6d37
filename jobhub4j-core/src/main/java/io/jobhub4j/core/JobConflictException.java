package io.jobhub4j.core;

/**
 * The operation is not allowed in the job's current state (e.g. run or update while running).
 */
public class JobConflictException extends JobManagerException {

    public JobConflictException(String jobId, String message) {
        super(ErrorKind.CONFLICT, jobId, message);
    }
}
