package io.jobhub4j.core;

public class JobNotFoundException extends JobManagerException {

    public JobNotFoundException(String jobId) {
        super(ErrorKind.NOT_FOUND, jobId, "job not found: " + jobId);
    }
}
