package io.jobhub4j.core;

public class InvalidJobRequestException extends JobManagerException {

    public InvalidJobRequestException(String jobId, String message) {
        super(ErrorKind.INVALID_REQUEST, jobId, message);
    }
}
