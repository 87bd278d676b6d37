package io.jobhub4j.core;

/**
 * A job definition or patch failed validation. Nothing was changed.
 */
public class InvalidJobConfigException extends JobManagerException {

    public InvalidJobConfigException(String jobId, String reason) {
        super(ErrorKind.INVALID_CONFIG, jobId, "invalid job configuration: " + reason);
    }

    public InvalidJobConfigException(String jobId, String reason, Throwable cause) {
        super(ErrorKind.INVALID_CONFIG, jobId, "invalid job configuration: " + reason, cause);
    }
}
