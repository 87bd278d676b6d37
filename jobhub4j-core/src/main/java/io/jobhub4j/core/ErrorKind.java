package io.jobhub4j.core;

/**
 * Synchronous failure categories returned to Manager callers.
 *
 * <p>Work failures are never thrown; they are recorded on the execution instead.
 */
public enum ErrorKind {
    NOT_FOUND,
    CONFLICT,
    INVALID_CONFIG,
    INVALID_REQUEST
}
