package io.jobhub4j.core;

/**
 * What caused an execution: the scheduler loop or an explicit caller request.
 */
public enum Trigger {
    SCHEDULED,
    MANUAL
}
