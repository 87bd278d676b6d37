package io.jobhub4j.core;

/**
 * Transient run state of a job. {@link #IDLE} is both the initial and the resting state.
 */
public enum JobState {
    IDLE,
    RUNNING,
    CANCELLING;

    public boolean isActive() {
        return this != IDLE;
    }
}
