package io.jobhub4j;

import io.jobhub4j.core.JobCancelledException;
import io.jobhub4j.core.Trigger;

import java.time.Duration;

/**
 * Per-execution view handed to a {@link JobHandler}: identity, cooperative cancellation and progress
 * reporting.
 */
public interface JobContext {

    String jobId();

    String jobName();

    long executionId();

    Trigger trigger();

    boolean isCancelled();

    /**
     * @throws JobCancelledException if cancellation was requested
     */
    default void checkCancelled() {
        if (isCancelled()) {
            throw new JobCancelledException("job " + jobId() + " cancelled");
        }
    }

    /**
     * Sleeps for {@code duration} but wakes up early when cancellation is requested.
     *
     * @return true if the full duration elapsed, false if woken by cancellation
     */
    boolean pause(Duration duration) throws InterruptedException;

    /**
     * Publishes a {@code progress} status update for this job.
     */
    void progress(String message);

    /**
     * Sets the message recorded on the execution when it ends successfully.
     */
    void result(String message);
}
