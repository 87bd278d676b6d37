package io.jobhub4j;

import io.jobhub4j.core.Execution;
import io.jobhub4j.core.InvalidJobConfigException;
import io.jobhub4j.core.InvalidJobRequestException;
import io.jobhub4j.core.Job;
import io.jobhub4j.core.JobConflictException;
import io.jobhub4j.core.JobNotFoundException;
import io.jobhub4j.core.JobPatch;
import io.jobhub4j.core.JobSpec;
import io.jobhub4j.events.Subscription;

import java.util.List;

/**
 * Main job manager API.
 *
 * <p>Owns job definitions, the scheduler loop, the executor, the execution history and the status event
 * bus. Typical usage:
 * <pre>{@code
 * manager.start();
 *
 * manager.define("Source Files Scan", "process")
 *        .id("source-files-scan")
 *        .every("24 hours")
 *        .config(Map.of("command", "python3", "arguments", List.of("source_scan_job.py")))
 *        .save();
 *
 * manager.runJob("source-files-scan", false);
 * manager.stop();
 * }</pre>
 */
public interface JobManager {

    /**
     * Starts the scheduler loop and the worker pool. Idempotent.
     */
    void start();

    /**
     * Stops the scheduler loop, requests cancellation of every in-flight execution and waits for them to
     * settle. Idempotent.
     */
    void stop();

    boolean isRunning();

    JobBuilder define(String name, String type);

    /**
     * @throws InvalidJobConfigException when the definition fails validation
     * @throws JobConflictException      when a job with the same id already exists
     */
    Job create(JobSpec spec);

    /**
     * All jobs ordered by id.
     */
    List<Job> getJobs();

    /**
     * @throws JobNotFoundException when the id is unknown
     */
    Job getJob(String id);

    /**
     * Applies {@code patch} atomically: either every field changes or none does.
     *
     * @throws JobNotFoundException      when the id is unknown
     * @throws JobConflictException      while the job is running or cancelling
     * @throws InvalidJobConfigException when the patched definition fails validation
     */
    Job updateJob(String id, JobPatch patch);

    /**
     * @throws JobNotFoundException when the id is unknown
     * @throws JobConflictException while the job is running or cancelling
     */
    void deleteJob(String id);

    /**
     * Starts an execution and returns as soon as it is accepted.
     *
     * @param force start a second, independent execution even if one is in flight; also allows running a
     *              disabled job
     * @return the accepted execution, still running
     * @throws JobNotFoundException        when the id is unknown
     * @throws InvalidJobRequestException  when the job is disabled and {@code force} is false
     * @throws JobConflictException        when the job is already running and {@code force} is false
     * @throws IllegalStateException       when the manager is not started
     */
    Execution runJob(String id, boolean force);

    /**
     * Signals cancellation to the job's in-flight executions and returns without waiting.
     *
     * @throws JobNotFoundException       when the id is unknown
     * @throws InvalidJobRequestException when the job is not running
     */
    void cancelJob(String id);

    /**
     * Retained executions, newest first, at most {@code limit} of them.
     *
     * @throws JobNotFoundException       when the id is unknown
     * @throws InvalidJobRequestException when {@code limit} is not positive
     */
    List<Execution> getJobExecutions(String id, int limit);

    /**
     * Registers a live status subscriber. Close the returned subscription (or call
     * {@link #unsubscribe(Subscription)}) to release it.
     */
    Subscription subscribe();

    void unsubscribe(Subscription subscription);
}
