package io.jobhub4j.core;

import java.util.List;

/**
 * Optional durable store for job definitions and execution history.
 *
 * <p>The manager keeps all live state in memory; a repository only lets the wiring reload that state at
 * startup. Implementations are called outside job locks, possibly from worker threads, and their
 * failures are logged by the manager rather than propagated.
 */
public interface JobRepository {

    List<Job> loadJobs();

    void saveJob(Job job);

    /**
     * Removes the job and its execution history.
     */
    void deleteJob(String jobId);

    /**
     * Inserts or replaces the execution row with the same {@code executionId}.
     */
    void saveExecution(Execution execution);

    /**
     * Most recent executions first.
     */
    List<Execution> loadExecutions(String jobId, int limit);
}
