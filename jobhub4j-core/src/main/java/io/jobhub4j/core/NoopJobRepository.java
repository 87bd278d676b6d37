package io.jobhub4j.core;

import java.util.List;

/**
 * Default repository: nothing survives a restart.
 */
public final class NoopJobRepository implements JobRepository {

    public static final NoopJobRepository INSTANCE = new NoopJobRepository();

    private NoopJobRepository() {
    }

    @Override
    public List<Job> loadJobs() {
        return List.of();
    }

    @Override
    public void saveJob(Job job) {
    }

    @Override
    public void deleteJob(String jobId) {
    }

    @Override
    public void saveExecution(Execution execution) {
    }

    @Override
    public List<Execution> loadExecutions(String jobId, int limit) {
        return List.of();
    }
}
