package io.jobhub4j.config;

import io.jobhub4j.JobManager;
import io.jobhub4j.core.Job;
import io.jobhub4j.core.JobManagerException;
import io.jobhub4j.core.JobSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.util.HashSet;
import java.util.Set;

/**
 * Bridges JobManager start/stop lifecycle with the Spring container lifecycle, and registers the jobs
 * declared under {@code jobhub.jobs} that do not exist yet.
 */
public class JobHubLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(JobHubLifecycle.class);

    private final JobManager jobManager;
    private final JobHubProperties props;
    private volatile boolean running = false;

    public JobHubLifecycle(JobManager jobManager, JobHubProperties props) {
        this.jobManager = jobManager;
        this.props = props;
    }

    @Override
    public void start() {
        jobManager.start();
        registerConfiguredJobs();
        running = true;
    }

    @Override
    public void stop() {
        jobManager.stop();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }

    private void registerConfiguredJobs() {
        if (props.getJobs() == null || props.getJobs().isEmpty()) {
            return;
        }

        Set<String> existing = new HashSet<>();
        for (Job job : jobManager.getJobs()) {
            existing.add(job.id());
        }

        for (JobHubProperties.ConfiguredJob configured : props.getJobs()) {
            if (configured.getId() == null || configured.getId().isBlank()) {
                throw new IllegalStateException("jobhub.jobs entries must declare an id (name=" + configured.getName() + ")");
            }
            if (existing.contains(configured.getId())) {
                log.debug("jobhub configured job already present id={}", configured.getId());
                continue;
            }
            try {
                JobSpec spec = configured.toSpec();
                jobManager.create(spec);
            } catch (JobManagerException | IllegalArgumentException e) {
                throw new IllegalStateException("invalid jobhub.jobs entry id=" + configured.getId() + ": " + e.getMessage(), e);
            }
        }
    }
}
