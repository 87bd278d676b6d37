package io.jobhub4j.internal;

import io.jobhub4j.core.Execution;
import io.jobhub4j.core.ExecutionStatus;
import io.jobhub4j.core.Job;
import io.jobhub4j.core.JobSpec;
import io.jobhub4j.core.JobState;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mutable record of one job inside the manager. Every field below {@link #lock} is guarded by it.
 */
final class JobEntry {

    final String id;
    final ReentrantLock lock = new ReentrantLock();

    JobSpec spec;
    Instant createdAt;
    Instant updatedAt;
    JobState state = JobState.IDLE;
    Instant lastRunAt;
    ExecutionStatus lastStatus;
    String lastMessage;
    Duration lastDuration;
    Instant nextRunAt;
    boolean deleted;

    // in-flight executions in acceptance order
    final Map<Long, ActiveRun> runs = new LinkedHashMap<>();

    private Instant lastEventAt;

    JobEntry(JobSpec spec, Instant createdAt) {
        this.id = spec.id();
        this.spec = spec;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    static JobEntry restore(Job job) {
        JobEntry e = new JobEntry(job.toSpec(), job.createdAt());
        e.updatedAt = job.updatedAt() != null ? job.updatedAt() : job.createdAt();
        e.lastRunAt = job.lastRunAt();
        e.lastStatus = job.lastStatus();
        e.lastMessage = job.lastMessage();
        e.lastDuration = job.lastDuration();
        e.nextRunAt = job.nextRunAt();
        return e;
    }

    Job snapshot() {
        lock.lock();
        try {
            return new Job(
                    id,
                    spec.name(),
                    spec.type(),
                    spec.description(),
                    spec.category(),
                    spec.tags(),
                    spec.schedule(),
                    spec.config(),
                    spec.enabled(),
                    state,
                    lastRunAt,
                    lastStatus,
                    lastMessage,
                    lastDuration,
                    nextRunAt,
                    createdAt,
                    updatedAt
            );
        } finally {
            lock.unlock();
        }
    }

    /**
     * RUNNING while any in-flight run is not cancelled, CANCELLING while every remaining run is, IDLE when
     * nothing is in flight.
     */
    JobState deriveState() {
        if (runs.isEmpty()) {
            return JobState.IDLE;
        }
        for (ActiveRun run : runs.values()) {
            if (!run.token.isCancelled()) {
                return JobState.RUNNING;
            }
        }
        return JobState.CANCELLING;
    }

    /**
     * Event timestamp that never goes backwards for this job, even if the clock does.
     */
    Instant nextEventTime(Instant now) {
        if (lastEventAt != null && now.isBefore(lastEventAt)) {
            now = lastEventAt;
        }
        lastEventAt = now;
        return now;
    }

    static final class ActiveRun {
        final Execution execution;
        final CancellationToken token;

        ActiveRun(Execution execution, CancellationToken token) {
            this.execution = execution;
            this.token = token;
        }
    }
}
