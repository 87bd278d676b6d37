package io.jobhub4j.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.jobhub4j.JobHandler;
import io.jobhub4j.core.Execution;
import io.jobhub4j.core.ExecutionStatus;
import io.jobhub4j.core.InvalidJobRequestException;
import io.jobhub4j.core.Job;
import io.jobhub4j.core.JobCancelledException;
import io.jobhub4j.core.JobConflictException;
import io.jobhub4j.core.JobHandlerRegistry;
import io.jobhub4j.core.JobNotFoundException;
import io.jobhub4j.core.JobRepository;
import io.jobhub4j.core.JobSpec;
import io.jobhub4j.core.JobState;
import io.jobhub4j.core.StatusUpdate;
import io.jobhub4j.core.Trigger;
import io.jobhub4j.core.UpdateStatus;
import io.jobhub4j.events.EventBus;
import io.jobhub4j.internal.JobEntry.ActiveRun;
import io.jobhub4j.utils.ScheduleCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Accepts runs, executes them on the worker pool and records their outcome.
 *
 * <p>Every state transition of a job and the status update that announces it happen under the job's
 * lock, so subscribers observe one job's updates in transition order. Repository writes happen after the
 * lock is released.
 */
final class JobExecutor {
    private static final Logger log = LoggerFactory.getLogger(JobExecutor.class);

    private final JobHandlerRegistry registry;
    private final ObjectMapper objectMapper;
    private final HistoryLedger ledger;
    private final EventBus bus;
    private final JobRepository repository;
    private final Clock clock;
    private final ZoneId defaultZone;
    private final AtomicLong executionIds = new AtomicLong();

    private volatile ExecutorService workerPool;

    JobExecutor(JobHandlerRegistry registry,
                ObjectMapper objectMapper,
                HistoryLedger ledger,
                EventBus bus,
                JobRepository repository,
                Clock clock,
                ZoneId defaultZone) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.ledger = Objects.requireNonNull(ledger, "ledger must not be null");
        this.bus = Objects.requireNonNull(bus, "bus must not be null");
        this.repository = Objects.requireNonNull(repository, "repository must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.defaultZone = Objects.requireNonNull(defaultZone, "defaultZone must not be null");
    }

    void attach(ExecutorService pool) {
        this.workerPool = pool;
    }

    ExecutorService detach() {
        ExecutorService pool = workerPool;
        workerPool = null;
        return pool;
    }

    /**
     * Makes sure ids handed out from now on are greater than {@code seen}.
     */
    void advanceExecutionIds(long seen) {
        executionIds.accumulateAndGet(seen, Math::max);
    }

    Execution launchManual(JobEntry entry, boolean force) {
        ExecutorService pool = workerPool;
        if (pool == null) {
            throw new IllegalStateException("job manager is not started");
        }

        RunTask task;
        entry.lock.lock();
        try {
            if (entry.deleted) {
                throw new JobNotFoundException(entry.id);
            }
            if (!entry.spec.enabled() && !force) {
                throw new InvalidJobRequestException(entry.id, "job is disabled");
            }
            if (!entry.runs.isEmpty() && !force) {
                throw new JobConflictException(entry.id, "job already running");
            }
            task = accept(entry, Trigger.MANUAL, force);
        } finally {
            entry.lock.unlock();
        }

        // before submit: the worker may write the terminal row at any moment after it
        persist(task.run.execution, task.entry.snapshot());
        submit(pool, task);
        return task.run.execution;
    }

    /**
     * Launches a scheduled run when the job is still due and idle at {@code now}.
     *
     * @return the accepted execution, or null when the job was skipped
     */
    Execution tryLaunchScheduled(JobEntry entry, Instant now) {
        ExecutorService pool = workerPool;
        if (pool == null) {
            return null;
        }

        RunTask task;
        entry.lock.lock();
        try {
            JobSpec spec = entry.spec;
            if (entry.deleted || !spec.enabled() || !spec.schedule().isAutomatic()) {
                return null;
            }
            if (entry.nextRunAt == null || entry.nextRunAt.isAfter(now)) {
                return null;
            }
            if (!entry.runs.isEmpty()) {
                log.debug("jobhub job still running, skipping scheduled run id={}", entry.id);
                return null;
            }
            task = accept(entry, Trigger.SCHEDULED, false);
        } finally {
            entry.lock.unlock();
        }

        // before submit: the worker may write the terminal row at any moment after it
        persist(task.run.execution, task.entry.snapshot());
        submit(pool, task);
        return task.run.execution;
    }

    /**
     * Signals every in-flight run of the job. Does not wait for them to stop.
     *
     * @throws InvalidJobRequestException when nothing is running
     */
    void cancel(JobEntry entry) {
        entry.lock.lock();
        try {
            if (entry.deleted) {
                throw new JobNotFoundException(entry.id);
            }
            if (entry.runs.isEmpty()) {
                throw new InvalidJobRequestException(entry.id, "job is not running");
            }
            if (entry.state == JobState.CANCELLING) {
                return;
            }
            signalCancel(entry);
        } finally {
            entry.lock.unlock();
        }
    }

    /**
     * Used on shutdown: signals the job's in-flight runs, if any.
     *
     * @return true if something was cancelled
     */
    boolean cancelQuietly(JobEntry entry) {
        entry.lock.lock();
        try {
            if (entry.runs.isEmpty() || entry.state == JobState.CANCELLING) {
                return false;
            }
            signalCancel(entry);
            return true;
        } finally {
            entry.lock.unlock();
        }
    }

    /**
     * Records a run that was accepted but never started because the pool refused or dropped it.
     */
    void abandon(Runnable queued) {
        if (queued instanceof RunTask task) {
            finish(task.entry, task.run, ExecutionStatus.CANCELLED,
                    "Job " + task.spec.name() + " cancelled", "worker pool shut down before the run started");
        }
    }

    // caller holds entry.lock
    private RunTask accept(JobEntry entry, Trigger trigger, boolean force) {
        Instant startedAt = clock.instant();
        JobSpec spec = entry.spec;
        Execution execution = Execution.started(executionIds.incrementAndGet(), entry.id, trigger, force, startedAt);
        ActiveRun run = new ActiveRun(execution, new CancellationToken());

        entry.runs.put(execution.executionId(), run);
        entry.state = entry.deriveState();
        if (trigger == Trigger.SCHEDULED) {
            entry.nextRunAt = null;
        }
        ledger.append(execution);
        publish(entry, execution.executionId(), UpdateStatus.STARTED, "Job " + spec.name() + " started", startedAt);

        log.debug("jobhub job accepted id={} execution={} trigger={} forced={}",
                entry.id, execution.executionId(), trigger, force);
        return new RunTask(entry, run, spec);
    }

    private void signalCancel(JobEntry entry) {
        long latest = -1;
        for (ActiveRun run : entry.runs.values()) {
            run.token.cancel();
            latest = run.execution.executionId();
        }
        entry.state = entry.deriveState();
        publish(entry, latest, UpdateStatus.CANCELLING, "Cancelling job " + entry.spec.name(), clock.instant());
        log.info("jobhub job cancelling id={} runs={}", entry.id, entry.runs.size());
    }

    private void submit(ExecutorService pool, RunTask task) {
        try {
            pool.execute(task);
        } catch (RejectedExecutionException e) {
            log.warn("jobhub worker pool rejected run id={} execution={}", task.entry.id, task.run.execution.executionId());
            finish(task.entry, task.run, ExecutionStatus.FAILED,
                    "Job " + task.spec.name() + " failed: worker pool rejected the run", "worker pool rejected the run");
        }
    }

    private void execute(RunTask task) {
        JobEntry entry = task.entry;
        ActiveRun run = task.run;
        JobSpec spec = task.spec;
        long executionId = run.execution.executionId();
        ExecutionContext context = new ExecutionContext(
                entry.id, spec.name(), executionId, run.execution.trigger(), run.token,
                message -> progress(entry, executionId, message));

        ExecutionStatus status;
        String message;
        String error = null;

        log.debug("jobhub job started id={} execution={}", entry.id, executionId);
        try {
            invokeHandler(registry.getRequired(spec.type()), spec, context);
            status = ExecutionStatus.SUCCEEDED;
            message = context.result() != null ? context.result() : "Job " + spec.name() + " completed successfully";
        } catch (JobCancelledException e) {
            status = ExecutionStatus.CANCELLED;
            message = null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            status = ExecutionStatus.CANCELLED;
            message = null;
        } catch (Exception | Error e) {
            status = ExecutionStatus.FAILED;
            error = e.getMessage() != null ? e.getMessage() : e.getClass().getName();
            message = "Job " + spec.name() + " failed: " + error;
            if (!run.token.isCancelled()) {
                log.error("jobhub job failed id={} execution={} msg={}", entry.id, executionId, e.getMessage(), e);
            }
        }

        if (run.token.isCancelled()) {
            status = ExecutionStatus.CANCELLED;
        }
        if (status == ExecutionStatus.CANCELLED) {
            message = "Job " + spec.name() + " cancelled";
        }

        finish(entry, run, status, message, error);
    }

    @SuppressWarnings("unchecked")
    private <C> void invokeHandler(JobHandler<?> handler, JobSpec spec, ExecutionContext context) throws Exception {
        JobHandler<C> h = (JobHandler<C>) handler;
        C config = objectMapper.convertValue(spec.config(), h.configClass());
        h.execute(config, context);
    }

    private void progress(JobEntry entry, long executionId, String message) {
        entry.lock.lock();
        try {
            if (!entry.runs.containsKey(executionId)) {
                return;
            }
            publish(entry, executionId, UpdateStatus.PROGRESS, message, clock.instant());
        } finally {
            entry.lock.unlock();
        }
    }

    private void finish(JobEntry entry, ActiveRun run, ExecutionStatus status, String message, String error) {
        Instant endedAt = clock.instant();
        Execution finished = run.execution.finish(status, endedAt, message, error);
        Job snapshot;

        entry.lock.lock();
        try {
            if (entry.runs.remove(finished.executionId()) == null) {
                return;
            }
            entry.state = entry.deriveState();
            entry.lastRunAt = finished.startedAt();
            entry.lastStatus = status;
            entry.lastMessage = message;
            entry.lastDuration = finished.duration();
            entry.nextRunAt = nextRunAt(entry.spec, endedAt);

            ledger.replace(finished);
            publish(entry, finished.executionId(), UpdateStatus.of(status), message, endedAt);
            snapshot = entry.deleted ? null : entry.snapshot();
        } finally {
            entry.lock.unlock();
        }

        log.debug("jobhub job finished id={} execution={} status={} duration={}",
                entry.id, finished.executionId(), status, finished.duration());

        persist(finished, snapshot);
    }

    private Instant nextRunAt(JobSpec spec, Instant endedAt) {
        if (!spec.enabled() || !spec.schedule().isAutomatic()) {
            return null;
        }
        try {
            return ScheduleCalculator.nextRunAfter(spec.schedule(), defaultZone, endedAt);
        } catch (IllegalArgumentException | DateTimeException e) {
            log.error("jobhub next run computation failed id={} schedule={} msg={}",
                    spec.id(), spec.schedule(), e.getMessage(), e);
            return null;
        }
    }

    // caller holds entry.lock
    private void publish(JobEntry entry, long executionId, UpdateStatus status, String message, Instant at) {
        bus.publish(new StatusUpdate(entry.id, executionId, status, message, entry.nextEventTime(at)));
    }

    private void persist(Execution execution, Job job) {
        try {
            repository.saveExecution(execution);
            if (job != null) {
                repository.saveJob(job);
            }
        } catch (Exception e) {
            log.error("jobhub repository write failed id={} execution={} msg={}",
                    execution.jobId(), execution.executionId(), e.getMessage(), e);
        }
    }

    private final class RunTask implements Runnable {
        private final JobEntry entry;
        private final ActiveRun run;
        private final JobSpec spec;

        private RunTask(JobEntry entry, ActiveRun run, JobSpec spec) {
            this.entry = entry;
            this.run = run;
            this.spec = spec;
        }

        @Override
        public void run() {
            execute(this);
        }
    }
}
