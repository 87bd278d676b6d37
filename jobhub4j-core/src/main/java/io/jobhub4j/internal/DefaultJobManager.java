package io.jobhub4j.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.jobhub4j.JobBuilder;
import io.jobhub4j.JobManager;
import io.jobhub4j.config.JobHubProperties;
import io.jobhub4j.core.Execution;
import io.jobhub4j.core.ExecutionStatus;
import io.jobhub4j.core.InvalidJobConfigException;
import io.jobhub4j.core.InvalidJobRequestException;
import io.jobhub4j.core.Job;
import io.jobhub4j.core.JobConflictException;
import io.jobhub4j.core.JobHandlerRegistry;
import io.jobhub4j.core.JobManagerException;
import io.jobhub4j.core.JobNotFoundException;
import io.jobhub4j.core.JobPatch;
import io.jobhub4j.core.JobRepository;
import io.jobhub4j.core.JobSpec;
import io.jobhub4j.core.NoopJobRepository;
import io.jobhub4j.events.EventBus;
import io.jobhub4j.events.Subscription;
import io.jobhub4j.utils.ScheduleCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-process job manager: definitions, scheduler loop, executor, history and event bus.
 *
 * <p>All state lives in memory. An optional {@link JobRepository} receives every change and is read
 * back on {@link #start()}.
 */
public class DefaultJobManager implements JobManager {
    private static final Logger log = LoggerFactory.getLogger(DefaultJobManager.class);

    static final String INTERRUPTED = "interrupted before completion";

    private final JobHubProperties props;
    private final JobRepository repository;
    private final Clock clock;
    private final ZoneId defaultZone;

    private final Map<String, JobEntry> jobs = new ConcurrentSkipListMap<>();
    private final HistoryLedger ledger;
    private final EventBus bus;
    private final JobValidator validator;
    private final JobExecutor executor;

    private final AtomicBoolean started = new AtomicBoolean(false);

    private SchedulerLoop scheduler;

    public DefaultJobManager(JobHubProperties props, JobHandlerRegistry registry, ObjectMapper objectMapper) {
        this(props, registry, objectMapper, NoopJobRepository.INSTANCE, Clock.systemUTC());
    }

    public DefaultJobManager(JobHubProperties props, JobHandlerRegistry registry, ObjectMapper objectMapper,
                             JobRepository repository) {
        this(props, registry, objectMapper, repository, Clock.systemUTC());
    }

    public DefaultJobManager(JobHubProperties props, JobHandlerRegistry registry, ObjectMapper objectMapper,
                             JobRepository repository, Clock clock) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        Objects.requireNonNull(registry, "registry must not be null");
        Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.repository = Objects.requireNonNull(repository, "repository must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.defaultZone = ScheduleCalculator.resolveZone(props.getTimezone());

        this.ledger = new HistoryLedger(props.getRetention());
        this.bus = new EventBus(props.getSubscriberBufferSize());
        this.validator = new JobValidator(registry, objectMapper);
        this.executor = new JobExecutor(registry, objectMapper, ledger, bus, repository, clock, defaultZone);
    }

    /**
     * Start the scheduler loop and the worker pool. Should be idempotent.
     */
    @Override
    public synchronized void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }

        try {
            Duration tick = Objects.requireNonNull(props.getTickInterval(), "jobhub.tickInterval must not be null");
            if (tick.isZero() || tick.isNegative()) {
                throw new IllegalArgumentException("jobhub.tickInterval must be a positive duration");
            }
            Duration shutdown = Objects.requireNonNull(props.getShutdownTimeout(), "jobhub.shutdownTimeout must not be null");
            if (shutdown.isNegative()) {
                throw new IllegalArgumentException("jobhub.shutdownTimeout must not be negative");
            }

            log.info("JobHub starting with tickInterval={}, retention={}, subscriberBufferSize={}, timezone={}, repository={}",
                    tick,
                    ledger.retention(),
                    props.getSubscriberBufferSize(),
                    defaultZone,
                    repository.getClass().getSimpleName());

            reload();

            ExecutorService workerPool = Executors.newCachedThreadPool(r -> {
                Thread t = new Thread(r);
                t.setName("jobhub.worker");
                t.setDaemon(true);
                return t;
            });
            executor.attach(workerPool);

            scheduler = new SchedulerLoop(tick, this::tick);
            scheduler.start();
        } catch (RuntimeException e) {
            started.set(false);
            throw e;
        }
        log.info("JobHub started successfully with {} jobs.", jobs.size());
    }

    /**
     * Stop the scheduler, cancel in-flight runs and wait for them. Should be idempotent.
     */
    @Override
    public synchronized void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }

        log.info("JobHub stopping...");

        if (scheduler != null) {
            scheduler.stop();
            scheduler = null;
        }

        ExecutorService pool = executor.detach();
        int cancelled = 0;
        for (JobEntry entry : jobs.values()) {
            if (executor.cancelQuietly(entry)) {
                cancelled++;
            }
        }
        if (cancelled > 0) {
            log.info("JobHub cancelled running jobs count={}", cancelled);
        }

        if (pool != null) {
            pool.shutdown();
            try {
                if (!pool.awaitTermination(props.getShutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("JobHub workers did not stop within {}; interrupting", props.getShutdownTimeout());
                    pool.shutdownNow().forEach(executor::abandon);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                pool.shutdownNow().forEach(executor::abandon);
            }
        }

        bus.closeAll();
        log.info("JobHub stopped successfully.");
    }

    @Override
    public boolean isRunning() {
        return started.get();
    }

    @Override
    public JobBuilder define(String name, String type) {
        return new SimpleJobBuilder(name, type, this::create);
    }

    @Override
    public Job create(JobSpec spec) {
        Objects.requireNonNull(spec, "spec must not be null");
        JobSpec s = spec.id() == null || spec.id().isBlank() ? spec.withId(UUID.randomUUID().toString()) : spec;
        validator.validate(s);

        Instant now = clock.instant();
        Instant firstRun = firstRunAt(s, now, null);
        JobEntry entry = new JobEntry(s, now);
        entry.nextRunAt = s.enabled() ? firstRun : null;

        if (jobs.putIfAbsent(s.id(), entry) != null) {
            throw new JobConflictException(s.id(), "job already exists: " + s.id());
        }

        Job job = entry.snapshot();
        log.info("JobHub job created id={} name={} type={} schedule={} nextRunAt={}",
                job.id(), job.name(), job.type(), job.schedule(), job.nextRunAt());
        saveJob(job);
        return job;
    }

    @Override
    public List<Job> getJobs() {
        List<Job> out = new ArrayList<>(jobs.size());
        for (JobEntry entry : jobs.values()) {
            out.add(entry.snapshot());
        }
        return out;
    }

    @Override
    public Job getJob(String id) {
        return require(id).snapshot();
    }

    @Override
    public Job updateJob(String id, JobPatch patch) {
        Objects.requireNonNull(patch, "patch must not be null");
        JobEntry entry = require(id);

        Job job;
        entry.lock.lock();
        try {
            if (entry.deleted) {
                throw new JobNotFoundException(id);
            }
            if (!entry.runs.isEmpty()) {
                throw new JobConflictException(id, "job is running");
            }

            JobSpec current = entry.spec;
            JobSpec merged = patch.applyTo(current);
            validator.validate(merged);

            Instant now = clock.instant();
            boolean reschedule = !merged.schedule().equals(current.schedule()) || merged.enabled() != current.enabled();
            Instant nextRunAt = entry.nextRunAt;
            if (reschedule) {
                Instant firstRun = firstRunAt(merged, now, entry.lastRunAt);
                nextRunAt = merged.enabled() ? firstRun : null;
            }
            entry.spec = merged;
            entry.updatedAt = now;
            entry.nextRunAt = nextRunAt;
            job = entry.snapshot();
        } finally {
            entry.lock.unlock();
        }

        log.info("JobHub job updated id={} schedule={} enabled={} nextRunAt={}",
                id, job.schedule(), job.enabled(), job.nextRunAt());
        saveJob(job);
        return job;
    }

    // evaluated for disabled jobs too
    private Instant firstRunAt(JobSpec spec, Instant now, Instant lastRunAt) {
        try {
            return ScheduleCalculator.firstRunAt(spec.schedule(), defaultZone, now, lastRunAt);
        } catch (IllegalArgumentException e) {
            throw new InvalidJobConfigException(spec.id(), e.getMessage(), e);
        }
    }

    @Override
    public void deleteJob(String id) {
        JobEntry entry = require(id);

        entry.lock.lock();
        try {
            if (entry.deleted) {
                throw new JobNotFoundException(id);
            }
            if (!entry.runs.isEmpty()) {
                throw new JobConflictException(id, "job is running");
            }
            entry.deleted = true;
            jobs.remove(id, entry);
        } finally {
            entry.lock.unlock();
        }
        ledger.remove(id);

        log.info("JobHub job deleted id={}", id);
        try {
            repository.deleteJob(id);
        } catch (Exception e) {
            log.error("jobhub repository delete failed id={} msg={}", id, e.getMessage(), e);
        }
    }

    @Override
    public Execution runJob(String id, boolean force) {
        JobEntry entry = require(id);
        Execution execution = executor.launchManual(entry, force);
        log.info("JobHub job started manually id={} execution={} forced={}", id, execution.executionId(), force);
        return execution;
    }

    @Override
    public void cancelJob(String id) {
        executor.cancel(require(id));
    }

    @Override
    public List<Execution> getJobExecutions(String id, int limit) {
        require(id);
        if (limit <= 0) {
            throw new InvalidJobRequestException(id, "limit must be a positive number");
        }
        return ledger.list(id, limit);
    }

    @Override
    public Subscription subscribe() {
        return bus.subscribe();
    }

    @Override
    public void unsubscribe(Subscription subscription) {
        bus.unsubscribe(subscription);
    }

    /**
     * One scheduler pass: launches every enabled, idle job whose next run is due.
     */
    void tick() {
        Instant now = clock.instant();
        for (JobEntry entry : jobs.values()) {
            try {
                Execution started = executor.tryLaunchScheduled(entry, now);
                if (started != null) {
                    log.debug("JobHub scheduled run launched id={} execution={}", entry.id, started.executionId());
                }
            } catch (JobManagerException e) {
                log.debug("JobHub scheduled run skipped id={} msg={}", entry.id, e.getMessage());
            }
        }
    }

    private JobEntry require(String id) {
        Objects.requireNonNull(id, "id must not be null");
        JobEntry entry = jobs.get(id);
        if (entry == null) {
            throw new JobNotFoundException(id);
        }
        return entry;
    }

    private void reload() {
        List<Job> stored;
        try {
            stored = repository.loadJobs();
        } catch (Exception e) {
            log.error("jobhub repository load failed msg={}", e.getMessage(), e);
            return;
        }

        Instant now = clock.instant();
        int restored = 0;
        for (Job job : stored) {
            if (jobs.containsKey(job.id())) {
                continue;
            }
            JobEntry entry = JobEntry.restore(job);
            JobSpec spec = entry.spec;
            if (!spec.enabled() || !spec.schedule().isAutomatic()) {
                entry.nextRunAt = null;
            } else if (entry.nextRunAt == null) {
                try {
                    entry.nextRunAt = ScheduleCalculator.firstRunAt(spec.schedule(), defaultZone, now, entry.lastRunAt);
                } catch (IllegalArgumentException e) {
                    log.warn("jobhub restored job has no next run id={} schedule={} msg={}", job.id(), spec.schedule(), e.getMessage());
                }
            }
            restoreHistory(entry, now);
            if (jobs.putIfAbsent(job.id(), entry) == null) {
                restored++;
            }
        }
        if (restored > 0) {
            log.info("JobHub restored jobs count={}", restored);
        }
    }

    private void restoreHistory(JobEntry entry, Instant now) {
        List<Execution> rows;
        try {
            rows = repository.loadExecutions(entry.id, ledger.retention());
        } catch (Exception e) {
            log.error("jobhub repository load failed id={} msg={}", entry.id, e.getMessage(), e);
            return;
        }

        List<Execution> fixed = new ArrayList<>(rows.size());
        for (Execution row : rows) {
            executor.advanceExecutionIds(row.executionId());
            if (row.isRunning()) {
                Execution interrupted = row.finish(ExecutionStatus.FAILED, now, INTERRUPTED, INTERRUPTED);
                fixed.add(interrupted);
                try {
                    repository.saveExecution(interrupted);
                } catch (Exception e) {
                    log.error("jobhub repository write failed id={} execution={} msg={}",
                            entry.id, row.executionId(), e.getMessage(), e);
                }
            } else {
                fixed.add(row);
            }
        }
        ledger.seed(entry.id, fixed);
    }

    private void saveJob(Job job) {
        try {
            repository.saveJob(job);
        } catch (Exception e) {
            log.error("jobhub repository write failed id={} msg={}", job.id(), e.getMessage(), e);
        }
    }
}
