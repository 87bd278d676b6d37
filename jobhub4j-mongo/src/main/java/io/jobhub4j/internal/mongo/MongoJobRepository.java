package io.jobhub4j.internal.mongo;

import io.jobhub4j.core.Execution;
import io.jobhub4j.core.Job;
import io.jobhub4j.core.JobRepository;
import io.jobhub4j.core.JobState;
import io.jobhub4j.core.Schedule;
import io.jobhub4j.core.ScheduleType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@link JobRepository} backed by the {@code jobs} and {@code job_executions} collections.
 *
 * <p>Run state is not stored; a reloaded job always starts idle.
 */
public class MongoJobRepository implements JobRepository {
    private static final Logger log = LoggerFactory.getLogger(MongoJobRepository.class);

    private final MongoTemplate mongoTemplate;

    public MongoJobRepository(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public List<Job> loadJobs() {
        List<JobDocument> docs = mongoTemplate.find(
                new Query().with(Sort.by(Sort.Direction.ASC, "_id")),
                JobDocument.class
        );
        List<Job> jobs = new ArrayList<>(docs.size());
        for (JobDocument doc : docs) {
            jobs.add(toJob(doc));
        }
        log.debug("jobhub mongo loaded jobs count={}", jobs.size());
        return jobs;
    }

    @Override
    public void saveJob(Job job) {
        Objects.requireNonNull(job, "job must not be null");
        mongoTemplate.save(toDocument(job));
    }

    @Override
    public void deleteJob(String jobId) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        mongoTemplate.remove(new Query(Criteria.where("_id").is(jobId)), JobDocument.class);
        long removed = mongoTemplate.remove(new Query(Criteria.where("jobId").is(jobId)), ExecutionDocument.class)
                .getDeletedCount();
        log.debug("jobhub mongo deleted job id={} executions={}", jobId, removed);
    }

    @Override
    public void saveExecution(Execution execution) {
        Objects.requireNonNull(execution, "execution must not be null");
        mongoTemplate.save(toDocument(execution));
    }

    @Override
    public List<Execution> loadExecutions(String jobId, int limit) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be a positive number");
        }

        Query q = new Query(Criteria.where("jobId").is(jobId))
                .with(Sort.by(Sort.Direction.DESC, "startedAt").and(Sort.by(Sort.Direction.DESC, "_id")))
                .limit(limit);

        List<ExecutionDocument> docs = mongoTemplate.find(q, ExecutionDocument.class);
        List<Execution> out = new ArrayList<>(docs.size());
        for (ExecutionDocument doc : docs) {
            out.add(toExecution(doc));
        }
        return out;
    }

    static JobDocument toDocument(Job job) {
        JobDocument doc = new JobDocument();
        doc.setId(job.id());
        doc.setName(job.name());
        doc.setType(job.type());
        doc.setDescription(job.description());
        doc.setCategory(job.category());
        doc.setTags(job.tags());
        doc.setScheduleType(job.schedule().type());
        doc.setScheduleExpression(job.schedule().expression());
        doc.setScheduleTimezone(job.schedule().timezone());
        doc.setConfig(job.config());
        doc.setEnabled(job.enabled());
        doc.setLastRunAt(job.lastRunAt());
        doc.setLastStatus(job.lastStatus());
        doc.setLastMessage(job.lastMessage());
        doc.setLastDurationMillis(job.lastDuration() == null ? null : job.lastDuration().toMillis());
        doc.setNextRunAt(job.nextRunAt());
        doc.setCreatedAt(job.createdAt());
        doc.setUpdatedAt(job.updatedAt());
        return doc;
    }

    static Job toJob(JobDocument doc) {
        ScheduleType scheduleType = doc.getScheduleType() == null ? ScheduleType.MANUAL : doc.getScheduleType();
        return new Job(
                doc.getId(),
                doc.getName(),
                doc.getType(),
                doc.getDescription(),
                doc.getCategory(),
                doc.getTags() == null ? List.of() : doc.getTags(),
                new Schedule(scheduleType, doc.getScheduleExpression(), doc.getScheduleTimezone()),
                doc.getConfig(),
                doc.isEnabled(),
                JobState.IDLE,
                doc.getLastRunAt(),
                doc.getLastStatus(),
                doc.getLastMessage(),
                doc.getLastDurationMillis() == null ? null : Duration.ofMillis(doc.getLastDurationMillis()),
                doc.getNextRunAt(),
                doc.getCreatedAt(),
                doc.getUpdatedAt()
        );
    }

    static ExecutionDocument toDocument(Execution execution) {
        ExecutionDocument doc = new ExecutionDocument();
        doc.setExecutionId(execution.executionId());
        doc.setJobId(execution.jobId());
        doc.setTrigger(execution.trigger());
        doc.setForced(execution.forced());
        doc.setStatus(execution.status());
        doc.setStartedAt(execution.startedAt());
        doc.setEndedAt(execution.endedAt());
        doc.setMessage(execution.message());
        doc.setError(execution.error());
        return doc;
    }

    static Execution toExecution(ExecutionDocument doc) {
        return new Execution(
                doc.getExecutionId(),
                doc.getJobId(),
                doc.getTrigger(),
                doc.isForced(),
                doc.getStatus(),
                doc.getStartedAt(),
                doc.getEndedAt(),
                doc.getMessage(),
                doc.getError()
        );
    }
}
