package io.jobhub4j.config;

import io.jobhub4j.internal.mongo.ExecutionDocument;
import io.jobhub4j.internal.mongo.JobDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

/**
 * MongoDB index definitions for the JobHub repository.
 *
 * <p>Indexes are <b>not</b> created automatically unless {@code jobhub.ensure-indexes-on-startup=true}.
 * In production they are usually managed by migrations or ops scripts.
 *
 * <h3>Required indexes</h3>
 * <ul>
 *   <li><b>idx_job_started</b> on {@code job_executions}: { jobId: 1, startedAt: -1 }
 *       <br/>Used to load the most recent executions of a job.</li>
 *   <li><b>idx_next_run</b> on {@code jobs}: { nextRunAt: 1 }
 *       <br/>Used by operators to inspect upcoming runs.</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.job_executions.createIndex({ jobId: 1, startedAt: -1 }, { name: "idx_job_started" });
 * db.jobs.createIndex({ nextRunAt: 1 }, { name: "idx_next_run" });
 * </pre>
 */
public class JobHubMongoIndexConfig {

    public static final String IDX_JOB_STARTED = "idx_job_started";
    public static final String IDX_NEXT_RUN = "idx_next_run";

    private final MongoTemplate mongoTemplate;

    public JobHubMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    public void ensureIndexes() {
        mongoTemplate.indexOps(ExecutionDocument.class).ensureIndex(jobStartedIndex());
        mongoTemplate.indexOps(JobDocument.class).ensureIndex(nextRunIndex());
    }

    /**
     * Keys: jobId ASC, startedAt DESC
     */
    public static Index jobStartedIndex() {
        return new Index()
                .on("jobId", Sort.Direction.ASC)
                .on("startedAt", Sort.Direction.DESC)
                .named(IDX_JOB_STARTED);
    }

    /**
     * Keys: nextRunAt ASC
     */
    public static Index nextRunIndex() {
        return new Index()
                .on("nextRunAt", Sort.Direction.ASC)
                .named(IDX_NEXT_RUN);
    }
}
