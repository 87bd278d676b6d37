package io.jobhub4j;

import io.jobhub4j.core.Job;
import io.jobhub4j.core.JobSpec;
import io.jobhub4j.core.Schedule;

import java.util.List;
import java.util.Map;

/**
 * Fluent builder for configuring a job before registering it.
 *
 * <p>Note:
 * <ul>
 *   <li>build(): returns an in-memory job spec</li>
 *   <li>save(): build() + validate + register with the manager</li>
 * </ul>
 */
public interface JobBuilder {

    /**
     * Stable id (e.g. {@code "source-files-scan"}). A UUID is assigned when omitted.
     */
    JobBuilder id(String id);

    JobBuilder description(String description);

    JobBuilder category(String category);

    JobBuilder tags(List<String> tags);

    JobBuilder config(Map<String, Object> config);

    /**
     * Set timezone used by cron schedules. Null means the manager default.
     */
    JobBuilder timezone(String timezone);

    /**
     * Repeat every X amount of time.
     * Accepts human-interval strings (e.g. "5 minutes", "2 hours", "30s") or plain seconds.
     */
    JobBuilder every(String interval);

    JobBuilder every(Number seconds);

    /**
     * Repeat on a 5-field or 6-field cron expression.
     */
    JobBuilder cron(String cron);

    /**
     * Run once when the scheduler first sees the job.
     */
    JobBuilder atStartup();

    /**
     * Only run on explicit request. This is the default.
     */
    JobBuilder manual();

    JobBuilder schedule(Schedule schedule);

    JobBuilder enabled(boolean enabled);

    /**
     * Build an immutable job spec (not registered).
     */
    JobSpec build();

    /**
     * Build + register.
     */
    Job save();
}
