package io.jobhub4j.internal;

import io.jobhub4j.JobBuilder;
import io.jobhub4j.core.Job;
import io.jobhub4j.core.JobSpec;
import io.jobhub4j.core.Schedule;
import io.jobhub4j.core.ScheduleType;

import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Default {@link JobBuilder} implementation used by the in-memory manager.
 */
public class SimpleJobBuilder implements JobBuilder {

    private final String name;
    private final String type;
    private final Function<JobSpec, Job> persister;

    private String id;
    private String description;
    private String category;
    private List<String> tags = List.of();
    private Map<String, Object> config = Map.of();
    private boolean enabled = true;

    private ScheduleType scheduleType = ScheduleType.MANUAL;
    private String expression;
    private String timezone;

    public SimpleJobBuilder(String name, String type, Function<JobSpec, Job> persister) {
        this.name = Objects.requireNonNull(name, "job name must not be null");
        this.type = Objects.requireNonNull(type, "job type must not be null");
        this.persister = Objects.requireNonNull(persister, "persister must not be null");
    }

    @Override
    public JobBuilder id(String id) {
        Objects.requireNonNull(id, "id must not be null");
        if (id.isBlank()) throw new IllegalArgumentException("id must not be blank");

        this.id = id;
        return this;
    }

    @Override
    public JobBuilder description(String description) {
        this.description = description;
        return this;
    }

    @Override
    public JobBuilder category(String category) {
        this.category = category;
        return this;
    }

    @Override
    public JobBuilder tags(List<String> tags) {
        Objects.requireNonNull(tags, "tags must not be null");
        this.tags = List.copyOf(tags);
        return this;
    }

    @Override
    public JobBuilder config(Map<String, Object> config) {
        Objects.requireNonNull(config, "config must not be null");
        this.config = new LinkedHashMap<>(config);
        return this;
    }

    @Override
    public JobBuilder timezone(String timezone) {
        Objects.requireNonNull(timezone, "timezone must not be null");
        ZoneId.of(timezone);
        this.timezone = timezone;
        return this;
    }

    @Override
    public JobBuilder every(String interval) {
        Objects.requireNonNull(interval, "interval must not be null");
        this.scheduleType = ScheduleType.INTERVAL;
        this.expression = interval;
        return this;
    }

    @Override
    public JobBuilder every(Number seconds) {
        Objects.requireNonNull(seconds, "interval must not be null");

        double asDouble = seconds.doubleValue();
        if (asDouble <= 0) {
            throw new IllegalArgumentException("interval must be a positive number of seconds");
        }
        if (asDouble % 1 != 0) {
            throw new IllegalArgumentException("interval must be an integer number of seconds");
        }

        this.scheduleType = ScheduleType.INTERVAL;
        this.expression = Long.toString(seconds.longValue());
        return this;
    }

    @Override
    public JobBuilder cron(String cron) {
        Objects.requireNonNull(cron, "cron must not be null");
        this.scheduleType = ScheduleType.CRON;
        this.expression = cron;
        return this;
    }

    @Override
    public JobBuilder atStartup() {
        this.scheduleType = ScheduleType.STARTUP;
        this.expression = null;
        return this;
    }

    @Override
    public JobBuilder manual() {
        this.scheduleType = ScheduleType.MANUAL;
        this.expression = null;
        return this;
    }

    @Override
    public JobBuilder schedule(Schedule schedule) {
        Objects.requireNonNull(schedule, "schedule must not be null");
        this.scheduleType = schedule.type();
        this.expression = schedule.expression();
        if (schedule.timezone() != null) {
            this.timezone = schedule.timezone();
        }
        return this;
    }

    @Override
    public JobBuilder enabled(boolean enabled) {
        this.enabled = enabled;
        return this;
    }

    @Override
    public JobSpec build() {
        return new JobSpec(
                id,
                name,
                type,
                description,
                category,
                tags,
                new Schedule(scheduleType, expression, timezone),
                enabled,
                config
        );
    }

    @Override
    public Job save() {
        return persister.apply(build());
    }
}
