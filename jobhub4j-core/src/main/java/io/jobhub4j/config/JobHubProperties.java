package io.jobhub4j.config;

import io.jobhub4j.core.JobSpec;
import io.jobhub4j.core.Schedule;
import io.jobhub4j.core.ScheduleType;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Runtime configuration for the job manager.
 */
public class JobHubProperties {
    private boolean enabled = true;
    private Duration tickInterval = Duration.ofSeconds(2);
    private int retention = 100; // executions kept per job
    private int subscriberBufferSize = 10;
    private Duration keepAliveInterval = Duration.ofSeconds(30);
    private Duration shutdownTimeout = Duration.ofSeconds(30);
    private String timezone;
    private String persistence = "none";
    private boolean processHandlerEnabled = true;
    private boolean ensureIndexesOnStartup = false;
    private List<ConfiguredJob> jobs = new ArrayList<>();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Duration getTickInterval() {
        return tickInterval;
    }

    public void setTickInterval(Duration tickInterval) {
        this.tickInterval = tickInterval;
    }

    public int getRetention() {
        return retention;
    }

    public void setRetention(int retention) {
        this.retention = retention;
    }

    public int getSubscriberBufferSize() {
        return subscriberBufferSize;
    }

    public void setSubscriberBufferSize(int subscriberBufferSize) {
        this.subscriberBufferSize = subscriberBufferSize;
    }

    public Duration getKeepAliveInterval() {
        return keepAliveInterval;
    }

    public void setKeepAliveInterval(Duration keepAliveInterval) {
        this.keepAliveInterval = keepAliveInterval;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    /**
     * {@code none} (default) or {@code mongo}.
     */
    public String getPersistence() {
        return persistence;
    }

    public void setPersistence(String persistence) {
        this.persistence = persistence;
    }

    public boolean isProcessHandlerEnabled() {
        return processHandlerEnabled;
    }

    public void setProcessHandlerEnabled(boolean processHandlerEnabled) {
        this.processHandlerEnabled = processHandlerEnabled;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }

    public List<ConfiguredJob> getJobs() {
        return jobs;
    }

    public void setJobs(List<ConfiguredJob> jobs) {
        this.jobs = jobs;
    }

    /**
     * A job declared in configuration and registered at startup when no job with the same id exists yet.
     */
    public static class ConfiguredJob {
        private String id;
        private String name;
        private String description;
        private String type;
        private String category;
        private List<String> tags = new ArrayList<>();
        private String scheduleType = "manual";
        private String schedule;
        private String timezone;
        private boolean enabled = true;
        private Map<String, Object> config = new LinkedHashMap<>();

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getDescription() {
            return description;
        }

        public void setDescription(String description) {
            this.description = description;
        }

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public String getCategory() {
            return category;
        }

        public void setCategory(String category) {
            this.category = category;
        }

        public List<String> getTags() {
            return tags;
        }

        public void setTags(List<String> tags) {
            this.tags = tags;
        }

        /**
         * {@code manual}, {@code interval}, {@code cron} or {@code startup}.
         */
        public String getScheduleType() {
            return scheduleType;
        }

        public void setScheduleType(String scheduleType) {
            this.scheduleType = scheduleType;
        }

        public String getSchedule() {
            return schedule;
        }

        public void setSchedule(String schedule) {
            this.schedule = schedule;
        }

        public String getTimezone() {
            return timezone;
        }

        public void setTimezone(String timezone) {
            this.timezone = timezone;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Map<String, Object> getConfig() {
            return config;
        }

        public void setConfig(Map<String, Object> config) {
            this.config = config;
        }

        public JobSpec toSpec() {
            ScheduleType st;
            try {
                st = ScheduleType.valueOf(scheduleType == null ? "MANUAL" : scheduleType.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException ex) {
                throw new IllegalArgumentException("unknown scheduleType for job " + id + ": " + scheduleType);
            }
            return new JobSpec(
                    id,
                    name,
                    type,
                    description,
                    category,
                    tags,
                    new Schedule(st, schedule, timezone),
                    enabled,
                    config
            );
        }
    }
}
