package io.jobhub4j.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Partial update of a job definition.
 *
 * <p>Every field is optional; {@code null} means "keep the current value". The patch is merged onto the
 * current definition and the merged result is validated as a whole before anything is changed.
 */
public final class JobPatch {

    private final String name;
    private final String type;
    private final String description;
    private final String category;
    private final List<String> tags;
    private final Schedule schedule;
    private final Map<String, Object> config;
    private final Boolean enabled;

    private JobPatch(Builder b) {
        this.name = b.name;
        this.type = b.type;
        this.description = b.description;
        this.category = b.category;
        this.tags = b.tags == null ? null : List.copyOf(b.tags);
        this.schedule = b.schedule;
        this.config = b.config == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(b.config));
        this.enabled = b.enabled;
    }

    public String name() {
        return name;
    }

    public String type() {
        return type;
    }

    public String description() {
        return description;
    }

    public String category() {
        return category;
    }

    public List<String> tags() {
        return tags;
    }

    public Schedule schedule() {
        return schedule;
    }

    /**
     * Replacement config. The whole map is replaced, not merged key by key.
     */
    public Map<String, Object> config() {
        return config;
    }

    public Boolean enabled() {
        return enabled;
    }

    public boolean isEmpty() {
        return name == null && type == null && description == null && category == null
                && tags == null && schedule == null && config == null && enabled == null;
    }

    /**
     * Returns {@code current} with this patch's non-null fields applied.
     */
    public JobSpec applyTo(JobSpec current) {
        return new JobSpec(
                current.id(),
                name != null ? name : current.name(),
                type != null ? type : current.type(),
                description != null ? description : current.description(),
                category != null ? category : current.category(),
                tags != null ? tags : current.tags(),
                schedule != null ? schedule : current.schedule(),
                enabled != null ? enabled : current.enabled(),
                config != null ? config : current.config()
        );
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String name;
        private String type;
        private String description;
        private String category;
        private List<String> tags;
        private Schedule schedule;
        private Map<String, Object> config;
        private Boolean enabled;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder tags(List<String> tags) {
            this.tags = tags;
            return this;
        }

        public Builder schedule(Schedule schedule) {
            this.schedule = schedule;
            return this;
        }

        public Builder config(Map<String, Object> config) {
            this.config = config;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public JobPatch build() {
            return new JobPatch(this);
        }
    }
}
