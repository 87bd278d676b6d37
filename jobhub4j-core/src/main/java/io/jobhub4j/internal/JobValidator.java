package io.jobhub4j.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.jobhub4j.JobHandler;
import io.jobhub4j.core.InvalidJobConfigException;
import io.jobhub4j.core.JobHandlerRegistry;
import io.jobhub4j.core.JobSpec;
import io.jobhub4j.utils.ScheduleCalculator;

import java.util.Objects;

/**
 * Checks a complete job definition before it is stored.
 */
final class JobValidator {
    private final JobHandlerRegistry registry;
    private final ObjectMapper objectMapper;

    JobValidator(JobHandlerRegistry registry, ObjectMapper objectMapper) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    /**
     * @throws InvalidJobConfigException naming the first problem found
     */
    void validate(JobSpec spec) {
        String id = spec.id();
        if (spec.name() == null || spec.name().isBlank()) {
            throw new InvalidJobConfigException(id, "name must not be blank");
        }
        if (spec.type() == null || spec.type().isBlank()) {
            throw new InvalidJobConfigException(id, "type must not be blank");
        }
        JobHandler<?> handler = registry.find(spec.type())
                .orElseThrow(() -> new InvalidJobConfigException(id, "unknown job type: " + spec.type()));

        try {
            ScheduleCalculator.validate(spec.schedule());
        } catch (IllegalArgumentException e) {
            throw new InvalidJobConfigException(id, e.getMessage(), e);
        }

        validateConfig(id, handler, spec);
    }

    private <C> void validateConfig(String id, JobHandler<C> handler, JobSpec spec) {
        C config;
        try {
            config = objectMapper.convertValue(spec.config(), handler.configClass());
        } catch (IllegalArgumentException e) {
            throw new InvalidJobConfigException(id,
                    "config does not match job type " + spec.type() + ": " + e.getMessage(), e);
        }
        try {
            handler.validate(config);
        } catch (IllegalArgumentException e) {
            throw new InvalidJobConfigException(id, e.getMessage(), e);
        }
    }
}
