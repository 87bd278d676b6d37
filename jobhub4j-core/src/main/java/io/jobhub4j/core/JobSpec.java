package io.jobhub4j.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable job definition produced by {@code JobBuilder.build()}.
 * This is a pure data object; the manager validates it on create.
 */
public record JobSpec(

        // identity; null id lets the manager assign one
        String id,
        String name,
        String type,

        // descriptive
        String description,
        String category,
        List<String> tags,

        // scheduling
        Schedule schedule,
        boolean enabled,

        // handler payload
        Map<String, Object> config
) {
    public JobSpec {
        tags = tags == null ? List.of() : List.copyOf(tags);
        // config values may be null (e.g. JSON nulls), so no Map.copyOf here
        config = config == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(config));
        if (schedule == null) {
            schedule = Schedule.manual();
        }
    }

    public JobSpec withId(String newId) {
        return new JobSpec(newId, name, type, description, category, tags, schedule, enabled, config);
    }
}
