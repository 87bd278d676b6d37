package io.jobhub4j.core;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time snapshot of a job definition and its bookkeeping.
 *
 * <p>{@code state} is best-effort while forced runs overlap: it reflects the executions still in flight.
 */
public record Job(
        String id,
        String name,
        String type,
        String description,
        String category,
        List<String> tags,
        Schedule schedule,
        Map<String, Object> config,
        boolean enabled,
        JobState state,
        Instant lastRunAt,
        ExecutionStatus lastStatus,
        String lastMessage,
        Duration lastDuration,
        Instant nextRunAt,
        Instant createdAt,
        Instant updatedAt
) {
    public boolean isRunning() {
        return state != null && state.isActive();
    }

    public JobSpec toSpec() {
        return new JobSpec(id, name, type, description, category, tags, schedule, enabled, config);
    }
}
