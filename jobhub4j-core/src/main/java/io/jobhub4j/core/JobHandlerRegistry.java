package io.jobhub4j.core;

import io.jobhub4j.JobHandler;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Handlers indexed by job type.
 */
public class JobHandlerRegistry {

    private final Map<String, JobHandler<?>> handlersByType;

    public JobHandlerRegistry(List<? extends JobHandler<?>> handlers) {
        this.handlersByType = handlers.stream()
                .collect(Collectors.toUnmodifiableMap(
                        JobHandler::type,
                        Function.identity(),
                        (a, b) -> {
                            throw new IllegalStateException("Duplicate JobHandler type: " + a.type());
                        }
                ));
    }

    public Optional<JobHandler<?>> find(String type) {
        return Optional.ofNullable(type == null ? null : handlersByType.get(type));
    }

    public JobHandler<?> getRequired(String type) {
        JobHandler<?> handler = handlersByType.get(type);
        if (handler == null) {
            throw new IllegalStateException("No JobHandler registered for type: " + type);
        }
        return handler;
    }

    public Set<String> types() {
        return handlersByType.keySet();
    }
}
