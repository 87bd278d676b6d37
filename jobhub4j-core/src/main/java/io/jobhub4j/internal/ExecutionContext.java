package io.jobhub4j.internal;

import io.jobhub4j.JobContext;
import io.jobhub4j.core.Trigger;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Consumer;

final class ExecutionContext implements JobContext {
    private final String jobId;
    private final String jobName;
    private final long executionId;
    private final Trigger trigger;
    private final CancellationToken token;
    private final Consumer<String> progressListener;

    private volatile String result;

    ExecutionContext(String jobId, String jobName, long executionId, Trigger trigger,
                     CancellationToken token, Consumer<String> progressListener) {
        this.jobId = jobId;
        this.jobName = jobName;
        this.executionId = executionId;
        this.trigger = trigger;
        this.token = Objects.requireNonNull(token, "token must not be null");
        this.progressListener = Objects.requireNonNull(progressListener, "progressListener must not be null");
    }

    @Override
    public String jobId() {
        return jobId;
    }

    @Override
    public String jobName() {
        return jobName;
    }

    @Override
    public long executionId() {
        return executionId;
    }

    @Override
    public Trigger trigger() {
        return trigger;
    }

    @Override
    public boolean isCancelled() {
        return token.isCancelled();
    }

    @Override
    public boolean pause(Duration duration) throws InterruptedException {
        Objects.requireNonNull(duration, "duration must not be null");
        return !token.await(duration);
    }

    @Override
    public void progress(String message) {
        progressListener.accept(message);
    }

    @Override
    public void result(String message) {
        this.result = message;
    }

    String result() {
        return result;
    }
}
