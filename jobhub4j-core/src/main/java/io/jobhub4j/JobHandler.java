package io.jobhub4j;

/**
 * Work function for one job type.
 *
 * <p>Handlers are shared by every job of their type and may run concurrently (different jobs, or a
 * forced rerun of the same job), so implementations must be thread-safe.
 *
 * @param <C> type the job's config map is converted into with Jackson
 */
public interface JobHandler<C> {

    /**
     * Job type this handler serves (e.g. {@code "process"}).
     */
    String type();

    Class<C> configClass();

    /**
     * Type-specific validation run on create and update, before anything is stored.
     *
     * @throws IllegalArgumentException when the config is unusable
     */
    default void validate(C config) {
    }

    /**
     * Runs the work. Long-running work must poll {@link JobContext#isCancelled()} (or call
     * {@link JobContext#checkCancelled()}) at safe boundaries such as between files or batches.
     * Any exception marks the execution as failed.
     */
    void execute(C config, JobContext context) throws Exception;
}
