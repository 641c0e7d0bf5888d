package io.schemafm.batch.config;

/**
 * Batch worker pool configuration.
 *
 * @param workers       number of worker threads translating and validating documents
 * @param queueCapacity bounded queue length; when full the submitting thread runs the task itself
 */
public record WorkerPoolConfig(int workers, int queueCapacity) {

    /** Default pool configuration. */
    public static final WorkerPoolConfig DEFAULT = new WorkerPoolConfig(4, 64);

    public WorkerPoolConfig {
        if (workers <= 0) {
            throw new IllegalArgumentException("workers must be positive, got: " + workers);
        }
        if (queueCapacity <= 0) {
            throw new IllegalArgumentException("queueCapacity must be positive, got: " + queueCapacity);
        }
    }
}
