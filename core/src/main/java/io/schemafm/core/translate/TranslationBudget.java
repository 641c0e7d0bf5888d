package io.schemafm.core.translate;

/**
 * Limits on translating one document, checked as the walk proceeds.
 *
 * <p>
 * Immutable and thread-safe.
 *
 * @param maxMillis maximum wall-clock time for one document in milliseconds (default: 2000ms)
 * @param maxDepth  maximum nesting depth of keys below the document root (default: 64)
 */
public record TranslationBudget(long maxMillis, int maxDepth) {

    /** Default budget: 2s wall-clock, 64 levels. */
    public static final TranslationBudget DEFAULT = new TranslationBudget(2000, 64);

    public TranslationBudget {
        if (maxMillis <= 0) {
            throw new IllegalArgumentException("maxMillis must be positive, got: " + maxMillis);
        }
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive, got: " + maxDepth);
        }
    }
}
