package io.schemafm.batch.runner;

/** Coarse file size classes reported in the run summary. */
public enum SizeBucket {
    TINY(5 * 1024L),
    SMALL(25 * 1024L),
    MEDIUM(100 * 1024L),
    LARGE(512 * 1024L),
    HUGE(Long.MAX_VALUE);

    private final long upperBound;

    SizeBucket(long upperBound) {
        this.upperBound = upperBound;
    }

    /** Bucket whose exclusive upper bound is the first to exceed {@code bytes}. */
    public static SizeBucket of(long bytes) {
        for (SizeBucket bucket : values()) {
            if (bytes < bucket.upperBound) {
                return bucket;
            }
        }
        return HUGE;
    }
}
