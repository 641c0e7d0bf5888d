package io.schemafm.batch.runner;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Totals of one batch run, as logged at the end.
 *
 * @param processed        documents translated or attempted
 * @param valid            documents without violations
 * @param invalid          documents with at least one violation
 * @param failed           documents that could not be read or translated
 * @param skipped          skipped documents by reason
 * @param buckets          files per size bucket
 * @param unmappedKeys     unmapped key paths over all documents
 * @param batchesRun       batches processed in this run
 * @param batchesResumed   batches skipped because the checkpoint lists them
 * @param cancelled        whether the run stopped early
 * @param diagnostics      model generation diagnostics by code, empty when no model was generated
 * @param elapsedMillis    wall-clock run time
 */
public record RunSummary(
        int processed,
        int valid,
        int invalid,
        int failed,
        Map<SkipReason, Integer> skipped,
        Map<SizeBucket, Integer> buckets,
        long unmappedKeys,
        int batchesRun,
        int batchesResumed,
        boolean cancelled,
        Map<String, Integer> diagnostics,
        long elapsedMillis) {

    public RunSummary {
        skipped = Collections.unmodifiableMap(new EnumMap<>(copyOrEmpty(skipped, SkipReason.class)));
        buckets = Collections.unmodifiableMap(new EnumMap<>(copyOrEmpty(buckets, SizeBucket.class)));
        diagnostics = Collections.unmodifiableMap(new LinkedHashMap<>(diagnostics));
    }

    public RunSummary withDiagnostics(Map<String, Integer> diagnostics) {
        return new RunSummary(processed, valid, invalid, failed, skipped, buckets, unmappedKeys,
                batchesRun, batchesResumed, cancelled, diagnostics, elapsedMillis);
    }

    public int totalSkipped() {
        return skipped.values().stream().mapToInt(Integer::intValue).sum();
    }

    private static <E extends Enum<E>> Map<E, Integer> copyOrEmpty(Map<E, Integer> map, Class<E> type) {
        return map.isEmpty() ? new EnumMap<>(type) : map;
    }
}
