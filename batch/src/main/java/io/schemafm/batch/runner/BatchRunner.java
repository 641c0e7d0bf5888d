package io.schemafm.batch.runner;

import io.schemafm.batch.config.WorkerPoolConfig;
import io.schemafm.core.engine.DocumentChecker;
import io.schemafm.core.engine.DocumentResult;
import io.schemafm.core.error.FeatureModelException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Translates and validates a corpus on a bounded worker pool, batch by batch.
 *
 * <p>
 * The sorted corpus is cut into batches of {@code batchSize} files with ids
 * {@code batch-00001}, {@code batch-00002}, ... Batches listed in the checkpoint are skipped.
 * Otherwise each file of the batch becomes one pool task; when the queue is full the submitting
 * thread runs the task itself. Once all tasks of a batch have finished, its rows are appended to
 * the reports and its id to the checkpoint.
 *
 * <p>
 * A document that fails to read or translate is reported as failed and never stops the run.
 * {@link #cancel()} stops submission and lets submitted tasks finish. A batch cut short this way
 * is neither reported nor checkpointed, so a restart runs it again from its first file.
 */
public final class BatchRunner {

    private static final Logger LOG = LoggerFactory.getLogger(BatchRunner.class);

    private final DocumentChecker checker;
    private final DocumentClassifier classifier;
    private final WorkerPoolConfig pool;
    private final int batchSize;
    private final CheckpointStore checkpoint;
    private final ReportWriter reports;
    private final AtomicBoolean cancelled = new AtomicBoolean();

    public BatchRunner(
            DocumentChecker checker,
            DocumentClassifier classifier,
            WorkerPoolConfig pool,
            int batchSize,
            CheckpointStore checkpoint,
            ReportWriter reports) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive, got: " + batchSize);
        }
        this.checker = checker;
        this.classifier = classifier;
        this.pool = pool;
        this.batchSize = batchSize;
        this.checkpoint = checkpoint;
        this.reports = reports;
    }

    /** Stops submitting new files. Safe to call from any thread. */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            LOG.info("Batch run cancellation requested");
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /** Batch id for a zero-based batch index. */
    public static String batchId(int index) {
        return String.format("batch-%05d", index + 1);
    }

    public RunSummary run(CorpusScanner corpus) {
        long started = System.currentTimeMillis();
        List<Path> files = corpus.scan();
        if (checkpoint.isEmpty()) {
            reports.reset();
        }
        Tally tally = new Tally();
        ThreadPoolExecutor executor = newExecutor();
        try {
            for (int from = 0, index = 0; from < files.size() && !cancelled.get(); from += batchSize, index++) {
                String id = batchId(index);
                if (checkpoint.isCompleted(id)) {
                    tally.batchesResumed++;
                    LOG.debug("Skipping checkpointed {}", id);
                    continue;
                }
                List<Path> batch = files.subList(from, Math.min(from + batchSize, files.size()));
                runBatch(id, batch, corpus, executor, tally);
            }
        } finally {
            executor.shutdown();
            awaitTermination(executor);
        }
        long elapsed = System.currentTimeMillis() - started;
        RunSummary summary = tally.toSummary(cancelled.get(), elapsed);
        LOG.info("Batch run finished: processed={}, valid={}, invalid={}, failed={}, skipped={}, batches={}, resumed={}, elapsedMs={}",
                summary.processed(), summary.valid(), summary.invalid(), summary.failed(), summary.totalSkipped(),
                summary.batchesRun(), summary.batchesResumed(), elapsed);
        return summary;
    }

    private void runBatch(String id, List<Path> batch, CorpusScanner corpus, ThreadPoolExecutor executor, Tally tally) {
        MDC.put("batch", id);
        try {
            long started = System.currentTimeMillis();
            List<Future<FileOutcome>> futures = new ArrayList<>(batch.size());
            for (Path file : batch) {
                if (cancelled.get()) {
                    break;
                }
                futures.add(executor.submit(() -> checkFile(id, file, corpus.relative(file))));
            }
            boolean complete = futures.size() == batch.size();
            List<FileOutcome> outcomes = new ArrayList<>(futures.size());
            for (Future<FileOutcome> f : futures) {
                FileOutcome outcome = await(f);
                if (outcome == null) {
                    complete = false;
                } else {
                    outcomes.add(outcome);
                }
            }
            if (!complete) {
                LOG.info("Abandoned {} after {} of {} files; it runs again on restart", id, outcomes.size(), batch.size());
                return;
            }
            List<DocumentResult> results = new ArrayList<>();
            for (FileOutcome outcome : outcomes) {
                tally.add(outcome);
                results.addAll(outcome.results());
            }
            reports.append(results);
            checkpoint.markCompleted(id);
            tally.batchesRun++;
            LOG.info("Finished {}: files={}, documents={}, elapsedMs={}",
                    id, outcomes.size(), results.size(), System.currentTimeMillis() - started);
        } finally {
            MDC.remove("batch");
        }
    }

    private FileOutcome checkFile(String batchId, Path file, String relative) {
        // runs on the submitting thread when the queue is full
        String outer = MDC.get("batch");
        MDC.put("batch", batchId);
        try {
            Triage triage = classifier.classify(file, relative);
            List<DocumentResult> results = new ArrayList<>(triage.units().size());
            for (DocumentUnit unit : triage.units()) {
                results.add(checkUnit(unit));
            }
            triage.skipped().forEach((doc, reason) -> LOG.debug("Skipped {}: {}", doc, reason));
            return new FileOutcome(triage, results);
        } catch (FeatureModelException e) {
            LOG.warn("File {} failed: {}", relative, e.getMessage());
            Triage empty = new Triage(relative, SizeBucket.TINY, List.of(), Map.of());
            return new FileOutcome(empty, List.of(DocumentResult.failed(relative, e.getMessage(), 0)), false);
        } finally {
            if (outer == null) {
                MDC.remove("batch");
            } else {
                MDC.put("batch", outer);
            }
        }
    }

    private DocumentResult checkUnit(DocumentUnit unit) {
        try {
            return checker.check(unit.document(), unit.id());
        } catch (FeatureModelException e) {
            LOG.warn("Document {} failed: {}", unit.id(), e.getMessage());
            return DocumentResult.failed(unit.id(), e.getMessage(), 0);
        }
    }

    private static FileOutcome await(Future<FileOutcome> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for a batch task");
            return null;
        } catch (ExecutionException e) {
            LOG.error("Batch task failed unexpectedly", e.getCause());
            return null;
        }
    }

    private ThreadPoolExecutor newExecutor() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threads = r -> {
            Thread t = new Thread(r, "schemafm-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return new ThreadPoolExecutor(
                pool.workers(),
                pool.workers(),
                0L,
                TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(pool.queueCapacity()),
                threads,
                new ThreadPoolExecutor.CallerRunsPolicy());
    }

    private static void awaitTermination(ThreadPoolExecutor executor) {
        try {
            if (!executor.awaitTermination(1, TimeUnit.MINUTES)) {
                LOG.warn("Worker pool did not terminate within one minute");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    /** Classification and results of one file; {@code counted} is false for unreadable files. */
    private record FileOutcome(Triage triage, List<DocumentResult> results, boolean counted) {
        FileOutcome(Triage triage, List<DocumentResult> results) {
            this(triage, results, true);
        }
    }

    /** Mutable totals, touched only by the thread driving the run. */
    private static final class Tally {
        int processed;
        int valid;
        int invalid;
        int failed;
        long unmapped;
        int batchesRun;
        int batchesResumed;
        final Map<SkipReason, Integer> skipped = new EnumMap<>(SkipReason.class);
        final Map<SizeBucket, Integer> buckets = new EnumMap<>(SizeBucket.class);

        void add(FileOutcome outcome) {
            if (outcome.counted()) {
                buckets.merge(outcome.triage().bucket(), 1, Integer::sum);
            }
            outcome.triage().skipped().values().forEach(r -> skipped.merge(r, 1, Integer::sum));
            for (DocumentResult r : outcome.results()) {
                processed++;
                if (r.failed()) {
                    failed++;
                } else if (r.valid()) {
                    valid++;
                } else {
                    invalid++;
                }
                if (r.selection() != null) {
                    unmapped += r.selection().unmapped().size();
                }
            }
        }

        RunSummary toSummary(boolean cancelled, long elapsed) {
            return new RunSummary(processed, valid, invalid, failed, skipped, buckets, unmapped,
                    batchesRun, batchesResumed, cancelled, Map.of(), elapsed);
        }
    }
}
