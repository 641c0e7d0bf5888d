package io.schemafm.batch.runner;

import static io.schemafm.batch.BatchFixtures.write;
import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import io.schemafm.batch.BatchFixtures;
import io.schemafm.batch.config.WorkerPoolConfig;
import io.schemafm.core.engine.DocumentChecker;
import io.schemafm.core.engine.GeneratedModel;
import io.schemafm.core.translate.TranslationBudget;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("BatchRunner")
class BatchRunnerTest {

    private static GeneratedModel pod;

    @TempDir
    Path dir;

    private Path corpus;
    private Path reportFile;
    private Path checkpointFile;

    @BeforeAll
    static void generate() {
        pod = BatchFixtures.podModel();
    }

    @BeforeEach
    void setUp() {
        corpus = dir.resolve("corpus");
        write(corpus.resolve("a-valid.yaml"), BatchFixtures.VALID_POD);
        write(corpus.resolve("b-missing.yaml"), BatchFixtures.POD_WITHOUT_CONTAINERS);
        write(corpus.resolve("c-templated.yaml"), BatchFixtures.TEMPLATED_POD);
        write(corpus.resolve("d-list.yaml"), "- apiVersion: v1\n- kind: Pod\n");
        write(corpus.resolve("e-broken.yaml"), "kind: [Pod\n");
        reportFile = dir.resolve("out/report.csv");
        checkpointFile = dir.resolve("out/checkpoint.txt");
    }

    private BatchRunner runner(TranslationBudget budget) {
        return new BatchRunner(
                new DocumentChecker(pod.model(), pod.mapping(), null, budget, null),
                new DocumentClassifier(true, true, true),
                new WorkerPoolConfig(2, 1),
                2,
                new CheckpointStore(checkpointFile),
                new ReportWriter(reportFile, dir.resolve("out/summary.csv")));
    }

    private CorpusScanner scanner() {
        return new CorpusScanner(corpus, List.of("yaml"));
    }

    private List<Map<String, String>> readReport() throws Exception {
        CsvSchema header = CsvSchema.emptySchema().withHeader();
        try (MappingIterator<Map<String, String>> it =
                new CsvMapper().readerFor(Map.class).with(header).readValues(reportFile.toFile())) {
            return it.readAll();
        }
    }

    @Test
    @DisplayName("checks every document and tallies outcomes")
    void fullRun() throws Exception {
        RunSummary summary = runner(TranslationBudget.DEFAULT).run(scanner());

        assertThat(summary.processed()).isEqualTo(4);
        assertThat(summary.valid()).isEqualTo(1);
        assertThat(summary.invalid()).isEqualTo(1);
        assertThat(summary.failed()).isEqualTo(2);
        assertThat(summary.skipped()).containsEntry(SkipReason.TEMPLATED, 1);
        assertThat(summary.buckets()).containsEntry(SizeBucket.TINY, 4);
        assertThat(summary.batchesRun()).isEqualTo(3);
        assertThat(summary.cancelled()).isFalse();

        assertThat(Files.readAllLines(checkpointFile)).containsExactly("batch-00001", "batch-00002", "batch-00003");
        List<Map<String, String>> rows = readReport();
        assertThat(rows).extracting(r -> r.get("document-id"))
                .containsExactly("a-valid.yaml", "b-missing.yaml", "d-list.yaml", "e-broken.yaml");
        assertThat(rows.get(1)).containsEntry("violations", "mandatory:Pod.spec.containers");
        assertThat(rows.get(2)).containsEntry("error", "Document root is not a mapping");
        assertThat(rows.get(3).get("error")).startsWith("Malformed document");
    }

    @Test
    @DisplayName("checkpointed batches are skipped on restart")
    void resumesFromCheckpoint() throws Exception {
        write(checkpointFile, "batch-00001\n");

        RunSummary summary = runner(TranslationBudget.DEFAULT).run(scanner());

        assertThat(summary.batchesResumed()).isEqualTo(1);
        assertThat(summary.batchesRun()).isEqualTo(2);
        assertThat(summary.processed()).isEqualTo(2);
        assertThat(readReport()).extracting(r -> r.get("document-id")).doesNotContain("a-valid.yaml");
        assertThat(Files.readAllLines(checkpointFile)).containsExactly("batch-00001", "batch-00002", "batch-00003");
    }

    @Test
    @DisplayName("a document over budget is reported failed and the run goes on")
    void budgetFailure() throws Exception {
        RunSummary summary = runner(new TranslationBudget(1000, 2)).run(scanner());

        assertThat(summary.valid()).isZero();
        assertThat(summary.processed()).isEqualTo(4);
        assertThat(readReport())
                .filteredOn(r -> r.get("document-id").equals("a-valid.yaml"))
                .singleElement()
                .satisfies(r -> assertThat(r.get("error")).contains("exceeds 2 levels"));
    }

    @Test
    @DisplayName("a cancelled runner starts no batch")
    void cancelled() {
        BatchRunner runner = runner(TranslationBudget.DEFAULT);
        runner.cancel();

        RunSummary summary = runner.run(scanner());

        assertThat(summary.cancelled()).isTrue();
        assertThat(summary.batchesRun()).isZero();
        assertThat(summary.processed()).isZero();
        assertThat(checkpointFile).doesNotExist();
    }

    @Test
    @DisplayName("batch ids are one-based and zero-padded")
    void batchIds() {
        assertThat(BatchRunner.batchId(0)).isEqualTo("batch-00001");
        assertThat(BatchRunner.batchId(41)).isEqualTo("batch-00042");
    }
}
