package io.schemafm.batch.runner;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import io.schemafm.core.engine.DocumentResult;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Appends per-document rows to the validation report and the batch summary CSV files.
 *
 * <p>
 * Rows are appended batch by batch; the header is written when a file is created. Violations are
 * joined with {@code ;} in report order.
 */
public final class ReportWriter {

    static final String SOURCE = "schema-fm";

    private static final CsvMapper MAPPER = new CsvMapper();

    @JsonPropertyOrder({"document-id", "valid", "violations", "elapsed-ms", "error"})
    record ReportRow(
            @JsonProperty("document-id") String documentId,
            @JsonProperty("valid") boolean valid,
            @JsonProperty("violations") String violations,
            @JsonProperty("elapsed-ms") long elapsedMs,
            @JsonProperty("error") String error) {}

    @JsonPropertyOrder({"filename", "source", "result", "time"})
    record SummaryRow(
            @JsonProperty("filename") String filename,
            @JsonProperty("source") String source,
            @JsonProperty("result") boolean result,
            @JsonProperty("time") long time) {}

    private final Path reportFile;
    private final Path summaryFile;

    public ReportWriter(Path reportFile, Path summaryFile) {
        this.reportFile = reportFile;
        this.summaryFile = summaryFile;
    }

    /** Removes both files so a fresh run starts with headers. */
    public synchronized void reset() {
        try {
            Files.deleteIfExists(reportFile);
            Files.deleteIfExists(summaryFile);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to reset report files", e);
        }
    }

    public synchronized void append(List<DocumentResult> results) {
        if (results.isEmpty()) {
            return;
        }
        List<ReportRow> reportRows = new ArrayList<>(results.size());
        List<SummaryRow> summaryRows = new ArrayList<>(results.size());
        for (DocumentResult r : results) {
            String violations = r.report() == null ? "" : String.join(";", r.report().violations());
            reportRows.add(new ReportRow(
                    r.documentId(), r.valid(), violations, r.elapsedMillis(), r.error() == null ? "" : r.error()));
            summaryRows.add(new SummaryRow(r.documentId(), SOURCE, r.valid(), r.elapsedMillis()));
        }
        appendRows(reportFile, ReportRow.class, reportRows);
        appendRows(summaryFile, SummaryRow.class, summaryRows);
    }

    private static void appendRows(Path target, Class<?> rowType, List<?> rows) {
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            boolean header = !Files.exists(target) || Files.size(target) == 0;
            CsvSchema schema = MAPPER.schemaFor(rowType).withUseHeader(header);
            String csv = MAPPER.writer(schema).writeValueAsString(rows);
            Files.writeString(target, csv, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render CSV rows for " + target, e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + target, e);
        }
    }
}
