package io.schemafm.batch.runner;

import static org.assertj.core.api.Assertions.assertThat;

import io.schemafm.core.engine.DocumentResult;
import io.schemafm.core.translate.ConfigurationSelection;
import io.schemafm.core.validate.ValidationReport;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("ReportWriter")
class ReportWriterTest {

    private static DocumentResult checked(String id, List<String> violations, long elapsed) {
        ConfigurationSelection selection = new ConfigurationSelection(id, Set.of(), Map.of(), List.of());
        return DocumentResult.checked(selection, new ValidationReport(id, violations.isEmpty(), violations, 0), elapsed);
    }

    @Test
    @DisplayName("appends report and summary rows with one header each")
    void appendsRows(@TempDir Path dir) throws Exception {
        Path report = dir.resolve("out/report.csv");
        Path summary = dir.resolve("out/summary.csv");
        ReportWriter writer = new ReportWriter(report, summary);

        writer.append(List.of(checked("a.yaml", List.of(), 3)));
        writer.append(List.of(
                checked("b.yaml", List.of("mandatory:Pod.spec.containers", "value:Pod.spec.restartPolicy"), 5),
                DocumentResult.failed("c.yaml", "Document root is not a mapping", 1)));

        assertThat(Files.readAllLines(report)).containsExactly(
                "document-id,valid,violations,elapsed-ms,error",
                "a.yaml,true,,3,",
                "b.yaml,false,mandatory:Pod.spec.containers;value:Pod.spec.restartPolicy,5,",
                "c.yaml,false,,1,Document root is not a mapping");
        assertThat(Files.readAllLines(summary)).containsExactly(
                "filename,source,result,time",
                "a.yaml,schema-fm,true,3",
                "b.yaml,schema-fm,false,5",
                "c.yaml,schema-fm,false,1");
    }

    @Test
    @DisplayName("reset removes earlier rows")
    void reset(@TempDir Path dir) throws Exception {
        Path report = dir.resolve("report.csv");
        ReportWriter writer = new ReportWriter(report, dir.resolve("summary.csv"));
        writer.append(List.of(checked("a.yaml", List.of(), 3)));

        writer.reset();
        writer.append(List.of(checked("b.yaml", List.of(), 4)));

        assertThat(Files.readAllLines(report)).hasSize(2).last().asString().startsWith("b.yaml");
    }
}
