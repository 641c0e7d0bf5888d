package io.schemafm.batch.runner;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("CorpusScanner")
class CorpusScannerTest {

    @Test
    @DisplayName("lists matching files sorted by relative path")
    void scan(@TempDir Path root) throws Exception {
        Files.createDirectories(root.resolve("b"));
        Files.createDirectories(root.resolve("a"));
        Files.writeString(root.resolve("b/two.yaml"), "x: 1");
        Files.writeString(root.resolve("a/one.YML"), "x: 1");
        Files.writeString(root.resolve("a/notes.txt"), "x");
        Files.writeString(root.resolve("z.json"), "{}");

        CorpusScanner scanner = new CorpusScanner(root, List.of(".yaml", "yml", "json"));

        assertThat(scanner.scan()).extracting(scanner::relative).containsExactly("a/one.YML", "b/two.yaml", "z.json");
    }

    @Test
    @DisplayName("a missing corpus directory is an error")
    void missingRoot(@TempDir Path root) {
        CorpusScanner scanner = new CorpusScanner(root.resolve("nowhere"), List.of("yaml"));

        assertThatThrownBy(scanner::scan)
                .isInstanceOf(UncheckedIOException.class)
                .hasMessageStartingWith("Corpus directory not found");
    }
}
