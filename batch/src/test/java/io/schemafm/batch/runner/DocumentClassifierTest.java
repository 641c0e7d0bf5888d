package io.schemafm.batch.runner;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.schemafm.core.error.DocumentReadException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("DocumentClassifier")
class DocumentClassifierTest {

    @TempDir
    Path dir;

    private final DocumentClassifier classifier = new DocumentClassifier(true, true, true);

    private Path write(String name, String text) throws Exception {
        return Files.writeString(dir.resolve(name), text);
    }

    @Nested
    @DisplayName("splitting")
    class Splitting {

        @Test
        @DisplayName("a single document keeps the file name as id")
        void singleDocument() throws Exception {
            Triage triage = classifier.classify(write("pod.yaml", "apiVersion: v1\nkind: Pod\n"), "apps/pod.yaml");

            assertThat(triage.units()).extracting(DocumentUnit::id).containsExactly("apps/pod.yaml");
            assertThat(triage.skipped()).isEmpty();
            assertThat(triage.bucket()).isEqualTo(SizeBucket.TINY);
        }

        @Test
        @DisplayName("documents of a multi-document file are numbered from zero")
        void multiDocument() throws Exception {
            Path file = write("all.yaml", """
                    apiVersion: v1
                    kind: Service
                    ---
                    apiVersion: v1
                    kind: Pod
                    """);

            Triage triage = classifier.classify(file, "all.yaml");

            assertThat(triage.units()).extracting(DocumentUnit::id).containsExactly("all.yaml#0", "all.yaml#1");
            assertThat(triage.units().get(1).document().path("kind").asText()).isEqualTo("Pod");
        }

        @Test
        @DisplayName("JSON files are read as JSON")
        void json() throws Exception {
            Triage triage = classifier.classify(write("pod.json", "{\"apiVersion\": \"v1\", \"kind\": \"Pod\"}"), "pod.json");

            assertThat(triage.units()).hasSize(1);
        }

        @Test
        @DisplayName("a non-mapping document is passed on for the translator to fail")
        void nonMapping() throws Exception {
            Triage triage = classifier.classify(write("list.yaml", "- a\n- b\n"), "list.yaml");

            assertThat(triage.units()).hasSize(1);
        }
    }

    @Nested
    @DisplayName("skips")
    class Skips {

        @Test
        @DisplayName("templated files are skipped whole")
        void templated() throws Exception {
            Path file = write("chart.yaml", "apiVersion: v1\nkind: Pod\nmetadata:\n  name: {{ .Values.name }}\n");

            Triage triage = classifier.classify(file, "chart.yaml");

            assertThat(triage.units()).isEmpty();
            assertThat(triage.skipped()).containsEntry("chart.yaml", SkipReason.TEMPLATED);
        }

        @Test
        @DisplayName("templated files are parsed when skipping is off")
        void templatedKept() throws Exception {
            Path file = write("ytt.yaml", "#@ load(\"@ytt:data\", \"data\")\napiVersion: v1\nkind: Pod\n");

            Triage triage = new DocumentClassifier(false, true, true).classify(file, "ytt.yaml");

            assertThat(triage.units()).hasSize(1);
        }

        @Test
        @DisplayName("documents without apiVersion or kind are skipped when a kind is required")
        void missingKind() throws Exception {
            Path file = write("values.yaml", "replicas: 3\n");

            assertThat(classifier.classify(file, "values.yaml").skipped())
                    .containsEntry("values.yaml", SkipReason.MISSING_KIND);
            assertThat(new DocumentClassifier(true, true, false).classify(file, "values.yaml").units()).hasSize(1);
        }

        @Test
        @DisplayName("custom resource definitions are skipped")
        void customResource() throws Exception {
            Path file = write("crd.yaml", "apiVersion: apiextensions.k8s.io/v1\nkind: CustomResourceDefinition\n");

            assertThat(classifier.classify(file, "crd.yaml").skipped())
                    .containsEntry("crd.yaml", SkipReason.CUSTOM_RESOURCE);
        }

        @Test
        @DisplayName("empty documents are skipped")
        void empty() throws Exception {
            Path file = write("empty.yaml", "apiVersion: v1\nkind: Pod\n---\n{}\n");

            Triage triage = classifier.classify(file, "empty.yaml");

            assertThat(triage.units()).extracting(DocumentUnit::id).containsExactly("empty.yaml#0");
            assertThat(triage.skipped()).containsEntry("empty.yaml#1", SkipReason.EMPTY);
        }
    }

    @Test
    @DisplayName("malformed text is a read failure")
    void malformed() throws Exception {
        Path file = write("broken.yaml", "kind: [Pod\n");

        assertThatThrownBy(() -> classifier.classify(file, "broken.yaml"))
                .isInstanceOf(DocumentReadException.class)
                .hasMessageStartingWith("Malformed document")
                .satisfies(e -> assertThat(((DocumentReadException) e).source()).isEqualTo("broken.yaml"));
    }

    @Test
    @DisplayName("file sizes fall into buckets")
    void buckets() {
        assertThat(SizeBucket.of(0)).isEqualTo(SizeBucket.TINY);
        assertThat(SizeBucket.of(10 * 1024)).isEqualTo(SizeBucket.SMALL);
        assertThat(SizeBucket.of(50 * 1024)).isEqualTo(SizeBucket.MEDIUM);
        assertThat(SizeBucket.of(200 * 1024)).isEqualTo(SizeBucket.LARGE);
        assertThat(SizeBucket.of(1024 * 1024)).isEqualTo(SizeBucket.HUGE);
    }
}
