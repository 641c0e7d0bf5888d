package io.schemafm.core.translate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import io.schemafm.core.engine.GeneratedModel;
import io.schemafm.core.engine.ModelPipeline;
import io.schemafm.core.engine.PipelineOptions;
import io.schemafm.core.error.DocumentReadException;
import io.schemafm.core.error.TranslationBudgetExceededException;
import io.schemafm.core.schema.DefinitionsLoader;
import io.schemafm.core.testkit.Fixtures;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ConfigurationTranslator")
class ConfigurationTranslatorTest {

    private static GeneratedModel pod;

    @BeforeAll
    static void generate() {
        pod = Fixtures.podModel();
    }

    private static ConfigurationTranslator translator() {
        return new ConfigurationTranslator(pod.model(), pod.mapping());
    }

    @Test
    @DisplayName("selects every mapped key with its abstract ancestors")
    void selectsMappedKeys() {
        ConfigurationSelection selection =
                translator().translate(Fixtures.document("documents/pod-valid.yaml"), "pod-valid.yaml");

        assertThat(selection.selected()).containsExactlyInAnyOrder(
                "model",
                "Pod",
                "Pod.apiVersion",
                "Pod.kind",
                "Pod.metadata",
                "Pod.metadata.name",
                "Pod.metadata.labels",
                "Pod.spec",
                "Pod.spec.containers",
                "Pod.spec.restartPolicy",
                "Pod.spec.activeDeadlineSeconds");
        assertThat(selection.hasValue("Pod.spec.restartPolicy", "Always")).isTrue();
        assertThat(selection.values().get("Pod.metadata.labels")).extracting(JsonNode::asText)
                .containsExactly("web", "frontend");
        assertThat(selection.fullyMapped()).isTrue();
    }

    @Test
    @DisplayName("an unknown feature absorbs the keys below it")
    void unknownAbsorbs() {
        ConfigurationSelection selection =
                translator().translate(Fixtures.document("documents/pod-valid.yaml"), "pod-valid.yaml");

        assertThat(selection.unmapped()).noneMatch(k -> k.startsWith("spec.containers"));
    }

    @Test
    @DisplayName("reports unmapped leaves without the kind and keeps going")
    void unmappedLeaves() {
        ConfigurationSelection selection =
                translator().translate(Fixtures.document("documents/pod-unmapped.yaml"), "pod-unmapped.yaml");

        assertThat(selection.unmapped()).containsExactly("foo.bar");
        assertThat(selection.isSelected("Pod.spec.containers")).isTrue();
    }

    @Test
    @DisplayName("empty containers select the isEmpty marker")
    void emptyContainer() {
        JsonNode doc = Fixtures.yaml("""
                kind: Pod
                metadata:
                  labels: {}
                """);

        ConfigurationSelection selection = translator().translate(doc, "empty-labels");

        assertThat(selection.selected()).contains("Pod.metadata.labels", "Pod.metadata.labels.isEmpty");
    }

    @Test
    @DisplayName("a null value selects a feature the schema does not mark nullable")
    void nullWithoutMarker() {
        JsonNode doc = Fixtures.yaml("""
                kind: Pod
                metadata:
                  name: null
                """);

        ConfigurationSelection selection = translator().translate(doc, "null-name");

        assertThat(selection.selected()).contains("Pod.metadata", "Pod.metadata.name");
        assertThat(selection.unmapped()).isEmpty();
        assertThat(selection.values()).doesNotContainKey("Pod.metadata.name");
    }

    @Test
    @DisplayName("a null value selects the isNull marker of a nullable feature")
    void nullWithMarker() {
        GeneratedModel nullable = new ModelPipeline(PipelineOptions.DEFAULT).generate(DefinitionsLoader.parse("""
                A:
                  type: object
                  properties:
                    note: {type: [string, 'null']}
                """, "inline"));
        JsonNode doc = Fixtures.yaml("kind: A\nnote: null\n");

        ConfigurationSelection selection =
                new ConfigurationTranslator(nullable.model(), nullable.mapping()).translate(doc, "null-note");

        assertThat(selection.selected()).contains("A.note", "A.note.isNull");
        assertThat(selection.unmapped()).doesNotContain("note");
    }

    @Test
    @DisplayName("documents without a kind use the default kind")
    void defaultKind() {
        JsonNode doc = Fixtures.yaml("spec:\n  restartPolicy: Never\n");

        ConfigurationSelection selection = new ConfigurationTranslator(
                        pod.model(), pod.mapping(), "Pod", TranslationBudget.DEFAULT)
                .translate(doc, "no-kind");

        assertThat(selection.selected()).contains("Pod", "Pod.spec", "Pod.spec.restartPolicy");
    }

    @Test
    @DisplayName("a scalar on a union feature selects the branch accepting its type")
    void unionBranch() {
        GeneratedModel union = new ModelPipeline(PipelineOptions.DEFAULT).generate(DefinitionsLoader.parse("""
                Service:
                  type: object
                  properties:
                    port: {x-kubernetes-int-or-string: true}
                """, "inline"));
        ConfigurationTranslator t = new ConfigurationTranslator(union.model(), union.mapping());

        ConfigurationSelection numeric = t.translate(Fixtures.yaml("kind: Service\nport: 8080\n"), "numeric");
        ConfigurationSelection named = t.translate(Fixtures.yaml("kind: Service\nport: http\n"), "named");

        assertThat(numeric.selected()).contains("Service.port", "Service.port.oneOf", "Service.port.oneOf.asInteger");
        assertThat(named.selected()).contains("Service.port.oneOf.asString")
                .doesNotContain("Service.port.oneOf.asInteger");
    }

    @Test
    @DisplayName("a non-mapping root cannot be translated")
    void nonObjectRoot() {
        assertThatThrownBy(() -> translator().translate(Fixtures.yaml("- a\n- b\n"), "list.yaml"))
                .isInstanceOf(DocumentReadException.class)
                .hasMessage("Document root is not a mapping");
    }

    @Test
    @DisplayName("nesting deeper than the budget aborts the document")
    void depthBudget() {
        ConfigurationTranslator shallow =
                new ConfigurationTranslator(pod.model(), pod.mapping(), null, new TranslationBudget(1000, 2));

        assertThatThrownBy(() -> shallow.translate(Fixtures.document("documents/pod-valid.yaml"), "deep.yaml"))
                .isInstanceOf(TranslationBudgetExceededException.class)
                .hasMessageContaining("exceeds 2 levels");
    }
}
