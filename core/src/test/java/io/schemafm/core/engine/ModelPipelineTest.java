package io.schemafm.core.engine;

import static org.assertj.core.api.Assertions.assertThat;

import io.schemafm.core.error.Diagnostics;
import io.schemafm.core.model.FeatureNode;
import io.schemafm.core.schema.DefinitionsLoader;
import io.schemafm.core.serial.ModelSerializer;
import io.schemafm.core.spi.PipelineListener;
import io.schemafm.core.testkit.Fixtures;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ModelPipeline")
class ModelPipelineTest {

    @Test
    @DisplayName("generates a model, its mapping and diagnostics from a schema")
    void generatesPodModel() {
        GeneratedModel generated = Fixtures.podModel();

        assertThat(generated.model().namespace()).isEqualTo("model");
        assertThat(generated.model().kinds()).extracting(FeatureNode::id).containsExactly("Pod");
        assertThat(generated.model().size()).isEqualTo(15);
        assertThat(generated.mapping().size()).isEqualTo(11);
        assertThat(generated.diagnostics().withCode(Diagnostics.UNRESOLVED_REFERENCE))
                .anySatisfy(d -> assertThat(d.subject()).startsWith("io.k8s.api.core.v1.PodSpec"));
        assertThat(generated.model().description("Pod"))
                .isEqualTo("Pod is a collection of containers that can run on a host.");
    }

    @Test
    @DisplayName("explicit roots restrict the kinds generated")
    void explicitRoots() {
        GeneratedModel generated = Fixtures.generate("schemas/pod.json", List.of("io.k8s.api.core.v1.PodSpec"));

        assertThat(generated.model().kinds()).extracting(FeatureNode::id).containsExactly("PodSpec");
    }

    @Test
    @DisplayName("counts unconverted description sentences")
    void unconvertedCount() {
        assertThat(Fixtures.generate("schemas/constraints.yaml").unconvertedDescriptions()).isEqualTo(1);
    }

    @Test
    @DisplayName("parallel synthesis produces the same model as sequential")
    void parallelIsDeterministic() {
        String definitions = """
                definitions:
                  a.v1.Alpha: {type: object, properties: {x: {type: string}}}
                  b.v1.Beta: {type: object, properties: {y: {type: integer}}}
                  c.v1.Gamma: {type: object, properties: {z: {type: boolean}}}
                """;
        ModelSerializer serializer = new ModelSerializer();

        String sequential = serializer.write(new ModelPipeline(new PipelineOptions("m", List.of(), 1))
                .generate(DefinitionsLoader.parse(definitions, "abc.yaml"))
                .model());
        String parallel = serializer.write(new ModelPipeline(new PipelineOptions("m", List.of(), 3))
                .generate(DefinitionsLoader.parse(definitions, "abc.yaml"))
                .model());

        assertThat(parallel).isEqualTo(sequential);
    }

    @Test
    @DisplayName("notifies the listener per kind and once per model")
    void listenerEvents() {
        RecordingListener listener = new RecordingListener();

        new ModelPipeline(PipelineOptions.DEFAULT, listener).generate(Fixtures.definitions("schemas/constraints.yaml"));

        assertThat(listener.kinds).singleElement().satisfies(e -> {
            assertThat(e.kindId()).isEqualTo("Probe");
            assertThat(e.definition()).isEqualTo("example.v1.Probe");
            assertThat(e.constraints()).isEqualTo(4);
        });
        assertThat(listener.models).singleElement().satisfies(e -> {
            assertThat(e.namespace()).isEqualTo("model");
            assertThat(e.kinds()).isEqualTo(1);
        });
    }

    @Test
    @DisplayName("a failing listener does not stop generation")
    void failingListener() {
        PipelineListener failing = new RecordingListener() {
            @Override
            public void onModelGenerated(ModelGeneratedEvent event) {
                throw new IllegalStateException("listener broke");
            }
        };

        GeneratedModel generated =
                new ModelPipeline(PipelineOptions.DEFAULT, failing).generate(Fixtures.definitions("schemas/pod.json"));

        assertThat(generated.model().kinds()).hasSize(1);
    }

    static class RecordingListener implements PipelineListener {
        final List<KindSynthesizedEvent> kinds = new CopyOnWriteArrayList<>();
        final List<ModelGeneratedEvent> models = new CopyOnWriteArrayList<>();
        final List<DocumentCheckedEvent> checked = new CopyOnWriteArrayList<>();
        final List<DocumentFailedEvent> failed = new CopyOnWriteArrayList<>();

        @Override
        public void onKindSynthesized(KindSynthesizedEvent event) {
            kinds.add(event);
        }

        @Override
        public void onModelGenerated(ModelGeneratedEvent event) {
            models.add(event);
        }

        @Override
        public void onDocumentChecked(DocumentCheckedEvent event) {
            checked.add(event);
        }

        @Override
        public void onDocumentFailed(DocumentFailedEvent event) {
            failed.add(event);
        }
    }
}
