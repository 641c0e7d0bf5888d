package io.schemafm.core.serial;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.schemafm.core.error.ModelParseException;
import io.schemafm.core.model.Cardinality;
import io.schemafm.core.model.FeatureFlag;
import io.schemafm.core.model.FeatureModel;
import io.schemafm.core.model.FeatureNode;
import io.schemafm.core.testkit.Fixtures;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ModelParser")
class ModelParserTest {

    @Nested
    @DisplayName("reading written models")
    class ReadBack {

        @Test
        @DisplayName("restores ids, keys, cardinalities, flags and attributes")
        void smallModel() {
            FeatureModel original = ModelSerializerTest.smallModel();

            FeatureModel parsed = ModelParser.parse(new ModelSerializer().write(original), "small.fm");

            assertThat(parsed.namespace()).isEqualTo("apps");
            assertThat(parsed.features()).extracting(FeatureNode::id)
                    .containsExactlyInAnyOrderElementsOf(original.features().stream().map(FeatureNode::id).toList());
            assertThat(parsed.get("App._2fa").key()).isEqualTo("2fa");
            assertThat(parsed.get("App.tier").key()).isEqualTo("tier");
            assertThat(parsed.get("App.isEmpty").key()).isNull();
            assertThat(parsed.get("App.replicas").cardinality()).isEqualTo(Cardinality.MANDATORY);
            assertThat(parsed.get("App.tier").attribute()).isEqualTo(original.get("App.tier").attribute());
            assertThat(parsed.root().has(FeatureFlag.ABSTRACT)).isTrue();
            assertThat(parsed.constraints()).isEqualTo(original.constraints());
        }

        @Test
        @DisplayName("writing a parsed model reproduces the file")
        void idempotent() {
            ModelSerializer serializer = new ModelSerializer();
            String written = serializer.write(Fixtures.podModel().model());

            assertThat(serializer.write(ModelParser.parse(written, "pod.fm"))).isEqualTo(written);
        }

        @Test
        @DisplayName("inline descriptions come back as metadata")
        void inlineDescriptions() {
            String written = new ModelSerializer(true).write(ModelSerializerTest.smallModel());

            assertThat(ModelParser.parse(written, "small.fm").description("App")).isEqualTo("An application.");
        }

        @Test
        @DisplayName("aliases section is read")
        void aliases() {
            FeatureModel parsed = ModelParser.parse("""
                    namespace m
                    features
                    \tm {abstract}
                    \t\tor
                    \t\t\tA
                    \t\t\t\toptional
                    \t\t\t\t\tA.b
                    aliases
                    \tA.c => A.b
                    """, "inline");

            assertThat(parsed.aliases()).containsEntry("A.c", "A.b");
        }
    }

    @Nested
    @DisplayName("malformed input")
    class Malformed {

        @Test
        @DisplayName("reports the line of an unknown section")
        void unknownSection() {
            assertThatThrownBy(() -> ModelParser.parse("namespace m\nfeatures\n\tm\nextras\n", "bad.fm"))
                    .isInstanceOf(ModelParseException.class)
                    .hasMessage("Unknown section 'extras' (line 4)")
                    .satisfies(e -> assertThat(((ModelParseException) e).source()).isEqualTo("bad.fm"));
        }

        @Test
        @DisplayName("reports the line of an unknown type")
        void unknownType() {
            assertThatThrownBy(() -> ModelParser.parse("""
                    namespace m
                    features
                    \tm {abstract}
                    \t\tor
                    \t\t\tFloat m.x
                    """, "bad.fm"))
                    .isInstanceOf(ModelParseException.class)
                    .satisfies(e -> assertThat(((ModelParseException) e).line()).isEqualTo(5))
                    .hasMessageContaining("unknown type 'Float'");
        }

        @Test
        @DisplayName("rejects constraints over features the model lacks")
        void danglingConstraint() {
            assertThatThrownBy(() -> ModelParser.parse("""
                    namespace m
                    features
                    \tm {abstract}
                    constraints
                    \tm => m.missing
                    """, "bad.fm"))
                    .isInstanceOf(ModelParseException.class)
                    .hasMessageContaining("unknown feature 'm.missing'");
        }

        @Test
        @DisplayName("rejects a feature outside any group")
        void featureOutsideGroup() {
            assertThatThrownBy(() -> ModelParser.parse("namespace m\nfeatures\n\tm\n\t\tm.x\n", "bad.fm"))
                    .isInstanceOf(ModelParseException.class)
                    .hasMessage("Feature m.x is not inside a group (line 4)");
        }

        @Test
        @DisplayName("requires the namespace line")
        void missingNamespace() {
            assertThatThrownBy(() -> ModelParser.parse("features\n\tm\n", "bad.fm"))
                    .isInstanceOf(ModelParseException.class)
                    .hasMessage("Missing namespace line");
        }

        @Test
        @DisplayName("wraps unreadable files")
        void unreadableFile() {
            assertThatThrownBy(() -> ModelParser.read(Path.of("does/not/exist.fm")))
                    .isInstanceOf(ModelParseException.class)
                    .hasMessageStartingWith("Cannot read model file");
        }
    }
}
