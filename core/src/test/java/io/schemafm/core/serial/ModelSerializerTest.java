package io.schemafm.core.serial;

import static org.assertj.core.api.Assertions.assertThat;

import io.schemafm.core.model.AttributeConstraint;
import io.schemafm.core.model.Cardinality;
import io.schemafm.core.model.Constraint;
import io.schemafm.core.model.FeatureFlag;
import io.schemafm.core.model.FeatureModel;
import io.schemafm.core.model.FeatureNode;
import io.schemafm.core.model.GroupType;
import io.schemafm.core.schema.ScalarType;
import io.schemafm.core.testkit.Fixtures;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("ModelSerializer")
class ModelSerializerTest {

    static FeatureModel smallModel() {
        FeatureNode.Builder app = FeatureNode.builder("App")
                .key("App")
                .cardinality(Cardinality.MANDATORY)
                .provenance("example.App")
                .addChild(FeatureNode.builder("App.tier")
                        .key("tier")
                        .attribute(new AttributeConstraint(ScalarType.STRING, List.of("web", "db"), null, null))
                        .provenance("example.App/properties/tier"))
                .addChild(FeatureNode.builder("App.replicas")
                        .key("replicas")
                        .cardinality(Cardinality.MANDATORY)
                        .attribute(new AttributeConstraint(ScalarType.INTEGER, List.of(), BigDecimal.ONE, null))
                        .provenance("example.App/properties/replicas"))
                .addChild(FeatureNode.builder("App._2fa")
                        .key("2fa")
                        .attribute(AttributeConstraint.of(ScalarType.BOOLEAN))
                        .provenance("example.App/properties/2fa"))
                .addChild(FeatureNode.builder("App.isEmpty")
                        .flag(FeatureFlag.ABSTRACT)
                        .provenance("App/isEmpty"));
        FeatureNode root = FeatureNode.builder("apps")
                .flag(FeatureFlag.ABSTRACT)
                .cardinality(Cardinality.MANDATORY)
                .group(GroupType.OR)
                .provenance("apps")
                .addChild(app)
                .build();
        return new FeatureModel(
                "apps",
                root,
                List.of(Constraint.requires("App._2fa", "App.tier", "test")),
                Map.of("App", "An application."),
                Map.of());
    }

    @Test
    @DisplayName("writes sections, groups and attributes in model order")
    void format() {
        String text = new ModelSerializer().write(smallModel());

        assertThat(text).isEqualTo("""
                namespace apps
                features
                \tapps {abstract, source 'apps'}
                \t\tor
                \t\t\tApp {source 'example.App'}
                \t\t\t\tmandatory
                \t\t\t\t\tInteger App.replicas {min 1, source 'example.App/properties/replicas'}
                \t\t\t\toptional
                \t\t\t\t\tString App.tier {enum ['web', 'db'], source 'example.App/properties/tier'}
                \t\t\t\t\tBoolean App._2fa {key '2fa', source 'example.App/properties/2fa'}
                \t\t\t\t\tApp.isEmpty {abstract, source 'App/isEmpty'}
                constraints
                \tApp._2fa => App.tier
                """);
    }

    @Test
    @DisplayName("descriptions are written inline only when asked")
    void inlineDescriptions() {
        assertThat(new ModelSerializer(false).write(smallModel())).doesNotContain("doc ");
        assertThat(new ModelSerializer(true).write(smallModel()))
                .contains("App {source 'example.App', doc 'An application.'}");
    }

    @Test
    @DisplayName("an unchanged model renders to the same bytes")
    void deterministic() {
        FeatureModel model = Fixtures.podModel().model();

        assertThat(new ModelSerializer().write(model)).isEqualTo(new ModelSerializer().write(model));
    }

    @Test
    @DisplayName("writes model and descriptions files, creating directories")
    void files(@TempDir Path dir) throws Exception {
        FeatureModel model = smallModel();
        Path modelFile = dir.resolve("out/model.fm");
        Path descriptionsFile = dir.resolve("out/descriptions.json");

        new ModelSerializer().write(model, modelFile);
        DescriptionsFile.write(model.descriptions(), descriptionsFile);

        assertThat(Files.readString(modelFile)).startsWith("namespace apps\n");
        assertThat(DescriptionsFile.read(descriptionsFile)).containsExactly(Map.entry("App", "An application."));
    }
}
