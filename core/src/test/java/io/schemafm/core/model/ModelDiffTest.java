package io.schemafm.core.model;

import static org.assertj.core.api.Assertions.assertThat;

import io.schemafm.core.serial.ModelParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ModelDiff")
class ModelDiffTest {

    private static final FeatureModel OLDER = ModelParser.parse("""
            namespace v1
            features
            \tv1 {abstract}
            \t\tor
            \t\t\tApp
            \t\t\t\toptional
            \t\t\t\t\tApp.name
            \t\t\t\t\tApp.tier
            \t\t\t\t\tApp.legacy
            constraints
            \tApp.tier => App.name
            """, "v1.fm");

    private static final FeatureModel NEWER = ModelParser.parse("""
            namespace v2
            features
            \tv2 {abstract}
            \t\tor
            \t\t\tApp
            \t\t\t\tmandatory
            \t\t\t\t\tApp.name
            \t\t\t\toptional
            \t\t\t\t\tApp.tier
            \t\t\t\t\tApp.replicas
            constraints
            \tApp.replicas => App.tier
            """, "v2.fm");

    @Test
    @DisplayName("lists added, removed and changed features, ignoring the root")
    void features() {
        ModelDiff diff = ModelDiff.between(OLDER, NEWER);

        assertThat(diff.addedFeatures()).containsExactly("App.replicas");
        assertThat(diff.removedFeatures()).containsExactly("App.legacy");
        assertThat(diff.changedFeatures()).containsOnlyKeys("App.name");
        assertThat(diff.isEmpty()).isFalse();
    }

    @Test
    @DisplayName("compares constraints by their rendered text")
    void constraints() {
        ModelDiff diff = ModelDiff.between(OLDER, NEWER);

        assertThat(diff.addedConstraints()).containsExactly("App.replicas => App.tier");
        assertThat(diff.removedConstraints()).containsExactly("App.tier => App.name");
    }

    @Test
    @DisplayName("a model compared with itself has no differences")
    void identical() {
        assertThat(ModelDiff.between(OLDER, OLDER).isEmpty()).isTrue();
    }

    @Test
    @DisplayName("renders a markdown changelog")
    void markdown() {
        String md = ModelDiff.between(OLDER, NEWER).toMarkdown();

        assertThat(md).startsWith("# Changelog: v1 -> v2\n")
                .contains("| Added features | 1 |")
                .contains("## Removed features\n\n- `App.legacy`")
                .contains("- `App.name`: optional -> mandatory");
    }
}
