package io.schemafm.core.constraint;

import static org.assertj.core.api.Assertions.assertThat;

import io.schemafm.core.error.Diagnostics;
import io.schemafm.core.model.Constraint;
import io.schemafm.core.schema.SchemaGraph;
import io.schemafm.core.schema.SchemaGraphResolver;
import io.schemafm.core.synth.FeatureSynthesizer;
import io.schemafm.core.synth.KindTree;
import io.schemafm.core.testkit.Fixtures;
import java.util.List;
import java.util.function.Function;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ConstraintDeriver")
class ConstraintDeriverTest {

    private Diagnostics diagnostics;
    private SchemaGraph graph;
    private KindTree probe;

    @BeforeEach
    void setUp() {
        diagnostics = new Diagnostics();
        graph = new SchemaGraphResolver(Fixtures.definitions("schemas/constraints.yaml"), diagnostics)
                .resolve(List.of());
        probe = new FeatureSynthesizer(graph, diagnostics).synthesize("example.v1.Probe");
    }

    @Test
    @DisplayName("derives constraints from keywords and description prose")
    void defaultRules() {
        DerivationResult result = new ConstraintDeriver(graph, diagnostics).derive(probe);

        assertThat(result.constraints()).extracting(Constraint::render).containsExactlyInAnyOrder(
                "Probe.port => Probe.mode",
                "Probe.mode == 'http' => Probe.path",
                "Probe.mode == 'exec' => !Probe.tcpSocket",
                "Probe.httpGet => !Probe.exec");
    }

    @Test
    @DisplayName("counts constraint-like sentences no rule converted")
    void unconvertedSentences() {
        DerivationResult result = new ConstraintDeriver(graph, diagnostics).derive(probe);

        assertThat(result.unconverted()).isEqualTo(1);
        assertThat(diagnostics.withCode(Diagnostics.UNCONVERTED_DESCRIPTION))
                .singleElement()
                .satisfies(d -> assertThat(d.message()).startsWith("Must be positive"));
    }

    @Test
    @DisplayName("every constraint carries the rule that produced it")
    void traces() {
        DerivationResult result = new ConstraintDeriver(graph, diagnostics).derive(probe);

        assertThat(result.constraints()).allSatisfy(c -> assertThat(c.trace()).isNotBlank());
    }

    @Test
    @DisplayName("constraints naming missing features are dropped with a warning")
    void danglingConstraintDropped() {
        DerivationRule dangling = rule("dangling", ctx -> List.of(
                Constraint.requires(ctx.tree().root().id() + ".mode", "Probe.nowhere", "dangling@test")));

        DerivationResult result = new ConstraintDeriver(graph, diagnostics, List.of(dangling)).derive(probe);

        assertThat(result.constraints()).isEmpty();
        assertThat(diagnostics.withCode(Diagnostics.DANGLING_CONSTRAINT)).isNotEmpty();
    }

    @Test
    @DisplayName("a pair both required and excluded keeps both constraints and warns once")
    void conflictingConstraints() {
        DerivationRule requires = rule("r", ctx -> List.of(Constraint.requires("Probe.exec", "Probe.httpGet", "r")));
        DerivationRule excludes = rule("x", ctx -> List.of(Constraint.excludes("Probe.httpGet", "Probe.exec", "x")));

        DerivationResult result =
                new ConstraintDeriver(graph, diagnostics, List.of(requires, excludes)).derive(probe);

        assertThat(result.constraints()).extracting(Constraint::render)
                .containsExactly("Probe.exec => Probe.httpGet", "Probe.httpGet => !Probe.exec");
        assertThat(diagnostics.withCode(Diagnostics.MODEL_INCONSISTENCY))
                .singleElement()
                .satisfies(d -> assertThat(d.subject()).isEqualTo("Probe.exec|Probe.httpGet"));
    }

    @Test
    @DisplayName("sentence detection looks for constraint phrasing")
    void constraintPhrasing() {
        assertThat(ConstraintDeriver.looksLikeConstraint("Exactly one of a or b.")).isTrue();
        assertThat(ConstraintDeriver.looksLikeConstraint("The name of the thing.")).isFalse();
    }

    private static DerivationRule rule(String name, Function<DerivationContext, List<Constraint>> body) {
        return new DerivationRule() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public List<Constraint> derive(DerivationContext context) {
                return body.apply(context);
            }
        };
    }
}
