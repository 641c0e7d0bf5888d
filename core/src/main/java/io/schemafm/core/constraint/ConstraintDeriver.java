package io.schemafm.core.constraint;

import io.schemafm.core.error.Diagnostics;
import io.schemafm.core.model.Constraint;
import io.schemafm.core.model.ConstraintKind;
import io.schemafm.core.model.FeatureNode;
import io.schemafm.core.schema.Definition;
import io.schemafm.core.schema.SchemaGraph;
import io.schemafm.core.synth.KindTree;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs every {@link DerivationRule} over every feature of a kind tree and unions the results.
 *
 * <p>
 * Constraints naming features the tree lacks are dropped with a {@code dangling-constraint}
 * diagnostic. A feature pair that is both required and excluded keeps both constraints and is
 * reported as {@code model-inconsistency}.
 */
public final class ConstraintDeriver {

    private static final Logger LOG = LoggerFactory.getLogger(ConstraintDeriver.class);

    private static final List<String> CONSTRAINT_PHRASES = List.of(
            "required when", "must be", "only if", "mutually exclusive", "at least one", "exactly one");

    private final SchemaGraph graph;
    private final Diagnostics diagnostics;
    private final List<DerivationRule> rules;

    public ConstraintDeriver(SchemaGraph graph, Diagnostics diagnostics) {
        this(graph, diagnostics, defaultRules());
    }

    public ConstraintDeriver(SchemaGraph graph, Diagnostics diagnostics, List<DerivationRule> rules) {
        this.graph = Objects.requireNonNull(graph, "graph must not be null");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics must not be null");
        this.rules = List.copyOf(rules);
    }

    public static List<DerivationRule> defaultRules() {
        return List.of(
                new ConditionalRequirementRule(),
                new DescriptionRequirementRule(),
                new DescriptionExclusionRule(),
                new DescriptionCardinalityRule(),
                new UnionExclusionRule());
    }

    public DerivationResult derive(KindTree tree) {
        List<FeatureNode> features = tree.root().preOrder();
        Set<String> ids = new HashSet<>();
        features.forEach(f -> ids.add(f.id()));

        Set<String> converted = new HashSet<>();
        Set<Constraint> derived = new LinkedHashSet<>();
        Map<String, String> unconverted = new LinkedHashMap<>();
        for (FeatureNode feature : features) {
            List<Definition> definitions = new ArrayList<>();
            for (String name : tree.expansions().getOrDefault(feature.id(), List.of())) {
                graph.find(name).ifPresent(definitions::add);
            }
            if (definitions.isEmpty() && feature.isLeaf()) {
                continue;
            }
            DerivationContext context = new DerivationContext(tree, feature, definitions, converted);
            for (DerivationRule rule : rules) {
                for (Constraint c : rule.derive(context)) {
                    String missing = firstMissing(c, ids);
                    if (missing != null) {
                        diagnostics.warn(
                                Diagnostics.DANGLING_CONSTRAINT,
                                c.render(),
                                "dropped, no feature '" + missing + "' (" + c.trace() + ")");
                    } else {
                        derived.add(c);
                    }
                }
            }
            for (DescriptionRule.Sentence s : DescriptionRule.sentences(context)) {
                if (looksLikeConstraint(s.text())) {
                    unconverted.putIfAbsent(s.key(), s.subject());
                }
            }
        }
        unconverted.keySet().removeAll(converted);
        unconverted.forEach((key, subject) -> diagnostics.info(
                Diagnostics.UNCONVERTED_DESCRIPTION, subject, key.substring(key.indexOf('\u0000') + 1)));

        reportConflicts(derived);
        LOG.debug("Derived {} constraints for kind {}, {} unconverted sentences",
                derived.size(), tree.root().id(), unconverted.size());
        return new DerivationResult(new ArrayList<>(derived), unconverted.size());
    }

    private void reportConflicts(Set<Constraint> constraints) {
        Map<String, Set<ConstraintKind>> kindsByPair = new TreeMap<>();
        for (Constraint c : constraints) {
            String pair = c.featurePair();
            if (pair != null) {
                kindsByPair.computeIfAbsent(pair, k -> EnumSet.noneOf(ConstraintKind.class)).add(c.kind());
            }
        }
        kindsByPair.forEach((pair, kinds) -> {
            if (kinds.contains(ConstraintKind.REQUIRES) && kinds.contains(ConstraintKind.EXCLUDES)) {
                diagnostics.warn(Diagnostics.MODEL_INCONSISTENCY, pair, "both requires and excludes derived");
            }
        });
    }

    private static String firstMissing(Constraint c, Set<String> ids) {
        for (String id : c.expression().features()) {
            if (!ids.contains(id)) {
                return id;
            }
        }
        return null;
    }

    static boolean looksLikeConstraint(String sentence) {
        String lower = sentence.toLowerCase(Locale.ROOT);
        for (String phrase : CONSTRAINT_PHRASES) {
            if (lower.contains(phrase)) {
                return true;
            }
        }
        return false;
    }
}
