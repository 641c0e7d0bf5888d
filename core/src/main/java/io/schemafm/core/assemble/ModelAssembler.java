package io.schemafm.core.assemble;

import io.schemafm.core.error.Diagnostics;
import io.schemafm.core.model.Cardinality;
import io.schemafm.core.model.Constraint;
import io.schemafm.core.model.Expression;
import io.schemafm.core.model.FeatureFlag;
import io.schemafm.core.model.FeatureModel;
import io.schemafm.core.model.FeatureNode;
import io.schemafm.core.model.GroupType;
import io.schemafm.core.synth.FeatureNames;
import io.schemafm.core.synth.KindTree;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Puts kind trees under one synthetic root and builds the {@link FeatureModel}.
 *
 * <p>
 * The root is abstract, named after the namespace, and groups the kinds as {@code or}. Kinds
 * that end up with the same root id are merged when their structure is identical. Otherwise the
 * later one is renamed after its qualified definition name, which becomes its key as well, and a
 * {@code kind-collision} warning is recorded.
 */
public final class ModelAssembler {

    private static final Logger LOG = LoggerFactory.getLogger(ModelAssembler.class);

    private final String namespace;
    private final Diagnostics diagnostics;

    public ModelAssembler(String namespace, Diagnostics diagnostics) {
        this.namespace = Objects.requireNonNull(namespace, "namespace must not be null");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics must not be null");
    }

    /**
     * @throws IllegalArgumentException if the assembled model breaks an invariant
     */
    public FeatureModel assemble(List<KindModel> kinds) {
        String rootId = FeatureNames.segment(namespace);
        Map<String, Merged> byId = new LinkedHashMap<>();
        Set<String> taken = new HashSet<>();
        taken.add(rootId);

        for (KindModel kind : kinds) {
            KindTree tree = kind.tree();
            String id = tree.root().id();
            Merged existing = byId.get(id);
            if (existing != null && existing.tree.root().fingerprint().equals(tree.root().fingerprint())) {
                LOG.debug("Kind {} from {} merged with {}", id, tree.definition(), existing.tree.definition());
                existing.constraints.addAll(kind.constraints());
                continue;
            }
            if (existing != null || taken.contains(id)) {
                String renamed = unique(FeatureNames.segment(tree.definition()), taken);
                diagnostics.warn(
                        Diagnostics.KIND_COLLISION,
                        id,
                        tree.definition() + " differs from the kind already named " + id + ", renamed to " + renamed);
                kind = rename(kind, renamed);
                id = renamed;
            }
            taken.add(id);
            byId.put(id, new Merged(kind));
        }

        FeatureNode.Builder root = FeatureNode.builder(rootId)
                .flag(FeatureFlag.ABSTRACT)
                .cardinality(Cardinality.MANDATORY)
                .group(GroupType.OR)
                .provenance(namespace);
        List<Constraint> constraints = new ArrayList<>();
        Map<String, String> descriptions = new LinkedHashMap<>();
        Map<String, String> aliases = new LinkedHashMap<>();
        for (Merged m : byId.values()) {
            root.addChild(FeatureNode.Builder.copyOf(m.tree.root(), UnaryOperator.identity())
                    .cardinality(Cardinality.MANDATORY));
            constraints.addAll(m.constraints);
            descriptions.putAll(m.tree.descriptions());
            aliases.putAll(m.tree.aliases());
        }
        FeatureModel model = new FeatureModel(namespace, root.build(), constraints, descriptions, aliases);
        LOG.info("Assembled model {}: {} kinds, {} features, {} constraints",
                namespace, model.kinds().size(), model.size(), model.constraints().size());
        return model;
    }

    private static String unique(String id, Set<String> taken) {
        if (!taken.contains(id)) {
            return id;
        }
        int n = 2;
        while (taken.contains(id + "_" + n)) {
            n++;
        }
        return id + "_" + n;
    }

    /** Re-roots every id of the kind under a new root id; the root key becomes the definition name. */
    static KindModel rename(KindModel kind, String newRootId) {
        KindTree tree = kind.tree();
        String old = tree.root().id();
        UnaryOperator<String> ids = id -> id.equals(old)
                ? newRootId
                : id.startsWith(old + ".") ? newRootId + id.substring(old.length()) : id;

        FeatureNode root = FeatureNode.Builder.copyOf(tree.root(), ids).key(tree.definition()).build();
        Map<String, String> descriptions = new LinkedHashMap<>();
        tree.descriptions().forEach((k, v) -> descriptions.put(ids.apply(k), v));
        Map<String, String> aliases = new LinkedHashMap<>();
        tree.aliases().forEach((k, v) -> aliases.put(ids.apply(k), ids.apply(v)));
        Map<String, List<String>> expansions = new LinkedHashMap<>();
        tree.expansions().forEach((k, v) -> expansions.put(ids.apply(k), v));
        List<Constraint> constraints = new ArrayList<>();
        for (Constraint c : kind.constraints()) {
            constraints.add(new Constraint(c.kind(), renameIds(c.expression(), ids), c.trace()));
        }
        return new KindModel(
                new KindTree(tree.definition(), tree.definition(), root, descriptions, aliases, expansions),
                constraints);
    }

    static Expression renameIds(Expression e, UnaryOperator<String> ids) {
        if (e instanceof Expression.Ref r) {
            return new Expression.Ref(ids.apply(r.featureId()));
        } else if (e instanceof Expression.ValueEquals v) {
            return new Expression.ValueEquals(ids.apply(v.featureId()), v.literal());
        } else if (e instanceof Expression.Not n) {
            return new Expression.Not(renameIds(n.operand(), ids));
        } else if (e instanceof Expression.And a) {
            return new Expression.And(renameAll(a.operands(), ids));
        } else if (e instanceof Expression.Or o) {
            return new Expression.Or(renameAll(o.operands(), ids));
        } else if (e instanceof Expression.Implies i) {
            return new Expression.Implies(renameIds(i.left(), ids), renameIds(i.right(), ids));
        } else if (e instanceof Expression.Iff i) {
            return new Expression.Iff(renameIds(i.left(), ids), renameIds(i.right(), ids));
        }
        throw new IllegalStateException("Unexpected expression " + e);
    }

    private static List<Expression> renameAll(List<Expression> operands, UnaryOperator<String> ids) {
        List<Expression> out = new ArrayList<>(operands.size());
        operands.forEach(o -> out.add(renameIds(o, ids)));
        return out;
    }

    private static final class Merged {
        final KindTree tree;
        final Set<Constraint> constraints = new LinkedHashSet<>();

        Merged(KindModel kind) {
            this.tree = kind.tree();
            this.constraints.addAll(kind.constraints());
        }
    }
}
