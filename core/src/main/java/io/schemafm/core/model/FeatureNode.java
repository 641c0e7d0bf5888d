package io.schemafm.core.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * One feature of the tree. Immutable; trees are assembled with {@link Builder} and frozen with
 * {@link Builder#build()}.
 *
 * <p>
 * The id is the dotted path from the kind root ({@code Pod.spec.containers}). The key is the
 * document key the feature corresponds to; abstract features have none and are transparent when
 * key paths are derived.
 */
public final class FeatureNode {

    private final String id;
    private final String key;
    private final Cardinality cardinality;
    private final GroupType group;
    private final List<FeatureNode> children;
    private final AttributeConstraint attribute;
    private final Set<FeatureFlag> flags;
    private final String provenance;

    private FeatureNode(Builder b, List<FeatureNode> children) {
        this.id = b.id;
        this.key = b.key;
        this.cardinality = b.cardinality;
        this.group = b.group;
        this.children = Collections.unmodifiableList(children);
        this.attribute = b.attribute;
        this.flags = Collections.unmodifiableSet(b.flags.isEmpty() ? EnumSet.noneOf(FeatureFlag.class) : EnumSet.copyOf(b.flags));
        this.provenance = b.provenance;
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public String id() {
        return id;
    }

    /** Document key segment, {@code null} for abstract features. */
    public String key() {
        return key;
    }

    public Cardinality cardinality() {
        return cardinality;
    }

    public GroupType group() {
        return group;
    }

    public List<FeatureNode> children() {
        return children;
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    /** Value constraint for terminal features, {@code null} when the feature carries no value. */
    public AttributeConstraint attribute() {
        return attribute;
    }

    public Set<FeatureFlag> flags() {
        return flags;
    }

    public boolean has(FeatureFlag flag) {
        return flags.contains(flag);
    }

    /** Originating schema path, e.g. {@code io.k8s.api.core.v1.Pod/properties/spec}. */
    public String provenance() {
        return provenance;
    }

    /** Last dotted segment of the id. */
    public String simpleName() {
        int dot = id.lastIndexOf('.');
        return dot >= 0 ? id.substring(dot + 1) : id;
    }

    public FeatureNode child(String simpleName) {
        for (FeatureNode c : children) {
            if (c.simpleName().equals(simpleName)) {
                return c;
            }
        }
        return null;
    }

    /** This node and all descendants, depth-first in child order. */
    public List<FeatureNode> preOrder() {
        List<FeatureNode> out = new ArrayList<>();
        Deque<FeatureNode> stack = new ArrayDeque<>();
        stack.push(this);
        while (!stack.isEmpty()) {
            FeatureNode n = stack.pop();
            out.add(n);
            for (int i = n.children.size() - 1; i >= 0; i--) {
                stack.push(n.children.get(i));
            }
        }
        return out;
    }

    /**
     * Shape of the subtree relative to this node: child names, cardinalities, groups, attributes
     * and flags, but not ids or provenance. Equal fingerprints mean structurally identical
     * subtrees.
     */
    public String fingerprint() {
        StringBuilder sb = new StringBuilder();
        int rootDepth = id.split("\\.").length;
        for (FeatureNode n : preOrder()) {
            int depth = n.id.split("\\.").length - rootDepth;
            sb.append(depth).append(':').append(depth == 0 ? "" : n.simpleName())
                    .append('/').append(n.key).append('/').append(n.cardinality)
                    .append('/').append(n.group).append('/').append(n.attribute)
                    .append('/').append(n.flags).append(';');
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "FeatureNode[" + id + "]";
    }

    /** Mutable tree builder. */
    public static final class Builder {
        private String id;
        private String key;
        private Cardinality cardinality = Cardinality.OPTIONAL;
        private GroupType group = GroupType.AND;
        private final List<Builder> children = new ArrayList<>();
        private AttributeConstraint attribute;
        private final Set<FeatureFlag> flags = EnumSet.noneOf(FeatureFlag.class);
        private String provenance;

        Builder(String id) {
            this.id = Objects.requireNonNull(id, "id must not be null");
        }

        public String id() {
            return id;
        }

        public Builder id(String id) {
            this.id = Objects.requireNonNull(id, "id must not be null");
            return this;
        }

        public Builder key(String key) {
            this.key = key;
            return this;
        }

        public String key() {
            return key;
        }

        public Builder cardinality(Cardinality cardinality) {
            this.cardinality = cardinality;
            return this;
        }

        public Cardinality cardinality() {
            return cardinality;
        }

        public Builder group(GroupType group) {
            this.group = group;
            return this;
        }

        public GroupType group() {
            return group;
        }

        public Builder attribute(AttributeConstraint attribute) {
            this.attribute = attribute;
            return this;
        }

        public AttributeConstraint attribute() {
            return attribute;
        }

        public Builder flag(FeatureFlag flag) {
            flags.add(flag);
            return this;
        }

        public boolean has(FeatureFlag flag) {
            return flags.contains(flag);
        }

        public Builder provenance(String provenance) {
            this.provenance = provenance;
            return this;
        }

        public Builder addChild(Builder child) {
            children.add(child);
            return this;
        }

        public List<Builder> children() {
            return children;
        }

        /**
         * Copies a frozen subtree back into builders, mapping every id through {@code ids}.
         */
        public static Builder copyOf(FeatureNode node, UnaryOperator<String> ids) {
            Map<FeatureNode, Builder> copies = new IdentityHashMap<>();
            Deque<FeatureNode> stack = new ArrayDeque<>();
            stack.push(node);
            while (!stack.isEmpty()) {
                FeatureNode n = stack.pop();
                Builder b = new Builder(ids.apply(n.id))
                        .key(n.key)
                        .cardinality(n.cardinality)
                        .group(n.group)
                        .attribute(n.attribute)
                        .provenance(n.provenance);
                b.flags.addAll(n.flags);
                copies.put(n, b);
                for (int i = n.children.size() - 1; i >= 0; i--) {
                    stack.push(n.children.get(i));
                }
            }
            for (Map.Entry<FeatureNode, Builder> e : copies.entrySet()) {
                for (FeatureNode c : e.getKey().children) {
                    e.getValue().children.add(copies.get(c));
                }
            }
            return copies.get(node);
        }

        /** Freezes this builder and its subtree, children before parents, without recursion. */
        public FeatureNode build() {
            Deque<Builder> order = new ArrayDeque<>();
            Deque<Builder> stack = new ArrayDeque<>();
            stack.push(this);
            while (!stack.isEmpty()) {
                Builder b = stack.pop();
                order.push(b);
                b.children.forEach(stack::push);
            }
            Map<Builder, FeatureNode> built = new IdentityHashMap<>();
            while (!order.isEmpty()) {
                Builder b = order.pop();
                List<FeatureNode> kids = new ArrayList<>(b.children.size());
                for (Builder c : b.children) {
                    kids.add(built.get(c));
                }
                built.put(b, new FeatureNode(b, kids));
            }
            return built.get(this);
        }
    }
}
