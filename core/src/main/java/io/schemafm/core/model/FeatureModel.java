package io.schemafm.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable feature model: a synthetic root whose children are the top-level kinds, an ordered
 * constraint list, id to description metadata, and aliases recorded during synthesis.
 *
 * <p>
 * Construction indexes the tree and checks the model invariants: ids are unique and every
 * constraint and alias references existing features. Thread-safe; shared read-only by all
 * translation and validation workers.
 */
public final class FeatureModel {

    private final String namespace;
    private final FeatureNode root;
    private final List<Constraint> constraints;
    private final Map<String, String> descriptions;
    private final Map<String, String> aliases;
    private final Map<String, FeatureNode> index;
    private final Map<String, String> parents;

    public FeatureModel(
            String namespace,
            FeatureNode root,
            List<Constraint> constraints,
            Map<String, String> descriptions,
            Map<String, String> aliases) {
        this.namespace = Objects.requireNonNull(namespace, "namespace must not be null");
        this.root = Objects.requireNonNull(root, "root must not be null");
        this.constraints = List.copyOf(constraints);
        this.descriptions = Collections.unmodifiableMap(new LinkedHashMap<>(descriptions));
        this.aliases = Collections.unmodifiableMap(new LinkedHashMap<>(aliases));

        Map<String, FeatureNode> idx = new LinkedHashMap<>();
        Map<String, String> par = new HashMap<>();
        for (FeatureNode n : root.preOrder()) {
            if (idx.putIfAbsent(n.id(), n) != null) {
                throw new IllegalArgumentException("Duplicate feature id '" + n.id() + "'");
            }
            for (FeatureNode c : n.children()) {
                par.put(c.id(), n.id());
            }
        }
        this.index = Collections.unmodifiableMap(idx);
        this.parents = Collections.unmodifiableMap(par);

        for (Constraint c : this.constraints) {
            for (String id : c.expression().features()) {
                if (!idx.containsKey(id)) {
                    throw new IllegalArgumentException(
                            "Constraint '" + c.render() + "' references unknown feature '" + id + "'");
                }
            }
        }
        for (Map.Entry<String, String> alias : this.aliases.entrySet()) {
            if (!idx.containsKey(alias.getValue())) {
                throw new IllegalArgumentException(
                        "Alias '" + alias.getKey() + "' targets unknown feature '" + alias.getValue() + "'");
            }
        }
    }

    public String namespace() {
        return namespace;
    }

    /** The synthetic root. */
    public FeatureNode root() {
        return root;
    }

    /** Top-level kind features, in model order. */
    public List<FeatureNode> kinds() {
        return root.children();
    }

    public List<Constraint> constraints() {
        return constraints;
    }

    public Map<String, String> descriptions() {
        return descriptions;
    }

    public String description(String featureId) {
        return descriptions.get(featureId);
    }

    /** Alias id to canonical id. */
    public Map<String, String> aliases() {
        return aliases;
    }

    public boolean contains(String featureId) {
        return index.containsKey(featureId);
    }

    public Optional<FeatureNode> find(String featureId) {
        return Optional.ofNullable(index.get(featureId));
    }

    /**
     * @throws IllegalArgumentException if the model has no such feature
     */
    public FeatureNode get(String featureId) {
        FeatureNode n = index.get(featureId);
        if (n == null) {
            throw new IllegalArgumentException("No feature '" + featureId + "'");
        }
        return n;
    }

    /** Parent id, or {@code null} for the root. */
    public String parentOf(String featureId) {
        return parents.get(featureId);
    }

    /** Ids of the feature's ancestors, nearest first, ending at the root. */
    public List<String> ancestorsOf(String featureId) {
        List<String> out = new ArrayList<>();
        for (String p = parents.get(featureId); p != null; p = parents.get(p)) {
            out.add(p);
        }
        return out;
    }

    /** Every feature including the root, depth-first in model order. */
    public List<FeatureNode> features() {
        return List.copyOf(index.values());
    }

    /** Feature count, including the synthetic root. */
    public int size() {
        return index.size();
    }
}
