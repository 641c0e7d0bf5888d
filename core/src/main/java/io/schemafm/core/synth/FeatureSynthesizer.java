package io.schemafm.core.synth;

import io.schemafm.core.error.Diagnostics;
import io.schemafm.core.model.AttributeConstraint;
import io.schemafm.core.model.Cardinality;
import io.schemafm.core.model.FeatureFlag;
import io.schemafm.core.model.FeatureNode;
import io.schemafm.core.model.GroupType;
import io.schemafm.core.schema.Definition;
import io.schemafm.core.schema.DefinitionKind;
import io.schemafm.core.schema.Property;
import io.schemafm.core.schema.SchemaGraph;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks a resolved {@link SchemaGraph} from one root definition and emits the feature tree of that
 * kind.
 *
 * <p>
 * Each definition kind is mapped by a fixed rule from {@link #rules}:
 * <ul>
 * <li>object: one child per property, required properties mandatory, and-group</li>
 * <li>intersection: branches flattened into the same and-group</li>
 * <li>union / disjunction: alternative / or group of abstract branch features, held by an abstract
 * {@code oneOf} / {@code anyOf} child when the feature itself is concrete</li>
 * <li>array / map: the feature itself stands for the element and is flagged repeatable / map</li>
 * <li>scalar: terminal with a type, value-set and bounds attribute</li>
 * <li>open / unknown: terminal, flagged</li>
 * </ul>
 *
 * <p>
 * Expansion uses an explicit work stack. Every work item carries the chain of definitions it was
 * reached through; a property whose definition is already on that chain becomes a terminal
 * flagged {@code recursive}, so self-referencing schemas yield finite trees.
 *
 * <p>
 * Instances hold no per-kind state and may synthesize different kinds concurrently over the same
 * read-only graph.
 */
public final class FeatureSynthesizer {

    private static final Logger LOG = LoggerFactory.getLogger(FeatureSynthesizer.class);

    /** Separator of key-path segments in alias detection. */
    private static final String SEP = "\u001F";

    @FunctionalInterface
    private interface ExpansionRule {
        void expand(Build build, Task task, Definition definition);
    }

    private final SchemaGraph graph;
    private final Diagnostics diagnostics;
    private final Map<DefinitionKind, ExpansionRule> rules = new EnumMap<>(DefinitionKind.class);

    public FeatureSynthesizer(SchemaGraph graph, Diagnostics diagnostics) {
        this.graph = Objects.requireNonNull(graph, "graph must not be null");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics must not be null");
        rules.put(DefinitionKind.OBJECT, this::expandObject);
        rules.put(DefinitionKind.INTERSECTION, this::expandObject);
        rules.put(DefinitionKind.MAP, this::expandMap);
        rules.put(DefinitionKind.ARRAY, this::expandArray);
        rules.put(DefinitionKind.SCALAR, this::expandScalar);
        rules.put(DefinitionKind.UNION, this::expandChoice);
        rules.put(DefinitionKind.DISJUNCTION, this::expandChoice);
        rules.put(DefinitionKind.OPEN, (build, task, d) -> task.feature().flag(FeatureFlag.OPEN));
        rules.put(DefinitionKind.UNKNOWN, (build, task, d) -> task.feature().flag(FeatureFlag.UNKNOWN));
    }

    /** Synthesizes the tree of a root definition using its default id. */
    public KindTree synthesize(String definition) {
        return synthesize(definition, FeatureNames.segment(graph.kindName(definition)));
    }

    /**
     * Synthesizes the tree of one root definition.
     *
     * @param definition qualified name of a root in the graph
     * @param rootId     id of the kind feature
     */
    public KindTree synthesize(String definition, String rootId) {
        Definition d = graph.get(definition);
        String kindName = graph.kindName(definition);
        FeatureNode.Builder root = FeatureNode.builder(rootId)
                .key(kindName)
                .cardinality(Cardinality.MANDATORY)
                .provenance(definition);
        Build build = new Build(root);
        build.keyPaths.put(root, "");
        build.describe(rootId, d.description());
        build.work.push(new Task(root, definition, null));
        while (!build.work.isEmpty()) {
            expand(build, build.work.pop());
        }
        FeatureNode tree = root.build();
        LOG.debug("Synthesized kind {} from {}: {} features", rootId, definition, tree.preOrder().size());
        return new KindTree(definition, kindName, tree, build.descriptions, build.aliases, build.expansions);
    }

    private void expand(Build build, Task task) {
        Definition d = graph.find(task.definition()).orElse(null);
        FeatureNode.Builder feature = task.feature();
        if (d == null) {
            feature.flag(FeatureFlag.UNKNOWN);
            return;
        }
        if (task.ancestry() != null && task.ancestry().contains(d.name())) {
            LOG.debug("Cycle through {} cut at {}", d.name(), feature.id());
            feature.flag(FeatureFlag.RECURSIVE);
            return;
        }
        build.expansions.computeIfAbsent(feature.id(), k -> new ArrayList<>()).add(d.name());
        List<Task> next = new ArrayList<>();
        build.pendingTasks = next;
        rules.get(d.kind()).expand(build, task, d);
        if (d.nullable()) {
            addMarker(build, feature, FeatureNames.IS_NULL);
        }
        // reversed so that the first-declared child is expanded first
        for (int i = next.size() - 1; i >= 0; i--) {
            build.work.push(next.get(i));
        }
    }

    private void expandObject(Build build, Task task, Definition d) {
        List<Definition> members = new ArrayList<>();
        List<Definition> choices = new ArrayList<>();
        List<Definition> others = new ArrayList<>();
        flatten(d, members, choices, others);

        boolean hasProperties = members.stream().anyMatch(m -> !m.properties().isEmpty());
        Ancestry ancestry = new Ancestry(d.name(), task.ancestry());
        for (Definition m : members) {
            if (m != d) {
                build.expansions.get(task.feature().id()).add(m.name());
                ancestry = new Ancestry(m.name(), ancestry);
            }
        }

        // an intersection over a single non-object branch is just that branch
        if (!hasProperties && choices.size() + others.size() == 1) {
            Definition only = choices.isEmpty() ? others.get(0) : choices.get(0);
            if (choices.isEmpty() || only.kind() == DefinitionKind.UNION || only.kind() == DefinitionKind.DISJUNCTION) {
                build.pendingTasks.add(new Task(task.feature(), only.name(), ancestry));
                return;
            }
        }
        if (!others.isEmpty()) {
            LOG.debug("Ignoring {} non-object intersection branches of {}", others.size(), d.name());
        }

        FeatureNode.Builder feature = task.feature();
        feature.group(GroupType.AND);
        Set<String> seen = new HashSet<>();
        for (Definition m : members) {
            for (Property p : m.properties()) {
                if (seen.add(p.name())) {
                    boolean required = members.stream().anyMatch(x -> x.isRequired(p.name()));
                    addProperty(build, feature, m, p, required, ancestry);
                }
            }
        }
        for (Definition c : choices) {
            DefinitionKind kind = c.choiceKind() != null ? c.choiceKind() : c.kind();
            addBranches(build, addChoiceHolder(build, feature, kind, c.name()), c.branches(), ancestry);
        }
        if (hasProperties && !feature.has(FeatureFlag.ABSTRACT)) {
            addMarker(build, feature, FeatureNames.IS_EMPTY);
        }
    }

    /** Collects intersection members without recursion; each definition is visited once. */
    private void flatten(Definition start, List<Definition> members, List<Definition> choices, List<Definition> others) {
        Deque<Definition> stack = new ArrayDeque<>();
        Set<String> visited = new HashSet<>();
        stack.push(start);
        while (!stack.isEmpty()) {
            Definition m = stack.pop();
            if (!visited.add(m.name())) {
                continue;
            }
            switch (m.kind()) {
                case OBJECT, INTERSECTION -> {
                    members.add(m);
                    if (m.choiceKind() != null) {
                        choices.add(m);
                    }
                    if (m.kind() == DefinitionKind.INTERSECTION) {
                        List<String> branches = m.branches();
                        for (int i = branches.size() - 1; i >= 0; i--) {
                            graph.find(branches.get(i)).ifPresent(stack::push);
                        }
                    }
                }
                case UNION, DISJUNCTION -> choices.add(m);
                default -> others.add(m);
            }
        }
    }

    private void addProperty(
            Build build, FeatureNode.Builder parent, Definition owner, Property p, boolean required, Ancestry ancestry) {
        String base = build.elementPath(parent);
        String path = base.isEmpty() ? p.name() : base + SEP + p.name();
        String segment = FeatureNames.segment(p.name());
        String existing = build.pathOwners.get(path);
        if (existing != null) {
            String candidate = parent.id() + "." + segment;
            if (!candidate.equals(existing)) {
                build.aliases.putIfAbsent(candidate, existing);
                diagnostics.info(Diagnostics.ALIAS, candidate, "same key path as " + existing);
            }
            return;
        }
        String id = parent.id() + "." + build.uniqueSegment(parent, segment);
        FeatureNode.Builder child = FeatureNode.builder(id)
                .key(p.name())
                .cardinality(required ? Cardinality.MANDATORY : Cardinality.OPTIONAL)
                .provenance(owner.name() + "/properties/" + p.name());
        if (p.deprecated()) {
            child.flag(FeatureFlag.DEPRECATED);
        }
        parent.addChild(child);
        build.keyPaths.put(child, path);
        build.pathOwners.put(path, id);
        String description = p.description();
        if (description == null && p.resolved()) {
            description = graph.find(p.target()).map(Definition::description).orElse(null);
        }
        build.describe(id, description);
        if (!p.resolved()) {
            // reference target missing: keep the property, drop what it pointed at
            child.flag(FeatureFlag.UNKNOWN);
            return;
        }
        build.pendingTasks.add(new Task(child, p.target(), ancestry));
    }

    private void addBranches(Build build, FeatureNode.Builder holder, List<String> branches, Ancestry ancestry) {
        for (int i = 0; i < branches.size(); i++) {
            String branch = branches.get(i);
            Definition b = graph.find(branch).orElse(null);
            String name;
            if (b != null && b.kind() == DefinitionKind.SCALAR) {
                name = "as" + b.scalarType().keyword();
            } else if (b != null && !b.name().contains("/")) {
                name = FeatureNames.segment(b.shortName());
            } else {
                name = "option" + (i + 1);
            }
            String id = holder.id() + "." + build.uniqueSegment(holder, name);
            FeatureNode.Builder feature = FeatureNode.builder(id)
                    .flag(FeatureFlag.ABSTRACT)
                    .cardinality(Cardinality.MANDATORY)
                    .provenance(branch);
            holder.addChild(feature);
            build.keyPaths.put(feature, build.elementPath(holder));
            if (b != null) {
                build.describe(id, b.description());
            }
            build.pendingTasks.add(new Task(feature, branch, ancestry));
        }
    }

    private void expandMap(Build build, Task task, Definition d) {
        task.feature().flag(FeatureFlag.MAP);
        expandElement(build, task, d);
    }

    private void expandArray(Build build, Task task, Definition d) {
        task.feature().flag(FeatureFlag.REPEATABLE);
        expandElement(build, task, d);
    }

    /** The element of an array or map is expanded into the container feature itself. */
    private void expandElement(Build build, Task task, Definition d) {
        FeatureNode.Builder feature = task.feature();
        if (!feature.has(FeatureFlag.ABSTRACT)) {
            addMarker(build, feature, FeatureNames.IS_EMPTY);
        }
        Definition element = d.element() == null ? null : graph.find(d.element()).orElse(null);
        if (element == null) {
            feature.flag(d.element() == null ? FeatureFlag.OPEN : FeatureFlag.UNKNOWN);
            return;
        }
        if (element.kind() == DefinitionKind.ARRAY || element.kind() == DefinitionKind.MAP) {
            LOG.debug("Nested container {} kept open at {}", element.name(), feature.id());
            feature.flag(FeatureFlag.OPEN);
            return;
        }
        build.pendingTasks.add(new Task(feature, element.name(), new Ancestry(d.name(), task.ancestry())));
    }

    private void expandScalar(Build build, Task task, Definition d) {
        task.feature().attribute(new AttributeConstraint(d.scalarType(), d.enumValues(), d.minimum(), d.maximum()));
    }

    private void expandChoice(Build build, Task task, Definition d) {
        FeatureNode.Builder feature = task.feature();
        Ancestry ancestry = new Ancestry(d.name(), task.ancestry());
        if (feature.has(FeatureFlag.ABSTRACT)) {
            feature.group(d.kind() == DefinitionKind.UNION ? GroupType.ALTERNATIVE : GroupType.OR);
            addBranches(build, feature, d.branches(), ancestry);
        } else {
            // concrete features keep an and-group so their optional markers stay valid
            addBranches(build, addChoiceHolder(build, feature, d.kind(), d.name()), d.branches(), ancestry);
        }
    }

    /** Abstract mandatory child grouping the branches of a choice. */
    private FeatureNode.Builder addChoiceHolder(
            Build build, FeatureNode.Builder feature, DefinitionKind kind, String definition) {
        String name = kind == DefinitionKind.UNION ? FeatureNames.ONE_OF : FeatureNames.ANY_OF;
        FeatureNode.Builder holder = FeatureNode.builder(feature.id() + "." + build.uniqueSegment(feature, name))
                .flag(FeatureFlag.ABSTRACT)
                .cardinality(Cardinality.MANDATORY)
                .group(kind == DefinitionKind.UNION ? GroupType.ALTERNATIVE : GroupType.OR)
                .provenance(definition + "/" + name);
        feature.addChild(holder);
        build.keyPaths.put(holder, build.elementPath(feature));
        return holder;
    }

    private void addMarker(Build build, FeatureNode.Builder feature, String name) {
        if (feature == build.root || feature.has(FeatureFlag.ABSTRACT) || !build.used(feature).add(name)) {
            return;
        }
        feature.addChild(FeatureNode.builder(feature.id() + "." + name)
                .flag(FeatureFlag.ABSTRACT)
                .cardinality(Cardinality.OPTIONAL)
                .provenance(feature.id() + "/" + name));
    }

    /** One pending expansion: a feature to fill from a definition. */
    private record Task(FeatureNode.Builder feature, String definition, Ancestry ancestry) {}

    /** Persistent chain of definitions a work item was reached through. */
    private record Ancestry(String name, Ancestry parent) {
        boolean contains(String definition) {
            for (Ancestry a = this; a != null; a = a.parent) {
                if (a.name.equals(definition)) {
                    return true;
                }
            }
            return false;
        }
    }

    /** Mutable state of one kind's synthesis. */
    private final class Build {
        final FeatureNode.Builder root;
        final Deque<Task> work = new ArrayDeque<>();
        final Map<FeatureNode.Builder, String> keyPaths = new IdentityHashMap<>();
        final Map<FeatureNode.Builder, Set<String>> usedNames = new IdentityHashMap<>();
        final Map<String, String> pathOwners = new HashMap<>();
        final Map<String, String> descriptions = new LinkedHashMap<>();
        final Map<String, String> aliases = new LinkedHashMap<>();
        final Map<String, List<String>> expansions = new LinkedHashMap<>();
        List<Task> pendingTasks = new ArrayList<>();

        Build(FeatureNode.Builder root) {
            this.root = root;
        }

        /** Key path prefix of the feature's children. */
        String elementPath(FeatureNode.Builder feature) {
            String path = keyPaths.getOrDefault(feature, "");
            if (feature.has(FeatureFlag.REPEATABLE)) {
                path = path + "[*]";
            }
            if (feature.has(FeatureFlag.MAP)) {
                path = path + SEP + "*";
            }
            return path;
        }

        Set<String> used(FeatureNode.Builder feature) {
            return usedNames.computeIfAbsent(feature, k -> new HashSet<>());
        }

        String uniqueSegment(FeatureNode.Builder parent, String segment) {
            Set<String> used = used(parent);
            if (used.add(segment)) {
                return segment;
            }
            int n = 2;
            while (!used.add(segment + "_" + n)) {
                n++;
            }
            diagnostics.warn(
                    Diagnostics.NAME_COLLISION,
                    parent.id() + "." + segment,
                    "sibling id already taken, renamed to " + segment + "_" + n);
            return segment + "_" + n;
        }

        void describe(String id, String text) {
            if (text != null && !text.isBlank()) {
                descriptions.put(id, text.strip());
            }
        }
    }
}
