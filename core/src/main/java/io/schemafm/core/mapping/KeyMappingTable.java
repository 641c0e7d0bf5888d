package io.schemafm.core.mapping;

import io.schemafm.core.error.AmbiguousKeyPathException;
import io.schemafm.core.model.FeatureModel;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Key mapping entries indexed by a segment trie.
 *
 * <p>
 * Paths are globally unique: adding a path equal to an existing one, or a pattern that can match
 * a concrete key some existing pattern also matches ({@code a.*} against {@code a.b}), fails with
 * {@link AmbiguousKeyPathException}. Lookups therefore have at most one answer. Immutable once
 * built; safe to share between translation workers.
 */
public final class KeyMappingTable {

    private static final class Node {
        final Map<KeyPath.Segment, Node> exact = new LinkedHashMap<>();
        Node anyName;
        Node anyIndex;
        KeyMappingEntry entry;
    }

    private record Visit(Node node, int depth) {}

    private final Node root = new Node();
    private final List<KeyMappingEntry> entries = new ArrayList<>();

    private KeyMappingTable() {}

    /**
     * @throws AmbiguousKeyPathException on the first entry overlapping an earlier one
     */
    public static KeyMappingTable of(Collection<KeyMappingEntry> entries) {
        KeyMappingTable table = new KeyMappingTable();
        entries.forEach(table::add);
        return table;
    }

    /**
     * Every overlap in {@code entries}, each reported against the earliest entry it clashes
     * with. Overlapping entries are left out of the comparison set, so one bad row yields one
     * report. Empty when {@link #of} would succeed.
     */
    public static List<AmbiguousKeyPathException> ambiguities(Collection<KeyMappingEntry> entries) {
        KeyMappingTable table = new KeyMappingTable();
        List<AmbiguousKeyPathException> out = new ArrayList<>();
        for (KeyMappingEntry entry : entries) {
            try {
                table.add(entry);
            } catch (AmbiguousKeyPathException e) {
                out.add(e);
            }
        }
        return out;
    }

    private void add(KeyMappingEntry entry) {
        KeyPath path = entry.keyPath();
        search(path).ifPresent(clash -> {
            throw new AmbiguousKeyPathException(path.toString(), clash.keyPath().toString());
        });
        Node node = root;
        for (KeyPath.Segment s : path.segments()) {
            if (s instanceof KeyPath.AnyName) {
                node = node.anyName == null ? (node.anyName = new Node()) : node.anyName;
            } else if (s instanceof KeyPath.AnyIndex) {
                node = node.anyIndex == null ? (node.anyIndex = new Node()) : node.anyIndex;
            } else {
                node = node.exact.computeIfAbsent(s, k -> new Node());
            }
        }
        node.entry = entry;
        entries.add(entry);
    }

    /** The entry whose pattern matches a concrete document path. */
    public Optional<KeyMappingEntry> lookup(KeyPath concrete) {
        return search(concrete);
    }

    /**
     * First entry compatible with the path, segment by segment. Exact children are tried before
     * wildcards.
     */
    private Optional<KeyMappingEntry> search(KeyPath path) {
        List<KeyPath.Segment> segments = path.segments();
        Deque<Visit> stack = new ArrayDeque<>();
        stack.push(new Visit(root, 0));
        while (!stack.isEmpty()) {
            Visit v = stack.pop();
            if (v.depth() == segments.size()) {
                if (v.node().entry != null) {
                    return Optional.of(v.node().entry);
                }
                continue;
            }
            KeyPath.Segment s = segments.get(v.depth());
            int next = v.depth() + 1;
            if (s instanceof KeyPath.Name || s instanceof KeyPath.AnyName) {
                push(stack, v.node().anyName, next);
            }
            if (s instanceof KeyPath.Index || s instanceof KeyPath.AnyIndex) {
                push(stack, v.node().anyIndex, next);
            }
            if (s instanceof KeyPath.AnyName || s instanceof KeyPath.AnyIndex) {
                Class<?> wanted = s instanceof KeyPath.AnyName ? KeyPath.Name.class : KeyPath.Index.class;
                for (Map.Entry<KeyPath.Segment, Node> child : v.node().exact.entrySet()) {
                    if (wanted.isInstance(child.getKey())) {
                        push(stack, child.getValue(), next);
                    }
                }
            } else {
                push(stack, v.node().exact.get(s), next);
            }
        }
        return Optional.empty();
    }

    private static void push(Deque<Visit> stack, Node node, int depth) {
        if (node != null) {
            stack.push(new Visit(node, depth));
        }
    }

    /** Entries in insertion order. */
    public List<KeyMappingEntry> entries() {
        return List.copyOf(entries);
    }

    public int size() {
        return entries.size();
    }

    /** Entries naming features the model does not contain. */
    public List<KeyMappingEntry> checkAgainst(FeatureModel model) {
        List<KeyMappingEntry> out = new ArrayList<>();
        for (KeyMappingEntry e : entries) {
            if (!model.contains(e.featureId())) {
                out.add(e);
            }
        }
        return out;
    }
}
