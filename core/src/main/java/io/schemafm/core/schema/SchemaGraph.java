package io.schemafm.core.schema;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Indexed arena of resolved {@link Definition}s for one schema version, keyed by qualified name.
 * Read-only once built, so synthesis of different kinds may share one instance across threads.
 * The graph lives for one model build and is dropped once the feature model exists.
 */
public final class SchemaGraph {

    private final Map<String, Definition> definitions;
    private final List<String> roots;
    private final Map<String, String> kindNames;

    SchemaGraph(Map<String, Definition> definitions, List<String> roots, Map<String, String> kindNames) {
        this.definitions = Collections.unmodifiableMap(new LinkedHashMap<>(definitions));
        this.roots = List.copyOf(roots);
        this.kindNames = Collections.unmodifiableMap(new LinkedHashMap<>(kindNames));
    }

    public Optional<Definition> find(String name) {
        return Optional.ofNullable(definitions.get(name));
    }

    /**
     * Returns the definition with the given qualified name.
     *
     * @throws IllegalArgumentException if the graph does not contain it
     */
    public Definition get(String name) {
        Definition d = definitions.get(name);
        if (d == null) {
            throw new IllegalArgumentException("No definition named '" + name + "'");
        }
        return d;
    }

    public boolean contains(String name) {
        return definitions.containsKey(name);
    }

    /** Resolved top-level kinds, in request order. */
    public List<String> roots() {
        return roots;
    }

    /** Document {@code kind} value of a root definition. */
    public String kindName(String root) {
        return Objects.requireNonNullElseGet(kindNames.get(root), () -> get(root).shortName());
    }

    public Collection<Definition> definitions() {
        return definitions.values();
    }

    public int size() {
        return definitions.size();
    }
}
