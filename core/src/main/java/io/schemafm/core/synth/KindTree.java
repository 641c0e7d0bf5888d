package io.schemafm.core.synth;

import io.schemafm.core.model.FeatureNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Feature tree synthesized for one top-level kind, with the metadata collected along the way.
 *
 * @param definition   qualified name of the kind's root definition
 * @param kindName     document {@code kind} value
 * @param root         the kind feature
 * @param descriptions feature id to description
 * @param aliases      alias id to the canonical feature id kept instead
 * @param expansions   feature id to the definitions expanded into it, in expansion order
 */
public record KindTree(
        String definition,
        String kindName,
        FeatureNode root,
        Map<String, String> descriptions,
        Map<String, String> aliases,
        Map<String, List<String>> expansions) {

    public KindTree {
        Objects.requireNonNull(definition, "definition must not be null");
        Objects.requireNonNull(kindName, "kindName must not be null");
        Objects.requireNonNull(root, "root must not be null");
        descriptions = Collections.unmodifiableMap(new LinkedHashMap<>(descriptions));
        aliases = Collections.unmodifiableMap(new LinkedHashMap<>(aliases));
        expansions = Collections.unmodifiableMap(new LinkedHashMap<>(expansions));
    }
}
