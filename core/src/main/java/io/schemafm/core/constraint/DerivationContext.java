package io.schemafm.core.constraint;

import io.schemafm.core.model.FeatureNode;
import io.schemafm.core.schema.Definition;
import io.schemafm.core.schema.Property;
import io.schemafm.core.synth.FeatureNames;
import io.schemafm.core.synth.KindTree;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * What a {@link DerivationRule} sees for one feature: the feature, the definitions expanded into
 * it, and the kind tree it belongs to.
 */
public final class DerivationContext {

    private final KindTree tree;
    private final FeatureNode feature;
    private final List<Definition> definitions;
    private final Set<String> converted;

    DerivationContext(KindTree tree, FeatureNode feature, List<Definition> definitions, Set<String> converted) {
        this.tree = tree;
        this.feature = feature;
        this.definitions = List.copyOf(definitions);
        this.converted = converted;
    }

    public KindTree tree() {
        return tree;
    }

    public FeatureNode feature() {
        return feature;
    }

    public List<Definition> definitions() {
        return definitions;
    }

    /**
     * Id of the feature standing for a property of this feature. Falls back to the alias target
     * when the property was deduplicated, and to the would-be id when the property does not
     * exist, which makes the constraint dangling.
     */
    public String featureFor(String property) {
        for (FeatureNode child : feature.children()) {
            if (property.equals(child.key())) {
                return child.id();
            }
        }
        String candidate = feature.id() + "." + FeatureNames.segment(property);
        return tree.aliases().getOrDefault(candidate, candidate);
    }

    /** Property names of the expanded definitions, in declaration order. */
    public List<String> propertyNames() {
        Set<String> names = new LinkedHashSet<>();
        for (Definition d : definitions) {
            for (Property p : d.properties()) {
                names.add(p.name());
            }
        }
        return new ArrayList<>(names);
    }

    /** Property names mentioned as whole words in the text, in declaration order. */
    public List<String> mentionedProperties(String text) {
        List<String> out = new ArrayList<>();
        for (String name : propertyNames()) {
            if (Pattern.compile("(?<![\\w.])" + Pattern.quote(name) + "(?![\\w])").matcher(text).find()) {
                out.add(name);
            }
        }
        return out;
    }

    void markConverted(String sentenceKey) {
        synchronized (converted) {
            converted.add(sentenceKey);
        }
    }
}
