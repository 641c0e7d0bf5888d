package io.schemafm.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Differences between two versions of a feature model: features and constraints added or removed,
 * and features whose group type or cardinality changed. Constraints are compared by their
 * rendered text, which is canonical.
 *
 * @param oldNamespace       namespace of the older model
 * @param newNamespace       namespace of the newer model
 * @param addedFeatures      ids only in the newer model, sorted
 * @param removedFeatures    ids only in the older model, sorted
 * @param changedFeatures    id to a short "old -> new" description, sorted by id
 * @param addedConstraints   rendered constraints only in the newer model, sorted
 * @param removedConstraints rendered constraints only in the older model, sorted
 */
public record ModelDiff(
        String oldNamespace,
        String newNamespace,
        List<String> addedFeatures,
        List<String> removedFeatures,
        Map<String, String> changedFeatures,
        List<String> addedConstraints,
        List<String> removedConstraints) {

    public ModelDiff {
        addedFeatures = List.copyOf(addedFeatures);
        removedFeatures = List.copyOf(removedFeatures);
        changedFeatures = Collections.unmodifiableMap(new TreeMap<>(changedFeatures));
        addedConstraints = List.copyOf(addedConstraints);
        removedConstraints = List.copyOf(removedConstraints);
    }

    public static ModelDiff between(FeatureModel older, FeatureModel newer) {
        Set<String> oldIds = ids(older);
        Set<String> newIds = ids(newer);

        Map<String, String> changed = new TreeMap<>();
        for (String id : oldIds) {
            if (!newIds.contains(id)) {
                continue;
            }
            FeatureNode a = older.get(id);
            FeatureNode b = newer.get(id);
            List<String> parts = new ArrayList<>();
            if (a.group() != b.group()) {
                parts.add("group " + a.group() + " -> " + b.group());
            }
            if (a.cardinality() != b.cardinality()) {
                parts.add(a.cardinality().keyword() + " -> " + b.cardinality().keyword());
            }
            if (!parts.isEmpty()) {
                changed.put(id, String.join(", ", parts));
            }
        }

        Set<String> oldConstraints = rendered(older);
        Set<String> newConstraints = rendered(newer);
        return new ModelDiff(
                older.namespace(),
                newer.namespace(),
                minus(newIds, oldIds),
                minus(oldIds, newIds),
                changed,
                minus(newConstraints, oldConstraints),
                minus(oldConstraints, newConstraints));
    }

    public boolean isEmpty() {
        return addedFeatures.isEmpty()
                && removedFeatures.isEmpty()
                && changedFeatures.isEmpty()
                && addedConstraints.isEmpty()
                && removedConstraints.isEmpty();
    }

    /** Markdown changelog, one section per non-empty category. */
    public String toMarkdown() {
        StringBuilder md = new StringBuilder();
        md.append("# Changelog: ").append(oldNamespace).append(" -> ").append(newNamespace).append("\n\n");
        md.append("| Change | Count |\n|---|---|\n");
        md.append("| Added features | ").append(addedFeatures.size()).append(" |\n");
        md.append("| Removed features | ").append(removedFeatures.size()).append(" |\n");
        md.append("| Changed features | ").append(changedFeatures.size()).append(" |\n");
        md.append("| Added constraints | ").append(addedConstraints.size()).append(" |\n");
        md.append("| Removed constraints | ").append(removedConstraints.size()).append(" |\n");
        section(md, "Added features", addedFeatures);
        section(md, "Removed features", removedFeatures);
        if (!changedFeatures.isEmpty()) {
            md.append("\n## Changed features\n\n");
            changedFeatures.forEach((id, change) ->
                    md.append("- `").append(id).append("`: ").append(change).append('\n'));
        }
        section(md, "Added constraints", addedConstraints);
        section(md, "Removed constraints", removedConstraints);
        return md.toString();
    }

    private static void section(StringBuilder md, String title, List<String> items) {
        if (items.isEmpty()) {
            return;
        }
        md.append("\n## ").append(title).append("\n\n");
        items.forEach(item -> md.append("- `").append(item).append("`\n"));
    }

    private static Set<String> ids(FeatureModel model) {
        Set<String> ids = new TreeSet<>();
        model.features().forEach(f -> ids.add(f.id()));
        ids.remove(model.root().id());
        return ids;
    }

    private static Set<String> rendered(FeatureModel model) {
        Set<String> out = new TreeSet<>();
        model.constraints().forEach(c -> out.add(c.render()));
        return out;
    }

    private static List<String> minus(Set<String> a, Set<String> b) {
        List<String> out = new ArrayList<>();
        for (String s : a) {
            if (!b.contains(s)) {
                out.add(s);
            }
        }
        return out;
    }
}
