package io.schemafm.core.mapping;

import io.schemafm.core.model.FeatureFlag;
import io.schemafm.core.model.FeatureModel;
import io.schemafm.core.model.FeatureNode;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Derives the key mapping table from a model by joining the keys along each kind. Abstract
 * features add no key and get no entry; repeatable and map features extend the path of their
 * children with {@code [*]} and {@code *}.
 */
public final class KeyMappingDeriver {

    private KeyMappingDeriver() {}

    private record Step(FeatureNode feature, KeyPath base) {}

    public static KeyMappingTable derive(FeatureModel model) {
        List<KeyMappingEntry> entries = new ArrayList<>();
        for (FeatureNode kind : model.kinds()) {
            Deque<Step> stack = new ArrayDeque<>();
            stack.push(new Step(kind, null));
            while (!stack.isEmpty()) {
                Step step = stack.pop();
                FeatureNode f = step.feature();
                KeyPath path;
                if (f.has(FeatureFlag.ABSTRACT)) {
                    path = step.base();
                } else {
                    path = step.base() == null ? KeyPath.of(f.key()) : step.base().name(f.key());
                    entries.add(new KeyMappingEntry(path, f.id(), f.attribute() != null
                            && !f.has(FeatureFlag.REPEATABLE) && !f.has(FeatureFlag.MAP)
                            ? valueKind(f)
                            : ValueKind.BOOLEAN_PRESENCE));
                }
                if (path == null) {
                    continue;
                }
                KeyPath element = path;
                if (f.has(FeatureFlag.REPEATABLE)) {
                    element = element.append(KeyPath.ANY_INDEX);
                }
                if (f.has(FeatureFlag.MAP)) {
                    element = element.append(KeyPath.ANY_NAME);
                }
                if (element != path && f.attribute() != null) {
                    entries.add(new KeyMappingEntry(element, f.id(), valueKind(f)));
                }
                for (int i = f.children().size() - 1; i >= 0; i--) {
                    stack.push(new Step(f.children().get(i), element));
                }
            }
        }
        return KeyMappingTable.of(entries);
    }

    private static ValueKind valueKind(FeatureNode f) {
        return f.attribute().enumerated() ? ValueKind.ENUMERATED : ValueKind.VERBATIM;
    }
}
