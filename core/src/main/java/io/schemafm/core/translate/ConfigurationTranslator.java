package io.schemafm.core.translate;

import com.fasterxml.jackson.databind.JsonNode;
import io.schemafm.core.error.DocumentReadException;
import io.schemafm.core.error.TranslationBudgetExceededException;
import io.schemafm.core.mapping.KeyMappingEntry;
import io.schemafm.core.mapping.KeyMappingTable;
import io.schemafm.core.mapping.KeyPath;
import io.schemafm.core.mapping.ValueKind;
import io.schemafm.core.model.FeatureFlag;
import io.schemafm.core.model.FeatureModel;
import io.schemafm.core.model.FeatureNode;
import io.schemafm.core.model.GroupType;
import io.schemafm.core.synth.FeatureNames;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns one concrete document into a {@link ConfigurationSelection} by looking up every key path
 * in the {@link KeyMappingTable}.
 *
 * <p>
 * Keys without an entry are reported as unmapped and never dropped; for unmapped containers only
 * the leaves are reported. Features flagged open, unknown or recursive absorb whatever lies
 * below them. A null value selects the feature's {@code isNull} marker when it has one, and the
 * feature alone otherwise. Thread-safe: one translator is shared by all workers of a batch.
 */
public final class ConfigurationTranslator {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigurationTranslator.class);

    private final FeatureModel model;
    private final KeyMappingTable table;
    private final String defaultKind;
    private final TranslationBudget budget;

    public ConfigurationTranslator(FeatureModel model, KeyMappingTable table) {
        this(model, table, null, TranslationBudget.DEFAULT);
    }

    /**
     * @param defaultKind kind assumed for documents without a {@code kind} field, may be {@code null}
     */
    public ConfigurationTranslator(
            FeatureModel model, KeyMappingTable table, String defaultKind, TranslationBudget budget) {
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.table = Objects.requireNonNull(table, "table must not be null");
        this.defaultKind = defaultKind;
        this.budget = Objects.requireNonNull(budget, "budget must not be null");
    }

    private record Visit(JsonNode value, KeyPath path, int depth, FeatureNode owner) {}

    /**
     * @throws DocumentReadException              if the document root is not a mapping
     * @throws TranslationBudgetExceededException if the document is too deep or takes too long
     */
    public ConfigurationSelection translate(JsonNode document, String documentId) {
        if (document == null || !document.isObject()) {
            throw new DocumentReadException("Document root is not a mapping", documentId);
        }
        long started = System.nanoTime();
        JsonNode kindNode = document.get("kind");
        String kind = kindNode != null && kindNode.isTextual() ? kindNode.textValue() : defaultKind;

        Walk walk = new Walk();
        Deque<Visit> stack = new ArrayDeque<>();
        stack.push(new Visit(document, KeyPath.of(kind == null ? "" : kind), 0, null));
        while (!stack.isEmpty()) {
            Visit v = stack.pop();
            checkBudget(v, started, documentId);
            visit(walk, v, stack);
        }
        LOG.debug("Translated {} ({}): {} features selected, {} unmapped keys",
                documentId, kind, walk.selected.size(), walk.unmapped.size());
        return new ConfigurationSelection(documentId, walk.selected, walk.values, walk.unmapped);
    }

    private void checkBudget(Visit v, long started, String documentId) {
        if (v.depth() > budget.maxDepth()) {
            throw new TranslationBudgetExceededException(
                    "Nesting at " + v.path() + " exceeds " + budget.maxDepth() + " levels", documentId);
        }
        long elapsedMs = (System.nanoTime() - started) / 1_000_000;
        if (elapsedMs > budget.maxMillis()) {
            throw new TranslationBudgetExceededException(
                    "Translation exceeded " + budget.maxMillis() + "ms budget", documentId);
        }
    }

    private void visit(Walk walk, Visit v, Deque<Visit> stack) {
        JsonNode value = v.value();
        Optional<KeyMappingEntry> hit = table.lookup(v.path());
        if (hit.isEmpty()) {
            if (value.isContainerNode() && value.size() > 0) {
                pushChildren(v, null, stack);
            } else if (value.isValueNode() && v.owner() != null && resolveBranch(walk, v.owner(), value)) {
                return;
            } else if (!(value.isContainerNode() && v.owner() != null)) {
                walk.unmapped.add(v.path().withoutKind());
            }
            return;
        }

        KeyMappingEntry entry = hit.get();
        FeatureNode feature = model.find(entry.featureId()).orElse(null);
        if (feature == null) {
            // surfaces as an unknown-feature violation
            walk.selected.add(entry.featureId());
            return;
        }
        if (feature.has(FeatureFlag.OPEN) || feature.has(FeatureFlag.UNKNOWN) || feature.has(FeatureFlag.RECURSIVE)) {
            walk.activate(feature.id());
            if (value.isValueNode() && !value.isNull() && entry.valueKind() != ValueKind.BOOLEAN_PRESENCE) {
                walk.record(feature.id(), value);
            }
            return;
        }
        if (value.isNull() || value.isContainerNode() && value.size() == 0) {
            FeatureNode marker = feature.child(value.isNull() ? FeatureNames.IS_NULL : FeatureNames.IS_EMPTY);
            if (marker == null && value.isNull()) {
                // an explicit null still sets the key; no value is recorded
                walk.activate(feature.id());
            } else if (marker == null) {
                walk.unmapped.add(v.path().withoutKind());
            } else {
                walk.activate(feature.id());
                walk.activate(marker.id());
            }
            return;
        }
        walk.activate(feature.id());
        if (value.isValueNode()) {
            if (entry.valueKind() != ValueKind.BOOLEAN_PRESENCE) {
                walk.record(feature.id(), value);
            } else if (!resolveBranch(walk, feature, value)) {
                // a value where a container is expected; the validator rejects it
                walk.record(feature.id(), value);
            }
            return;
        }
        boolean owns = feature.has(FeatureFlag.REPEATABLE) || feature.has(FeatureFlag.MAP);
        pushChildren(v, owns ? feature : null, stack);
    }

    /** Picks the typed branch of a union held below the feature that accepts the value. */
    private boolean resolveBranch(Walk walk, FeatureNode feature, JsonNode value) {
        for (FeatureNode holder : feature.children()) {
            if (!holder.has(FeatureFlag.ABSTRACT) || holder.group() == GroupType.AND) {
                continue;
            }
            for (FeatureNode branch : holder.children()) {
                if (branch.attribute() != null && branch.attribute().type().accepts(value)) {
                    walk.activate(branch.id());
                    walk.record(branch.id(), value);
                    return true;
                }
            }
        }
        return false;
    }

    private static void pushChildren(Visit v, FeatureNode owner, Deque<Visit> stack) {
        JsonNode value = v.value();
        List<Visit> children = new ArrayList<>();
        if (value.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = value.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                children.add(new Visit(field.getValue(), v.path().name(field.getKey()), v.depth() + 1, owner));
            }
        } else {
            for (int i = 0; i < value.size(); i++) {
                children.add(new Visit(value.get(i), v.path().index(i), v.depth() + 1, owner));
            }
        }
        for (int i = children.size() - 1; i >= 0; i--) {
            stack.push(children.get(i));
        }
    }

    /** Accumulated state of one translation. */
    private final class Walk {
        final Set<String> selected = new LinkedHashSet<>();
        final Map<String, List<JsonNode>> values = new LinkedHashMap<>();
        final List<String> unmapped = new ArrayList<>();

        /** Selects the feature and every abstract ancestor directly above it. */
        void activate(String featureId) {
            if (!selected.add(featureId)) {
                return;
            }
            for (String ancestor : model.ancestorsOf(featureId)) {
                if (!model.get(ancestor).has(FeatureFlag.ABSTRACT)) {
                    break;
                }
                selected.add(ancestor);
            }
        }

        void record(String featureId, JsonNode value) {
            values.computeIfAbsent(featureId, k -> new ArrayList<>()).add(value);
        }
    }
}
