package io.schemafm.core.validate;

import com.fasterxml.jackson.databind.JsonNode;
import io.schemafm.core.model.Cardinality;
import io.schemafm.core.model.Constraint;
import io.schemafm.core.model.FeatureFlag;
import io.schemafm.core.model.FeatureModel;
import io.schemafm.core.model.FeatureNode;
import io.schemafm.core.model.GroupType;
import io.schemafm.core.synth.FeatureNames;
import io.schemafm.core.translate.ConfigurationSelection;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks a {@link ConfigurationSelection} against a {@link FeatureModel}.
 *
 * <p>
 * Rules, each reported as {@code <rule>:<subject>}:
 * <ul>
 * <li>{@code unknown}: a selected id the model lacks</li>
 * <li>{@code parent}: a selected feature whose parent is not selected; the root always counts as
 * selected. When the missing ancestor is a mandatory child of a selected and-group, only its
 * {@code mandatory} violation is reported</li>
 * <li>{@code mandatory}: a mandatory child of a selected and-group feature is missing</li>
 * <li>{@code or} / {@code alternative}: a selected group feature with no member, or not exactly
 * one member, selected</li>
 * <li>{@code value}: a recorded value outside the feature's type, value set or bounds</li>
 * <li>{@code constraint}: a cross-tree constraint evaluating to false</li>
 * </ul>
 * Group rules are not checked below an unselected ancestor. A repeatable or map feature with its
 * {@code isEmpty} or {@code isNull} marker selected has no elements, so its group rules are
 * waived. Stateless and thread-safe.
 */
public final class ModelValidator {

    private static final Logger LOG = LoggerFactory.getLogger(ModelValidator.class);

    private final FeatureModel model;

    public ModelValidator(FeatureModel model) {
        this.model = Objects.requireNonNull(model, "model must not be null");
    }

    public ValidationReport validate(ConfigurationSelection selection) {
        long started = System.nanoTime();
        List<String> violations = new ArrayList<>();

        for (String id : selection.selected()) {
            if (!model.contains(id)) {
                violations.add("unknown:" + id);
            }
        }

        for (FeatureNode f : model.features()) {
            if (!selected(selection, f)) {
                continue;
            }
            String detachedAt = topmostUnselectedAncestor(selection, f);
            if (detachedAt == null) {
                if (!f.isLeaf() && !waived(selection, f)) {
                    checkGroup(selection, f, violations);
                }
            } else if (!selection.isSelected(model.parentOf(f.id())) && !reportedAsMandatory(selection, detachedAt)) {
                violations.add("parent:" + f.id());
            }
            checkValues(selection, f, violations);
        }

        for (Constraint c : model.constraints()) {
            if (!c.expression().evaluate(selection)) {
                violations.add("constraint:" + c.render());
            }
        }

        long elapsedMs = (System.nanoTime() - started) / 1_000_000;
        if (!violations.isEmpty()) {
            LOG.debug("{} violates {} rules, first {}", selection.documentId(), violations.size(), violations.get(0));
        }
        return new ValidationReport(selection.documentId(), violations.isEmpty(), violations, elapsedMs);
    }

    private boolean selected(ConfigurationSelection selection, FeatureNode f) {
        return f == model.root() || selection.isSelected(f.id());
    }

    /** Highest unselected ancestor below the root, or {@code null} when the whole chain is selected. */
    private String topmostUnselectedAncestor(ConfigurationSelection selection, FeatureNode f) {
        String topmost = null;
        for (String ancestor : model.ancestorsOf(f.id())) {
            if (!selected(selection, model.get(ancestor))) {
                topmost = ancestor;
            }
        }
        return topmost;
    }

    /** Whether the parent's and-group check already names the missing feature. */
    private boolean reportedAsMandatory(ConfigurationSelection selection, String missing) {
        FeatureNode feature = model.get(missing);
        FeatureNode parent = model.get(model.parentOf(missing));
        return feature.cardinality() == Cardinality.MANDATORY
                && parent.group() == GroupType.AND
                && !waived(selection, parent);
    }

    private static boolean waived(ConfigurationSelection selection, FeatureNode f) {
        if (!f.has(FeatureFlag.REPEATABLE) && !f.has(FeatureFlag.MAP)) {
            return false;
        }
        for (FeatureNode c : f.children()) {
            if (c.has(FeatureFlag.ABSTRACT)
                    && (FeatureNames.IS_EMPTY.equals(c.simpleName()) || FeatureNames.IS_NULL.equals(c.simpleName()))
                    && selection.isSelected(c.id())) {
                return true;
            }
        }
        return false;
    }

    private void checkGroup(ConfigurationSelection selection, FeatureNode f, List<String> violations) {
        switch (f.group()) {
            case AND -> {
                for (FeatureNode c : f.children()) {
                    if (c.cardinality() == Cardinality.MANDATORY && !selected(selection, c)) {
                        violations.add("mandatory:" + c.id());
                    }
                }
            }
            case OR -> {
                if (countSelected(selection, f) == 0) {
                    violations.add("or:" + f.id());
                }
            }
            case ALTERNATIVE -> {
                if (countSelected(selection, f) != 1) {
                    violations.add("alternative:" + f.id());
                }
            }
        }
    }

    private int countSelected(ConfigurationSelection selection, FeatureNode f) {
        int n = 0;
        for (FeatureNode c : f.children()) {
            if (selected(selection, c)) {
                n++;
            }
        }
        return n;
    }

    private static void checkValues(ConfigurationSelection selection, FeatureNode f, List<String> violations) {
        Map<String, List<JsonNode>> values = selection.values();
        List<JsonNode> recorded = values.get(f.id());
        if (recorded == null) {
            return;
        }
        for (JsonNode v : recorded) {
            if (f.attribute() == null || !f.attribute().accepts(v)) {
                violations.add("value:" + f.id());
                return;
            }
        }
    }
}
