package io.schemafm.core.constraint;

import io.schemafm.core.model.Constraint;
import io.schemafm.core.model.FeatureNode;
import io.schemafm.core.model.GroupType;
import java.util.ArrayList;
import java.util.List;

/** Branches of an alternative group that carry their own features exclude each other pairwise. */
public final class UnionExclusionRule implements DerivationRule {

    @Override
    public String name() {
        return "union-exclusion";
    }

    @Override
    public List<Constraint> derive(DerivationContext context) {
        FeatureNode feature = context.feature();
        if (feature.group() != GroupType.ALTERNATIVE) {
            return List.of();
        }
        List<FeatureNode> branches = new ArrayList<>();
        for (FeatureNode c : feature.children()) {
            if (!c.isLeaf()) {
                branches.add(c);
            }
        }
        List<Constraint> out = new ArrayList<>();
        for (int i = 0; i < branches.size(); i++) {
            for (int j = i + 1; j < branches.size(); j++) {
                out.add(Constraint.excludes(
                        branches.get(i).id(), branches.get(j).id(), name() + "@" + feature.provenance()));
            }
        }
        return out;
    }
}
