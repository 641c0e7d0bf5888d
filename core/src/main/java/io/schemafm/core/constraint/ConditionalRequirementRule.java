package io.schemafm.core.constraint;

import io.schemafm.core.model.Constraint;
import io.schemafm.core.model.Expression;
import io.schemafm.core.schema.ConditionalRequirement;
import io.schemafm.core.schema.Definition;
import java.util.ArrayList;
import java.util.List;

/**
 * {@code if}/{@code then} pinning a sibling value, and {@code dependentRequired}: the condition
 * implies each required property.
 */
public final class ConditionalRequirementRule implements DerivationRule {

    @Override
    public String name() {
        return "conditional-requirement";
    }

    @Override
    public List<Constraint> derive(DerivationContext context) {
        List<Constraint> out = new ArrayList<>();
        for (Definition d : context.definitions()) {
            for (ConditionalRequirement cr : d.conditionals()) {
                String trigger = context.featureFor(cr.property());
                Expression condition = cr.value() == null
                        ? Expression.ref(trigger)
                        : new Expression.ValueEquals(trigger, cr.value());
                for (String required : cr.required()) {
                    out.add(Constraint.of(
                            Expression.implies(condition, Expression.ref(context.featureFor(required))),
                            name() + "@" + d.name()));
                }
            }
        }
        return out;
    }
}
