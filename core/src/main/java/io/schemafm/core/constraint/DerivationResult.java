package io.schemafm.core.constraint;

import io.schemafm.core.model.Constraint;
import java.util.List;

/**
 * @param constraints deduplicated constraints in derivation order
 * @param unconverted description sentences that look like constraints but matched no rule
 */
public record DerivationResult(List<Constraint> constraints, int unconverted) {

    public DerivationResult {
        constraints = List.copyOf(constraints);
    }
}
