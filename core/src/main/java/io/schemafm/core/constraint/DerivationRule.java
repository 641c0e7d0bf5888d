package io.schemafm.core.constraint;

import io.schemafm.core.model.Constraint;
import java.util.List;

/**
 * One independent way of deriving cross-tree constraints. Rules run over every synthesized
 * feature and their outputs are unioned; a rule never sees another rule's output.
 */
public interface DerivationRule {

    /** Short rule name, used as the prefix of constraint traces. */
    String name();

    List<Constraint> derive(DerivationContext context);
}
