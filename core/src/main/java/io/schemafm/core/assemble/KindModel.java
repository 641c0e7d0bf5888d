package io.schemafm.core.assemble;

import io.schemafm.core.model.Constraint;
import io.schemafm.core.synth.KindTree;
import java.util.List;

/** A synthesized kind with the constraints derived for it, ready for assembly. */
public record KindModel(KindTree tree, List<Constraint> constraints) {

    public KindModel {
        constraints = List.copyOf(constraints);
    }
}
