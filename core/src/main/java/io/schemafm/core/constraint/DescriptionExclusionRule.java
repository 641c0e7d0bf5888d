package io.schemafm.core.constraint;

import io.schemafm.core.model.Constraint;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/** "Mutually exclusive" sentences: pairwise excludes between the sibling properties named. */
public final class DescriptionExclusionRule extends DescriptionRule {

    @Override
    public String name() {
        return "description-exclusion";
    }

    @Override
    protected List<Constraint> fromSentence(DerivationContext context, Sentence sentence) {
        if (!sentence.text().toLowerCase(Locale.ROOT).contains("mutually exclusive")) {
            return List.of();
        }
        List<String> names = context.mentionedProperties(sentence.text());
        if (sentence.property() != null && !names.contains(sentence.property().name())) {
            names.add(0, sentence.property().name());
        }
        if (names.size() < 2) {
            return List.of();
        }
        List<String> ordered = new ArrayList<>();
        for (String p : context.propertyNames()) {
            if (names.contains(p)) {
                ordered.add(p);
            }
        }
        List<Constraint> out = new ArrayList<>();
        for (int i = 0; i < ordered.size(); i++) {
            for (int j = i + 1; j < ordered.size(); j++) {
                out.add(Constraint.excludes(
                        context.featureFor(ordered.get(i)), context.featureFor(ordered.get(j)), trace(sentence)));
            }
        }
        return out;
    }
}
