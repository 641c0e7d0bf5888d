package io.schemafm.core.constraint;

import io.schemafm.core.model.Constraint;
import io.schemafm.core.model.Expression;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * "At least one of a, b" gives {@code P => P.a | P.b}; "Exactly one of a, b" additionally
 * forbids selecting all of them together.
 */
public final class DescriptionCardinalityRule extends DescriptionRule {

    private static final Pattern PHRASE = Pattern.compile("(?i)\\b(at\\s+least|exactly)\\s+one\\s+of\\b");

    @Override
    public String name() {
        return "description-cardinality";
    }

    @Override
    protected List<Constraint> fromSentence(DerivationContext context, Sentence sentence) {
        Matcher m = PHRASE.matcher(sentence.text());
        if (!m.find()) {
            return List.of();
        }
        List<String> names = context.mentionedProperties(sentence.text().substring(m.end()));
        if (names.size() < 2) {
            return List.of();
        }
        List<Expression> refs = new ArrayList<>();
        for (String n : names) {
            refs.add(Expression.ref(context.featureFor(n)));
        }
        Expression atLeastOne = new Expression.Or(refs);
        Expression body = m.group(1).toLowerCase(Locale.ROOT).startsWith("exactly")
                ? new Expression.And(List.of(atLeastOne, Expression.not(new Expression.And(refs))))
                : atLeastOne;
        return List.of(Constraint.of(
                Expression.implies(Expression.ref(context.feature().id()), body), trace(sentence)));
    }
}
