package io.schemafm.core.constraint;

import io.schemafm.core.model.Constraint;
import io.schemafm.core.model.Expression;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Property descriptions that tie the property to a sibling value:
 * <ul>
 * <li>"Required when `x` is set to "V"" gives {@code P.x == 'V' => P.prop}</li>
 * <li>"Must be set if x is "V"" gives {@code P.x == 'V' <=> P.prop}</li>
 * <li>"Must be empty when x is "V"" gives {@code P.x == 'V' => !P.prop}</li>
 * </ul>
 */
public final class DescriptionRequirementRule extends DescriptionRule {

    private static final String SUBJECT = "[`'\"]?([A-Za-z_][\\w]*)[`'\"]?";
    private static final String VALUE = "[`'\"\\\\]*([\\w\\-/:]+(?:\\.[\\w\\-/:]+)*)[`'\"\\\\]*";

    private static final Pattern REQUIRED_WHEN = Pattern.compile(
            "(?i)\\brequired\\s+(?:when|if)\\s+" + SUBJECT + "\\s+(?:is\\s+set\\s+to|is|equals|==)\\s+" + VALUE);
    private static final Pattern MUST_BE_SET = Pattern.compile(
            "(?i)\\bmust\\s+be\\s+set\\s+(?:if|when)\\s+" + SUBJECT + "\\s+is\\s+(?:set\\s+to\\s+)?" + VALUE);
    private static final Pattern MUST_BE_EMPTY = Pattern.compile(
            "(?i)\\bmust\\s+(?:be\\s+(?:empty|unset|omitted)|not\\s+be\\s+set)\\s+(?:if|when)\\s+"
                    + SUBJECT + "\\s+is\\s+(?:set\\s+to\\s+)?" + VALUE);

    @Override
    public String name() {
        return "description-requirement";
    }

    @Override
    protected List<Constraint> fromSentence(DerivationContext context, Sentence sentence) {
        if (sentence.property() == null) {
            return List.of();
        }
        String self = context.featureFor(sentence.property().name());
        Matcher m = REQUIRED_WHEN.matcher(sentence.text());
        if (m.find()) {
            return List.of(Constraint.of(
                    Expression.implies(valueAtom(context, m), Expression.ref(self)), trace(sentence)));
        }
        m = MUST_BE_SET.matcher(sentence.text());
        if (m.find()) {
            return List.of(Constraint.of(
                    new Expression.Iff(valueAtom(context, m), Expression.ref(self)), trace(sentence)));
        }
        m = MUST_BE_EMPTY.matcher(sentence.text());
        if (m.find()) {
            return List.of(Constraint.of(
                    Expression.implies(valueAtom(context, m), Expression.not(Expression.ref(self))),
                    trace(sentence)));
        }
        return List.of();
    }

    private static Expression valueAtom(DerivationContext context, Matcher m) {
        return new Expression.ValueEquals(context.featureFor(m.group(1)), m.group(2));
    }
}
