package io.schemafm.core.model;

import java.util.Objects;

/**
 * Cross-tree constraint. The kind is derived from the expression shape, so a constraint read back
 * from a model file has the same kind it was written with. The trace names the rule and schema
 * location that produced it and is not part of equality.
 *
 * @param kind       shape of the expression
 * @param expression the propositional expression
 * @param trace      derivation trace for diagnostics, may be {@code null}
 */
public record Constraint(ConstraintKind kind, Expression expression, String trace) {

    public Constraint {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(expression, "expression must not be null");
        if (kind != classify(expression)) {
            throw new IllegalArgumentException("Expression '" + expression.render() + "' is not of kind " + kind);
        }
    }

    public static Constraint of(Expression expression, String trace) {
        return new Constraint(classify(expression), expression, trace);
    }

    public static Constraint requires(String feature, String required, String trace) {
        return of(Expression.implies(Expression.ref(feature), Expression.ref(required)), trace);
    }

    public static Constraint excludes(String feature, String excluded, String trace) {
        return of(Expression.implies(Expression.ref(feature), Expression.not(Expression.ref(excluded))), trace);
    }

    static ConstraintKind classify(Expression e) {
        if (e instanceof Expression.Implies imp && imp.left() instanceof Expression.Ref) {
            if (imp.right() instanceof Expression.Ref) {
                return ConstraintKind.REQUIRES;
            }
            if (imp.right() instanceof Expression.Not not && not.operand() instanceof Expression.Ref) {
                return ConstraintKind.EXCLUDES;
            }
        }
        return ConstraintKind.EXPRESSION;
    }

    /**
     * For requires/excludes, the unordered feature pair the constraint relates, as
     * {@code "a|b"} with the ids sorted; {@code null} for general expressions.
     */
    public String featurePair() {
        if (kind == ConstraintKind.EXPRESSION) {
            return null;
        }
        Expression.Implies imp = (Expression.Implies) expression;
        String a = ((Expression.Ref) imp.left()).featureId();
        String b = imp.right() instanceof Expression.Not not
                ? ((Expression.Ref) not.operand()).featureId()
                : ((Expression.Ref) imp.right()).featureId();
        return a.compareTo(b) <= 0 ? a + "|" + b : b + "|" + a;
    }

    public String render() {
        return expression.render();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Constraint other && kind == other.kind && expression.equals(other.expression);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, expression);
    }

    @Override
    public String toString() {
        return kind + "[" + render() + "]";
    }
}
