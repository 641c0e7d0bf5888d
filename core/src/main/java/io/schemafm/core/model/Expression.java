package io.schemafm.core.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Propositional expression over feature ids. Operators by increasing binding strength:
 * {@code <=>}, {@code =>}, {@code |}, {@code &}, {@code !}. Atoms are feature references and
 * value tests ({@code Pod.spec.restartPolicy == 'Never'}).
 */
public sealed interface Expression
        permits Expression.Ref, Expression.ValueEquals, Expression.Not, Expression.And, Expression.Or,
                Expression.Implies, Expression.Iff {

    boolean evaluate(Assignment assignment);

    /** Binding strength; higher binds tighter. */
    int precedence();

    /** Canonical text form, parenthesizing only where precedence requires. */
    String render();

    /** Feature ids referenced, in first-occurrence order. */
    default Set<String> features() {
        Set<String> out = new LinkedHashSet<>();
        collect(out);
        return out;
    }

    void collect(Set<String> out);

    static Ref ref(String featureId) {
        return new Ref(featureId);
    }

    static Expression not(Expression operand) {
        return new Not(operand);
    }

    static Expression and(Expression... operands) {
        return new And(List.of(operands));
    }

    static Expression or(Expression... operands) {
        return new Or(List.of(operands));
    }

    static Expression implies(Expression left, Expression right) {
        return new Implies(left, right);
    }

    private static String wrap(Expression e, int minPrecedence) {
        return e.precedence() >= minPrecedence ? e.render() : "(" + e.render() + ")";
    }

    private static String join(List<Expression> operands, String op, int minPrecedence) {
        List<String> parts = new ArrayList<>(operands.size());
        for (Expression e : operands) {
            parts.add(wrap(e, minPrecedence));
        }
        return String.join(" " + op + " ", parts);
    }

    /** A feature is selected. */
    record Ref(String featureId) implements Expression {
        public Ref {
            Objects.requireNonNull(featureId, "featureId must not be null");
        }

        @Override
        public boolean evaluate(Assignment a) {
            return a.isSelected(featureId);
        }

        @Override
        public int precedence() {
            return 6;
        }

        @Override
        public String render() {
            return featureId;
        }

        @Override
        public void collect(Set<String> out) {
            out.add(featureId);
        }
    }

    /** A feature is selected with the given literal value. */
    record ValueEquals(String featureId, String literal) implements Expression {
        public ValueEquals {
            Objects.requireNonNull(featureId, "featureId must not be null");
            Objects.requireNonNull(literal, "literal must not be null");
        }

        @Override
        public boolean evaluate(Assignment a) {
            return a.hasValue(featureId, literal);
        }

        @Override
        public int precedence() {
            return 6;
        }

        @Override
        public String render() {
            return featureId + " == " + quote(literal);
        }

        @Override
        public void collect(Set<String> out) {
            out.add(featureId);
        }
    }

    record Not(Expression operand) implements Expression {
        @Override
        public boolean evaluate(Assignment a) {
            return !operand.evaluate(a);
        }

        @Override
        public int precedence() {
            return 5;
        }

        @Override
        public String render() {
            return "!" + wrap(operand, 5);
        }

        @Override
        public void collect(Set<String> out) {
            operand.collect(out);
        }
    }

    record And(List<Expression> operands) implements Expression {
        public And {
            if (operands.size() < 2) {
                throw new IllegalArgumentException("And needs at least two operands");
            }
            operands = List.copyOf(operands);
        }

        @Override
        public boolean evaluate(Assignment a) {
            return operands.stream().allMatch(e -> e.evaluate(a));
        }

        @Override
        public int precedence() {
            return 4;
        }

        @Override
        public String render() {
            return join(operands, "&", 5);
        }

        @Override
        public void collect(Set<String> out) {
            operands.forEach(e -> e.collect(out));
        }
    }

    record Or(List<Expression> operands) implements Expression {
        public Or {
            if (operands.size() < 2) {
                throw new IllegalArgumentException("Or needs at least two operands");
            }
            operands = List.copyOf(operands);
        }

        @Override
        public boolean evaluate(Assignment a) {
            return operands.stream().anyMatch(e -> e.evaluate(a));
        }

        @Override
        public int precedence() {
            return 3;
        }

        @Override
        public String render() {
            return join(operands, "|", 4);
        }

        @Override
        public void collect(Set<String> out) {
            operands.forEach(e -> e.collect(out));
        }
    }

    record Implies(Expression left, Expression right) implements Expression {
        @Override
        public boolean evaluate(Assignment a) {
            return !left.evaluate(a) || right.evaluate(a);
        }

        @Override
        public int precedence() {
            return 2;
        }

        @Override
        public String render() {
            return wrap(left, 3) + " => " + wrap(right, 3);
        }

        @Override
        public void collect(Set<String> out) {
            left.collect(out);
            right.collect(out);
        }
    }

    record Iff(Expression left, Expression right) implements Expression {
        @Override
        public boolean evaluate(Assignment a) {
            return left.evaluate(a) == right.evaluate(a);
        }

        @Override
        public int precedence() {
            return 1;
        }

        @Override
        public String render() {
            return wrap(left, 2) + " <=> " + wrap(right, 2);
        }

        @Override
        public void collect(Set<String> out) {
            left.collect(out);
            right.collect(out);
        }
    }

    /** Single-quotes a literal, escaping backslashes, quotes and line breaks. */
    static String quote(String literal) {
        return "'" + literal.replace("\\", "\\\\")
                .replace("'", "\\'")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t") + "'";
    }
}
