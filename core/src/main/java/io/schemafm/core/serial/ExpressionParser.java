package io.schemafm.core.serial;

import io.schemafm.core.model.Expression;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the text form produced by {@link Expression#render()}. Binding strength, loosest first:
 * {@code <=>}, {@code =>}, {@code |}, {@code &}, {@code !}.
 */
public final class ExpressionParser {

    private final Tokenizer tokens;

    private ExpressionParser(String text) {
        this.tokens = new Tokenizer(text);
    }

    /**
     * @throws IllegalStateException if the text is not a well-formed expression
     */
    public static Expression parse(String text) {
        ExpressionParser p = new ExpressionParser(text);
        Expression e = p.iff();
        if (!p.tokens.atEnd()) {
            throw new IllegalStateException("unexpected " + p.tokens.peek() + " after expression");
        }
        return e;
    }

    private Expression iff() {
        Expression left = implies();
        while (tokens.accept("<=>")) {
            left = new Expression.Iff(left, implies());
        }
        return left;
    }

    private Expression implies() {
        Expression left = or();
        if (tokens.accept("=>")) {
            return new Expression.Implies(left, or());
        }
        return left;
    }

    private Expression or() {
        List<Expression> operands = new ArrayList<>();
        operands.add(and());
        while (tokens.accept("|")) {
            operands.add(and());
        }
        return operands.size() == 1 ? operands.get(0) : new Expression.Or(operands);
    }

    private Expression and() {
        List<Expression> operands = new ArrayList<>();
        operands.add(unary());
        while (tokens.accept("&")) {
            operands.add(unary());
        }
        return operands.size() == 1 ? operands.get(0) : new Expression.And(operands);
    }

    private Expression unary() {
        if (tokens.accept("!")) {
            return new Expression.Not(unary());
        }
        if (tokens.accept("(")) {
            Expression inner = iff();
            tokens.expect(")");
            return inner;
        }
        String id = tokens.word();
        if (tokens.accept("==")) {
            return new Expression.ValueEquals(id, tokens.string());
        }
        return new Expression.Ref(id);
    }
}
