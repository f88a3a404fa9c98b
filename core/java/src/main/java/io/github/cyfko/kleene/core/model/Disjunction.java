package io.github.cyfko.kleene.core.model;

import io.github.cyfko.kleene.core.api.KleeneOperator;

import java.util.Objects;

/**
 * Kleene disjunction {@code (left ∨ right)}, evaluated as {@code max(left, right)}.
 *
 * @param left  left operand, evaluated first
 * @param right right operand, skipped by optimized evaluation when {@code left} is {@code TRUE}
 * @author Frank KOSSI
 * @since 1.0
 */
public record Disjunction(Expression left, Expression right) implements Expression {

    public Disjunction {
        Objects.requireNonNull(left, "Left operand cannot be null");
        Objects.requireNonNull(right, "Right operand cannot be null");
    }

    @Override
    public int atomCount() {
        return left.atomCount() + right.atomCount();
    }

    @Override
    public int depth() {
        return 1 + Math.max(left.depth(), right.depth());
    }

    @Override
    public String toString() {
        return "(" + left + " " + KleeneOperator.OR.getSymbol() + " " + right + ")";
    }
}
