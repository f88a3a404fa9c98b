package io.github.cyfko.kleene.core.model;

import io.github.cyfko.kleene.core.api.KleeneOperator;

import java.util.Objects;

/**
 * Kleene negation {@code ¬operand}, evaluated as {@code -operand}. Confidence passes through unchanged.
 *
 * @param operand the negated expression
 * @author Frank KOSSI
 * @since 1.0
 */
public record Negation(Expression operand) implements Expression {

    public Negation {
        Objects.requireNonNull(operand, "Operand cannot be null");
    }

    @Override
    public int atomCount() {
        return operand.atomCount();
    }

    @Override
    public int depth() {
        return 1 + operand.depth();
    }

    @Override
    public String toString() {
        return KleeneOperator.NOT.getSymbol() + operand;
    }
}
