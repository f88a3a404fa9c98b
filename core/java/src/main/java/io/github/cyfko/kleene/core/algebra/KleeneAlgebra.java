package io.github.cyfko.kleene.core.algebra;

import io.github.cyfko.kleene.core.api.KleeneOperator;
import io.github.cyfko.kleene.core.api.TernaryValue;
import io.github.cyfko.kleene.core.utils.TernaryValidationUtils;

import java.util.Objects;

/**
 * Kleene connectives over {@link TernaryValue}, computed arithmetically on the
 * {@code {-1, 0, 1}} encoding.
 * <ul>
 *   <li>{@code and(a, b) = min(a, b)}: FALSE dominates, UNKNOWN dominates TRUE</li>
 *   <li>{@code or(a, b) = max(a, b)}: TRUE dominates, UNKNOWN dominates FALSE</li>
 *   <li>{@code not(a) = -a}</li>
 *   <li>{@code eqv(a, b) = a × b}</li>
 * </ul>
 * <p>
 * The {@code int} overloads validate both operands before computing anything.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public final class KleeneAlgebra {

    private KleeneAlgebra() {}

    public static TernaryValue and(TernaryValue a, TernaryValue b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    public static TernaryValue or(TernaryValue a, TernaryValue b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    public static TernaryValue not(TernaryValue a) {
        return TernaryValue.fromInt(-a.numericValue());
    }

    public static TernaryValue eqv(TernaryValue a, TernaryValue b) {
        return TernaryValue.fromInt(a.numericValue() * b.numericValue());
    }

    public static int and(int a, int b) {
        return and(TernaryValidationUtils.requireTernary(a), TernaryValidationUtils.requireTernary(b)).numericValue();
    }

    public static int or(int a, int b) {
        return or(TernaryValidationUtils.requireTernary(a), TernaryValidationUtils.requireTernary(b)).numericValue();
    }

    public static int not(int a) {
        return not(TernaryValidationUtils.requireTernary(a)).numericValue();
    }

    public static int eqv(int a, int b) {
        return eqv(TernaryValidationUtils.requireTernary(a), TernaryValidationUtils.requireTernary(b)).numericValue();
    }

    /**
     * Applies a binary operator.
     *
     * @param operator one of {@code AND}, {@code OR}, {@code EQV}
     * @param a        left operand
     * @param b        right operand
     * @return the combined value
     * @throws IllegalArgumentException if the operator is unary
     */
    public static TernaryValue apply(KleeneOperator operator, TernaryValue a, TernaryValue b) {
        Objects.requireNonNull(operator, "Operator cannot be null");
        Objects.requireNonNull(a, "Left operand cannot be null");
        Objects.requireNonNull(b, "Right operand cannot be null");
        return switch (operator) {
            case AND -> and(a, b);
            case OR -> or(a, b);
            case EQV -> eqv(a, b);
            case NOT -> throw new IllegalArgumentException("Operator NOT is unary and cannot combine two operands");
        };
    }
}
