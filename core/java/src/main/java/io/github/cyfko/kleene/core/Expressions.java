package io.github.cyfko.kleene.core;

import io.github.cyfko.kleene.core.api.KleeneOperator;
import io.github.cyfko.kleene.core.api.TernaryValue;
import io.github.cyfko.kleene.core.exception.KleeneValidationException;
import io.github.cyfko.kleene.core.model.Atomic;
import io.github.cyfko.kleene.core.model.Conjunction;
import io.github.cyfko.kleene.core.model.Disjunction;
import io.github.cyfko.kleene.core.model.Expression;
import io.github.cyfko.kleene.core.model.Negation;
import io.github.cyfko.kleene.core.utils.TernaryValidationUtils;

import java.util.Objects;

/**
 * High-level construction API for expression trees.
 * <p>
 * Atoms are validated when they are built: a raw value outside {@code {-1, 0, 1}}, a confidence
 * outside {@code [0, 1]} or a definite atom with a confidence other than {@code 1.0} is rejected
 * with {@link KleeneValidationException} before any tree exists.
 * </p>
 *
 * <p><strong>Complete Usage Example:</strong></p>
 * <pre>{@code
 * import static io.github.cyfko.kleene.core.Expressions.*;
 *
 * // ¬(A ∧ B) ∨ C
 * Expression expr = or(not(and(atom(1), atom(0, 0.6))), atom(0, 0.7));
 *
 * // Left-leaning chain ((s1 ∧ s2) ∧ s3) from raw sensor readings
 * Expression fused = chain(KleeneOperator.AND,
 *     new int[]{1, 0, 1},
 *     new double[]{1.0, 0.8, 1.0});
 *
 * EvaluationResult result = new DefaultExpressionEvaluator().evaluate(fused);
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public final class Expressions {

    private Expressions() {}

    /**
     * @param raw {@code -1}, {@code 0} or {@code 1}
     * @return an atom with the default confidence for its value
     */
    public static Expression atom(int raw) {
        return Atomic.of(raw);
    }

    public static Expression atom(int raw, double confidence) {
        return Atomic.of(raw, confidence);
    }

    public static Expression atom(TernaryValue value) {
        return Atomic.of(value);
    }

    public static Expression atom(TernaryValue value, double confidence) {
        return Atomic.of(value, confidence);
    }

    public static Expression and(Expression left, Expression right) {
        return new Conjunction(left, right);
    }

    public static Expression or(Expression left, Expression right) {
        return new Disjunction(left, right);
    }

    public static Expression not(Expression operand) {
        return new Negation(operand);
    }

    /**
     * Builds a left-leaning chain of {@code operator} over atoms built from parallel arrays,
     * e.g. {@code ((a₀ ∧ a₁) ∧ a₂)} for AND.
     *
     * @param operator    {@code AND}, {@code OR}, or {@code NOT} (exactly one value)
     * @param values      raw ternary values
     * @param confidences one confidence per value
     * @return the root of the chain
     * @throws KleeneValidationException if values is empty, lengths differ, or an atom is invalid
     * @throws IllegalArgumentException  for {@code NOT} with more than one value, or for {@code EQV},
     *                                   which has no tree node
     */
    public static Expression chain(KleeneOperator operator, int[] values, double[] confidences) {
        Objects.requireNonNull(operator, "Operator cannot be null");
        Objects.requireNonNull(values, "Values cannot be null");
        Objects.requireNonNull(confidences, "Confidences cannot be null");
        TernaryValidationUtils.requireSequenceShape(values.length, confidences.length);

        Expression[] atoms = new Expression[values.length];
        for (int i = 0; i < values.length; i++) {
            atoms[i] = Atomic.of(values[i], confidences[i]);
        }

        switch (operator) {
            case AND, OR -> {
                Expression root = atoms[0];
                for (int i = 1; i < atoms.length; i++) {
                    root = operator == KleeneOperator.AND ? and(root, atoms[i]) : or(root, atoms[i]);
                }
                return root;
            }
            case NOT -> {
                if (atoms.length != 1) {
                    throw new IllegalArgumentException("NOT operator requires exactly one value, got " + atoms.length);
                }
                return not(atoms[0]);
            }
            default -> throw new IllegalArgumentException("Operator " + operator.name() + " has no expression node");
        }
    }
}
