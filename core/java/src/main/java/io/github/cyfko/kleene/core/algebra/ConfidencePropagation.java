package io.github.cyfko.kleene.core.algebra;

import io.github.cyfko.kleene.core.api.TernaryValue;
import io.github.cyfko.kleene.core.utils.TernaryValidationUtils;

import java.util.List;

/**
 * Confidence arithmetic shared by the tree evaluator and the flat-sequence evaluator.
 * <ul>
 *   <li>AND: product of all confidences (every conjunct must hold)</li>
 *   <li>OR: {@code 1 − Π(1 − cᵢ)} (any disjunct suffices)</li>
 *   <li>NOT: identity</li>
 *   <li>EQV: product of both confidences</li>
 * </ul>
 * <p>
 * List arguments must be non-empty and every element must lie in {@code [0, 1]}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public final class ConfidencePropagation {

    /** Confidence attached to a definite result reached through a dominating operand. */
    public static final double CERTAIN = 1.0;

    private ConfidencePropagation() {}

    public static double and(List<Double> confidences) {
        TernaryValidationUtils.requireConfidenceSet(confidences);
        double result = 1.0;
        for (double c : confidences) {
            result *= c;
        }
        return result;
    }

    public static double or(List<Double> confidences) {
        TernaryValidationUtils.requireConfidenceSet(confidences);
        double complement = 1.0;
        for (double c : confidences) {
            complement *= (1.0 - c);
        }
        return 1.0 - complement;
    }

    public static double not(double confidence) {
        return TernaryValidationUtils.requireConfidence(confidence);
    }

    public static double and(double left, double right) {
        TernaryValidationUtils.requireConfidence(left);
        TernaryValidationUtils.requireConfidence(right);
        return left * right;
    }

    public static double or(double left, double right) {
        TernaryValidationUtils.requireConfidence(left);
        TernaryValidationUtils.requireConfidence(right);
        return 1.0 - (1.0 - left) * (1.0 - right);
    }

    public static double eqv(double left, double right) {
        return and(left, right);
    }

    /**
     * Confidence of a binary conjunction node: {@link #CERTAIN} when the combined value is
     * {@code FALSE}, otherwise the product of the operand confidences.
     */
    public static double conjunction(TernaryValue combined, double left, double right) {
        double product = and(left, right);
        return combined == TernaryValue.FALSE ? CERTAIN : product;
    }

    /**
     * Confidence of a binary disjunction node: {@link #CERTAIN} when the combined value is
     * {@code TRUE}, otherwise {@code 1 − (1 − left)(1 − right)}.
     */
    public static double disjunction(TernaryValue combined, double left, double right) {
        double union = or(left, right);
        return combined == TernaryValue.TRUE ? CERTAIN : union;
    }
}
