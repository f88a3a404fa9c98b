package io.github.cyfko.kleene.core.model;

import io.github.cyfko.kleene.core.api.TernaryValue;
import io.github.cyfko.kleene.core.utils.TernaryValidationUtils;

import java.util.Locale;
import java.util.Objects;

/**
 * Outcome of evaluating an expression tree.
 *
 * @param value           the resulting truth value
 * @param confidence      the propagated confidence, checked against {@code [0, 1]} at construction
 * @param evaluationCount number of atoms actually visited
 * @author Frank KOSSI
 * @since 1.0
 */
public record EvaluationResult(TernaryValue value, double confidence, int evaluationCount) {

    public EvaluationResult {
        Objects.requireNonNull(value, "Ternary value cannot be null");
        TernaryValidationUtils.requireConfidence(confidence);
        if (evaluationCount < 0) {
            throw new IllegalArgumentException("evaluationCount must be non-negative, got: " + evaluationCount);
        }
    }

    /**
     * Whether this result agrees with another one on value and, within {@code tolerance}, on
     * confidence. Evaluation counts are ignored.
     */
    public boolean sameOutcome(EvaluationResult other, double tolerance) {
        Objects.requireNonNull(other, "Other result cannot be null");
        return value == other.value && Math.abs(confidence - other.confidence) <= tolerance;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "%s (conf: %.4f, evals: %d)", value, confidence, evaluationCount);
    }
}
