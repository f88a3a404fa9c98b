package io.github.cyfko.kleene.core.model;

import java.util.Objects;

/**
 * Optimized and naive results for the same expression.
 *
 * @param optimized result of the short-circuiting walk
 * @param naive     result of the exhaustive walk
 * @author Frank KOSSI
 * @since 1.0
 */
public record ModeComparison(EvaluationResult optimized, EvaluationResult naive) {

    public ModeComparison {
        Objects.requireNonNull(optimized, "optimized");
        Objects.requireNonNull(naive, "naive");
    }

    /**
     * Both walks must agree on value and confidence, and short-circuiting may only ever save work.
     *
     * @param tolerance maximum accepted confidence difference
     */
    public boolean isConsistent(double tolerance) {
        return optimized.sameOutcome(naive, tolerance)
                && optimized.evaluationCount() <= naive.evaluationCount();
    }

    /**
     * @return atoms the optimized walk did not visit
     */
    public int savedEvaluations() {
        return naive.evaluationCount() - optimized.evaluationCount();
    }
}
