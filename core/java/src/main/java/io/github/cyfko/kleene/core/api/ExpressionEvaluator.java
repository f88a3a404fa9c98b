package io.github.cyfko.kleene.core.api;

import io.github.cyfko.kleene.core.exception.KleeneValidationException;
import io.github.cyfko.kleene.core.model.EvaluationResult;
import io.github.cyfko.kleene.core.model.Expression;
import io.github.cyfko.kleene.core.model.ModeComparison;
import io.github.cyfko.kleene.core.model.PerformanceSummary;

/**
 * Evaluates Kleene expression trees and keeps per-instance instrumentation.
 * <p>
 * Both {@link EvaluationMode}s compute the same value and confidence for any tree; they only
 * differ in how many atoms they visit. Every call to {@link #evaluate(Expression, EvaluationMode)}
 * adds its evaluation count and elapsed time to the counters of its mode until {@link #reset()}.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * ExpressionEvaluator evaluator = new DefaultExpressionEvaluator();
 *
 * Expression expr = Expressions.atom(-1).and(Expressions.atom(0, 0.6).or(Expressions.atom(1)));
 *
 * EvaluationResult fast = evaluator.evaluate(expr, EvaluationMode.OPTIMIZED); // 1 evaluation
 * EvaluationResult slow = evaluator.evaluate(expr, EvaluationMode.NAIVE);     // 3 evaluations
 *
 * PerformanceSummary summary = evaluator.summary();
 * summary.evaluationReduction();  // (3 - 1) / 3
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * Implementations hold mutable counters and are not thread-safe. Use one evaluator per
 * benchmarking session or synchronize externally.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public interface ExpressionEvaluator {

    /**
     * Evaluates an expression in the given mode and records the run in the instrumentation.
     *
     * @param expression the root of the tree
     * @param mode       the walking strategy
     * @return value, propagated confidence and number of atoms visited
     * @throws NullPointerException      if expression or mode is null
     * @throws KleeneValidationException if a propagated confidence leaves {@code [0, 1]}
     */
    EvaluationResult evaluate(Expression expression, EvaluationMode mode);

    /**
     * Evaluates an expression in the evaluator's default mode.
     */
    EvaluationResult evaluate(Expression expression);

    /**
     * Evaluates an expression in both modes, recording both runs.
     *
     * @return the optimized and naive results side by side
     */
    default ModeComparison compare(Expression expression) {
        EvaluationResult optimized = evaluate(expression, EvaluationMode.OPTIMIZED);
        EvaluationResult naive = evaluate(expression, EvaluationMode.NAIVE);
        return new ModeComparison(optimized, naive);
    }

    /**
     * @return a snapshot of the counters accumulated since construction or the last reset
     */
    PerformanceSummary summary();

    /**
     * Clears all counters and timers.
     */
    void reset();
}
