package io.github.cyfko.kleene.core.spi;

import io.github.cyfko.kleene.core.api.EvaluationMode;
import io.github.cyfko.kleene.core.model.Atomic;
import io.github.cyfko.kleene.core.model.EvaluationResult;
import io.github.cyfko.kleene.core.model.Expression;

/**
 * Observer notified while an evaluator walks an expression tree.
 * <p>
 * Listeners see the walk exactly as it happens: an atom that an optimized walk skips never
 * reaches {@link #onAtomEvaluated}, while the skipped subtree is reported once through
 * {@link #onShortCircuit}. Listeners cannot influence results.
 * </p>
 *
 * <p><strong>Example: tracing a walk</strong></p>
 * <pre>{@code
 * EvaluationListener tracer = new EvaluationListener() {
 *     @Override
 *     public void onAtomEvaluated(Atomic atom, EvaluationMode mode) {
 *         System.out.println(mode + " visited " + atom);
 *     }
 * };
 *
 * ExpressionEvaluator evaluator = new DefaultExpressionEvaluator(
 *     EvaluatorConfig.builder().listener(tracer).build());
 * }</pre>
 *
 * <p>All methods default to no-ops. Implementations should be fast and must not throw.</p>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public interface EvaluationListener {

    /** Listener that ignores every notification. */
    EvaluationListener NONE = new EvaluationListener() {};

    /**
     * Called for every atom visited.
     *
     * @param atom the visited leaf
     * @param mode the mode of the current walk
     */
    default void onAtomEvaluated(Atomic atom, EvaluationMode mode) {}

    /**
     * Called when an optimized walk skips the right operand of a binary node.
     *
     * @param node    the conjunction or disjunction that short-circuited
     * @param skipped the right operand that was not visited
     */
    default void onShortCircuit(Expression node, Expression skipped) {}

    /**
     * Called once per top-level evaluation, after the walk completes.
     *
     * @param expression the evaluated root
     * @param mode       the mode used
     * @param result     the result returned to the caller
     */
    default void onEvaluationCompleted(Expression expression, EvaluationMode mode, EvaluationResult result) {}
}
