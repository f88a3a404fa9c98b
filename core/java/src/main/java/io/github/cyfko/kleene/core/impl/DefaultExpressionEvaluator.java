package io.github.cyfko.kleene.core.impl;

import io.github.cyfko.kleene.core.algebra.ConfidencePropagation;
import io.github.cyfko.kleene.core.algebra.KleeneAlgebra;
import io.github.cyfko.kleene.core.api.EvaluationMode;
import io.github.cyfko.kleene.core.api.ExpressionEvaluator;
import io.github.cyfko.kleene.core.api.TernaryValue;
import io.github.cyfko.kleene.core.config.EvaluatorConfig;
import io.github.cyfko.kleene.core.model.Atomic;
import io.github.cyfko.kleene.core.model.Conjunction;
import io.github.cyfko.kleene.core.model.Disjunction;
import io.github.cyfko.kleene.core.model.EvaluationResult;
import io.github.cyfko.kleene.core.model.Expression;
import io.github.cyfko.kleene.core.model.Negation;
import io.github.cyfko.kleene.core.model.PerformanceSummary;
import io.github.cyfko.kleene.core.spi.EvaluationListener;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * Default {@link ExpressionEvaluator}: a recursive walk over the four node kinds, in either
 * {@link EvaluationMode}.
 *
 * <h2>Optimized walk</h2>
 * <ul>
 *   <li><strong>Atom:</strong> its own value and confidence, one evaluation</li>
 *   <li><strong>Conjunction:</strong> left first; a {@code FALSE} left returns
 *       {@code (FALSE, 1.0, left count)} without visiting the right operand. Otherwise
 *       {@code min}, confidence {@code 1.0} if the result is {@code FALSE} else the product,
 *       counts summed</li>
 *   <li><strong>Disjunction:</strong> symmetric on {@code TRUE}, confidence
 *       {@code 1 − (1 − l)(1 − r)} unless the result is {@code TRUE}</li>
 *   <li><strong>Negation:</strong> {@code -value}, same confidence, same count</li>
 * </ul>
 *
 * <h2>Naive walk</h2>
 * <p>
 * Same formulas, both operands always visited. The optimized count never exceeds the naive
 * count, and value and confidence are identical in both modes.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public class DefaultExpressionEvaluator implements ExpressionEvaluator {

    private static final Logger log = Logger.getLogger(DefaultExpressionEvaluator.class.getName());

    private final EvaluatorConfig config;
    private final EvaluationListener listener;
    private final EvaluatorStats stats = new EvaluatorStats();

    public DefaultExpressionEvaluator() {
        this(EvaluatorConfig.defaults());
    }

    public DefaultExpressionEvaluator(EvaluatorConfig config) {
        this.config = Objects.requireNonNull(config, "EvaluatorConfig cannot be null");
        this.listener = config.getListener();
    }

    @Override
    public EvaluationResult evaluate(Expression expression, EvaluationMode mode) {
        Objects.requireNonNull(expression, "Expression cannot be null");
        Objects.requireNonNull(mode, "EvaluationMode cannot be null");

        long start = System.nanoTime();
        EvaluationResult result = mode == EvaluationMode.OPTIMIZED ? optimized(expression) : naive(expression);
        long elapsed = System.nanoTime() - start;

        stats.record(mode, result.evaluationCount(), elapsed);
        listener.onEvaluationCompleted(expression, mode, result);

        log.fine(() -> String.format(
                "Evaluated %d-atom expression in %s mode: %s in %d ns",
                expression.atomCount(), mode, result, elapsed
        ));
        return result;
    }

    @Override
    public EvaluationResult evaluate(Expression expression) {
        return evaluate(expression, config.getDefaultMode());
    }

    @Override
    public PerformanceSummary summary() {
        return stats.snapshot();
    }

    @Override
    public void reset() {
        stats.reset();
        log.fine("Evaluator statistics reset");
    }

    /**
     * @return the live counters of this evaluator
     */
    public EvaluatorStats getStats() {
        return stats;
    }

    private EvaluationResult optimized(Expression expression) {
        if (expression instanceof Atomic atom) {
            return visit(atom, EvaluationMode.OPTIMIZED);
        }
        if (expression instanceof Conjunction conjunction) {
            EvaluationResult left = optimized(conjunction.left());
            if (left.value() == TernaryValue.FALSE) {
                listener.onShortCircuit(conjunction, conjunction.right());
                return new EvaluationResult(TernaryValue.FALSE, ConfidencePropagation.CERTAIN, left.evaluationCount());
            }
            return combineConjunction(left, optimized(conjunction.right()));
        }
        if (expression instanceof Disjunction disjunction) {
            EvaluationResult left = optimized(disjunction.left());
            if (left.value() == TernaryValue.TRUE) {
                listener.onShortCircuit(disjunction, disjunction.right());
                return new EvaluationResult(TernaryValue.TRUE, ConfidencePropagation.CERTAIN, left.evaluationCount());
            }
            return combineDisjunction(left, optimized(disjunction.right()));
        }
        if (expression instanceof Negation negation) {
            return negate(optimized(negation.operand()));
        }
        throw new IllegalStateException("Unsupported expression node: " + expression.getClass().getName());
    }

    private EvaluationResult naive(Expression expression) {
        if (expression instanceof Atomic atom) {
            return visit(atom, EvaluationMode.NAIVE);
        }
        if (expression instanceof Conjunction conjunction) {
            EvaluationResult left = naive(conjunction.left());
            EvaluationResult right = naive(conjunction.right());
            return combineConjunction(left, right);
        }
        if (expression instanceof Disjunction disjunction) {
            EvaluationResult left = naive(disjunction.left());
            EvaluationResult right = naive(disjunction.right());
            return combineDisjunction(left, right);
        }
        if (expression instanceof Negation negation) {
            return negate(naive(negation.operand()));
        }
        throw new IllegalStateException("Unsupported expression node: " + expression.getClass().getName());
    }

    private EvaluationResult visit(Atomic atom, EvaluationMode mode) {
        listener.onAtomEvaluated(atom, mode);
        return new EvaluationResult(atom.value(), atom.confidence(), 1);
    }

    private static EvaluationResult combineConjunction(EvaluationResult left, EvaluationResult right) {
        TernaryValue value = KleeneAlgebra.and(left.value(), right.value());
        double confidence = ConfidencePropagation.conjunction(value, left.confidence(), right.confidence());
        return new EvaluationResult(value, confidence, left.evaluationCount() + right.evaluationCount());
    }

    private static EvaluationResult combineDisjunction(EvaluationResult left, EvaluationResult right) {
        TernaryValue value = KleeneAlgebra.or(left.value(), right.value());
        double confidence = ConfidencePropagation.disjunction(value, left.confidence(), right.confidence());
        return new EvaluationResult(value, confidence, left.evaluationCount() + right.evaluationCount());
    }

    private static EvaluationResult negate(EvaluationResult operand) {
        return new EvaluationResult(
                KleeneAlgebra.not(operand.value()),
                ConfidencePropagation.not(operand.confidence()),
                operand.evaluationCount()
        );
    }
}
