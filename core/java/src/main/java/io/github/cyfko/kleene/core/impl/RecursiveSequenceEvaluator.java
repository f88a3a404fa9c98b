package io.github.cyfko.kleene.core.impl;

import io.github.cyfko.kleene.core.algebra.ConfidencePropagation;
import io.github.cyfko.kleene.core.algebra.KleeneAlgebra;
import io.github.cyfko.kleene.core.api.KleeneOperator;
import io.github.cyfko.kleene.core.api.TernaryValue;
import io.github.cyfko.kleene.core.exception.KleeneValidationException;
import io.github.cyfko.kleene.core.model.SequenceResult;
import io.github.cyfko.kleene.core.utils.TernaryValidationUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Folds a single Kleene operator over a flat sequence of values, optionally tracking confidence.
 * <p>
 * The fold is right-associative: {@code op(head, fold(tail))}. At every level the head of the
 * current sub-sequence is checked first:
 * </p>
 * <ul>
 *   <li>AND with a {@code FALSE} head returns {@code FALSE} with the AND-confidence of the whole
 *       remaining sub-sequence</li>
 *   <li>OR with a {@code TRUE} head returns {@code TRUE} with the OR-confidence of the whole
 *       remaining sub-sequence</li>
 * </ul>
 * <p>
 * Only the head is inspected; a dominating value further down is found when the fold
 * reaches it. A one-element sequence returns that element as is. The fold runs in a loop, so
 * sequence length is not bounded by the call stack.
 * </p>
 *
 * <p><b>Example usage:</b></p>
 * <pre>{@code
 * SequenceResult r = RecursiveSequenceEvaluator.recursiveTernary(
 *     KleeneOperator.AND, new int[]{1, 0, -1}, new double[]{0.9, 0.8, 0.7});
 * // r.value() == FALSE, r.confidence() == 0.504
 * }</pre>
 *
 * <p>This class is designed to be used statically and cannot be instantiated.</p>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public final class RecursiveSequenceEvaluator {

    private static final Logger log = Logger.getLogger(RecursiveSequenceEvaluator.class.getName());

    private RecursiveSequenceEvaluator() {}

    /**
     * Folds {@code operator} over {@code values} without confidence tracking.
     *
     * @see #recursiveTernary(KleeneOperator, List, List)
     */
    public static SequenceResult recursiveTernary(KleeneOperator operator, List<TernaryValue> values) {
        return recursiveTernary(operator, values, null);
    }

    /**
     * Folds {@code operator} over {@code values}, pairing each value with the confidence at the
     * same position.
     *
     * @param operator    {@code AND}, {@code OR} or {@code EQV}
     * @param values      the ternary values, non-empty
     * @param confidences one confidence per value, or {@code null} to disable confidence tracking
     * @return the folded value, with a confidence only when {@code confidences} was given
     * @throws IllegalArgumentException  if the operator is unary
     * @throws KleeneValidationException if the sequence is empty, lengths differ or a confidence
     *                                   is out of range
     * @throws NullPointerException      if operator, values or one of their elements is null
     */
    public static SequenceResult recursiveTernary(KleeneOperator operator, List<TernaryValue> values, List<Double> confidences) {
        Objects.requireNonNull(operator, "Operator cannot be null");
        Objects.requireNonNull(values, "Values cannot be null");
        if (!operator.isBinary()) {
            throw new IllegalArgumentException("Operator " + operator.name() + " cannot be folded over a sequence");
        }
        TernaryValidationUtils.requireSequenceShape(values.size(), confidences == null ? -1 : confidences.size());
        for (TernaryValue value : values) {
            Objects.requireNonNull(value, "Values cannot contain null elements");
        }
        if (confidences != null) {
            TernaryValidationUtils.requireConfidenceSet(confidences);
        }
        return fold(operator, values, confidences);
    }

    /**
     * Raw form of {@link #recursiveTernary(KleeneOperator, List, List)}: every integer is
     * validated against {@code {-1, 0, 1}} before folding.
     *
     * @param confidences one confidence per value, or {@code null} to disable confidence tracking
     */
    public static SequenceResult recursiveTernary(KleeneOperator operator, int[] values, double[] confidences) {
        Objects.requireNonNull(values, "Values cannot be null");
        List<TernaryValue> ternaries = new ArrayList<>(values.length);
        for (int raw : values) {
            ternaries.add(TernaryValidationUtils.requireTernary(raw));
        }
        List<Double> boxed = null;
        if (confidences != null) {
            boxed = new ArrayList<>(confidences.length);
            for (double c : confidences) {
                boxed.add(c);
            }
        }
        return recursiveTernary(operator, ternaries, boxed);
    }

    /**
     * Evaluates {@code op(head, fold(tail))} without recursion. Folding stops at the
     * first position whose head dominates the operator, so that position is located first and
     * the remaining heads are then combined right to left onto its result.
     */
    private static SequenceResult fold(KleeneOperator operator, List<TernaryValue> values, List<Double> confidences) {
        boolean tracked = confidences != null;
        int last = values.size() - 1;

        int stop = last;
        for (int i = 0; i < last; i++) {
            if (dominates(operator, values.get(i))) {
                stop = i;
                break;
            }
        }

        SequenceResult acc;
        if (stop == last) {
            TernaryValue value = values.get(last);
            acc = tracked ? SequenceResult.tracked(value, confidences.get(last)) : SequenceResult.untracked(value);
        } else {
            int from = stop;
            log.finer(() -> String.format("%s fold stopped on %s head at index %d of %d",
                    operator, values.get(from), from, values.size()));
            acc = tracked ? earlyExit(operator, confidences.subList(from, confidences.size()))
                    : SequenceResult.untracked(values.get(from));
        }

        for (int i = stop - 1; i >= 0; i--) {
            acc = combine(operator, values.get(i), tracked ? confidences.get(i) : Double.NaN, acc);
        }
        return acc;
    }

    private static boolean dominates(KleeneOperator operator, TernaryValue head) {
        return (operator == KleeneOperator.AND && head == TernaryValue.FALSE)
                || (operator == KleeneOperator.OR && head == TernaryValue.TRUE);
    }

    private static SequenceResult earlyExit(KleeneOperator operator, List<Double> remaining) {
        return operator == KleeneOperator.AND
                ? SequenceResult.tracked(TernaryValue.FALSE, ConfidencePropagation.and(remaining))
                : SequenceResult.tracked(TernaryValue.TRUE, ConfidencePropagation.or(remaining));
    }

    private static SequenceResult combine(KleeneOperator operator, TernaryValue head, double headConfidence, SequenceResult tail) {
        TernaryValue value = KleeneAlgebra.apply(operator, head, tail.value());
        if (!tail.isConfidenceTracked()) {
            return SequenceResult.untracked(value);
        }

        double tailConfidence = tail.confidence().getAsDouble();
        double confidence = switch (operator) {
            case AND -> ConfidencePropagation.and(List.of(headConfidence, tailConfidence));
            case OR -> ConfidencePropagation.or(List.of(headConfidence, tailConfidence));
            case EQV -> ConfidencePropagation.eqv(headConfidence, tailConfidence);
            case NOT -> throw new IllegalStateException("NOT rejected before folding");
        };
        return SequenceResult.tracked(value, confidence);
    }
}
