package io.github.cyfko.kleene.core.api;

/**
 * Strategy used to walk an expression tree.
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public enum EvaluationMode {

    /**
     * Short-circuits conjunctions on a {@code FALSE} left operand and disjunctions on a
     * {@code TRUE} left operand; the skipped subtree is never visited.
     */
    OPTIMIZED,

    /**
     * Always visits both operands of every binary node. Serves as the reference baseline
     * for {@link #OPTIMIZED}.
     */
    NAIVE
}
