package io.github.cyfko.kleene.core.model;

/**
 * An immutable node of a Kleene expression tree.
 * <p>
 * The set of node kinds is closed: {@link Atomic}, {@link Conjunction}, {@link Disjunction}
 * and {@link Negation}. Evaluators dispatch over exactly these four kinds.
 * </p>
 *
 * <h2>Composition</h2>
 * <pre>{@code
 * Expression sensorA = Expressions.atom(1);          // TRUE, confidence 1.0
 * Expression sensorB = Expressions.atom(0, 0.6);     // UNKNOWN, confidence 0.6
 * Expression sensorC = Expressions.atom(0, 0.7);
 *
 * // (A ∧ B) ∨ ¬C
 * Expression expr = sensorA.and(sensorB).or(sensorC.not());
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * Nodes are records with final fields and can be shared freely between threads and between
 * trees. Each combinator returns a new node and leaves its operands untouched.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public sealed interface Expression permits Atomic, Conjunction, Disjunction, Negation {

    /**
     * @param other right operand
     * @return a new node representing {@code (this ∧ other)}
     * @throws NullPointerException if other is null
     */
    default Expression and(Expression other) {
        return new Conjunction(this, other);
    }

    /**
     * @param other right operand
     * @return a new node representing {@code (this ∨ other)}
     * @throws NullPointerException if other is null
     */
    default Expression or(Expression other) {
        return new Disjunction(this, other);
    }

    /**
     * @return a new node representing {@code ¬this}
     */
    default Expression not() {
        return new Negation(this);
    }

    /**
     * @return the number of atomic leaves in this tree
     */
    int atomCount();

    /**
     * @return the height of this tree, {@code 1} for a single atom
     */
    int depth();
}
