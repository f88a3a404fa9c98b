package io.github.cyfko.kleene.core.model;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ExpressionTest {

    private Expression a;
    private Expression b;
    private Expression c;

    @BeforeEach
    void setUp() {
        a = Atomic.of(1);
        b = Atomic.of(0, 0.6);
        c = Atomic.of(-1);
    }

    @Test
    @DisplayName("Should combine expressions with AND operation")
    void shouldCombineWithAnd() {
        // When
        Expression result = a.and(b);

        // Then
        Conjunction conjunction = assertInstanceOf(Conjunction.class, result);
        assertSame(a, conjunction.left());
        assertSame(b, conjunction.right());
    }

    @Test
    @DisplayName("Should combine expressions with OR operation")
    void shouldCombineWithOr() {
        // When
        Expression result = a.or(b);

        // Then
        Disjunction disjunction = assertInstanceOf(Disjunction.class, result);
        assertSame(a, disjunction.left());
        assertSame(b, disjunction.right());
    }

    @Test
    @DisplayName("Should negate expression with NOT operation")
    void shouldNegate() {
        // When
        Expression result = a.not();

        // Then
        Negation negation = assertInstanceOf(Negation.class, result);
        assertSame(a, negation.operand());
    }

    @Test
    @DisplayName("Should chain multiple operations without modifying operands")
    void shouldChainOperations() {
        // When
        Expression result = a.and(b).or(c).not();

        // Then
        assertInstanceOf(Negation.class, result);
        assertEquals("¬((T(1.00) ∧ U(0.60)) ∨ F(1.00))", result.toString());
        assertEquals("T(1.00)", a.toString());
    }

    @Test
    @DisplayName("Should handle null operands in operations")
    void shouldRejectNullOperands() {
        assertThrows(NullPointerException.class, () -> a.and(null));
        assertThrows(NullPointerException.class, () -> a.or(null));
        assertThrows(NullPointerException.class, () -> new Negation(null));
        assertThrows(NullPointerException.class, () -> new Conjunction(null, a));
    }

    @Test
    @DisplayName("Should count atoms and measure depth")
    void shouldReportTreeMetrics() {
        Expression tree = a.and(b).or(c.not());

        assertEquals(3, tree.atomCount());
        assertEquals(3, tree.depth());
        assertEquals(1, a.depth());
        assertEquals(2, a.not().depth());
        assertEquals(1, a.not().atomCount());
    }

    @Test
    @DisplayName("Should compare structurally")
    void shouldCompareStructurally() {
        assertEquals(Atomic.of(1).and(Atomic.of(0, 0.6)), a.and(b));
        assertNotEquals(a.and(b), b.and(a));
    }
}
