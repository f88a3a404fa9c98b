package io.github.cyfko.kleene.core.algebra;

import io.github.cyfko.kleene.core.api.TernaryValue;
import io.github.cyfko.kleene.core.exception.KleeneValidationException;
import io.github.cyfko.kleene.core.exception.ValidationErrorKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ConfidencePropagation Tests")
class ConfidencePropagationTest {

    private static final double EPSILON = 1e-9;

    @Test
    @DisplayName("AND confidence should be the product of all elements")
    void andShouldMultiply() {
        assertEquals(0.504, ConfidencePropagation.and(List.of(0.9, 0.8, 0.7)), EPSILON);
        assertEquals(0.42, ConfidencePropagation.and(0.6, 0.7), EPSILON);
        assertEquals(0.8, ConfidencePropagation.and(List.of(0.8)), EPSILON);
    }

    @Test
    @DisplayName("OR confidence should be one minus the product of complements")
    void orShouldUseComplements() {
        assertEquals(0.994, ConfidencePropagation.or(List.of(0.9, 0.8, 0.7)), EPSILON);
        assertEquals(0.76, ConfidencePropagation.or(0.4, 0.6), EPSILON);
    }

    @Test
    @DisplayName("NOT confidence should be the identity")
    void notShouldBeIdentity() {
        assertEquals(0.37, ConfidencePropagation.not(0.37));
    }

    @Test
    @DisplayName("EQV confidence should be the product of both sides")
    void eqvShouldMultiply() {
        assertEquals(0.3, ConfidencePropagation.eqv(0.5, 0.6), EPSILON);
    }

    @Test
    @DisplayName("Chained AND confidence should decay geometrically")
    void chainedAndShouldDecay() {
        List<Double> tenReadings = Collections.nCopies(10, 0.8);
        assertEquals(Math.pow(0.8, 10), ConfidencePropagation.and(tenReadings), EPSILON);
        assertEquals(0.1074, ConfidencePropagation.and(tenReadings), 1e-4);
    }

    @Test
    @DisplayName("FALSE conjunction and TRUE disjunction should be certain")
    void dominatingResultsShouldBeCertain() {
        assertEquals(1.0, ConfidencePropagation.conjunction(TernaryValue.FALSE, 0.5, 1.0));
        assertEquals(0.3, ConfidencePropagation.conjunction(TernaryValue.UNKNOWN, 0.5, 0.6), EPSILON);

        assertEquals(1.0, ConfidencePropagation.disjunction(TernaryValue.TRUE, 0.2, 1.0));
        assertEquals(0.8, ConfidencePropagation.disjunction(TernaryValue.UNKNOWN, 0.5, 0.6), EPSILON);
    }

    @Test
    @DisplayName("Should reject empty confidence sets")
    void shouldRejectEmptySets() {
        KleeneValidationException andEx = assertThrows(KleeneValidationException.class,
                () -> ConfidencePropagation.and(List.of()));
        assertEquals(ValidationErrorKind.EMPTY_CONFIDENCE_SET, andEx.getErrorKind());

        KleeneValidationException orEx = assertThrows(KleeneValidationException.class,
                () -> ConfidencePropagation.or(List.of()));
        assertEquals(ValidationErrorKind.EMPTY_CONFIDENCE_SET, orEx.getErrorKind());
    }

    @Test
    @DisplayName("Should reject confidences outside [0, 1]")
    void shouldRejectOutOfRangeConfidences() {
        KleeneValidationException ex = assertThrows(KleeneValidationException.class,
                () -> ConfidencePropagation.and(List.of(0.5, 1.5)));
        assertEquals(ValidationErrorKind.INVALID_CONFIDENCE, ex.getErrorKind());

        assertThrows(KleeneValidationException.class, () -> ConfidencePropagation.or(-0.1, 0.5));
        assertThrows(KleeneValidationException.class, () -> ConfidencePropagation.not(Double.NaN));
        assertThrows(KleeneValidationException.class, () -> ConfidencePropagation.and(0.5, Double.POSITIVE_INFINITY));
    }

    @Test
    @DisplayName("Should reject null lists and null elements")
    void shouldRejectNulls() {
        assertThrows(NullPointerException.class, () -> ConfidencePropagation.and(null));
        assertThrows(NullPointerException.class, () -> ConfidencePropagation.or(Arrays.asList(0.5, null)));
    }
}
