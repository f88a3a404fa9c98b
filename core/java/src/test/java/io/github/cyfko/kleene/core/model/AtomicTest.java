package io.github.cyfko.kleene.core.model;

import io.github.cyfko.kleene.core.api.TernaryValue;
import io.github.cyfko.kleene.core.exception.KleeneValidationException;
import io.github.cyfko.kleene.core.exception.ValidationErrorKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Atomic Tests")
class AtomicTest {

    @Test
    @DisplayName("Should default UNKNOWN to 0.5 and definite values to 1.0")
    void shouldApplyDefaultConfidences() {
        assertEquals(0.5, Atomic.of(TernaryValue.UNKNOWN).confidence());
        assertEquals(1.0, Atomic.of(TernaryValue.TRUE).confidence());
        assertEquals(1.0, Atomic.of(-1).confidence());
    }

    @Test
    @DisplayName("Should accept UNKNOWN with any confidence in range")
    void shouldAcceptUnknownWithConfidence() {
        Atomic atom = Atomic.of(0, 0.6);

        assertEquals(TernaryValue.UNKNOWN, atom.value());
        assertEquals(0.6, atom.confidence());
        assertEquals(0.0, Atomic.of(0, 0.0).confidence());
        assertEquals(1.0, Atomic.of(0, 1.0).confidence());
    }

    @Test
    @DisplayName("Should reject raw value 2")
    void shouldRejectInvalidRawValue() {
        KleeneValidationException ex = assertThrows(KleeneValidationException.class, () -> Atomic.of(2));
        assertEquals(ValidationErrorKind.INVALID_TERNARY_VALUE, ex.getErrorKind());

        KleeneValidationException withConfidence = assertThrows(KleeneValidationException.class, () -> Atomic.of(2, 0.5));
        assertEquals(ValidationErrorKind.INVALID_TERNARY_VALUE, withConfidence.getErrorKind());
    }

    @ParameterizedTest
    @ValueSource(doubles = {1.5, -0.01, Double.NaN, Double.NEGATIVE_INFINITY})
    @DisplayName("Should reject confidences outside [0, 1]")
    void shouldRejectOutOfRangeConfidence(double confidence) {
        KleeneValidationException ex = assertThrows(KleeneValidationException.class, () -> Atomic.of(0, confidence));
        assertEquals(ValidationErrorKind.INVALID_CONFIDENCE, ex.getErrorKind());
    }

    @Test
    @DisplayName("Should reject a TRUE atom with confidence 0.5")
    void shouldRejectUncertainDefiniteAtom() {
        KleeneValidationException ex = assertThrows(KleeneValidationException.class,
                () -> Atomic.of(TernaryValue.TRUE, 0.5));
        assertEquals(ValidationErrorKind.INVALID_DEFINITE_CONFIDENCE, ex.getErrorKind());

        assertThrows(KleeneValidationException.class, () -> new Atomic(TernaryValue.FALSE, 0.99));
    }

    @Test
    @DisplayName("Should report the definite-value rule first for a definite atom out of range")
    void shouldReportDefinitenessBeforeRange() {
        KleeneValidationException aboveRange = assertThrows(KleeneValidationException.class,
                () -> Atomic.of(TernaryValue.TRUE, 1.5));
        assertEquals(ValidationErrorKind.INVALID_DEFINITE_CONFIDENCE, aboveRange.getErrorKind());

        KleeneValidationException notANumber = assertThrows(KleeneValidationException.class,
                () -> Atomic.of(TernaryValue.FALSE, Double.NaN));
        assertEquals(ValidationErrorKind.INVALID_DEFINITE_CONFIDENCE, notANumber.getErrorKind());

        KleeneValidationException unknown = assertThrows(KleeneValidationException.class,
                () -> Atomic.of(TernaryValue.UNKNOWN, 1.5));
        assertEquals(ValidationErrorKind.INVALID_CONFIDENCE, unknown.getErrorKind());
    }

    @Test
    @DisplayName("Should reject null values")
    void shouldRejectNullValue() {
        assertThrows(NullPointerException.class, () -> new Atomic(null, 0.5));
        assertThrows(NullPointerException.class, () -> Atomic.of((TernaryValue) null));
    }

    @Test
    @DisplayName("Should render as symbol with two-decimal confidence")
    void shouldRender() {
        assertEquals("U(0.60)", Atomic.of(0, 0.6).toString());
        assertEquals("T(1.00)", Atomic.of(1).toString());
    }

    @Test
    @DisplayName("Should have value semantics")
    void shouldHaveValueSemantics() {
        assertEquals(Atomic.of(0, 0.3), Atomic.of(TernaryValue.UNKNOWN, 0.3));
        assertEquals(Atomic.of(1).hashCode(), Atomic.of(TernaryValue.TRUE, 1.0).hashCode());
    }
}
