package io.github.cyfko.kleene.core.model;

import io.github.cyfko.kleene.core.api.TernaryValue;
import io.github.cyfko.kleene.core.exception.KleeneValidationException;
import io.github.cyfko.kleene.core.exception.ValidationErrorKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Result Model Tests")
class EvaluationResultTest {

    @Test
    @DisplayName("Should fail construction on out-of-range confidence instead of clamping")
    void shouldRejectOutOfRangeConfidence() {
        KleeneValidationException ex = assertThrows(KleeneValidationException.class,
                () -> new EvaluationResult(TernaryValue.UNKNOWN, 1.0000001, 1));
        assertEquals(ValidationErrorKind.INVALID_CONFIDENCE, ex.getErrorKind());
    }

    @Test
    @DisplayName("Should reject negative evaluation counts")
    void shouldRejectNegativeCount() {
        assertThrows(IllegalArgumentException.class, () -> new EvaluationResult(TernaryValue.TRUE, 1.0, -1));
    }

    @Test
    @DisplayName("Should compare outcomes within tolerance and ignore counts")
    void shouldCompareOutcomes() {
        EvaluationResult r1 = new EvaluationResult(TernaryValue.UNKNOWN, 0.42, 2);
        EvaluationResult r2 = new EvaluationResult(TernaryValue.UNKNOWN, 0.42 + 1e-12, 7);
        EvaluationResult r3 = new EvaluationResult(TernaryValue.FALSE, 0.42, 2);

        assertTrue(r1.sameOutcome(r2, 1e-9));
        assertFalse(r1.sameOutcome(r3, 1e-9));
    }

    @Test
    @DisplayName("Mode comparison should flag inconsistent pairs")
    void modeComparisonShouldCheckConsistency() {
        EvaluationResult optimized = new EvaluationResult(TernaryValue.FALSE, 1.0, 1);
        EvaluationResult naive = new EvaluationResult(TernaryValue.FALSE, 1.0, 4);

        ModeComparison ok = new ModeComparison(optimized, naive);
        assertTrue(ok.isConsistent(1e-9));
        assertEquals(3, ok.savedEvaluations());

        ModeComparison reversed = new ModeComparison(naive, optimized);
        assertFalse(reversed.isConsistent(1e-9));
    }

    @Test
    @DisplayName("Sequence result should distinguish tracked and untracked confidence")
    void sequenceResultShouldTrackConfidenceOptionally() {
        SequenceResult untracked = SequenceResult.untracked(TernaryValue.TRUE);
        SequenceResult tracked = SequenceResult.tracked(TernaryValue.TRUE, 0.9);

        assertFalse(untracked.isConfidenceTracked());
        assertEquals(OptionalDouble.empty(), untracked.confidence());
        assertTrue(tracked.isConfidenceTracked());
        assertEquals(0.9, tracked.confidence().getAsDouble());

        assertThrows(KleeneValidationException.class, () -> SequenceResult.tracked(TernaryValue.TRUE, 2.0));
    }

    @Test
    @DisplayName("Performance summary should derive ratios and guard divisions by zero")
    void performanceSummaryShouldDeriveRatios() {
        PerformanceSummary summary = new PerformanceSummary(25, 100, Duration.ofNanos(500), Duration.ofNanos(2000));
        assertEquals(0.75, summary.evaluationReduction(), 1e-12);
        assertEquals(4.0, summary.speedup(), 1e-12);

        PerformanceSummary empty = new PerformanceSummary(0, 0, Duration.ZERO, Duration.ZERO);
        assertEquals(0.0, empty.evaluationReduction());
        assertEquals(0.0, empty.speedup());

        PerformanceSummary naiveOnly = new PerformanceSummary(0, 10, Duration.ZERO, Duration.ofMillis(3));
        assertEquals(1.0, naiveOnly.evaluationReduction());
        assertEquals(0.0, naiveOnly.speedup());
    }
}
