package io.github.cyfko.kleene.core.model;

import io.github.cyfko.kleene.core.api.TernaryValue;
import io.github.cyfko.kleene.core.utils.TernaryValidationUtils;

import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Outcome of folding an operator over a flat sequence.
 *
 * @param value      the folded truth value
 * @param confidence the folded confidence, empty when the caller did not track confidences
 * @author Frank KOSSI
 * @since 1.0
 */
public record SequenceResult(TernaryValue value, OptionalDouble confidence) {

    public SequenceResult {
        Objects.requireNonNull(value, "Ternary value cannot be null");
        Objects.requireNonNull(confidence, "Confidence cannot be null, use OptionalDouble.empty()");
        if (confidence.isPresent()) {
            TernaryValidationUtils.requireConfidence(confidence.getAsDouble());
        }
    }

    public static SequenceResult untracked(TernaryValue value) {
        return new SequenceResult(value, OptionalDouble.empty());
    }

    public static SequenceResult tracked(TernaryValue value, double confidence) {
        return new SequenceResult(value, OptionalDouble.of(confidence));
    }

    public boolean isConfidenceTracked() {
        return confidence.isPresent();
    }
}
