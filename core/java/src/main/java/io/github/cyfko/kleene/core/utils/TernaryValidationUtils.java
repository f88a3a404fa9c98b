package io.github.cyfko.kleene.core.utils;

import io.github.cyfko.kleene.core.api.TernaryValue;
import io.github.cyfko.kleene.core.exception.KleeneValidationException;
import io.github.cyfko.kleene.core.exception.ValidationErrorKind;

import java.util.List;

/**
 * Utility class centralizing the input guards of the evaluation engine.
 * <p>
 * Each check exists in two flavours: a {@code validateXxx} method returning a
 * {@link ValidationResult}, for callers that want to inspect inputs without exceptions, and a
 * {@code requireXxx} method that throws {@link KleeneValidationException} on failure and is
 * what the engine itself calls at every entry point.
 * </p>
 *
 * <p><b>Usage example:</b></p>
 * <pre>{@code
 * ValidationResult result = TernaryValidationUtils.validateConfidence(reading);
 * if (!result.isValid()) {
 *     rejected.add(result.getErrorMessage());
 * }
 *
 * double c = TernaryValidationUtils.requireConfidence(reading); // throws on failure
 * }</pre>
 *
 * <p>This class is stateless and thread-safe.</p>
 *
 * @author Frank KOSSI
 * @since 1.0
 * @see ValidationResult
 */
public final class TernaryValidationUtils {

    private TernaryValidationUtils() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Checks that a raw integer belongs to the ternary domain {@code {-1, 0, 1}}.
     *
     * @param raw the raw value
     * @return the validation result
     */
    public static ValidationResult validateTernary(int raw) {
        if (raw < -1 || raw > 1) {
            return ValidationResult.failure(ValidationErrorKind.INVALID_TERNARY_VALUE,
                    String.format("Ternary value must be one of {-1, 0, 1}, got %d", raw));
        }
        return ValidationResult.success();
    }

    /**
     * Checks that a confidence lies in {@code [0, 1]}. NaN is rejected.
     *
     * @param confidence the confidence
     * @return the validation result
     */
    public static ValidationResult validateConfidence(double confidence) {
        if (!(confidence >= 0.0 && confidence <= 1.0)) {
            return ValidationResult.failure(ValidationErrorKind.INVALID_CONFIDENCE,
                    String.format("Confidence must be in [0, 1], got %s", confidence));
        }
        return ValidationResult.success();
    }

    /**
     * Checks the confidence of an atom against its value. Definite values ({@code TRUE},
     * {@code FALSE}) only accept exactly {@code 1.0}, and that rule is reported before the
     * range check; {@code UNKNOWN} accepts any confidence in range.
     *
     * @param value      the atom value
     * @param confidence the atom confidence
     * @return the validation result
     * @throws NullPointerException if value is null
     */
    public static ValidationResult validateAtom(TernaryValue value, double confidence) {
        if (value == null) {
            throw new NullPointerException("Ternary value cannot be null");
        }
        if (value.isDefinite() && confidence != 1.0) {
            return ValidationResult.failure(ValidationErrorKind.INVALID_DEFINITE_CONFIDENCE,
                    String.format("Definite value %s must have confidence 1.0, got %s", value, confidence));
        }
        return validateConfidence(confidence);
    }

    /**
     * Checks a confidence list handed to AND/OR propagation: non-empty, every element in range.
     *
     * @param confidences the list to check
     * @return the validation result, reporting the first offending element
     * @throws NullPointerException if the list or one of its elements is null
     */
    public static ValidationResult validateConfidenceSet(List<Double> confidences) {
        if (confidences == null) {
            throw new NullPointerException("Confidence list cannot be null");
        }
        if (confidences.isEmpty()) {
            return ValidationResult.failure(ValidationErrorKind.EMPTY_CONFIDENCE_SET,
                    "Confidence propagation requires at least one confidence");
        }
        for (Double c : confidences) {
            if (c == null) {
                throw new NullPointerException("Confidence list cannot contain null elements");
            }
            ValidationResult result = validateConfidence(c);
            if (!result.isValid()) {
                return result;
            }
        }
        return ValidationResult.success();
    }

    /**
     * Checks the shape of a flat sequence: at least one value and, when confidences are
     * tracked, exactly one confidence per value.
     *
     * @param valueCount      number of ternary values
     * @param confidenceCount number of confidences, or a negative number when tracking is disabled
     * @return the validation result
     */
    public static ValidationResult validateSequenceShape(int valueCount, int confidenceCount) {
        if (valueCount == 0) {
            return ValidationResult.failure(ValidationErrorKind.EMPTY_INPUT_SEQUENCE,
                    "Input sequence cannot be empty");
        }
        if (confidenceCount >= 0 && confidenceCount != valueCount) {
            return ValidationResult.failure(ValidationErrorKind.MISMATCHED_LENGTHS,
                    String.format("Values and confidences must have the same length, got %d values and %d confidences",
                            valueCount, confidenceCount));
        }
        return ValidationResult.success();
    }

    public static TernaryValue requireTernary(int raw) {
        validateTernary(raw).throwIfInvalid();
        return TernaryValue.fromInt(raw);
    }

    public static double requireConfidence(double confidence) {
        validateConfidence(confidence).throwIfInvalid();
        return confidence;
    }

    public static void requireAtom(TernaryValue value, double confidence) {
        validateAtom(value, confidence).throwIfInvalid();
    }

    public static void requireConfidenceSet(List<Double> confidences) {
        validateConfidenceSet(confidences).throwIfInvalid();
    }

    public static void requireSequenceShape(int valueCount, int confidenceCount) {
        validateSequenceShape(valueCount, confidenceCount).throwIfInvalid();
    }
}
