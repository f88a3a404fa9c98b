package io.github.cyfko.kleene.core.exception;

/**
 * Classification of the contract violations reported by {@link KleeneValidationException}.
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public enum ValidationErrorKind {

    /** A raw ternary input outside {@code {-1, 0, 1}}. */
    INVALID_TERNARY_VALUE,

    /** A confidence outside {@code [0, 1]}, NaN included. */
    INVALID_CONFIDENCE,

    /** An empty value sequence handed to the flat evaluator or the chain builder. */
    EMPTY_INPUT_SEQUENCE,

    /** An empty confidence list handed to AND/OR propagation. */
    EMPTY_CONFIDENCE_SET,

    /** A confidence sequence whose length differs from the value sequence. */
    MISMATCHED_LENGTHS,

    /** A {@code TRUE} or {@code FALSE} atom given a confidence other than {@code 1.0}. */
    INVALID_DEFINITE_CONFIDENCE
}
