package io.github.cyfko.kleene.core.exception;

import java.util.Objects;

/**
 * Exception thrown when a ternary value, a confidence or an input sequence violates the
 * contract of the evaluation engine.
 * <p>
 * Every violation is detected eagerly, at construction or call time, before any arithmetic
 * runs. These are programming errors rather than transient conditions: the engine never
 * retries or recovers, it reports the violation to the caller of the offending call.
 * </p>
 *
 * <p><strong>Common Validation Scenarios:</strong></p>
 * <ul>
 *   <li><strong>Out-of-domain values:</strong> a raw ternary input such as {@code 2}</li>
 *   <li><strong>Out-of-range confidences:</strong> {@code 1.5}, {@code -0.1} or NaN</li>
 *   <li><strong>Uncertain definite atoms:</strong> {@code TRUE} with confidence {@code 0.5}</li>
 *   <li><strong>Sequence shape:</strong> empty inputs or value/confidence lists of different length</li>
 * </ul>
 *
 * <p><strong>Handling Example:</strong></p>
 * <pre>{@code
 * try {
 *     Expression atom = Expressions.atom(rawValue, rawConfidence);
 * } catch (KleeneValidationException e) {
 *     if (e.getErrorKind() == ValidationErrorKind.INVALID_CONFIDENCE) {
 *         logger.warning("Rejected sensor reading: " + e.getMessage());
 *     }
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0
 * @see ValidationErrorKind
 */
public class KleeneValidationException extends RuntimeException {

    private final ValidationErrorKind errorKind;

    /**
     * Creates an exception of the given kind with an explanatory message.
     *
     * @param errorKind the violated contract, never null
     * @param message   the description of the violation, should name the offending value
     */
    public KleeneValidationException(ValidationErrorKind errorKind, String message) {
        super(message);
        this.errorKind = Objects.requireNonNull(errorKind, "errorKind");
    }

    /**
     * Creates an exception of the given kind with an explanatory message and an underlying cause.
     *
     * @param errorKind the violated contract, never null
     * @param message   the description of the violation
     * @param cause     the original cause
     */
    public KleeneValidationException(ValidationErrorKind errorKind, String message, Throwable cause) {
        super(message, cause);
        this.errorKind = Objects.requireNonNull(errorKind, "errorKind");
    }

    /**
     * @return the kind of contract violation
     */
    public ValidationErrorKind getErrorKind() {
        return errorKind;
    }
}
