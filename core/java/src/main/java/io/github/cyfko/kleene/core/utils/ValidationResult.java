package io.github.cyfko.kleene.core.utils;

import io.github.cyfko.kleene.core.exception.KleeneValidationException;
import io.github.cyfko.kleene.core.exception.ValidationErrorKind;

/**
 * Class representing the result of a validation operation.
 * <p>
 * The result can indicate either a successful validation or a failure with an associated
 * error kind and message. Instances are immutable and created via {@link #success()} and
 * {@link #failure(ValidationErrorKind, String)}.
 * </p>
 *
 * <p>Usage example:</p>
 * <pre>{@code
 * ValidationResult result = TernaryValidationUtils.validateConfidence(0.7);
 * if (!result.isValid()) {
 *     System.out.println("Validation error: " + result.getErrorMessage());
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public final class ValidationResult {

    private static final ValidationResult SUCCESS = new ValidationResult(true, null, null);

    private final boolean valid;
    private final ValidationErrorKind errorKind;
    private final String errorMessage;

    private ValidationResult(boolean valid, ValidationErrorKind errorKind, String errorMessage) {
        this.valid = valid;
        this.errorKind = errorKind;
        this.errorMessage = errorMessage;
    }

    /**
     * Creates an instance indicating a successful validation.
     *
     * @return a valid result with no error message
     */
    public static ValidationResult success() {
        return SUCCESS;
    }

    /**
     * Creates an instance indicating a failed validation.
     *
     * @param errorKind    the violated contract
     * @param errorMessage message explaining the reason for failure
     * @return an invalid result
     */
    public static ValidationResult failure(ValidationErrorKind errorKind, String errorMessage) {
        if (errorKind == null) {
            throw new NullPointerException("Error kind cannot be null");
        }
        return new ValidationResult(false, errorKind, errorMessage);
    }

    public boolean isValid() {
        return valid;
    }

    /**
     * @return the error kind if invalid, or null if valid
     */
    public ValidationErrorKind getErrorKind() {
        return errorKind;
    }

    /**
     * @return error message if invalid, or null if valid
     */
    public String getErrorMessage() {
        return errorMessage;
    }

    /**
     * Converts a failure into its exception; does nothing on success.
     *
     * @throws KleeneValidationException if this result is invalid
     */
    public void throwIfInvalid() {
        if (!valid) {
            throw new KleeneValidationException(errorKind, errorMessage);
        }
    }

    @Override
    public String toString() {
        return valid ? "ValidationResult[valid=true]"
                : "ValidationResult[valid=false, kind=" + errorKind + ", error=" + errorMessage + "]";
    }
}
