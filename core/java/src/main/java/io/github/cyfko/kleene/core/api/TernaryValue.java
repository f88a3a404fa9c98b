package io.github.cyfko.kleene.core.api;

import io.github.cyfko.kleene.core.exception.KleeneValidationException;
import io.github.cyfko.kleene.core.exception.ValidationErrorKind;

/**
 * The three truth values of Kleene logic, mapped onto the integers {@code {-1, 0, 1}}.
 * <p>
 * The natural order of the constants is the logical order {@code FALSE < UNKNOWN < TRUE},
 * which is what makes conjunction a minimum and disjunction a maximum.
 * </p>
 *
 * <p><strong>Example usage:</strong></p>
 * <pre>{@code
 * TernaryValue v = TernaryValue.fromInt(0);      // UNKNOWN
 * TernaryValue w = TernaryValue.fromInt(2);      // throws KleeneValidationException
 * int raw = TernaryValue.TRUE.numericValue();    // 1
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public enum TernaryValue {

    FALSE(-1, "F"),
    UNKNOWN(0, "U"),
    TRUE(1, "T");

    private final int numericValue;
    private final String symbol;

    TernaryValue(int numericValue, String symbol) {
        this.numericValue = numericValue;
        this.symbol = symbol;
    }

    /**
     * @return the integer encoding of this value ({@code -1}, {@code 0} or {@code 1})
     */
    public int numericValue() {
        return numericValue;
    }

    /**
     * @return the one-letter symbol used when rendering expressions ({@code F}, {@code U}, {@code T})
     */
    public String symbol() {
        return symbol;
    }

    /**
     * Whether this value is definite, i.e. {@code TRUE} or {@code FALSE}.
     *
     * @return {@code false} only for {@link #UNKNOWN}
     */
    public boolean isDefinite() {
        return this != UNKNOWN;
    }

    /**
     * Resolves a raw integer to its ternary value.
     *
     * @param raw the integer encoding
     * @return the matching value
     * @throws KleeneValidationException with {@link ValidationErrorKind#INVALID_TERNARY_VALUE}
     *                                   if {@code raw} is not one of {@code -1, 0, 1}
     */
    public static TernaryValue fromInt(int raw) {
        return switch (raw) {
            case -1 -> FALSE;
            case 0 -> UNKNOWN;
            case 1 -> TRUE;
            default -> throw new KleeneValidationException(ValidationErrorKind.INVALID_TERNARY_VALUE,
                    "Ternary value must be one of {-1, 0, 1}, got " + raw);
        };
    }
}
