package io.github.cyfko.kleene.core.api;

/**
 * Enumeration of the Kleene connectives supported by the engine.
 * <p>
 * Each operator carries the symbol used when rendering expressions and its arity.
 * </p>
 *
 * <ul>
 *     <li>AND / ∧ : {@code min(a, b)}</li>
 *     <li>OR / ∨ : {@code max(a, b)}</li>
 *     <li>NOT / ¬ : {@code -a}</li>
 *     <li>EQV / ↔ : {@code a × b}</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public enum KleeneOperator {

    AND("∧", true),
    OR("∨", true),
    NOT("¬", false),
    EQV("↔", true);

    private final String symbol;
    private final boolean binary;

    KleeneOperator(String symbol, boolean binary) {
        this.symbol = symbol;
        this.binary = binary;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * @return {@code true} if the operator combines two operands
     */
    public boolean isBinary() {
        return binary;
    }

    /**
     * Parses an operator from its name or symbol, ignoring case and surrounding whitespace.
     *
     * @param value the name ({@code "and"}) or symbol ({@code "∧"})
     * @return the operator, or {@code null} if nothing matches
     */
    public static KleeneOperator fromString(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        for (KleeneOperator op : values()) {
            if (op.name().equalsIgnoreCase(trimmed) || op.symbol.equals(trimmed)) {
                return op;
            }
        }
        return null;
    }
}
