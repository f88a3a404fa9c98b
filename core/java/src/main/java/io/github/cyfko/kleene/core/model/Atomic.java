package io.github.cyfko.kleene.core.model;

import io.github.cyfko.kleene.core.api.TernaryValue;
import io.github.cyfko.kleene.core.utils.TernaryValidationUtils;

import java.util.Locale;
import java.util.Objects;

/**
 * Leaf proposition holding a ternary value and its confidence.
 * <p>
 * Definite values carry certainty by convention: a {@code TRUE} or {@code FALSE} atom must
 * have confidence exactly {@code 1.0}. An {@code UNKNOWN} atom created without an explicit
 * confidence gets {@link #DEFAULT_UNKNOWN_CONFIDENCE}.
 * </p>
 *
 * @param value      the ternary value, never null
 * @param confidence the confidence in {@code [0, 1]}
 * @author Frank KOSSI
 * @since 1.0
 */
public record Atomic(TernaryValue value, double confidence) implements Expression {

    public static final double DEFAULT_UNKNOWN_CONFIDENCE = 0.5;

    public Atomic {
        Objects.requireNonNull(value, "Ternary value cannot be null");
        TernaryValidationUtils.requireAtom(value, confidence);
    }

    /**
     * Creates an atom with the default confidence for its value: {@code 1.0} for definite
     * values, {@code 0.5} for {@code UNKNOWN}.
     */
    public static Atomic of(TernaryValue value) {
        Objects.requireNonNull(value, "Ternary value cannot be null");
        return new Atomic(value, value.isDefinite() ? 1.0 : DEFAULT_UNKNOWN_CONFIDENCE);
    }

    public static Atomic of(TernaryValue value, double confidence) {
        return new Atomic(value, confidence);
    }

    /**
     * Creates an atom from a raw integer, validated against {@code {-1, 0, 1}} before anything else.
     */
    public static Atomic of(int raw) {
        return of(TernaryValidationUtils.requireTernary(raw));
    }

    public static Atomic of(int raw, double confidence) {
        return new Atomic(TernaryValidationUtils.requireTernary(raw), confidence);
    }

    @Override
    public int atomCount() {
        return 1;
    }

    @Override
    public int depth() {
        return 1;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "%s(%.2f)", value.symbol(), confidence);
    }
}
