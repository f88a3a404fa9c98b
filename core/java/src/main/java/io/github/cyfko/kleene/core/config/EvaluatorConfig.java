package io.github.cyfko.kleene.core.config;

import io.github.cyfko.kleene.core.api.EvaluationMode;
import io.github.cyfko.kleene.core.spi.EvaluationListener;

import java.util.Objects;

/**
 * Central configuration object for an expression evaluator.
 * <p>
 * Exposes the mode used when callers do not pass one explicitly and the
 * {@link EvaluationListener} notified during walks. A builder keeps construction fluent and
 * forward compatible.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public final class EvaluatorConfig {

    private static final EvaluatorConfig DEFAULTS = builder().build();

    private final EvaluationMode defaultMode;
    private final EvaluationListener listener;

    private EvaluatorConfig(Builder builder) {
        this.defaultMode = builder.defaultMode;
        this.listener = builder.listener;
    }

    public static Builder builder() { return new Builder(); }

    /**
     * @return optimized default mode, no listener
     */
    public static EvaluatorConfig defaults() { return DEFAULTS; }

    public EvaluationMode getDefaultMode() { return defaultMode; }
    public EvaluationListener getListener() { return listener; }

    /**
     * Builder for {@link EvaluatorConfig}.
     */
    public static final class Builder {
        private EvaluationMode defaultMode = EvaluationMode.OPTIMIZED; // default
        private EvaluationListener listener = EvaluationListener.NONE; // default

        public Builder defaultMode(EvaluationMode mode) {
            this.defaultMode = Objects.requireNonNull(mode, "defaultMode");
            return this;
        }

        public Builder listener(EvaluationListener listener) {
            this.listener = Objects.requireNonNull(listener, "listener");
            return this;
        }

        public EvaluatorConfig build() { return new EvaluatorConfig(this); }
    }
}
