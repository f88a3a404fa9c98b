package io.github.cyfko.kleene.core.impl;

import io.github.cyfko.kleene.core.api.EvaluationMode;
import io.github.cyfko.kleene.core.model.PerformanceSummary;

import java.time.Duration;
import java.util.Objects;

/**
 * Mutable per-evaluator counters: atoms visited and nanoseconds spent, per {@link EvaluationMode}.
 * <p>
 * Not thread-safe; owned by exactly one evaluator.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public final class EvaluatorStats {

    private long optimizedEvaluations;
    private long optimizedNanos;
    private long naiveEvaluations;
    private long naiveNanos;

    void record(EvaluationMode mode, int evaluations, long elapsedNanos) {
        Objects.requireNonNull(mode, "mode");
        switch (mode) {
            case OPTIMIZED -> {
                optimizedEvaluations += evaluations;
                optimizedNanos += elapsedNanos;
            }
            case NAIVE -> {
                naiveEvaluations += evaluations;
                naiveNanos += elapsedNanos;
            }
        }
    }

    void reset() {
        optimizedEvaluations = 0;
        optimizedNanos = 0;
        naiveEvaluations = 0;
        naiveNanos = 0;
    }

    public long evaluations(EvaluationMode mode) {
        return mode == EvaluationMode.OPTIMIZED ? optimizedEvaluations : naiveEvaluations;
    }

    public Duration elapsed(EvaluationMode mode) {
        return Duration.ofNanos(mode == EvaluationMode.OPTIMIZED ? optimizedNanos : naiveNanos);
    }

    public PerformanceSummary snapshot() {
        return new PerformanceSummary(
                optimizedEvaluations,
                naiveEvaluations,
                Duration.ofNanos(optimizedNanos),
                Duration.ofNanos(naiveNanos)
        );
    }
}
