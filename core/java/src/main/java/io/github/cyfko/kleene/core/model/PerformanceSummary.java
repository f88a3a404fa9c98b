package io.github.cyfko.kleene.core.model;

import java.time.Duration;
import java.util.Objects;

/**
 * Snapshot of an evaluator's accumulated instrumentation.
 * <p>
 * Only the four raw figures are stored; {@link #evaluationReduction()} and {@link #speedup()}
 * are derived on every call.
 * </p>
 *
 * <pre>{@code
 * PerformanceSummary summary = evaluator.summary();
 * System.out.printf("Evaluation reduction: %.1f%%%n", summary.evaluationReduction() * 100);
 * System.out.printf("Time speedup: %.2fx%n", summary.speedup());
 * }</pre>
 *
 * @param optimizedEvaluations atoms visited in optimized mode since the last reset
 * @param naiveEvaluations     atoms visited in naive mode since the last reset
 * @param optimizedTime        wall-clock time spent in optimized mode
 * @param naiveTime            wall-clock time spent in naive mode
 * @author Frank KOSSI
 * @since 1.0
 */
public record PerformanceSummary(
        long optimizedEvaluations,
        long naiveEvaluations,
        Duration optimizedTime,
        Duration naiveTime
) {

    public PerformanceSummary {
        if (optimizedEvaluations < 0 || naiveEvaluations < 0) {
            throw new IllegalArgumentException("Evaluation counts must be non-negative");
        }
        Objects.requireNonNull(optimizedTime, "optimizedTime");
        Objects.requireNonNull(naiveTime, "naiveTime");
    }

    /**
     * @return {@code (naive − optimized) / naive}, or {@code 0} when no naive evaluation was recorded
     */
    public double evaluationReduction() {
        if (naiveEvaluations == 0) {
            return 0.0;
        }
        return (double) (naiveEvaluations - optimizedEvaluations) / naiveEvaluations;
    }

    /**
     * @return {@code naiveTime / optimizedTime}, or {@code 0} when no optimized time was recorded
     */
    public double speedup() {
        long optimizedNanos = optimizedTime.toNanos();
        if (optimizedNanos == 0) {
            return 0.0;
        }
        return (double) naiveTime.toNanos() / optimizedNanos;
    }
}
