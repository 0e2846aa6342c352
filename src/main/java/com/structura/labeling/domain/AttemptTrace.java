package com.structura.labeling.domain;

import java.time.Duration;
import java.util.Objects;

/**
 * Diagnostic record of one remote classification attempt.
 *
 * @param attempt        1-based attempt number
 * @param timeout        response timeout applied to the attempt
 * @param elapsedMillis  wall time spent in the attempt
 * @param classification failure classification, or null when the attempt succeeded
 */
public record AttemptTrace(
        int attempt,
        Duration timeout,
        long elapsedMillis,
        FailureClassification classification
) {
    public AttemptTrace {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1");
        }
        Objects.requireNonNull(timeout, "timeout");
    }

    public static AttemptTrace success(int attempt, Duration timeout, long elapsedMillis) {
        return new AttemptTrace(attempt, timeout, elapsedMillis, null);
    }

    public static AttemptTrace failure(int attempt, Duration timeout, long elapsedMillis,
                                       FailureClassification classification) {
        return new AttemptTrace(attempt, timeout, elapsedMillis,
                Objects.requireNonNull(classification, "classification"));
    }

    public boolean succeeded() {
        return classification == null;
    }
}
