package com.structura.labeling.service.remote;

import com.structura.labeling.domain.FailureClassification;

import java.time.Duration;
import java.util.Objects;

/**
 * Decides whether a failed attempt is retried and how long to wait first.
 *
 * <p>Only transient classifications are retried, and only while attempts remain. The delay before
 * attempt {@code n} (n &gt;= 2) is {@code backoffBase * 2^(n-2)}: 1 s, 2 s, 4 s... for a 1 s base.
 */
public final class RetryPolicy {

    private static final int MAX_SHIFT = 20;

    private final int maxAttempts;
    private final Duration backoffBase;

    public RetryPolicy(int maxAttempts, Duration backoffBase) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
        }
        Objects.requireNonNull(backoffBase, "backoffBase must not be null");
        if (backoffBase.isNegative()) {
            throw new IllegalArgumentException("backoffBase must not be negative, got: " + backoffBase);
        }
        this.maxAttempts = maxAttempts;
        this.backoffBase = backoffBase;
    }

    /**
     * @param classification classification of the attempt that just failed
     * @param attempt 1-based number of that attempt
     * @return true if another attempt should be made
     */
    public boolean shouldRetry(FailureClassification classification, int attempt) {
        Objects.requireNonNull(classification, "classification must not be null");
        return classification.isRetryable() && attempt < maxAttempts;
    }

    /**
     * Delay to wait before the given attempt.
     *
     * @param attempt 1-based attempt about to be made
     * @return zero for the first attempt, otherwise the exponential backoff
     */
    public Duration backoffBefore(int attempt) {
        if (attempt <= 1) {
            return Duration.ZERO;
        }
        long factor = 1L << Math.min(attempt - 2, MAX_SHIFT);
        return backoffBase.multipliedBy(factor);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getBackoffBase() {
        return backoffBase;
    }
}
