package com.structura.labeling.service.remote;

import java.time.Duration;
import java.util.Objects;

/**
 * Computes the response timeout of one logical remote call from the size of the request.
 *
 * <p>{@code timeout = min(base + paragraphCount * perParagraph, max)}. The result is
 * non-decreasing in the paragraph count and never exceeds {@code max}. The connect timeout is a
 * separate fixed value applied when the HTTP client is built, not here.
 */
public final class TimeoutPolicy {

    private final Duration baseTimeout;
    private final Duration perParagraph;
    private final Duration maxTimeout;

    public TimeoutPolicy(Duration baseTimeout, Duration perParagraph, Duration maxTimeout) {
        this.baseTimeout = Objects.requireNonNull(baseTimeout, "baseTimeout must not be null");
        this.perParagraph = Objects.requireNonNull(perParagraph, "perParagraph must not be null");
        this.maxTimeout = Objects.requireNonNull(maxTimeout, "maxTimeout must not be null");
        if (baseTimeout.isNegative() || baseTimeout.isZero()) {
            throw new IllegalArgumentException("baseTimeout must be positive, got: " + baseTimeout);
        }
        if (perParagraph.isNegative()) {
            throw new IllegalArgumentException("perParagraph must not be negative, got: " + perParagraph);
        }
        if (maxTimeout.compareTo(baseTimeout) < 0) {
            throw new IllegalArgumentException(
                    "maxTimeout (" + maxTimeout + ") must be >= baseTimeout (" + baseTimeout + ")");
        }
    }

    /**
     * @param paragraphCount number of paragraphs in the request
     * @return response timeout for every attempt of the call
     * @throws IllegalArgumentException if paragraphCount is negative
     */
    public Duration computeDynamicTimeout(int paragraphCount) {
        if (paragraphCount < 0) {
            throw new IllegalArgumentException("paragraphCount must be >= 0, got: " + paragraphCount);
        }
        Duration scaled = baseTimeout.plus(perParagraph.multipliedBy(paragraphCount));
        return scaled.compareTo(maxTimeout) > 0 ? maxTimeout : scaled;
    }

    public Duration getBaseTimeout() {
        return baseTimeout;
    }

    public Duration getPerParagraph() {
        return perParagraph;
    }

    public Duration getMaxTimeout() {
        return maxTimeout;
    }
}
