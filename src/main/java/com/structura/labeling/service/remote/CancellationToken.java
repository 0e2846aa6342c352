package com.structura.labeling.service.remote;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Cooperative cancellation signal polled by the retry loop between attempts.
 */
@FunctionalInterface
public interface CancellationToken {

    /** Never cancelled. */
    CancellationToken NONE = () -> false;

    boolean isCancelled();

    /**
     * Token that reports cancellation once the clock reaches the deadline.
     */
    static CancellationToken deadline(Instant deadline, Clock clock) {
        Objects.requireNonNull(deadline, "deadline must not be null");
        Objects.requireNonNull(clock, "clock must not be null");
        return () -> !clock.instant().isBefore(deadline);
    }

    /**
     * Token that expires the given budget from now on the system clock.
     */
    static CancellationToken within(Duration budget) {
        Objects.requireNonNull(budget, "budget must not be null");
        Clock clock = Clock.systemUTC();
        return deadline(clock.instant().plus(budget), clock);
    }
}
