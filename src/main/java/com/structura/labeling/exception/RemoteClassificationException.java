package com.structura.labeling.exception;

import com.structura.labeling.domain.AttemptTrace;
import com.structura.labeling.domain.FailureClassification;

import java.util.List;
import java.util.Objects;

/**
 * Thrown when a logical remote classification call fails for good: the failure was terminal
 * ({@code auth_error}), not retryable ({@code other_error}), the attempt budget was exhausted,
 * or the caller cancelled between attempts.
 *
 * <p>The message follows the pattern {@code "<classification> (attempt n/max): <cause>"},
 * e.g. {@code "read timeout (attempt 3/3): HttpTimeoutException: request timed out"}.
 */
public class RemoteClassificationException extends StructuraException {

    private final FailureClassification classification;
    private final int attempts;
    private final int maxAttempts;
    private final boolean cancelled;
    private final List<AttemptTrace> traces;

    public RemoteClassificationException(FailureClassification classification,
                                         int attempts,
                                         int maxAttempts,
                                         boolean cancelled,
                                         String causeDescription,
                                         List<AttemptTrace> traces,
                                         Throwable cause) {
        super(formatMessage(classification, attempts, maxAttempts, cancelled, causeDescription), cause);
        this.classification = Objects.requireNonNull(classification, "classification");
        this.attempts = attempts;
        this.maxAttempts = maxAttempts;
        this.cancelled = cancelled;
        this.traces = traces == null ? List.of() : List.copyOf(traces);
    }

    private static String formatMessage(FailureClassification classification, int attempts, int maxAttempts,
                                        boolean cancelled, String causeDescription) {
        StringBuilder sb = new StringBuilder(classification.description())
                .append(" (attempt ").append(attempts).append('/').append(maxAttempts);
        if (cancelled) {
            sb.append(", cancelled before retry");
        }
        sb.append(')');
        if (causeDescription != null && !causeDescription.isBlank()) {
            sb.append(": ").append(causeDescription);
        }
        return sb.toString();
    }

    public FailureClassification getClassification() {
        return classification;
    }

    /** Number of attempts actually made. */
    public int getAttempts() {
        return attempts;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /** One trace per attempt, in order. */
    public List<AttemptTrace> getTraces() {
        return traces;
    }
}
