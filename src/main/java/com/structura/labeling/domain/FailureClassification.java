package com.structura.labeling.domain;

/**
 * Classified cause of a failed remote classification attempt.
 *
 * <p>Only {@link #AUTH_ERROR} is terminal. The timeout and connection variants are transient and
 * eligible for retry; {@link #OTHER_ERROR} is a hard failure of the remote call that is not retried.
 */
public enum FailureClassification {
    AUTH_ERROR("auth_error", "authentication rejected", false),
    CONNECT_TIMEOUT("connect_timeout", "connect timeout", true),
    READ_TIMEOUT("read_timeout", "read timeout", true),
    TIMEOUT("timeout", "timeout", true),
    CONNECT_ERROR("connect_error", "connection error", true),
    OTHER_ERROR("other_error", "remote call failed", false);

    private final String wireName;
    private final String description;
    private final boolean retryable;

    FailureClassification(String wireName, String description, boolean retryable) {
        this.wireName = wireName;
        this.description = description;
        this.retryable = retryable;
    }

    /** Stable lower-case name used in logs, metrics tags and reports. */
    public String wireName() {
        return wireName;
    }

    /** Human-readable phrase, e.g. "read timeout". */
    public String description() {
        return description;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
