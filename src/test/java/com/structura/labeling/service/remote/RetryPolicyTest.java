package com.structura.labeling.service.remote;

import com.structura.labeling.domain.FailureClassification;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    private final RetryPolicy policy = new RetryPolicy(3, Duration.ofSeconds(1));

    @Test
    void neverRetriesAuthError() {
        assertThat(policy.shouldRetry(FailureClassification.AUTH_ERROR, 1)).isFalse();
    }

    @Test
    void doesNotRetryOtherError() {
        assertThat(policy.shouldRetry(FailureClassification.OTHER_ERROR, 1)).isFalse();
    }

    @ParameterizedTest
    @EnumSource(value = FailureClassification.class,
            names = {"CONNECT_TIMEOUT", "READ_TIMEOUT", "TIMEOUT", "CONNECT_ERROR"})
    void retriesTransientFailuresWhileAttemptsRemain(FailureClassification classification) {
        assertThat(policy.shouldRetry(classification, 1)).isTrue();
        assertThat(policy.shouldRetry(classification, 2)).isTrue();
        assertThat(policy.shouldRetry(classification, 3)).isFalse();
    }

    @Test
    void backoffDoublesFromSecondAttempt() {
        assertThat(policy.backoffBefore(1)).isEqualTo(Duration.ZERO);
        assertThat(policy.backoffBefore(2)).isEqualTo(Duration.ofSeconds(1));
        assertThat(policy.backoffBefore(3)).isEqualTo(Duration.ofSeconds(2));
        assertThat(policy.backoffBefore(4)).isEqualTo(Duration.ofSeconds(4));
    }

    @Test
    void zeroBaseMeansNoDelay() {
        RetryPolicy noDelay = new RetryPolicy(5, Duration.ZERO);
        assertThat(noDelay.backoffBefore(5)).isEqualTo(Duration.ZERO);
    }

    @Test
    void rejectsInvalidConfiguration() {
        assertThatThrownBy(() -> new RetryPolicy(0, Duration.ofSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryPolicy(3, Duration.ofSeconds(-1)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
