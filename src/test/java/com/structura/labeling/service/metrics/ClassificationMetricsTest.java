package com.structura.labeling.service.metrics;

import com.structura.labeling.domain.FailureClassification;
import com.structura.labeling.domain.LabelSource;
import com.structura.labeling.domain.LabelingMode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClassificationMetricsTest {

    private MeterRegistry registry;
    private ClassificationMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new ClassificationMetrics(registry);
    }

    @Test
    void shouldRecordSuccessfulAttempt() {
        long durationNanos = TimeUnit.MILLISECONDS.toNanos(120);

        metrics.recordAttempt(null, durationNanos);

        Counter counter = registry.find("structura.remote.attempts").tag("outcome", "success").counter();
        Timer timer = registry.find("structura.remote.latency").tag("outcome", "success").timer();
        assertThat(counter).isNotNull();
        assertThat(counter.count()).isEqualTo(1.0);
        assertThat(timer).isNotNull();
        assertThat(timer.totalTime(TimeUnit.NANOSECONDS)).isEqualTo(durationNanos);
    }

    @Test
    void shouldTagFailedAttemptsByClassification() {
        metrics.recordAttempt(FailureClassification.READ_TIMEOUT, 1_000);
        metrics.recordAttempt(FailureClassification.READ_TIMEOUT, 2_000);
        metrics.recordAttempt(FailureClassification.AUTH_ERROR, 3_000);

        assertThat(registry.find("structura.remote.attempts").tag("outcome", "read_timeout").counter().count())
                .isEqualTo(2.0);
        assertThat(registry.find("structura.remote.attempts").tag("outcome", "auth_error").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.find("structura.remote.attempts").tag("outcome", "success").counter()).isNull();
    }

    @Test
    void shouldCountFallbacksByModeAndClassification() {
        metrics.recordFallback(LabelingMode.HYBRID, FailureClassification.CONNECT_ERROR);
        metrics.recordFallback(LabelingMode.REMOTE, FailureClassification.CONNECT_ERROR);
        metrics.recordFallback(LabelingMode.HYBRID, FailureClassification.CONNECT_ERROR);

        Counter hybrid = registry.find("structura.labeling.fallback")
                .tag("mode", "hybrid")
                .tag("classification", "connect_error")
                .counter();
        assertThat(hybrid).isNotNull();
        assertThat(hybrid.count()).isEqualTo(2.0);
    }

    @Test
    void shouldAddLabelCountsBySource() {
        metrics.recordLabels(LabelSource.RULE, 10);
        metrics.recordLabels(LabelSource.RULE, 5);
        metrics.recordLabels(LabelSource.REMOTE, 0);

        assertThat(registry.find("structura.labeling.source").tag("source", "rule").counter().count())
                .isEqualTo(15.0);
        assertThat(registry.find("structura.labeling.source").tag("source", "remote").counter()).isNull();
    }

    @Test
    void shouldRejectNullRegistry() {
        assertThatThrownBy(() -> new ClassificationMetrics(null))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("registry");
    }
}
