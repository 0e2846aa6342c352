package com.structura.labeling.service.metrics;

import com.structura.labeling.domain.FailureClassification;
import com.structura.labeling.domain.LabelSource;
import com.structura.labeling.domain.LabelingMode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics tracking for remote classification and labeling.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Remote attempts by outcome ({@code success} or a failure classification)</li>
 *   <li>Latency of each remote attempt</li>
 *   <li>Fallbacks to deterministic labels, by mode and classification</li>
 *   <li>Final labels by source (rule, remote)</li>
 * </ul>
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class ClassificationMetrics {

    private static final String REMOTE_PREFIX = "structura.remote";
    private static final String LABELING_PREFIX = "structura.labeling";

    static final String OUTCOME_SUCCESS = "success";

    private final MeterRegistry registry;

    public ClassificationMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    /**
     * Records one remote attempt.
     *
     * @param classification failure classification, or null for a successful attempt
     * @param durationNanos  wall time of the attempt
     */
    public void recordAttempt(FailureClassification classification, long durationNanos) {
        String outcome = classification == null ? OUTCOME_SUCCESS : classification.wireName();
        Counter.builder(REMOTE_PREFIX + ".attempts")
                .description("Number of remote classification attempts")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
        Timer.builder(REMOTE_PREFIX + ".latency")
                .description("Time taken by one remote classification attempt")
                .tag("outcome", outcome)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Increments the fallback counter.
     *
     * @param mode           labeling mode that fell back
     * @param classification classification of the failure that caused it
     */
    public void recordFallback(LabelingMode mode, FailureClassification classification) {
        Counter.builder(LABELING_PREFIX + ".fallback")
                .description("Number of remote failures answered with deterministic labels")
                .tag("mode", mode.wireName())
                .tag("classification", classification.wireName())
                .register(registry)
                .increment();
    }

    /**
     * Adds final labels of one source.
     */
    public void recordLabels(LabelSource source, long count) {
        if (count <= 0) {
            return;
        }
        Counter.builder(LABELING_PREFIX + ".source")
                .description("Number of final paragraph labels by source")
                .tag("source", source.wireName())
                .register(registry)
                .increment(count);
    }
}
