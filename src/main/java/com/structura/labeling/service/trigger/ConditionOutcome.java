package com.structura.labeling.service.trigger;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Result of one trigger condition.
 *
 * @param condition name of the condition
 * @param fired     true if at least one paragraph was flagged
 * @param indices   flagged paragraph indices, ascending
 * @param reason    human-readable reason, empty when not fired
 * @param metrics   named counts contributed to the trigger report
 */
public record ConditionOutcome(
        String condition,
        boolean fired,
        List<Integer> indices,
        String reason,
        Map<String, Integer> metrics
) {
    public ConditionOutcome {
        Objects.requireNonNull(condition, "condition");
        indices = indices == null ? List.of() : List.copyOf(indices);
        reason = reason == null ? "" : reason;
        metrics = metrics == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
    }

    /**
     * Builds an outcome that fires iff indices is non-empty.
     */
    public static ConditionOutcome of(String condition, List<Integer> indices, String reason,
                                      Map<String, Integer> metrics) {
        boolean fired = indices != null && !indices.isEmpty();
        return new ConditionOutcome(condition, fired, indices, fired ? reason : "", metrics);
    }
}
