package com.structura.labeling.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Diagnostic summary of the remote-review gate, surfaced verbatim into the document report.
 *
 * @param triggered               whether any trigger condition fired
 * @param reasons                 one human-readable reason per fired condition
 * @param triggeredParagraphCount number of paragraphs sent for remote review
 * @param totalParagraphCount     number of paragraphs in the document
 * @param remoteCalled            whether the remote classifier was invoked (true even if it failed)
 * @param metrics                 raw counts such as {@code unknown_count}
 * @param remoteError             failure message when the remote call failed, otherwise null
 */
public record TriggerReport(
        boolean triggered,
        List<String> reasons,
        int triggeredParagraphCount,
        int totalParagraphCount,
        boolean remoteCalled,
        Map<String, Integer> metrics,
        String remoteError
) {
    public TriggerReport {
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
        metrics = metrics == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
        if (triggeredParagraphCount < 0 || totalParagraphCount < 0) {
            throw new IllegalArgumentException("paragraph counts must not be negative");
        }
        if (triggeredParagraphCount > totalParagraphCount) {
            throw new IllegalArgumentException("triggered count exceeds total paragraph count");
        }
    }

    /**
     * Returns a copy carrying the outcome of the remote call.
     *
     * @param error failure message, or null on success
     * @param extraMetrics counts to add to (or overwrite in) the metrics map
     */
    public TriggerReport withRemoteOutcome(String error, Map<String, Integer> extraMetrics) {
        Map<String, Integer> merged = new LinkedHashMap<>(metrics);
        if (extraMetrics != null) {
            merged.putAll(extraMetrics);
        }
        return new TriggerReport(triggered, reasons, triggeredParagraphCount, totalParagraphCount,
                true, merged, error);
    }

    public int metric(String name) {
        Objects.requireNonNull(name, "name");
        return metrics.getOrDefault(name, 0);
    }

    public boolean hasRemoteError() {
        return remoteError != null;
    }
}
