package com.structura.labeling.service.trigger;

import com.structura.labeling.domain.TriggerReport;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Combined outcome of all trigger conditions for one document.
 *
 * @param triggered        true if the union of flagged indices is non-empty
 * @param indices          deduplicated union of flagged indices, ascending
 * @param reasons          one reason per fired condition, in condition order
 * @param metrics          counts of every condition, fired or not
 * @param totalParagraphs  size of the evaluated document
 */
public record TriggerEvaluation(
        boolean triggered,
        List<Integer> indices,
        List<String> reasons,
        Map<String, Integer> metrics,
        int totalParagraphs
) {
    public TriggerEvaluation {
        indices = indices == null ? List.of() : List.copyOf(indices);
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
        metrics = metrics == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
    }

    /**
     * Report before any remote call was made.
     */
    public TriggerReport toReport() {
        return new TriggerReport(triggered, reasons, indices.size(), totalParagraphs, false, metrics, null);
    }
}
