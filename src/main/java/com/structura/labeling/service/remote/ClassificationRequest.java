package com.structura.labeling.service.remote;

import com.structura.labeling.domain.Paragraph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * One logical remote classification call.
 *
 * @param paragraphs    paragraphs to classify, in document order (whole document or a subset)
 * @param contextLabels index to deterministic label, sent as review context (may be empty)
 * @param operation     structure or review
 */
public record ClassificationRequest(
        List<Paragraph> paragraphs,
        Map<Integer, String> contextLabels,
        OperationKind operation
) {
    public ClassificationRequest {
        paragraphs = List.copyOf(Objects.requireNonNull(paragraphs, "paragraphs"));
        contextLabels = contextLabels == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(contextLabels));
        Objects.requireNonNull(operation, "operation");
    }

    public static ClassificationRequest structure(List<Paragraph> paragraphs) {
        return new ClassificationRequest(paragraphs, Map.of(), OperationKind.STRUCTURE);
    }

    public static ClassificationRequest review(List<Paragraph> paragraphs, Map<Integer, String> contextLabels) {
        return new ClassificationRequest(paragraphs, contextLabels, OperationKind.REVIEW);
    }

    public int paragraphCount() {
        return paragraphs.size();
    }

    /** Indices of the requested paragraphs. */
    public Set<Integer> requestedIndices() {
        return paragraphs.stream().map(Paragraph::index).collect(Collectors.toUnmodifiableSet());
    }
}
