package com.structura.labeling.service.remote;

import com.structura.labeling.domain.Suggestion;

import java.util.List;
import java.util.Objects;

/**
 * Decoded answer of the remote classifier. Suggestions are only produced by review calls.
 */
public record ClassificationResult(
        OperationKind operation,
        List<RemoteLabel> labels,
        List<Suggestion> suggestions
) {
    public ClassificationResult {
        Objects.requireNonNull(operation, "operation");
        labels = labels == null ? List.of() : List.copyOf(labels);
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }
}
