package com.structura.labeling.service.merge;

import com.structura.labeling.domain.ParagraphLabel;
import com.structura.labeling.domain.Suggestion;

import java.util.List;

/**
 * @param labels                 one label per paragraph, in index order
 * @param suggestions            remote suggestions, unmodified
 * @param lowConfidenceFallbacks remote labels rejected for low confidence
 * @param adoptedCount           remote labels adopted
 */
public record MergeOutcome(
        List<ParagraphLabel> labels,
        List<Suggestion> suggestions,
        int lowConfidenceFallbacks,
        int adoptedCount
) {
    public MergeOutcome {
        labels = List.copyOf(labels);
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }
}
