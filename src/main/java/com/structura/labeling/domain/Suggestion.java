package com.structura.labeling.domain;

import java.util.Objects;

/**
 * Review suggestion returned by the remote classifier.
 *
 * <p>Suggestions are auxiliary output: they are surfaced in the diagnostic report as-is and never
 * change a paragraph label.
 *
 * @param category          one of hierarchy, ambiguity, structure, style, terminology
 * @param severity          one of low, medium, high
 * @param confidence        remote confidence (0.0 to 1.0)
 * @param evidence          text excerpt the suggestion refers to
 * @param recommendedAction what the reviewer proposes to change
 * @param rationale         why the change is proposed
 * @param applyMode         manual or auto
 * @param paragraphIndex    target paragraph index, or null when the suggestion is document-wide
 */
public record Suggestion(
        String category,
        String severity,
        double confidence,
        String evidence,
        String recommendedAction,
        String rationale,
        String applyMode,
        Integer paragraphIndex
) {
    public Suggestion {
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(severity, "severity");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be between 0.0 and 1.0");
        }
        evidence = evidence == null ? "" : evidence;
        recommendedAction = recommendedAction == null ? "" : recommendedAction;
        rationale = rationale == null ? "" : rationale;
        applyMode = applyMode == null ? "manual" : applyMode;
    }
}
