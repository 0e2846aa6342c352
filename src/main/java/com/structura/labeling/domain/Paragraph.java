package com.structura.labeling.domain;

import java.util.Objects;

/**
 * Immutable paragraph as produced by the upstream rule classifier.
 *
 * @param index      zero-based position of the paragraph in the document
 * @param text       raw paragraph text (may be empty, never null)
 * @param label      deterministic label assigned by the rule engine (e.g. "h2", "body", "unknown")
 * @param confidence rule-engine confidence between 0.0 and 1.0
 */
public record Paragraph(
        int index,
        String text,
        String label,
        double confidence
) {

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException if index is negative or confidence is out of range
     * @throws NullPointerException if text or label is null
     */
    public Paragraph {
        if (index < 0) {
            throw new IllegalArgumentException("Paragraph index must not be negative, got: " + index);
        }
        Objects.requireNonNull(text, "Paragraph text must not be null");
        Objects.requireNonNull(label, "Paragraph label must not be null");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException(
                    "Confidence must be between 0.0 and 1.0, got: " + confidence
            );
        }
    }

    /**
     * Creates a paragraph whose rule label is fully trusted (confidence 1.0).
     *
     * @param index paragraph index
     * @param text  paragraph text
     * @param label deterministic label
     * @return new paragraph
     */
    public static Paragraph of(int index, String text, String label) {
        return new Paragraph(index, text, label, 1.0);
    }

    /**
     * Text length in Unicode code points, so CJK and emoji count as one character each.
     */
    public int textLength() {
        return text.codePointCount(0, text.length());
    }

    public boolean hasLabel(String role) {
        return label.equalsIgnoreCase(role);
    }
}
