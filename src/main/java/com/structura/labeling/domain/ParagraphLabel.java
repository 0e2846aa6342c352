package com.structura.labeling.domain;

import java.util.Objects;

/**
 * Final label for one paragraph, tagged with where it came from.
 *
 * @param index      paragraph index
 * @param label      structural role
 * @param source     {@link LabelSource#RULE} or {@link LabelSource#REMOTE}
 * @param confidence confidence reported by the source (0.0 to 1.0)
 */
public record ParagraphLabel(
        int index,
        String label,
        LabelSource source,
        double confidence
) {
    public ParagraphLabel {
        if (index < 0) {
            throw new IllegalArgumentException("index must not be negative");
        }
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(source, "source");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be between 0.0 and 1.0");
        }
    }

    /**
     * Keeps the deterministic label of a paragraph.
     */
    public static ParagraphLabel fromRule(Paragraph paragraph) {
        return new ParagraphLabel(paragraph.index(), paragraph.label(), LabelSource.RULE, paragraph.confidence());
    }

    public boolean isRemote() {
        return source == LabelSource.REMOTE;
    }
}
