package com.structura.labeling.service.trigger.impl;

import com.structura.labeling.domain.Paragraph;
import com.structura.labeling.domain.ParagraphRoles;
import com.structura.labeling.service.trigger.ConditionOutcome;
import com.structura.labeling.service.trigger.TriggerCondition;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Flags second and third level headings whose text is too long to be a plausible heading.
 */
public class AmbiguousHeadingCondition implements TriggerCondition {

    public static final String METRIC = "ambiguous_heading_count";

    private final int headingLengthThreshold;

    /**
     * @param headingLengthThreshold headings longer than this many code points are flagged
     */
    public AmbiguousHeadingCondition(int headingLengthThreshold) {
        if (headingLengthThreshold < 1) {
            throw new IllegalArgumentException("headingLengthThreshold must be >= 1, got: " + headingLengthThreshold);
        }
        this.headingLengthThreshold = headingLengthThreshold;
    }

    @Override
    public String name() {
        return "ambiguous_heading";
    }

    @Override
    public ConditionOutcome evaluate(List<Paragraph> paragraphs) {
        List<Integer> indices = paragraphs.stream()
                .filter(p -> p.hasLabel(ParagraphRoles.H2) || p.hasLabel(ParagraphRoles.H3))
                .filter(p -> p.textLength() > headingLengthThreshold)
                .map(Paragraph::index)
                .sorted()
                .collect(Collectors.toList());
        return ConditionOutcome.of(name(), indices,
                indices.size() + " h2/h3 heading(s) longer than " + headingLengthThreshold + " characters",
                Map.of(METRIC, indices.size()));
    }
}
