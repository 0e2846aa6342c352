package com.structura.labeling.service.trigger.impl;

import com.structura.labeling.domain.Paragraph;
import com.structura.labeling.domain.ParagraphRoles;
import com.structura.labeling.service.trigger.ConditionOutcome;
import com.structura.labeling.service.trigger.TriggerCondition;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Flags paragraphs the rule engine could not classify.
 */
public class UnknownLabelCondition implements TriggerCondition {

    public static final String METRIC = "unknown_count";

    @Override
    public String name() {
        return "unknown_label";
    }

    @Override
    public ConditionOutcome evaluate(List<Paragraph> paragraphs) {
        List<Integer> indices = paragraphs.stream()
                .filter(p -> p.hasLabel(ParagraphRoles.UNKNOWN))
                .map(Paragraph::index)
                .sorted()
                .collect(Collectors.toList());
        return ConditionOutcome.of(name(), indices,
                indices.size() + " paragraph(s) have an unknown rule label",
                Map.of(METRIC, indices.size()));
    }
}
