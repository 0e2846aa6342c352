package com.structura.labeling.service.trigger;

import com.structura.labeling.domain.Paragraph;

import java.util.List;

/**
 * Pure predicate over a labeled document that flags paragraphs worth a remote review.
 *
 * <p>Implementations must not mutate the input and must return indices in ascending order.
 */
public interface TriggerCondition {

    /** Stable condition name, used in logs. */
    String name();

    ConditionOutcome evaluate(List<Paragraph> paragraphs);
}
