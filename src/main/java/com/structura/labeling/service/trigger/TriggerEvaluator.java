package com.structura.labeling.service.trigger;

import com.structura.labeling.domain.Paragraph;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Decides which paragraphs of a hybrid run are sent for remote review.
 *
 * <p>Runs every condition independently and unions their indices. Thread-safe as long as the
 * conditions are, which the shipped ones are (no mutable state).
 */
public class TriggerEvaluator {

    private static final Logger LOG = LogManager.getLogger(TriggerEvaluator.class);

    private final List<TriggerCondition> conditions;

    public TriggerEvaluator(List<TriggerCondition> conditions) {
        Objects.requireNonNull(conditions, "conditions must not be null");
        this.conditions = List.copyOf(conditions);
    }

    public TriggerEvaluation evaluate(List<Paragraph> paragraphs) {
        Objects.requireNonNull(paragraphs, "paragraphs must not be null");
        TreeSet<Integer> union = new TreeSet<>();
        List<String> reasons = new ArrayList<>();
        Map<String, Integer> metrics = new LinkedHashMap<>();

        for (TriggerCondition condition : conditions) {
            ConditionOutcome outcome = condition.evaluate(paragraphs);
            metrics.putAll(outcome.metrics());
            if (outcome.fired()) {
                union.addAll(outcome.indices());
                reasons.add(outcome.reason());
                LOG.debug("Trigger condition {} fired for {} paragraph(s)", outcome.condition(), outcome.indices().size());
            }
        }

        boolean triggered = !union.isEmpty();
        LOG.debug("Trigger evaluation: triggered={}, paragraphs={}/{}", triggered, union.size(), paragraphs.size());
        return new TriggerEvaluation(triggered, new ArrayList<>(union), reasons, metrics, paragraphs.size());
    }

    public List<TriggerCondition> getConditions() {
        return conditions;
    }
}
