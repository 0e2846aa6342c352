package com.structura.labeling.service.trigger.impl;

import com.structura.labeling.domain.Paragraph;
import com.structura.labeling.domain.ParagraphRoles;
import com.structura.labeling.service.trigger.ConditionOutcome;
import com.structura.labeling.service.trigger.TriggerCondition;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flags runs of consecutive short body paragraphs the rule engine was unsure about, which are
 * often an unrecognized list.
 *
 * <p>Only body paragraphs whose deterministic confidence is below the confidence threshold take
 * part in a run; a confidently labeled short body ends the run like any other paragraph.
 * Consecutive means adjacent in document order. Every paragraph of a qualifying run is flagged.
 */
public class PotentialListCondition implements TriggerCondition {

    public static final String METRIC = "potential_list_count";
    public static final String RUN_METRIC = "potential_list_runs";

    private final int shortBodyThreshold;
    private final int minRunLength;
    private final double confidenceThreshold;

    /**
     * @param shortBodyThreshold  body text of at most this many code points counts as short
     * @param minRunLength        minimum number of consecutive short bodies that form a run
     * @param confidenceThreshold rule confidence at or above which a short body is trusted as plain body
     */
    public PotentialListCondition(int shortBodyThreshold, int minRunLength, double confidenceThreshold) {
        if (shortBodyThreshold < 1) {
            throw new IllegalArgumentException("shortBodyThreshold must be >= 1, got: " + shortBodyThreshold);
        }
        if (minRunLength < 2) {
            throw new IllegalArgumentException("minRunLength must be >= 2, got: " + minRunLength);
        }
        if (confidenceThreshold < 0.0 || confidenceThreshold > 1.0) {
            throw new IllegalArgumentException("confidenceThreshold must be in [0,1], got: " + confidenceThreshold);
        }
        this.shortBodyThreshold = shortBodyThreshold;
        this.minRunLength = minRunLength;
        this.confidenceThreshold = confidenceThreshold;
    }

    @Override
    public String name() {
        return "potential_list";
    }

    @Override
    public ConditionOutcome evaluate(List<Paragraph> paragraphs) {
        List<Integer> indices = new ArrayList<>();
        List<Integer> run = new ArrayList<>();
        int runs = 0;
        for (Paragraph p : paragraphs) {
            if (isListCandidate(p)) {
                run.add(p.index());
                continue;
            }
            runs += flush(run, indices);
        }
        runs += flush(run, indices);

        Map<String, Integer> metrics = new LinkedHashMap<>();
        metrics.put(METRIC, indices.size());
        metrics.put(RUN_METRIC, runs);
        return ConditionOutcome.of(name(), indices,
                runs + " run(s) of " + minRunLength + "+ consecutive short low-confidence body paragraphs ("
                        + indices.size() + " paragraphs)",
                metrics);
    }

    private boolean isListCandidate(Paragraph p) {
        return p.hasLabel(ParagraphRoles.BODY)
                && p.textLength() <= shortBodyThreshold
                && p.confidence() < confidenceThreshold;
    }

    private int flush(List<Integer> run, List<Integer> indices) {
        int qualified = 0;
        if (run.size() >= minRunLength) {
            indices.addAll(run);
            qualified = 1;
        }
        run.clear();
        return qualified;
    }
}
