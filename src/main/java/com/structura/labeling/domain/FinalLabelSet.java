package com.structura.labeling.domain;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Sole output of the labeling core, consumed by the formatting engine.
 *
 * <p>Holds exactly one {@link ParagraphLabel} per paragraph index, in index order with no gaps
 * and no duplicates. The trigger report is present only for remote and hybrid runs.
 *
 * @param mode          mode that produced this set
 * @param labels        one label per paragraph, position i holds index i
 * @param suggestions   remote review suggestions (auxiliary, possibly empty)
 * @param triggerReport remote-review diagnostics, or null in rule mode
 * @param warnings      degraded-operation notes for the diagnostic report
 * @param attempts      remote attempt traces, empty when the remote classifier was not called
 */
public record FinalLabelSet(
        LabelingMode mode,
        List<ParagraphLabel> labels,
        List<Suggestion> suggestions,
        TriggerReport triggerReport,
        List<String> warnings,
        List<AttemptTrace> attempts
) {
    public FinalLabelSet {
        Objects.requireNonNull(mode, "mode");
        labels = List.copyOf(Objects.requireNonNull(labels, "labels"));
        for (int i = 0; i < labels.size(); i++) {
            if (labels.get(i).index() != i) {
                throw new IllegalArgumentException(
                        "Label at position " + i + " has index " + labels.get(i).index());
            }
        }
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        attempts = attempts == null ? List.of() : List.copyOf(attempts);
    }

    public int size() {
        return labels.size();
    }

    public ParagraphLabel labelAt(int index) {
        return labels.get(index);
    }

    public Optional<TriggerReport> findTriggerReport() {
        return Optional.ofNullable(triggerReport);
    }

    /**
     * Whether the remote classifier was invoked while producing this set.
     */
    public boolean remoteCalled() {
        return triggerReport != null && triggerReport.remoteCalled();
    }

    public long countBySource(LabelSource source) {
        return labels.stream().filter(l -> l.source() == source).count();
    }
}
