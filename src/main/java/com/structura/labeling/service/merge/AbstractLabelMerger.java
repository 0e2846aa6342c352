package com.structura.labeling.service.merge;

import com.structura.labeling.domain.LabelSource;
import com.structura.labeling.domain.Paragraph;
import com.structura.labeling.domain.ParagraphLabel;
import com.structura.labeling.service.remote.ClassificationResult;
import com.structura.labeling.service.remote.RemoteLabel;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Abstract base class for label mergers implementing the common filtering logic.
 *
 * <p>This class implements the Template Method pattern: {@link #merge} handles the absent result,
 * drops remote labels that cannot apply and then asks {@link #accept} per paragraph.
 *
 * <p><b>Filtering Strategy:</b>
 * <ul>
 *   <li>Null result → every paragraph keeps its deterministic label</li>
 *   <li>Remote label for an index outside 0..N-1 or outside the request → ignored</li>
 *   <li>Several remote labels for one index → the first one wins</li>
 *   <li>Requested index without a remote label → deterministic label</li>
 * </ul>
 *
 * <p>Suggestions are passed through untouched and never change a label.
 */
public abstract class AbstractLabelMerger implements LabelMerger {

    @Override
    public final MergeOutcome merge(List<Paragraph> paragraphs, Set<Integer> requestedIndices,
                                    ClassificationResult result) {
        Objects.requireNonNull(paragraphs, "paragraphs must not be null");
        Objects.requireNonNull(requestedIndices, "requestedIndices must not be null");
        if (result == null) {
            return new MergeOutcome(ruleLabels(paragraphs), List.of(), 0, 0);
        }

        Map<Integer, RemoteLabel> byIndex = new LinkedHashMap<>();
        for (RemoteLabel label : result.labels()) {
            int index = label.index();
            if (index < 0 || index >= paragraphs.size() || !requestedIndices.contains(index)) {
                continue;
            }
            byIndex.putIfAbsent(index, label);
        }

        List<ParagraphLabel> merged = new ArrayList<>(paragraphs.size());
        int rejected = 0;
        int adopted = 0;
        for (Paragraph paragraph : paragraphs) {
            RemoteLabel remote = byIndex.get(paragraph.index());
            if (remote == null) {
                merged.add(ParagraphLabel.fromRule(paragraph));
            } else if (accept(paragraph, remote)) {
                merged.add(toRemoteLabel(remote));
                adopted++;
            } else {
                merged.add(ParagraphLabel.fromRule(paragraph));
                rejected++;
            }
        }
        return new MergeOutcome(merged, result.suggestions(), rejected, adopted);
    }

    /**
     * Decides whether a remote label replaces the deterministic one.
     *
     * @param paragraph deterministic paragraph (never null)
     * @param remote    remote label for the same index (never null)
     */
    protected abstract boolean accept(Paragraph paragraph, RemoteLabel remote);

    protected final ParagraphLabel toRemoteLabel(RemoteLabel remote) {
        return new ParagraphLabel(remote.index(), remote.label(),
                LabelSource.REMOTE, remote.confidence());
    }

    /**
     * Deterministic labels of every paragraph, in order.
     */
    public static List<ParagraphLabel> ruleLabels(List<Paragraph> paragraphs) {
        List<ParagraphLabel> labels = new ArrayList<>(paragraphs.size());
        for (Paragraph paragraph : paragraphs) {
            labels.add(ParagraphLabel.fromRule(paragraph));
        }
        return labels;
    }
}
