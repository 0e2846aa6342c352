package com.structura.labeling.service.merge;

import com.structura.labeling.domain.Paragraph;
import com.structura.labeling.service.remote.ClassificationResult;

import java.util.List;
import java.util.Set;

/**
 * Strategy for reconciling remote labels with the deterministic labels of a document.
 *
 * <p>Implementations must return exactly one label per paragraph, in index order.
 */
public interface LabelMerger {

    /**
     * @param paragraphs       whole document, index i at position i
     * @param requestedIndices indices that were sent to the remote classifier
     * @param result           remote answer, or null when there is none
     * @return merged labels plus the suggestions carried through
     */
    MergeOutcome merge(List<Paragraph> paragraphs, Set<Integer> requestedIndices, ClassificationResult result);
}
