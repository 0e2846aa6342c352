package com.structura.labeling.service.orchestration;

import com.structura.labeling.domain.FinalLabelSet;
import com.structura.labeling.domain.LabelingMode;
import com.structura.labeling.domain.Paragraph;
import com.structura.labeling.service.remote.CancellationToken;

import java.util.List;

/**
 * Produces the final label of every paragraph of a document in one of three modes.
 *
 * <p><b>Labeling Modes:</b>
 * <ul>
 *   <li><b>Rule:</b> deterministic labels verbatim; the remote classifier is never called.</li>
 *   <li><b>Remote:</b> one review call covering every paragraph; remote labels are adopted,
 *       deterministic labels fill the gaps.</li>
 *   <li><b>Hybrid:</b> trigger conditions select the paragraphs worth a review; only those are
 *       sent, and a remote label replaces the deterministic one only above the confidence
 *       threshold.</li>
 * </ul>
 *
 * <p><b>Error Handling:</b> a failed remote call never escapes. The document falls back to its
 * deterministic labels, a warning is added to the result and a WARN line is logged with the mode,
 * the number of paragraphs sent and the failure classification.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * LabelingOrchestrator orchestrator = ...;
 * List<Paragraph> paragraphs = ...; // from the rule classifier, index i at position i
 *
 * FinalLabelSet labels = orchestrator.classify(paragraphs, LabelingMode.HYBRID);
 * }</pre>
 *
 * @see com.structura.labeling.service.trigger.TriggerEvaluator
 * @see com.structura.labeling.service.remote.RemoteClassifierClient
 * @see com.structura.labeling.service.merge.LabelMerger
 */
public interface LabelingOrchestrator {

    /**
     * Labels a document in the configured default mode.
     */
    FinalLabelSet classify(List<Paragraph> paragraphs);

    /**
     * Labels a document in the given mode.
     *
     * @param paragraphs document paragraphs, paragraph i at position i
     * @param mode       labeling mode, or null for the configured default
     * @return one label per paragraph
     * @throws IllegalArgumentException if a paragraph index does not match its position
     */
    FinalLabelSet classify(List<Paragraph> paragraphs, LabelingMode mode);

    /**
     * Labels a document in the given mode, stopping remote retries once the token is cancelled.
     */
    FinalLabelSet classify(List<Paragraph> paragraphs, LabelingMode mode, CancellationToken cancellation);

    /** Mode used when none is given. */
    LabelingMode getDefaultMode();
}
