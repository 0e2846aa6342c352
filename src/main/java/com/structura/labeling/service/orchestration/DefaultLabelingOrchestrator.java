package com.structura.labeling.service.orchestration;

import com.structura.labeling.domain.AttemptTrace;
import com.structura.labeling.domain.FailureClassification;
import com.structura.labeling.domain.FinalLabelSet;
import com.structura.labeling.domain.LabelSource;
import com.structura.labeling.domain.LabelingMode;
import com.structura.labeling.domain.Paragraph;
import com.structura.labeling.domain.TriggerReport;
import com.structura.labeling.exception.RemoteClassificationException;
import com.structura.labeling.service.merge.AbstractLabelMerger;
import com.structura.labeling.service.merge.LabelMerger;
import com.structura.labeling.service.merge.MergeOutcome;
import com.structura.labeling.service.metrics.ClassificationMetrics;
import com.structura.labeling.service.remote.CancellationToken;
import com.structura.labeling.service.remote.ClassificationRequest;
import com.structura.labeling.service.remote.RemoteClassifierClient;
import com.structura.labeling.service.remote.RemoteInvocation;
import com.structura.labeling.service.trigger.TriggerEvaluation;
import com.structura.labeling.service.trigger.TriggerEvaluator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Default implementation of {@link LabelingOrchestrator}.
 *
 * <p>Stateless after construction; every call builds a fresh {@link FinalLabelSet}, so one
 * instance serves concurrent documents. The mode and a document id are put in the Log4j2
 * {@link ThreadContext} for the duration of a call.
 */
public class DefaultLabelingOrchestrator implements LabelingOrchestrator {

    private static final Logger LOG = LogManager.getLogger(DefaultLabelingOrchestrator.class);

    static final String MODE_KEY = "labelingMode";
    static final String DOCUMENT_KEY = "documentId";

    static final String LOW_CONFIDENCE_METRIC = "low_confidence_fallback_count";
    static final String ADOPTED_METRIC = "remote_adopted_count";
    static final String REMOTE_MODE_REASON = "remote mode reviews every paragraph";
    static final String TRACES_UNAVAILABLE = "attempt traces unavailable";

    private final LabelingMode defaultMode;
    private final String configurationWarning;
    private final TriggerEvaluator triggerEvaluator;
    private final RemoteClassifierClient remoteClient;
    private final LabelMerger hybridMerger;
    private final LabelMerger remoteMerger;
    private final ClassificationMetrics metrics;

    /**
     * @param configuredMode   mode name from configuration; unrecognized names fall back to rule
     * @param triggerEvaluator selects the paragraphs reviewed in hybrid mode
     * @param remoteClient     remote classifier
     * @param hybridMerger     confidence-gated merger for hybrid mode
     * @param remoteMerger     merger for remote mode
     * @param metrics          fallback and label-source counters
     */
    public DefaultLabelingOrchestrator(String configuredMode,
                                       TriggerEvaluator triggerEvaluator,
                                       RemoteClassifierClient remoteClient,
                                       LabelMerger hybridMerger,
                                       LabelMerger remoteMerger,
                                       ClassificationMetrics metrics) {
        this.triggerEvaluator = Objects.requireNonNull(triggerEvaluator, "triggerEvaluator must not be null");
        this.remoteClient = Objects.requireNonNull(remoteClient, "remoteClient must not be null");
        this.hybridMerger = Objects.requireNonNull(hybridMerger, "hybridMerger must not be null");
        this.remoteMerger = Objects.requireNonNull(remoteMerger, "remoteMerger must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");

        LabelingMode parsed = LabelingMode.parse(configuredMode).orElse(null);
        if (parsed == null) {
            this.defaultMode = LabelingMode.RULE;
            this.configurationWarning = "Unrecognized labeling mode '" + configuredMode + "', using rule mode";
            LOG.warn(configurationWarning);
        } else {
            this.defaultMode = parsed;
            this.configurationWarning = null;
        }
    }

    @Override
    public FinalLabelSet classify(List<Paragraph> paragraphs) {
        return classify(paragraphs, null, CancellationToken.NONE);
    }

    @Override
    public FinalLabelSet classify(List<Paragraph> paragraphs, LabelingMode mode) {
        return classify(paragraphs, mode, CancellationToken.NONE);
    }

    @Override
    public FinalLabelSet classify(List<Paragraph> paragraphs, LabelingMode mode, CancellationToken cancellation) {
        Objects.requireNonNull(paragraphs, "paragraphs must not be null");
        validateIndices(paragraphs);
        LabelingMode effective = mode == null ? defaultMode : mode;
        CancellationToken token = cancellation == null ? CancellationToken.NONE : cancellation;

        List<String> warnings = new ArrayList<>();
        if (mode == null && configurationWarning != null) {
            warnings.add(configurationWarning);
        }

        boolean addedDocumentId = !ThreadContext.containsKey(DOCUMENT_KEY);
        String previousMode = ThreadContext.get(MODE_KEY);
        ThreadContext.put(MODE_KEY, effective.wireName());
        if (addedDocumentId) {
            ThreadContext.put(DOCUMENT_KEY, UUID.randomUUID().toString().substring(0, 8));
        }
        try {
            FinalLabelSet result = switch (effective) {
                case RULE -> classifyRule(paragraphs, warnings);
                case REMOTE -> classifyRemote(paragraphs, warnings, token);
                case HYBRID -> classifyHybrid(paragraphs, warnings, token);
            };
            metrics.recordLabels(LabelSource.RULE, result.countBySource(LabelSource.RULE));
            metrics.recordLabels(LabelSource.REMOTE, result.countBySource(LabelSource.REMOTE));
            LOG.info("Labeled {} paragraph(s): remote={}, rule={}, remoteCalled={}",
                    result.size(), result.countBySource(LabelSource.REMOTE),
                    result.countBySource(LabelSource.RULE), result.remoteCalled());
            return result;
        } finally {
            if (previousMode == null) {
                ThreadContext.remove(MODE_KEY);
            } else {
                ThreadContext.put(MODE_KEY, previousMode);
            }
            if (addedDocumentId) {
                ThreadContext.remove(DOCUMENT_KEY);
            }
        }
    }

    private FinalLabelSet classifyRule(List<Paragraph> paragraphs, List<String> warnings) {
        return new FinalLabelSet(LabelingMode.RULE, AbstractLabelMerger.ruleLabels(paragraphs),
                List.of(), null, warnings, List.of());
    }

    private FinalLabelSet classifyRemote(List<Paragraph> paragraphs, List<String> warnings,
                                         CancellationToken token) {
        int total = paragraphs.size();
        if (total == 0) {
            TriggerReport empty = new TriggerReport(false, List.of(), 0, 0, false, Map.of(), null);
            return new FinalLabelSet(LabelingMode.REMOTE, List.of(), List.of(), empty, warnings, List.of());
        }
        TriggerReport report = new TriggerReport(true, List.of(REMOTE_MODE_REASON), total, total,
                false, Map.of(), null);
        ClassificationRequest request = ClassificationRequest.review(paragraphs, Map.of());
        return callAndMerge(LabelingMode.REMOTE, paragraphs, request, report, remoteMerger, warnings, token);
    }

    private FinalLabelSet classifyHybrid(List<Paragraph> paragraphs, List<String> warnings,
                                         CancellationToken token) {
        TriggerEvaluation evaluation = triggerEvaluator.evaluate(paragraphs);
        TriggerReport report = evaluation.toReport();
        if (!evaluation.triggered()) {
            LOG.debug("Hybrid gate not triggered for {} paragraph(s); keeping rule labels", paragraphs.size());
            return new FinalLabelSet(LabelingMode.HYBRID, AbstractLabelMerger.ruleLabels(paragraphs),
                    List.of(), report, warnings, List.of());
        }

        List<Paragraph> subset = new ArrayList<>(evaluation.indices().size());
        for (Integer index : evaluation.indices()) {
            subset.add(paragraphs.get(index));
        }
        Map<Integer, String> context = new LinkedHashMap<>();
        for (Paragraph paragraph : paragraphs) {
            context.put(paragraph.index(), paragraph.label());
        }
        LOG.info("Hybrid gate triggered: {} of {} paragraph(s) sent for review ({})",
                subset.size(), paragraphs.size(), String.join("; ", evaluation.reasons()));
        ClassificationRequest request = ClassificationRequest.review(subset, context);
        return callAndMerge(LabelingMode.HYBRID, paragraphs, request, report, hybridMerger, warnings, token);
    }

    private FinalLabelSet callAndMerge(LabelingMode mode,
                                       List<Paragraph> paragraphs,
                                       ClassificationRequest request,
                                       TriggerReport report,
                                       LabelMerger merger,
                                       List<String> warnings,
                                       CancellationToken token) {
        RemoteInvocation invocation;
        try {
            invocation = remoteClient.execute(request, token);
        } catch (RemoteClassificationException e) {
            return fallback(mode, paragraphs, request, report, warnings, e.getClassification(),
                    e.getMessage(), e.getTraces());
        } catch (RuntimeException e) {
            LOG.error("Unexpected error during remote classification", e);
            // no traces: the client failed outside its retry loop
            String message = FailureClassification.OTHER_ERROR.description() + ": " + e.getClass().getSimpleName()
                    + " (" + TRACES_UNAVAILABLE + ")";
            return fallback(mode, paragraphs, request, report, warnings, FailureClassification.OTHER_ERROR,
                    message, List.of());
        }

        Set<Integer> requested = request.requestedIndices();
        MergeOutcome outcome = merger.merge(paragraphs, requested, invocation.result());
        if (outcome.lowConfidenceFallbacks() > 0) {
            warnings.add(outcome.lowConfidenceFallbacks()
                    + " remote label(s) below the confidence threshold kept their rule label");
        }
        Map<String, Integer> extra = new LinkedHashMap<>();
        extra.put(LOW_CONFIDENCE_METRIC, outcome.lowConfidenceFallbacks());
        extra.put(ADOPTED_METRIC, outcome.adoptedCount());
        return new FinalLabelSet(mode, outcome.labels(), outcome.suggestions(),
                report.withRemoteOutcome(null, extra), warnings, invocation.attempts());
    }

    private FinalLabelSet fallback(LabelingMode mode,
                                   List<Paragraph> paragraphs,
                                   ClassificationRequest request,
                                   TriggerReport report,
                                   List<String> warnings,
                                   FailureClassification classification,
                                   String message,
                                   List<AttemptTrace> attempts) {
        LOG.warn("Remote classification fallback: mode={}, paragraphs={}, subset={}, classification={} ({})",
                mode.wireName(), paragraphs.size(), request.paragraphCount(), classification.wireName(), message);
        metrics.recordFallback(mode, classification);
        warnings.add("Remote classification failed (" + classification.wireName()
                + "), deterministic labels used: " + message);
        return new FinalLabelSet(mode, AbstractLabelMerger.ruleLabels(paragraphs), List.of(),
                report.withRemoteOutcome(message, Map.of()), warnings, attempts);
    }

    private static void validateIndices(List<Paragraph> paragraphs) {
        for (int i = 0; i < paragraphs.size(); i++) {
            Paragraph paragraph = Objects.requireNonNull(paragraphs.get(i), "paragraph must not be null");
            if (paragraph.index() != i) {
                throw new IllegalArgumentException(
                        "Paragraph at position " + i + " has index " + paragraph.index());
            }
        }
    }

    @Override
    public LabelingMode getDefaultMode() {
        return defaultMode;
    }
}
