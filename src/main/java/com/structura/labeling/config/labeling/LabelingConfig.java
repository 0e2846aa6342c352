package com.structura.labeling.config.labeling;

import com.structura.labeling.service.merge.LabelMerger;
import com.structura.labeling.service.merge.impl.PassThroughLabelMerger;
import com.structura.labeling.service.merge.impl.ThresholdLabelMerger;
import com.structura.labeling.service.metrics.ClassificationMetrics;
import com.structura.labeling.service.orchestration.DefaultLabelingOrchestrator;
import com.structura.labeling.service.orchestration.LabelingOrchestrator;
import com.structura.labeling.service.remote.RemoteClassifierClient;
import com.structura.labeling.service.trigger.TriggerEvaluator;
import com.structura.labeling.service.trigger.impl.AmbiguousHeadingCondition;
import com.structura.labeling.service.trigger.impl.PotentialListCondition;
import com.structura.labeling.service.trigger.impl.UnknownLabelCondition;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Wires trigger conditions, mergers and the orchestrator from {@link LabelingProperties}.
 */
@Configuration
public class LabelingConfig {

    @Bean
    public TriggerEvaluator triggerEvaluator(LabelingProperties props) {
        return new TriggerEvaluator(List.of(
                new UnknownLabelCondition(),
                new AmbiguousHeadingCondition(props.getHeadingLengthThreshold()),
                new PotentialListCondition(props.getShortBodyThreshold(), props.getShortBodyRunLength(),
                        props.getListConfidenceThreshold())));
    }

    @Bean
    public LabelMerger hybridLabelMerger(LabelingProperties props) {
        return new ThresholdLabelMerger(props.getConfidenceThreshold());
    }

    @Bean
    public LabelMerger remoteLabelMerger() {
        return new PassThroughLabelMerger();
    }

    @Bean
    public LabelingOrchestrator labelingOrchestrator(LabelingProperties props,
                                                     TriggerEvaluator triggerEvaluator,
                                                     RemoteClassifierClient remoteClassifierClient,
                                                     @Qualifier("hybridLabelMerger") LabelMerger hybridMerger,
                                                     @Qualifier("remoteLabelMerger") LabelMerger remoteMerger,
                                                     ClassificationMetrics metrics) {
        return new DefaultLabelingOrchestrator(props.getMode(), triggerEvaluator, remoteClassifierClient,
                hybridMerger, remoteMerger, metrics);
    }
}
