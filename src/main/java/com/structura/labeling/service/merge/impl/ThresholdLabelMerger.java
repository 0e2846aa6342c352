package com.structura.labeling.service.merge.impl;

import com.structura.labeling.domain.Paragraph;
import com.structura.labeling.service.merge.AbstractLabelMerger;
import com.structura.labeling.service.remote.RemoteLabel;

/**
 * Hybrid merge: a remote label is adopted only when its confidence reaches the acceptance
 * threshold; otherwise the deterministic label stays.
 */
public class ThresholdLabelMerger extends AbstractLabelMerger {

    private final double confidenceThreshold;

    public ThresholdLabelMerger(double confidenceThreshold) {
        if (confidenceThreshold < 0.0 || confidenceThreshold > 1.0) {
            throw new IllegalArgumentException("confidenceThreshold must be in [0,1], got: " + confidenceThreshold);
        }
        this.confidenceThreshold = confidenceThreshold;
    }

    @Override
    protected boolean accept(Paragraph paragraph, RemoteLabel remote) {
        return remote.confidence() >= confidenceThreshold;
    }

    public double getConfidenceThreshold() {
        return confidenceThreshold;
    }
}
