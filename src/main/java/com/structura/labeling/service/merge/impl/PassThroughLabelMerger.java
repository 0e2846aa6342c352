package com.structura.labeling.service.merge.impl;

import com.structura.labeling.domain.Paragraph;
import com.structura.labeling.service.merge.AbstractLabelMerger;
import com.structura.labeling.service.remote.RemoteLabel;

/**
 * Remote-only merge: every remote label for a requested paragraph is adopted.
 */
public class PassThroughLabelMerger extends AbstractLabelMerger {

    @Override
    protected boolean accept(Paragraph paragraph, RemoteLabel remote) {
        return true;
    }
}
