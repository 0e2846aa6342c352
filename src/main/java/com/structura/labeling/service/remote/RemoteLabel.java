package com.structura.labeling.service.remote;

import java.util.Objects;

/**
 * Label proposed by the remote classifier for one paragraph, already mapped to an internal role.
 */
public record RemoteLabel(int index, String label, double confidence, String rationale) {

    public RemoteLabel {
        Objects.requireNonNull(label, "label");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be in [0,1], got: " + confidence);
        }
        rationale = rationale == null ? "" : rationale;
    }
}
