package com.structura.labeling.service.remote;

import com.structura.labeling.domain.AttemptTrace;

import java.util.List;
import java.util.Objects;

/**
 * Successful outcome of a logical remote call, with the trace of every attempt it took.
 */
public record RemoteInvocation(ClassificationResult result, List<AttemptTrace> attempts) {

    public RemoteInvocation {
        Objects.requireNonNull(result, "result");
        attempts = attempts == null ? List.of() : List.copyOf(attempts);
    }

    public int attemptCount() {
        return attempts.size();
    }
}
