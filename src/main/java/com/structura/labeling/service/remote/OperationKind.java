package com.structura.labeling.service.remote;

/**
 * Kind of remote classification call.
 */
public enum OperationKind {
    /** Label every paragraph from scratch. */
    STRUCTURE,
    /** Review deterministic labels; may also return suggestions. */
    REVIEW
}
