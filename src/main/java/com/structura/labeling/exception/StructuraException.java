package com.structura.labeling.exception;

/**
 * Base exception for all Structura labeling errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class StructuraException extends RuntimeException {

    public StructuraException(String message) {
        super(message);
    }

    public StructuraException(String message, Throwable cause) {
        super(message, cause);
    }

    public StructuraException(Throwable cause) {
        super(cause);
    }
}
