package com.structura.labeling.exception;

/**
 * Thrown when the remote classifier answers, but the body cannot be read as a classification
 * payload (not JSON, no message content, missing envelope).
 */
public class MalformedRemotePayloadException extends StructuraException {

    private final String bodyPreview;

    public MalformedRemotePayloadException(String message, String bodyPreview) {
        super(message);
        this.bodyPreview = bodyPreview == null ? "" : bodyPreview;
    }

    public MalformedRemotePayloadException(String message, String bodyPreview, Throwable cause) {
        super(message, cause);
        this.bodyPreview = bodyPreview == null ? "" : bodyPreview;
    }

    /** First characters of the offending body, for diagnostics. */
    public String getBodyPreview() {
        return bodyPreview;
    }
}
