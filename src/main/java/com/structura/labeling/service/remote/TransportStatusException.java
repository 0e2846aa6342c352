package com.structura.labeling.service.remote;

import java.io.IOException;

/**
 * Non-success HTTP status other than an authentication rejection.
 */
public class TransportStatusException extends IOException {

    private final int statusCode;

    public TransportStatusException(int statusCode, String bodyPreview) {
        super("HTTP " + statusCode + (bodyPreview == null || bodyPreview.isBlank() ? "" : ": " + bodyPreview));
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
