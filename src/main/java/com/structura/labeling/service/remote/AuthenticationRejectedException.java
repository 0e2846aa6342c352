package com.structura.labeling.service.remote;

import java.io.IOException;

/**
 * Raised by a transport when the remote service refuses the credentials (HTTP 401/403) or no API
 * key is configured. Classified as terminal.
 */
public class AuthenticationRejectedException extends IOException {

    private final int statusCode;

    public AuthenticationRejectedException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    /** HTTP status, or 0 when the request was never sent. */
    public int getStatusCode() {
        return statusCode;
    }
}
