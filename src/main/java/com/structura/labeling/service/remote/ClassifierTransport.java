package com.structura.labeling.service.remote;

import java.io.IOException;
import java.time.Duration;

/**
 * Sends one encoded classification payload and returns the raw response body.
 *
 * <p>Implementations raise the exception types of their network stack unchanged; the client
 * classifies them. The timeout bounds the wait for the response of this single attempt.
 */
public interface ClassifierTransport {

    String send(String payload, Duration timeout) throws IOException;
}
