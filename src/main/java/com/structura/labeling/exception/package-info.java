/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.structura.labeling.exception.StructuraException} - Base exception for all
 *       application-specific errors</li>
 *   <li>{@link com.structura.labeling.exception.RemoteClassificationException} - A logical
 *       remote classification call failed after classification and retries; carries the
 *       {@link com.structura.labeling.domain.FailureClassification} and per-attempt traces</li>
 *   <li>{@link com.structura.labeling.exception.MalformedRemotePayloadException} - The remote
 *       service answered with a body that is not a classification payload</li>
 * </ul>
 *
 * <p>Malformed configuration is reported with {@link java.lang.IllegalArgumentException} from the
 * properties constructors, before any document is processed.
 */
package com.structura.labeling.exception;
