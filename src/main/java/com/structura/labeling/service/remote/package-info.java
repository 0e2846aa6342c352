/**
 * Resilient remote classification.
 *
 * <p>A logical call computes one response timeout from its size ({@link
 * com.structura.labeling.service.remote.TimeoutPolicy}), sends the encoded payload through a
 * {@link com.structura.labeling.service.remote.ClassifierTransport}, classifies failures by
 * exception type ({@link com.structura.labeling.service.remote.FailureClassifier}) and retries
 * transient ones with exponential backoff ({@link com.structura.labeling.service.remote.RetryPolicy}).
 */
package com.structura.labeling.service.remote;
