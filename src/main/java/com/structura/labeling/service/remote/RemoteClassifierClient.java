package com.structura.labeling.service.remote;

import com.structura.labeling.domain.AttemptTrace;
import com.structura.labeling.domain.FailureClassification;
import com.structura.labeling.exception.RemoteClassificationException;
import com.structura.labeling.service.metrics.ClassificationMetrics;
import com.structura.labeling.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Executes one logical remote classification call with timeout scaling, failure classification
 * and bounded retries.
 *
 * <p>The response timeout is computed once from the request's paragraph count and reused for
 * every attempt. Failed attempts are classified by exception type; transient failures are retried
 * after an exponential backoff while attempts remain. The cancellation token is polled before the
 * backoff sleep and again before the next attempt, never during one.
 *
 * <p>Thread-safe: holds no per-call state. Every attempt is traced, logged and counted.
 */
public class RemoteClassifierClient {

    private static final Logger LOG = LogManager.getLogger(RemoteClassifierClient.class);

    private final ClassifierTransport transport;
    private final ClassificationPayloadCodec codec;
    private final TimeoutPolicy timeoutPolicy;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;
    private final ClassificationMetrics metrics;

    public RemoteClassifierClient(ClassifierTransport transport,
                                  ClassificationPayloadCodec codec,
                                  TimeoutPolicy timeoutPolicy,
                                  RetryPolicy retryPolicy,
                                  Sleeper sleeper,
                                  ClassificationMetrics metrics) {
        this.transport = Objects.requireNonNull(transport, "transport must not be null");
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        this.timeoutPolicy = Objects.requireNonNull(timeoutPolicy, "timeoutPolicy must not be null");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    public RemoteInvocation execute(ClassificationRequest request) {
        return execute(request, CancellationToken.NONE);
    }

    /**
     * @param request      paragraphs to classify
     * @param cancellation polled between attempts
     * @return decoded result plus the trace of every attempt
     * @throws RemoteClassificationException when the call fails for good
     */
    public RemoteInvocation execute(ClassificationRequest request, CancellationToken cancellation) {
        Objects.requireNonNull(request, "request must not be null");
        CancellationToken token = cancellation == null ? CancellationToken.NONE : cancellation;

        Duration timeout = timeoutPolicy.computeDynamicTimeout(request.paragraphCount());
        String payload = codec.encode(request);
        int maxAttempts = retryPolicy.getMaxAttempts();
        List<AttemptTrace> traces = new ArrayList<>();

        LOG.debug("Remote {} call: paragraphs={}, timeout={}s, maxAttempts={}",
                request.operation(), request.paragraphCount(), TimeUtils.toSeconds(timeout), maxAttempts);

        int attempt = 1;
        while (true) {
            long start = System.nanoTime();
            try {
                String body = transport.send(payload, timeout);
                ClassificationResult result = codec.decode(body, request);
                long elapsed = TimeUtils.elapsedNanos(start);
                traces.add(AttemptTrace.success(attempt, timeout, TimeUtils.nanosToMillis(elapsed)));
                metrics.recordAttempt(null, elapsed);
                LOG.info("Remote {} call succeeded on attempt {}/{} in {} ms ({} labels)",
                        request.operation(), attempt, maxAttempts, TimeUtils.nanosToMillis(elapsed),
                        result.labels().size());
                return new RemoteInvocation(result, traces);
            } catch (IOException | RuntimeException e) {
                long elapsed = TimeUtils.elapsedNanos(start);
                FailureClassification classification = FailureClassifier.classify(e);
                String cause = FailureClassifier.describeCause(e);
                traces.add(AttemptTrace.failure(attempt, timeout, TimeUtils.nanosToMillis(elapsed), classification));
                metrics.recordAttempt(classification, elapsed);

                if (!retryPolicy.shouldRetry(classification, attempt)) {
                    LOG.warn("Remote {} call failed: {} on attempt {}/{} ({})",
                            request.operation(), classification.wireName(), attempt, maxAttempts, cause);
                    throw new RemoteClassificationException(classification, attempt, maxAttempts, false,
                            cause, traces, e);
                }

                int next = attempt + 1;
                Duration backoff = retryPolicy.backoffBefore(next);
                LOG.warn("Remote {} attempt {}/{} failed: {} ({}); retrying in {}s",
                        request.operation(), attempt, maxAttempts, classification.wireName(), cause,
                        TimeUtils.toSeconds(backoff));
                if (!awaitRetry(backoff, token)) {
                    LOG.warn("Remote {} call cancelled after attempt {}/{} ({})",
                            request.operation(), attempt, maxAttempts, classification.wireName());
                    throw new RemoteClassificationException(classification, attempt, maxAttempts, true,
                            cause, traces, e);
                }
                attempt = next;
            }
        }
    }

    /**
     * Sleeps the backoff unless cancelled before or after it.
     *
     * @return false if the call must stop
     */
    private boolean awaitRetry(Duration backoff, CancellationToken token) {
        if (token.isCancelled()) {
            return false;
        }
        try {
            sleeper.sleep(backoff);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        }
        return !token.isCancelled();
    }

    public TimeoutPolicy getTimeoutPolicy() {
        return timeoutPolicy;
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }
}
