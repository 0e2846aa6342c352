package com.structura.labeling.service.remote;

import com.structura.labeling.domain.FailureClassification;

import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpTimeoutException;
import java.nio.channels.UnresolvedAddressException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;

/**
 * Maps a transport failure to a {@link FailureClassification} by exception type.
 *
 * <p>The whole cause chain is inspected, so a timeout wrapped in an {@code ExecutionException} or
 * a runtime wrapper is still recognized. Message text is never consulted.
 */
public final class FailureClassifier {

    private static final int MAX_CAUSE_DEPTH = 16;

    /** Order matters: first match wins. Connect timeout must precede the generic HTTP timeout. */
    private static final Map<Predicate<Throwable>, FailureClassification> MATCHERS = new LinkedHashMap<>();

    static {
        MATCHERS.put(t -> t instanceof AuthenticationRejectedException, FailureClassification.AUTH_ERROR);
        MATCHERS.put(t -> t instanceof HttpConnectTimeoutException, FailureClassification.CONNECT_TIMEOUT);
        MATCHERS.put(t -> t instanceof HttpTimeoutException, FailureClassification.READ_TIMEOUT);
        MATCHERS.put(FailureClassifier::isGenericTimeout, FailureClassification.TIMEOUT);
        MATCHERS.put(FailureClassifier::isConnectionError, FailureClassification.CONNECT_ERROR);
    }

    private FailureClassifier() {
    }

    /**
     * @param failure exception raised by the transport or codec (null yields OTHER_ERROR)
     * @return classification of the first matcher hit anywhere in the cause chain
     */
    public static FailureClassification classify(Throwable failure) {
        if (failure == null) {
            return FailureClassification.OTHER_ERROR;
        }
        List<Throwable> chain = causeChain(failure);
        for (Map.Entry<Predicate<Throwable>, FailureClassification> e : MATCHERS.entrySet()) {
            for (Throwable t : chain) {
                if (e.getKey().test(t)) {
                    return e.getValue();
                }
            }
        }
        return FailureClassification.OTHER_ERROR;
    }

    /**
     * Short description of the innermost cause, e.g. {@code "HttpTimeoutException: request timed out"}.
     */
    public static String describeCause(Throwable failure) {
        if (failure == null) {
            return "";
        }
        List<Throwable> chain = causeChain(failure);
        Throwable root = chain.get(chain.size() - 1);
        String message = root.getMessage();
        String name = root.getClass().getSimpleName();
        return message == null || message.isBlank() ? name : name + ": " + message;
    }

    static List<Throwable> causeChain(Throwable failure) {
        List<Throwable> chain = new ArrayList<>();
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        Throwable current = failure;
        while (current != null && chain.size() < MAX_CAUSE_DEPTH && seen.add(current)) {
            chain.add(current);
            current = current.getCause();
        }
        return chain;
    }

    private static boolean isGenericTimeout(Throwable t) {
        return t instanceof SocketTimeoutException || t instanceof TimeoutException;
    }

    private static boolean isConnectionError(Throwable t) {
        return t instanceof ConnectException
                || t instanceof UnknownHostException
                || t instanceof NoRouteToHostException
                || t instanceof SocketException
                || t instanceof UnresolvedAddressException;
    }
}
