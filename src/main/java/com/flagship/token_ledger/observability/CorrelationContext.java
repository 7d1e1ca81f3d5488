package com.flagship.token_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Per-thread request context shared between the web layer, the ledger host and the
 * notification channel.
 *
 * Holds the correlation ID of the current request and mirrors it, together with the
 * account making the ledger call, into the logging MDC.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String CALLER_ACCOUNT_MDC_KEY = "callerAccount";

    static final String ANONYMOUS_CALLER = "anonymous";

    private static final ThreadLocal<String> CURRENT = new ThreadLocal<>();

    private CorrelationContext() {
    }

    /**
     * Starts a request with the given correlation ID, or a fresh one if it is blank.
     *
     * @return the correlation ID now in effect
     */
    public static String begin(String requestedId) {
        String id = requestedId != null && !requestedId.isBlank() ? requestedId : newCorrelationId();
        CURRENT.set(id);
        MDC.put(CORRELATION_ID_MDC_KEY, id);
        return id;
    }

    /**
     * Correlation ID of the current request. Outside a request (schedulers, startup, tests)
     * each call returns a fresh ID and nothing is bound to the thread.
     */
    public static String getCorrelationId() {
        String id = CURRENT.get();
        return id != null ? id : newCorrelationId();
    }

    /**
     * Tags subsequent log lines with the calling account; {@code null} means no caller
     * identity was given.
     */
    public static void enterCall(String callerAccount) {
        MDC.put(CALLER_ACCOUNT_MDC_KEY, callerAccount != null ? callerAccount : ANONYMOUS_CALLER);
    }

    public static void exitCall() {
        MDC.remove(CALLER_ACCOUNT_MDC_KEY);
    }

    public static void end() {
        CURRENT.remove();
        MDC.remove(CORRELATION_ID_MDC_KEY);
        MDC.remove(CALLER_ACCOUNT_MDC_KEY);
    }

    static String newCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
