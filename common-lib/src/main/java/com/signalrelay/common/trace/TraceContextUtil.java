package com.signalrelay.common.trace;

import org.slf4j.MDC;
import reactor.util.context.Context;
import reactor.util.context.ContextView;

import java.util.Optional;
import java.util.UUID;

/**
 * Trace id for one webhook request, from receipt to every sink delivery.
 *
 * <p>Synchronous code holds the id as a plain value and opens an MDC scope around its log
 * calls. Sink deliveries run later on reactor threads, so each delivery subscription
 * carries the id in its Reactor Context; the sink client reads it from there when it
 * stamps the outbound {@value #TRACE_ID_HEADER} header.
 */
public final class TraceContextUtil {

    public static final String TRACE_ID_KEY    = "traceId";
    public static final String TRACE_ID_HEADER = "X-Trace-Id";

    private TraceContextUtil() {}

    /** Caller-supplied id when present, otherwise a fresh one. */
    public static String resolve(String headerValue) {
        if (headerValue != null && !headerValue.isBlank()) {
            return headerValue.trim();
        }
        return UUID.randomUUID().toString().replace("-", "");
    }

    /** Context for {@code contextWrite} on a delivery subscription. */
    public static Context deliveryContext(String traceId) {
        return Context.of(TRACE_ID_KEY, traceId);
    }

    /** Id stored by {@link #deliveryContext}, empty outside a delivery. */
    public static Optional<String> traceIdOf(ContextView ctx) {
        return ctx.getOrEmpty(TRACE_ID_KEY);
    }

    /**
     * Puts {@code traceId} into MDC until the returned scope is closed. Use with
     * try-with-resources around the log calls of a single request.
     */
    public static MDC.MDCCloseable logScope(String traceId) {
        return MDC.putCloseable(TRACE_ID_KEY, traceId);
    }
}
