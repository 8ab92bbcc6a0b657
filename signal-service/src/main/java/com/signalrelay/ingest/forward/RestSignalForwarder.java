package com.signalrelay.ingest.forward;

import com.signalrelay.common.exception.ForwardingException;
import com.signalrelay.common.model.NormalizedPayload;
import com.signalrelay.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * HTTP implementation of {@link SignalForwarder}.
 *
 * <p>POSTs the payload as JSON to every configured sink. Each delivery is its own
 * subscription with its own timeout: no retry, no ordering between sinks or between
 * requests. With no sink configured the payload is only logged.
 */
public class RestSignalForwarder implements SignalForwarder {

    private static final Logger log = LoggerFactory.getLogger(RestSignalForwarder.class);

    private final WebClient sinkClient;
    private final List<String> sinkUrls;
    private final Duration timeout;
    private final ForwardingStats stats;

    public RestSignalForwarder(WebClient sinkClient, List<String> sinkUrls,
                               Duration timeout, ForwardingStats stats) {
        this.sinkClient = sinkClient.mutate().filter(traceHeaderFilter()).build();
        this.sinkUrls   = sinkUrls.stream().map(String::trim).filter(u -> !u.isEmpty()).toList();
        this.timeout    = timeout;
        this.stats      = stats;
    }

    @Override
    public void forward(NormalizedPayload payload, String traceId) {
        if (sinkUrls.isEmpty()) {
            try (MDC.MDCCloseable scope = TraceContextUtil.logScope(traceId)) {
                log.info("No sink configured. Logging payload instead. ticker={} action={} chatId={}",
                         payload.ticker(), payload.action(), payload.chatId());
            }
            return;
        }
        for (String url : sinkUrls) {
            deliver(url, payload, traceId);
        }
    }

    private void deliver(String url, NormalizedPayload payload, String traceId) {
        Mono.defer(() -> sinkClient.post()
                .uri(url)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(payload)
                .retrieve()
                .toBodilessEntity())
            .timeout(timeout)
            .onErrorMap(e -> new ForwardingException(url, e))
            .contextWrite(TraceContextUtil.deliveryContext(traceId))
            .subscribe(
                r   -> {
                    stats.recordDelivered();
                    try (MDC.MDCCloseable scope = TraceContextUtil.logScope(traceId)) {
                        log.info("Signal forwarded. sink={} ticker={} status={} traceId={}",
                                 url, payload.ticker(), r.getStatusCode(), traceId);
                    }
                },
                err -> {
                    String sink = err instanceof ForwardingException fe ? fe.getSinkUrl() : url;
                    stats.recordFailure(sink, err.getMessage());
                    try (MDC.MDCCloseable scope = TraceContextUtil.logScope(traceId)) {
                        log.warn("Signal forward failed (non-critical). sink={} ticker={} traceId={}",
                                 sink, payload.ticker(), traceId, err);
                    }
                }
            );
    }

    /**
     * Stamps {@value TraceContextUtil#TRACE_ID_HEADER} on each sink call from the id its
     * delivery subscription carries.
     */
    static ExchangeFilterFunction traceHeaderFilter() {
        return (request, next) -> Mono.deferContextual(ctx -> {
            ClientRequest traced = TraceContextUtil.traceIdOf(ctx)
                .map(id -> ClientRequest.from(request).header(TraceContextUtil.TRACE_ID_HEADER, id).build())
                .orElse(request);
            return next.exchange(traced);
        });
    }
}
