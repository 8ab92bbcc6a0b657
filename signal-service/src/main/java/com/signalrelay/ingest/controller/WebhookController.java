package com.signalrelay.ingest.controller;

import com.signalrelay.common.trace.TraceContextUtil;
import com.signalrelay.ingest.dto.WebhookResponse;
import com.signalrelay.ingest.pipeline.IngestionPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

/**
 * Inbound alert endpoint. The body is taken as raw bytes so that alerting tools which
 * label JSON as {@code text/plain} are still accepted.
 */
@RestController
public class WebhookController {

    private static final Logger log = LoggerFactory.getLogger(WebhookController.class);

    private final IngestionPipeline pipeline;

    public WebhookController(IngestionPipeline pipeline) {
        this.pipeline = pipeline;
    }

    @PostMapping("/webhook")
    public Mono<ResponseEntity<WebhookResponse>> receive(
            @RequestBody(required = false) byte[] body,
            @RequestHeader(value = TraceContextUtil.TRACE_ID_HEADER, required = false) String traceHeader) {
        String traceId = TraceContextUtil.resolve(traceHeader);
        return Mono.fromCallable(() -> pipeline.ingest(body, traceId))
            .map(payload -> ResponseEntity.ok(WebhookResponse.received()))
            .doOnError(e -> {
                try (MDC.MDCCloseable scope = TraceContextUtil.logScope(traceId)) {
                    log.warn("Webhook rejected. traceId={} reason={}", traceId, e.getMessage());
                }
            });
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<String>> health() {
        return Mono.just(ResponseEntity.ok("OK"));
    }
}
