package com.signalrelay.ingest.forward;

import com.signalrelay.common.model.NormalizedPayload;
import com.signalrelay.common.trace.TraceContextUtil;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class RestSignalForwarderTest {

    private static final NormalizedPayload PAYLOAD = new NormalizedPayload(
        "buy", "BTCUSD", 50000, 0, 0, 0, 0, null, null, "2024-03-15", "10:15:30", "-1001", "text");

    private final List<ClientRequest> requests = new CopyOnWriteArrayList<>();
    private final ForwardingStats stats = new ForwardingStats();

    private WebClient client(HttpStatus status) {
        return WebClient.builder()
            .exchangeFunction(request -> {
                requests.add(request);
                return Mono.just(ClientResponse.create(status).build());
            })
            .build();
    }

    private static void awaitUntil(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("condition not met within 5s");
            }
            Thread.sleep(10);
        }
    }

    @Test
    @DisplayName("POSTs to every sink with the trace id header")
    void deliversToEverySink() throws Exception {
        RestSignalForwarder forwarder = new RestSignalForwarder(
            client(HttpStatus.OK), List.of("http://a.test/hook", " http://b.test/hook "), Duration.ofSeconds(2), stats);

        forwarder.forward(PAYLOAD, "trace-42");

        awaitUntil(() -> stats.delivered() == 2);
        assertEquals(0, stats.failed());
        assertEquals(2, requests.size());
        for (ClientRequest request : requests) {
            assertEquals(HttpMethod.POST, request.method());
            assertEquals("trace-42", request.headers().getFirst(TraceContextUtil.TRACE_ID_HEADER));
        }
        assertEquals(Set.of("a.test", "b.test"),
                     requests.stream().map(r -> r.url().getHost()).collect(Collectors.toSet()));
    }

    @Test
    @DisplayName("sink error is counted, never thrown")
    void failureIsCounted() throws Exception {
        RestSignalForwarder forwarder = new RestSignalForwarder(
            client(HttpStatus.INTERNAL_SERVER_ERROR), List.of("http://a.test/hook"), Duration.ofSeconds(2), stats);

        assertDoesNotThrow(() -> forwarder.forward(PAYLOAD, "trace-1"));

        awaitUntil(() -> stats.failed() == 1);
        assertEquals(0, stats.delivered());
        ForwardingStats.Failure last = stats.snapshot().lastFailure();
        assertNotNull(last);
        assertEquals("http://a.test/hook", last.sink());
    }

    @Test
    @DisplayName("hung sink times out as a failure")
    void timeoutIsCounted() throws Exception {
        WebClient hung = WebClient.builder().exchangeFunction(request -> Mono.never()).build();
        RestSignalForwarder forwarder = new RestSignalForwarder(
            hung, List.of("http://slow.test/hook"), Duration.ofMillis(100), stats);

        forwarder.forward(PAYLOAD, "trace-1");

        awaitUntil(() -> stats.failed() == 1);
    }

    @Test
    @DisplayName("no sinks → nothing sent")
    void noSinks() {
        RestSignalForwarder forwarder = new RestSignalForwarder(
            client(HttpStatus.OK), List.of(" ", ""), Duration.ofSeconds(2), stats);

        forwarder.forward(PAYLOAD, "trace-1");

        assertTrue(requests.isEmpty());
        assertEquals(0, stats.delivered());
        assertEquals(0, stats.failed());
    }

    @Test
    @DisplayName("trace header is only stamped inside a delivery subscription")
    void headerComesFromDeliveryContext() {
        WebClient plain = client(HttpStatus.OK).mutate()
            .filter(RestSignalForwarder.traceHeaderFilter())
            .build();

        plain.get().uri("http://a.test/ping").retrieve().toBodilessEntity().block(Duration.ofSeconds(2));
        plain.get().uri("http://a.test/ping").retrieve().toBodilessEntity()
            .contextWrite(TraceContextUtil.deliveryContext("ctx-7"))
            .block(Duration.ofSeconds(2));

        assertEquals(2, requests.size());
        assertNull(requests.get(0).headers().getFirst(TraceContextUtil.TRACE_ID_HEADER));
        assertEquals("ctx-7", requests.get(1).headers().getFirst(TraceContextUtil.TRACE_ID_HEADER));
    }
}
