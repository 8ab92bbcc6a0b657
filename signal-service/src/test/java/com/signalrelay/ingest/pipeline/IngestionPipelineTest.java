package com.signalrelay.ingest.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.signalrelay.common.exception.SignalParseException;
import com.signalrelay.common.model.NormalizedPayload;
import com.signalrelay.common.parse.SignalParser;
import com.signalrelay.common.stats.StatsSnapshot;
import com.signalrelay.ingest.forward.SignalForwarder;
import com.signalrelay.ingest.state.SignalState;
import com.signalrelay.ingest.state.StateView;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class IngestionPipelineTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-15T10:15:30Z"), ZoneOffset.UTC);

    private final List<NormalizedPayload> forwarded = new CopyOnWriteArrayList<>();
    private final List<String> traceIds = new CopyOnWriteArrayList<>();

    private SignalState state;
    private IngestionPipeline pipeline;

    @BeforeEach
    void setUp() {
        state = new SignalState(50, CLOCK);
        SignalForwarder recorder = (payload, traceId) -> {
            forwarded.add(payload);
            traceIds.add(traceId);
        };
        pipeline = new IngestionPipeline(new SignalParser(new ObjectMapper(), CLOCK), state, recorder, "-1001");
    }

    private NormalizedPayload ingest(String body) {
        return pipeline.ingest(body.getBytes(StandardCharsets.UTF_8), "trace-1");
    }

    @Nested
    @DisplayName("accepted signals")
    class Accepted {

        @Test
        @DisplayName("buy → one trade, history head, payload forwarded")
        void buy() {
            NormalizedPayload payload = ingest("{\"action\":\"buy\",\"ticker\":\"BTCUSD\",\"price\":50000}");

            StateView view = state.view();
            assertEquals(1, view.stats().totalTrades());
            assertEquals(1, view.stats().todayTrades());
            assertEquals("BTCUSD", view.signals().get(0).ticker());

            assertEquals(List.of(payload), forwarded);
            assertEquals(List.of("trace-1"), traceIds);
            assertEquals("-1001", payload.chatId());
            assertTrue(payload.text().contains("BTCUSD"));
            assertEquals("2024-03-15", payload.date());
            assertEquals("10:15:30", payload.time());
        }

        @Test
        @DisplayName("win after buy → counters only, history unchanged")
        void winAfterBuy() {
            ingest("{\"action\":\"buy\",\"ticker\":\"BTCUSD\",\"price\":50000}");
            ingest("{\"action\":\"win\",\"ticker\":\"BTCUSD\",\"price\":51000}");

            StateView view = state.view();
            StatsSnapshot stats = view.stats();
            assertEquals(1, stats.wins());
            assertEquals(0, stats.losses());
            assertEquals(100.0, stats.winRate());
            assertEquals(1, stats.totalTrades());
            assertEquals(1, view.signals().size());
            assertEquals(2, forwarded.size());
        }

        @Test
        @DisplayName("unrecognized action is relayed without touching state")
        void unrecognized() {
            ingest("{\"action\":\"close\",\"ticker\":\"BTCUSD\",\"price\":1}");

            StateView view = state.view();
            assertEquals(0, view.stats().totalTrades());
            assertEquals(0, view.signals().size());
            assertEquals(1, forwarded.size());
        }
    }

    @Nested
    @DisplayName("rejected signals")
    class Rejected {

        @Test
        @DisplayName("missing ticker → parse error, no state change, nothing forwarded")
        void missingTicker() {
            ingest("{\"action\":\"buy\",\"ticker\":\"A\",\"price\":1}");
            forwarded.clear();

            assertThrows(SignalParseException.class,
                () -> ingest("{\"action\":\"buy\",\"price\":50000}"));

            assertEquals(1, state.stats().totalTrades());
            assertTrue(forwarded.isEmpty());
        }
    }

    @Test
    @DisplayName("a throwing forwarder does not fail ingestion")
    void forwarderFailureIsContained() {
        SignalForwarder broken = (payload, traceId) -> {
            throw new IllegalStateException("sink client closed");
        };
        IngestionPipeline p = new IngestionPipeline(new SignalParser(new ObjectMapper(), CLOCK), state, broken, "");

        NormalizedPayload payload = assertDoesNotThrow(() ->
            p.ingest("{\"action\":\"sell\",\"ticker\":\"ETHUSD\",\"price\":3000}".getBytes(StandardCharsets.UTF_8), "trace-2"));

        assertEquals("ETHUSD", payload.ticker());
        assertEquals(1, state.stats().totalTrades());
    }
}
