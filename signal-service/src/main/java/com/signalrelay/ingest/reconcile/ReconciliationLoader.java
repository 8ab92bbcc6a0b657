package com.signalrelay.ingest.reconcile;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.signalrelay.common.exception.ReconciliationException;
import com.signalrelay.common.exception.SignalParseException;
import com.signalrelay.common.model.Outcome;
import com.signalrelay.common.model.Signal;
import com.signalrelay.common.model.SignalKind;
import com.signalrelay.common.parse.SignalParser;
import com.signalrelay.common.stats.StatsSeed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Rebuilds history and counters from the persistence sink once, at startup.
 *
 * <p>The sink answers either {@code {"status":"success","data":[...]}} or a bare array of
 * rows. Every row is scanned for outcome markers ({@code action}, {@code result} or
 * {@code status} equal to win/loss, case-insensitive); rows whose action is buy/sell are
 * counted as trades and, when well-formed, kept as history.
 *
 * <p>Any failure leaves the service with empty state. Nothing is thrown to the caller.
 */
public class ReconciliationLoader {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationLoader.class);

    private final WebClient sinkClient;
    private final String sourceUrl;
    private final Duration timeout;
    private final boolean newestFirst;
    private final SignalParser parser;
    private final ObjectMapper objectMapper;

    public ReconciliationLoader(WebClient sinkClient,
                                String sourceUrl,
                                Duration timeout,
                                boolean newestFirst,
                                SignalParser parser,
                                ObjectMapper objectMapper) {
        this.sinkClient   = sinkClient;
        this.sourceUrl    = sourceUrl;
        this.timeout      = timeout;
        this.newestFirst  = newestFirst;
        this.parser       = parser;
        this.objectMapper = objectMapper;
    }

    /**
     * Blocking fetch bounded by the configured timeout. Must not be called from a
     * reactor thread.
     */
    public ReconciliationResult load() {
        if (sourceUrl == null || sourceUrl.isBlank()) {
            log.info("Reconciliation skipped. No history source configured.");
            return ReconciliationResult.empty();
        }
        log.info("Fetching signal history. source={} timeout={}", sourceUrl, timeout);
        try {
            String body = Mono.defer(() -> sinkClient.get()
                    .uri(sourceUrl)
                    .retrieve()
                    .bodyToMono(String.class))
                .timeout(timeout)
                .onErrorMap(e -> !(e instanceof ReconciliationException),
                            e -> new ReconciliationException("fetch from " + sourceUrl + " failed: " + e.getMessage(), e))
                .block();
            if (body == null || body.isBlank()) {
                throw new ReconciliationException("history source returned an empty body");
            }
            ReconciliationResult result = reconcile(readJson(body));
            log.info("Loaded {} past trades. historyRows={} wins={} losses={}",
                     result.seed().totalTrades(), result.history().size(),
                     result.seed().wins(), result.seed().losses());
            return result;
        } catch (ReconciliationException e) {
            log.error("Failed to fetch history. Starting with empty state. reason={}", e.getMessage(), e);
            return ReconciliationResult.empty();
        }
    }

    /**
     * Scans a decoded sink response.
     *
     * @throws ReconciliationException when the response shape is not recognised
     */
    ReconciliationResult reconcile(JsonNode body) {
        JsonNode rows = extractRows(body);

        long total = 0;
        long wins = 0;
        long losses = 0;
        int skipped = 0;
        List<Signal> history = new ArrayList<>();

        for (JsonNode row : rows) {
            if (!row.isObject()) {
                skipped++;
                continue;
            }
            Outcome outcome = outcomeOf(row);
            if (outcome == Outcome.WIN)  wins++;
            if (outcome == Outcome.LOSS) losses++;

            if (SignalKind.fromAction(text(row, "action")) != SignalKind.ENTRY) {
                continue;
            }
            total++;
            try {
                history.add(parser.parseRow(row));
            } catch (SignalParseException e) {
                skipped++;
                log.warn("Skipping history row. reason={}", e.getDetail());
            }
        }

        if (!newestFirst) {
            Collections.reverse(history);
        }
        if (skipped > 0) {
            log.warn("Reconciliation skipped {} malformed rows", skipped);
        }
        return new ReconciliationResult(List.copyOf(history), new StatsSeed(total, wins, losses));
    }

    private JsonNode readJson(String body) {
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ReconciliationException("history source returned malformed JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static JsonNode extractRows(JsonNode body) {
        if (body.isArray()) {
            return body;
        }
        if (!body.isObject()) {
            throw new ReconciliationException("unexpected history payload type " + body.getNodeType());
        }
        String status = text(body, "status");
        if (!"success".equalsIgnoreCase(status)) {
            throw new ReconciliationException("history source reported status=" + status);
        }
        JsonNode data = body.get("data");
        if (data == null || data.isNull()) {
            return JsonNodeFactory.instance.arrayNode();
        }
        if (!data.isArray()) {
            throw new ReconciliationException("history 'data' is not an array");
        }
        return data;
    }

    private static Outcome outcomeOf(JsonNode row) {
        Outcome fromAction = Outcome.fromAction(text(row, "action"));
        if (fromAction != null) return fromAction;
        Outcome fromResult = Outcome.fromMarker(text(row, "result"));
        if (fromResult != null) return fromResult;
        return Outcome.fromMarker(text(row, "status"));
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
