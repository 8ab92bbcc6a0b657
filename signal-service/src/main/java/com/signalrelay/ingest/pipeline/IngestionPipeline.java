package com.signalrelay.ingest.pipeline;

import com.signalrelay.common.model.ClassifiedSignal;
import com.signalrelay.common.model.NormalizedPayload;
import com.signalrelay.common.model.Signal;
import com.signalrelay.common.model.SignalKind;
import com.signalrelay.common.parse.SignalParser;
import com.signalrelay.common.trace.TraceContextUtil;
import com.signalrelay.ingest.forward.SignalForwarder;
import com.signalrelay.ingest.state.SignalState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Webhook ingestion: parse, apply to state, normalize, relay.
 *
 * <p>Parsing and payload building run without any lock; only the state change itself is
 * serialized inside {@link SignalState}. Forwarding is handed off before returning and
 * its outcome never reaches the caller.
 */
public class IngestionPipeline {

    private static final Logger log = LoggerFactory.getLogger(IngestionPipeline.class);

    private final SignalParser parser;
    private final SignalState state;
    private final SignalForwarder forwarder;
    private final String defaultChatId;

    public IngestionPipeline(SignalParser parser, SignalState state,
                             SignalForwarder forwarder, String defaultChatId) {
        this.parser        = parser;
        this.state         = state;
        this.forwarder     = forwarder;
        this.defaultChatId = defaultChatId;
    }

    /**
     * @throws com.signalrelay.common.exception.SignalParseException when the body is
     *         malformed; state is untouched and nothing is forwarded
     */
    public NormalizedPayload ingest(byte[] raw, String traceId) {
        ClassifiedSignal classified = parser.parse(raw);
        Signal signal = classified.signal();

        state.apply(classified);
        try (MDC.MDCCloseable scope = TraceContextUtil.logScope(traceId)) {
            if (classified.kind() == SignalKind.UNRECOGNIZED) {
                log.info("Unrecognized action relayed without state change. ticker={} action={} traceId={}",
                         signal.ticker(), signal.action(), traceId);
            } else {
                log.info("Signal received. ticker={} action={} kind={} traceId={}",
                         signal.ticker(), signal.action(), classified.kind(), traceId);
            }
        }

        NormalizedPayload payload = NormalizedPayload.of(signal, defaultChatId);
        dispatch(payload, traceId);
        return payload;
    }

    private void dispatch(NormalizedPayload payload, String traceId) {
        try {
            forwarder.forward(payload, traceId);
        } catch (RuntimeException e) {
            try (MDC.MDCCloseable scope = TraceContextUtil.logScope(traceId)) {
                log.error("Forwarder rejected payload. ticker={} traceId={}", payload.ticker(), traceId, e);
            }
        }
    }
}
