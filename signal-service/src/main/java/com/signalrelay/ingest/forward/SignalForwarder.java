package com.signalrelay.ingest.forward;

import com.signalrelay.common.model.NormalizedPayload;

/**
 * Relays a normalized signal to the notification/persistence sinks.
 *
 * <p>Implementations MUST return without waiting for delivery and MUST NOT throw: the
 * webhook response is already decided by the time this is called. Outcomes are only
 * observable through logs and {@link ForwardingStats}.
 */
public interface SignalForwarder {

    /**
     * @param payload the body to deliver
     * @param traceId request trace id, sent to sinks as {@code X-Trace-Id}
     */
    void forward(NormalizedPayload payload, String traceId);
}
