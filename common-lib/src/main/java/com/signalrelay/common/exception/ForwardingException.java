package com.signalrelay.common.exception;

/**
 * Delivery to a sink failed (transport error, timeout or non-2xx status).
 */
public class ForwardingException extends SignalRelayException {

    private final String sinkUrl;

    public ForwardingException(String sinkUrl, Throwable cause) {
        super("forwarder", "Delivery to " + sinkUrl + " failed: " + cause.getMessage(), cause);
        this.sinkUrl = sinkUrl;
    }

    public String getSinkUrl() {
        return sinkUrl;
    }
}
