package com.signalrelay.common.exception;

/**
 * Inbound body is not valid JSON or does not satisfy the signal schema.
 * Surfaced to the caller as HTTP 422; nothing is mutated or forwarded.
 */
public class SignalParseException extends SignalRelayException {

    private final String detail;

    public SignalParseException(String detail) {
        super("parser", detail);
        this.detail = detail;
    }

    public SignalParseException(String detail, Throwable cause) {
        super("parser", detail, cause);
        this.detail = detail;
    }

    /** Message without the component prefix, suitable for a response body. */
    public String getDetail() {
        return detail;
    }
}
