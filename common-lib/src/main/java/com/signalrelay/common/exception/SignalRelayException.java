package com.signalrelay.common.exception;

/**
 * Base for every failure raised by the relay core. The component name is prefixed to the
 * message so log lines stay attributable without a stack trace.
 */
public class SignalRelayException extends RuntimeException {
    private final String component;

    public SignalRelayException(String component, String message) {
        super("[" + component + "] " + message);
        this.component = component;
    }

    public SignalRelayException(String component, String message, Throwable cause) {
        super("[" + component + "] " + message, cause);
        this.component = component;
    }

    public String getComponent() {
        return component;
    }
}
