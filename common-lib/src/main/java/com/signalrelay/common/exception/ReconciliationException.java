package com.signalrelay.common.exception;

/**
 * Startup history fetch failed. Always logged and swallowed by the loader.
 */
public class ReconciliationException extends SignalRelayException {

    public ReconciliationException(String message) {
        super("reconciliation", message);
    }

    public ReconciliationException(String message, Throwable cause) {
        super("reconciliation", message, cause);
    }
}
