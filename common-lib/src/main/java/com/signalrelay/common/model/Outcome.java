package com.signalrelay.common.model;

/**
 * Result of a closed trade.
 */
public enum Outcome {

    WIN,
    LOSS;

    /**
     * Reads a result marker such as {@code "win"} or {@code "LOSS"}.
     *
     * @return the outcome, or {@code null} when the value is not a marker
     */
    public static Outcome fromMarker(String value) {
        if (value == null) return null;
        String v = value.trim();
        if ("win".equalsIgnoreCase(v))  return WIN;
        if ("loss".equalsIgnoreCase(v)) return LOSS;
        return null;
    }

    /** Like {@link #fromMarker} but also accepts the {@code tp}/{@code sl} action aliases. */
    public static Outcome fromAction(String action) {
        Outcome marker = fromMarker(action);
        if (marker != null || action == null) return marker;
        String v = action.trim();
        if ("tp".equalsIgnoreCase(v)) return WIN;
        if ("sl".equalsIgnoreCase(v)) return LOSS;
        return null;
    }
}
