package com.signalrelay.common.model;

/**
 * Class of an inbound action.
 *
 * <ul>
 *   <li>ENTRY: {@code buy} / {@code sell}: becomes a history row and a counted trade</li>
 *   <li>OUTCOME: {@code win} / {@code loss} (and {@code tp} / {@code sl}): adjusts counters only</li>
 *   <li>UNRECOGNIZED: anything else: relayed, never counted</li>
 * </ul>
 */
public enum SignalKind {

    ENTRY,
    OUTCOME,
    UNRECOGNIZED;

    /** Case-insensitive classification of the raw action string. */
    public static SignalKind fromAction(String action) {
        if (action == null) return UNRECOGNIZED;
        String v = action.trim();
        if ("buy".equalsIgnoreCase(v) || "sell".equalsIgnoreCase(v)) return ENTRY;
        if (Outcome.fromAction(v) != null) return OUTCOME;
        return UNRECOGNIZED;
    }
}
