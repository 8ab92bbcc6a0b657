package com.signalrelay.common.model;

import com.signalrelay.common.history.HistoryStore;
import com.signalrelay.common.stats.StatsAggregator;

/** Any other action: relayed to sinks, no state change. */
public record UnrecognizedSignal(Signal signal) implements ClassifiedSignal {

    @Override
    public SignalKind kind() {
        return SignalKind.UNRECOGNIZED;
    }

    @Override
    public void applyTo(HistoryStore history, StatsAggregator stats) {
        // relayed only
    }
}
