package com.signalrelay.common.model;

import com.signalrelay.common.history.HistoryStore;
import com.signalrelay.common.stats.StatsAggregator;

/** A new buy/sell instruction. */
public record EntrySignal(Signal signal) implements ClassifiedSignal {

    @Override
    public SignalKind kind() {
        return SignalKind.ENTRY;
    }

    @Override
    public void applyTo(HistoryStore history, StatsAggregator stats) {
        history.pushFront(signal);
        stats.recordEntry();
    }
}
