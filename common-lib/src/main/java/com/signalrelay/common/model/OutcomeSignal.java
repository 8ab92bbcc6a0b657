package com.signalrelay.common.model;

import com.signalrelay.common.history.HistoryStore;
import com.signalrelay.common.stats.StatsAggregator;

/** A win/loss notification. Does not add a history row. */
public record OutcomeSignal(Signal signal, Outcome outcome) implements ClassifiedSignal {

    @Override
    public SignalKind kind() {
        return SignalKind.OUTCOME;
    }

    @Override
    public void applyTo(HistoryStore history, StatsAggregator stats) {
        if (outcome == Outcome.WIN) {
            stats.recordWin();
        } else {
            stats.recordLoss();
        }
    }
}
