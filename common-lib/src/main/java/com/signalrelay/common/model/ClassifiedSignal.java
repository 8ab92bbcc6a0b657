package com.signalrelay.common.model;

import com.signalrelay.common.history.HistoryStore;
import com.signalrelay.common.stats.StatsAggregator;

/**
 * A parsed signal tagged with its class. Each variant owns the state change it causes,
 * so callers never branch on the action string again.
 */
public interface ClassifiedSignal {

    Signal signal();

    SignalKind kind();

    /**
     * Applies this signal to the shared state. Callers must hold the lock that guards
     * both structures.
     */
    void applyTo(HistoryStore history, StatsAggregator stats);

    static ClassifiedSignal of(Signal signal) {
        return switch (SignalKind.fromAction(signal.action())) {
            case ENTRY        -> new EntrySignal(signal);
            case OUTCOME      -> new OutcomeSignal(signal, Outcome.fromAction(signal.action()));
            case UNRECOGNIZED -> new UnrecognizedSignal(signal);
        };
    }
}
