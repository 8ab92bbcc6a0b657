package com.signalrelay.ingest.state;

import com.signalrelay.common.history.HistoryStore;
import com.signalrelay.common.model.ClassifiedSignal;
import com.signalrelay.common.stats.StatsAggregator;
import com.signalrelay.common.stats.StatsSnapshot;
import com.signalrelay.ingest.reconcile.ReconciliationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The one mutable piece of the service: recent history plus trade counters.
 *
 * <p>Both structures sit behind a single lock so that a history insert and its counter
 * update are never interleaved with another request's. Nothing else holds a reference to
 * them.
 */
public class SignalState {

    private static final Logger log = LoggerFactory.getLogger(SignalState.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final HistoryStore history;
    private final StatsAggregator stats;

    public SignalState(int historyCapacity, Clock clock) {
        this.history = new HistoryStore(historyCapacity);
        this.stats   = new StatsAggregator(history, clock);
    }

    public void apply(ClassifiedSignal signal) {
        lock.lock();
        try {
            signal.applyTo(history, stats);
        } finally {
            lock.unlock();
        }
    }

    /** Replaces history and counters with the reconciled startup state. */
    public void seed(ReconciliationResult result) {
        lock.lock();
        try {
            history.replaceAll(result.history());
            stats.seed(result.seed());
            log.info("State seeded. historyRows={} capacity={} totalTrades={} wins={} losses={}",
                     history.size(), history.capacity(),
                     result.seed().totalTrades(), result.seed().wins(), result.seed().losses());
        } finally {
            lock.unlock();
        }
    }

    public StatsSnapshot stats() {
        lock.lock();
        try {
            return stats.snapshot();
        } finally {
            lock.unlock();
        }
    }

    public StateView view() {
        lock.lock();
        try {
            return new StateView(stats.snapshot(), history.all());
        } finally {
            lock.unlock();
        }
    }
}
