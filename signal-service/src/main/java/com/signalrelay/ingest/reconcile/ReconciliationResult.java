package com.signalrelay.ingest.reconcile;

import com.signalrelay.common.model.Signal;
import com.signalrelay.common.stats.StatsSeed;

import java.util.List;

/**
 * @param history newest-first rows to place in the history store
 * @param seed    counters recomputed from every row the sink returned
 */
public record ReconciliationResult(List<Signal> history, StatsSeed seed) {

    public static ReconciliationResult empty() {
        return new ReconciliationResult(List.of(), StatsSeed.empty());
    }
}
