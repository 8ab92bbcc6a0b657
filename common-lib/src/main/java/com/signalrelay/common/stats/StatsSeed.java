package com.signalrelay.common.stats;

/**
 * Counter values rebuilt from the persistence sink at startup.
 */
public record StatsSeed(long totalTrades, long wins, long losses) {

    public static StatsSeed empty() {
        return new StatsSeed(0, 0, 0);
    }
}
