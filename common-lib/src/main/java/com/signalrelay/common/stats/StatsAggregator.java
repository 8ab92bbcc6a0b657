package com.signalrelay.common.stats;

import com.signalrelay.common.history.HistoryStore;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Running trade counters plus the derived win rate.
 *
 * <p>{@code totalTrades} counts every entry ever received and is unaffected by history
 * eviction. {@code todayTrades} is never stored: each {@link #snapshot()} recounts the
 * history rows dated today, so a date rollover is picked up on the next read.
 *
 * <p>Not thread-safe; guarded together with its {@link HistoryStore}.
 */
public class StatsAggregator {

    private final HistoryStore history;
    private final Clock clock;

    private long totalTrades;
    private long wins;
    private long losses;

    public StatsAggregator(HistoryStore history, Clock clock) {
        this.history = history;
        this.clock   = clock;
    }

    public void recordEntry() {
        totalTrades++;
    }

    public void recordWin() {
        wins++;
    }

    public void recordLoss() {
        losses++;
    }

    /** Overwrites all counters. Used once, by startup reconciliation. */
    public void seed(StatsSeed seed) {
        this.totalTrades = seed.totalTrades();
        this.wins        = seed.wins();
        this.losses      = seed.losses();
    }

    public StatsSnapshot snapshot() {
        LocalDate today = LocalDate.now(clock);
        int todayTrades = history.countWhere(s -> today.equals(s.date()));
        return new StatsSnapshot(totalTrades, todayTrades, wins, losses, winRate(wins, losses));
    }

    /** {@code wins / (wins + losses) * 100}, or 0.0 with no outcomes. */
    public static double winRate(long wins, long losses) {
        long decided = wins + losses;
        if (decided == 0) return 0.0;
        return (double) wins / decided * 100.0;
    }
}
