package com.signalrelay.common.stats;

import com.fasterxml.jackson.annotation.JsonProperty;

public record StatsSnapshot(
    @JsonProperty("total_trades") long totalTrades,
    @JsonProperty("today_trades") int todayTrades,
    @JsonProperty("wins")         long wins,
    @JsonProperty("losses")       long losses,
    @JsonProperty("win_rate")     double winRate
) {}
