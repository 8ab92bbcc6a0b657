package com.signalrelay.ingest.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.signalrelay.common.model.Signal;
import com.signalrelay.common.stats.StatsSnapshot;
import com.signalrelay.ingest.forward.ForwardingStats;

import java.util.List;

/**
 * Read model for the dashboard: counters, recent history (newest first) and sink delivery counts.
 */
public record DashboardResponse(
    @JsonProperty("stats")      StatsSnapshot stats,
    @JsonProperty("signals")    List<Signal> signals,
    @JsonProperty("forwarding") ForwardingStats.Snapshot forwarding
) {}
