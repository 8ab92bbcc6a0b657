package com.signalrelay.ingest.state;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.signalrelay.common.model.Signal;
import com.signalrelay.common.stats.StatsSnapshot;

import java.util.List;

/**
 * Stats and history captured under the same lock acquisition.
 */
public record StateView(
    @JsonProperty("stats")   StatsSnapshot stats,
    @JsonProperty("signals") List<Signal> signals
) {}
