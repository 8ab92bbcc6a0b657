package com.signalrelay.ingest.controller;

import com.signalrelay.common.stats.StatsSnapshot;
import com.signalrelay.ingest.dto.DashboardResponse;
import com.signalrelay.ingest.forward.ForwardingStats;
import com.signalrelay.ingest.state.SignalState;
import com.signalrelay.ingest.state.StateView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

/**
 * Read-only view of the current counters and recent signals.
 */
@RestController
@RequestMapping("/api/v1")
public class DashboardController {

    private static final Logger log = LoggerFactory.getLogger(DashboardController.class);

    private final SignalState state;
    private final ForwardingStats forwardingStats;

    public DashboardController(SignalState state, ForwardingStats forwardingStats) {
        this.state           = state;
        this.forwardingStats = forwardingStats;
    }

    @GetMapping("/dashboard")
    public Mono<ResponseEntity<DashboardResponse>> dashboard() {
        log.debug("Dashboard query received");
        StateView view = state.view();
        return Mono.just(ResponseEntity.ok(
            new DashboardResponse(view.stats(), view.signals(), forwardingStats.snapshot())));
    }

    @GetMapping("/stats")
    public Mono<ResponseEntity<StatsSnapshot>> stats() {
        log.debug("Stats query received");
        return Mono.just(ResponseEntity.ok(state.stats()));
    }
}
