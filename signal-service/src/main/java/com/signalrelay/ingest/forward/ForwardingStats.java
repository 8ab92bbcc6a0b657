package com.signalrelay.ingest.forward;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Delivery counters for sink calls. Updated from reactor threads, read by the dashboard.
 */
public class ForwardingStats {

    private final AtomicLong delivered = new AtomicLong();
    private final AtomicLong failed    = new AtomicLong();
    private final AtomicReference<Failure> lastFailure = new AtomicReference<>();

    public void recordDelivered() {
        delivered.incrementAndGet();
    }

    public void recordFailure(String sinkUrl, String reason) {
        failed.incrementAndGet();
        lastFailure.set(new Failure(sinkUrl, reason, Instant.now()));
    }

    public long delivered() {
        return delivered.get();
    }

    public long failed() {
        return failed.get();
    }

    public Snapshot snapshot() {
        return new Snapshot(delivered.get(), failed.get(), lastFailure.get());
    }

    public record Failure(
        @JsonProperty("sink")   String sink,
        @JsonProperty("reason") String reason,
        @JsonProperty("at")     Instant at
    ) {}

    public record Snapshot(
        @JsonProperty("delivered")    long delivered,
        @JsonProperty("failed")       long failed,
        @JsonProperty("last_failure") Failure lastFailure
    ) {}
}
