package com.signalrelay.ingest.state;

import com.signalrelay.common.model.ClassifiedSignal;
import com.signalrelay.common.model.Signal;
import com.signalrelay.common.stats.StatsSeed;
import com.signalrelay.common.stats.StatsSnapshot;
import com.signalrelay.ingest.reconcile.ReconciliationResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class SignalStateTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-15T12:00:00Z"), ZoneOffset.UTC);
    private static final LocalDate TODAY = LocalDate.of(2024, 3, 15);

    private static Signal signal(String action, String ticker, LocalDate date) {
        return new Signal(action, ticker, 1, 0, 0, 0, 0, null, null, null, null, date, LocalTime.NOON);
    }

    @Test
    @DisplayName("view() returns newest-first history with matching counters")
    void viewIsConsistent() {
        SignalState state = new SignalState(3, CLOCK);
        state.apply(ClassifiedSignal.of(signal("buy", "A", TODAY)));
        state.apply(ClassifiedSignal.of(signal("sell", "B", TODAY)));

        StateView view = state.view();
        assertEquals(List.of("B", "A"), view.signals().stream().map(Signal::ticker).toList());
        assertEquals(2, view.stats().totalTrades());
        assertEquals(2, view.stats().todayTrades());
    }

    @Test
    @DisplayName("seed() replaces history and counters, truncating to capacity")
    void seedReplacesState() {
        SignalState state = new SignalState(2, CLOCK);
        state.apply(ClassifiedSignal.of(signal("buy", "OLD", TODAY)));

        List<Signal> rows = List.of(
            signal("buy", "N1", TODAY),
            signal("sell", "N2", TODAY.minusDays(1)),
            signal("buy", "N3", TODAY.minusDays(2)));
        state.seed(new ReconciliationResult(rows, new StatsSeed(3, 2, 1)));

        StateView view = state.view();
        assertEquals(List.of("N1", "N2"), view.signals().stream().map(Signal::ticker).toList());
        StatsSnapshot stats = view.stats();
        assertEquals(3, stats.totalTrades());
        assertEquals(1, stats.todayTrades());
        assertEquals(2, stats.wins());
        assertEquals(1, stats.losses());
        assertEquals(66.67, stats.winRate(), 0.01);
    }

    @Test
    @DisplayName("concurrent entries are all counted")
    void concurrentEntries() throws Exception {
        SignalState state = new SignalState(50, CLOCK);
        int threads = 8;
        int perThread = 500;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            String ticker = "T" + t;
            futures.add(pool.submit(() -> {
                start.await();
                for (int i = 0; i < perThread; i++) {
                    state.apply(ClassifiedSignal.of(signal(i % 2 == 0 ? "buy" : "sell", ticker, TODAY)));
                    if (i % 10 == 0) {
                        state.apply(ClassifiedSignal.of(signal("win", ticker, TODAY)));
                    }
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> f : futures) {
            f.get();
        }
        pool.shutdown();

        StateView view = state.view();
        assertEquals(threads * perThread, view.stats().totalTrades());
        assertEquals(threads * (perThread / 10), view.stats().wins());
        assertEquals(50, view.signals().size());
        assertEquals(50, view.stats().todayTrades());
    }
}
