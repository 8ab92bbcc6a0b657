package com.signalrelay.common.history;

import com.signalrelay.common.model.Signal;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.function.Predicate;

/**
 * Bounded, newest-first list of recent entry signals.
 *
 * <p>Not thread-safe. The owning state object serializes every call.
 */
public class HistoryStore {

    public static final int DEFAULT_CAPACITY = 50;

    private final int capacity;
    private final Deque<Signal> entries = new ArrayDeque<>();

    public HistoryStore() {
        this(DEFAULT_CAPACITY);
    }

    public HistoryStore(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("History capacity must be at least 1, got " + capacity);
        }
        this.capacity = capacity;
    }

    /** Inserts at the head and drops the oldest entry once capacity is exceeded. */
    public void pushFront(Signal signal) {
        entries.addFirst(signal);
        if (entries.size() > capacity) {
            entries.removeLast();
        }
    }

    /** Immutable copy, newest first. */
    public List<Signal> all() {
        return List.copyOf(entries);
    }

    public int countWhere(Predicate<Signal> predicate) {
        int count = 0;
        for (Signal s : entries) {
            if (predicate.test(s)) count++;
        }
        return count;
    }

    /**
     * Replaces the whole content with {@code newestFirst}, keeping only the most recent
     * {@link #capacity()} rows.
     */
    public void replaceAll(List<Signal> newestFirst) {
        entries.clear();
        for (Signal s : newestFirst) {
            if (entries.size() == capacity) break;
            entries.addLast(s);
        }
    }

    public int size() {
        return entries.size();
    }

    public int capacity() {
        return capacity;
    }
}
