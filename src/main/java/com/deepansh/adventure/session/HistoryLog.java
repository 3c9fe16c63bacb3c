package com.deepansh.adventure.session;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Bounded, time-ordered record of actions and their results.
 * Keeps the most recent {@code maxEntries}; older entries fall off the front.
 */
public class HistoryLog {

    public static final int DEFAULT_MAX_ENTRIES = 50;

    private final Deque<HistoryEntry> entries = new ArrayDeque<>();
    private final int maxEntries;

    public HistoryLog() {
        this(DEFAULT_MAX_ENTRIES);
    }

    public HistoryLog(int maxEntries) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be positive, got " + maxEntries);
        }
        this.maxEntries = maxEntries;
    }

    public void append(String action, String result) {
        entries.addLast(new HistoryEntry(action, result));
        while (entries.size() > maxEntries) {
            entries.removeFirst();
        }
    }

    /** Up to {@code count} most recent entries, oldest first. */
    public List<HistoryEntry> recent(int count) {
        List<HistoryEntry> all = entries();
        int from = Math.max(0, all.size() - count);
        return all.subList(from, all.size());
    }

    /** Snapshot copy, oldest first. */
    public List<HistoryEntry> entries() {
        return List.copyOf(entries);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
