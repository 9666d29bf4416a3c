package com.triviabot.service;

import com.triviabot.model.LeaderboardEntry;
import com.triviabot.model.Winner;

import java.util.ArrayList;
import java.util.List;

/**
 * Session-wide results table: one entry per completed question, in question order.
 * Entries are never removed or reordered. Once sealed, the table is read-only.
 */
public class LeaderboardAggregator {
    private final List<LeaderboardEntry> entries = new ArrayList<>();
    private boolean sealed;

    public synchronized void record(String questionText, List<Winner> winners) {
        if (sealed) {
            throw new IllegalStateException("Leaderboard is sealed, cannot record '" + questionText + "'");
        }
        entries.add(new LeaderboardEntry(questionText, winners));
    }

    /**
     * Point-in-time copy of the table; safe to call while rounds are still being recorded.
     */
    public synchronized List<LeaderboardEntry> snapshot() {
        return List.copyOf(entries);
    }

    public synchronized void seal() {
        sealed = true;
    }

    public synchronized boolean isSealed() {
        return sealed;
    }

    public synchronized int size() {
        return entries.size();
    }
}
