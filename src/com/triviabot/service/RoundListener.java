package com.triviabot.service;

import com.triviabot.model.LeaderboardEntry;
import com.triviabot.model.RoundResult;

import java.util.List;

/**
 * Interface for listening to round completion and end-of-session events.
 */
public interface RoundListener {

    RoundListener NONE = new RoundListener() {
    };

    default void onRoundCompleted(RoundResult result) {
    }

    default void onSessionFinished(List<LeaderboardEntry> leaderboard) {
    }
}
