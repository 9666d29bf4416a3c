package com.triviabot.model;

import java.util.List;

/**
 * Winners of one completed question, in ranking order.
 */
public final class LeaderboardEntry {
    private final String questionText;
    private final List<Winner> winners;

    public LeaderboardEntry(String questionText, List<Winner> winners) {
        this.questionText = questionText;
        this.winners = List.copyOf(winners);
    }

    public String getQuestionText() {
        return questionText;
    }

    public List<Winner> getWinners() {
        return winners;
    }

    public boolean hasWinners() {
        return !winners.isEmpty();
    }

    @Override
    public String toString() {
        return "LeaderboardEntry{" +
                "questionText='" + questionText + '\'' +
                ", winners=" + winners +
                '}';
    }
}
