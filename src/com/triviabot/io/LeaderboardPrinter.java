package com.triviabot.io;

import com.triviabot.model.LeaderboardEntry;
import com.triviabot.model.Winner;

import java.util.List;
import java.util.Locale;

/**
 * Console rendering of the leaderboard: each question followed by its winners and response times.
 */
public final class LeaderboardPrinter {
    private static final String RULE = "=".repeat(80);

    private LeaderboardPrinter() {
    }

    public static String format(List<LeaderboardEntry> snapshot) {
        StringBuilder sb = new StringBuilder();
        sb.append('\n').append(RULE).append('\n');
        sb.append("LEADERBOARD").append('\n');
        sb.append(RULE).append('\n');

        int questionNumber = 1;
        for (LeaderboardEntry entry : snapshot) {
            sb.append('\n').append('Q').append(questionNumber++).append(": ").append(entry.getQuestionText()).append('\n');
            if (!entry.hasWinners()) {
                sb.append("  No correct answers").append('\n');
                continue;
            }
            int rank = 1;
            for (Winner w : entry.getWinners()) {
                sb.append(String.format(Locale.ROOT, "  %d. %s - %.1fs\n", rank++, w.getSenderName(),
                        w.getResponseTimeSeconds()));
            }
        }

        sb.append('\n').append(RULE).append('\n');
        return sb.toString();
    }
}
