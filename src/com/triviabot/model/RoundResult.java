package com.triviabot.model;

import java.util.List;

/**
 * Outcome of a finished round, handed to listeners once the round reaches DONE.
 */
public final class RoundResult {
    private final int questionNumber;
    private final String questionText;
    private final List<Winner> winners;
    private final List<Submission> submissions;

    public RoundResult(int questionNumber, String questionText, List<Winner> winners, List<Submission> submissions) {
        this.questionNumber = questionNumber;
        this.questionText = questionText;
        this.winners = List.copyOf(winners);
        this.submissions = List.copyOf(submissions);
    }

    public int getQuestionNumber() {
        return questionNumber;
    }

    public String getQuestionText() {
        return questionText;
    }

    public List<Winner> getWinners() {
        return winners;
    }

    public List<Submission> getSubmissions() {
        return submissions;
    }
}
