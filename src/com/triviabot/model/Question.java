package com.triviabot.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Trivia question with its set of accepted answers.
 * Answers are expected to be normalized already (see the question bank loader).
 */
public final class Question {
    private final String text;
    private final Set<String> acceptedAnswers;

    public Question(String text, Set<String> acceptedAnswers) {
        if (text == null) {
            throw new IllegalArgumentException("Question text must not be null");
        }
        this.text = text;
        this.acceptedAnswers = acceptedAnswers == null
                ? Collections.emptySet()
                : Collections.unmodifiableSet(new LinkedHashSet<>(acceptedAnswers));
    }

    public String getText() {
        return text;
    }

    public Set<String> getAcceptedAnswers() {
        return acceptedAnswers;
    }

    /**
     * A question with no accepted answers can be played but never won.
     */
    public boolean isAnswerable() {
        return !acceptedAnswers.isEmpty();
    }

    @Override
    public String toString() {
        return "Question{" +
                "text='" + text + '\'' +
                ", acceptedAnswers=" + acceptedAnswers +
                '}';
    }
}
