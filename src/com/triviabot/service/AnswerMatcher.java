package com.triviabot.service;

import java.util.Set;

/**
 * Exact-membership check of a normalized submission against the accepted answers.
 * No partial or fuzzy matching: alternative spellings belong in the question bank.
 */
public final class AnswerMatcher {

    private AnswerMatcher() {
    }

    public static boolean isCorrect(String normalizedSubmission, Set<String> acceptedAnswers) {
        if (normalizedSubmission == null || normalizedSubmission.isEmpty()) {
            return false;
        }
        if (acceptedAnswers == null || acceptedAnswers.isEmpty()) {
            return false;
        }
        return acceptedAnswers.contains(normalizedSubmission);
    }
}
