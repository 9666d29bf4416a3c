package com.triviabot.service;

import com.triviabot.model.ChatMessage;
import com.triviabot.model.Question;
import com.triviabot.model.RoundResult;
import com.triviabot.model.RoundState;
import com.triviabot.model.Submission;
import com.triviabot.model.Winner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One question's lifecycle: OPEN -> LOCKED -> REVEALED -> DONE.
 *
 * <p>Answer admission and state transitions are mutually exclusive under the round's own lock,
 * so a message racing a phase timer is either scored before the lock or recorded as late.
 * Validity is decided on the message timestamp against {@code postedAt..cutoffAt}
 * (both ends inclusive), never on the time the message happened to arrive.</p>
 *
 * <p>Winners hold at most one entry per sender, are capped at the configured maximum and
 * stay sorted by response time, ties keeping arrival order.</p>
 */
public class Round {
    private static final Logger log = LoggerFactory.getLogger(Round.class);

    private final int number;
    private final Question question;
    private final Instant postedAt;
    private final Instant cutoffAt;
    private final int maxWinners;

    private final ReentrantLock lock = new ReentrantLock();
    // guarded by lock
    private final List<Submission> submissions = new ArrayList<>();
    private final List<Winner> winners = new ArrayList<>();
    private final Set<String> winnerIds = new HashSet<>();
    private RoundState state = RoundState.OPEN;

    public Round(int number, Question question, Instant postedAt, Duration openDuration, int maxWinners) {
        if (question == null || postedAt == null || openDuration == null) {
            throw new IllegalArgumentException("Question, postedAt and openDuration are required");
        }
        if (maxWinners < 1) {
            throw new IllegalArgumentException("maxWinners must be at least 1");
        }
        this.number = number;
        this.question = question;
        this.postedAt = postedAt;
        this.cutoffAt = postedAt.plus(openDuration);
        this.maxWinners = maxWinners;
    }

    /**
     * Evaluates and records an inbound message.
     *
     * @return the recorded submission, or empty if the round is already DONE and takes no more input
     */
    public Optional<Submission> submit(ChatMessage message) {
        // pure, kept outside the lock
        String normalized = AnswerNormalizer.normalize(message.getBody());
        boolean correct = AnswerMatcher.isCorrect(normalized, question.getAcceptedAnswers());

        lock.lock();
        try {
            if (state == RoundState.DONE) {
                return Optional.empty();
            }
            if (state != RoundState.OPEN) {
                Submission late = new Submission(message, normalized, correct, false, false);
                submissions.add(late);
                return Optional.of(late);
            }

            boolean validWindow = isWithinWindow(message.getTimestamp());
            boolean counted = false;
            if (validWindow && correct
                    && !winnerIds.contains(message.getSenderId())
                    && winners.size() < maxWinners) {
                Duration responseTime = Duration.between(postedAt, message.getTimestamp());
                insertWinner(new Winner(message.getSenderId(), message.getSenderName(),
                        message.getTimestamp(), responseTime, message.getMessageId()));
                winnerIds.add(message.getSenderId());
                counted = true;
            }

            Submission submission = new Submission(message, normalized, correct, validWindow, counted);
            submissions.add(submission);
            return Optional.of(submission);
        } finally {
            lock.unlock();
        }
    }

    private boolean isWithinWindow(Instant timestamp) {
        if (timestamp == null) {
            return false;
        }
        // a negative response time means the clocks disagree; reject rather than clamp
        if (Duration.between(postedAt, timestamp).isNegative()) {
            return false;
        }
        return !timestamp.isAfter(cutoffAt);
    }

    private void insertWinner(Winner winner) {
        int index = winners.size();
        while (index > 0 && winners.get(index - 1).getResponseTime().compareTo(winner.getResponseTime()) > 0) {
            index--;
        }
        winners.add(index, winner);
    }

    /**
     * OPEN -> LOCKED. Returns false when the round was already locked or later.
     */
    public boolean close() {
        return transitionTo(RoundState.LOCKED);
    }

    /**
     * LOCKED -> REVEALED, selecting the fastest winner to quote.
     *
     * @return the reveal, or empty when the round had already been revealed
     */
    public Optional<Reveal> reveal() {
        lock.lock();
        try {
            if (!advanceLocked(RoundState.REVEALED)) {
                return Optional.empty();
            }
            return Optional.of(new Reveal(winners.isEmpty() ? null : winners.get(0), winners.size()));
        } finally {
            lock.unlock();
        }
    }

    /**
     * REVEALED -> DONE. After this, submissions and winners never change.
     */
    public boolean finish() {
        return transitionTo(RoundState.DONE);
    }

    /**
     * Moves the round to {@code target}.
     *
     * @return true if the state changed, false if the round already reached or passed {@code target}
     * @throws IllegalStateException if the move would skip a state or reopen the round
     */
    public boolean transitionTo(RoundState target) {
        lock.lock();
        try {
            return advanceLocked(target);
        } finally {
            lock.unlock();
        }
    }

    private boolean advanceLocked(RoundState target) {
        if (target == RoundState.OPEN && state != RoundState.OPEN) {
            throw new IllegalStateException("Round " + number + " cannot go back from " + state + " to OPEN");
        }
        if (target.compareTo(state) <= 0) {
            log.debug("Round {} already {} (requested {}), ignoring", number, state, target);
            return false;
        }
        if (target != state.next()) {
            throw new IllegalStateException("Round " + number + " cannot skip from " + state + " to " + target);
        }
        state = target;
        return true;
    }

    public int getNumber() {
        return number;
    }

    public Question getQuestion() {
        return question;
    }

    public Instant getPostedAt() {
        return postedAt;
    }

    public Instant getCutoffAt() {
        return cutoffAt;
    }

    public RoundState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public List<Winner> getWinners() {
        lock.lock();
        try {
            return List.copyOf(winners);
        } finally {
            lock.unlock();
        }
    }

    public List<Submission> getSubmissions() {
        lock.lock();
        try {
            return List.copyOf(submissions);
        } finally {
            lock.unlock();
        }
    }

    public RoundResult toResult() {
        lock.lock();
        try {
            return new RoundResult(number, question.getText(), winners, submissions);
        } finally {
            lock.unlock();
        }
    }

    /**
     * What to show when the answer is revealed: the fastest winner, if anyone answered correctly.
     */
    public static final class Reveal {
        private final Winner firstWinner; // nullable
        private final int winnerCount;

        Reveal(Winner firstWinner, int winnerCount) {
            this.firstWinner = firstWinner;
            this.winnerCount = winnerCount;
        }

        public Optional<Winner> getFirstWinner() {
            return Optional.ofNullable(firstWinner);
        }

        public boolean hasCorrectAnswer() {
            return firstWinner != null;
        }

        public int getWinnerCount() {
            return winnerCount;
        }
    }
}
