package com.triviabot.service;

import com.triviabot.config.TriviaConfig;
import com.triviabot.model.ChatMessage;
import com.triviabot.model.LeaderboardEntry;
import com.triviabot.model.Question;
import com.triviabot.model.RoundDurations;
import com.triviabot.model.RoundResult;
import com.triviabot.model.RoundState;
import com.triviabot.model.Submission;
import com.triviabot.model.Winner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * RoundManager:
 * - posts questions one after another, keeping exactly one active round
 * - routes every inbound group message to the active round
 * - drives each round through STOP, REP and NEXT on timers
 * - accepts the same three steps as explicit signals, which cancel the pending timer
 * - records every finished round on the leaderboard and seals it at the end of the session
 *
 * <p>Each timer is scheduled from the moment its phase began. Timers never touch the round's
 * recorded {@code postedAt}/{@code cutoffAt}, which come from message timestamps.</p>
 */
public class RoundManager {
    private static final Logger log = LoggerFactory.getLogger(RoundManager.class);

    static final String STOP_TEXT = "STOP";
    static final String REP_TEXT = "REP";
    static final String NEXT_TEXT = "NEXT";

    private final ChatTransport transport;
    private final LeaderboardAggregator leaderboard;
    private final int maxWinners;
    private final RoundDurations defaultDurations;
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;
    private final Clock clock;
    private final RoundListener listener;
    private final CompletableFuture<List<LeaderboardEntry>> sessionFinished = new CompletableFuture<>();

    // read without locking by onMessage; replaced only while holding this
    private volatile Round activeRound;

    // guarded by this
    private List<Question> questions = List.of();
    private RoundDurations durations;
    private int nextQuestionIndex;
    private ScheduledFuture<?> pendingPhase;
    private boolean started;

    public RoundManager(ChatTransport transport, LeaderboardAggregator leaderboard, TriviaConfig config) {
        this(transport, leaderboard, config, newScheduler(), true, Clock.systemUTC(), RoundListener.NONE);
    }

    public RoundManager(ChatTransport transport, LeaderboardAggregator leaderboard, TriviaConfig config,
                        ScheduledExecutorService scheduler, Clock clock, RoundListener listener) {
        this(transport, leaderboard, config, scheduler, false, clock, listener);
    }

    private RoundManager(ChatTransport transport, LeaderboardAggregator leaderboard, TriviaConfig config,
                         ScheduledExecutorService scheduler, boolean ownsScheduler, Clock clock,
                         RoundListener listener) {
        this.transport = transport;
        this.leaderboard = leaderboard;
        this.maxWinners = config.getMaxWinnersPerRound();
        this.defaultDurations = config.durations();
        this.scheduler = scheduler;
        this.ownsScheduler = ownsScheduler;
        this.clock = clock;
        this.listener = listener == null ? RoundListener.NONE : listener;
    }

    private static ScheduledExecutorService newScheduler() {
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "trivia-phase-timer");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Starts the session with the configured durations.
     */
    public void start(List<Question> questions) {
        start(questions, defaultDurations);
    }

    /**
     * Starts the session: posts the first question and arms its timer.
     */
    public synchronized void start(List<Question> questions, RoundDurations durations) {
        if (started) {
            throw new IllegalStateException("Session already started");
        }
        started = true;
        this.questions = List.copyOf(questions);
        this.durations = durations;
        log.info("Starting trivia session with {} question(s), {}", this.questions.size(), durations);
        if (this.questions.isEmpty()) {
            log.warn("No questions to play");
        }
        openNextRound();
    }

    /**
     * Hands a group message to the active round. Drops it when no round is active.
     * Never blocks on I/O and never throws back to the transport.
     */
    public void onMessage(ChatMessage message) {
        Round round = activeRound;
        if (round == null) {
            log.debug("No active round, dropping message from {}", message.getSenderName());
            return;
        }
        try {
            round.submit(message).ifPresent(submission -> logSubmission(round, submission));
        } catch (RuntimeException e) {
            log.error("Failed to score message {} in round {}", message, round.getNumber(), e);
        }
    }

    /**
     * STOP signal: closes the answer window now.
     */
    public synchronized void stop() {
        Round round = activeRound;
        if (round != null) {
            lockPhase(round);
        }
    }

    /**
     * REP signal: reveals the answer now, closing the window first if still open.
     */
    public synchronized void reveal() {
        Round round = activeRound;
        if (round != null) {
            revealPhase(round);
        }
    }

    /**
     * NEXT signal: finishes the current round now and moves on.
     */
    public synchronized void next() {
        Round round = activeRound;
        if (round != null) {
            nextPhase(round);
        }
    }

    /**
     * Opens the next question, or ends the session when none are left.
     * Only valid once the current round (if any) is DONE.
     */
    public synchronized void advance() {
        if (!started) {
            throw new IllegalStateException("Session not started");
        }
        if (sessionFinished.isDone()) {
            return;
        }
        Round round = activeRound;
        if (round != null && round.getState() != RoundState.DONE) {
            throw new IllegalStateException("Round " + round.getNumber() + " is still " + round.getState());
        }
        openNextRound();
    }

    private void openNextRound() {
        if (nextQuestionIndex >= questions.size()) {
            finishSession();
            return;
        }
        Question question = questions.get(nextQuestionIndex);
        int number = ++nextQuestionIndex;

        Instant postedAt = postQuestion(number, question);
        Round round = new Round(number, question, postedAt, durations.getOpen(), maxWinners);
        activeRound = round;
        log.info("Q{} open, posted at {}, cutoff at {}", number, round.getPostedAt(), round.getCutoffAt());

        schedule(() -> lockPhase(round), durations.getOpen());
    }

    private Instant postQuestion(int number, Question question) {
        String text = "Q" + number + ": " + question.getText();
        try {
            Optional<Instant> serverTime = transport.send(text);
            if (serverTime.isPresent()) {
                return serverTime.get();
            }
            log.warn("No server timestamp for Q{}, using local clock", number);
        } catch (TransportException e) {
            log.warn("Failed to post Q{}, using local clock: {}", number, e.getMessage());
        }
        // transport timestamps have second resolution
        return clock.instant().truncatedTo(ChronoUnit.SECONDS);
    }

    private synchronized void lockPhase(Round round) {
        if (round != activeRound) {
            log.debug("Ignoring stale STOP for round {}", round.getNumber());
            return;
        }
        if (!round.close()) {
            return;
        }
        cancelPendingPhase();
        sendQuietly(STOP_TEXT);
        log.info("STOP Q{}", round.getNumber());
        schedule(() -> revealPhase(round), durations.getRevealDelay());
    }

    private synchronized void revealPhase(Round round) {
        if (round != activeRound) {
            log.debug("Ignoring stale REP for round {}", round.getNumber());
            return;
        }
        if (round.getState() == RoundState.OPEN) {
            lockPhase(round);
        }
        Optional<Round.Reveal> reveal = round.reveal();
        if (reveal.isEmpty()) {
            return;
        }
        cancelPendingPhase();
        announceReveal(round, reveal.get());

        if (isLastRound(round)) {
            completeRound(round);
        } else {
            schedule(() -> nextPhase(round), durations.getAdvanceDelay());
        }
    }

    private synchronized void nextPhase(Round round) {
        if (round != activeRound) {
            log.debug("Ignoring stale NEXT for round {}", round.getNumber());
            return;
        }
        if (round.getState().compareTo(RoundState.REVEALED) < 0) {
            revealPhase(round);
            if (round != activeRound) {
                return;
            }
        }
        if (round.getState() != RoundState.REVEALED) {
            return;
        }
        cancelPendingPhase();
        sendQuietly(NEXT_TEXT);
        log.info("NEXT after Q{}", round.getNumber());
        completeRound(round);
    }

    private void completeRound(Round round) {
        if (!round.finish()) {
            return;
        }
        activeRound = null;
        RoundResult result = round.toResult();
        leaderboard.record(result.getQuestionText(), result.getWinners());
        log.info("Q{} done with {} winner(s) out of {} submission(s)",
                result.getQuestionNumber(), result.getWinners().size(), result.getSubmissions().size());
        try {
            listener.onRoundCompleted(result);
        } catch (RuntimeException e) {
            log.error("Round listener failed for Q{}", result.getQuestionNumber(), e);
        }
        advance();
    }

    private void finishSession() {
        activeRound = null;
        cancelPendingPhase();
        leaderboard.seal();
        List<LeaderboardEntry> snapshot = leaderboard.snapshot();
        log.info("All questions completed, {} recorded", snapshot.size());
        try {
            listener.onSessionFinished(snapshot);
        } catch (RuntimeException e) {
            log.error("Round listener failed at end of session", e);
        }
        sessionFinished.complete(snapshot);
    }

    private void announceReveal(Round round, Round.Reveal reveal) {
        Optional<Winner> first = reveal.getFirstWinner();
        if (first.isPresent() && first.get().getMessageId() != null) {
            try {
                transport.reply(REP_TEXT, first.get().getMessageId());
            } catch (TransportException e) {
                log.warn("Failed to send '{}': {}", REP_TEXT, e.getMessage());
            }
            log.info("REP Q{} (quoted) - {} correct answer(s)", round.getNumber(), reveal.getWinnerCount());
        } else if (first.isPresent()) {
            sendQuietly(REP_TEXT);
            log.info("REP Q{} - {} correct answer(s)", round.getNumber(), reveal.getWinnerCount());
        } else {
            sendQuietly(answerListing(round.getQuestion()));
            log.info("REP Q{} (no correct answers)", round.getNumber());
        }
    }

    static String answerListing(Question question) {
        if (!question.isAnswerable()) {
            return REP_TEXT;
        }
        List<String> answers = new ArrayList<>(question.getAcceptedAnswers());
        answers.sort(null);
        return REP_TEXT + ": " + String.join(" / ", answers);
    }

    private boolean isLastRound(Round round) {
        return round.getNumber() >= questions.size();
    }

    private void schedule(Runnable phase, Duration delay) {
        pendingPhase = scheduler.schedule(() -> {
            try {
                phase.run();
            } catch (RuntimeException e) {
                log.error("Phase timer failed", e);
                throw e;
            }
        }, delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void cancelPendingPhase() {
        if (pendingPhase != null) {
            pendingPhase.cancel(false);
            pendingPhase = null;
        }
    }

    private void sendQuietly(String text) {
        try {
            transport.send(text);
        } catch (TransportException e) {
            log.warn("Failed to send '{}': {}", text, e.getMessage());
        }
    }

    private void logSubmission(Round round, Submission submission) {
        if (submission.getTimestamp() == null) {
            log.warn("Message from {} has no timestamp, not scored", submission.getSenderName());
        } else if (submission.isCountedWinner()) {
            Duration responseTime = Duration.between(round.getPostedAt(), submission.getTimestamp());
            log.info("Correct by {}: {} (+{}s after Q{})", submission.getSenderName(),
                    submission.getNormalizedText(), responseTime.toMillis() / 1000.0, round.getNumber());
        } else if (submission.isCorrect() && submission.getTimestamp().isAfter(round.getCutoffAt())) {
            log.info("Late answer from {}: {} (sent at {}, cutoff was {})", submission.getSenderName(),
                    submission.getNormalizedText(), submission.getTimestamp(), round.getCutoffAt());
        } else {
            log.debug("Q{} submission {}", round.getNumber(), submission);
        }
    }

    public Round getActiveRound() {
        return activeRound;
    }

    public LeaderboardAggregator getLeaderboard() {
        return leaderboard;
    }

    /**
     * Completes with the sealed leaderboard once the last round is done.
     */
    public CompletableFuture<List<LeaderboardEntry>> sessionFinished() {
        return sessionFinished;
    }

    public synchronized void shutdown() {
        cancelPendingPhase();
        activeRound = null;
        if (!sessionFinished.isDone()) {
            sessionFinished.cancel(false);
        }
        if (ownsScheduler) {
            scheduler.shutdownNow();
        }
    }
}
