package com.triviabot.service;

import com.triviabot.config.TriviaConfig;
import com.triviabot.model.ChatMessage;
import com.triviabot.model.LeaderboardEntry;
import com.triviabot.model.Question;
import com.triviabot.model.RoundDurations;
import com.triviabot.model.RoundResult;
import com.triviabot.model.RoundState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RoundManagerTest {
    private static final Instant T0 = Instant.ofEpochSecond(1_700_000_000L);
    private static final RoundDurations LONG_TIMERS =
            new RoundDurations(Duration.ofHours(1), Duration.ofHours(1), Duration.ofHours(1));

    private static final Question PARIS = new Question("Capital of France?", Set.of("paris"));
    private static final Question TWO_PLUS_TWO = new Question("What is 2+2?", Set.of("4", "four"));

    private RecordingTransport transport;
    private LeaderboardAggregator leaderboard;
    private ScheduledExecutorService scheduler;
    private final List<RoundResult> completed = new ArrayList<>();
    private RoundManager manager;

    @BeforeEach
    void setUp() {
        transport = new RecordingTransport(T0);
        leaderboard = new LeaderboardAggregator();
        scheduler = Executors.newSingleThreadScheduledExecutor();
        RoundListener listener = new RoundListener() {
            @Override
            public void onRoundCompleted(RoundResult result) {
                completed.add(result);
            }
        };
        manager = new RoundManager(transport, leaderboard, TriviaConfig.builder().build(), scheduler,
                Clock.fixed(T0.plusMillis(1500), ZoneOffset.UTC), listener);
    }

    @AfterEach
    void tearDown() {
        manager.shutdown();
        scheduler.shutdownNow();
    }

    private static ChatMessage answer(String sender, String body, long secondsAfterPost) {
        return new ChatMessage(sender, sender.toUpperCase(), body, T0.plusSeconds(secondsAfterPost), "m-" + sender);
    }

    @Test
    void messagesBeforeStartAreDropped() {
        manager.onMessage(answer("a", "paris", 1));

        assertNull(manager.getActiveRound());
        assertTrue(transport.events().isEmpty());
    }

    @Test
    void startPostsFirstQuestionWithServerTimestamp() {
        manager.start(List.of(PARIS, TWO_PLUS_TWO), LONG_TIMERS);

        Round round = manager.getActiveRound();
        assertNotNull(round);
        assertEquals(RoundState.OPEN, round.getState());
        assertEquals(T0, round.getPostedAt());
        assertEquals(T0.plus(Duration.ofHours(1)), round.getCutoffAt());
        assertEquals(List.of("Q1: Capital of France?"), transport.events());
    }

    @Test
    void startingTwiceFails() {
        manager.start(List.of(PARIS), LONG_TIMERS);

        assertThrows(IllegalStateException.class, () -> manager.start(List.of(PARIS), LONG_TIMERS));
    }

    @Test
    void messagesAreScoredAgainstActiveRound() {
        manager.start(List.of(PARIS), LONG_TIMERS);

        manager.onMessage(answer("a", " Paris! ", 3));

        Round round = manager.getActiveRound();
        assertEquals(1, round.getWinners().size());
        assertEquals(3.0, round.getWinners().get(0).getResponseTimeSeconds());
    }

    @Test
    void stopTwiceSendsStopOnceAndKeepsWinners() {
        manager.start(List.of(PARIS), LONG_TIMERS);
        manager.onMessage(answer("a", "paris", 1));
        Round round = manager.getActiveRound();

        manager.stop();
        manager.stop();

        assertEquals(RoundState.LOCKED, round.getState());
        assertEquals(1, round.getWinners().size());
        assertEquals(List.of("Q1: Capital of France?", "STOP"), transport.events());
    }

    @Test
    void answersAfterStopAreNotScored() {
        manager.start(List.of(PARIS), LONG_TIMERS);
        Round round = manager.getActiveRound();
        manager.stop();

        manager.onMessage(answer("a", "paris", 1));

        assertTrue(round.getWinners().isEmpty());
        assertEquals(1, round.getSubmissions().size());
        assertFalse(round.getSubmissions().get(0).isValidWindow());
    }

    @Test
    void revealQuotesFastestCorrectAnswer() {
        manager.start(List.of(PARIS, TWO_PLUS_TWO), LONG_TIMERS);
        manager.onMessage(answer("b", "paris", 4));
        manager.onMessage(answer("a", "paris", 2));

        manager.stop();
        manager.reveal();

        assertEquals(List.of("Q1: Capital of France?", "STOP", "REP -> m-a"), transport.events());
        assertEquals(RoundState.REVEALED, manager.getActiveRound().getState());
    }

    @Test
    void revealWhileOpenLocksFirst() {
        manager.start(List.of(PARIS, TWO_PLUS_TWO), LONG_TIMERS);

        manager.reveal();

        assertEquals(List.of("Q1: Capital of France?", "STOP", "REP: paris"), transport.events());
    }

    @Test
    void noCorrectAnswerStillAdvancesAndRecordsEmptyEntry() {
        manager.start(List.of(PARIS, TWO_PLUS_TWO), LONG_TIMERS);
        Round first = manager.getActiveRound();
        manager.onMessage(answer("a", "london", 2));

        manager.stop();
        manager.reveal();
        manager.next();

        assertEquals(RoundState.DONE, first.getState());
        List<LeaderboardEntry> snapshot = leaderboard.snapshot();
        assertEquals(1, snapshot.size());
        assertEquals("Capital of France?", snapshot.get(0).getQuestionText());
        assertTrue(snapshot.get(0).getWinners().isEmpty());
        assertEquals(List.of("Q1: Capital of France?", "STOP", "REP: paris", "NEXT", "Q2: What is 2+2?"),
                transport.events());
        assertNotNull(manager.getActiveRound());
        assertEquals(2, manager.getActiveRound().getNumber());
    }

    @Test
    void lastQuestionFinishesSessionWithoutNext() throws Exception {
        manager.start(List.of(PARIS, TWO_PLUS_TWO), LONG_TIMERS);
        manager.onMessage(answer("a", "paris", 1));
        manager.next();
        manager.onMessage(answer("b", "Four", 2));
        manager.onMessage(answer("c", "4", 3));
        manager.stop();
        manager.reveal();

        assertTrue(manager.sessionFinished().isDone());
        assertTrue(leaderboard.isSealed());
        assertNull(manager.getActiveRound());
        assertEquals(List.of(
                "Q1: Capital of France?", "STOP", "REP -> m-a", "NEXT",
                "Q2: What is 2+2?", "STOP", "REP -> m-b"), transport.events());

        List<LeaderboardEntry> results = manager.sessionFinished().get(1, TimeUnit.SECONDS);
        assertEquals(2, results.size());
        assertEquals("a", results.get(0).getWinners().get(0).getSenderId());
        assertEquals(List.of("b", "c"), List.of(
                results.get(1).getWinners().get(0).getSenderId(),
                results.get(1).getWinners().get(1).getSenderId()));
        assertEquals(2, completed.size());
        assertEquals(2, completed.get(1).getQuestionNumber());
    }

    @Test
    void signalsAfterSessionEndAreIgnored() {
        manager.start(List.of(PARIS), LONG_TIMERS);
        manager.next();
        int sent = transport.events().size();

        manager.stop();
        manager.reveal();
        manager.next();
        manager.advance();
        manager.onMessage(answer("a", "paris", 1));

        assertEquals(sent, transport.events().size());
        assertEquals(1, leaderboard.size());
    }

    @Test
    void advanceBeforeRoundIsDoneFails() {
        manager.start(List.of(PARIS, TWO_PLUS_TWO), LONG_TIMERS);

        assertThrows(IllegalStateException.class, manager::advance);
    }

    @Test
    void messageForReplacedRoundIsNotScoredOnNewOne() {
        manager.start(List.of(PARIS, TWO_PLUS_TWO), LONG_TIMERS);
        Round first = manager.getActiveRound();
        manager.next();

        first.submit(answer("a", "paris", 1));
        manager.onMessage(answer("b", "paris", 1));

        Round second = manager.getActiveRound();
        assertEquals(2, second.getNumber());
        assertTrue(second.getWinners().isEmpty());
        assertEquals(1, second.getSubmissions().size());
        assertTrue(first.getSubmissions().isEmpty());
    }

    @Test
    void failedQuestionPostFallsBackToLocalClock() {
        transport.setFailing(true);

        manager.start(List.of(PARIS), LONG_TIMERS);

        Round round = manager.getActiveRound();
        assertNotNull(round);
        assertEquals(T0.plusSeconds(1), round.getPostedAt());
    }

    @Test
    void missingServerTimestampFallsBackToLocalClock() {
        transport.setServerTime(null);

        manager.start(List.of(PARIS), LONG_TIMERS);

        assertEquals(T0.plusSeconds(1), manager.getActiveRound().getPostedAt());
    }

    @Test
    void transportFailuresDoNotStopTheGame() {
        manager.start(List.of(PARIS, TWO_PLUS_TWO), LONG_TIMERS);
        transport.setFailing(true);

        manager.next();

        assertEquals(2, manager.getActiveRound().getNumber());
        assertEquals(1, leaderboard.size());
    }

    @Test
    void emptyQuestionListFinishesImmediately() {
        manager.start(List.of(), LONG_TIMERS);

        assertTrue(manager.sessionFinished().isDone());
        assertTrue(leaderboard.isSealed());
        assertTrue(leaderboard.snapshot().isEmpty());
    }

    @Test
    void answerListingIsSortedAndJoined() {
        assertEquals("REP: 4 / four", RoundManager.answerListing(TWO_PLUS_TWO));
        assertEquals("REP", RoundManager.answerListing(new Question("?", Set.of())));
    }

    @Test
    void timersDriveWholeSession() throws Exception {
        RoundDurations fast = new RoundDurations(Duration.ofMillis(150), Duration.ofMillis(30), Duration.ofMillis(30));
        manager.start(List.of(PARIS, TWO_PLUS_TWO), fast);
        manager.onMessage(answer("a", "paris", 0));

        List<LeaderboardEntry> results = manager.sessionFinished().get(10, TimeUnit.SECONDS);

        assertEquals(2, results.size());
        assertEquals(1, results.get(0).getWinners().size());
        assertTrue(results.get(1).getWinners().isEmpty());
        assertEquals(List.of(
                "Q1: Capital of France?", "STOP", "REP -> m-a", "NEXT",
                "Q2: What is 2+2?", "STOP", "REP: 4 / four"), transport.events());
    }

    @Test
    void explicitStopCancelsOpenTimer() throws Exception {
        RoundDurations durations = new RoundDurations(Duration.ofMillis(100), Duration.ofHours(1), Duration.ofHours(1));
        manager.start(List.of(PARIS, TWO_PLUS_TWO), durations);
        Round round = manager.getActiveRound();

        manager.stop();
        Thread.sleep(300);

        assertEquals(RoundState.LOCKED, round.getState());
        assertEquals(List.of("Q1: Capital of France?", "STOP"), transport.events());
        assertSame(round, manager.getActiveRound());
    }
}
