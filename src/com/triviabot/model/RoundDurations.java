package com.triviabot.model;

import java.time.Duration;

/**
 * Phase timings for a session: how long a question stays open,
 * the wait before revealing, and the wait before the next question.
 */
public final class RoundDurations {
    private final Duration open;
    private final Duration revealDelay;
    private final Duration advanceDelay;

    public RoundDurations(Duration open, Duration revealDelay, Duration advanceDelay) {
        if (open == null || open.isNegative() || open.isZero()) {
            throw new IllegalArgumentException("Open duration must be positive");
        }
        if (revealDelay == null || revealDelay.isNegative()) {
            throw new IllegalArgumentException("Reveal delay must not be negative");
        }
        if (advanceDelay == null || advanceDelay.isNegative()) {
            throw new IllegalArgumentException("Advance delay must not be negative");
        }
        this.open = open;
        this.revealDelay = revealDelay;
        this.advanceDelay = advanceDelay;
    }

    public static RoundDurations ofSeconds(long open, long revealDelay, long advanceDelay) {
        return new RoundDurations(Duration.ofSeconds(open), Duration.ofSeconds(revealDelay), Duration.ofSeconds(advanceDelay));
    }

    public Duration getOpen() {
        return open;
    }

    public Duration getRevealDelay() {
        return revealDelay;
    }

    public Duration getAdvanceDelay() {
        return advanceDelay;
    }

    @Override
    public String toString() {
        return "RoundDurations{" +
                "open=" + open +
                ", revealDelay=" + revealDelay +
                ", advanceDelay=" + advanceDelay +
                '}';
    }
}
