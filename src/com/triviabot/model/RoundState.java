package com.triviabot.model;

/**
 * Lifecycle of a round. Transitions only ever move one step forward.
 */
public enum RoundState {
    OPEN,
    LOCKED,
    REVEALED,
    DONE;

    public RoundState next() {
        if (this == DONE) {
            throw new IllegalStateException("DONE is terminal");
        }
        return values()[ordinal() + 1];
    }
}
