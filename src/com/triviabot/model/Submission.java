package com.triviabot.model;

import java.time.Instant;

/**
 * One inbound message as evaluated by a round. Never mutated after creation.
 */
public final class Submission {
    private final String senderId;
    private final String senderName;
    private final String rawText;
    private final Instant timestamp; // nullable
    private final String normalizedText;
    private final boolean correct;
    private final boolean validWindow;
    private final boolean countedWinner;
    private final String messageId; // nullable

    public Submission(ChatMessage message, String normalizedText, boolean correct,
                      boolean validWindow, boolean countedWinner) {
        this.senderId = message.getSenderId();
        this.senderName = message.getSenderName();
        this.rawText = message.getBody();
        this.timestamp = message.getTimestamp();
        this.messageId = message.getMessageId();
        this.normalizedText = normalizedText;
        this.correct = correct;
        this.validWindow = validWindow;
        this.countedWinner = countedWinner;
    }

    public String getSenderId() {
        return senderId;
    }

    public String getSenderName() {
        return senderName;
    }

    public String getRawText() {
        return rawText;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getNormalizedText() {
        return normalizedText;
    }

    public boolean isCorrect() {
        return correct;
    }

    public boolean isValidWindow() {
        return validWindow;
    }

    public boolean isCountedWinner() {
        return countedWinner;
    }

    public String getMessageId() {
        return messageId;
    }

    @Override
    public String toString() {
        return "Submission{" +
                "senderId='" + senderId + '\'' +
                ", normalizedText='" + normalizedText + '\'' +
                ", timestamp=" + timestamp +
                ", correct=" + correct +
                ", validWindow=" + validWindow +
                ", countedWinner=" + countedWinner +
                '}';
    }
}
