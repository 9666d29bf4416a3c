package com.triviabot.model;

import java.time.Duration;
import java.time.Instant;

/**
 * A submission that was scored as a correct answer inside the answer window.
 */
public final class Winner {
    private final String senderId;
    private final String senderName;
    private final Instant timestamp;
    private final Duration responseTime;
    private final String messageId; // nullable, used to quote the answer on reveal

    public Winner(String senderId, String senderName, Instant timestamp, Duration responseTime, String messageId) {
        if (responseTime.isNegative()) {
            throw new IllegalArgumentException("Response time must not be negative: " + responseTime);
        }
        this.senderId = senderId;
        this.senderName = senderName;
        this.timestamp = timestamp;
        this.responseTime = responseTime;
        this.messageId = messageId;
    }

    public String getSenderId() {
        return senderId;
    }

    public String getSenderName() {
        return senderName;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Duration getResponseTime() {
        return responseTime;
    }

    public double getResponseTimeSeconds() {
        return responseTime.toMillis() / 1000.0;
    }

    public String getMessageId() {
        return messageId;
    }

    @Override
    public String toString() {
        return "Winner{" +
                "senderName='" + senderName + '\'' +
                ", timestamp=" + timestamp +
                ", responseTimeSeconds=" + getResponseTimeSeconds() +
                '}';
    }
}
