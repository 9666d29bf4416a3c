package com.triviabot.model;

import java.time.Instant;

/**
 * Inbound group message as delivered by the chat transport.
 * The timestamp is the server time of the message and may be null when the transport did not supply one.
 */
public final class ChatMessage {
    private final String senderId;
    private final String senderName;
    private final String body;
    private final Instant timestamp;
    private final String messageId; // nullable

    public ChatMessage(String senderId, String senderName, String body, Instant timestamp) {
        this(senderId, senderName, body, timestamp, null);
    }

    public ChatMessage(String senderId, String senderName, String body, Instant timestamp, String messageId) {
        this.senderId = senderId;
        this.senderName = senderName;
        this.body = body;
        this.timestamp = timestamp;
        this.messageId = messageId;
    }

    public String getSenderId() {
        return senderId;
    }

    public String getSenderName() {
        return senderName;
    }

    public String getBody() {
        return body;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getMessageId() {
        return messageId;
    }

    @Override
    public String toString() {
        return "ChatMessage{" +
                "senderId='" + senderId + '\'' +
                ", senderName='" + senderName + '\'' +
                ", body='" + body + '\'' +
                ", timestamp=" + timestamp +
                ", messageId='" + messageId + '\'' +
                '}';
    }
}
