package com.triviabot.service;

/**
 * Raised by a {@link ChatTransport} when a message could not be delivered.
 */
public class TransportException extends Exception {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
