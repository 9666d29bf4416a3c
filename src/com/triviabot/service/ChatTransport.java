package com.triviabot.service;

import java.time.Instant;
import java.util.Optional;

/**
 * Outbound side of the group chat the game is played in.
 */
public interface ChatTransport {

    /**
     * Posts a message to the group.
     *
     * @return the server timestamp of the posted message, if the transport reports one
     */
    Optional<Instant> send(String text) throws TransportException;

    /**
     * Posts a message quoting an earlier message of the group.
     */
    void reply(String text, String replyToMessageId) throws TransportException;
}
