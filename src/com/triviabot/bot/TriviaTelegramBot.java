package com.triviabot.bot;

import com.triviabot.config.TriviaConfig;
import com.triviabot.model.ChatMessage;
import com.triviabot.service.ChatTransport;
import com.triviabot.service.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.telegram.telegrambots.bots.TelegramLongPollingBot;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.User;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

import java.time.Instant;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Telegram bot implementation:
 * - listens to the configured group and forwards every text message to the game
 * - ignores messages from other chats and from bots (including itself)
 * - posts questions, STOP/REP/NEXT announcements and quoted replies to the group
 */
public class TriviaTelegramBot extends TelegramLongPollingBot implements ChatTransport {
    private static final Logger log = LoggerFactory.getLogger(TriviaTelegramBot.class);

    private final String botUsername;
    private final String groupChatId;
    private volatile Consumer<ChatMessage> messageHandler = message -> { };

    public TriviaTelegramBot(TriviaConfig config) {
        super(config.getBotToken());
        this.botUsername = config.getBotUsername();
        this.groupChatId = config.getGroupChatId();

        if (config.getBotToken().isBlank() || groupChatId.isBlank()) {
            log.error("Bot token or group chat id missing, set {} and {}",
                    TriviaConfig.ENV_BOT_TOKEN, TriviaConfig.ENV_GROUP_ID);
        }
    }

    public void setMessageHandler(Consumer<ChatMessage> messageHandler) {
        this.messageHandler = messageHandler;
    }

    @Override
    public String getBotUsername() {
        return botUsername;
    }

    @Override
    public void onUpdateReceived(Update update) {
        try {
            if (!update.hasMessage()) {
                return;
            }
            toChatMessage(update.getMessage(), groupChatId).ifPresent(messageHandler);
        } catch (RuntimeException ex) {
            log.error("Error while handling update {}", update.getUpdateId(), ex);
        }
    }

    /**
     * Converts a Telegram message into a game message, or empty if it should not be scored.
     */
    static Optional<ChatMessage> toChatMessage(Message m, String groupChatId) {
        if (m == null || !m.hasText()) {
            return Optional.empty();
        }
        if (m.getChat() == null || !String.valueOf(m.getChatId()).equals(groupChatId)) {
            return Optional.empty();
        }
        User from = m.getFrom();
        if (from == null || Boolean.TRUE.equals(from.getIsBot())) {
            return Optional.empty();
        }

        Instant timestamp = m.getDate() == null ? null : Instant.ofEpochSecond(m.getDate());
        String messageId = m.getMessageId() == null ? null : String.valueOf(m.getMessageId());
        return Optional.of(new ChatMessage(String.valueOf(from.getId()), displayName(from), m.getText(),
                timestamp, messageId));
    }

    static String displayName(User user) {
        if (user.getFirstName() != null && !user.getFirstName().isBlank()) {
            return user.getFirstName();
        }
        if (user.getUserName() != null && !user.getUserName().isBlank()) {
            return user.getUserName();
        }
        return "Someone";
    }

    @Override
    public Optional<Instant> send(String text) throws TransportException {
        SendMessage sm = new SendMessage();
        sm.setChatId(groupChatId);
        sm.setText(text);
        return post(sm, text);
    }

    @Override
    public void reply(String text, String replyToMessageId) throws TransportException {
        SendMessage sm = new SendMessage();
        sm.setChatId(groupChatId);
        sm.setText(text);
        try {
            sm.setReplyToMessageId(Integer.valueOf(replyToMessageId));
        } catch (NumberFormatException ex) {
            log.warn("Cannot quote message id '{}', sending without quote", replyToMessageId);
        }
        post(sm, text);
    }

    private Optional<Instant> post(SendMessage sm, String text) throws TransportException {
        try {
            Message sent = execute(sm);
            if (sent == null || sent.getDate() == null) {
                return Optional.empty();
            }
            return Optional.of(Instant.ofEpochSecond(sent.getDate()));
        } catch (TelegramApiException ex) {
            throw new TransportException("Failed to send '" + text + "' to chat " + groupChatId, ex);
        }
    }
}
