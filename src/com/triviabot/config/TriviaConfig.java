package com.triviabot.config;

import com.triviabot.model.RoundDurations;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Game settings, read once at startup and passed to the components that need them.
 *
 * <p>Values come from the {@code trivia.json} classpath resource, optionally overridden by a JSON file
 * given on the command line, then by the environment variables {@code TRIVIA_BOT_TOKEN},
 * {@code TRIVIA_BOT_USERNAME} and {@code TRIVIA_GROUP_ID}.</p>
 */
public final class TriviaConfig {
    public static final String DEFAULT_RESOURCE = "trivia.json";

    public static final String ENV_BOT_TOKEN = "TRIVIA_BOT_TOKEN";
    public static final String ENV_BOT_USERNAME = "TRIVIA_BOT_USERNAME";
    public static final String ENV_GROUP_ID = "TRIVIA_GROUP_ID";

    private final String botUsername;
    private final String botToken;
    private final String groupChatId;
    private final String questionsCsv;
    private final String leaderboardCsv;
    private final long openDurationSeconds;
    private final long revealDelaySeconds;
    private final long advanceDelaySeconds;
    private final int maxWinnersPerRound;

    private TriviaConfig(Builder b) {
        this.botUsername = b.botUsername;
        this.botToken = b.botToken;
        this.groupChatId = b.groupChatId;
        this.questionsCsv = b.questionsCsv;
        this.leaderboardCsv = b.leaderboardCsv;
        this.openDurationSeconds = b.openDurationSeconds;
        this.revealDelaySeconds = b.revealDelaySeconds;
        this.advanceDelaySeconds = b.advanceDelaySeconds;
        this.maxWinnersPerRound = b.maxWinnersPerRound;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Loads the bundled defaults, then applies the override file (if any) and the environment.
     */
    public static TriviaConfig load(Path overrideFile, Map<String, String> env) throws IOException {
        JSONObject json = readResource(DEFAULT_RESOURCE);
        if (overrideFile != null) {
            JSONObject overrides = parse(Files.readString(overrideFile, StandardCharsets.UTF_8), overrideFile.toString());
            for (String key : overrides.keySet()) {
                json.put(key, overrides.get(key));
            }
        }
        applyEnvironment(json, env);
        return fromJson(json);
    }

    public static TriviaConfig fromJson(JSONObject json) {
        Builder b = builder();
        b.botUsername(json.optString("botUsername", b.botUsername));
        b.botToken(json.optString("botToken", b.botToken));
        b.groupChatId(json.optString("groupChatId", b.groupChatId));
        b.questionsCsv(json.optString("questionsCsv", b.questionsCsv));
        b.leaderboardCsv(json.optString("leaderboardCsv", b.leaderboardCsv));
        b.openDurationSeconds(readLong(json, "openDurationSeconds", b.openDurationSeconds));
        b.revealDelaySeconds(readLong(json, "revealDelaySeconds", b.revealDelaySeconds));
        b.advanceDelaySeconds(readLong(json, "advanceDelaySeconds", b.advanceDelaySeconds));
        b.maxWinnersPerRound((int) readLong(json, "maxWinnersPerRound", b.maxWinnersPerRound));
        return b.build();
    }

    private static JSONObject readResource(String name) throws IOException {
        try (InputStream in = TriviaConfig.class.getClassLoader().getResourceAsStream(name)) {
            if (in == null) {
                return new JSONObject();
            }
            return parse(new String(in.readAllBytes(), StandardCharsets.UTF_8), name);
        }
    }

    private static JSONObject parse(String text, String source) throws IOException {
        try {
            return new JSONObject(text);
        } catch (JSONException e) {
            throw new IOException("Malformed configuration in " + source + ": " + e.getMessage(), e);
        }
    }

    private static void applyEnvironment(JSONObject json, Map<String, String> env) {
        if (env == null) {
            return;
        }
        putIfPresent(json, "botToken", env.get(ENV_BOT_TOKEN));
        putIfPresent(json, "botUsername", env.get(ENV_BOT_USERNAME));
        putIfPresent(json, "groupChatId", env.get(ENV_GROUP_ID));
    }

    private static void putIfPresent(JSONObject json, String key, String value) {
        if (value != null && !value.isBlank()) {
            json.put(key, value.trim());
        }
    }

    private static long readLong(JSONObject json, String key, long defaultValue) {
        if (!json.has(key) || json.isNull(key)) {
            return defaultValue;
        }
        Object value = json.get(key);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        try {
            return Long.parseLong(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Config key '" + key + "' must be a whole number, got: " + value);
        }
    }

    public RoundDurations durations() {
        return RoundDurations.ofSeconds(openDurationSeconds, revealDelaySeconds, advanceDelaySeconds);
    }

    public String getBotUsername() {
        return botUsername;
    }

    public String getBotToken() {
        return botToken;
    }

    public String getGroupChatId() {
        return groupChatId;
    }

    public String getQuestionsCsv() {
        return questionsCsv;
    }

    public String getLeaderboardCsv() {
        return leaderboardCsv;
    }

    public long getOpenDurationSeconds() {
        return openDurationSeconds;
    }

    public long getRevealDelaySeconds() {
        return revealDelaySeconds;
    }

    public long getAdvanceDelaySeconds() {
        return advanceDelaySeconds;
    }

    public int getMaxWinnersPerRound() {
        return maxWinnersPerRound;
    }

    @Override
    public String toString() {
        // token left out on purpose
        return "TriviaConfig{" +
                "botUsername='" + botUsername + '\'' +
                ", groupChatId='" + groupChatId + '\'' +
                ", questionsCsv='" + questionsCsv + '\'' +
                ", leaderboardCsv='" + leaderboardCsv + '\'' +
                ", openDurationSeconds=" + openDurationSeconds +
                ", revealDelaySeconds=" + revealDelaySeconds +
                ", advanceDelaySeconds=" + advanceDelaySeconds +
                ", maxWinnersPerRound=" + maxWinnersPerRound +
                '}';
    }

    public static final class Builder {
        private String botUsername = "";
        private String botToken = "";
        private String groupChatId = "";
        private String questionsCsv = "questions.csv";
        private String leaderboardCsv = "leaderboard.csv";
        private long openDurationSeconds = 15;
        private long revealDelaySeconds = 10;
        private long advanceDelaySeconds = 5;
        private int maxWinnersPerRound = 5;

        private Builder() {
        }

        public Builder botUsername(String botUsername) {
            this.botUsername = botUsername;
            return this;
        }

        public Builder botToken(String botToken) {
            this.botToken = botToken;
            return this;
        }

        public Builder groupChatId(String groupChatId) {
            this.groupChatId = groupChatId;
            return this;
        }

        public Builder questionsCsv(String questionsCsv) {
            this.questionsCsv = questionsCsv;
            return this;
        }

        public Builder leaderboardCsv(String leaderboardCsv) {
            this.leaderboardCsv = leaderboardCsv;
            return this;
        }

        public Builder openDurationSeconds(long openDurationSeconds) {
            this.openDurationSeconds = openDurationSeconds;
            return this;
        }

        public Builder revealDelaySeconds(long revealDelaySeconds) {
            this.revealDelaySeconds = revealDelaySeconds;
            return this;
        }

        public Builder advanceDelaySeconds(long advanceDelaySeconds) {
            this.advanceDelaySeconds = advanceDelaySeconds;
            return this;
        }

        public Builder maxWinnersPerRound(int maxWinnersPerRound) {
            this.maxWinnersPerRound = maxWinnersPerRound;
            return this;
        }

        public TriviaConfig build() {
            if (openDurationSeconds <= 0) {
                throw new IllegalArgumentException("Config key 'openDurationSeconds' must be positive");
            }
            if (revealDelaySeconds < 0) {
                throw new IllegalArgumentException("Config key 'revealDelaySeconds' must not be negative");
            }
            if (advanceDelaySeconds < 0) {
                throw new IllegalArgumentException("Config key 'advanceDelaySeconds' must not be negative");
            }
            if (maxWinnersPerRound < 1) {
                throw new IllegalArgumentException("Config key 'maxWinnersPerRound' must be at least 1");
            }
            return new TriviaConfig(this);
        }
    }
}
