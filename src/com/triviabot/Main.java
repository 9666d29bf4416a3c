package com.triviabot;

import com.triviabot.bot.TriviaTelegramBot;
import com.triviabot.config.TriviaConfig;
import com.triviabot.io.LeaderboardCsvExporter;
import com.triviabot.io.LeaderboardPrinter;
import com.triviabot.io.QuestionBankLoader;
import com.triviabot.model.LeaderboardEntry;
import com.triviabot.model.Question;
import com.triviabot.service.LeaderboardAggregator;
import com.triviabot.service.RoundManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.telegram.telegrambots.meta.TelegramBotsApi;
import org.telegram.telegrambots.updatesreceivers.DefaultBotSession;

import java.nio.file.Path;
import java.util.List;
import java.util.Scanner;
import java.util.concurrent.CancellationException;

/**
 * Main application entry point.
 * - Loads configuration and the question bank.
 * - Registers the Telegram bot and runs every question in sequence.
 * - Prints the leaderboard and optionally saves it to CSV.
 *
 * Usage: {@code java -jar trivia-bot.jar [config.json]}
 */
public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) throws Exception {
        System.out.println("🎲 Trivia Bot starting...");

        // === Configuration ===
        Path configFile = args.length > 0 ? Path.of(args[0]) : null;
        TriviaConfig config = TriviaConfig.load(configFile, System.getenv());
        log.info("Configuration loaded: {}", config);

        // === Question bank ===
        List<Question> questions = new QuestionBankLoader().load(Path.of(config.getQuestionsCsv()));
        if (questions.isEmpty()) {
            log.error("No questions loaded from {}", config.getQuestionsCsv());
            return;
        }

        // === Bot and game ===
        TriviaTelegramBot bot = new TriviaTelegramBot(config);
        LeaderboardAggregator leaderboard = new LeaderboardAggregator();
        RoundManager roundManager = new RoundManager(bot, leaderboard, config);
        bot.setMessageHandler(roundManager::onMessage);

        TelegramBotsApi botsApi = new TelegramBotsApi(DefaultBotSession.class);
        botsApi.registerBot(bot);
        System.out.println("🤖 Bot connected, listening for answers...");

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            System.out.println("\n🛑 Shutting down...");
            roundManager.shutdown();
        }));

        System.out.println("Loaded " + questions.size() + " questions");
        System.out.println("Starting trivia game...\n");
        roundManager.start(questions);

        List<LeaderboardEntry> results;
        try {
            results = roundManager.sessionFinished().get();
        } catch (CancellationException e) {
            log.warn("Session cancelled before the last question");
            results = leaderboard.snapshot();
        }
        System.out.println("All questions completed!");
        System.out.println(LeaderboardPrinter.format(results));

        if (askToSave()) {
            new LeaderboardCsvExporter(config.getMaxWinnersPerRound())
                    .write(results, Path.of(config.getLeaderboardCsv()));
            System.out.println("Leaderboard saved to " + config.getLeaderboardCsv());
        }

        roundManager.shutdown();
        System.out.println("Bot stopped.");
        System.exit(0);
    }

    private static boolean askToSave() {
        System.out.print("\nSave leaderboard to CSV? (y/n): ");
        Scanner scanner = new Scanner(System.in);
        return scanner.hasNextLine() && scanner.nextLine().trim().equalsIgnoreCase("y");
    }
}
