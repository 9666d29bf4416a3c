package com.triviabot.io;

import com.triviabot.model.LeaderboardEntry;
import com.triviabot.model.Winner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Writes the leaderboard to CSV.
 *
 * <p>Format: {@code Question | Winner1 | Time1 | ResponseTime1 | Winner2 | ...}, three columns per
 * winner slot. Empty slots are left blank so every row has the same width.</p>
 */
public class LeaderboardCsvExporter {
    private static final Logger log = LoggerFactory.getLogger(LeaderboardCsvExporter.class);
    private static final String LINE_END = "\r\n";

    private final int winnerSlots;
    private final DateTimeFormatter timeFormat;

    public LeaderboardCsvExporter(int winnerSlots) {
        this(winnerSlots, ZoneId.systemDefault());
    }

    public LeaderboardCsvExporter(int winnerSlots, ZoneId zone) {
        if (winnerSlots < 1) {
            throw new IllegalArgumentException("winnerSlots must be at least 1");
        }
        this.winnerSlots = winnerSlots;
        this.timeFormat = DateTimeFormatter.ofPattern("HH:mm:ss").withZone(zone);
    }

    public void write(List<LeaderboardEntry> snapshot, Path path) throws IOException {
        try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            write(snapshot, writer);
        }
        log.info("Leaderboard saved to {}", path);
    }

    public void write(List<LeaderboardEntry> snapshot, Writer writer) throws IOException {
        writer.write(Csv.join(header()));
        writer.write(LINE_END);
        for (LeaderboardEntry entry : snapshot) {
            writer.write(Csv.join(row(entry)));
            writer.write(LINE_END);
        }
        writer.flush();
    }

    List<String> header() {
        List<String> header = new ArrayList<>();
        header.add("Question");
        for (int i = 1; i <= winnerSlots; i++) {
            header.add("Winner" + i);
            header.add("Time" + i);
            header.add("ResponseTime" + i);
        }
        return header;
    }

    List<String> row(LeaderboardEntry entry) {
        List<String> row = new ArrayList<>();
        row.add(entry.getQuestionText());
        List<Winner> winners = entry.getWinners();
        for (int i = 0; i < winnerSlots; i++) {
            if (i < winners.size()) {
                Winner w = winners.get(i);
                row.add(w.getSenderName());
                row.add(timeFormat.format(w.getTimestamp()));
                row.add(String.format(Locale.ROOT, "%.1fs", w.getResponseTimeSeconds()));
            } else {
                row.add("");
                row.add("");
                row.add("");
            }
        }
        return row;
    }
}
