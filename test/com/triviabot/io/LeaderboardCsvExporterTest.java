package com.triviabot.io;

import com.triviabot.model.LeaderboardEntry;
import com.triviabot.model.Winner;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class LeaderboardCsvExporterTest {
    // 2023-11-14T22:13:20Z
    private static final Instant POSTED = Instant.ofEpochSecond(1_700_000_000L);

    private final LeaderboardCsvExporter exporter = new LeaderboardCsvExporter(5, ZoneOffset.UTC);

    private static Winner winner(String name, long millis) {
        return new Winner(name, name, POSTED.plusMillis(millis), Duration.ofMillis(millis), null);
    }

    private static List<List<String>> parse(String csv) throws IOException {
        Csv.RecordReader reader = new Csv.RecordReader(new BufferedReader(new StringReader(csv.replace("\r\n", "\n"))));
        List<List<String>> rows = new ArrayList<>();
        List<String> row;
        while ((row = reader.next()) != null) {
            rows.add(row);
        }
        return rows;
    }

    @Test
    void writesHeaderAndPaddedRows() throws IOException {
        List<LeaderboardEntry> snapshot = List.of(
                new LeaderboardEntry("What is 2+2?", List.of(winner("Alice", 2500), winner("Bob", 4000))),
                new LeaderboardEntry("Capital of France?", List.of()));
        StringWriter out = new StringWriter();

        exporter.write(snapshot, out);

        List<List<String>> rows = parse(out.toString());
        assertEquals(3, rows.size());
        assertEquals(16, rows.get(0).size());
        assertEquals("Question", rows.get(0).get(0));
        assertEquals("Winner1", rows.get(0).get(1));
        assertEquals("ResponseTime5", rows.get(0).get(15));

        List<String> first = rows.get(1);
        assertEquals(16, first.size());
        assertEquals("What is 2+2?", first.get(0));
        assertEquals("Alice", first.get(1));
        assertEquals("22:13:22", first.get(2));
        assertEquals("2.5s", first.get(3));
        assertEquals("Bob", first.get(4));
        assertEquals("4.0s", first.get(6));
        assertEquals("", first.get(7));

        List<String> second = rows.get(2);
        assertEquals(16, second.size());
        assertEquals("", second.get(1));
    }

    @Test
    void quotesFieldsWithCommas() throws IOException {
        StringWriter out = new StringWriter();

        exporter.write(List.of(new LeaderboardEntry("Red, green or \"blue\"?", List.of())), out);

        String dataLine = out.toString().split("\r\n")[1];
        assertEquals("\"Red, green or \"\"blue\"\"?\"", dataLine.substring(0, dataLine.indexOf("?\"") + 2));
        assertEquals("Red, green or \"blue\"?", parse(out.toString()).get(1).get(0));
    }

    @Test
    void writesFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("leaderboard.csv");

        exporter.write(List.of(new LeaderboardEntry("Q", List.of(winner("Zoë", 1000)))), file);

        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertEquals(2, lines.size());
        assertEquals("Q,Zoë,22:13:21,1.0s,,,,,,,,,,,,", lines.get(1));
    }
}
