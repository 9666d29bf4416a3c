package com.triviabot.io;

import com.triviabot.model.Question;
import com.triviabot.service.AnswerNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Loads trivia questions from a CSV file.
 *
 * <p>Expected format:</p>
 * <pre>
 * question,answers
 * "What is 2+2?","4|four"
 * "Capital of France?","Paris|paris"
 * </pre>
 * The answers column holds pipe-separated alternatives, each normalized with {@link AnswerNormalizer}.
 */
public class QuestionBankLoader {
    private static final Logger log = LoggerFactory.getLogger(QuestionBankLoader.class);

    static final String QUESTION_COLUMN = "question";
    static final String ANSWERS_COLUMN = "answers";

    public List<Question> load(Path path) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return load(reader);
        }
    }

    public List<Question> load(Reader source) throws IOException {
        BufferedReader reader = source instanceof BufferedReader ? (BufferedReader) source : new BufferedReader(source);
        Csv.RecordReader records = new Csv.RecordReader(reader);

        List<String> header = records.next();
        if (header == null) {
            return List.of();
        }
        int questionIndex = indexOf(header, QUESTION_COLUMN);
        int answersIndex = indexOf(header, ANSWERS_COLUMN);
        if (questionIndex < 0 || answersIndex < 0) {
            throw new IOException("CSV header must contain '" + QUESTION_COLUMN + "' and '" + ANSWERS_COLUMN
                    + "' columns, got " + header);
        }
        int requiredColumns = Math.max(questionIndex, answersIndex) + 1;

        List<Question> questions = new ArrayList<>();
        List<String> row;
        while ((row = records.next()) != null) {
            if (row.size() == 1 && row.get(0).isBlank()) {
                continue;
            }
            int line = records.recordLine();
            if (row.size() < requiredColumns) {
                throw new IOException("Line " + line + ": expected at least " + requiredColumns
                        + " columns, got " + row.size());
            }
            String text = row.get(questionIndex).trim();
            if (text.isEmpty()) {
                throw new IOException("Line " + line + ": question text is blank");
            }
            Set<String> answers = parseAnswers(row.get(answersIndex));
            if (answers.isEmpty()) {
                log.warn("Line {}: question '{}' has no accepted answers and cannot be won", line, text);
            }
            questions.add(new Question(text, answers));
        }
        log.info("Loaded {} question(s)", questions.size());
        return questions;
    }

    /**
     * Splits a pipe-delimited answer field and normalizes each alternative, dropping empty ones.
     */
    public static Set<String> parseAnswers(String field) {
        Set<String> answers = new LinkedHashSet<>();
        if (field == null) {
            return answers;
        }
        for (String alternative : field.split("\\|")) {
            String normalized = AnswerNormalizer.normalize(alternative);
            if (!normalized.isEmpty()) {
                answers.add(normalized);
            }
        }
        return answers;
    }

    private static int indexOf(List<String> header, String column) {
        for (int i = 0; i < header.size(); i++) {
            String name = header.get(i).replace("\uFEFF", "").trim().toLowerCase(Locale.ROOT);
            if (name.equals(column)) {
                return i;
            }
        }
        return -1;
    }
}
