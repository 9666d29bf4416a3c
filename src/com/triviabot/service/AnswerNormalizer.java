package com.triviabot.service;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonical form used to compare free-text answers:
 * lower case, punctuation removed, whitespace collapsed to single spaces and trimmed.
 * For example {@code " Paris! "} and {@code "paris"} both become {@code "paris"}.
 */
public final class AnswerNormalizer {
    private static final Pattern PUNCTUATION = Pattern.compile("[^\\w\\s]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private AnswerNormalizer() {
    }

    /**
     * Never fails: a null input normalizes to the empty string.
     */
    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        String composed = Normalizer.normalize(text, Normalizer.Form.NFC);
        String lower = composed.toLowerCase(Locale.ROOT);
        String stripped = PUNCTUATION.matcher(lower).replaceAll("");
        return WHITESPACE.matcher(stripped).replaceAll(" ").trim();
    }
}
