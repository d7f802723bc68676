package com.tailorai.infrastructure.ai.preprocessing;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tokenization shared by scoring, merging and the guardrail validators.
 */
public final class ResumeTokenizer {

    private static final Pattern NON_ALNUM = Pattern.compile("[^a-z0-9]");
    private static final Pattern NUMBER = Pattern.compile("\\d+(\\.\\d+)?");
    private static final Pattern DIGIT_RUN = Pattern.compile("\\d+");
    private static final Pattern DIGIT = Pattern.compile("\\d");
    private static final Pattern NUMERIC_TOKEN = Pattern.compile("^\\d+(\\.\\d+)?$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private ResumeTokenizer() {
    }

    /**
     * Lowercased alphanumeric word tokens. Every other character is a separator.
     */
    public static List<String> wordTokens(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        String cleaned = NON_ALNUM.matcher(text.toLowerCase()).replaceAll(" ");
        return Arrays.stream(WHITESPACE.split(cleaned))
                .filter(t -> !t.isEmpty())
                .toList();
    }

    /**
     * Numbers with an optional decimal part, e.g. {@code 40} or {@code 2.5}.
     */
    public static List<String> numbers(String text) {
        return findAll(NUMBER, text);
    }

    public static List<String> digitRuns(String text) {
        return findAll(DIGIT_RUN, text);
    }

    public static boolean hasDigit(String text) {
        return text != null && DIGIT.matcher(text).find();
    }

    public static boolean isNumeric(String token) {
        return NUMERIC_TOKEN.matcher(token).matches();
    }

    /**
     * Count of whitespace-separated words.
     */
    public static int wordCount(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        return WHITESPACE.split(text.strip()).length;
    }

    private static List<String> findAll(Pattern pattern, String text) {
        List<String> found = new ArrayList<>();
        if (text == null) {
            return found;
        }
        Matcher m = pattern.matcher(text);
        while (m.find()) {
            found.add(m.group());
        }
        return found;
    }
}
