package com.gt.vocab.evaluation;

import java.util.Locale;
import java.util.regex.Pattern;

public final class AnswerNormalizer {

    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");
    private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[.!?]+$");

    private AnswerNormalizer() { }

    public static String normalize(String answer) {
        if (answer == null) {
            return "";
        }

        String collapsed = WHITESPACE_RUN.matcher(answer.trim()).replaceAll(" ").toLowerCase(Locale.ROOT);
        return TRAILING_PUNCTUATION.matcher(collapsed).replaceAll("").trim();
    }

    public static boolean matches(String expected, String submitted) {
        return normalize(expected).equals(normalize(submitted));
    }
}
