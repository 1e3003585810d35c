package com.brainstorm.orchestrator.util;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonical form of item text used for duplicate detection: lower-case,
 * punctuation stripped, whitespace collapsed.
 */
public final class TextNormalizer {

    private static final Pattern PUNCTUATION = Pattern.compile("[\\p{Punct}\\p{P}]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TextNormalizer() {
    }

    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        String lower = text.toLowerCase(Locale.ROOT);
        String stripped = PUNCTUATION.matcher(lower).replaceAll("");
        return WHITESPACE.matcher(stripped).replaceAll(" ").trim();
    }

    public static boolean sameText(String a, String b) {
        return normalize(a).equals(normalize(b));
    }

    public static int wordCount(String text) {
        String normalized = text == null ? "" : text.trim();
        return normalized.isEmpty() ? 0 : WHITESPACE.split(normalized).length;
    }
}
