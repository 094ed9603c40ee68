package com.busreview.tracker.scrape.normalize;

import org.jsoup.parser.Parser;

import java.util.Locale;

public final class TextCleaner {
    private TextCleaner() {
    }

    /**
     * Decodes HTML entities, collapses whitespace and trims. Blank input yields null.
     */
    public static String clean(String raw) {
        if (raw == null) {
            return null;
        }
        String decoded = Parser.unescapeEntities(raw, false)
            .replace('\u00A0', ' ')
            .replaceAll("\\s+", " ")
            .trim();
        return decoded.isEmpty() ? null : decoded;
    }

    /**
     * Lowercased cleaned form used inside identity keys; never null.
     */
    public static String keyForm(String raw) {
        String cleaned = clean(raw);
        return cleaned == null ? "" : cleaned.toLowerCase(Locale.ROOT);
    }

    public static int wordCount(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        return text.trim().split("\\s+").length;
    }
}
