package com.busreview.tracker.scrape.normalize;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Locale;

public final class ReviewDateParser {
    private static final List<DateTimeFormatter> FORMATS = List.of(
        formatter("uuuu-MM-dd"),
        formatter("d MMM uuuu"),
        formatter("d MMMM uuuu"),
        formatter("dd-MM-uuuu"),
        formatter("dd/MM/uuuu"),
        formatter("d-MMM-uuuu"),
        formatter("MMM d, uuuu"),
        formatter("MMMM d, uuuu")
    );

    private ReviewDateParser() {
    }

    public record Result(LocalDate value, boolean invalid) {
        static final Result ABSENT = new Result(null, false);
        static final Result INVALID = new Result(null, true);
    }

    public static Result parse(String text) {
        String cleaned = TextCleaner.clean(text);
        if (cleaned == null) {
            return Result.ABSENT;
        }
        String candidate = stripPrefix(cleaned);
        for (DateTimeFormatter format : FORMATS) {
            try {
                return new Result(LocalDate.parse(candidate, format), false);
            } catch (DateTimeParseException ignored) {
                // next format
            }
        }
        return Result.INVALID;
    }

    private static String stripPrefix(String value) {
        String lower = value.toLowerCase(Locale.ROOT);
        for (String prefix : List.of("reviewed on", "travelled on", "posted on", "on")) {
            if (lower.startsWith(prefix + " ")) {
                return value.substring(prefix.length()).trim();
            }
        }
        return value;
    }

    private static DateTimeFormatter formatter(String pattern) {
        return new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern(pattern)
            .toFormatter(Locale.ENGLISH)
            .withResolverStyle(ResolverStyle.STRICT);
    }
}
