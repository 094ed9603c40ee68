package com.busreview.tracker.scrape.normalize;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class RatingParser {
    private static final Pattern FIRST_DECIMAL = Pattern.compile("(-?\\d+(?:\\.\\d+)?)");
    private static final Pattern DIGITS = Pattern.compile("\\d[\\d,]*");
    public static final double MIN_RATING = 0.0;
    public static final double MAX_RATING = 5.0;

    private RatingParser() {
    }

    public record Result(Double value, boolean invalid) {
        static final Result ABSENT = new Result(null, false);
        static final Result INVALID = new Result(null, true);
    }

    /**
     * Reads the first decimal number in the text. Absent text is not an error; unreadable or
     * out-of-range text is.
     */
    public static Result parse(String text) {
        String cleaned = TextCleaner.clean(text);
        if (cleaned == null) {
            return Result.ABSENT;
        }
        Matcher matcher = FIRST_DECIMAL.matcher(cleaned);
        if (!matcher.find()) {
            return Result.INVALID;
        }
        double value;
        try {
            value = Double.parseDouble(matcher.group(1));
        } catch (NumberFormatException e) {
            return Result.INVALID;
        }
        if (value < MIN_RATING || value > MAX_RATING) {
            return Result.INVALID;
        }
        return new Result(value, false);
    }

    /**
     * Reads a vote count such as {@code "(1,234 ratings)"}.
     */
    public static Integer parseCount(String text) {
        String cleaned = TextCleaner.clean(text);
        if (cleaned == null) {
            return null;
        }
        Matcher matcher = DIGITS.matcher(cleaned);
        if (!matcher.find()) {
            return null;
        }
        try {
            return Integer.parseInt(matcher.group().replace(",", ""));
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
