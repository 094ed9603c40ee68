package com.busreview.tracker.scrape.normalize;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class DepartureTimeParser {
    private static final Pattern TIME = Pattern.compile("(\\d{1,2})[:.](\\d{2})\\s*([ap]\\.?m\\.?)?", Pattern.CASE_INSENSITIVE);

    private DepartureTimeParser() {
    }

    /**
     * @return departure as {@code HH:mm}, or null when the text holds no valid clock time
     */
    public static String parse(String text) {
        String cleaned = TextCleaner.clean(text);
        if (cleaned == null) {
            return null;
        }
        Matcher matcher = TIME.matcher(cleaned);
        if (!matcher.find()) {
            return null;
        }
        int hour = Integer.parseInt(matcher.group(1));
        int minute = Integer.parseInt(matcher.group(2));
        String meridiem = matcher.group(3);
        if (meridiem != null) {
            if (hour < 1 || hour > 12) {
                return null;
            }
            boolean pm = meridiem.toLowerCase(Locale.ROOT).startsWith("p");
            hour = hour % 12 + (pm ? 12 : 0);
        }
        if (hour > 23 || minute > 59) {
            return null;
        }
        return String.format(Locale.ROOT, "%02d:%02d", hour, minute);
    }
}
