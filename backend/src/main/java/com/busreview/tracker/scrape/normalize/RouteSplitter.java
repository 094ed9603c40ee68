package com.busreview.tracker.scrape.normalize;

import java.util.List;
import java.util.Locale;

public final class RouteSplitter {
    private static final List<String> DELIMITERS = List.of("->", "→", " to ", " - ");

    private RouteSplitter() {
    }

    public record Route(String origin, String destination) {}

    /**
     * Splits on the first delimiter found; text without a delimiter is all origin.
     */
    public static Route split(String routeText) {
        String cleaned = TextCleaner.clean(routeText);
        if (cleaned == null) {
            return new Route(null, null);
        }
        String lower = cleaned.toLowerCase(Locale.ROOT);
        for (String delimiter : DELIMITERS) {
            int index = lower.indexOf(delimiter);
            if (index >= 0) {
                String origin = TextCleaner.clean(cleaned.substring(0, index));
                String destination = TextCleaner.clean(cleaned.substring(index + delimiter.length()));
                return new Route(origin, destination);
            }
        }
        return new Route(cleaned, null);
    }
}
