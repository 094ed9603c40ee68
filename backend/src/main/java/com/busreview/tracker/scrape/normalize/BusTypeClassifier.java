package com.busreview.tracker.scrape.normalize;

import com.busreview.tracker.scrape.model.BusType;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Maps free-text seating descriptions ("A/C Sleeper (2+1)", "NON AC Seater / Push Back") onto {@link BusType}.
 */
public final class BusTypeClassifier {
    private static final Pattern NON_AC = Pattern.compile("\\bnon[\\s-]*(ac|a/c|a\\.c\\.?)(?![a-z])");
    private static final Pattern AC = Pattern.compile("(\\bac\\b|\\ba/c\\b|\\ba\\.c\\b|air[\\s-]*condition|\\bvolvo\\b)");

    private enum Berth {
        SLEEPER,
        SEMI_SLEEPER,
        SEATER
    }

    private BusTypeClassifier() {
    }

    /**
     * Tries the bus-type text first and the bus name as context. Empty when no seating class is recognisable.
     */
    public static Optional<BusType> classify(String busTypeText, String busName) {
        String typeText = lower(busTypeText);
        String nameText = lower(busName);

        Berth berth = berthOf(typeText);
        if (berth == null) {
            berth = berthOf(nameText);
        }
        if (berth == null) {
            return Optional.empty();
        }
        Boolean airConditioned = airConditioning(typeText);
        if (airConditioned == null) {
            airConditioned = airConditioning(nameText);
        }
        boolean ac = airConditioned != null && airConditioned;
        return Optional.of(switch (berth) {
            case SLEEPER -> ac ? BusType.AC_SLEEPER : BusType.NON_AC_SLEEPER;
            case SEMI_SLEEPER -> ac ? BusType.AC_SEMI_SLEEPER : BusType.NON_AC_SEMI_SLEEPER;
            case SEATER -> ac ? BusType.AC_SEATER : BusType.NON_AC_SEATER;
        });
    }

    private static Berth berthOf(String text) {
        if (text.isEmpty()) {
            return null;
        }
        if (text.contains("semi sleeper") || text.contains("semi-sleeper") || text.contains("semisleeper")) {
            return Berth.SEMI_SLEEPER;
        }
        if (text.contains("sleeper")) {
            return Berth.SLEEPER;
        }
        if (text.contains("seater") || text.contains("push back") || text.contains("pushback")) {
            return Berth.SEATER;
        }
        return null;
    }

    private static Boolean airConditioning(String text) {
        if (text.isEmpty()) {
            return null;
        }
        if (NON_AC.matcher(text).find()) {
            return Boolean.FALSE;
        }
        if (AC.matcher(text).find()) {
            return Boolean.TRUE;
        }
        return null;
    }

    private static String lower(String value) {
        String cleaned = TextCleaner.clean(value);
        return cleaned == null ? "" : cleaned.toLowerCase(Locale.ROOT);
    }
}
