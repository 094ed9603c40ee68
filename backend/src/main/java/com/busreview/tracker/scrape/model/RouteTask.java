package com.busreview.tracker.scrape.model;

import java.time.LocalDate;
import java.util.Locale;

/**
 * One route under traversal. {@code journeyDate} is the travel date the search pages are built for;
 * null until the route is started.
 */
public record RouteTask(
    String routeKey,
    String origin,
    String destination,
    int cursor,
    RouteStatus status,
    LocalDate journeyDate
) {
    public static RouteTask pending(String origin, String destination) {
        return new RouteTask(routeKeyOf(origin, destination), clean(origin), clean(destination), 0, RouteStatus.PENDING, null);
    }

    public RouteTask withCursor(int nextCursor) {
        return new RouteTask(routeKey, origin, destination, Math.max(0, nextCursor), status, journeyDate);
    }

    public RouteTask withStatus(RouteStatus nextStatus) {
        return new RouteTask(routeKey, origin, destination, cursor, nextStatus, journeyDate);
    }

    public RouteTask withJourneyDate(LocalDate date) {
        return new RouteTask(routeKey, origin, destination, cursor, status, date);
    }

    public static String routeKeyOf(String origin, String destination) {
        return clean(origin).toLowerCase(Locale.ROOT) + "->" + clean(destination).toLowerCase(Locale.ROOT);
    }

    private static String clean(String value) {
        if (value == null) {
            return "";
        }
        return value.trim().replaceAll("\\s+", " ");
    }
}
