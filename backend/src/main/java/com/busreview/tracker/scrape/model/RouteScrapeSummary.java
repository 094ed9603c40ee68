package com.busreview.tracker.scrape.model;

import java.util.List;
import java.util.Map;

public record RouteScrapeSummary(
    String routeKey,
    RouteStatus status,
    int startPageIndex,
    int pagesLoaded,
    Integer lastCommittedPageIndex,
    int listingsFetched,
    int reviewsFetched,
    int listingsNormalized,
    int reviewsNormalized,
    int recordsDropped,
    int malformedRecords,
    Map<QualityIssue, Integer> qualityIssues,
    LoadReport load,
    List<String> errors
) {
    public static RouteScrapeSummary failedBeforeStart(String routeKey, String error) {
        return new RouteScrapeSummary(
            routeKey,
            RouteStatus.FAILED,
            0,
            0,
            null,
            0,
            0,
            0,
            0,
            0,
            0,
            Map.of(),
            LoadReport.empty(),
            List.of(error)
        );
    }
}
