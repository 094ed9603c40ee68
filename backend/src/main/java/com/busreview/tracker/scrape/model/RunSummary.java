package com.busreview.tracker.scrape.model;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public record RunSummary(
    String runId,
    Instant startedAt,
    Instant finishedAt,
    String status,
    int listingsFetched,
    int reviewsFetched,
    int listingsNormalized,
    int reviewsNormalized,
    int recordsDropped,
    int malformedRecords,
    int duplicatesSkipped,
    int listingsLoaded,
    int reviewsLoaded,
    int reviewsRejected,
    int routesFailed,
    Map<QualityIssue, Integer> qualityIssues,
    List<RouteScrapeSummary> routes
) {
    public static RunSummary of(
        String runId,
        Instant startedAt,
        Instant finishedAt,
        String status,
        List<RouteScrapeSummary> routes
    ) {
        int listingsFetched = 0;
        int reviewsFetched = 0;
        int listingsNormalized = 0;
        int reviewsNormalized = 0;
        int recordsDropped = 0;
        int malformedRecords = 0;
        int failed = 0;
        LoadReport load = LoadReport.empty();
        Map<QualityIssue, Integer> qualityIssues = new EnumMap<>(QualityIssue.class);
        for (RouteScrapeSummary route : routes) {
            listingsFetched += route.listingsFetched();
            reviewsFetched += route.reviewsFetched();
            listingsNormalized += route.listingsNormalized();
            reviewsNormalized += route.reviewsNormalized();
            recordsDropped += route.recordsDropped();
            malformedRecords += route.malformedRecords();
            if (route.status() == RouteStatus.FAILED) {
                failed++;
            }
            load = load.plus(route.load());
            route.qualityIssues().forEach((issue, count) -> qualityIssues.merge(issue, count, Integer::sum));
        }
        return new RunSummary(
            runId,
            startedAt,
            finishedAt,
            status,
            listingsFetched,
            reviewsFetched,
            listingsNormalized,
            reviewsNormalized,
            recordsDropped,
            malformedRecords,
            load.reviewsDuplicateSkipped(),
            load.listingsInserted() + load.listingsUpdated(),
            load.reviewsInserted(),
            load.reviewsRejected(),
            failed,
            Map.copyOf(qualityIssues),
            List.copyOf(routes)
        );
    }
}
