package com.busreview.tracker.scrape.model;

import java.util.List;

public record ScrapeRunRequest(
    List<RouteRequest> routes,
    Integer concurrency,
    Integer maxDurationSeconds
) {
    public List<RouteRequest> safeRoutes() {
        return routes == null ? List.of() : routes;
    }
}
