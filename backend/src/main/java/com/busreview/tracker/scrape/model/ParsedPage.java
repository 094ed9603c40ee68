package com.busreview.tracker.scrape.model;

import java.util.List;

public record ParsedPage(
    String routeKey,
    int pageIndex,
    List<ListingRecord> listings,
    List<ReviewRecord> reviews,
    int malformedRecords
) {}
