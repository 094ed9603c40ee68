package com.busreview.tracker.scrape.model;

import java.time.Instant;

public record RawPage(
    String routeKey,
    int pageIndex,
    String url,
    String html,
    Instant fetchedAt,
    int byteSize
) {}
