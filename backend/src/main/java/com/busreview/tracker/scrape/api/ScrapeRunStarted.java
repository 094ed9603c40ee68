package com.busreview.tracker.scrape.api;

public record ScrapeRunStarted(String runId, String status) {}
