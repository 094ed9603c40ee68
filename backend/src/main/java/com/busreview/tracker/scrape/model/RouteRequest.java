package com.busreview.tracker.scrape.model;

public record RouteRequest(String origin, String destination) {}
