package com.busreview.tracker.scrape.service;

import com.busreview.tracker.config.PipelineProperties;
import com.busreview.tracker.scrape.model.RouteRequest;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the default route work set from a CSV file with an {@code origin,destination} header.
 */
@Component
public class RouteWorkSetLoader {
    private static final Logger log = LoggerFactory.getLogger(RouteWorkSetLoader.class);

    private final PipelineProperties properties;

    public RouteWorkSetLoader(PipelineProperties properties) {
        this.properties = properties;
    }

    public List<RouteRequest> loadConfigured() {
        String configured = properties.getData().getRoutesCsv();
        if (configured == null || configured.isBlank()) {
            return List.of();
        }
        Path path = Paths.get(configured);
        if (!Files.exists(path)) {
            log.warn("Routes CSV {} not found; work set is empty", path.toAbsolutePath());
            return List.of();
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read routes CSV " + path, e);
        }
    }

    public List<RouteRequest> read(Reader reader) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreEmptyLines(true)
            .setTrim(true)
            .build();
        List<RouteRequest> routes = new ArrayList<>();
        try (CSVParser parser = format.parse(reader)) {
            for (CSVRecord record : parser) {
                String origin = valueOf(record, "origin");
                String destination = valueOf(record, "destination");
                if (origin == null || destination == null) {
                    log.warn("Skipping routes CSV line {}: origin and destination are required", record.getRecordNumber() + 1);
                    continue;
                }
                routes.add(new RouteRequest(origin, destination));
            }
        }
        return routes;
    }

    private String valueOf(CSVRecord record, String column) {
        if (!record.isMapped(column) || !record.isSet(column)) {
            return null;
        }
        String value = record.get(column);
        return value == null || value.isBlank() ? null : value.trim();
    }
}
