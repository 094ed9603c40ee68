package com.busreview.tracker.scrape.fetch;

import com.busreview.tracker.config.PipelineProperties;
import com.busreview.tracker.scrape.model.RouteTask;
import org.springframework.stereotype.Component;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

@Component
public class SearchUrlBuilder {
    private static final DateTimeFormatter JOURNEY_DATE = DateTimeFormatter.ofPattern("dd-MMM-yyyy", Locale.ENGLISH);

    private final PipelineProperties properties;
    private final Clock clock;

    public SearchUrlBuilder(PipelineProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    public String pageUrl(RouteTask task, int pageIndex) {
        PipelineProperties.Source source = properties.getSource();
        LocalDate journeyDate = task.journeyDate() != null
            ? task.journeyDate()
            : LocalDate.now(clock).plusDays(source.getJourneyOffsetDays());
        String base = trimTrailingSlash(source.getBaseUrl());
        String path = source.getSearchPath() == null ? "" : source.getSearchPath().trim();
        if (!path.isEmpty() && !path.startsWith("/")) {
            path = "/" + path;
        }
        return base + path
            + "?fromCity=" + encode(task.origin())
            + "&toCity=" + encode(task.destination())
            + "&doj=" + JOURNEY_DATE.format(journeyDate).toUpperCase(Locale.ROOT)
            + "&page=" + pageIndex;
    }

    private String trimTrailingSlash(String value) {
        String trimmed = value == null ? "" : value.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    private String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
    }
}
