package com.busreview.tracker.scrape.fetch;

import com.busreview.tracker.config.PipelineProperties;
import com.busreview.tracker.scrape.model.RawPage;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

@Component
public class RawPageAuditStore {
    private static final Logger log = LoggerFactory.getLogger(RawPageAuditStore.class);

    private final PipelineProperties properties;
    private final ObjectMapper objectMapper;

    public RawPageAuditStore(PipelineProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    public boolean isEnabled() {
        return properties.getAudit().isEnabled();
    }

    public void write(RawPage page) {
        if (!isEnabled() || page == null) {
            return;
        }
        Path directory = Paths.get(properties.getAudit().getDirectory()).resolve(slug(page.routeKey()));
        String baseName = "page-" + page.pageIndex();
        try {
            Files.createDirectories(directory);
            Files.writeString(directory.resolve(baseName + ".html"), page.html() == null ? "" : page.html(), StandardCharsets.UTF_8);
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("routeKey", page.routeKey());
            metadata.put("pageIndex", page.pageIndex());
            metadata.put("url", page.url());
            metadata.put("fetchedAt", page.fetchedAt());
            metadata.put("byteSize", page.byteSize());
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(directory.resolve(baseName + ".json").toFile(), metadata);
        } catch (IOException e) {
            log.warn("Failed to write audit snapshot for {} page {}", page.routeKey(), page.pageIndex(), e);
        }
    }

    static String slug(String routeKey) {
        if (routeKey == null || routeKey.isBlank()) {
            return "unknown-route";
        }
        String slug = routeKey.toLowerCase(Locale.ROOT)
            .replace("->", "__")
            .replaceAll("[^a-z0-9_]+", "-")
            .replaceAll("(^-+|-+$)", "");
        return slug.isEmpty() ? "unknown-route" : slug;
    }
}
