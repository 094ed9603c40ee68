package com.busreview.tracker.scrape.service;

import com.busreview.tracker.config.PipelineProperties;
import com.busreview.tracker.scrape.browser.BrowserSession;
import com.busreview.tracker.scrape.browser.BrowserSessionException;
import com.busreview.tracker.scrape.browser.BrowserSessionFactory;
import com.busreview.tracker.scrape.fetch.PageFetcher;
import com.busreview.tracker.scrape.model.FetchError;
import com.busreview.tracker.scrape.model.FetchOutcome;
import com.busreview.tracker.scrape.model.ListingRecord;
import com.busreview.tracker.scrape.model.LoadReport;
import com.busreview.tracker.scrape.model.Normalized;
import com.busreview.tracker.scrape.model.NormalizedListing;
import com.busreview.tracker.scrape.model.NormalizedReview;
import com.busreview.tracker.scrape.model.ParsedPage;
import com.busreview.tracker.scrape.model.QualityIssue;
import com.busreview.tracker.scrape.model.ReviewRecord;
import com.busreview.tracker.scrape.model.RouteScrapeSummary;
import com.busreview.tracker.scrape.model.RouteStatus;
import com.busreview.tracker.scrape.model.RouteTask;
import com.busreview.tracker.scrape.normalize.RecordNormalizer;
import com.busreview.tracker.scrape.parse.ListingPageParser;
import com.busreview.tracker.scrape.parse.PageParseException;
import com.busreview.tracker.scrape.sentiment.SentimentScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Scrapes one route page by page. Page N+1 is fetched only after page N is loaded and checkpointed.
 */
@Service
public class RouteScrapeService {
    private static final Logger log = LoggerFactory.getLogger(RouteScrapeService.class);

    private final BrowserSessionFactory browserSessionFactory;
    private final PageFetcher pageFetcher;
    private final ListingPageParser parser;
    private final RecordNormalizer normalizer;
    private final SentimentScorer sentimentScorer;
    private final ReviewLoaderService loaderService;
    private final CheckpointService checkpointService;
    private final PipelineProperties properties;

    public RouteScrapeService(
        BrowserSessionFactory browserSessionFactory,
        PageFetcher pageFetcher,
        ListingPageParser parser,
        RecordNormalizer normalizer,
        SentimentScorer sentimentScorer,
        ReviewLoaderService loaderService,
        CheckpointService checkpointService,
        PipelineProperties properties
    ) {
        this.browserSessionFactory = browserSessionFactory;
        this.pageFetcher = pageFetcher;
        this.parser = parser;
        this.normalizer = normalizer;
        this.sentimentScorer = sentimentScorer;
        this.loaderService = loaderService;
        this.checkpointService = checkpointService;
        this.properties = properties;
    }

    public RouteScrapeSummary scrape(RouteTask task, ScrapeRunControl control) {
        RouteProgress progress = new RouteProgress(task.routeKey());
        try {
            OptionalInt startCursor = checkpointService.startCursor(task.routeKey());
            if (startCursor.isEmpty()) {
                log.info("Route {} already completed; skipping", task.routeKey());
                progress.status = RouteStatus.DONE;
                return progress.toSummary();
            }
            progress.startPageIndex = startCursor.getAsInt();
            progress.status = RouteStatus.IN_PROGRESS;
            LocalDate journeyDate = checkpointService.journeyDate(task.routeKey());
            log.info("Starting route {} at page {} for journey date {}", task.routeKey(), progress.startPageIndex, journeyDate);
            RouteTask started = task.withCursor(progress.startPageIndex)
                .withStatus(RouteStatus.IN_PROGRESS)
                .withJourneyDate(journeyDate);
            try (BrowserSession session = browserSessionFactory.open()) {
                runPages(session, started, control, progress);
            }
        } catch (BrowserSessionException e) {
            progress.fail("Browser session failed: " + e.getMessage());
            log.warn("Browser session failed for route {}", task.routeKey(), e);
        } catch (RuntimeException e) {
            progress.fail("Unexpected failure: " + e.getMessage());
            log.warn("Route {} failed unexpectedly", task.routeKey(), e);
        }
        log.info(
            "Route {} finished status={} pages={} lastCommittedPage={}",
            task.routeKey(),
            progress.status,
            progress.pagesLoaded,
            progress.lastCommittedPageIndex
        );
        return progress.toSummary();
    }

    private void runPages(BrowserSession session, RouteTask task, ScrapeRunControl control, RouteProgress progress) {
        int maxPages = properties.getSource().getMaxPagesPerRoute();
        int pageIndex = task.cursor();
        while (true) {
            if (pageIndex >= maxPages) {
                log.info("Route {} reached max pages ({})", task.routeKey(), maxPages);
                checkpointService.markCompleted(task.routeKey());
                progress.status = RouteStatus.DONE;
                return;
            }
            if (control.shouldStop()) {
                progress.status = RouteStatus.PENDING;
                return;
            }
            RouteTask current = task.withCursor(pageIndex);
            FetchOutcome outcome = pageFetcher.fetch(session, current, pageIndex);
            if (!outcome.isSuccess()) {
                handleFetchFailure(current, pageIndex, outcome.error(), control, progress);
                return;
            }
            if (!processPage(current, outcome, progress)) {
                return;
            }
            pageIndex++;
        }
    }

    private void handleFetchFailure(
        RouteTask task,
        int pageIndex,
        FetchError error,
        ScrapeRunControl control,
        RouteProgress progress
    ) {
        if (error.isEndOfResults()) {
            checkpointService.markCompleted(task.routeKey());
            progress.status = RouteStatus.DONE;
            return;
        }
        if (control.shouldStop()) {
            progress.status = RouteStatus.PENDING;
            return;
        }
        String reason = error.terminalReason() == null ? error.kind().name() : error.kind() + "/" + error.terminalReason();
        progress.fail("Fetch failed at page " + pageIndex + " (" + reason + ", attempts=" + error.attempts() + "): " + error.message());
        log.warn("Route {} stopped at page {}: {} {}", task.routeKey(), pageIndex, reason, error.message());
    }

    /**
     * @return false when the route must stop; the checkpoint then still points at the last committed page
     */
    private boolean processPage(RouteTask task, FetchOutcome outcome, RouteProgress progress) {
        int pageIndex = outcome.page().pageIndex();
        ParsedPage parsed;
        try {
            parsed = parser.parse(outcome.page());
        } catch (PageParseException e) {
            progress.fail("Malformed page " + pageIndex + ": " + e.getMessage());
            log.warn("Route {} page {} malformed: {}", task.routeKey(), pageIndex, e.getMessage());
            return false;
        }
        progress.listingsFetched += parsed.listings().size();
        progress.reviewsFetched += parsed.reviews().size();
        progress.malformedRecords += parsed.malformedRecords();

        List<NormalizedListing> listings = new ArrayList<>();
        Map<String, String> busIdsByRef = new HashMap<>();
        for (ListingRecord record : parsed.listings()) {
            Normalized<NormalizedListing> normalized = normalizer.normalizeListing(record, task);
            if (normalized.isDropped()) {
                progress.recordsDropped++;
                continue;
            }
            NormalizedListing listing = normalized.value();
            listings.add(listing);
            progress.countIssues(listing.qualityIssues());
            if (listing.listingRef() != null) {
                busIdsByRef.put(listing.listingRef(), listing.busId());
            }
        }

        double minRating = properties.getRun().getMinRating();
        List<NormalizedReview> reviews = new ArrayList<>();
        for (ReviewRecord record : parsed.reviews()) {
            Normalized<NormalizedReview> normalized = normalizer.normalizeReview(record, busIdsByRef.get(record.listingRef()));
            if (normalized.isDropped()) {
                progress.recordsDropped++;
                continue;
            }
            NormalizedReview review = normalized.value();
            if (review.rating() != null && review.rating() < minRating) {
                progress.recordsDropped++;
                continue;
            }
            progress.countIssues(review.qualityIssues());
            reviews.add(review.withSentiment(sentimentScorer.score(review.text())));
        }
        progress.listingsNormalized += listings.size();
        progress.reviewsNormalized += reviews.size();

        try {
            LoadReport report = loaderService.load(listings, reviews);
            progress.load = progress.load.plus(report);
            String reviewCursor = reviews.isEmpty() ? null : reviews.get(reviews.size() - 1).reviewId();
            checkpointService.advance(task.routeKey(), pageIndex, reviewCursor, task.journeyDate());
        } catch (LoadException e) {
            progress.fail("Load failed at page " + pageIndex + ": " + e.getMessage());
            log.warn("Route {} load failed at page {}", task.routeKey(), pageIndex, e);
            return false;
        } catch (CheckpointConflictException e) {
            progress.fail(e.getMessage());
            log.warn("Route {} checkpoint conflict: {}", task.routeKey(), e.getMessage());
            return false;
        }
        progress.pagesLoaded++;
        progress.lastCommittedPageIndex = pageIndex;
        log.info(
            "Route {} page {} committed listings={} reviews={}",
            task.routeKey(),
            pageIndex,
            listings.size(),
            reviews.size()
        );
        return true;
    }

    private static final class RouteProgress {
        private final String routeKey;
        private RouteStatus status = RouteStatus.PENDING;
        private int startPageIndex;
        private int pagesLoaded;
        private Integer lastCommittedPageIndex;
        private int listingsFetched;
        private int reviewsFetched;
        private int listingsNormalized;
        private int reviewsNormalized;
        private int recordsDropped;
        private int malformedRecords;
        private final Map<QualityIssue, Integer> qualityIssues = new EnumMap<>(QualityIssue.class);
        private LoadReport load = LoadReport.empty();
        private final List<String> errors = new ArrayList<>();

        private RouteProgress(String routeKey) {
            this.routeKey = routeKey;
        }

        private void fail(String error) {
            status = RouteStatus.FAILED;
            errors.add(error);
        }

        private void countIssues(Iterable<QualityIssue> issues) {
            for (QualityIssue issue : issues) {
                qualityIssues.merge(issue, 1, Integer::sum);
            }
        }

        private RouteScrapeSummary toSummary() {
            return new RouteScrapeSummary(
                routeKey,
                status,
                startPageIndex,
                pagesLoaded,
                lastCommittedPageIndex,
                listingsFetched,
                reviewsFetched,
                listingsNormalized,
                reviewsNormalized,
                recordsDropped,
                malformedRecords,
                Map.copyOf(qualityIssues),
                load,
                List.copyOf(errors)
            );
        }
    }
}
