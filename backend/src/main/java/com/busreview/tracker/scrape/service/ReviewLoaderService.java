package com.busreview.tracker.scrape.service;

import com.busreview.tracker.scrape.model.LoadError;
import com.busreview.tracker.scrape.model.LoadErrorKind;
import com.busreview.tracker.scrape.model.LoadReport;
import com.busreview.tracker.scrape.model.NormalizedListing;
import com.busreview.tracker.scrape.model.NormalizedReview;
import com.busreview.tracker.scrape.persistence.BusReviewJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Service
public class ReviewLoaderService {
    private static final Logger log = LoggerFactory.getLogger(ReviewLoaderService.class);

    private final BusReviewJdbcRepository repository;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public ReviewLoaderService(BusReviewJdbcRepository repository, TransactionTemplate transactionTemplate, Clock clock) {
        this.repository = repository;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
    }

    /**
     * Loads one page worth of records. Each bus and its reviews commit together; a data-access
     * failure aborts the remaining buses with a {@link LoadException}.
     */
    public LoadReport load(List<NormalizedListing> listings, List<NormalizedReview> reviews) {
        Map<String, NormalizedListing> listingsByBus = new LinkedHashMap<>();
        for (NormalizedListing listing : listings == null ? List.<NormalizedListing>of() : listings) {
            listingsByBus.put(listing.busId(), listing);
        }
        Map<String, List<NormalizedReview>> reviewsByBus = new LinkedHashMap<>();
        List<LoadError> errors = new ArrayList<>();
        int rejected = 0;
        for (NormalizedReview review : reviews == null ? List.<NormalizedReview>of() : reviews) {
            if (review.busId() == null || review.reviewId() == null) {
                rejected++;
                errors.add(new LoadError(LoadErrorKind.FOREIGN_KEY_VIOLATION, null, review.reviewId(), "Review has no bus id"));
                continue;
            }
            reviewsByBus.computeIfAbsent(review.busId(), key -> new ArrayList<>()).add(review);
        }

        Set<String> busIds = new LinkedHashSet<>(listingsByBus.keySet());
        busIds.addAll(reviewsByBus.keySet());

        LoadReport report = new LoadReport(0, 0, 0, 0, rejected, List.copyOf(errors));
        for (String busId : busIds) {
            NormalizedListing listing = listingsByBus.get(busId);
            List<NormalizedReview> busReviews = reviewsByBus.getOrDefault(busId, List.of());
            LoadReport busReport;
            try {
                busReport = transactionTemplate.execute(status -> loadBus(busId, listing, busReviews));
            } catch (DataAccessException e) {
                log.warn("Load failed for bus {}", busId, e);
                throw new LoadException(LoadErrorKind.CONSTRAINT_VIOLATION, busId, "Load failed for bus " + busId + ": " + e.getMessage(), e);
            }
            report = report.plus(busReport);
        }
        return report;
    }

    private LoadReport loadBus(String busId, NormalizedListing listing, List<NormalizedReview> reviews) {
        Instant now = Instant.now(clock);
        int inserted = 0;
        int updated = 0;
        if (listing != null) {
            if (repository.upsertBus(listing, now)) {
                inserted++;
            } else {
                updated++;
            }
        } else if (!repository.busExists(busId)) {
            List<LoadError> errors = new ArrayList<>();
            for (NormalizedReview review : reviews) {
                errors.add(new LoadError(LoadErrorKind.FOREIGN_KEY_VIOLATION, busId, review.reviewId(), "Unknown bus " + busId));
            }
            log.info("Rejected {} reviews for unknown bus {}", reviews.size(), busId);
            return new LoadReport(0, 0, 0, 0, reviews.size(), List.copyOf(errors));
        }

        int reviewsInserted = 0;
        int duplicates = 0;
        Set<String> seen = new LinkedHashSet<>();
        for (NormalizedReview review : reviews) {
            if (!seen.add(review.reviewId()) || repository.reviewExists(review.reviewId())) {
                duplicates++;
                continue;
            }
            repository.insertReview(review, now);
            reviewsInserted++;
        }
        repository.recomputeAggregates(busId);
        return new LoadReport(inserted, updated, reviewsInserted, duplicates, 0, List.of());
    }
}
