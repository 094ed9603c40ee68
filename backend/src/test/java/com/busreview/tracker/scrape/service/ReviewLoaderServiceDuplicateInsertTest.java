package com.busreview.tracker.scrape.service;

import com.busreview.tracker.scrape.model.ListingRecord;
import com.busreview.tracker.scrape.model.LoadErrorKind;
import com.busreview.tracker.scrape.model.NormalizedListing;
import com.busreview.tracker.scrape.model.NormalizedReview;
import com.busreview.tracker.scrape.model.ReviewRecord;
import com.busreview.tracker.scrape.model.RouteTask;
import com.busreview.tracker.scrape.normalize.RecordNormalizer;
import com.busreview.tracker.scrape.persistence.BusReviewJdbcRepository;
import com.busreview.tracker.scrape.sentiment.SentimentScore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReviewLoaderServiceDuplicateInsertTest {

    @Mock
    private BusReviewJdbcRepository repository;

    @Mock
    private PlatformTransactionManager transactionManager;

    @Test
    void duplicateKeyOnInsertAbortsBusWithLoadException() {
        ReviewLoaderService loaderService = new ReviewLoaderService(
            repository,
            new TransactionTemplate(transactionManager),
            Clock.systemUTC()
        );
        RecordNormalizer normalizer = new RecordNormalizer();
        NormalizedListing listing = normalizer.normalizeListing(
            new ListingRecord("1", "KPN Travels", "KPN AC Sleeper", "A/C Sleeper (2+1)", "Chennai -> Bangalore", "21:30", null, null),
            RouteTask.pending("Chennai", "Bangalore")
        ).value();
        NormalizedReview review = normalizer.normalizeReview(
            new ReviewRecord("1", "5", null, "Great ride", "2024-01-10"),
            listing.busId()
        ).value().withSentiment(SentimentScore.NEUTRAL);

        when(repository.upsertBus(any(NormalizedListing.class), any(Instant.class))).thenReturn(true);
        when(repository.reviewExists(review.reviewId())).thenReturn(false);
        doThrow(new DuplicateKeyException("reviews_pkey"))
            .when(repository).insertReview(any(NormalizedReview.class), any(Instant.class));

        assertThatThrownBy(() -> loaderService.load(List.of(listing), List.of(review)))
            .isInstanceOfSatisfying(LoadException.class, e -> {
                assertThat(e.getKind()).isEqualTo(LoadErrorKind.CONSTRAINT_VIOLATION);
                assertThat(e.getBusId()).isEqualTo(listing.busId());
            });
        verify(repository, never()).recomputeAggregates(anyString());
        verify(transactionManager).rollback(any());
    }
}
