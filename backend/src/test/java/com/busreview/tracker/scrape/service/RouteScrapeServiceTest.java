package com.busreview.tracker.scrape.service;

import com.busreview.tracker.config.PipelineProperties;
import com.busreview.tracker.scrape.browser.BrowserSession;
import com.busreview.tracker.scrape.browser.BrowserSessionFactory;
import com.busreview.tracker.scrape.fetch.PageFetcher;
import com.busreview.tracker.scrape.fetch.SearchUrlBuilder;
import com.busreview.tracker.scrape.model.Checkpoint;
import com.busreview.tracker.scrape.model.FetchError;
import com.busreview.tracker.scrape.model.FetchOutcome;
import com.busreview.tracker.scrape.model.LoadErrorKind;
import com.busreview.tracker.scrape.model.LoadReport;
import com.busreview.tracker.scrape.model.NormalizedReview;
import com.busreview.tracker.scrape.model.RawPage;
import com.busreview.tracker.scrape.model.RouteScrapeSummary;
import com.busreview.tracker.scrape.model.RouteStatus;
import com.busreview.tracker.scrape.model.RouteTask;
import com.busreview.tracker.scrape.model.TerminalReason;
import com.busreview.tracker.scrape.normalize.RecordNormalizer;
import com.busreview.tracker.scrape.parse.ListingPageParser;
import com.busreview.tracker.scrape.persistence.CheckpointJdbcRepository;
import com.busreview.tracker.scrape.sentiment.SentimentScore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.nullable;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RouteScrapeServiceTest {
    private static final String PAGE_HTML = """
        <div class="bus-items">
          <div class="bus-item" data-busid="1">
            <div class="travels">KPN Travels</div>
            <div class="bus-name">KPN AC Sleeper</div>
            <div class="route-info">Chennai -> Bangalore</div>
            <div class="review-card"><span class="rating">5</span><p class="comment">Great ride</p></div>
            <div class="review-card"><span class="rating">2</span><p class="comment">Late again</p></div>
            <div class="review-card"><p class="comment">No stars given</p></div>
          </div>
        </div>
        """;

    @Mock
    private BrowserSessionFactory browserSessionFactory;

    @Mock
    private BrowserSession session;

    @Mock
    private PageFetcher pageFetcher;

    @Mock
    private ReviewLoaderService loaderService;

    @Mock
    private CheckpointService checkpointService;

    @Mock
    private CheckpointJdbcRepository checkpointRepository;

    private PipelineProperties properties;
    private RouteScrapeService service;
    private final RouteTask task = RouteTask.pending("Chennai", "Bangalore");

    @BeforeEach
    void setUp() {
        properties = new PipelineProperties();
        service = routeService(checkpointService);
    }

    @Test
    void resumesAtPageAfterCheckpointAndCompletesOnEndOfResults() {
        when(checkpointService.startCursor(task.routeKey())).thenReturn(OptionalInt.of(3));
        when(browserSessionFactory.open()).thenReturn(session);
        when(pageFetcher.fetch(eq(session), any(RouteTask.class), eq(3))).thenReturn(FetchOutcome.success(page(3)));
        when(pageFetcher.fetch(eq(session), any(RouteTask.class), eq(4)))
            .thenReturn(FetchOutcome.failure(FetchError.terminal(TerminalReason.END_OF_RESULTS, 1, "end")));
        when(loaderService.load(anyList(), anyList())).thenReturn(new LoadReport(1, 0, 3, 0, 0, List.of()));

        RouteScrapeSummary summary = service.scrape(task, control());

        InOrder order = inOrder(pageFetcher, loaderService, checkpointService);
        order.verify(pageFetcher).fetch(eq(session), any(RouteTask.class), eq(3));
        order.verify(loaderService).load(anyList(), anyList());
        order.verify(checkpointService).advance(eq(task.routeKey()), eq(3), nullable(String.class), nullable(LocalDate.class));
        order.verify(pageFetcher).fetch(eq(session), any(RouteTask.class), eq(4));
        order.verify(checkpointService).markCompleted(task.routeKey());
        verify(session).close();

        assertThat(summary.status()).isEqualTo(RouteStatus.DONE);
        assertThat(summary.startPageIndex()).isEqualTo(3);
        assertThat(summary.pagesLoaded()).isEqualTo(1);
        assertThat(summary.lastCommittedPageIndex()).isEqualTo(3);
        assertThat(summary.listingsFetched()).isEqualTo(1);
        assertThat(summary.reviewsFetched()).isEqualTo(3);
        assertThat(summary.load().reviewsInserted()).isEqualTo(3);
    }

    @Test
    void transientFailureKeepsLastCommittedCheckpoint() {
        when(checkpointService.startCursor(task.routeKey())).thenReturn(OptionalInt.of(0));
        when(browserSessionFactory.open()).thenReturn(session);
        when(pageFetcher.fetch(eq(session), any(RouteTask.class), eq(0))).thenReturn(FetchOutcome.success(page(0)));
        when(pageFetcher.fetch(eq(session), any(RouteTask.class), eq(1)))
            .thenReturn(FetchOutcome.failure(FetchError.transientFailure(3, "HTTP 503")));
        when(loaderService.load(anyList(), anyList())).thenReturn(LoadReport.empty());

        RouteScrapeSummary summary = service.scrape(task, control());

        assertThat(summary.status()).isEqualTo(RouteStatus.FAILED);
        assertThat(summary.lastCommittedPageIndex()).isZero();
        assertThat(summary.errors()).singleElement().asString().contains("HTTP 503");
        verify(checkpointService).advance(eq(task.routeKey()), eq(0), nullable(String.class), nullable(LocalDate.class));
        verify(checkpointService, never()).advance(eq(task.routeKey()), eq(1), nullable(String.class), nullable(LocalDate.class));
        verify(checkpointService, never()).markCompleted(task.routeKey());
    }

    @Test
    void loadFailureDoesNotAdvanceCheckpoint() {
        when(checkpointService.startCursor(task.routeKey())).thenReturn(OptionalInt.of(2));
        when(browserSessionFactory.open()).thenReturn(session);
        when(pageFetcher.fetch(eq(session), any(RouteTask.class), eq(2))).thenReturn(FetchOutcome.success(page(2)));
        when(loaderService.load(anyList(), anyList()))
            .thenThrow(new LoadException(LoadErrorKind.CONSTRAINT_VIOLATION, "bus", "check failed", null));

        RouteScrapeSummary summary = service.scrape(task, control());

        assertThat(summary.status()).isEqualTo(RouteStatus.FAILED);
        assertThat(summary.lastCommittedPageIndex()).isNull();
        verify(checkpointService, never()).advance(any(), anyInt(), any(), any());
    }

    @Test
    void challengeFailsRouteWithoutCompleting() {
        when(checkpointService.startCursor(task.routeKey())).thenReturn(OptionalInt.of(0));
        when(browserSessionFactory.open()).thenReturn(session);
        when(pageFetcher.fetch(eq(session), any(RouteTask.class), eq(0)))
            .thenReturn(FetchOutcome.failure(FetchError.terminal(TerminalReason.CHALLENGE, 1, "captcha")));

        RouteScrapeSummary summary = service.scrape(task, control());

        assertThat(summary.status()).isEqualTo(RouteStatus.FAILED);
        assertThat(summary.errors()).singleElement().asString().contains("CHALLENGE");
        verify(checkpointService, never()).markCompleted(any());
    }

    @Test
    void cancelledRunLeavesRoutePending() {
        when(checkpointService.startCursor(task.routeKey())).thenReturn(OptionalInt.of(5));
        when(browserSessionFactory.open()).thenReturn(session);
        ScrapeRunControl control = control();
        control.cancel();

        RouteScrapeSummary summary = service.scrape(task, control);

        assertThat(summary.status()).isEqualTo(RouteStatus.PENDING);
        verify(pageFetcher, never()).fetch(any(), any(), anyInt());
    }

    @Test
    void completedRouteIsSkippedWithoutOpeningBrowser() {
        when(checkpointService.startCursor(task.routeKey())).thenReturn(OptionalInt.empty());

        RouteScrapeSummary summary = service.scrape(task, control());

        assertThat(summary.status()).isEqualTo(RouteStatus.DONE);
        verify(browserSessionFactory, never()).open();
    }

    @Test
    void maxPagesPerRouteCompletesRoute() {
        properties.getSource().setMaxPagesPerRoute(1);
        when(checkpointService.startCursor(task.routeKey())).thenReturn(OptionalInt.of(0));
        when(browserSessionFactory.open()).thenReturn(session);
        when(pageFetcher.fetch(eq(session), any(RouteTask.class), eq(0))).thenReturn(FetchOutcome.success(page(0)));
        when(loaderService.load(anyList(), anyList())).thenReturn(LoadReport.empty());

        RouteScrapeSummary summary = service.scrape(task, control());

        assertThat(summary.status()).isEqualTo(RouteStatus.DONE);
        verify(checkpointService).markCompleted(task.routeKey());
        verify(pageFetcher, never()).fetch(any(), any(), eq(1));
    }

    @Test
    @SuppressWarnings("unchecked")
    void minRatingFilterDropsLowRatedReviewsButKeepsUnrated() {
        properties.getRun().setMinRating(4.0);
        when(checkpointService.startCursor(task.routeKey())).thenReturn(OptionalInt.of(0));
        when(browserSessionFactory.open()).thenReturn(session);
        when(pageFetcher.fetch(eq(session), any(RouteTask.class), eq(0))).thenReturn(FetchOutcome.success(page(0)));
        when(pageFetcher.fetch(eq(session), any(RouteTask.class), eq(1)))
            .thenReturn(FetchOutcome.failure(FetchError.terminal(TerminalReason.END_OF_RESULTS, 1, "end")));
        when(loaderService.load(anyList(), anyList())).thenReturn(LoadReport.empty());

        RouteScrapeSummary summary = service.scrape(task, control());

        ArgumentCaptor<List<NormalizedReview>> reviews = ArgumentCaptor.forClass(List.class);
        verify(loaderService).load(anyList(), reviews.capture());
        assertThat(reviews.getValue()).extracting(NormalizedReview::text)
            .containsExactly("Great ride", "No stars given");
        assertThat(reviews.getValue()).allSatisfy(review -> assertThat(review.sentiment()).isNotNull());
        assertThat(summary.recordsDropped()).isEqualTo(1);
    }

    @Test
    void resumedRouteKeepsJourneyDateOfItsFirstPage() {
        Clock dayOne = Clock.fixed(Instant.parse("2024-03-01T06:00:00Z"), ZoneOffset.UTC);
        Clock dayTwo = Clock.fixed(Instant.parse("2024-03-02T06:00:00Z"), ZoneOffset.UTC);
        when(browserSessionFactory.open()).thenReturn(session);
        when(pageFetcher.fetch(eq(session), any(RouteTask.class), eq(0))).thenReturn(FetchOutcome.success(page(0)));
        when(pageFetcher.fetch(eq(session), any(RouteTask.class), eq(1)))
            .thenReturn(FetchOutcome.failure(FetchError.transientFailure(3, "HTTP 503")));
        when(loaderService.load(anyList(), anyList())).thenReturn(LoadReport.empty());
        when(checkpointRepository.find(task.routeKey())).thenReturn(Optional.empty());

        routeService(new CheckpointService(checkpointRepository, properties, dayOne)).scrape(task, control());

        ArgumentCaptor<LocalDate> stored = ArgumentCaptor.forClass(LocalDate.class);
        verify(checkpointRepository).insertFirstPage(eq(task.routeKey()), nullable(String.class), stored.capture(), any(Instant.class));
        assertThat(stored.getValue()).isEqualTo(LocalDate.of(2024, 3, 2));

        when(checkpointRepository.find(task.routeKey())).thenReturn(Optional.of(
            new Checkpoint(task.routeKey(), 0, null, stored.getValue(), Instant.parse("2024-03-01T06:00:00Z"), null)
        ));

        RouteScrapeSummary resumed = routeService(new CheckpointService(checkpointRepository, properties, dayTwo)).scrape(task, control());

        assertThat(resumed.startPageIndex()).isEqualTo(1);
        ArgumentCaptor<RouteTask> fetched = ArgumentCaptor.forClass(RouteTask.class);
        verify(pageFetcher, times(2)).fetch(eq(session), fetched.capture(), eq(1));
        SearchUrlBuilder urls = new SearchUrlBuilder(properties, dayTwo);
        assertThat(urls.pageUrl(fetched.getAllValues().get(1), 1))
            .contains("doj=02-MAR-2024")
            .contains("page=1");
    }

    private RouteScrapeService routeService(CheckpointService checkpoints) {
        return new RouteScrapeService(
            browserSessionFactory,
            pageFetcher,
            new ListingPageParser(),
            new RecordNormalizer(),
            text -> SentimentScore.NEUTRAL,
            loaderService,
            checkpoints,
            properties
        );
    }

    private ScrapeRunControl control() {
        return new ScrapeRunControl(Clock.systemUTC(), null);
    }

    private RawPage page(int pageIndex) {
        return new RawPage(task.routeKey(), pageIndex, "https://bus.example.test/search?page=" + pageIndex, PAGE_HTML, Instant.EPOCH, PAGE_HTML.length());
    }
}
