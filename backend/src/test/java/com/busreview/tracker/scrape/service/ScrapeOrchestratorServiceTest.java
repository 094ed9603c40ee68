package com.busreview.tracker.scrape.service;

import com.busreview.tracker.config.PipelineProperties;
import com.busreview.tracker.scrape.model.LoadReport;
import com.busreview.tracker.scrape.model.RouteRequest;
import com.busreview.tracker.scrape.model.RouteScrapeSummary;
import com.busreview.tracker.scrape.model.RouteStatus;
import com.busreview.tracker.scrape.model.RouteTask;
import com.busreview.tracker.scrape.model.RunSummary;
import com.busreview.tracker.scrape.model.ScrapeRunRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ScrapeOrchestratorServiceTest {

    @Mock
    private RouteScrapeService routeScrapeService;

    @Mock
    private RouteWorkSetLoader workSetLoader;

    private ExecutorService runExecutor;
    private ScrapeOrchestratorService orchestrator;

    @BeforeEach
    void setUp() {
        runExecutor = Executors.newSingleThreadExecutor();
        orchestrator = new ScrapeOrchestratorService(
            routeScrapeService,
            workSetLoader,
            runExecutor,
            new PipelineProperties(),
            Clock.systemUTC()
        );
    }

    @AfterEach
    void tearDown() {
        runExecutor.shutdownNow();
    }

    @Test
    void duplicateRouteKeysAreScrapedOnce() {
        when(routeScrapeService.scrape(any(), any()))
            .thenAnswer(invocation -> summary(invocation.<RouteTask>getArgument(0).routeKey(), RouteStatus.DONE));

        RunSummary summary = orchestrator.run(new ScrapeRunRequest(
            List.of(
                new RouteRequest("Chennai", "Bangalore"),
                new RouteRequest(" chennai ", "BANGALORE"),
                new RouteRequest("Pune", "Goa")
            ),
            2,
            null
        ));

        ArgumentCaptor<RouteTask> tasks = ArgumentCaptor.forClass(RouteTask.class);
        verify(routeScrapeService, times(2)).scrape(tasks.capture(), any());
        assertThat(tasks.getAllValues()).extracting(RouteTask::routeKey)
            .containsExactlyInAnyOrder("chennai->bangalore", "pune->goa");
        assertThat(summary.status()).isEqualTo(ScrapeOrchestratorService.STATUS_COMPLETED);
        assertThat(summary.routes()).hasSize(2);
        assertThat(orchestrator.latestSummary()).contains(summary);
    }

    @Test
    void emptyRequestUsesConfiguredWorkSet() {
        when(workSetLoader.loadConfigured()).thenReturn(List.of(new RouteRequest("Mumbai", "Pune")));
        when(routeScrapeService.scrape(any(), any())).thenReturn(summary("mumbai->pune", RouteStatus.DONE));

        RunSummary summary = orchestrator.run(null);

        assertThat(summary.routes()).extracting(RouteScrapeSummary::routeKey).containsExactly("mumbai->pune");
    }

    @Test
    void failedAndCrashedRoutesAreRecorded() {
        when(routeScrapeService.scrape(any(), any())).thenAnswer(invocation -> {
            RouteTask task = invocation.getArgument(0);
            if (task.origin().equals("Pune")) {
                throw new IllegalStateException("worker crashed");
            }
            return summary(task.routeKey(), RouteStatus.FAILED);
        });

        RunSummary summary = orchestrator.run(new ScrapeRunRequest(
            List.of(new RouteRequest("Chennai", "Bangalore"), new RouteRequest("Pune", "Goa")),
            1,
            null
        ));

        assertThat(summary.status()).isEqualTo(ScrapeOrchestratorService.STATUS_COMPLETED_WITH_FAILURES);
        assertThat(summary.routesFailed()).isEqualTo(2);
        assertThat(summary.routes()).filteredOn(route -> route.routeKey().equals("pune->goa"))
            .singleElement()
            .satisfies(route -> assertThat(route.errors()).containsExactly("worker crashed"));
    }

    @Test
    void onlyOneRunAtATimeAndCancellationInterrupts() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(routeScrapeService.scrape(any(), any())).thenAnswer(invocation -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            ScrapeRunControl control = invocation.getArgument(1);
            return summary("chennai->bangalore", control.shouldStop() ? RouteStatus.PENDING : RouteStatus.DONE);
        });
        ScrapeRunRequest request = new ScrapeRunRequest(List.of(new RouteRequest("Chennai", "Bangalore")), 1, null);

        String runId = orchestrator.startAsync(request);
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        assertThatThrownBy(() -> orchestrator.run(request)).isInstanceOf(ActiveScrapeRunException.class);
        assertThat(orchestrator.activeRunId()).contains(runId);
        assertThat(orchestrator.cancel()).isTrue();
        release.countDown();

        RunSummary summary = awaitSummary();
        assertThat(summary.runId()).isEqualTo(runId);
        assertThat(summary.status()).isEqualTo(ScrapeOrchestratorService.STATUS_INTERRUPTED);
        assertThat(summary.routes()).singleElement()
            .satisfies(route -> assertThat(route.status()).isEqualTo(RouteStatus.PENDING));
    }

    @Test
    void cancelWithoutActiveRunReturnsFalse() {
        assertThat(orchestrator.cancel()).isFalse();
        assertThat(orchestrator.latestSummary()).isEmpty();
    }

    private RunSummary awaitSummary() throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (System.currentTimeMillis() < deadline) {
            if (orchestrator.latestSummary().isPresent()) {
                return orchestrator.latestSummary().get();
            }
            Thread.sleep(20);
        }
        throw new AssertionError("Run did not finish");
    }

    private RouteScrapeSummary summary(String routeKey, RouteStatus status) {
        return new RouteScrapeSummary(
            routeKey,
            status,
            0,
            0,
            null,
            0,
            0,
            0,
            0,
            0,
            0,
            Map.of(),
            LoadReport.empty(),
            List.of()
        );
    }
}
