package com.busreview.tracker.scrape.service;

import com.busreview.tracker.config.PipelineProperties;
import com.busreview.tracker.scrape.model.RouteRequest;
import com.busreview.tracker.scrape.model.RouteScrapeSummary;
import com.busreview.tracker.scrape.model.RouteStatus;
import com.busreview.tracker.scrape.model.RouteTask;
import com.busreview.tracker.scrape.model.RunSummary;
import com.busreview.tracker.scrape.model.ScrapeRunRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;

@Service
public class ScrapeOrchestratorService {
    private static final Logger log = LoggerFactory.getLogger(ScrapeOrchestratorService.class);

    public static final String STATUS_COMPLETED = "COMPLETED";
    public static final String STATUS_COMPLETED_WITH_FAILURES = "COMPLETED_WITH_FAILURES";
    public static final String STATUS_INTERRUPTED = "INTERRUPTED";
    public static final String STATUS_FAILED = "FAILED";

    private final RouteScrapeService routeScrapeService;
    private final RouteWorkSetLoader workSetLoader;
    private final ExecutorService scrapeRunExecutor;
    private final PipelineProperties properties;
    private final Clock clock;
    private final AtomicReference<ActiveRun> activeRun = new AtomicReference<>();
    private final AtomicReference<RunSummary> latestSummary = new AtomicReference<>();

    public ScrapeOrchestratorService(
        RouteScrapeService routeScrapeService,
        RouteWorkSetLoader workSetLoader,
        @Qualifier("scrapeRunExecutor") ExecutorService scrapeRunExecutor,
        PipelineProperties properties,
        Clock clock
    ) {
        this.routeScrapeService = routeScrapeService;
        this.workSetLoader = workSetLoader;
        this.scrapeRunExecutor = scrapeRunExecutor;
        this.properties = properties;
        this.clock = clock;
    }

    public RunSummary run(ScrapeRunRequest request) {
        ActiveRun run = claim(request);
        return execute(run, request);
    }

    /**
     * Starts a run on the run executor and returns its id immediately.
     */
    public String startAsync(ScrapeRunRequest request) {
        ActiveRun run = claim(request);
        try {
            scrapeRunExecutor.submit(() -> execute(run, request));
        } catch (RuntimeException e) {
            activeRun.compareAndSet(run, null);
            throw e;
        }
        return run.runId();
    }

    public boolean cancel() {
        ActiveRun run = activeRun.get();
        if (run == null) {
            return false;
        }
        log.info("Cancelling scrape run {}", run.runId());
        run.control().cancel();
        return true;
    }

    public Optional<RunSummary> latestSummary() {
        return Optional.ofNullable(latestSummary.get());
    }

    public Optional<String> activeRunId() {
        ActiveRun run = activeRun.get();
        return run == null ? Optional.empty() : Optional.of(run.runId());
    }

    private ActiveRun claim(ScrapeRunRequest request) {
        int maxDuration = request != null && request.maxDurationSeconds() != null
            ? Math.max(0, request.maxDurationSeconds())
            : properties.getRun().getMaxDurationSeconds();
        ActiveRun run = new ActiveRun(
            UUID.randomUUID().toString(),
            Instant.now(clock),
            ScrapeRunControl.withMaxDuration(clock, maxDuration)
        );
        if (!activeRun.compareAndSet(null, run)) {
            ActiveRun current = activeRun.get();
            throw new ActiveScrapeRunException(
                "Scrape run " + (current == null ? "unknown" : current.runId()) + " is already active"
            );
        }
        return run;
    }

    private RunSummary execute(ActiveRun run, ScrapeRunRequest request) {
        List<RouteScrapeSummary> routes = new ArrayList<>();
        String status;
        try {
            List<RouteTask> tasks = workSet(request);
            int concurrency = request != null && request.concurrency() != null
                ? Math.max(1, request.concurrency())
                : properties.getRun().getConcurrency();
            log.info("Scrape run {} starting with {} routes, concurrency {}", run.runId(), tasks.size(), concurrency);
            routes.addAll(runRoutes(tasks, concurrency, run.control()));
            status = statusFor(routes, run.control());
        } catch (RuntimeException e) {
            log.warn("Scrape run {} failed", run.runId(), e);
            status = STATUS_FAILED;
        }
        RunSummary summary = RunSummary.of(run.runId(), run.startedAt(), Instant.now(clock), status, routes);
        latestSummary.set(summary);
        activeRun.compareAndSet(run, null);
        log.info(
            "Scrape run {} {}: listingsFetched={} reviewsFetched={} dropped={} malformed={} duplicates={} "
                + "listingsLoaded={} reviewsLoaded={} rejected={} routesFailed={} qualityIssues={}",
            summary.runId(),
            summary.status(),
            summary.listingsFetched(),
            summary.reviewsFetched(),
            summary.recordsDropped(),
            summary.malformedRecords(),
            summary.duplicatesSkipped(),
            summary.listingsLoaded(),
            summary.reviewsLoaded(),
            summary.reviewsRejected(),
            summary.routesFailed(),
            summary.qualityIssues()
        );
        return summary;
    }

    private List<RouteTask> workSet(ScrapeRunRequest request) {
        List<RouteRequest> requested = request == null ? List.of() : request.safeRoutes();
        if (requested.isEmpty()) {
            requested = workSetLoader.loadConfigured();
        }
        Map<String, RouteTask> unique = new LinkedHashMap<>();
        for (RouteRequest route : requested) {
            if (route == null || isBlank(route.origin()) || isBlank(route.destination())) {
                log.warn("Skipping route without origin or destination: {}", route);
                continue;
            }
            RouteTask task = RouteTask.pending(route.origin(), route.destination());
            unique.putIfAbsent(task.routeKey(), task);
        }
        return List.copyOf(unique.values());
    }

    private List<RouteScrapeSummary> runRoutes(List<RouteTask> tasks, int concurrency, ScrapeRunControl control) {
        if (tasks.isEmpty()) {
            return List.of();
        }
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(concurrency, tasks.size()));
        try {
            List<CompletableFuture<RouteScrapeSummary>> futures = new ArrayList<>();
            for (RouteTask task : tasks) {
                futures.add(CompletableFuture.supplyAsync(() -> routeScrapeService.scrape(task, control), pool));
            }
            List<RouteScrapeSummary> summaries = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                RouteTask task = tasks.get(i);
                try {
                    summaries.add(futures.get(i).join());
                } catch (CompletionException e) {
                    Throwable cause = e.getCause() == null ? e : e.getCause();
                    log.warn("Route worker failed for {}", task.routeKey(), cause);
                    summaries.add(RouteScrapeSummary.failedBeforeStart(task.routeKey(), String.valueOf(cause.getMessage())));
                }
            }
            return summaries;
        } finally {
            pool.shutdown();
        }
    }

    private String statusFor(List<RouteScrapeSummary> routes, ScrapeRunControl control) {
        boolean interrupted = control.isCancelled() || control.isDeadlineReached()
            || routes.stream().anyMatch(route -> route.status() == RouteStatus.PENDING);
        if (interrupted) {
            return STATUS_INTERRUPTED;
        }
        boolean anyFailed = routes.stream().anyMatch(route -> route.status() == RouteStatus.FAILED);
        return anyFailed ? STATUS_COMPLETED_WITH_FAILURES : STATUS_COMPLETED;
    }

    private boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private record ActiveRun(String runId, Instant startedAt, ScrapeRunControl control) {}
}
