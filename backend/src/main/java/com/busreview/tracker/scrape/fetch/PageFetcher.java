package com.busreview.tracker.scrape.fetch;

import com.busreview.tracker.config.PipelineProperties;
import com.busreview.tracker.scrape.browser.BrowserSession;
import com.busreview.tracker.scrape.browser.BrowserSessionException;
import com.busreview.tracker.scrape.model.FetchError;
import com.busreview.tracker.scrape.model.FetchOutcome;
import com.busreview.tracker.scrape.model.RawPage;
import com.busreview.tracker.scrape.model.RouteTask;
import com.busreview.tracker.scrape.model.TerminalReason;
import com.busreview.tracker.scrape.parse.ListingSelectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.LongBinaryOperator;

@Service
public class PageFetcher {
    private static final Logger log = LoggerFactory.getLogger(PageFetcher.class);

    private final PipelineProperties properties;
    private final SearchUrlBuilder urlBuilder;
    private final RawPageAuditStore auditStore;
    private final Sleeper sleeper;
    private final Clock clock;
    private final RetryPolicy retryPolicy;
    private final LongBinaryOperator delayPicker;

    @Autowired
    public PageFetcher(
        PipelineProperties properties,
        SearchUrlBuilder urlBuilder,
        RawPageAuditStore auditStore,
        Sleeper sleeper,
        Clock clock
    ) {
        this(
            properties,
            urlBuilder,
            auditStore,
            sleeper,
            clock,
            RetryPolicy.from(properties.getFetch()),
            PageFetcher::randomBetween
        );
    }

    public PageFetcher(
        PipelineProperties properties,
        SearchUrlBuilder urlBuilder,
        RawPageAuditStore auditStore,
        Sleeper sleeper,
        Clock clock,
        RetryPolicy retryPolicy,
        LongBinaryOperator delayPicker
    ) {
        this.properties = properties;
        this.urlBuilder = urlBuilder;
        this.auditStore = auditStore;
        this.sleeper = sleeper;
        this.clock = clock;
        this.retryPolicy = retryPolicy;
        this.delayPicker = delayPicker;
    }

    public FetchOutcome fetch(BrowserSession session, RouteTask task, int pageIndex) {
        String url = urlBuilder.pageUrl(task, pageIndex);
        Duration waitTimeout = Duration.ofSeconds(properties.getFetch().getWaitTimeoutSeconds());
        String lastError = null;
        for (int attempt = 1; attempt <= retryPolicy.maxAttempts(); attempt++) {
            if (!politenessDelay()) {
                return FetchOutcome.failure(FetchError.transientFailure(attempt, "interrupted before request"));
            }
            try {
                session.navigate(url);
                session.waitFor(ListingSelectors.PAGE_READY, waitTimeout);
                String html = session.extractHtml();
                RawPage page = new RawPage(
                    task.routeKey(),
                    pageIndex,
                    url,
                    html,
                    Instant.now(clock),
                    html == null ? 0 : html.getBytes(StandardCharsets.UTF_8).length
                );
                auditStore.write(page);
                Optional<TerminalReason> signal = PageSignals.detect(html);
                if (signal.isPresent()) {
                    log.info("Terminal signal {} for {} page {}", signal.get(), task.routeKey(), pageIndex);
                    return FetchOutcome.failure(FetchError.terminal(signal.get(), attempt, url));
                }
                return FetchOutcome.success(page);
            } catch (BrowserSessionException e) {
                if (!e.isTransientFailure()) {
                    TerminalReason reason = terminalReasonFor(e.getStatusCode());
                    log.info("Non-retryable fetch failure for {} page {}: {}", task.routeKey(), pageIndex, e.getMessage());
                    return FetchOutcome.failure(FetchError.terminal(reason, attempt, e.getMessage()));
                }
                lastError = e.getMessage();
                log.warn(
                    "Transient fetch failure for {} page {} (attempt {}/{}): {}",
                    task.routeKey(),
                    pageIndex,
                    attempt,
                    retryPolicy.maxAttempts(),
                    e.getMessage()
                );
            }
            if (!retryPolicy.canRetry(attempt)) {
                break;
            }
            if (!sleeper.sleep(retryPolicy.backoffAfter(attempt))) {
                return FetchOutcome.failure(FetchError.transientFailure(attempt, "interrupted during backoff"));
            }
        }
        return FetchOutcome.failure(FetchError.transientFailure(
            retryPolicy.maxAttempts(),
            lastError == null ? "retries exhausted" : lastError
        ));
    }

    private TerminalReason terminalReasonFor(Integer statusCode) {
        if (statusCode != null && (statusCode == 404 || statusCode == 410)) {
            return TerminalReason.END_OF_RESULTS;
        }
        return TerminalReason.CHALLENGE;
    }

    private boolean politenessDelay() {
        long min = properties.getFetch().getMinDelayMs();
        long max = properties.getFetch().getMaxDelayMs();
        long delay = delayPicker.applyAsLong(min, max);
        return sleeper.sleep(Duration.ofMillis(Math.max(0, delay)));
    }

    static long randomBetween(long min, long max) {
        if (max <= min) {
            return min;
        }
        return ThreadLocalRandom.current().nextLong(min, max + 1);
    }
}
