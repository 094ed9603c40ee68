package com.busreview.tracker.scrape.browser;

import java.time.Duration;

/**
 * Minimal browser capability a fetch depends on. One session belongs to one route worker.
 */
public interface BrowserSession extends AutoCloseable {
    void navigate(String url);

    /**
     * Blocks until an element matching {@code selector} is present.
     *
     * @throws BrowserSessionException marked transient when the timeout elapses
     */
    void waitFor(String selector, Duration timeout);

    String extractHtml();

    @Override
    void close();
}
