package com.busreview.tracker.scrape.browser;

import org.jsoup.HttpStatusException;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

import java.io.IOException;
import java.time.Duration;

/**
 * Static-HTML session over plain HTTP. {@link #waitFor} cannot wait for scripts, so a missing
 * element on the fetched document counts as a timeout.
 */
public class JsoupBrowserSession implements BrowserSession {
    private final String userAgent;
    private final int timeoutMs;
    private Document document;
    private String currentUrl;

    public JsoupBrowserSession(String userAgent, int timeoutMs) {
        this.userAgent = userAgent;
        this.timeoutMs = timeoutMs;
    }

    @Override
    public void navigate(String url) {
        currentUrl = url;
        document = null;
        try {
            document = Jsoup.connect(url)
                .userAgent(userAgent)
                .timeout(timeoutMs)
                .header("Accept-Language", "en-US,en;q=0.8")
                .get();
        } catch (HttpStatusException e) {
            throw BrowserSessionException.forStatus(e.getStatusCode(), url, e);
        } catch (IOException e) {
            throw BrowserSessionException.transientFailure("Request failed for " + url + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void waitFor(String selector, Duration timeout) {
        Document current = requireDocument();
        if (current.selectFirst(selector) == null) {
            throw BrowserSessionException.transientFailure(
                "No element matching " + selector + " on " + currentUrl,
                null
            );
        }
    }

    @Override
    public String extractHtml() {
        return requireDocument().outerHtml();
    }

    private Document requireDocument() {
        if (document == null) {
            throw new IllegalStateException("navigate must succeed before reading the page");
        }
        return document;
    }

    @Override
    public void close() {
        document = null;
    }
}
