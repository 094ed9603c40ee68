package com.busreview.tracker.scrape.browser;

public interface BrowserSessionFactory {
    BrowserSession open();
}
