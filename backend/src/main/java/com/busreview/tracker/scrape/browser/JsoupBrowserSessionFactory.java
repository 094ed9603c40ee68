package com.busreview.tracker.scrape.browser;

import com.busreview.tracker.config.PipelineProperties;

public class JsoupBrowserSessionFactory implements BrowserSessionFactory {
    private final PipelineProperties.Browser settings;

    public JsoupBrowserSessionFactory(PipelineProperties properties) {
        this.settings = properties.getBrowser();
    }

    @Override
    public BrowserSession open() {
        return new JsoupBrowserSession(settings.getUserAgent(), settings.getPageLoadTimeoutSeconds() * 1000);
    }
}
