package com.busreview.tracker.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {
    private static final String DEFAULT_USER_AGENT =
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0 Safari/537.36";

    private Browser browser = new Browser();
    private Source source = new Source();
    private Fetch fetch = new Fetch();
    private Run run = new Run();
    private Sentiment sentiment = new Sentiment();
    private Audit audit = new Audit();
    private Data data = new Data();

    public Browser getBrowser() {
        return browser;
    }

    public void setBrowser(Browser browser) {
        this.browser = browser;
    }

    public Source getSource() {
        return source;
    }

    public void setSource(Source source) {
        this.source = source;
    }

    public Fetch getFetch() {
        return fetch;
    }

    public void setFetch(Fetch fetch) {
        this.fetch = fetch;
    }

    public Run getRun() {
        return run;
    }

    public void setRun(Run run) {
        this.run = run;
    }

    public Sentiment getSentiment() {
        return sentiment;
    }

    public void setSentiment(Sentiment sentiment) {
        this.sentiment = sentiment;
    }

    public Audit getAudit() {
        return audit;
    }

    public void setAudit(Audit audit) {
        this.audit = audit;
    }

    public Data getData() {
        return data;
    }

    public void setData(Data data) {
        this.data = data;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Browser {
        private String engine = "selenium";
        private boolean headless = true;
        private String driverPath;
        private String userAgent;
        private int windowWidth = 1440;
        private int windowHeight = 900;
        private int pageLoadTimeoutSeconds = 30;
        private int maxScrollAttempts = 15;
        private int scrollPauseMs = 1500;

        public String getEngine() {
            return engine == null || engine.isBlank() ? "selenium" : engine.trim();
        }

        public void setEngine(String engine) {
            this.engine = engine;
        }

        public boolean isHeadless() {
            return headless;
        }

        public void setHeadless(boolean headless) {
            this.headless = headless;
        }

        public String getDriverPath() {
            return driverPath;
        }

        public void setDriverPath(String driverPath) {
            this.driverPath = driverPath;
        }

        public String getUserAgent() {
            return normalizeUserAgent(userAgent);
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = normalizeUserAgent(userAgent);
        }

        public int getWindowWidth() {
            return Math.max(320, windowWidth);
        }

        public void setWindowWidth(int windowWidth) {
            this.windowWidth = windowWidth;
        }

        public int getWindowHeight() {
            return Math.max(240, windowHeight);
        }

        public void setWindowHeight(int windowHeight) {
            this.windowHeight = windowHeight;
        }

        public int getPageLoadTimeoutSeconds() {
            return Math.max(1, pageLoadTimeoutSeconds);
        }

        public void setPageLoadTimeoutSeconds(int pageLoadTimeoutSeconds) {
            this.pageLoadTimeoutSeconds = Math.max(1, pageLoadTimeoutSeconds);
        }

        public int getMaxScrollAttempts() {
            return Math.max(0, maxScrollAttempts);
        }

        public void setMaxScrollAttempts(int maxScrollAttempts) {
            this.maxScrollAttempts = Math.max(0, maxScrollAttempts);
        }

        public int getScrollPauseMs() {
            return Math.max(0, scrollPauseMs);
        }

        public void setScrollPauseMs(int scrollPauseMs) {
            this.scrollPauseMs = Math.max(0, scrollPauseMs);
        }
    }

    public static class Source {
        private String baseUrl = "https://www.redbus.in";
        private String searchPath = "/search";
        private int journeyOffsetDays = 1;
        private int maxPagesPerRoute = 50;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getSearchPath() {
            return searchPath;
        }

        public void setSearchPath(String searchPath) {
            this.searchPath = searchPath;
        }

        public int getJourneyOffsetDays() {
            return Math.max(0, journeyOffsetDays);
        }

        public void setJourneyOffsetDays(int journeyOffsetDays) {
            this.journeyOffsetDays = Math.max(0, journeyOffsetDays);
        }

        public int getMaxPagesPerRoute() {
            return Math.max(1, maxPagesPerRoute);
        }

        public void setMaxPagesPerRoute(int maxPagesPerRoute) {
            this.maxPagesPerRoute = Math.max(1, maxPagesPerRoute);
        }
    }

    public static class Fetch {
        private int minDelayMs = 1000;
        private int maxDelayMs = 2500;
        private int waitTimeoutSeconds = 20;
        private int maxAttempts = 3;
        private int retryBaseDelayMs = 1000;
        private int retryMaxDelayMs = 15000;

        public int getMinDelayMs() {
            return Math.max(0, minDelayMs);
        }

        public void setMinDelayMs(int minDelayMs) {
            this.minDelayMs = Math.max(0, minDelayMs);
        }

        public int getMaxDelayMs() {
            return Math.max(getMinDelayMs(), maxDelayMs);
        }

        public void setMaxDelayMs(int maxDelayMs) {
            this.maxDelayMs = Math.max(0, maxDelayMs);
        }

        public int getWaitTimeoutSeconds() {
            return Math.max(1, waitTimeoutSeconds);
        }

        public void setWaitTimeoutSeconds(int waitTimeoutSeconds) {
            this.waitTimeoutSeconds = Math.max(1, waitTimeoutSeconds);
        }

        public int getMaxAttempts() {
            return Math.max(1, maxAttempts);
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = Math.max(1, maxAttempts);
        }

        public int getRetryBaseDelayMs() {
            return Math.max(0, retryBaseDelayMs);
        }

        public void setRetryBaseDelayMs(int retryBaseDelayMs) {
            this.retryBaseDelayMs = Math.max(0, retryBaseDelayMs);
        }

        public int getRetryMaxDelayMs() {
            return Math.max(0, retryMaxDelayMs);
        }

        public void setRetryMaxDelayMs(int retryMaxDelayMs) {
            this.retryMaxDelayMs = Math.max(0, retryMaxDelayMs);
        }
    }

    public static class Run {
        private int concurrency = 4;
        private int maxDurationSeconds = 0;
        private boolean restartCompletedRoutes = true;
        private double minRating = 0.0;

        public int getConcurrency() {
            return Math.max(1, concurrency);
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = Math.max(1, concurrency);
        }

        public int getMaxDurationSeconds() {
            return Math.max(0, maxDurationSeconds);
        }

        public void setMaxDurationSeconds(int maxDurationSeconds) {
            this.maxDurationSeconds = Math.max(0, maxDurationSeconds);
        }

        public boolean isRestartCompletedRoutes() {
            return restartCompletedRoutes;
        }

        public void setRestartCompletedRoutes(boolean restartCompletedRoutes) {
            this.restartCompletedRoutes = restartCompletedRoutes;
        }

        public double getMinRating() {
            return Math.max(0.0, Math.min(5.0, minRating));
        }

        public void setMinRating(double minRating) {
            this.minRating = minRating;
        }
    }

    public static class Sentiment {
        private double positiveThreshold = 0.05;
        private double negativeThreshold = -0.05;
        private String lexiconResource = "sentiment-lexicon.tsv";

        public double getPositiveThreshold() {
            return positiveThreshold;
        }

        public void setPositiveThreshold(double positiveThreshold) {
            this.positiveThreshold = positiveThreshold;
        }

        public double getNegativeThreshold() {
            return negativeThreshold;
        }

        public void setNegativeThreshold(double negativeThreshold) {
            this.negativeThreshold = negativeThreshold;
        }

        public String getLexiconResource() {
            return lexiconResource;
        }

        public void setLexiconResource(String lexiconResource) {
            this.lexiconResource = lexiconResource;
        }
    }

    public static class Audit {
        private boolean enabled = false;
        private String directory = "../data/raw-pages";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getDirectory() {
            return directory;
        }

        public void setDirectory(String directory) {
            this.directory = directory;
        }
    }

    public static class Data {
        private String routesCsv = "../data/routes.csv";

        public String getRoutesCsv() {
            return routesCsv;
        }

        public void setRoutesCsv(String routesCsv) {
            this.routesCsv = routesCsv;
        }
    }
}
