package com.busreview.tracker.config;

import com.busreview.tracker.scrape.browser.BrowserSessionFactory;
import com.busreview.tracker.scrape.browser.JsoupBrowserSessionFactory;
import com.busreview.tracker.scrape.browser.SeleniumBrowserSessionFactory;
import com.busreview.tracker.scrape.fetch.Sleeper;
import com.busreview.tracker.scrape.sentiment.LexiconSentimentScorer;
import com.busreview.tracker.scrape.sentiment.SentimentScorer;
import com.busreview.tracker.scrape.sentiment.SentimentThresholds;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.Locale;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class PipelineConfig {

    @Bean(name = "scrapeRunExecutor", destroyMethod = "shutdown")
    public ExecutorService scrapeRunExecutor() {
        return Executors.newSingleThreadExecutor();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.threadSleeper();
    }

    @Bean
    public BrowserSessionFactory browserSessionFactory(PipelineProperties properties) {
        String engine = properties.getBrowser().getEngine().toLowerCase(Locale.ROOT);
        if ("jsoup".equals(engine)) {
            return new JsoupBrowserSessionFactory(properties);
        }
        return new SeleniumBrowserSessionFactory(properties);
    }

    @Bean
    public SentimentThresholds sentimentThresholds(PipelineProperties properties) {
        return new SentimentThresholds(
            properties.getSentiment().getPositiveThreshold(),
            properties.getSentiment().getNegativeThreshold()
        );
    }

    @Bean
    public SentimentScorer sentimentScorer(SentimentThresholds thresholds, PipelineProperties properties) {
        return LexiconSentimentScorer.fromClasspath(properties.getSentiment().getLexiconResource(), thresholds);
    }

    @Bean
    public TransactionTemplate transactionTemplate(PlatformTransactionManager transactionManager) {
        return new TransactionTemplate(transactionManager);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
