package com.busreview.tracker.scrape.browser;

import com.busreview.tracker.config.PipelineProperties;
import org.openqa.selenium.Dimension;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeDriverService;
import org.openqa.selenium.chrome.ChromeOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class SeleniumBrowserSessionFactory implements BrowserSessionFactory {
    private static final Logger log = LoggerFactory.getLogger(SeleniumBrowserSessionFactory.class);

    private final PipelineProperties.Browser settings;

    public SeleniumBrowserSessionFactory(PipelineProperties properties) {
        this.settings = properties.getBrowser();
    }

    @Override
    public BrowserSession open() {
        ChromeOptions options = new ChromeOptions();
        if (settings.isHeadless()) {
            options.addArguments("--headless=new");
        }
        options.addArguments("--no-sandbox");
        options.addArguments("--disable-dev-shm-usage");
        options.addArguments("--disable-blink-features=AutomationControlled");
        options.addArguments("--window-size=" + settings.getWindowWidth() + "," + settings.getWindowHeight());
        options.addArguments("user-agent=" + settings.getUserAgent());
        options.setExperimentalOption("excludeSwitches", List.of("enable-automation", "enable-logging"));

        Map<String, Object> prefs = new HashMap<>();
        prefs.put("credentials_enable_service", false);
        prefs.put("profile.default_content_setting_values.notifications", 2);
        options.setExperimentalOption("prefs", prefs);

        try {
            ChromeDriver driver;
            String driverPath = settings.getDriverPath();
            if (driverPath != null && !driverPath.isBlank()) {
                ChromeDriverService service = new ChromeDriverService.Builder()
                    .usingDriverExecutable(new File(driverPath.trim()))
                    .build();
                driver = new ChromeDriver(service, options);
            } else {
                driver = new ChromeDriver(options);
            }
            driver.manage().timeouts().pageLoadTimeout(Duration.ofSeconds(settings.getPageLoadTimeoutSeconds()));
            driver.manage().window().setSize(new Dimension(settings.getWindowWidth(), settings.getWindowHeight()));
            log.debug("Opened Chrome session headless={}", settings.isHeadless());
            return new SeleniumBrowserSession(driver, settings.getMaxScrollAttempts(), settings.getScrollPauseMs());
        } catch (WebDriverException e) {
            throw BrowserSessionException.transientFailure("Failed to start Chrome session: " + e.getMessage(), e);
        }
    }
}
