package com.busreview.tracker.scrape.browser;

import org.openqa.selenium.By;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.StaleElementReferenceException;
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.support.ui.ExpectedConditions;
import org.openqa.selenium.support.ui.WebDriverWait;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

public class SeleniumBrowserSession implements BrowserSession {
    private static final Logger log = LoggerFactory.getLogger(SeleniumBrowserSession.class);

    private final WebDriver driver;
    private final int maxScrollAttempts;
    private final long scrollPauseMs;

    public SeleniumBrowserSession(WebDriver driver, int maxScrollAttempts, long scrollPauseMs) {
        this.driver = driver;
        this.maxScrollAttempts = maxScrollAttempts;
        this.scrollPauseMs = scrollPauseMs;
    }

    @Override
    public void navigate(String url) {
        try {
            driver.get(url);
        } catch (TimeoutException e) {
            throw BrowserSessionException.transientFailure("Page load timed out for " + url, e);
        } catch (WebDriverException e) {
            throw BrowserSessionException.transientFailure("Navigation failed for " + url + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void waitFor(String selector, Duration timeout) {
        try {
            new WebDriverWait(driver, timeout)
                .until(ExpectedConditions.presenceOfElementLocated(By.cssSelector(selector)));
        } catch (TimeoutException e) {
            throw BrowserSessionException.transientFailure("Timed out after " + timeout + " waiting for " + selector, e);
        } catch (StaleElementReferenceException e) {
            throw BrowserSessionException.transientFailure("Stale element while waiting for " + selector, e);
        } catch (WebDriverException e) {
            throw BrowserSessionException.transientFailure("Wait failed for " + selector + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String extractHtml() {
        try {
            scrollToBottom();
            return driver.getPageSource();
        } catch (WebDriverException e) {
            throw BrowserSessionException.transientFailure("Failed to read rendered page: " + e.getMessage(), e);
        }
    }

    // Results load lazily; keep scrolling until the document height stops growing.
    private void scrollToBottom() {
        if (maxScrollAttempts <= 0 || !(driver instanceof JavascriptExecutor js)) {
            return;
        }
        Object lastHeight = js.executeScript("return document.body.scrollHeight");
        int stableAttempts = 0;
        while (stableAttempts < maxScrollAttempts) {
            js.executeScript("window.scrollTo(0, document.body.scrollHeight);");
            if (!pause()) {
                return;
            }
            Object newHeight = js.executeScript("return document.body.scrollHeight");
            if (newHeight != null && newHeight.equals(lastHeight)) {
                stableAttempts++;
            } else {
                stableAttempts = 0;
                lastHeight = newHeight;
            }
        }
    }

    private boolean pause() {
        if (scrollPauseMs <= 0) {
            return true;
        }
        try {
            Thread.sleep(scrollPauseMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public void close() {
        try {
            driver.quit();
        } catch (WebDriverException e) {
            log.warn("Failed to quit browser session cleanly", e);
        }
    }
}
