package com.busreview.tracker.scrape.fetch;

import com.busreview.tracker.scrape.model.TerminalReason;
import com.busreview.tracker.scrape.parse.ListingSelectors;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

public final class PageSignals {
    private static final List<String> CHALLENGE_TITLES = List.of(
        "access denied",
        "attention required",
        "just a moment",
        "are you a robot",
        "captcha"
    );

    private PageSignals() {
    }

    public static Optional<TerminalReason> detect(String html) {
        if (html == null || html.isBlank()) {
            return Optional.empty();
        }
        Document document = Jsoup.parse(html);
        if (document.selectFirst(ListingSelectors.CHALLENGE) != null || hasChallengeTitle(document)) {
            return Optional.of(TerminalReason.CHALLENGE);
        }
        if (document.selectFirst(ListingSelectors.END_OF_RESULTS) != null) {
            return Optional.of(TerminalReason.END_OF_RESULTS);
        }
        Element container = document.selectFirst(ListingSelectors.RESULTS_CONTAINER);
        if (container != null && container.select(ListingSelectors.BUS_CARD).isEmpty()) {
            return Optional.of(TerminalReason.END_OF_RESULTS);
        }
        return Optional.empty();
    }

    private static boolean hasChallengeTitle(Document document) {
        String title = document.title().toLowerCase(Locale.ROOT);
        if (title.isBlank()) {
            return false;
        }
        for (String marker : CHALLENGE_TITLES) {
            if (title.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
