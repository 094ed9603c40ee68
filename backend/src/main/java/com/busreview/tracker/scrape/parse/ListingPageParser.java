package com.busreview.tracker.scrape.parse;

import com.busreview.tracker.scrape.model.ListingRecord;
import com.busreview.tracker.scrape.model.ParsedPage;
import com.busreview.tracker.scrape.model.RawPage;
import com.busreview.tracker.scrape.model.ReviewRecord;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Extracts raw listing and review records from a results page. Values are kept as page text;
 * cleaning and typing happen in the normalizer.
 */
@Component
public class ListingPageParser {
    private static final Logger log = LoggerFactory.getLogger(ListingPageParser.class);

    public ParsedPage parse(RawPage page) {
        if (page == null || page.html() == null || page.html().isBlank()) {
            throw new PageParseException(PageParseException.Kind.MALFORMED_PAGE, "Empty page body");
        }
        Document document = Jsoup.parse(page.html(), page.url() == null ? "" : page.url());
        Element container = document.selectFirst(ListingSelectors.RESULTS_CONTAINER);
        if (container == null) {
            throw new PageParseException(
                PageParseException.Kind.MALFORMED_PAGE,
                "Results container missing for " + page.routeKey() + " page " + page.pageIndex()
            );
        }

        List<ListingRecord> listings = new ArrayList<>();
        List<ReviewRecord> reviews = new ArrayList<>();
        int malformed = 0;
        int position = 0;
        for (Element card : container.select(ListingSelectors.BUS_CARD)) {
            position++;
            try {
                ListingRecord listing = parseCard(card, page.pageIndex(), position);
                listings.add(listing);
                for (Element reviewCard : card.select(ListingSelectors.REVIEW_CARD)) {
                    try {
                        reviews.add(parseReview(reviewCard, listing.listingRef()));
                    } catch (PageParseException e) {
                        malformed++;
                        log.debug("Skipping review on {} page {}: {}", page.routeKey(), page.pageIndex(), e.getMessage());
                    }
                }
            } catch (PageParseException e) {
                malformed++;
                log.debug("Skipping card on {} page {}: {}", page.routeKey(), page.pageIndex(), e.getMessage());
            }
        }
        if (malformed > 0) {
            log.info("Skipped {} malformed records on {} page {}", malformed, page.routeKey(), page.pageIndex());
        }
        return new ParsedPage(page.routeKey(), page.pageIndex(), List.copyOf(listings), List.copyOf(reviews), malformed);
    }

    private ListingRecord parseCard(Element card, int pageIndex, int position) {
        Element cardOnly = card.clone();
        cardOnly.select(ListingSelectors.REVIEW_CARD).remove();

        String operator = firstText(cardOnly, ListingSelectors.OPERATOR);
        String busName = firstText(cardOnly, ListingSelectors.BUS_NAME);
        if (operator == null && busName == null) {
            throw new PageParseException(PageParseException.Kind.MALFORMED_RECORD, "Card without operator or bus name");
        }
        String listingRef = card.attr("data-busid");
        if (listingRef == null || listingRef.isBlank()) {
            listingRef = "p" + pageIndex + "-" + position;
        }
        String rating = firstText(cardOnly, ListingSelectors.CARD_RATING);
        if (rating == null) {
            rating = firstText(cardOnly, ".rating");
        }
        return new ListingRecord(
            listingRef.trim(),
            operator,
            busName,
            firstText(cardOnly, ListingSelectors.BUS_TYPE),
            firstText(cardOnly, ListingSelectors.ROUTE),
            firstText(cardOnly, ListingSelectors.DEPARTURE),
            rating,
            firstText(cardOnly, ListingSelectors.CARD_VOTES)
        );
    }

    private ReviewRecord parseReview(Element reviewCard, String listingRef) {
        String rating = firstText(reviewCard, ListingSelectors.REVIEW_RATING);
        String body = firstText(reviewCard, ListingSelectors.REVIEW_BODY);
        if (rating == null && body == null) {
            throw new PageParseException(PageParseException.Kind.MALFORMED_RECORD, "Review without body or rating");
        }
        return new ReviewRecord(
            listingRef,
            rating,
            firstText(reviewCard, ListingSelectors.REVIEW_TITLE),
            body,
            firstText(reviewCard, ListingSelectors.REVIEW_DATE)
        );
    }

    private String firstText(Element root, String selector) {
        Element element = root.selectFirst(selector);
        if (element == null) {
            return null;
        }
        String text = element.text();
        return text == null || text.isBlank() ? null : text;
    }
}
