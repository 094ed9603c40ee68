package com.busreview.tracker.scrape.parse;

public final class ListingSelectors {
    public static final String RESULTS_CONTAINER = ".bus-items, #result-section";
    public static final String BUS_CARD = ".bus-item";
    public static final String OPERATOR = ".travels .name, .travels";
    public static final String BUS_NAME = ".bus-name";
    public static final String BUS_TYPE = ".bus-type, .busType";
    public static final String ROUTE = ".route-info, .route";
    public static final String DEPARTURE = ".dp-time, .departure-time";
    public static final String CARD_RATING = ".rating-sec .rating";
    public static final String CARD_VOTES = ".rating-sec .votes";
    public static final String REVIEW_CARD = ".review-card";
    public static final String REVIEW_RATING = ".rating, .score";
    public static final String REVIEW_TITLE = ".title";
    public static final String REVIEW_BODY = ".comment, .desc";
    public static final String REVIEW_DATE = ".review-date, .date";
    public static final String END_OF_RESULTS = ".no-results, .end-of-results, .oops-wrapper";
    public static final String CHALLENGE = "#challenge-form, .cf-challenge, #px-captcha, .g-recaptcha, "
        + "iframe[src*=captcha], form[action*=captcha]";
    public static final String PAGE_READY = RESULTS_CONTAINER + ", " + END_OF_RESULTS + ", " + CHALLENGE;

    private ListingSelectors() {
    }
}
