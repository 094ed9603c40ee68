package com.busreview.tracker.scrape.normalize;

import com.busreview.tracker.scrape.model.BusType;
import com.busreview.tracker.scrape.model.ListingRecord;
import com.busreview.tracker.scrape.model.Normalized;
import com.busreview.tracker.scrape.model.NormalizedListing;
import com.busreview.tracker.scrape.model.NormalizedReview;
import com.busreview.tracker.scrape.model.QualityIssue;
import com.busreview.tracker.scrape.model.ReviewRecord;
import com.busreview.tracker.scrape.model.RouteTask;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

@Component
public class RecordNormalizer {
    public static final String DROP_MISSING_IDENTITY = "missing_operator_and_bus_name";
    public static final String DROP_BLANK_BODY = "blank_review_body";

    public Normalized<NormalizedListing> normalizeListing(ListingRecord record, RouteTask task) {
        if (record == null) {
            return Normalized.drop(DROP_MISSING_IDENTITY);
        }
        String operator = TextCleaner.clean(record.operatorName());
        String busName = TextCleaner.clean(record.busName());
        if (operator == null && busName == null) {
            return Normalized.drop(DROP_MISSING_IDENTITY);
        }

        Set<QualityIssue> issues = EnumSet.noneOf(QualityIssue.class);
        String origin;
        String destination;
        if (TextCleaner.clean(record.routeText()) == null) {
            origin = task == null ? null : TextCleaner.clean(task.origin());
            destination = task == null ? null : TextCleaner.clean(task.destination());
        } else {
            RouteSplitter.Route route = RouteSplitter.split(record.routeText());
            origin = route.origin();
            destination = route.destination();
        }

        Optional<BusType> busType = BusTypeClassifier.classify(record.busTypeText(), busName);
        if (busType.isEmpty()) {
            issues.add(QualityIssue.UNMAPPED_BUS_TYPE);
        }

        RatingParser.Result sourceRating = RatingParser.parse(record.sourceRatingText());
        if (sourceRating.invalid()) {
            issues.add(QualityIssue.RATING_INVALID);
        }

        String departure = DepartureTimeParser.parse(record.departureText());
        String busId = BusIdentity.busId(operator, origin, destination, departure, busName);
        return Normalized.of(new NormalizedListing(
            busId,
            TextCleaner.clean(record.listingRef()),
            operator,
            busName,
            busType.orElse(BusType.OTHER),
            origin,
            destination,
            departure,
            sourceRating.value(),
            RatingParser.parseCount(record.sourceRatingCountText()),
            Set.copyOf(issues)
        ));
    }

    /**
     * Produces a review without sentiment; the caller scores it before loading.
     */
    public Normalized<NormalizedReview> normalizeReview(ReviewRecord record, String busId) {
        if (record == null) {
            return Normalized.drop(DROP_BLANK_BODY);
        }
        String text = TextCleaner.clean(record.body());
        if (text == null) {
            return Normalized.drop(DROP_BLANK_BODY);
        }

        Set<QualityIssue> issues = EnumSet.noneOf(QualityIssue.class);
        RatingParser.Result rating = RatingParser.parse(record.ratingText());
        if (rating.invalid()) {
            issues.add(QualityIssue.RATING_INVALID);
        }
        ReviewDateParser.Result date = ReviewDateParser.parse(record.dateText());
        if (date.invalid()) {
            issues.add(QualityIssue.DATE_INVALID);
        }

        LocalDate reviewDate = date.value();
        String textHash = BusIdentity.textHash(text);
        String reviewId = busId == null ? null : BusIdentity.reviewId(busId, textHash, reviewDate);
        return Normalized.of(new NormalizedReview(
            busId,
            reviewId,
            textHash,
            rating.value(),
            TextCleaner.clean(record.title()),
            text,
            reviewDate,
            text.length(),
            TextCleaner.wordCount(text),
            null,
            Set.copyOf(issues)
        ));
    }
}
