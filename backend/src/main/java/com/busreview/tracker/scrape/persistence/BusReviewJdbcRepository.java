package com.busreview.tracker.scrape.persistence;

import com.busreview.tracker.scrape.model.BusListingView;
import com.busreview.tracker.scrape.model.NormalizedListing;
import com.busreview.tracker.scrape.model.NormalizedReview;
import com.busreview.tracker.scrape.model.QualityIssue;
import com.busreview.tracker.scrape.model.ReviewView;
import com.busreview.tracker.scrape.sentiment.SentimentScore;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Date;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

@Repository
public class BusReviewJdbcRepository {
    private static final RowMapper<BusListingView> BUS_MAPPER = (rs, rowNum) -> new BusListingView(
        rs.getString("bus_id"),
        rs.getString("operator_name"),
        rs.getString("bus_name"),
        rs.getString("bus_type"),
        rs.getString("origin"),
        rs.getString("destination"),
        rs.getString("departure_time"),
        rs.getObject("avg_rating", Double.class),
        rs.getInt("rating_count"),
        rs.getObject("sentiment_positive", Double.class),
        rs.getObject("sentiment_negative", Double.class),
        rs.getString("quality_issues"),
        toInstant(rs.getTimestamp("last_scraped_at"))
    );

    private static final RowMapper<ReviewView> REVIEW_MAPPER = (rs, rowNum) -> {
        Date reviewDate = rs.getDate("review_date");
        return new ReviewView(
            rs.getString("review_id"),
            rs.getString("bus_id"),
            rs.getObject("rating", Double.class),
            rs.getString("review_title"),
            rs.getString("review_text"),
            reviewDate == null ? null : reviewDate.toLocalDate(),
            rs.getString("sentiment_label"),
            rs.getObject("sentiment_score", Double.class),
            rs.getString("quality_issues"),
            toInstant(rs.getTimestamp("ingested_at"))
        );
    };

    private final NamedParameterJdbcTemplate jdbc;

    public BusReviewJdbcRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public boolean busExists(String busId) {
        Integer count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM buses WHERE bus_id = :busId",
            new MapSqlParameterSource("busId", busId),
            Integer.class
        );
        return count != null && count > 0;
    }

    /**
     * @return true when a new row was inserted, false when an existing bus was updated
     */
    public boolean upsertBus(NormalizedListing listing, Instant scrapedAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("busId", listing.busId())
            .addValue("operatorName", listing.operatorName())
            .addValue("busName", listing.busName())
            .addValue("busType", listing.busType().name())
            .addValue("origin", listing.origin())
            .addValue("destination", listing.destination())
            .addValue("departureTime", listing.departureTime())
            .addValue("qualityIssues", formatIssues(listing.qualityIssues()))
            .addValue("scrapedAt", toTimestamp(scrapedAt));

        int updated = updateBus(params);
        if (updated > 0) {
            return false;
        }
        jdbc.update(
            """
                INSERT INTO buses (
                    bus_id, operator_name, bus_name, bus_type, origin, destination, departure_time,
                    rating_count, quality_issues, first_seen_at, last_scraped_at
                )
                VALUES (
                    :busId, :operatorName, :busName, :busType, :origin, :destination, :departureTime,
                    0, :qualityIssues, :scrapedAt, :scrapedAt
                )
                """,
            params
        );
        return true;
    }

    private int updateBus(MapSqlParameterSource params) {
        return jdbc.update(
            """
                UPDATE buses
                SET operator_name = COALESCE(:operatorName, operator_name),
                    bus_name = COALESCE(:busName, bus_name),
                    bus_type = :busType,
                    origin = COALESCE(:origin, origin),
                    destination = COALESCE(:destination, destination),
                    departure_time = COALESCE(:departureTime, departure_time),
                    quality_issues = :qualityIssues,
                    last_scraped_at = :scrapedAt
                WHERE bus_id = :busId
                """,
            params
        );
    }

    public boolean reviewExists(String reviewId) {
        Integer count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM reviews WHERE review_id = :reviewId",
            new MapSqlParameterSource("reviewId", reviewId),
            Integer.class
        );
        return count != null && count > 0;
    }

    public void insertReview(NormalizedReview review, Instant ingestedAt) {
        SentimentScore sentiment = review.sentiment() == null ? SentimentScore.NEUTRAL : review.sentiment();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("reviewId", review.reviewId())
            .addValue("busId", review.busId())
            .addValue("textHash", review.textHash())
            .addValue("rating", review.rating())
            .addValue("title", review.title())
            .addValue("text", review.text())
            .addValue("reviewDate", review.reviewDate() == null ? null : Date.valueOf(review.reviewDate()))
            .addValue("reviewLength", review.reviewLength())
            .addValue("wordCount", review.wordCount())
            .addValue("sentimentLabel", sentiment.label().dbValue())
            .addValue("sentimentScore", sentiment.value())
            .addValue("qualityIssues", formatIssues(review.qualityIssues()))
            .addValue("ingestedAt", toTimestamp(ingestedAt));
        jdbc.update(
            """
                INSERT INTO reviews (
                    review_id, bus_id, review_text_hash, rating, review_title, review_text, review_date,
                    review_length, review_word_count, sentiment_label, sentiment_score, quality_issues, ingested_at
                )
                VALUES (
                    :reviewId, :busId, :textHash, :rating, :title, :text, :reviewDate,
                    :reviewLength, :wordCount, :sentimentLabel, :sentimentScore, :qualityIssues, :ingestedAt
                )
                """,
            params
        );
    }

    /**
     * Recomputes the bus aggregates from its stored reviews. Unrated reviews do not count toward the
     * rating; sentiment shares are over all reviews and stay null while the bus has none.
     */
    public void recomputeAggregates(String busId) {
        jdbc.update(
            """
                UPDATE buses
                SET avg_rating = (
                        SELECT AVG(r.rating) FROM reviews r WHERE r.bus_id = :busId AND r.rating IS NOT NULL
                    ),
                    rating_count = (
                        SELECT COUNT(r.rating) FROM reviews r WHERE r.bus_id = :busId AND r.rating IS NOT NULL
                    ),
                    sentiment_positive = (
                        SELECT AVG(CASE WHEN r.sentiment_label = 'positive' THEN 1.0 ELSE 0.0 END)
                        FROM reviews r WHERE r.bus_id = :busId
                    ),
                    sentiment_negative = (
                        SELECT AVG(CASE WHEN r.sentiment_label = 'negative' THEN 1.0 ELSE 0.0 END)
                        FROM reviews r WHERE r.bus_id = :busId
                    )
                WHERE bus_id = :busId
                """,
            new MapSqlParameterSource("busId", busId)
        );
    }

    public BusListingView findBus(String busId) {
        List<BusListingView> rows = jdbc.query(
            """
                SELECT bus_id, operator_name, bus_name, bus_type, origin, destination, departure_time,
                       avg_rating, rating_count, sentiment_positive, sentiment_negative, quality_issues, last_scraped_at
                FROM buses
                WHERE bus_id = :busId
                """,
            new MapSqlParameterSource("busId", busId),
            BUS_MAPPER
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public List<BusListingView> findBusesByOperator(String operatorName) {
        return jdbc.query(
            """
                SELECT bus_id, operator_name, bus_name, bus_type, origin, destination, departure_time,
                       avg_rating, rating_count, sentiment_positive, sentiment_negative, quality_issues, last_scraped_at
                FROM buses
                WHERE LOWER(operator_name) = LOWER(:operatorName)
                ORDER BY origin, destination, departure_time
                """,
            new MapSqlParameterSource("operatorName", operatorName),
            BUS_MAPPER
        );
    }

    public List<ReviewView> findReviewsForBus(String busId) {
        return jdbc.query(
            """
                SELECT review_id, bus_id, rating, review_title, review_text, review_date,
                       sentiment_label, sentiment_score, quality_issues, ingested_at
                FROM reviews
                WHERE bus_id = :busId
                ORDER BY review_date DESC, review_id
                """,
            new MapSqlParameterSource("busId", busId),
            REVIEW_MAPPER
        );
    }

    static String formatIssues(Collection<QualityIssue> issues) {
        if (issues == null || issues.isEmpty()) {
            return null;
        }
        return issues.stream()
            .map(Enum::name)
            .sorted()
            .collect(Collectors.joining(","));
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
