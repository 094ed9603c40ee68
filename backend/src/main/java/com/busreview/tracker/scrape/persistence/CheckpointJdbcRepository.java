package com.busreview.tracker.scrape.persistence;

import com.busreview.tracker.scrape.model.Checkpoint;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Date;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public class CheckpointJdbcRepository {
    private static final RowMapper<Checkpoint> MAPPER = (rs, rowNum) -> {
        Date journeyDate = rs.getDate("journey_date");
        return new Checkpoint(
            rs.getString("route_key"),
            rs.getInt("last_page_index"),
            rs.getString("last_review_cursor"),
            journeyDate == null ? null : journeyDate.toLocalDate(),
            toInstant(rs.getTimestamp("updated_at")),
            toInstant(rs.getTimestamp("completed_at"))
        );
    };

    private final NamedParameterJdbcTemplate jdbc;

    public CheckpointJdbcRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Optional<Checkpoint> find(String routeKey) {
        List<Checkpoint> rows = jdbc.query(
            """
                SELECT route_key, last_page_index, last_review_cursor, journey_date, updated_at, completed_at
                FROM checkpoints
                WHERE route_key = :routeKey
                """,
            new MapSqlParameterSource("routeKey", routeKey),
            MAPPER
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public List<Checkpoint> findAll() {
        return jdbc.query(
            """
                SELECT route_key, last_page_index, last_review_cursor, journey_date, updated_at, completed_at
                FROM checkpoints
                ORDER BY route_key
                """,
            MAPPER
        );
    }

    public void insertFirstPage(String routeKey, String reviewCursor, LocalDate journeyDate, Instant updatedAt) {
        jdbc.update(
            """
                INSERT INTO checkpoints (route_key, last_page_index, last_review_cursor, journey_date, updated_at, completed_at)
                VALUES (:routeKey, 0, :cursor, :journeyDate, :updatedAt, NULL)
                """,
            new MapSqlParameterSource()
                .addValue("routeKey", routeKey)
                .addValue("cursor", reviewCursor)
                .addValue("journeyDate", journeyDate == null ? null : Date.valueOf(journeyDate))
                .addValue("updatedAt", Timestamp.from(updatedAt))
        );
    }

    /**
     * Moves the checkpoint from {@code newPageIndex - 1} to {@code newPageIndex}.
     *
     * @return rows changed; 0 when the stored page was not the predecessor or the route is completed
     */
    public int advanceFrom(String routeKey, int newPageIndex, String reviewCursor, Instant updatedAt) {
        return jdbc.update(
            """
                UPDATE checkpoints
                SET last_page_index = :newPageIndex,
                    last_review_cursor = :cursor,
                    updated_at = :updatedAt
                WHERE route_key = :routeKey
                  AND last_page_index = :previousPageIndex
                  AND completed_at IS NULL
                """,
            new MapSqlParameterSource()
                .addValue("routeKey", routeKey)
                .addValue("newPageIndex", newPageIndex)
                .addValue("previousPageIndex", newPageIndex - 1)
                .addValue("cursor", reviewCursor)
                .addValue("updatedAt", Timestamp.from(updatedAt))
        );
    }

    public int markCompleted(String routeKey, Instant completedAt) {
        return jdbc.update(
            """
                UPDATE checkpoints
                SET completed_at = :completedAt,
                    updated_at = :completedAt
                WHERE route_key = :routeKey
                """,
            new MapSqlParameterSource()
                .addValue("routeKey", routeKey)
                .addValue("completedAt", Timestamp.from(completedAt))
        );
    }

    public void insertCompleted(String routeKey, Instant completedAt) {
        jdbc.update(
            """
                INSERT INTO checkpoints (route_key, last_page_index, last_review_cursor, updated_at, completed_at)
                VALUES (:routeKey, -1, NULL, :completedAt, :completedAt)
                """,
            new MapSqlParameterSource()
                .addValue("routeKey", routeKey)
                .addValue("completedAt", Timestamp.from(completedAt))
        );
    }

    public int delete(String routeKey) {
        return jdbc.update(
            "DELETE FROM checkpoints WHERE route_key = :routeKey",
            new MapSqlParameterSource("routeKey", routeKey)
        );
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
