package com.busreview.tracker.scrape.service;

import com.busreview.tracker.config.PipelineProperties;
import com.busreview.tracker.scrape.model.Checkpoint;
import com.busreview.tracker.scrape.persistence.CheckpointJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

@Service
public class CheckpointService {
    private static final Logger log = LoggerFactory.getLogger(CheckpointService.class);

    private final CheckpointJdbcRepository repository;
    private final PipelineProperties properties;
    private final Clock clock;

    public CheckpointService(CheckpointJdbcRepository repository, PipelineProperties properties, Clock clock) {
        this.repository = repository;
        this.properties = properties;
        this.clock = clock;
    }

    public Optional<Checkpoint> load(String routeKey) {
        return repository.find(routeKey);
    }

    public List<Checkpoint> listAll() {
        return repository.findAll();
    }

    /**
     * First page to fetch for the route, or empty when the route is already complete and
     * completed routes are not restarted.
     */
    public OptionalInt startCursor(String routeKey) {
        Optional<Checkpoint> checkpoint = repository.find(routeKey);
        if (checkpoint.isEmpty()) {
            return OptionalInt.of(0);
        }
        if (!checkpoint.get().isCompleted()) {
            LocalDate journeyDate = checkpoint.get().journeyDate();
            if (journeyDate != null && journeyDate.isBefore(LocalDate.now(clock))) {
                log.info("Journey date {} of route {} has passed; restarting from page 0", journeyDate, routeKey);
                reset(routeKey);
                return OptionalInt.of(0);
            }
            return OptionalInt.of(checkpoint.get().nextPageIndex());
        }
        if (!properties.getRun().isRestartCompletedRoutes()) {
            return OptionalInt.empty();
        }
        log.info("Restarting completed route {} from page 0", routeKey);
        reset(routeKey);
        return OptionalInt.of(0);
    }

    /**
     * Travel date the route's search pages are built for. A route that is being resumed keeps the
     * date stored with its checkpoint, so page N+1 belongs to the same search as pages 0..N.
     */
    public LocalDate journeyDate(String routeKey) {
        return repository.find(routeKey)
            .filter(checkpoint -> !checkpoint.isCompleted())
            .map(Checkpoint::journeyDate)
            .orElseGet(() -> LocalDate.now(clock).plusDays(properties.getSource().getJourneyOffsetDays()));
    }

    public void advance(String routeKey, int newPageIndex, String reviewCursor, LocalDate journeyDate) {
        Instant now = Instant.now(clock);
        if (newPageIndex == 0) {
            try {
                repository.insertFirstPage(routeKey, reviewCursor, journeyDate, now);
                return;
            } catch (DataIntegrityViolationException e) {
                throw new CheckpointConflictException("Checkpoint for " + routeKey + " already exists; cannot restart at page 0");
            }
        }
        int updated = repository.advanceFrom(routeKey, newPageIndex, reviewCursor, now);
        if (updated != 1) {
            String stored = repository.find(routeKey)
                .map(cp -> cp.isCompleted() ? "completed" : "page " + cp.lastPageIndex())
                .orElse("none");
            throw new CheckpointConflictException(
                "Cannot advance " + routeKey + " to page " + newPageIndex + " (stored: " + stored + ")"
            );
        }
    }

    public void markCompleted(String routeKey) {
        Instant now = Instant.now(clock);
        if (repository.markCompleted(routeKey, now) == 0) {
            repository.insertCompleted(routeKey, now);
        }
    }

    public void reset(String routeKey) {
        repository.delete(routeKey);
    }
}
